package tech.yump.credvault.tool;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope returned by every tool operation: either data or an error, never an exception.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult<T>(boolean success, T data, ToolError error) {

    public static <T> ToolResult<T> ok(T data) {
        return new ToolResult<>(true, data, null);
    }

    public static <T> ToolResult<T> failure(ToolError error) {
        return new ToolResult<>(false, null, error);
    }
}
