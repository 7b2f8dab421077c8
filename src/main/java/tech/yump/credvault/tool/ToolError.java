package tech.yump.credvault.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.yump.credvault.core.VaultErrorKind;

import java.util.Map;

/**
 * Error half of a {@link ToolResult}. {@code incident} marks failures an operator should look at,
 * {@code retryable} those a caller may simply try again.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolError(
        VaultErrorKind kind,
        String message,
        boolean incident,
        boolean retryable,
        Map<String, Object> details
) {

    public static ToolError of(VaultErrorKind kind, String message, Map<String, Object> details) {
        return new ToolError(kind, message, kind.isIncident(), kind.isRetryable(),
                details == null || details.isEmpty() ? null : details);
    }
}
