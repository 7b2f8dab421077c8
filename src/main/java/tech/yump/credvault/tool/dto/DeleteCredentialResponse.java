package tech.yump.credvault.tool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeleteCredentialResponse(
        boolean deleted,
        boolean confirmed,
        String providerId,
        String scope,
        String warning
) {
}
