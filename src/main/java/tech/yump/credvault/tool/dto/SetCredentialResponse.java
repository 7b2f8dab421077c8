package tech.yump.credvault.tool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetCredentialResponse(
        boolean success,
        String providerId,
        String scope,
        String storageKey,
        Instant createdAt,
        Instant updatedAt
) {
}
