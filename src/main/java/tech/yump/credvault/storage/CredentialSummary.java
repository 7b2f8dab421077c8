package tech.yump.credvault.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Listing view of a stored credential, without any encrypted material.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CredentialSummary(
        String providerId,
        String scope,
        String storageKey,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt
) {
    public CredentialSummary {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
