package tech.yump.credvault.store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Result of a successful store: where the credential now lives.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StoredCredentialSummary(
        String tenantId,
        String providerId,
        String scope,
        String storageKey,
        Instant createdAt,
        Instant updatedAt
) {
}
