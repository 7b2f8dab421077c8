package tech.yump.credvault.storage;

import lombok.Builder;

import java.time.Instant;

/**
 * One use of a credential: a store or a read, successful or not. Never carries the value.
 */
@Builder
public record CredentialUsageEvent(
        String tenantId,
        String providerId,
        String scope,       // Stored scope string, null for the unscoped credential
        String operation,
        boolean success,
        Instant occurredAt
) {
}
