package tech.yump.credvault.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Usage counts for one (provider, scope, operation) group. {@code operation} is null when the
 * grouping ignores it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UsageAggregate(
        String providerId,
        String scope,
        String operation,
        long usageCount,
        long successCount,
        long failureCount,
        Instant lastUsed
) {
}
