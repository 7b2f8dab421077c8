package tech.yump.credvault.usage;

import tech.yump.credvault.storage.UsageAggregate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CredentialUsageReport(
        String tenantId,
        int periodDays,
        long totalUsage,
        Map<String, ProviderUsage> byProvider,
        List<UsageAggregate> details
) {

    /**
     * @param operations usage count per operation, e.g. {@code get -> 12}.
     */
    public record ProviderUsage(
            long totalUsage,
            long successCount,
            long failureCount,
            Instant lastUsed,
            Map<String, Long> operations
    ) {
    }
}
