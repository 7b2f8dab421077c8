package tech.yump.credvault.usage;

import java.time.Instant;
import java.util.List;

public record MostUsedCredentials(
        String tenantId,
        int periodDays,
        List<Entry> mostUsed
) {

    public record Entry(String providerId, String scope, long usageCount, Instant lastUsed) {
    }
}
