package tech.yump.credvault.usage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.credvault.config.VaultProperties;
import tech.yump.credvault.core.CredentialValidationException;
import tech.yump.credvault.storage.CredentialUsageEvent;
import tech.yump.credvault.storage.CredentialUsageRepository;
import tech.yump.credvault.storage.UsageAggregate;
import tech.yump.credvault.store.TenantIdSanitizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Records credential usage and summarizes it per tenant.
 * <p>
 * Recording never fails the operation being recorded: a usage write that cannot reach the
 * database is logged and dropped. Reading the summaries propagates storage errors.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialUsageTracker {

    public static final String OPERATION_STORE = "store";
    public static final String OPERATION_GET = "get";

    static final int MAX_PERIOD_DAYS = 365;
    static final int MAX_LIMIT = 100;

    private final CredentialUsageRepository usageRepository;
    private final VaultProperties vaultProperties;
    private final Clock clock;

    /**
     * @param tenantId already sanitized tenant id.
     * @param scope    stored scope string, null for the unscoped credential.
     */
    public void recordUsage(String tenantId, String providerId, String scope, String operation, boolean success) {
        if (!vaultProperties.usage().enabled()) {
            return;
        }
        CredentialUsageEvent event = CredentialUsageEvent.builder()
                .tenantId(tenantId)
                .providerId(providerId)
                .scope(scope)
                .operation(operation)
                .success(success)
                .occurredAt(clock.instant())
                .build();
        try {
            usageRepository.record(event);
        } catch (RuntimeException e) {
            log.warn("Could not record {} usage of {} credential for tenant '{}': {}",
                    operation, providerId, tenantId, e.getMessage());
        }
    }

    /**
     * @param days look-back window, null for the configured period.
     */
    public CredentialUsageReport usageStats(String tenantId, Integer days) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        int periodDays = periodDays(days);
        List<UsageAggregate> details = usageRepository.aggregate(tenant, since(periodDays));

        Map<String, ProviderTotals> totals = new TreeMap<>();
        long totalUsage = 0;
        for (UsageAggregate row : details) {
            totals.computeIfAbsent(row.providerId(), id -> new ProviderTotals()).add(row);
            totalUsage += row.usageCount();
        }

        Map<String, CredentialUsageReport.ProviderUsage> byProvider = new LinkedHashMap<>();
        totals.forEach((providerId, t) -> byProvider.put(providerId, t.toUsage()));
        return new CredentialUsageReport(tenant, periodDays, totalUsage, byProvider, details);
    }

    /**
     * Successful uses only, over the configured period.
     *
     * @param limit maximum entries, null for the configured default.
     */
    public MostUsedCredentials mostUsed(String tenantId, Integer limit) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        int effectiveLimit = limit == null ? vaultProperties.usage().mostUsedLimit() : limit;
        if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
            throw new CredentialValidationException("Limit must be between 1 and " + MAX_LIMIT);
        }
        int periodDays = periodDays(null);
        List<MostUsedCredentials.Entry> entries = usageRepository.mostUsed(tenant, since(periodDays), effectiveLimit).stream()
                .map(row -> new MostUsedCredentials.Entry(row.providerId(), row.scope(), row.usageCount(), row.lastUsed()))
                .toList();
        return new MostUsedCredentials(tenant, periodDays, entries);
    }

    private int periodDays(Integer days) {
        int value = days == null ? (int) vaultProperties.usage().period().toDays() : days;
        if (value < 1 || value > MAX_PERIOD_DAYS) {
            throw new CredentialValidationException("Period must be between 1 and " + MAX_PERIOD_DAYS + " days");
        }
        return value;
    }

    private Instant since(int periodDays) {
        return clock.instant().minus(Duration.ofDays(periodDays));
    }

    private static final class ProviderTotals {
        private long usage;
        private long success;
        private long failure;
        private Instant lastUsed;
        private final Map<String, Long> operations = new TreeMap<>();

        void add(UsageAggregate row) {
            usage += row.usageCount();
            success += row.successCount();
            failure += row.failureCount();
            if (row.lastUsed() != null && (lastUsed == null || row.lastUsed().isAfter(lastUsed))) {
                lastUsed = row.lastUsed();
            }
            operations.merge(row.operation(), row.usageCount(), Long::sum);
        }

        CredentialUsageReport.ProviderUsage toUsage() {
            return new CredentialUsageReport.ProviderUsage(usage, success, failure, lastUsed, Collections.unmodifiableMap(operations));
        }
    }
}
