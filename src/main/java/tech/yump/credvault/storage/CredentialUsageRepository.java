package tech.yump.credvault.storage;

import java.time.Instant;
import java.util.List;

/**
 * Append-only log of credential usage events. Every method may throw
 * {@link StorageUnavailableException}.
 */
public interface CredentialUsageRepository {

    void record(CredentialUsageEvent event);

    /**
     * Groups the tenant's events after {@code since} by provider, scope and operation.
     *
     * @return the groups, most used first.
     */
    List<UsageAggregate> aggregate(String tenantId, Instant since);

    /**
     * Groups the tenant's successful events after {@code since} by provider and scope.
     *
     * @return at most {@code limit} groups, most used first, ties broken by most recent use.
     */
    List<UsageAggregate> mostUsed(String tenantId, Instant since, int limit);
}
