package tech.yump.credvault.support;

import tech.yump.credvault.storage.CredentialUsageEvent;
import tech.yump.credvault.storage.CredentialUsageRepository;
import tech.yump.credvault.storage.UsageAggregate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * List backed usage log with the same grouping and ordering as the SQL queries.
 */
public class InMemoryCredentialUsageRepository implements CredentialUsageRepository {

    private final List<CredentialUsageEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(CredentialUsageEvent event) {
        events.add(event);
    }

    @Override
    public List<UsageAggregate> aggregate(String tenantId, Instant since) {
        return group(tenantId, since, false, event -> List.of(event.providerId(), String.valueOf(event.scope()), event.operation()))
                .stream()
                .sorted(Comparator.comparingLong(UsageAggregate::usageCount).reversed()
                        .thenComparing(UsageAggregate::providerId)
                        .thenComparing(UsageAggregate::operation))
                .toList();
    }

    @Override
    public List<UsageAggregate> mostUsed(String tenantId, Instant since, int limit) {
        return group(tenantId, since, true, event -> List.of(event.providerId(), String.valueOf(event.scope())))
                .stream()
                .map(row -> new UsageAggregate(row.providerId(), row.scope(), null, row.usageCount(), row.usageCount(), 0, row.lastUsed()))
                .sorted(Comparator.comparingLong(UsageAggregate::usageCount).reversed()
                        .thenComparing(UsageAggregate::lastUsed, Comparator.reverseOrder()))
                .limit(limit)
                .toList();
    }

    public List<CredentialUsageEvent> events() {
        return List.copyOf(events);
    }

    private List<UsageAggregate> group(String tenantId, Instant since, boolean successOnly,
                                       Function<CredentialUsageEvent, List<String>> groupKey) {
        Map<List<String>, List<CredentialUsageEvent>> groups = new LinkedHashMap<>();
        for (CredentialUsageEvent event : events) {
            if (!event.tenantId().equals(tenantId) || !event.occurredAt().isAfter(since)) {
                continue;
            }
            if (successOnly && !event.success()) {
                continue;
            }
            groups.computeIfAbsent(groupKey.apply(event), key -> new ArrayList<>()).add(event);
        }

        List<UsageAggregate> rows = new ArrayList<>();
        groups.values().forEach(group -> {
            CredentialUsageEvent first = group.get(0);
            long successes = group.stream().filter(CredentialUsageEvent::success).count();
            Instant lastUsed = group.stream().map(CredentialUsageEvent::occurredAt).filter(Objects::nonNull)
                    .max(Comparator.naturalOrder()).orElse(null);
            rows.add(new UsageAggregate(first.providerId(), first.scope(), first.operation(),
                    group.size(), successes, group.size() - successes, lastUsed));
        });
        return rows;
    }
}
