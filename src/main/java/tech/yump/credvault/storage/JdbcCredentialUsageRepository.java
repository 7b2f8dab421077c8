package tech.yump.credvault.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * PostgreSQL implementation of {@link CredentialUsageRepository} on the {@code credential_usage} table.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcCredentialUsageRepository implements CredentialUsageRepository {

    private static final String INSERT_SQL = """
            INSERT INTO credential_usage (tenant_id, provider_id, scope, operation, success, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String AGGREGATE_SQL = """
            SELECT provider_id, scope, operation,
                   COUNT(*) AS usage_count,
                   COUNT(*) FILTER (WHERE success) AS success_count,
                   COUNT(*) FILTER (WHERE NOT success) AS failure_count,
                   MAX(created_at) AS last_used
            FROM credential_usage
            WHERE tenant_id = ? AND created_at > ?
            GROUP BY provider_id, scope, operation
            ORDER BY usage_count DESC, provider_id, operation
            """;

    private static final String MOST_USED_SQL = """
            SELECT provider_id, scope,
                   COUNT(*) AS usage_count,
                   MAX(created_at) AS last_used
            FROM credential_usage
            WHERE tenant_id = ? AND success AND created_at > ?
            GROUP BY provider_id, scope
            ORDER BY usage_count DESC, last_used DESC
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void record(CredentialUsageEvent event) {
        try {
            jdbcTemplate.update(INSERT_SQL,
                    event.tenantId(),
                    event.providerId(),
                    event.scope(),
                    event.operation(),
                    event.success(),
                    OffsetDateTime.ofInstant(event.occurredAt(), ZoneOffset.UTC));
        } catch (DataAccessException e) {
            throw new StorageUnavailableException("Failed to record credential usage: database unavailable", e);
        }
    }

    @Override
    public List<UsageAggregate> aggregate(String tenantId, Instant since) {
        try {
            return jdbcTemplate.query(AGGREGATE_SQL, (rs, rowNum) -> new UsageAggregate(
                    rs.getString("provider_id"),
                    rs.getString("scope"),
                    rs.getString("operation"),
                    rs.getLong("usage_count"),
                    rs.getLong("success_count"),
                    rs.getLong("failure_count"),
                    instant(rs, "last_used")), tenantId, OffsetDateTime.ofInstant(since, ZoneOffset.UTC));
        } catch (DataAccessException e) {
            log.error("Database error aggregating credential usage for tenant '{}': {}", tenantId, e.getMessage());
            throw new StorageUnavailableException("Failed to read credential usage: database unavailable", e);
        }
    }

    @Override
    public List<UsageAggregate> mostUsed(String tenantId, Instant since, int limit) {
        try {
            return jdbcTemplate.query(MOST_USED_SQL, (rs, rowNum) -> {
                long count = rs.getLong("usage_count");
                return new UsageAggregate(
                        rs.getString("provider_id"),
                        rs.getString("scope"),
                        null,
                        count,
                        count,
                        0,
                        instant(rs, "last_used"));
            }, tenantId, OffsetDateTime.ofInstant(since, ZoneOffset.UTC), limit);
        } catch (DataAccessException e) {
            log.error("Database error reading most used credentials for tenant '{}': {}", tenantId, e.getMessage());
            throw new StorageUnavailableException("Failed to read credential usage: database unavailable", e);
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
