package tech.yump.credvault.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL implementation of {@link CredentialRepository} on the {@code credentials} table.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcCredentialRepository implements CredentialRepository {

    private static final TypeReference<LinkedHashMap<String, String>> METADATA_TYPE = new TypeReference<>() {};

    // Keeps the first createdAt in metadata as well as in the column
    private static final String UPSERT_SQL = """
            INSERT INTO credentials (tenant_id, storage_key, provider_id, scope, encrypted_value, nonce, auth_tag, metadata)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (tenant_id, storage_key) DO UPDATE SET
                provider_id = EXCLUDED.provider_id,
                scope = EXCLUDED.scope,
                encrypted_value = EXCLUDED.encrypted_value,
                nonce = EXCLUDED.nonce,
                auth_tag = EXCLUDED.auth_tag,
                metadata = EXCLUDED.metadata || jsonb_build_object(
                    'createdAt', COALESCE(credentials.metadata -> 'createdAt', EXCLUDED.metadata -> 'createdAt')),
                updated_at = NOW()
            RETURNING created_at, updated_at
            """;

    private static final String SELECT_SQL = """
            SELECT id, tenant_id, storage_key, provider_id, scope, encrypted_value, nonce, auth_tag,
                   metadata::text AS metadata, created_at, updated_at
            FROM credentials
            WHERE tenant_id = ? AND storage_key = ?
            """;

    private static final String DELETE_SQL = "DELETE FROM credentials WHERE tenant_id = ? AND storage_key = ?";

    private static final String LIST_SQL = """
            SELECT provider_id, scope, storage_key, metadata::text AS metadata, created_at, updated_at
            FROM credentials
            WHERE tenant_id = ?
            ORDER BY updated_at DESC, id DESC
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public UpsertResult upsert(StoredCredential credential) {
        String metadataJson = writeMetadata(credential.metadata());
        log.debug("Upserting credential row for tenant '{}', storage key '{}'", credential.tenantId(), credential.storageKey());
        try {
            UpsertResult result = jdbcTemplate.queryForObject(UPSERT_SQL,
                    (rs, rowNum) -> new UpsertResult(instant(rs, "created_at"), instant(rs, "updated_at")),
                    credential.tenantId(),
                    credential.storageKey(),
                    credential.providerId(),
                    credential.scope(),
                    credential.encryptedValue(),
                    credential.nonce(),
                    credential.authTag(),
                    metadataJson);
            log.debug("Credential row written for storage key '{}'", credential.storageKey());
            return result;
        } catch (DataAccessException e) {
            log.error("Database error writing credential for tenant '{}', storage key '{}': {}",
                    credential.tenantId(), credential.storageKey(), e.getMessage());
            throw new StorageUnavailableException("Failed to store credential: database unavailable", e);
        }
    }

    @Override
    public Optional<StoredCredential> find(String tenantId, String storageKey) {
        try {
            List<StoredCredential> rows = jdbcTemplate.query(SELECT_SQL, storedCredentialMapper(), tenantId, storageKey);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            log.error("Database error reading credential for tenant '{}', storage key '{}': {}", tenantId, storageKey, e.getMessage());
            throw new StorageUnavailableException("Failed to read credential: database unavailable", e);
        }
    }

    @Override
    public boolean delete(String tenantId, String storageKey) {
        try {
            int rows = jdbcTemplate.update(DELETE_SQL, tenantId, storageKey);
            log.debug("Deleted {} credential row(s) for storage key '{}'", rows, storageKey);
            return rows > 0;
        } catch (DataAccessException e) {
            log.error("Database error deleting credential for tenant '{}', storage key '{}': {}", tenantId, storageKey, e.getMessage());
            throw new StorageUnavailableException("Failed to delete credential: database unavailable", e);
        }
    }

    @Override
    public List<CredentialSummary> listByTenant(String tenantId) {
        try {
            return jdbcTemplate.query(LIST_SQL, (rs, rowNum) -> new CredentialSummary(
                    rs.getString("provider_id"),
                    rs.getString("scope"),
                    rs.getString("storage_key"),
                    readMetadata(rs.getString("metadata"), rs.getString("storage_key")),
                    instant(rs, "created_at"),
                    instant(rs, "updated_at")), tenantId);
        } catch (DataAccessException e) {
            log.error("Database error listing credentials for tenant '{}': {}", tenantId, e.getMessage());
            throw new StorageUnavailableException("Failed to list credentials: database unavailable", e);
        }
    }

    private RowMapper<StoredCredential> storedCredentialMapper() {
        return (rs, rowNum) -> StoredCredential.builder()
                .id(rs.getLong("id"))
                .tenantId(rs.getString("tenant_id"))
                .storageKey(rs.getString("storage_key"))
                .providerId(rs.getString("provider_id"))
                .scope(rs.getString("scope"))
                .encryptedValue(rs.getBytes("encrypted_value"))
                .nonce(rs.getBytes("nonce"))
                .authTag(rs.getBytes("auth_tag"))
                .metadata(readMetadata(rs.getString("metadata"), rs.getString("storage_key")))
                .createdAt(instant(rs, "created_at"))
                .updatedAt(instant(rs, "updated_at"))
                .build();
    }

    private String writeMetadata(Map<String, String> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Credential metadata cannot be serialized to JSON", e);
        }
    }

    private Map<String, String> readMetadata(String json, String storageKey) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            // Metadata is informational; a bad document must not hide the credential
            log.warn("Ignoring unreadable metadata for storage key '{}': {}", storageKey, e.getOriginalMessage());
            return Map.of();
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
