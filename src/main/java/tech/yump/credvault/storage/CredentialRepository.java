package tech.yump.credvault.storage;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for encrypted credentials.
 * Implementations hold exactly one row per (tenantId, storageKey).
 * Every method may throw {@link StorageUnavailableException}.
 */
public interface CredentialRepository {

    /**
     * Inserts the credential or replaces the existing row under the same
     * (tenantId, storageKey), keeping its creation time. Last write wins.
     *
     * @param credential the record to write; id and timestamps are ignored.
     * @return the row's timestamps after the write.
     */
    UpsertResult upsert(StoredCredential credential);

    /**
     * @return the row, or empty if none exists.
     */
    Optional<StoredCredential> find(String tenantId, String storageKey);

    /**
     * @return true if a row was removed.
     */
    boolean delete(String tenantId, String storageKey);

    /**
     * @return the tenant's credentials, most recently updated first.
     */
    List<CredentialSummary> listByTenant(String tenantId);
}
