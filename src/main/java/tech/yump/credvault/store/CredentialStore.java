package tech.yump.credvault.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.credvault.audit.AuditHelper;
import tech.yump.credvault.core.CredentialValidationException;
import tech.yump.credvault.core.MasterKeyManager;
import tech.yump.credvault.crypto.AuthenticationFailedException;
import tech.yump.credvault.crypto.CryptoEngine;
import tech.yump.credvault.crypto.EncryptedPayload;
import tech.yump.credvault.provider.CredentialProvider;
import tech.yump.credvault.provider.ProviderRegistry;
import tech.yump.credvault.provider.ValidationResult;
import tech.yump.credvault.scope.CredentialScope;
import tech.yump.credvault.storage.CredentialRepository;
import tech.yump.credvault.storage.CredentialSummary;
import tech.yump.credvault.storage.StoredCredential;
import tech.yump.credvault.storage.UpsertResult;
import tech.yump.credvault.usage.CredentialUsageTracker;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Stores, retrieves and removes encrypted credentials per tenant, provider and scope.
 * <p>
 * Writes go to the repository first, then to the cache. Concurrent writes to the same
 * key are not serialized: the last write to reach the database wins, and a write that
 * overlapped another write or a delete leaves the key uncached so the next read goes to
 * storage.
 * <p>
 * Stores and successful or failed reads are recorded with {@link CredentialUsageTracker}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    static final String AUDIT_TYPE = "credential_operation";
    static final String ACTION_STORE = "credential.store";
    static final String ACTION_GET = "credential.get";
    static final String ACTION_DELETE = "credential.delete";
    static final String DEFAULT_SOURCE = "credential-vault";
    static final String SCHEMA_VERSION = "1";

    private final ProviderRegistry providerRegistry;
    private final CryptoEngine cryptoEngine;
    private final MasterKeyManager masterKeyManager;
    private final CredentialRepository credentialRepository;
    private final CredentialCache credentialCache;
    private final AuditHelper auditHelper;
    private final CredentialUsageTracker usageTracker;
    private final Clock clock;

    /**
     * Validates, encrypts and persists a credential, replacing any previous value under the
     * same tenant, provider and scope.
     *
     * @param extraMetadata caller supplied, non-secret attributes. May be null.
     * @throws CredentialValidationException if the tenant id or credential is rejected.
     * @throws tech.yump.credvault.provider.UnknownProviderException if the provider is not registered.
     * @throws tech.yump.credvault.storage.StorageUnavailableException if the write fails.
     */
    public StoredCredentialSummary storeCredential(String providerId,
                                                   String credential,
                                                   String tenantId,
                                                   CredentialScope scope,
                                                   Map<String, String> extraMetadata) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        CredentialScope effectiveScope = scope == null ? CredentialScope.none() : scope;
        CredentialProvider provider = providerRegistry.get(providerId);

        ValidationResult validation = provider.validate(credential);
        if (!validation.valid()) {
            log.warn("Rejected {} credential {} for tenant '{}': {}",
                    providerId, provider.mask(credential), tenant, validation.reason());
            auditHelper.logFailureEvent(AUDIT_TYPE, ACTION_STORE, tenant, validation.reason(),
                    auditData(providerId, effectiveScope, null));
            usageTracker.recordUsage(tenant, providerId, effectiveScope.storedValue(), CredentialUsageTracker.OPERATION_STORE, false);
            throw new CredentialValidationException(validation.reason());
        }

        String storageKey = provider.storageKey(tenant, effectiveScope);
        Map<String, String> metadata = buildMetadata(provider, credential, extraMetadata);

        byte[] plaintext = credential.getBytes(StandardCharsets.UTF_8);
        EncryptedPayload payload;
        try {
            payload = cryptoEngine.encrypt(plaintext, masterKeyManager.getMasterKey());
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }

        StoredCredential record = StoredCredential.builder()
                .tenantId(tenant)
                .storageKey(storageKey)
                .providerId(providerId)
                .scope(effectiveScope.storedValue())
                .encryptedValue(payload.ciphertext())
                .nonce(payload.nonce())
                .authTag(payload.tag())
                .metadata(metadata)
                .build();

        long stamp = credentialCache.writeStamp();
        UpsertResult result = credentialRepository.upsert(record);
        credentialCache.putAfterWrite(storageKey, credential, stamp);

        log.info("Stored {} credential {} for tenant '{}' under '{}'", providerId, provider.mask(credential), tenant, storageKey);
        auditHelper.logInternalEvent(AUDIT_TYPE, ACTION_STORE, AuditHelper.OUTCOME_SUCCESS, tenant,
                auditData(providerId, effectiveScope, storageKey));
        usageTracker.recordUsage(tenant, providerId, effectiveScope.storedValue(), CredentialUsageTracker.OPERATION_STORE, true);

        return new StoredCredentialSummary(tenant, providerId, effectiveScope.storedValue(), storageKey,
                result.createdAt(), result.updatedAt());
    }

    /**
     * @return the plaintext credential, or empty if none is stored.
     * @throws AuthenticationFailedException if the stored record does not verify under the master key.
     */
    public Optional<String> getCredential(String providerId, String tenantId, CredentialScope scope) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        CredentialScope effectiveScope = scope == null ? CredentialScope.none() : scope;
        CredentialProvider provider = providerRegistry.get(providerId);
        String storageKey = provider.storageKey(tenant, effectiveScope);

        Optional<String> cached = credentialCache.get(storageKey);
        if (cached.isPresent()) {
            log.debug("Cache hit for '{}'", storageKey);
            recordSuccessfulRead(tenant, providerId, effectiveScope, storageKey, "cache");
            return cached;
        }

        long stamp = credentialCache.writeStamp();
        Optional<StoredCredential> stored = credentialRepository.find(tenant, storageKey);
        if (stored.isEmpty()) {
            log.debug("No {} credential stored for tenant '{}' under '{}'", providerId, tenant, storageKey);
            return Optional.empty();
        }

        byte[] plaintext;
        try {
            plaintext = cryptoEngine.decrypt(stored.get().payload(), masterKeyManager.getMasterKey());
        } catch (AuthenticationFailedException e) {
            log.error("Stored {} credential for tenant '{}' under '{}' failed authentication. "
                            + "The record is corrupt, was tampered with, or was written under another master key.",
                    providerId, tenant, storageKey);
            auditHelper.logFailureEvent(AUDIT_TYPE, ACTION_GET, tenant, e.getMessage(),
                    auditData(providerId, effectiveScope, storageKey));
            usageTracker.recordUsage(tenant, providerId, effectiveScope.storedValue(), CredentialUsageTracker.OPERATION_GET, false);
            throw e;
        }

        String credential = new String(plaintext, StandardCharsets.UTF_8);
        Arrays.fill(plaintext, (byte) 0);
        credentialCache.putIfUnchanged(storageKey, credential, stamp);

        recordSuccessfulRead(tenant, providerId, effectiveScope, storageKey, "storage");
        return Optional.of(credential);
    }

    /**
     * Removes the credential and its cache entry. Idempotent.
     *
     * @return true if a stored credential was removed.
     */
    public boolean deleteCredential(String providerId, String tenantId, CredentialScope scope) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        CredentialScope effectiveScope = scope == null ? CredentialScope.none() : scope;
        CredentialProvider provider = providerRegistry.get(providerId);
        String storageKey = provider.storageKey(tenant, effectiveScope);

        boolean deleted = credentialRepository.delete(tenant, storageKey);
        credentialCache.invalidate(storageKey);

        if (deleted) {
            log.info("Deleted {} credential for tenant '{}' under '{}'", providerId, tenant, storageKey);
        } else {
            log.debug("Nothing to delete for tenant '{}' under '{}'", tenant, storageKey);
        }
        Map<String, Object> data = auditData(providerId, effectiveScope, storageKey);
        data.put("deleted", deleted);
        auditHelper.logInternalEvent(AUDIT_TYPE, ACTION_DELETE, AuditHelper.OUTCOME_SUCCESS, tenant, data);
        return deleted;
    }

    /**
     * @return the tenant's credentials, most recently updated first. Never decrypts.
     */
    public List<CredentialSummary> listCredentials(String tenantId) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        return credentialRepository.listByTenant(tenant);
    }

    public CredentialStatusReport credentialStatus(String tenantId) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        List<CredentialSummary> credentials = credentialRepository.listByTenant(tenant);

        // Listing is newest first, so the first entry per provider is the current one
        Map<String, List<CredentialSummary>> grouped = new TreeMap<>();
        for (CredentialSummary summary : credentials) {
            grouped.computeIfAbsent(summary.providerId(), id -> new ArrayList<>()).add(summary);
        }

        Map<String, CredentialStatusReport.ProviderStatus> byProvider = new LinkedHashMap<>();
        grouped.forEach((providerId, entries) -> {
            TreeSet<String> scopes = new TreeSet<>();
            entries.stream().map(CredentialSummary::scope).filter(Objects::nonNull).forEach(scopes::add);
            byProvider.put(providerId, new CredentialStatusReport.ProviderStatus(
                    entries.size(),
                    entries.get(0).metadata().get(MetadataKeys.MASKED_VALUE),
                    List.copyOf(scopes)));
        });

        return new CredentialStatusReport(tenant, credentials.size(), byProvider, List.copyOf(grouped.keySet()));
    }

    /**
     * Format check only, nothing is stored. Unknown providers are reported as invalid.
     */
    public ValidationResult validateCredential(String providerId, String credential) {
        return providerRegistry.find(providerId)
                .map(provider -> provider.validate(credential))
                .orElseGet(() -> ValidationResult.invalid("Unknown provider: " + providerId));
    }

    /**
     * Drops every cached plaintext. Subsequent reads go to storage.
     */
    public long clearCache() {
        long dropped = credentialCache.clear();
        log.warn("Credential cache cleared, {} entries dropped", dropped);
        return dropped;
    }

    private Map<String, String> buildMetadata(CredentialProvider provider, String credential, Map<String, String> extraMetadata) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (extraMetadata != null) {
            extraMetadata.forEach((key, value) -> {
                if (key != null && value != null) {
                    metadata.put(key, value);
                }
            });
        }
        try {
            metadata.putAll(provider.metadata(credential));
        } catch (RuntimeException e) {
            log.warn("Provider '{}' failed to build metadata, storing without it: {}", provider.providerId(), e.getMessage());
        }

        String now = clock.instant().toString();
        metadata.putIfAbsent(MetadataKeys.SOURCE, DEFAULT_SOURCE);
        metadata.put(MetadataKeys.SCHEMA_VERSION, SCHEMA_VERSION);
        metadata.put(MetadataKeys.CREATED_AT, now);
        metadata.put(MetadataKeys.UPDATED_AT, now);
        metadata.put(MetadataKeys.MASKED_VALUE, provider.mask(credential));
        return metadata;
    }

    private void recordSuccessfulRead(String tenant, String providerId, CredentialScope scope, String storageKey, String source) {
        Map<String, Object> data = auditData(providerId, scope, storageKey);
        data.put("source", source);
        auditHelper.logInternalEvent(AUDIT_TYPE, ACTION_GET, AuditHelper.OUTCOME_SUCCESS, tenant, data);
        usageTracker.recordUsage(tenant, providerId, scope.storedValue(), CredentialUsageTracker.OPERATION_GET, true);
    }

    private static Map<String, Object> auditData(String providerId, CredentialScope scope, String storageKey) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("provider", providerId);
        scope.serialize().ifPresent(value -> data.put("scope", value));
        if (storageKey != null) {
            data.put("storage_key", storageKey);
        }
        return data;
    }
}
