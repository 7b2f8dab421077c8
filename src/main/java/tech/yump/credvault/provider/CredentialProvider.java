package tech.yump.credvault.provider;

import tech.yump.credvault.scope.CredentialScope;

import java.util.Map;
import java.util.Set;

/**
 * Describes one external service whose credentials the vault can hold.
 * Implementations are stateless and registered once at startup.
 */
public interface CredentialProvider {

    /**
     * Stable identifier used in storage keys, e.g. {@code github}. Never contains ':'.
     */
    String providerId();

    String displayName();

    Set<CredentialType> supportedTypes();

    /**
     * Scopes a token needs for the automation to work. Informational only.
     */
    Set<String> requiredScopes();

    /**
     * Structural check of the credential. Never contacts the provider.
     *
     * @param credential the raw credential, may be null.
     * @return the validation outcome with a human readable reason when invalid.
     */
    ValidationResult validate(String credential);

    /**
     * Builds the storage key {@code tenantId:providerId[:scope]}.
     * Distinct (tenant, scope) pairs always yield distinct keys.
     */
    String storageKey(String tenantId, CredentialScope scope);

    /**
     * Non-secret attributes derived from the credential. Must not throw.
     */
    Map<String, String> metadata(String credential);

    /**
     * Headers a client would send to authenticate against the provider's API.
     */
    Map<String, String> authHeaders(String credential);

    default String mask(String credential) {
        return CredentialMasking.mask(credential, CredentialMasking.DEFAULT_VISIBLE_CHARS);
    }
}
