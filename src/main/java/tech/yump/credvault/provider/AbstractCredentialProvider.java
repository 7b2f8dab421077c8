package tech.yump.credvault.provider;

import org.springframework.http.HttpHeaders;
import tech.yump.credvault.scope.CredentialScope;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Length and prefix checks plus the default storage key, metadata and header layout
 * shared by the built-in providers.
 */
public abstract class AbstractCredentialProvider implements CredentialProvider {

    public static final int DEFAULT_MAX_LENGTH = 255;

    private final String providerId;
    private final String displayName;
    private final Set<CredentialType> supportedTypes;
    private final Set<String> requiredScopes;
    private final int minLength;
    private final int maxLength;
    private final List<String> prefixes;

    protected AbstractCredentialProvider(String providerId,
                                         String displayName,
                                         Set<CredentialType> supportedTypes,
                                         Set<String> requiredScopes,
                                         int minLength,
                                         List<String> prefixes) {
        if (providerId == null || providerId.isBlank() || providerId.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Provider id must be non-blank and must not contain ':'");
        }
        this.providerId = providerId;
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.supportedTypes = Set.copyOf(supportedTypes);
        this.requiredScopes = Set.copyOf(requiredScopes);
        this.minLength = minLength;
        this.maxLength = DEFAULT_MAX_LENGTH;
        this.prefixes = List.copyOf(prefixes);
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public Set<CredentialType> supportedTypes() {
        return supportedTypes;
    }

    @Override
    public Set<String> requiredScopes() {
        return requiredScopes;
    }

    @Override
    public final ValidationResult validate(String credential) {
        if (credential == null || credential.isBlank()) {
            return ValidationResult.invalid("Credential must be a non-empty string");
        }
        if (credential.length() < minLength) {
            return ValidationResult.invalid("Token is too short (minimum " + minLength + " characters)");
        }
        if (credential.length() > maxLength) {
            return ValidationResult.invalid("Token exceeds maximum length (" + maxLength + " characters)");
        }
        if (!prefixes.isEmpty() && prefixes.stream().noneMatch(credential::startsWith)) {
            return ValidationResult.invalid("Invalid " + displayName + " token format. Expected prefix: " + String.join(", ", prefixes));
        }
        return validateFormat(credential);
    }

    /**
     * Provider specific checks run after the length and prefix rules passed.
     */
    protected ValidationResult validateFormat(String credential) {
        return ValidationResult.ok();
    }

    @Override
    public String storageKey(String tenantId, CredentialScope scope) {
        StringBuilder key = new StringBuilder(tenantId).append(':').append(providerId);
        if (scope != null) {
            scope.serialize().ifPresent(value -> key.append(':').append(value));
        }
        return key.toString();
    }

    @Override
    public Map<String, String> metadata(String credential) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("provider", providerId);
        metadata.put("version", "1");
        return metadata;
    }

    @Override
    public Map<String, String> authHeaders(String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + credential);
        return headers;
    }
}
