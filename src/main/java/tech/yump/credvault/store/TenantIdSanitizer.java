package tech.yump.credvault.store;

import lombok.extern.slf4j.Slf4j;
import tech.yump.credvault.core.CredentialValidationException;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes caller supplied tenant ids to {@code [A-Za-z0-9_.-]}, at most 255 characters.
 * Since ':' can never survive, a tenant id cannot forge another tenant's storage key.
 */
@Slf4j
public final class TenantIdSanitizer {

    public static final String DEFAULT_TENANT = "default";
    public static final int MAX_LENGTH = 255;

    private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9_.-]");
    private static final Set<String> RESERVED = Set.of("admin", "root", "system", "superuser", "test");

    private TenantIdSanitizer() {
    }

    /**
     * @return the sanitized tenant id.
     * @throws CredentialValidationException if nothing usable remains or the id is too long.
     */
    public static String sanitize(String tenantId) {
        if (tenantId == null || tenantId.isEmpty()) {
            throw new CredentialValidationException("User ID is required and must be a non-empty string");
        }

        String sanitized = DISALLOWED.matcher(tenantId).replaceAll("");
        if (!sanitized.equals(tenantId)) {
            log.warn("Tenant id contained invalid characters and was sanitized to '{}'", sanitized);
        }
        if (sanitized.isEmpty()) {
            throw new CredentialValidationException("User ID contains no valid characters");
        }
        if (sanitized.length() > MAX_LENGTH) {
            throw new CredentialValidationException("User ID too long (max " + MAX_LENGTH + " characters)");
        }
        if (RESERVED.contains(sanitized.toLowerCase(Locale.ROOT))) {
            log.warn("Credential operation for reserved tenant id '{}'", sanitized);
        }
        return sanitized;
    }
}
