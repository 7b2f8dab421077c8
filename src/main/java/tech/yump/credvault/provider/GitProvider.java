package tech.yump.credvault.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-repository git login stored as {@code username:password}, where the password may be a
 * token. The username never contains ':', so the first ':' separates the two.
 */
@Component
public class GitProvider extends AbstractCredentialProvider {

    public static final String ID = "git";
    public static final char SEPARATOR = ':';

    public GitProvider() {
        super(ID,
                "Git",
                Set.of(CredentialType.BASIC_AUTH),
                Set.of(),
                3,
                List.of());
    }

    @Override
    protected ValidationResult validateFormat(String credential) {
        int separator = credential.indexOf(SEPARATOR);
        if (separator <= 0) {
            return ValidationResult.invalid("Git credentials must have the form username:password");
        }
        if (separator == credential.length() - 1) {
            return ValidationResult.invalid("Git password must not be empty");
        }
        if (credential.substring(0, separator).chars().anyMatch(Character::isWhitespace)) {
            return ValidationResult.invalid("Git username must not contain whitespace");
        }
        return ValidationResult.ok();
    }

    @Override
    public Map<String, String> metadata(String credential) {
        Map<String, String> metadata = super.metadata(credential);
        int separator = credential == null ? -1 : credential.indexOf(SEPARATOR);
        if (separator > 0) {
            metadata.put("username", credential.substring(0, separator));
        }
        return metadata;
    }

    @Override
    public Map<String, String> authHeaders(String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        String encoded = Base64.getEncoder().encodeToString(credential.getBytes(StandardCharsets.UTF_8));
        headers.put(HttpHeaders.AUTHORIZATION, "Basic " + encoded);
        return headers;
    }

    /**
     * Shows the username and masks only the password, e.g. {@code bob:ghp_...R8s9}.
     */
    @Override
    public String mask(String credential) {
        int separator = credential == null ? -1 : credential.indexOf(SEPARATOR);
        if (separator <= 0) {
            return CredentialMasking.mask(credential);
        }
        return credential.substring(0, separator + 1) + CredentialMasking.mask(credential.substring(separator + 1));
    }
}
