package tech.yump.credvault.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * GitHub personal access, OAuth, user-to-server, server-to-server and refresh tokens.
 */
@Component
public class GitHubProvider extends AbstractCredentialProvider {

    public static final String ID = "github";
    static final String API_VERSION = "2022-11-28";

    private static final Pattern TOKEN_BODY = Pattern.compile("[A-Za-z0-9]+");

    private final ProviderAccountLookup accountLookup;

    public GitHubProvider(ProviderAccountLookup accountLookup) {
        super(ID,
                "GitHub",
                Set.of(CredentialType.OAUTH_TOKEN, CredentialType.BEARER_TOKEN),
                Set.of("repo", "read:org"),
                36,
                List.of("ghp_", "gho_", "ghu_", "ghs_", "ghr_", "ghb_", "ghc_"));
        this.accountLookup = accountLookup;
    }

    @Override
    protected ValidationResult validateFormat(String credential) {
        String body = credential.substring(credential.indexOf('_') + 1);
        if (!TOKEN_BODY.matcher(body).matches()) {
            return ValidationResult.invalid("Invalid GitHub token format. Token body must be alphanumeric");
        }
        return ValidationResult.ok();
    }

    @Override
    public Map<String, String> metadata(String credential) {
        Map<String, String> metadata = super.metadata(credential);
        int separator = credential == null ? -1 : credential.indexOf('_');
        if (separator > 0) {
            metadata.put("tokenPrefix", credential.substring(0, separator));
        }
        accountLookup.fetchGitHubLogin(authHeaders(credential))
                .ifPresent(login -> metadata.put("username", login));
        return metadata;
    }

    @Override
    public Map<String, String> authHeaders(String credential) {
        Map<String, String> headers = super.authHeaders(credential);
        headers.put(HttpHeaders.ACCEPT, "application/vnd.github.v3+json");
        headers.put(HttpHeaders.USER_AGENT, ProviderAccountLookup.USER_AGENT);
        headers.put("X-GitHub-Api-Version", API_VERSION);
        return headers;
    }
}
