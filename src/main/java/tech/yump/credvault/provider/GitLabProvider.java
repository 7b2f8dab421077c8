package tech.yump.credvault.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * GitLab personal, feed and trigger tokens.
 */
@Component
public class GitLabProvider extends AbstractCredentialProvider {

    public static final String ID = "gitlab";

    private final ProviderAccountLookup accountLookup;

    public GitLabProvider(ProviderAccountLookup accountLookup) {
        super(ID,
                "GitLab",
                Set.of(CredentialType.OAUTH_TOKEN, CredentialType.BEARER_TOKEN),
                Set.of("api", "read_repository", "write_repository"),
                20,
                List.of("glpat-", "glft-", "glt_"));
        this.accountLookup = accountLookup;
    }

    @Override
    public Map<String, String> metadata(String credential) {
        Map<String, String> metadata = super.metadata(credential);
        accountLookup.fetchGitLabUsername(authHeaders(credential))
                .ifPresent(username -> metadata.put("username", username));
        return metadata;
    }

    @Override
    public Map<String, String> authHeaders(String credential) {
        Map<String, String> headers = super.authHeaders(credential);
        headers.put(HttpHeaders.USER_AGENT, ProviderAccountLookup.USER_AGENT);
        return headers;
    }
}
