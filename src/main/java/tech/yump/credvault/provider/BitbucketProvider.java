package tech.yump.credvault.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bitbucket app passwords and access tokens. No fixed prefix, length is the only check.
 */
@Component
public class BitbucketProvider extends AbstractCredentialProvider {

    public static final String ID = "bitbucket";

    public BitbucketProvider() {
        super(ID,
                "Bitbucket",
                Set.of(CredentialType.OAUTH_TOKEN, CredentialType.BEARER_TOKEN),
                Set.of("repository:write", "pullrequest:write"),
                20,
                List.of());
    }

    @Override
    public Map<String, String> authHeaders(String credential) {
        Map<String, String> headers = super.authHeaders(credential);
        headers.put(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return headers;
    }
}
