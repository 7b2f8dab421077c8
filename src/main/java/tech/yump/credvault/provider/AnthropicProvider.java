package tech.yump.credvault.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Anthropic API keys. Authenticates with {@code x-api-key} rather than a bearer token.
 */
@Component
public class AnthropicProvider extends AbstractCredentialProvider {

    public static final String ID = "anthropic";
    static final String API_VERSION = "2023-06-01";

    public AnthropicProvider() {
        super(ID, "Anthropic", Set.of(CredentialType.API_KEY), Set.of(), 20, List.of("sk-ant-"));
    }

    @Override
    public Map<String, String> authHeaders(String credential) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", credential);
        headers.put("anthropic-version", API_VERSION);
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        return headers;
    }
}
