package tech.yump.credvault.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class OpenAIProvider extends AbstractCredentialProvider {

    public static final String ID = "openai";

    public OpenAIProvider() {
        super(ID, "OpenAI", Set.of(CredentialType.API_KEY), Set.of(), 20, List.of("sk-"));
    }

    @Override
    public Map<String, String> authHeaders(String credential) {
        Map<String, String> headers = super.authHeaders(credential);
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        return headers;
    }
}
