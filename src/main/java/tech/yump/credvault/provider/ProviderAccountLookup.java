package tech.yump.credvault.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import tech.yump.credvault.config.VaultProperties;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves the account name behind a token so it can be stored as metadata.
 * <p>
 * Every failure (disabled, timeout, non-2xx, unexpected body) yields an empty result;
 * storing a credential never depends on the provider being reachable.
 */
@Slf4j
@Component
public class ProviderAccountLookup {

    public static final String USER_AGENT = "credential-vault";

    private final RestClient restClient;
    private final VaultProperties.AccountLookupProperties properties;

    public ProviderAccountLookup(@Qualifier("providerRestClient") RestClient restClient, VaultProperties vaultProperties) {
        this.restClient = restClient;
        this.properties = vaultProperties.providers().accountLookup();
    }

    public Optional<String> fetchGitHubLogin(Map<String, String> authHeaders) {
        return fetchField(properties.githubApiUrl() + "/user", authHeaders, "login");
    }

    public Optional<String> fetchGitLabUsername(Map<String, String> authHeaders) {
        return fetchField(properties.gitlabApiUrl() + "/user", authHeaders, "username");
    }

    private Optional<String> fetchField(String url, Map<String, String> authHeaders, String field) {
        if (!properties.enabled()) {
            return Optional.empty();
        }
        try {
            JsonNode body = restClient.get()
                    .uri(url)
                    .headers(headers -> authHeaders.forEach(headers::set))
                    .retrieve()
                    .body(JsonNode.class);
            Optional<String> value = Optional.ofNullable(body)
                    .map(node -> node.path(field))
                    .filter(JsonNode::isTextual)
                    .map(JsonNode::asText)
                    .filter(text -> !text.isBlank());
            log.debug("Account lookup against {} {}.", url, value.isPresent() ? "succeeded" : "returned no '" + field + "'");
            return value;
        } catch (RestClientException e) {
            log.debug("Account lookup against {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }
}
