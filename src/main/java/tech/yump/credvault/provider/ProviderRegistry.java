package tech.yump.credvault.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Closed set of credential providers, built from the provider beans at startup and
 * read-only afterwards.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<String, CredentialProvider> providers;

    public ProviderRegistry(List<CredentialProvider> providers) {
        Map<String, CredentialProvider> byId = new TreeMap<>();
        for (CredentialProvider provider : providers) {
            CredentialProvider existing = byId.putIfAbsent(provider.providerId(), provider);
            if (existing != null) {
                throw new IllegalStateException("Duplicate credential provider id '" + provider.providerId() + "': "
                        + existing.getClass().getName() + " and " + provider.getClass().getName());
            }
        }
        this.providers = Collections.unmodifiableMap(byId);
        log.info("Registered {} credential providers: {}", this.providers.size(), this.providers.keySet());
    }

    /**
     * @throws UnknownProviderException if no provider is registered under the id.
     */
    public CredentialProvider get(String providerId) {
        return find(providerId).orElseThrow(() -> new UnknownProviderException(providerId, providerIds()));
    }

    public Optional<CredentialProvider> find(String providerId) {
        return providerId == null ? Optional.empty() : Optional.ofNullable(providers.get(providerId));
    }

    public boolean contains(String providerId) {
        return find(providerId).isPresent();
    }

    /**
     * @return registered ids, sorted.
     */
    public List<String> providerIds() {
        return List.copyOf(providers.keySet());
    }

    public Collection<CredentialProvider> all() {
        return providers.values();
    }
}
