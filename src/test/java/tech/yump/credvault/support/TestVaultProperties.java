package tech.yump.credvault.support;

import tech.yump.credvault.config.VaultProperties;

import java.time.Duration;
import java.util.List;

/**
 * Builds {@link VaultProperties} with the same defaults as application.yml.
 */
public final class TestVaultProperties {

    public static final String TEST_KEY = "test-encryption-key-0123456789abcdefghijklmnop";
    public static final String TEST_SALT = "test-salt";

    private TestVaultProperties() {
    }

    public static VaultProperties defaults() {
        return withEncryption(false, TEST_KEY, TEST_SALT);
    }

    public static VaultProperties withEncryption(boolean productionMode, String key, String salt) {
        return create(productionMode, new VaultProperties.EncryptionProperties(key, salt, 100_000),
                cache(Duration.ofMinutes(5), 100), accountLookup(false, "https://api.github.com", "https://gitlab.com/api/v4"),
                health(Duration.ofDays(90), List.of("github", "openai")));
    }

    public static VaultProperties withAccountLookup(VaultProperties.AccountLookupProperties lookup) {
        return create(false, new VaultProperties.EncryptionProperties(TEST_KEY, TEST_SALT, 100_000),
                cache(Duration.ofMinutes(5), 100), lookup, health(Duration.ofDays(90), List.of("github", "openai")));
    }

    public static VaultProperties withHealth(VaultProperties.HealthProperties health) {
        return create(false, new VaultProperties.EncryptionProperties(TEST_KEY, TEST_SALT, 100_000),
                cache(Duration.ofMinutes(5), 100), accountLookup(false, "https://api.github.com", "https://gitlab.com/api/v4"),
                health);
    }

    public static VaultProperties withUsage(VaultProperties.UsageProperties usage) {
        VaultProperties base = defaults();
        return new VaultProperties(false, base.encryption(), base.datasource(), base.cache(), base.audit(),
                base.providers(), base.health(), usage);
    }

    public static VaultProperties.CacheProperties cache(Duration ttl, long maxSize) {
        return new VaultProperties.CacheProperties(ttl, maxSize, Duration.ofSeconds(60));
    }

    public static VaultProperties.AccountLookupProperties accountLookup(boolean enabled, String githubApiUrl, String gitlabApiUrl) {
        return new VaultProperties.AccountLookupProperties(enabled, Duration.ofSeconds(5), githubApiUrl, gitlabApiUrl);
    }

    public static VaultProperties.HealthProperties health(Duration rotationAge, List<String> recommendedProviders) {
        return new VaultProperties.HealthProperties(rotationAge, recommendedProviders);
    }

    public static VaultProperties.UsageProperties usage(boolean enabled, Duration period, int mostUsedLimit) {
        return new VaultProperties.UsageProperties(enabled, period, mostUsedLimit);
    }

    private static VaultProperties create(boolean productionMode,
                                          VaultProperties.EncryptionProperties encryption,
                                          VaultProperties.CacheProperties cache,
                                          VaultProperties.AccountLookupProperties lookup,
                                          VaultProperties.HealthProperties health) {
        VaultProperties.DataSourceProperties datasource = new VaultProperties.DataSourceProperties(
                null, "localhost", 5432, "credential_vault", "vault", "secret".toCharArray(),
                20, 2, Duration.ofSeconds(5), Duration.ofSeconds(10), true);
        return new VaultProperties(productionMode, encryption, datasource, cache,
                new VaultProperties.AuditProperties("slf4j", "logs/test-audit.log"),
                new VaultProperties.ProvidersProperties(lookup),
                health,
                usage(true, Duration.ofDays(30), 5));
    }
}
