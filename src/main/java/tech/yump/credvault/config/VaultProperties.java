package tech.yump.credvault.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Configuration properties for the credential vault under the 'vault' prefix.
 */
@ConfigurationProperties(prefix = "vault")
@Validated
public record VaultProperties(

        boolean productionMode,

        @Valid
        @NotNull(message = "Encryption configuration (vault.encryption) is required.")
        @DefaultValue
        EncryptionProperties encryption,

        @Valid
        @NotNull(message = "Datasource configuration (vault.datasource) is required.")
        @DefaultValue
        DataSourceProperties datasource,

        @Valid
        @NotNull
        @DefaultValue
        CacheProperties cache,

        @Valid
        @NotNull
        @DefaultValue
        AuditProperties audit,

        @Valid
        @NotNull
        @DefaultValue
        ProvidersProperties providers,

        @Valid
        @NotNull
        @DefaultValue
        HealthProperties health,

        @Valid
        @NotNull
        @DefaultValue
        UsageProperties usage
) {

    // --- EncryptionProperties ---
    @Validated
    public record EncryptionProperties(
            // Optional outside production mode, see MasterKeyManager
            String key,

            String salt,

            @Min(value = 100_000, message = "PBKDF2 iterations (vault.encryption.iterations) must be at least 100000.")
            @DefaultValue("100000")
            int iterations
    ) {
        public boolean hasKey() {
            return StringUtils.hasText(key);
        }

        public boolean hasSalt() {
            return StringUtils.hasText(salt);
        }

        @Override
        public String toString() {
            // Never print the key or salt
            return "EncryptionProperties[" +
                    "key=" + (hasKey() ? "******" : "<unset>") +
                    ", salt=" + (hasSalt() ? "******" : "<derived>") +
                    ", iterations=" + iterations +
                    ']';
        }
    }

    // --- DataSourceProperties ---
    @Validated
    public record DataSourceProperties(
            // Full JDBC URL, overrides host/port/database when set
            String url,

            @DefaultValue("localhost")
            String host,

            @Min(1) @Max(65535)
            @DefaultValue("5432")
            int port,

            @DefaultValue("credential_vault")
            String database,

            @NotBlank(message = "Database username (vault.datasource.username) must be provided.")
            @DefaultValue("vault")
            String username,

            char[] password,

            @Min(value = 1, message = "Connection pool size (vault.datasource.pool-size) must be at least 1.")
            @DefaultValue("20")
            int poolSize,

            @Min(0)
            @DefaultValue("2")
            int minimumIdle,

            @NotNull
            @DefaultValue("5s")
            Duration connectionTimeout,

            @NotNull
            @DefaultValue("10s")
            Duration queryTimeout,

            @DefaultValue("true")
            boolean initializeSchema
    ) {
        public String jdbcUrl() {
            if (StringUtils.hasText(url)) {
                return url;
            }
            return "jdbc:postgresql://" + host + ":" + port + "/" + database;
        }

        @AssertTrue(message = "Either vault.datasource.url or vault.datasource.host and vault.datasource.database must be provided.")
        public boolean isLocationValid() {
            return StringUtils.hasText(url) || (StringUtils.hasText(host) && StringUtils.hasText(database));
        }

        @AssertTrue(message = "vault.datasource.minimum-idle cannot exceed vault.datasource.pool-size.")
        public boolean isMinimumIdleValid() {
            return minimumIdle <= poolSize;
        }

        @AssertTrue(message = "vault.datasource.connection-timeout must be at least 250ms.")
        public boolean isConnectionTimeoutValid() {
            return connectionTimeout == null || connectionTimeout.toMillis() >= 250;
        }

        @AssertTrue(message = "vault.datasource.query-timeout must be at least one second.")
        public boolean isQueryTimeoutValid() {
            return queryTimeout == null || queryTimeout.getSeconds() >= 1;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DataSourceProperties that = (DataSourceProperties) o;
            return port == that.port &&
                    poolSize == that.poolSize &&
                    minimumIdle == that.minimumIdle &&
                    initializeSchema == that.initializeSchema &&
                    Objects.equals(url, that.url) &&
                    Objects.equals(host, that.host) &&
                    Objects.equals(database, that.database) &&
                    Objects.equals(username, that.username) &&
                    Arrays.equals(password, that.password) &&
                    Objects.equals(connectionTimeout, that.connectionTimeout) &&
                    Objects.equals(queryTimeout, that.queryTimeout);
        }

        @Override
        public int hashCode() {
            int result = Objects.hash(url, host, port, database, username, poolSize, minimumIdle,
                    connectionTimeout, queryTimeout, initializeSchema);
            result = 31 * result + Arrays.hashCode(password);
            return result;
        }

        @Override
        public String toString() {
            // Avoid logging the password in toString()
            return "DataSourceProperties[" +
                    "jdbcUrl='" + jdbcUrl() + '\'' +
                    ", username='" + username + '\'' +
                    ", password=******" +
                    ", poolSize=" + poolSize +
                    ", minimumIdle=" + minimumIdle +
                    ", connectionTimeout=" + connectionTimeout +
                    ", queryTimeout=" + queryTimeout +
                    ", initializeSchema=" + initializeSchema +
                    ']';
        }
    }

    // --- CacheProperties ---
    @Validated
    public record CacheProperties(
            @NotNull
            @DefaultValue("5m")
            Duration ttl,

            @Min(value = 1, message = "Cache size (vault.cache.max-size) must be at least 1.")
            @DefaultValue("100")
            long maxSize,

            @NotNull
            @DefaultValue("60s")
            Duration sweepInterval
    ) {
        @AssertTrue(message = "vault.cache.ttl and vault.cache.sweep-interval must be positive.")
        public boolean isDurationsPositive() {
            return ttl != null && sweepInterval != null && !ttl.isNegative() && !ttl.isZero()
                    && !sweepInterval.isNegative() && !sweepInterval.isZero();
        }
    }

    // --- AuditProperties ---
    @Validated
    public record AuditProperties(
            @Pattern(regexp = "slf4j|file", message = "Audit backend (vault.audit.backend) must be 'slf4j' or 'file'.")
            @DefaultValue("slf4j")
            String backend,

            // Read by logback-spring.xml
            @DefaultValue("logs/credential-vault-audit.log")
            String filePath
    ) {
        public static final String BACKEND_PROPERTY = "vault.audit.backend";
        public static final String FILE_PATH_PROPERTY = "vault.audit.file-path";
        public static final String BACKEND_SLF4J = "slf4j";
        public static final String BACKEND_FILE = "file";
    }

    // --- ProvidersProperties ---
    @Validated
    public record ProvidersProperties(
            @Valid
            @NotNull
            @DefaultValue
            AccountLookupProperties accountLookup
    ) {}

    /**
     * Optional lookup of the account behind a GitHub or GitLab token, stored as metadata.
     * Disabled by default since it sends the token to the provider.
     */
    @Validated
    public record AccountLookupProperties(
            boolean enabled,

            @NotNull
            @DefaultValue("5s")
            Duration timeout,

            @NotBlank
            @DefaultValue("https://api.github.com")
            String githubApiUrl,

            @NotBlank
            @DefaultValue("https://gitlab.com/api/v4")
            String gitlabApiUrl
    ) {}

    // --- HealthProperties ---
    @Validated
    public record HealthProperties(
            @NotNull
            @DefaultValue("90d")
            Duration rotationAge,

            @NotNull
            @DefaultValue({"github", "openai"})
            List<String> recommendedProviders
    ) {}

    // --- UsageProperties ---
    /**
     * Usage analytics: one event row per store or read, aggregated on request.
     */
    @Validated
    public record UsageProperties(
            @DefaultValue("true")
            boolean enabled,

            @NotNull
            @DefaultValue("30d")
            Duration period,

            @Min(1) @Max(100)
            @DefaultValue("5")
            int mostUsedLimit
    ) {
        @AssertTrue(message = "vault.usage.period must be between one day and one year.")
        public boolean isPeriodValid() {
            return period == null || (period.toDays() >= 1 && period.toDays() <= 365);
        }
    }
}
