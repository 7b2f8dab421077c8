package tech.yump.credvault.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataSourceConfig {

    static final String SCHEMA_LOCATION = "schema/credentials.sql";
    private static final String POOL_NAME = "CredentialVaultPool";

    private final VaultProperties vaultProperties;

    @Bean
    @Primary
    public DataSource dataSource() {
        log.info("Manually configuring primary Hikari DataSource...");
        VaultProperties.DataSourceProperties db = vaultProperties.datasource();

        char[] password = db.password();
        if (password == null || password.length == 0) {
            if (vaultProperties.productionMode()) {
                log.error("Database password (vault.datasource.password / CREDENTIAL_DB_PASSWORD) is empty in production mode.");
                throw new IllegalStateException("Database password cannot be empty in production mode.");
            }
            log.warn("Database password is empty. Relying on trust or peer authentication.");
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(db.jdbcUrl());
        config.setUsername(db.username());
        if (password != null && password.length > 0) {
            // HikariConfig has no char[] setter
            config.setPassword(new String(password));
        }
        config.setDriverClassName("org.postgresql.Driver");
        config.setPoolName(POOL_NAME);
        config.setMaximumPoolSize(db.poolSize());
        config.setMinimumIdle(db.minimumIdle());
        config.setConnectionTimeout(db.connectionTimeout().toMillis());

        log.info("Creating HikariDataSource for URL: {}, User: {}, Pool size: {}",
                config.getJdbcUrl(), config.getUsername(), config.getMaximumPoolSize());
        try {
            HikariDataSource dataSource = new HikariDataSource(config);
            log.info("HikariDataSource configured successfully.");
            return dataSource;
        } catch (RuntimeException e) {
            log.error("Failed to configure primary DataSource: {}", e.getMessage());
            throw new IllegalStateException("Failed to configure primary DataSource", e);
        }
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) vaultProperties.datasource().queryTimeout().getSeconds());
        return jdbcTemplate;
    }

    @Bean
    @ConditionalOnProperty(name = "vault.datasource.initialize-schema", havingValue = "true", matchIfMissing = true)
    public DataSourceInitializer credentialSchemaInitializer(DataSource dataSource) {
        log.info("Credential schema will be initialized from classpath:{}", SCHEMA_LOCATION);
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(populator);
        return initializer;
    }
}
