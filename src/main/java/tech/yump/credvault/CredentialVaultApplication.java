package tech.yump.credvault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import tech.yump.credvault.config.VaultProperties;

@Slf4j
@SpringBootApplication(
        exclude = { DataSourceAutoConfiguration.class }
)
@EnableConfigurationProperties(VaultProperties.class)
public class CredentialVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredentialVaultApplication.class, args);
        log.info(">>> Credential Vault Application Started <<<");
    }
}
