package tech.yump.credvault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.credvault.audit.AuditBackend;
import tech.yump.credvault.audit.FileAuditBackend;
import tech.yump.credvault.audit.LogAuditBackend;

@Configuration
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    public AuditConfiguration(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Bean
    @ConditionalOnProperty(name = VaultProperties.AuditProperties.BACKEND_PROPERTY,
            havingValue = VaultProperties.AuditProperties.BACKEND_SLF4J, matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = VaultProperties.AuditProperties.BACKEND_PROPERTY,
            havingValue = VaultProperties.AuditProperties.BACKEND_FILE)
    public AuditBackend fileAuditBackend() {
        log.info("Configuring File Audit Backend. Ensure Logback is configured correctly for logger '{}' and path property '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, VaultProperties.AuditProperties.FILE_PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }
}
