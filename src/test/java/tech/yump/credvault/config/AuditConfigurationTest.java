package tech.yump.credvault.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tech.yump.credvault.audit.AuditBackend;
import tech.yump.credvault.audit.FileAuditBackend;
import tech.yump.credvault.audit.LogAuditBackend;

import static org.assertj.core.api.Assertions.assertThat;

class AuditConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withUserConfiguration(AuditConfiguration.class);

    @Test
    @DisplayName("Defaults to the SLF4J backend when no backend is configured")
    void noBackend_Slf4j() {
        contextRunner.run(context -> assertThat(context)
                .hasSingleBean(AuditBackend.class)
                .getBean(AuditBackend.class).isInstanceOf(LogAuditBackend.class));
    }

    @Test
    @DisplayName("Selects the file backend when configured")
    void fileBackend() {
        contextRunner
                .withPropertyValues("vault.audit.backend=file")
                .run(context -> assertThat(context)
                        .hasSingleBean(AuditBackend.class)
                        .getBean(AuditBackend.class).isInstanceOf(FileAuditBackend.class));
    }
}
