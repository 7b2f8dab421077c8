package tech.yump.credvault.audit;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogAuditBackendTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final LogAuditBackend backend = new LogAuditBackend(objectMapper);

    private ListAppender<ILoggingEvent> listAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(LogAuditBackend.class);
        listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(listAppender);
        listAppender.stop();
    }

    @Test
    @DisplayName("logEvent: Should write one prefixed JSON line without null fields")
    void logEvent_WritesJson() {
        AuditEvent event = AuditEvent.builder()
                .timestamp(Instant.parse("2024-01-15T10:00:00Z"))
                .type("credential_operation")
                .action("credential.delete")
                .outcome("success")
                .principal("alice")
                .data(Map.of("provider", "github"))
                .build();

        backend.logEvent(event);

        assertThat(listAppender.list).singleElement().satisfies(line -> {
            assertThat(line.getFormattedMessage())
                    .startsWith(LogAuditBackend.PREFIX)
                    .contains("\"action\":\"credential.delete\"")
                    .contains("\"principal\":\"alice\"")
                    .contains("\"provider\":\"github\"")
                    .doesNotContain("errorMessage");
        });
    }

    @Test
    @DisplayName("logEvent: Should ignore null events")
    void logEvent_Null() {
        backend.logEvent(null);

        assertThat(listAppender.list)
                .noneMatch(line -> line.getFormattedMessage().startsWith(LogAuditBackend.PREFIX));
    }
}
