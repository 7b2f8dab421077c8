package tech.yump.credvault.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit events as JSON through this class's SLF4J logger at INFO level,
 * interleaved with the application log.
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    static final String PREFIX = "AUDIT_EVENT: ";

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            log.info(PREFIX + "{}", objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize AuditEvent to JSON. Logging raw event details.", e);
            log.info("AUDIT_EVENT_FALLBACK: {}", event);
        }
    }
}
