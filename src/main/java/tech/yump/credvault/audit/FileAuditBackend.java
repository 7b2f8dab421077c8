package tech.yump.credvault.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.yump.credvault.provider.CredentialMasking;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes audit events as JSON lines to the dedicated audit logger, which
 * logback-spring.xml routes to its own rolling file.
 * <p>
 * The file outlives the process, so string values are scrubbed before writing: userinfo in
 * URLs (a repository URL with an embedded token) becomes {@code ***} and anything shaped
 * like a known provider token is masked.
 */
@Slf4j
@RequiredArgsConstructor
public class FileAuditBackend implements AuditBackend {

    public static final String AUDIT_LOGGER_NAME = "tech.yump.credvault.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    static final String REDACTED = "***";
    private static final Pattern URL_USERINFO = Pattern.compile("(?i)\\b([a-z][a-z0-9+.-]*://)[^/@\\s]+@");
    private static final Pattern PROVIDER_TOKEN = Pattern.compile(
            "\\b(?:gh[pousr]_|github_pat_|glpat-|sk-ant-|sk-)[A-Za-z0-9_-]{8,}");

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        AuditEvent redacted = redact(event);
        try {
            auditLogger.info(objectMapper.writeValueAsString(redacted));
        } catch (JsonProcessingException e) {
            // Keep the audit file pure JSON; report in the application log instead
            log.error("Failed to serialize AuditEvent to JSON for file audit logging. Action: {}", redacted.action(), e);
        }
    }

    static AuditEvent redact(AuditEvent event) {
        Map<String, Object> data = null;
        if (event.data() != null) {
            data = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : event.data().entrySet()) {
                Object value = entry.getValue();
                data.put(entry.getKey(), value instanceof String ? redact((String) value) : value);
            }
        }
        return new AuditEvent(event.timestamp(), event.type(), event.action(), event.outcome(), event.principal(),
                redact(event.errorMessage()), data);
    }

    static String redact(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String withoutUserInfo = URL_USERINFO.matcher(value).replaceAll("$1" + REDACTED + "@");
        Matcher tokens = PROVIDER_TOKEN.matcher(withoutUserInfo);
        StringBuilder result = new StringBuilder();
        while (tokens.find()) {
            tokens.appendReplacement(result, Matcher.quoteReplacement(CredentialMasking.mask(tokens.group())));
        }
        tokens.appendTail(result);
        return result.toString();
    }
}
