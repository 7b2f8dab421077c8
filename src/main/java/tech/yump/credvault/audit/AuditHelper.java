package tech.yump.credvault.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Builds audit events and hands them to the configured {@link AuditBackend}.
 * Audit is fire-and-forget: a failing backend is logged and never fails the operation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    static final String SYSTEM_PRINCIPAL = "system";

    private final AuditBackend auditBackend;
    private final Clock clock;

    /**
     * Logs an audit event for a vault operation.
     *
     * @param type      The type of event (e.g., "credential_operation", "project_operation").
     * @param action    The specific action performed (e.g., "credential.store").
     * @param outcome   The result ("success" or "failure").
     * @param principal Tenant the operation ran for; falls back to "system".
     * @param data      Optional map containing context-specific data. Must not contain secrets.
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {
        logEventInternal(type, action, outcome, principal, null, data);
    }

    /**
     * Logs a failed operation with the error message shown to the caller.
     */
    public void logFailureEvent(
            String type,
            String action,
            @Nullable String principal,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        logEventInternal(type, action, OUTCOME_FAILURE, principal, errorMessage, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(clock.instant())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .principal(Optional.ofNullable(principal).orElse(SYSTEM_PRINCIPAL))
                    .errorMessage(errorMessage)
                    .data(data != null && !data.isEmpty() ? data : null) // Ensure null if empty
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }
}
