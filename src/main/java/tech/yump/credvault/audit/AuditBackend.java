package tech.yump.credvault.audit;

/**
 * Interface for audit logging backends.
 */
public interface AuditBackend {

    /**
     * Logs a given audit event.
     * Implementations determine *how* the event is recorded (console, dedicated file).
     *
     * @param event The AuditEvent to log.
     */
    void logEvent(AuditEvent event);

}
