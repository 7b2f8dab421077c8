package tech.yump.credvault.support;

import tech.yump.credvault.audit.AuditBackend;
import tech.yump.credvault.audit.AuditEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingAuditBackend implements AuditBackend {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void logEvent(AuditEvent event) {
        events.add(event);
    }

    public List<AuditEvent> events() {
        return List.copyOf(events);
    }

    public List<AuditEvent> eventsFor(String action) {
        return events.stream().filter(e -> action.equals(e.action())).toList();
    }
}
