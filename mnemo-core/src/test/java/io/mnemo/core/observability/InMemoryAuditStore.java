package io.mnemo.core.observability;

import java.util.ArrayList;
import java.util.List;

public final class InMemoryAuditStore implements AuditStore {
    private final List<AuditEvent> events = new ArrayList<>();

    @Override
    public synchronized void append(AuditEvent event) {
        events.add(event);
    }

    @Override
    public synchronized List<AuditEvent> load() {
        return List.copyOf(events);
    }
}
