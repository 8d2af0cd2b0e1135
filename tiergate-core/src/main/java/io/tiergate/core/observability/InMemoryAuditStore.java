package io.tiergate.core.observability;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public final class InMemoryAuditStore implements AuditStore {
    private final Deque<AuditEvent> events = new ArrayDeque<>();

    @Override
    public synchronized void append(AuditEvent event, int retain) {
        events.addLast(event);
        while (events.size() > Math.max(1, retain)) {
            events.removeFirst();
        }
    }

    @Override
    public synchronized List<AuditEvent> events() {
        return List.copyOf(events);
    }
}
