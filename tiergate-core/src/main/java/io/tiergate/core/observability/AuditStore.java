package io.tiergate.core.observability;

import java.io.IOException;
import java.util.List;

/**
 * Append-only event log. Implementations keep at most {@code retain} of the newest events.
 */
public interface AuditStore {
    void append(AuditEvent event, int retain) throws IOException;

    List<AuditEvent> events() throws IOException;
}
