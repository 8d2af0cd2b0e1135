package io.tiergate.core.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit trail kept as one JSON array, rewritten through a sibling temp file on every append.
 * An unreadable trail is moved to {@code <name>.corrupt} and a new one is started.
 */
public final class FileAuditStore implements AuditStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAuditStore.class);
    private static final TypeReference<List<AuditEvent>> EVENT_LIST = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper json;

    public FileAuditStore(Path file) {
        this.file = file;
        this.json = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(AuditEvent event, int retain) throws IOException {
        List<AuditEvent> trail = new ArrayList<>(readTrail());
        trail.add(event);
        int overflow = trail.size() - Math.max(1, retain);
        if (overflow > 0) {
            trail = new ArrayList<>(trail.subList(overflow, trail.size()));
        }
        writeTrail(trail);
    }

    @Override
    public synchronized List<AuditEvent> events() throws IOException {
        return readTrail();
    }

    private List<AuditEvent> readTrail() throws IOException {
        if (Files.notExists(file)) {
            return List.of();
        }
        try {
            return json.readValue(Files.readString(file), EVENT_LIST);
        } catch (JsonProcessingException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt");
            LOG.warn("Audit trail {} is unreadable, moving it to {}: {}", file, aside, e.getOriginalMessage());
            Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            return List.of();
        }
    }

    private void writeTrail(List<AuditEvent> trail) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Path staging = file.resolveSibling(file.getFileName() + ".tmp");
        json.writerWithDefaultPrettyPrinter().writeValue(staging.toFile(), trail);
        Files.move(staging, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
