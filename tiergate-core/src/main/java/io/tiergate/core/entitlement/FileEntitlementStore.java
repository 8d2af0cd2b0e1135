package io.tiergate.core.entitlement;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * JSON document store. Every operation re-reads the file, mutates and atomically replaces it while holding
 * the instance monitor and an OS lock on a sibling {@code .lock} file. Processes sharing the file serialize
 * on that lock.
 */
public final class FileEntitlementStore implements EntitlementStore {
    private static final long LOCK_POLL_MS = 10;

    private final Path path;
    private final Path lockPath;
    private final EntitlementDefaults defaults;
    private final Duration lockTimeout;
    private final ObjectMapper mapper;

    public FileEntitlementStore(Path path, EntitlementDefaults defaults) {
        this(path, defaults, Duration.ofSeconds(5));
    }

    public FileEntitlementStore(Path path, EntitlementDefaults defaults, Duration lockTimeout) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.lockPath = path.resolveSibling(path.getFileName() + ".lock");
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.lockTimeout = lockTimeout == null ? Duration.ofSeconds(5) : lockTimeout;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public UserEntitlement get(String userId) throws IOException {
        return update(userId, UnaryOperator.identity()).after();
    }

    @Override
    public void save(UserEntitlement record) throws IOException {
        update(record.userId(), current -> record);
    }

    @Override
    public synchronized EntitlementChange update(String userId, UnaryOperator<UserEntitlement> mutation) throws IOException {
        String id = key(userId);
        try (FileChannel ignored = lock()) {
            EntitlementDocument document = load();
            UserEntitlement existing = document.users().get(id);
            UserEntitlement before = defaults.withConfiguredLimit(existing == null ? defaults.create(id) : existing);
            UserEntitlement after = mutation.apply(before).settledAgainst(before);
            if (!after.equals(existing)) {
                write(document.withUser(after));
            }
            return new EntitlementChange(before, after);
        }
    }

    /**
     * Ledger entry and granted record go out in the same document rewrite.
     */
    @Override
    public synchronized Optional<EntitlementChange> applyPayment(
        String userId,
        String paymentId,
        UnaryOperator<UserEntitlement> grant
    ) throws IOException {
        String id = key(userId);
        try (FileChannel ignored = lock()) {
            EntitlementDocument document = load();
            if (document.processedPayments().containsKey(paymentId)) {
                return Optional.empty();
            }
            UserEntitlement existing = document.users().get(id);
            UserEntitlement before = defaults.withConfiguredLimit(existing == null ? defaults.create(id) : existing);
            UserEntitlement after = grant.apply(before).settledAgainst(before).withPayment(paymentId, defaults.now());
            Map<String, String> payments = new LinkedHashMap<>(document.processedPayments());
            payments.put(paymentId, id);
            write(new EntitlementDocument(document.users(), payments).withUser(after));
            return Optional.of(new EntitlementChange(before, after));
        }
    }

    @Override
    public synchronized List<String> userIds() throws IOException {
        try (FileChannel ignored = lock()) {
            List<String> ids = new ArrayList<>(load().users().keySet());
            ids.sort(String::compareTo);
            return ids;
        }
    }

    private EntitlementDocument load() throws IOException {
        if (!Files.exists(path)) {
            return EntitlementDocument.empty();
        }
        return mapper.readValue(Files.readString(path), EntitlementDocument.class);
    }

    private void write(EntitlementDocument document) throws IOException {
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private FileChannel lock() throws IOException {
        Files.createDirectories(path.toAbsolutePath().getParent());
        FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        long deadline = System.nanoTime() + lockTimeout.toNanos();
        try {
            while (true) {
                FileLock lock = tryLock(channel);
                if (lock != null) {
                    // released when the channel closes
                    return channel;
                }
                if (System.nanoTime() >= deadline) {
                    throw new TransientStoreException("Timed out waiting for entitlement file lock " + lockPath);
                }
                Thread.sleep(LOCK_POLL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channel.close();
            throw new TransientStoreException("Interrupted waiting for entitlement file lock", e);
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }

    private static FileLock tryLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // another store instance in this JVM holds it
            return null;
        }
    }

    private static String key(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return userId.trim();
    }

    public record EntitlementDocument(Map<String, UserEntitlement> users, Map<String, String> processedPayments) {

        public EntitlementDocument {
            users = users == null ? Map.of() : users;
            processedPayments = processedPayments == null ? Map.of() : processedPayments;
        }

        static EntitlementDocument empty() {
            return new EntitlementDocument(Map.of(), Map.of());
        }

        EntitlementDocument withUser(UserEntitlement record) {
            Map<String, UserEntitlement> updated = new LinkedHashMap<>(users);
            updated.put(record.userId(), record);
            return new EntitlementDocument(updated, processedPayments);
        }
    }
}
