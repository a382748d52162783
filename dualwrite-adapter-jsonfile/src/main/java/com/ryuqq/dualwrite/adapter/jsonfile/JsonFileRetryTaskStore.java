package com.ryuqq.dualwrite.adapter.jsonfile;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.dualwrite.core.model.EntityRef;
import com.ryuqq.dualwrite.core.model.EntityType;
import com.ryuqq.dualwrite.core.model.OperationId;
import com.ryuqq.dualwrite.core.retry.RetryTask;
import com.ryuqq.dualwrite.core.retry.RetryTaskState;
import com.ryuqq.dualwrite.core.spi.RetryTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * File-backed {@link RetryTaskStore} that survives process restarts.
 *
 * <p>Every mutation rewrites a JSON snapshot of all pending tasks: the snapshot is
 * written to a temporary file in the same directory and moved over the target
 * atomically, so a crash leaves either the old or the new snapshot, never a torn one.
 * On construction the snapshot is loaded and sequence allocation resumes after the
 * highest sequence ever handed out.</p>
 *
 * <p><strong>File Format:</strong></p>
 * <pre>
 * {
 *   "lastSequence": 42,
 *   "tasks": [
 *     {"operationId": "...", "entityType": "cart", "entityKey": "u123", "kind": "UPDATE",
 *      "payload": {...}, "sequence": 41, "attemptCount": 2, "nextAttemptAt": 1700000000000, ...}
 *   ]
 * }
 * </pre>
 *
 * <p><strong>Payload Fidelity:</strong> floating point values are read back as
 * {@link java.math.BigDecimal} and {@code java.time} values are written as ISO-8601
 * strings. The sync validator normalizes both forms, so a replayed task compares
 * equal to the original write.</p>
 *
 * <p><strong>Scale:</strong> suited to retry backlogs of thousands of tasks. All
 * methods are synchronized on the store; the retry queue is not a hot path.</p>
 *
 * @author Dual-Write Team
 * @since 1.0.0
 */
public class JsonFileRetryTaskStore implements RetryTaskStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRetryTaskStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<OperationId, RetryTask> tasks = new LinkedHashMap<>();
    private long lastSequence;

    /**
     * Opens the store, loading the snapshot if the file exists.
     *
     * @param file snapshot file (parent directories are created)
     * @throws IllegalArgumentException if file is null
     * @throws UncheckedIOException if the snapshot cannot be read
     */
    public JsonFileRetryTaskStore(Path file) {
        this(file, defaultMapper());
    }

    /**
     * Opens the store with a caller-provided mapper.
     *
     * @param file snapshot file
     * @param mapper Jackson mapper
     */
    public JsonFileRetryTaskStore(Path file, ObjectMapper mapper) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.file = file.toAbsolutePath().normalize();
        this.mapper = mapper;
        load();
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public synchronized long nextSequence() {
        lastSequence++;
        flush();
        return lastSequence;
    }

    @Override
    public synchronized void save(RetryTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (task.state() != RetryTaskState.PENDING) {
            throw new IllegalArgumentException("Only PENDING tasks can be stored (current: " + task.state() + ")");
        }
        RetryTask previous = tasks.put(task.operationId(), task);
        lastSequence = Math.max(lastSequence, task.sequence());
        try {
            flush();
        } catch (UncheckedIOException e) {
            if (previous == null) {
                tasks.remove(task.operationId());
            } else {
                tasks.put(task.operationId(), previous);
            }
            throw e;
        }
    }

    @Override
    public synchronized boolean remove(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        RetryTask removed = tasks.remove(operationId);
        if (removed == null) {
            return false;
        }
        try {
            flush();
        } catch (UncheckedIOException e) {
            tasks.put(operationId, removed);
            throw e;
        }
        return true;
    }

    @Override
    public synchronized Optional<RetryTask> find(OperationId operationId) {
        if (operationId == null) {
            throw new IllegalArgumentException("operationId cannot be null");
        }
        return Optional.ofNullable(tasks.get(operationId));
    }

    @Override
    public synchronized List<RetryTask> findAllPending() {
        return tasks.values().stream().sorted(Comparator.comparingLong(RetryTask::sequence)).toList();
    }

    @Override
    public synchronized List<RetryTask> findByEntityType(EntityType entityType) {
        if (entityType == null) {
            throw new IllegalArgumentException("entityType cannot be null");
        }
        return tasks.values().stream()
            .filter(task -> task.ref().entityType().equals(entityType))
            .sorted(Comparator.comparingLong(RetryTask::sequence))
            .toList();
    }

    @Override
    public synchronized boolean hasPending(EntityRef ref) {
        if (ref == null) {
            throw new IllegalArgumentException("ref cannot be null");
        }
        return tasks.values().stream().anyMatch(task -> task.ref().equals(ref));
    }

    @Override
    public synchronized int size() {
        return tasks.size();
    }

    public Path getFile() {
        return file;
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("Retry task file {} not found, starting with an empty queue", file);
            return;
        }
        try {
            StoredRetryQueue stored = mapper.readValue(file.toFile(), StoredRetryQueue.class);
            for (StoredRetryTask storedTask : stored.tasks()) {
                RetryTask task = storedTask.toTask();
                tasks.put(task.operationId(), task);
                lastSequence = Math.max(lastSequence, task.sequence());
            }
            lastSequence = Math.max(lastSequence, stored.lastSequence());
            log.info("Loaded {} pending retry tasks from {} (lastSequence={})", tasks.size(), file, lastSequence);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read retry task file " + file, e);
        }
    }

    private void flush() {
        StoredRetryQueue snapshot = new StoredRetryQueue(
            lastSequence,
            tasks.values().stream().map(StoredRetryTask::from).toList()
        );
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try {
                Files.write(temp, mapper.writeValueAsBytes(snapshot));
                moveIntoPlace(temp);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write retry task file " + file, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
