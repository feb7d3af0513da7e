package io.mockdispatch.core.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mockdispatch.core.error.StoreException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Record store that keeps collections in memory and mirrors every write to a single JSON file
 * of the form {@code {"users": [...], "posts": [...]}}.
 *
 * <p>
 * Writes are serialized under one lock and the file is replaced via a temp file and a move, so
 * a crash never leaves a half-written document. When the file write fails the in-memory change
 * is rolled back and a {@link StoreException} is thrown.
 */
public final class FileRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileRecordStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final InMemoryRecordStore memory = new InMemoryRecordStore();
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * Opens the store, loading the file when it exists.
     *
     * @param file JSON document holding all collections
     * @throws StoreException if the existing file cannot be read or is not a JSON object
     */
    public FileRecordStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        load();
    }

    @Override
    public Optional<List<ObjectNode>> get(String resourceName) {
        return memory.get(resourceName);
    }

    @Override
    public boolean exists(String resourceName) {
        return memory.exists(resourceName);
    }

    @Override
    public void replace(String resourceName, List<ObjectNode> records) {
        writeLock.lock();
        try {
            Optional<List<ObjectNode>> previous = memory.get(resourceName);
            memory.replace(resourceName, records);
            persistOrRollback(resourceName, previous);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public <T> T update(String resourceName, CollectionMutation<T> mutation) {
        writeLock.lock();
        try {
            Optional<List<ObjectNode>> previous = memory.get(resourceName);
            T result = memory.update(resourceName, mutation);
            persistOrRollback(resourceName, previous);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean clear(String resourceName) {
        writeLock.lock();
        try {
            Optional<List<ObjectNode>> previous = memory.get(resourceName);
            boolean removed = memory.clear(resourceName);
            if (removed) {
                persistOrRollback(resourceName, previous);
            }
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Set<String> resourceNames() {
        return memory.resourceNames();
    }

    /** Location of the backing document. */
    public Path file() {
        return file;
    }

    private void load() {
        if (!Files.exists(file)) {
            LOG.info("Record store file {} does not exist yet, starting empty", file);
            return;
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new StoreException("Failed to read record store file: " + file, null, e);
        }
        if (root == null || root.isMissingNode()) {
            return;
        }
        if (!root.isObject()) {
            throw new StoreException("Record store file must hold a JSON object: " + file, null, null);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            List<ObjectNode> records = new ArrayList<>();
            for (JsonNode record : entry.getValue()) {
                if (record.isObject()) {
                    records.add((ObjectNode) record);
                }
            }
            memory.replace(entry.getKey(), records);
        }
        LOG.info("Record store loaded from {}: {} collections", file, memory.resourceNames().size());
    }

    private void persistOrRollback(String resourceName, Optional<List<ObjectNode>> previous) {
        try {
            persist();
        } catch (IOException e) {
            if (previous.isPresent()) {
                memory.replace(resourceName, previous.get());
            } else {
                memory.clear(resourceName);
            }
            throw new StoreException("Failed to write record store file: " + file, resourceName, e);
        }
    }

    private void persist() throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        memory.snapshot().forEach((name, records) -> root.putArray(name).addAll(records));

        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            MAPPER.writeValue(temp.toFile(), root);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
