package pulsestream.persist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pulsestream.domain.BiometricEvent;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Buffers delivered biometric events and appends them in batches to a JSON array file.
 * <p>
 * Every write goes to {@code <file>.tmp} first and is then moved over the target, so a reader always
 * sees a complete array. A failed write keeps the buffered records for the next flush.
 */
public class BatchedPersister implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BatchedPersister.class);
    public static final int DEFAULT_BATCH_SIZE = 10;

    private final Path target;
    private final Path tempFile;
    private final int batchSize;
    private final ObjectMapper objectMapper;
    private final Object bufferLock = new Object();

    // Guarded by bufferLock
    private final List<JsonNode> buffer = new ArrayList<>();
    private long totalFlushed;

    public BatchedPersister(Path target) {
        this(target, DEFAULT_BATCH_SIZE);
    }

    public BatchedPersister(Path target, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.target = Objects.requireNonNull(target, "target cannot be null").toAbsolutePath();
        this.tempFile = this.target.resolveSibling(this.target.getFileName() + ".tmp");
        this.batchSize = batchSize;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Buffer one event, flushing once the batch is full. Control events are ignored.
     *
     * @return true if the event was buffered
     */
    public boolean accept(BiometricEvent event) {
        if (event == null || !event.eventType().isBiometric()) {
            return false;
        }
        int size;
        synchronized (bufferLock) {
            buffer.add(event.toJsonNode());
            size = buffer.size();
            if (size >= batchSize) {
                flushLocked();
            }
        }
        logger.debug("Buffered {} event (buffer: {})", event.eventType().wireName(), size);
        return true;
    }

    /**
     * Write every buffered record now.
     *
     * @return true if nothing was pending or the write succeeded
     */
    public boolean flush() {
        synchronized (bufferLock) {
            return flushLocked();
        }
    }

    /**
     * Final flush of a partial batch, emptying the in-memory buffer.
     *
     * @return true if the buffered records were written
     */
    public boolean clear() {
        return flush();
    }

    /**
     * Drop the buffer and replace the file with an empty array.
     */
    public void reset() throws IOException {
        synchronized (bufferLock) {
            buffer.clear();
            writeAtomically(objectMapper.createArrayNode());
            logger.info("Cleared persisted buffer {}", target);
        }
    }

    /**
     * Read every persisted record. A missing file reads as empty.
     *
     * @throws IOException if the file exists but cannot be read as a JSON array
     */
    public List<JsonNode> readAll() throws IOException {
        if (!Files.exists(target)) {
            return List.of();
        }
        JsonNode root = objectMapper.readTree(target.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("Persisted buffer " + target + " is not a JSON array");
        }
        List<JsonNode> records = new ArrayList<>(root.size());
        root.forEach(records::add);
        return records;
    }

    public int pending() {
        synchronized (bufferLock) {
            return buffer.size();
        }
    }

    public long getTotalFlushed() {
        synchronized (bufferLock) {
            return totalFlushed;
        }
    }

    public Path getTarget() {
        return target;
    }

    @Override
    public void close() {
        clear();
    }

    private boolean flushLocked() {
        if (buffer.isEmpty()) {
            return true;
        }
        try {
            ArrayNode records = loadExisting();
            buffer.forEach(records::add);
            writeAtomically(records);
            totalFlushed += buffer.size();
            logger.info("Flushed {} records to {} (total: {})", buffer.size(), target, records.size());
            buffer.clear();
            return true;
        } catch (IOException e) {
            logger.error("Failed to flush {} records to {}, keeping them for the next flush",
                    buffer.size(), target, e);
            return false;
        }
    }

    private ArrayNode loadExisting() {
        if (!Files.exists(target)) {
            return objectMapper.createArrayNode();
        }
        try {
            JsonNode root = objectMapper.readTree(target.toFile());
            if (root instanceof ArrayNode) {
                return (ArrayNode) root;
            }
            logger.warn("Persisted buffer {} is not a JSON array, resetting it", target);
        } catch (IOException e) {
            logger.warn("Persisted buffer {} is corrupted, resetting it: {}", target, e.getMessage());
        }
        return objectMapper.createArrayNode();
    }

    private void writeAtomically(ArrayNode records) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            objectMapper.writeValue(tempFile.toFile(), records);
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.warn("Atomic move not supported for {}, falling back to replace", target);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
