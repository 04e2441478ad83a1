package org.opensds.anomaly.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;

import org.opensds.anomaly.util.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Checkpoints kept in one JSON document ({@code {"partition": offset}}), rewritten atomically on every store.
 */
public class FileCheckpointStore implements CheckpointStore {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final TypeReference<TreeMap<String, Long>> OFFSETS = new TypeReference<TreeMap<String, Long>>() {};

    private final Path path;
    private final TreeMap<String, Long> offsets;

    public FileCheckpointStore(Path path) {
        this.path = path;
        this.offsets = read(path);
        LOG.info("Checkpoint store at {} ({} partitions)", path, offsets.size());
    }

    private static TreeMap<String, Long> read(Path path) {
        if (!Files.exists(path)) {
            return new TreeMap<>();
        }
        try {
            TreeMap<String, Long> loaded = JsonSupport.MAPPER.readValue(path.toFile(), OFFSETS);
            return loaded == null ? new TreeMap<>() : loaded;
        } catch (IOException ex) {
            throw new CheckpointStoreException(null, "Failed to read checkpoint file " + path, ex);
        }
    }

    @Override
    public synchronized Long load(String partitionId) {
        return offsets.get(partitionId);
    }

    @Override
    public synchronized void store(String partitionId, long offset) {
        Long previous = offsets.get(partitionId);
        if (previous != null && offset < previous) {
            throw new CheckpointStoreException(partitionId,
                    "Refusing to move checkpoint of " + partitionId + " back from " + previous + " to " + offset, null);
        }
        TreeMap<String, Long> next = new TreeMap<>(offsets);
        next.put(partitionId, offset);
        try {
            JsonSupport.writeAtomically(path, next);
        } catch (IOException ex) {
            throw new CheckpointStoreException(partitionId, "Failed to write checkpoint file " + path, ex);
        }
        offsets.put(partitionId, offset);
    }

    public synchronized Map<String, Long> snapshot() {
        return new TreeMap<>(offsets);
    }
}
