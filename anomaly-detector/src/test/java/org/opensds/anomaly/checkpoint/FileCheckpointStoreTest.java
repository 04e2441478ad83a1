package org.opensds.anomaly.checkpoint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileCheckpointStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void offsetsSurviveReopen() {
        Path file = tempDir.resolve("checkpoints.json");
        FileCheckpointStore store = new FileCheckpointStore(file);
        store.store("storage_metrics-0", 17L);
        store.store("storage_metrics-1", 3L);

        FileCheckpointStore reopened = new FileCheckpointStore(file);

        assertEquals(17L, reopened.load("storage_metrics-0"));
        assertEquals(3L, reopened.load("storage_metrics-1"));
        assertNull(reopened.load("storage_metrics-2"));
        assertEquals(2, reopened.snapshot().size());
    }

    @Test
    void regressionIsRefused() {
        FileCheckpointStore store = new FileCheckpointStore(tempDir.resolve("checkpoints.json"));
        store.store("storage_metrics-0", 17L);

        CheckpointStoreException ex = assertThrows(CheckpointStoreException.class,
                () -> store.store("storage_metrics-0", 16L));
        assertEquals("storage_metrics-0", ex.partitionId());
        assertEquals(17L, store.load("storage_metrics-0"));
    }

    @Test
    void unwritableLocationFails() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.write(blocker, "not a directory".getBytes(StandardCharsets.UTF_8));
        FileCheckpointStore store = new FileCheckpointStore(blocker.resolve("checkpoints.json"));

        assertThrows(CheckpointStoreException.class, () -> store.store("storage_metrics-0", 1L));
        assertNull(store.load("storage_metrics-0"));
    }
}
