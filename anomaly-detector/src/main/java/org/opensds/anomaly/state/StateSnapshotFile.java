package org.opensds.anomaly.state;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;

import org.opensds.anomaly.util.JsonSupport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Optional durable copy of the state store, written as one JSON document.
 *
 * <p>Only confirmed state is written (see {@link StreamState}): a record past the persisted checkpoint is
 * redelivered after a restart, so its effect must not be in the snapshot already.</p>
 */
public class StateSnapshotFile {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(StateSnapshotFile.class);
    private static final TypeReference<List<Entry>> ENTRY_LIST = new TypeReference<List<Entry>>() {};

    private final Path path;

    public StateSnapshotFile(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public synchronized void save(StreamStateStore store) throws IOException {
        List<Entry> entries = new ArrayList<>();
        for (ConfirmedState state : store.confirmedEntries()) {
            Entry entry = new Entry();
            entry.metricId = state.metricId;
            entry.detector = state.detectorName;
            entry.evaluations = state.evaluations;
            entry.state = state.value;
            entries.add(entry);
        }
        JsonSupport.writeAtomically(path, entries);
        LOG.debug("Saved {} stream states to {}", entries.size(), path);
    }

    /**
     * @return number of restored entries, 0 when no snapshot exists yet
     */
    public synchronized int restoreInto(StreamStateStore store) throws IOException {
        if (!Files.exists(path)) {
            LOG.info("No state snapshot at {}, starting with empty state", path);
            return 0;
        }
        List<Entry> entries = JsonSupport.MAPPER.readValue(path.toFile(), ENTRY_LIST);
        int restored = 0;
        for (Entry entry : entries) {
            if (entry.metricId == null || entry.detector == null || entry.state == null) {
                continue;
            }
            store.restore(entry.metricId, entry.detector, entry.state, entry.evaluations);
            restored++;
        }
        LOG.info("Restored {} stream states from {}", restored, path);
        return restored;
    }

    static class Entry {
        @JsonProperty("metric_id")
        public String metricId;
        @JsonProperty("detector")
        public String detector;
        @JsonProperty("evaluations")
        public long evaluations;
        @JsonProperty("state")
        public DetectorState state;
    }
}
