package org.opensds.anomaly.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.model.InboundMessage;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Replays a recorded data set, one message per line, as a single partition whose offsets are zero-based line
 * numbers. Blank lines and lines starting with {@code #} are skipped but keep their line number.
 */
public class FileReplayChannel implements IngestionChannel {
    private static final Logger LOG = LoggerFactory.getLogger(FileReplayChannel.class);
    static final int DEFAULT_BATCH_SIZE = 500;

    private final Path file;
    private final String topic;
    private final int batchSize;
    private final Function<String, Long> resumePositions;
    private BufferedReader reader;
    private long nextLine;
    private volatile boolean exhausted;
    private volatile boolean paused;

    public FileReplayChannel(Path file, Function<String, Long> resumePositions) {
        this(file, DEFAULT_BATCH_SIZE, resumePositions);
    }

    public FileReplayChannel(Path file, int batchSize, Function<String, Long> resumePositions) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.file = file;
        this.topic = file.getFileName().toString();
        this.batchSize = batchSize;
        this.resumePositions = resumePositions;
    }

    public String partitionId() {
        return InboundMessage.partitionId(topic, 0);
    }

    @Override
    public List<InboundMessage> poll(Duration timeout) {
        if (exhausted || paused) {
            return Collections.emptyList();
        }
        List<InboundMessage> batch = new ArrayList<>();
        try {
            if (reader == null) {
                open();
            }
            while (batch.size() < batchSize) {
                String line = reader.readLine();
                if (line == null) {
                    exhausted = true;
                    LOG.info("Replay of {} finished after {} lines", file, nextLine);
                    break;
                }
                long offset = nextLine++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                InboundMessage message = new InboundMessage(topic, 0, offset, line.getBytes(StandardCharsets.UTF_8));
                message.recordTimestamp = System.currentTimeMillis();
                batch.add(message);
            }
        } catch (IOException ex) {
            throw new ChannelException("Reading " + file + " failed at line " + nextLine, ex);
        }
        return batch;
    }

    private void open() throws IOException {
        reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        Long resumeFrom = resumePositions.apply(partitionId());
        if (resumeFrom == null) {
            LOG.info("Replaying {} from the first line", file);
            return;
        }
        while (nextLine < resumeFrom && reader.readLine() != null) {
            nextLine++;
        }
        LOG.info("Replaying {} from line {} (checkpoint)", file, nextLine);
    }

    @Override
    public void ackSafeToResumeFrom(String partitionId, long offset) {
        LOG.debug("Replay {} safe to resume from line {}", partitionId, offset);
    }

    @Override
    public void pause(String partitionId) {
        if (partitionId().equals(partitionId)) {
            paused = true;
            LOG.warn("Paused replay of {}", file);
        }
    }

    @Override
    public void wakeup() {
        // poll never blocks
    }

    @Override
    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public void close() {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (IOException ex) {
            LOG.warn("Closing {} failed: {}", file, ex.getMessage());
        }
    }
}
