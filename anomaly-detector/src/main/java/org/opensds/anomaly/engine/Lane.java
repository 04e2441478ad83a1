package org.opensds.anomaly.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.opensds.anomaly.model.MetricRecord;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.function.Consumer;

/**
 * Serialized execution context: one thread draining a bounded queue in FIFO order. Every record of a metric is
 * routed to the same lane, which gives per-metric ordering. A full queue blocks the submitter.
 */
final class Lane {
    private static final Logger LOG = LoggerFactory.getLogger(Lane.class);
    private static final Item STOP = new Item(null);

    private final int index;
    private final BlockingQueue<Item> queue;
    private final Consumer<MetricRecord> processor;
    private final Thread thread;

    Lane(int index, int capacity, Consumer<MetricRecord> processor) {
        this.index = index;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.processor = processor;
        this.thread = new Thread(this::drain, "anomaly-lane-" + index);
    }

    void start() {
        thread.start();
    }

    /**
     * Enqueues a record, waiting while the lane is full.
     */
    void submit(MetricRecord record) throws InterruptedException {
        queue.put(new Item(record));
    }

    /**
     * Lets the lane finish everything already queued, then stops it.
     */
    void stop() throws InterruptedException {
        queue.put(STOP);
    }

    void join() throws InterruptedException {
        thread.join();
    }

    void interrupt() {
        thread.interrupt();
    }

    boolean isAlive() {
        return thread.isAlive();
    }

    int backlog() {
        return queue.size();
    }

    private void drain() {
        LOG.debug("Lane {} started", index);
        while (true) {
            Item item;
            try {
                item = queue.take();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOG.warn("Lane {} interrupted with {} queued records", index, queue.size());
                return;
            }
            if (item == STOP) {
                LOG.debug("Lane {} stopped", index);
                return;
            }
            processor.accept(item.record);
        }
    }

    private static final class Item {
        final MetricRecord record;

        Item(MetricRecord record) {
            this.record = record;
        }
    }
}
