package org.opensds.anomaly.engine;

/**
 * Receives failures that put durability at risk. Called from the engine's poll thread after the affected
 * partition has been paused and halted.
 */
@FunctionalInterface
public interface FatalErrorHandler {
    void onFatal(String partitionId, Throwable cause);
}
