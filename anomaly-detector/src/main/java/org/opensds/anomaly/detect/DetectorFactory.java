package org.opensds.anomaly.detect;

/**
 * Creates detector instances for a registry binding. New algorithms plug in by registering a factory.
 */
@FunctionalInterface
public interface DetectorFactory {
    Detector create();
}
