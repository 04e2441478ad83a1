package org.opensds.anomaly.detect;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.opensds.anomaly.model.MetricRecord;
import org.opensds.anomaly.util.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DetectorCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private static MetricRecord record(String metricId, String metric) {
        return new MetricRecord(metricId, 1L, 1.0, Map.of("metric", metric), "p-0", 0L);
    }

    @Test
    void bundledCatalogLoads() throws Exception {
        DetectorCatalog catalog = DetectorCatalogLoader.load(null);

        assertEquals("1", catalog.version());
        assertEquals(3, catalog.size());
        DetectorRegistry registry = catalog.toRegistry("threshold");
        assertEquals("capacity_bounds", registry.resolve(record("pool-a/capacity_used_pct", "capacity_used_pct")).name());
        assertEquals("gaussian", registry.resolve(record("vol-01/latency_ms", "latency_ms")).name());
        assertEquals("threshold", registry.resolve(record("vol-01/iops", "iops")).name());
        assertEquals("threshold", registry.resolve(record("host-1/temperature", "temperature")).name());
    }

    @Test
    void fileCatalogWithMetricBindings() throws Exception {
        Path file = tempDir.resolve("catalog.json");
        Files.write(file, ("{\"catalog_version\":\"test-2\","
                + "\"detectors\":[{\"name\":\"tight\",\"type\":\"threshold\",\"params\":{\"sigma\":1.5}},"
                + "{\"name\":\"limits\",\"type\":\"bounds\",\"params\":{\"lower\":\"0\",\"upper\":\"1\",\"severity\":\"critical\"}}],"
                + "\"metrics\":{\"vol-09/iops\":\"limits\"}}").getBytes(StandardCharsets.UTF_8));

        DetectorCatalog catalog = DetectorCatalogLoader.load(file.toString());
        DetectorRegistry registry = catalog.toRegistry("tight");

        assertEquals("test-2", catalog.version());
        assertEquals("limits", registry.resolve("vol-09/iops").name());
        assertEquals("tight", registry.resolve("vol-01/iops").name());
    }

    @Test
    void blankDefaultLeavesRegistryWithoutDefault() {
        DetectorRegistry registry = DetectorCatalogLoader.load(null).toRegistry("");

        assertFalse(registry.hasDefault());
        assertThrows(NoDetectorAvailableException.class, () -> registry.resolve("host-1/temperature"));
    }

    @Test
    void undefinedDetectorReferenceFails() throws Exception {
        DetectorCatalog catalog = DetectorCatalogLoader.parseCatalog(JsonSupport.MAPPER.readTree(
                "{\"detectors\":[{\"name\":\"a\",\"type\":\"threshold\"}],\"categories\":{\"latency\":\"missing\"}}"));

        assertThrows(IllegalStateException.class, () -> catalog.toRegistry("a"));
    }

    @Test
    void unknownTypeFails() throws Exception {
        DetectorCatalog catalog = DetectorCatalogLoader.parseCatalog(JsonSupport.MAPPER.readTree(
                "{\"detectors\":[{\"name\":\"a\",\"type\":\"lstm\"}]}"));

        assertThrows(IllegalArgumentException.class, () -> catalog.toRegistry("a"));
    }

    @Test
    void duplicateDetectorNamesFail() throws Exception {
        assertThrows(IllegalStateException.class, () -> DetectorCatalogLoader.parseCatalog(JsonSupport.MAPPER.readTree(
                "{\"detectors\":[{\"name\":\"a\",\"type\":\"threshold\"},{\"name\":\"a\",\"type\":\"gaussian\"}]}")));
    }

    @Test
    void missingFileFails() {
        assertThrows(IllegalStateException.class,
                () -> DetectorCatalogLoader.load(tempDir.resolve("nope.json").toString()));
    }
}
