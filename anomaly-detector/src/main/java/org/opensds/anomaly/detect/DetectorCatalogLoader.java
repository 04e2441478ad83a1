package org.opensds.anomaly.detect;

import com.fasterxml.jackson.databind.JsonNode;

import org.opensds.anomaly.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads the detector catalog from the filesystem or classpath.
 *
 * Lookup order:
 * 1) explicit path (pipeline config)
 * 2) JVM property `anomaly.detector.catalog.path`
 * 3) classpath resource `reference/detector_catalog.v1.json`
 */
public final class DetectorCatalogLoader {
    public static final String CATALOG_PROPERTY = "anomaly.detector.catalog.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "reference/detector_catalog.v1.json";

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(DetectorCatalogLoader.class);

    private DetectorCatalogLoader() {}

    public static DetectorCatalog load(String explicitPath) {
        if (explicitPath != null && !explicitPath.isBlank()) {
            return loadFromFile(Path.of(explicitPath));
        }
        String overridePath = System.getProperty(CATALOG_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }
        DetectorCatalog fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath == null) {
            throw new IllegalStateException("Detector catalog resource not found: " + DEFAULT_CLASSPATH_RESOURCE);
        }
        return fromClasspath;
    }

    static DetectorCatalog loadFromClasspath(String resourcePath) {
        try (InputStream in = DetectorCatalogLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            DetectorCatalog catalog = parseCatalog(JsonSupport.MAPPER.readTree(in));
            LOG.info("Loaded detector catalog version={} detectors={} from classpath:{}",
                    catalog.version(), catalog.size(), resourcePath);
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load detector catalog from classpath: " + resourcePath, ex);
        }
    }

    static DetectorCatalog loadFromFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Detector catalog file not found: " + path);
        }
        try {
            DetectorCatalog catalog = parseCatalog(JsonSupport.MAPPER.readTree(path.toFile()));
            LOG.info("Loaded detector catalog version={} detectors={} from {}", catalog.version(), catalog.size(), path);
            return catalog;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load detector catalog from file: " + path, ex);
        }
    }

    static DetectorCatalog parseCatalog(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Detector catalog is not a JSON object");
        }
        String version = root.path("catalog_version").asText("unknown");

        JsonNode detectors = root.path("detectors");
        if (!detectors.isArray()) {
            throw new IllegalStateException("Detector catalog missing detectors array");
        }
        Map<String, DetectorDefinition> definitions = new LinkedHashMap<>();
        for (JsonNode node : detectors) {
            String name = node.path("name").asText("");
            String type = node.path("type").asText("");
            if (name.isEmpty() || type.isEmpty()) {
                throw new IllegalStateException("Detector entry requires name and type: " + node);
            }
            Map<String, String> params = new LinkedHashMap<>();
            node.path("params").fields().forEachRemaining(e -> params.put(e.getKey(), e.getValue().asText()));
            if (definitions.put(name, new DetectorDefinition(name, type, params)) != null) {
                throw new IllegalStateException("Duplicate detector name in catalog: " + name);
            }
        }

        List<Map.Entry<Pattern, String>> rules = new ArrayList<>();
        for (JsonNode rule : root.path("category_rules")) {
            String pattern = rule.path("pattern").asText("");
            String category = rule.path("category").asText("");
            if (pattern.isEmpty() || category.isEmpty()) {
                continue;
            }
            try {
                rules.add(new AbstractMap.SimpleImmutableEntry<>(Pattern.compile(pattern), category));
            } catch (PatternSyntaxException ex) {
                throw new IllegalStateException("Invalid category rule pattern: " + pattern, ex);
            }
        }

        return new DetectorCatalog(
                version,
                definitions,
                textMap(root.path("metrics")),
                textMap(root.path("categories")),
                rules);
    }

    private static Map<String, String> textMap(JsonNode node) {
        Map<String, String> map = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> map.put(e.getKey(), e.getValue().asText()));
        }
        return map;
    }
}
