package org.opensds.anomaly.detect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detector definitions and bindings loaded from the catalog document.
 */
public final class DetectorCatalog {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(DetectorCatalog.class);

    private final String version;
    private final Map<String, DetectorDefinition> definitions;
    private final Map<String, String> metricBindings;
    private final Map<String, String> categoryBindings;
    private final List<Map.Entry<Pattern, String>> categoryRules;

    public DetectorCatalog(
            String version,
            Map<String, DetectorDefinition> definitions,
            Map<String, String> metricBindings,
            Map<String, String> categoryBindings,
            List<Map.Entry<Pattern, String>> categoryRules) {
        this.version = version;
        this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
        this.metricBindings = Collections.unmodifiableMap(new LinkedHashMap<>(metricBindings));
        this.categoryBindings = Collections.unmodifiableMap(new LinkedHashMap<>(categoryBindings));
        this.categoryRules = List.copyOf(categoryRules);
    }

    public String version() {
        return version;
    }

    public int size() {
        return definitions.size();
    }

    public DetectorDefinition definition(String name) {
        return definitions.get(name);
    }

    /**
     * Builds a registry from the catalog bindings.
     *
     * @param defaultDetector definition name used when nothing else matches; blank for no default
     */
    public DetectorRegistry toRegistry(String defaultDetector) {
        DetectorRegistry registry = new DetectorRegistry();
        Map<String, DetectorFactory> factories = new LinkedHashMap<>();
        for (DetectorDefinition definition : definitions.values()) {
            factories.put(definition.name, definition.toFactory());
        }
        for (Map.Entry<String, String> binding : metricBindings.entrySet()) {
            registry.registerMetric(binding.getKey(), requireFactory(factories, binding.getValue()));
        }
        for (Map.Entry<String, String> binding : categoryBindings.entrySet()) {
            registry.register(binding.getKey(), requireFactory(factories, binding.getValue()));
        }
        for (Map.Entry<Pattern, String> rule : categoryRules) {
            registry.addCategoryRule(rule.getKey(), rule.getValue());
        }
        if (defaultDetector != null && !defaultDetector.trim().isEmpty()) {
            registry.setDefault(requireFactory(factories, defaultDetector.trim()));
        } else {
            LOG.warn("No default detector configured; unmatched metrics will be checkpointed without detection");
        }
        return registry;
    }

    private static DetectorFactory requireFactory(Map<String, DetectorFactory> factories, String name) {
        DetectorFactory factory = factories.get(name);
        if (factory == null) {
            throw new IllegalStateException("Detector catalog references undefined detector: " + name);
        }
        return factory;
    }
}
