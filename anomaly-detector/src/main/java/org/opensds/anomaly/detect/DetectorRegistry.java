package org.opensds.anomaly.detect;

import org.opensds.anomaly.model.MetricRecord;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Pattern;

/**
 * Maps metrics to detector instances.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>exact {@code metric_id} binding</li>
 *   <li>category binding, where the category comes from the record's {@code category} tag or else from the
 *       first name rule matching the record's metric name</li>
 *   <li>the default detector</li>
 * </ol>
 * Detectors are created once per binding and shared by every metric resolving to it, so they must keep all
 * per-metric history in their state. Registration may happen while lanes resolve concurrently; a replaced
 * binding takes effect on the next lookup.</p>
 */
public class DetectorRegistry {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(DetectorRegistry.class);
    public static final String CATEGORY_TAG = "category";
    public static final String METRIC_TAG = "metric";

    private final ConcurrentHashMap<String, Binding> metricBindings = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Binding> categoryBindings = new ConcurrentHashMap<>();
    private final List<CategoryRule> categoryRules = new CopyOnWriteArrayList<>();
    private volatile Binding defaultBinding;

    public DetectorRegistry() {}

    public DetectorRegistry(DetectorFactory defaultFactory) {
        if (defaultFactory != null) {
            this.defaultBinding = new Binding("default", defaultFactory);
        }
    }

    public void register(String category, DetectorFactory factory) {
        Objects.requireNonNull(category, "category");
        categoryBindings.put(category, new Binding("category:" + category, factory));
        LOG.info("Registered detector for category {}", category);
    }

    public void registerMetric(String metricId, DetectorFactory factory) {
        Objects.requireNonNull(metricId, "metricId");
        metricBindings.put(metricId, new Binding("metric:" + metricId, factory));
        LOG.info("Registered detector for metric {}", metricId);
    }

    /**
     * Adds a rule deriving {@code category} for records whose metric name matches {@code pattern}.
     * Rules are tried in registration order.
     */
    public void addCategoryRule(Pattern pattern, String category) {
        categoryRules.add(new CategoryRule(pattern, category));
    }

    public void setDefault(DetectorFactory factory) {
        this.defaultBinding = factory == null ? null : new Binding("default", factory);
        LOG.info("Default detector {}", factory == null ? "cleared" : "set");
    }

    public boolean hasDefault() {
        return defaultBinding != null;
    }

    public Detector resolve(MetricRecord record) throws NoDetectorAvailableException {
        Binding exact = metricBindings.get(record.metricId);
        if (exact != null) {
            return exact.detector();
        }
        String category = categoryOf(record);
        if (category != null) {
            Binding byCategory = categoryBindings.get(category);
            if (byCategory != null) {
                return byCategory.detector();
            }
        }
        Binding fallback = defaultBinding;
        if (fallback != null) {
            return fallback.detector();
        }
        throw new NoDetectorAvailableException(record.metricId);
    }

    /**
     * Resolution for a bare metric identity; only exact bindings, name rules and the default apply.
     */
    public Detector resolve(String metricId) throws NoDetectorAvailableException {
        return resolve(new MetricRecord(metricId, 0L, 0.0, null, null, -1L));
    }

    String categoryOf(MetricRecord record) {
        String tagged = record.tag(CATEGORY_TAG);
        if (tagged != null && !tagged.isEmpty()) {
            return tagged;
        }
        String name = record.tag(METRIC_TAG);
        if (name == null) {
            name = record.metricId;
        }
        for (CategoryRule rule : categoryRules) {
            if (rule.pattern.matcher(name).matches()) {
                return rule.category;
            }
        }
        return null;
    }

    private static final class Binding {
        private final String key;
        private final DetectorFactory factory;
        private volatile Detector instance;

        private Binding(String key, DetectorFactory factory) {
            this.key = key;
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        private Detector detector() {
            Detector current = instance;
            if (current == null) {
                synchronized (this) {
                    current = instance;
                    if (current == null) {
                        current = Objects.requireNonNull(factory.create(), "factory for " + key + " returned null");
                        instance = current;
                    }
                }
            }
            return current;
        }
    }

    private static final class CategoryRule {
        private final Pattern pattern;
        private final String category;

        private CategoryRule(Pattern pattern, String category) {
            this.pattern = Objects.requireNonNull(pattern, "pattern");
            this.category = Objects.requireNonNull(category, "category");
        }
    }
}
