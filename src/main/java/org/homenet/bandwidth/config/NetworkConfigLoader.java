package org.homenet.bandwidth.config;

import org.homenet.bandwidth.model.ActivityType;
import org.homenet.bandwidth.model.Device;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.nio.file.*;
import java.time.Duration;
import java.util.*;

/**
 * Loads {@link NetworkConfig} from YAML.
 *
 * Example:
 * <pre>
 * totalBandwidth: 500          # Mbps
 * tickPeriodSeconds: 1
 * retentionHours: 24
 * generator:
 *   seed: 42
 *   minDevices: 8
 *   maxDevices: 15
 * devices:                     # optional, replaces the generator
 *   - name: Sony Smart TV
 *     usage: 300
 *     priority: 2
 *     activity: Streaming
 *     signalStrength: 90
 *     dataTransferred: 1.5
 *     ipAddress: 192.168.1.20
 * </pre>
 * Missing keys keep their defaults.
 */
public class NetworkConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(NetworkConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "network.yaml";

    private final Yaml yaml;

    public NetworkConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    /**
     * Load configuration from a YAML file.
     */
    public NetworkConfig loadFromFile(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            NetworkConfig config = load(is);
            log.info("Loaded {} from {}", config, file);
            return config;
        }
    }

    /**
     * Load configuration from a classpath resource.
     */
    public NetworkConfig loadFromResource(String resource) throws IOException {
        InputStream is = NetworkConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IOException("Configuration resource not found: " + resource);
        }
        try (is) {
            NetworkConfig config = load(is);
            log.info("Loaded {} from classpath:{}", config, resource);
            return config;
        }
    }

    /**
     * Load the bundled {@value #DEFAULT_RESOURCE}.
     */
    public NetworkConfig loadDefault() throws IOException {
        return loadFromResource(DEFAULT_RESOURCE);
    }

    /**
     * Parse configuration from a YAML stream. An empty document yields defaults.
     */
    public NetworkConfig load(InputStream is) {
        Object raw = yaml.load(is);
        if (raw == null) {
            return NetworkConfig.defaults();
        }
        if (!(raw instanceof Map)) {
            throw new IllegalArgumentException("Configuration root must be a mapping");
        }
        return parse(asMap(raw, "root"));
    }

    /**
     * Parse configuration from a YAML string.
     */
    public NetworkConfig parse(String content) {
        return load(new ByteArrayInputStream(content.getBytes(java.nio.charset.StandardCharsets.UTF_8)));
    }

    @SuppressWarnings("unchecked")
    private NetworkConfig parse(Map<String, Object> raw) {
        NetworkConfig.Builder builder = new NetworkConfig.Builder();

        if (raw.containsKey("totalBandwidth")) {
            builder.totalBandwidth(getDouble(raw, "totalBandwidth", 500.0));
        }
        if (raw.containsKey("tickPeriodSeconds")) {
            builder.tickPeriod(Duration.ofMillis(Math.round(getDouble(raw, "tickPeriodSeconds", 1.0) * 1000)));
        }
        if (raw.containsKey("retentionHours")) {
            builder.retentionWindow(Duration.ofMillis(Math.round(getDouble(raw, "retentionHours", 24.0) * 3_600_000)));
        }

        Object generator = raw.get("generator");
        if (generator != null) {
            Map<String, Object> genMap = asMap(generator, "generator");
            builder.generatorSeed(getLong(genMap, "seed", 42L, "generator.seed"));
            builder.deviceCountBounds(
                getInt(genMap, "minDevices", 8, "generator.minDevices"),
                getInt(genMap, "maxDevices", 15, "generator.maxDevices"));
        }

        Object devices = raw.get("devices");
        if (devices != null) {
            if (!(devices instanceof List)) {
                throw new IllegalArgumentException("'devices' must be a list");
            }
            List<Device> parsed = new ArrayList<>();
            int index = 0;
            for (Object entry : (List<Object>) devices) {
                parsed.add(parseDevice(asMap(entry, "devices[" + index + "]"), index));
                index++;
            }
            builder.initialDevices(parsed);
        }

        return builder.build();
    }

    private Device parseDevice(Map<String, Object> map, int index) {
        String prefix = "devices[" + index + "].";
        String name = getString(map, "name", null);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(prefix + "name is required");
        }
        String activityName = getString(map, "activity", null);
        ActivityType activity = ActivityType.fromName(activityName);
        if (activityName != null && activity == null) {
            log.warn("Unknown activity '{}' for device '{}', ranking it with the default multiplier",
                activityName, name);
        }
        int priority = getInt(map, "priority", Device.MIN_PRIORITY, prefix + "priority");
        if (priority < Device.MIN_PRIORITY || priority > Device.MAX_PRIORITY) {
            throw new IllegalArgumentException(prefix + "priority must be between "
                + Device.MIN_PRIORITY + " and " + Device.MAX_PRIORITY + ", got: " + priority);
        }
        return new Device(
            name,
            getDouble(map, "usage", 0.0, prefix + "usage"),
            priority,
            activity,
            getDouble(map, "signalStrength", 100.0, prefix + "signalStrength"),
            getDouble(map, "dataTransferred", 0.0, prefix + "dataTransferred"),
            getString(map, "ipAddress", null),
            null);
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        return getDouble(map, key, defaultValue, key);
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue, String path) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("'" + path + "' must be a number, got: " + value);
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue, String path) {
        long value = getLong(map, key, defaultValue, path);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("'" + path + "' is out of range, got: " + value);
        }
        return (int) value;
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue, String path) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer || value instanceof Long) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number) {
            // Floats and values past the long range
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
                return (long) d;
            }
        }
        throw new IllegalArgumentException("'" + path + "' must be an integer, got: " + value);
    }
}
