package com.podconfig.config;

import com.podconfig.exception.ConfigurationException;
import com.podconfig.exception.UnknownSourceException;
import com.podconfig.policy.PriorityClassConfig;
import com.podconfig.source.PodSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads pod configuration settings from YAML files.
 */
public class PodConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PodConfigLoader.class);

    private PodConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static PodConfig load(String path) {
        log.info("Loading pod configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static PodConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(inputStream);

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Settings live at root or under a 'pod-config' key
        Object section = root.containsKey("pod-config") ? root.get("pod-config") : root;
        if (!(section instanceof Map)) {
            throw new ConfigurationException("Section 'pod-config' must be a mapping");
        }
        Map<String, Object> podConfig = (Map<String, Object>) section;

        List<String> sources = parseSources(podConfig.get("sources"));
        Object prioritySection = podConfig.get("priority");
        if (prioritySection != null && !(prioritySection instanceof Map)) {
            throw new ConfigurationException("Section 'priority' must be a mapping");
        }
        PriorityClassConfig priority = parsePriority((Map<String, Object>) prioritySection);

        PodConfig config = new PodConfig(sources, priority);

        log.info("Loaded pod configuration: sources {}, critical priority threshold {}",
                config.sources(), config.priority().systemCriticalPriority());

        return config;
    }

    private static List<String> parseSources(Object value) {
        if (value == null) {
            log.debug("No sources configured, enabling all");
            return PodSources.all();
        }

        List<String> declared = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                // null entries reach validation and are rejected as unknown
                declared.add(item == null ? null : item.toString());
            }
        } else {
            // comma separated string form, e.g. "file,api"
            for (String item : value.toString().split(",")) {
                declared.add(item.trim());
            }
        }

        try {
            return PodSources.validate(declared);
        } catch (UnknownSourceException e) {
            throw new ConfigurationException("Invalid 'sources' setting: " + e.getMessage(), e);
        }
    }

    private static PriorityClassConfig parsePriority(Map<String, Object> map) {
        if (map == null) {
            return PriorityClassConfig.defaults();
        }
        return new PriorityClassConfig(
                getInt(map, "system-critical-threshold", PriorityClassConfig.SYSTEM_CRITICAL_PRIORITY),
                getString(map, "system-node-critical-class", PriorityClassConfig.SYSTEM_NODE_CRITICAL),
                getString(map, "system-cluster-critical-class", PriorityClassConfig.SYSTEM_CLUSTER_CRITICAL));
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        long parsed;
        if (value instanceof Integer || value instanceof Long) {
            parsed = ((Number) value).longValue();
        } else {
            try {
                parsed = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Setting '" + key + "' is not an integer: " + value, e);
            }
        }
        if (parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new ConfigurationException("Setting '" + key + "' is out of integer range: " + value);
        }
        return (int) parsed;
    }
}
