package me.christianrobert.retarget.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime settings of the translation services, held in memory and editable over REST.
 * Emission itself takes no settings; these only shape the post-processing around it.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String HEADER_ENABLED = "translation.header.enabled";
    public static final String HEADER_TOOL_NAME = "translation.header.tool-name";
    public static final String IMPORTS_ENABLED = "translation.imports.enabled";
    public static final String FALLBACK_VERBATIM = "translation.fallback.verbatim";
    public static final String WRAPPER_PROGRAM_NAME = "translation.wrapper.program-name";
    public static final String BATCH_PARALLELISM = "translation.batch.parallelism";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(HEADER_ENABLED, true);
        configuration.put(HEADER_TOOL_NAME, "retarget");
        configuration.put(IMPORTS_ENABLED, true);
        configuration.put(FALLBACK_VERBATIM, true);
        configuration.put(WRAPPER_PROGRAM_NAME, "Main");
        configuration.put(BATCH_PARALLELISM, 4);

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an int, accepting numbers and numeric strings.
     *
     * @return the value, or {@code defaultValue} when missing or not numeric
     */
    public int getConfigValueAsInt(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number, using {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    /**
     * Boolean flag with a default for missing values.
     */
    public boolean isEnabled(String key, boolean defaultValue) {
        Boolean value = getConfigValueAsBoolean(key);
        return value != null ? value : defaultValue;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
