package com.ipintel.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for a single gateway (lookup or assessment) instance.
 *
 * <p>{@code credentials} maps a gateway property name to the environment variable that
 * supplies its value.  They are resolved into {@code properties} by
 * {@link CredentialResolver} before the gateway is created, so secrets never live in the
 * YAML file itself.</p>
 */
@Data
@NoArgsConstructor
public class GatewayConfig {

    private String name;
    private String className;
    // holds resolved secrets
    @ToString.Exclude
    private Map<String, String> properties = new HashMap<>();
    private Map<String, String> credentials = new HashMap<>();

    public String getProperty(String key) {
        return properties.get(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    public int getIntProperty(String key, int defaultValue) {
        String value = properties.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Gateway '" + name + "' property " + key
                    + " is not an integer: " + value, e);
        }
    }

    public double getDoubleProperty(String key, double defaultValue) {
        String value = properties.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Gateway '" + name + "' property " + key
                    + " is not a number: " + value, e);
        }
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.get(key);
        return value == null || value.isBlank() ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * Returns a property that must be present.
     *
     * @throws ConfigurationException when the property is missing or blank
     */
    public String requireProperty(String key) {
        String value = properties.get(key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Gateway '" + name + "' requires property: " + key);
        }
        return value;
    }

    void validate(String section) {
        if (className == null || className.isBlank()) {
            throw new ConfigurationException(section + ".className is not configured");
        }
    }
}
