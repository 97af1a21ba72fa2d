package com.mimecast.mimetree.config;

import java.util.Collections;
import java.util.Map;

/**
 * Map backed configuration with typed accessors.
 *
 * <p>Keys may address nested maps with dots, e.g. {@code "charsetAliases.latin"}.
 * <br>Numbers come out of JSON as doubles and are narrowed on read.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map;

    /**
     * Constructs a new BasicConfig instance.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        this.map = map != null ? map : Collections.emptyMap();
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets property, walking nested maps for dotted names.
     *
     * @param name Property name.
     * @return Object or null.
     */
    protected Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        int dot = name.indexOf('.');
        if (dot > 0 && map.get(name.substring(0, dot)) instanceof Map) {
            return new BasicConfig((Map<String, Object>) map.get(name.substring(0, dot)))
                    .getProperty(name.substring(dot + 1));
        }

        return null;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets string property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets boolean property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean def) {
        Object value = getProperty(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null ? Boolean.parseBoolean(String.valueOf(value)) : def;
    }

    /**
     * Gets long property with default.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value != null) {
            try {
                return (long) Double.parseDouble(String.valueOf(value));
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if absent.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : Collections.emptyMap();
    }
}
