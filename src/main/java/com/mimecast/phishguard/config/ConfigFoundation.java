package com.mimecast.phishguard.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Wraps a JSON5 document as a map and provides type safe accessors with defaults.
 * <br>Keys may be dotted to reach into nested objects, e.g. {@code text.keywords}.
 * <br>JSON5 is read with Gson in lenient mode, which accepts comments, unquoted keys and single quotes.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    private static final Gson gson = new Gson();

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new ConfigFoundation instance with an empty map.
     */
    public ConfigFoundation() {
        this.map = new LinkedHashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new LinkedHashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        this(readFile(Paths.get(path)));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map instance.
     * @throws IOException Unable to read or parse file.
     */
    public static Map<String, Object> readFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Reads a JSON5 document into a map.
     *
     * @param reader Reader instance.
     * @return Map instance, empty for an empty document.
     * @throws IOException Unable to parse document.
     */
    public static Map<String, Object> read(Reader reader) throws IOException {
        try {
            Map<String, Object> parsed = gson.fromJson(reader, Map.class);
            return parsed != null ? parsed : new LinkedHashMap<>();
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON5 configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Gets the underlying map.
     *
     * @return Unmodifiable map.
     */
    public Map<String, Object> getMap() {
        return Collections.unmodifiableMap(map);
    }

    /**
     * Checks if property exists.
     *
     * @param key Property key.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        return getProperty(key) != null;
    }

    /**
     * Gets property.
     * <p>Exact keys win over dotted paths.
     *
     * @param key Property key.
     * @return Object or null.
     */
    protected Object getProperty(String key) {
        if (key == null) {
            return null;
        }
        if (map.containsKey(key)) {
            return map.get(key);
        }

        Object current = map;
        for (String part : key.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }
        return current;
    }

    /**
     * Gets String property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        Object value = getProperty(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets String property.
     *
     * @param key Property key.
     * @return String or null.
     */
    public String getStringProperty(String key) {
        return getStringProperty(key, null);
    }

    /**
     * Gets Long property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String key, Long defaultValue) {
        Object value = getProperty(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        } else if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets Double property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String key, Double defaultValue) {
        Object value = getProperty(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets Boolean property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public Boolean getBooleanProperty(String key, Boolean defaultValue) {
        Object value = getProperty(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        } else if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    /**
     * Gets Boolean property.
     *
     * @param key Property key.
     * @return Boolean, false if missing.
     */
    public boolean getBooleanProperty(String key) {
        return getBooleanProperty(key, false);
    }

    /**
     * Gets List property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return List.
     */
    public List<Object> getListProperty(String key, List<Object> defaultValue) {
        Object value = getProperty(key);
        return value instanceof List ? (List<Object>) value : defaultValue;
    }

    /**
     * Gets List property.
     *
     * @param key Property key.
     * @return List, empty if missing.
     */
    public List<Object> getListProperty(String key) {
        return getListProperty(key, Collections.emptyList());
    }

    /**
     * Gets Map property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Map.
     */
    public Map<String, Object> getMapProperty(String key, Map<String, Object> defaultValue) {
        Object value = getProperty(key);
        return value instanceof Map ? (Map<String, Object>) value : defaultValue;
    }

    /**
     * Gets Map property.
     *
     * @param key Property key.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String key) {
        return getMapProperty(key, Collections.emptyMap());
    }
}
