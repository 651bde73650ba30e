package fr.lapetina.llmmanager.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Open key/value configuration handed to a backend at construction.
 *
 * No schema is enforced: any key may hold any value, and a missing key
 * yields the caller-supplied default. Each instance owns its own holder.
 */
public final class BackendConfig {

    private final Map<String, Object> params;

    public BackendConfig() {
        this.params = new LinkedHashMap<>();
    }

    private BackendConfig(Map<String, Object> params) {
        this.params = new LinkedHashMap<>(params);
    }

    public static BackendConfig of(Map<String, ?> params) {
        return params == null ? new BackendConfig() : new BackendConfig(new LinkedHashMap<>(params));
    }

    public static BackendConfig empty() {
        return new BackendConfig();
    }

    /**
     * Returns the stored value, or {@code defaultValue} only when the key is absent.
     * A key explicitly set to null yields null.
     */
    public synchronized Object get(String key, Object defaultValue) {
        return params.containsKey(key) ? params.get(key) : defaultValue;
    }

    public synchronized Object get(String key) {
        return params.get(key);
    }

    public synchronized BackendConfig set(String key, Object value) {
        params.put(key, value);
        return this;
    }

    /**
     * Sets every entry of {@code values}, overwriting existing keys.
     */
    public synchronized BackendConfig update(Map<String, ?> values) {
        if (values != null) {
            params.putAll(values);
        }
        return this;
    }

    public synchronized boolean contains(String key) {
        return params.containsKey(key);
    }

    /**
     * Returns a copy of all parameters.
     */
    public synchronized Map<String, Object> toMap() {
        return new LinkedHashMap<>(params);
    }

    public String getString(String key, String defaultValue) {
        Object value = get(key);
        return value != null ? value.toString() : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object value = get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        Object value = get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @Override
    public synchronized String toString() {
        // keys only, values may hold credentials
        return "BackendConfig{keys=" + params.keySet() + "}";
    }
}
