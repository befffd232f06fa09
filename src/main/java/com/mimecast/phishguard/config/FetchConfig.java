package com.mimecast.phishguard.config;

import java.util.Map;

/**
 * Remote image fetch configuration.
 */
public class FetchConfig extends ConfigFoundation {

    /**
     * Constructs a new FetchConfig instance.
     *
     * @param map Configuration map.
     */
    public FetchConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if images may be fetched from remote URLs.
     *
     * @return true if enabled, false otherwise.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", true);
    }

    /**
     * Gets timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getTimeout() {
        return Math.toIntExact(getLongProperty("timeout", 30L));
    }

    /**
     * Gets maximum body size in bytes.
     *
     * @return Byte limit.
     */
    public long getMaxBytes() {
        return getLongProperty("maxBytes", 16L * 1024 * 1024);
    }
}
