package com.mimecast.phishguard.config;

import java.util.Map;

/**
 * Rspamd classifier configuration.
 *
 * <p>This class provides type safe access to the Rspamd daemon used as the pretrained text classifier.
 */
public class RspamdConfig extends ConfigFoundation {

    /**
     * Constructs a new RspamdConfig instance.
     *
     * @param map Configuration map.
     */
    public RspamdConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if Rspamd classification is enabled.
     *
     * @return true if enabled, false otherwise.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    /**
     * Gets Rspamd server host.
     *
     * @return Rspamd server hostname or IP address.
     */
    public String getHost() {
        return getStringProperty("host", "localhost");
    }

    /**
     * Gets Rspamd server port.
     *
     * @return Rspamd server port number.
     */
    public int getPort() {
        return Math.toIntExact(getLongProperty("port", 11333L));
    }

    /**
     * Gets connection timeout in seconds.
     *
     * @return Timeout in seconds.
     */
    public int getTimeout() {
        return Math.toIntExact(getLongProperty("timeout", 30L));
    }

    /**
     * Gets spam score threshold.
     * <p>Texts scoring at or above it are labelled spam with full confidence.
     *
     * @return Threshold score.
     */
    public double getRejectThreshold() {
        return getDoubleProperty("rejectThreshold", 7.0);
    }
}
