package com.mimecast.phishguard.config;

import java.util.Map;

/**
 * OCR configuration.
 *
 * <p>This class provides type safe access to the Tesseract OCR settings.
 */
public class OcrConfig extends ConfigFoundation {

    /**
     * Constructs a new OcrConfig instance.
     *
     * @param map Configuration map.
     */
    public OcrConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Checks if OCR is enabled.
     *
     * @return true if enabled, false otherwise.
     */
    public boolean isEnabled() {
        return getBooleanProperty("enabled", false);
    }

    /**
     * Gets tessdata directory.
     *
     * @return Path or null to let Tesseract use TESSDATA_PREFIX.
     */
    public String getDatapath() {
        return getStringProperty("datapath", null);
    }

    /**
     * Gets OCR language.
     *
     * @return Tesseract language code.
     */
    public String getLanguage() {
        return getStringProperty("language", "eng");
    }
}
