package com.mimecast.phishguard.config;

import java.io.IOException;
import java.util.Map;

/**
 * Collaborator services configuration.
 *
 * <p>This class provides type safe access to the external collaborators:
 * <ul>
 *     <li><b>rspamd</b> - pretrained text classifier, see {@link RspamdConfig}.</li>
 *     <li><b>ocr</b> - Tesseract OCR, see {@link OcrConfig}.</li>
 *     <li><b>fetch</b> - remote image download, see {@link FetchConfig}.</li>
 *     <li><b>vision</b> - built in vision primitives, on unless disabled.</li>
 *     <li><b>image</b> - image engine threading.</li>
 * </ul>
 *
 * <p>File name: {@code services.json5}.
 */
public class ServiceConfig extends ConfigFoundation {

    /**
     * Configuration file name.
     */
    public static final String FILENAME = "services.json5";

    /**
     * Constructs a new ServiceConfig instance with defaults only.
     */
    public ServiceConfig() {
        super();
    }

    /**
     * Constructs a new ServiceConfig instance.
     *
     * @param map Configuration map.
     */
    public ServiceConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServiceConfig instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ServiceConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets Rspamd configuration.
     *
     * @return RspamdConfig instance.
     */
    public RspamdConfig getRspamd() {
        return new RspamdConfig(getMapProperty("rspamd"));
    }

    /**
     * Gets OCR configuration.
     *
     * @return OcrConfig instance.
     */
    public OcrConfig getOcr() {
        return new OcrConfig(getMapProperty("ocr"));
    }

    /**
     * Gets fetch configuration.
     *
     * @return FetchConfig instance.
     */
    public FetchConfig getFetch() {
        return new FetchConfig(getMapProperty("fetch"));
    }

    /**
     * Checks if vision primitives are enabled.
     *
     * @return true if enabled, false otherwise.
     */
    public boolean isVisionEnabled() {
        return getBooleanProperty("vision.enabled", true);
    }

    /**
     * Gets number of threads running image sub-analyses.
     * <p>Zero or less runs them in the calling thread.
     *
     * @return Thread count.
     */
    public int getImageThreads() {
        return Math.toIntExact(getLongProperty("image.threads", 0L));
    }
}
