package com.mimecast.phishguard.main;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.config.ServiceConfig;
import com.mimecast.phishguard.email.EmailSignalEngine;
import com.mimecast.phishguard.email.UrlSignalEngine;
import com.mimecast.phishguard.image.ImageSignalEngine;
import com.mimecast.phishguard.sender.SenderIdentityAnalyzer;
import com.mimecast.phishguard.text.TextSignalEngine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Engine wiring.
 *
 * <p>Builds every engine once from a configuration directory and hands out the shared instances.
 * <br>Engines are immutable after construction so one instance serves concurrent callers.
 * <br>Missing configuration files fall back to built in defaults.
 */
public class Engines implements Closeable {
    private static final Logger log = LogManager.getLogger(Engines.class);

    /**
     * Configuration directory used when none is given.
     */
    public static final String DEFAULT_DIR = "cfg/";

    private final TextSignalEngine textEngine;
    private final SenderIdentityAnalyzer senderAnalyzer;
    private final ImageSignalEngine imageEngine;
    private final EmailSignalEngine emailEngine;
    private final UrlSignalEngine urlEngine;
    private final ExecutorService executor;

    /**
     * Constructs a new Engines instance.
     *
     * @param detection DetectionConfig instance.
     * @param services  ServiceConfig instance.
     */
    public Engines(DetectionConfig detection, ServiceConfig services) {
        this.executor = services.getImageThreads() > 0 ? Executors.newFixedThreadPool(services.getImageThreads()) : null;
        this.textEngine = new TextSignalEngine(detection, Factories.getTextClassifier(services));
        this.senderAnalyzer = new SenderIdentityAnalyzer(detection);
        this.imageEngine = new ImageSignalEngine(detection,
                Factories.getOcrEngine(services),
                Factories.getVisionToolkit(services),
                Factories.getImageFetcher(services),
                executor);
        this.emailEngine = new EmailSignalEngine(textEngine, senderAnalyzer);
        this.urlEngine = new UrlSignalEngine(textEngine);
    }

    /**
     * Loads engines from a configuration directory.
     *
     * @param dir Directory holding signals.json5 and services.json5, or null for defaults.
     * @return Engines instance.
     * @throws IOException Unable to read a present configuration file.
     */
    public static Engines load(Path dir) throws IOException {
        DetectionConfig detection = new DetectionConfig();
        ServiceConfig services = new ServiceConfig();

        if (dir != null) {
            Path signals = dir.resolve(DetectionConfig.FILENAME);
            if (Files.isRegularFile(signals)) {
                detection = new DetectionConfig(signals.toString());
                log.info("Loaded detection tables from {}", signals);
            } else {
                log.warn("No {} in {}, using defaults", DetectionConfig.FILENAME, dir);
            }

            Path servicesPath = dir.resolve(ServiceConfig.FILENAME);
            if (Files.isRegularFile(servicesPath)) {
                services = new ServiceConfig(servicesPath.toString());
                log.info("Loaded services from {}", servicesPath);
            } else {
                log.warn("No {} in {}, using defaults", ServiceConfig.FILENAME, dir);
            }
        }

        return new Engines(detection, services);
    }

    public TextSignalEngine getTextEngine() {
        return textEngine;
    }

    public SenderIdentityAnalyzer getSenderAnalyzer() {
        return senderAnalyzer;
    }

    public ImageSignalEngine getImageEngine() {
        return imageEngine;
    }

    public EmailSignalEngine getEmailEngine() {
        return emailEngine;
    }

    public UrlSignalEngine getUrlEngine() {
        return urlEngine;
    }

    /**
     * Runs every health check.
     *
     * @return Map of engine name to health.
     */
    public Map<String, Boolean> health() {
        Map<String, Boolean> health = new LinkedHashMap<>();
        health.put("text", textEngine.isHealthy());
        health.put("sender", senderAnalyzer.isHealthy());
        health.put("image", imageEngine.isHealthy());
        return health;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
    }
}
