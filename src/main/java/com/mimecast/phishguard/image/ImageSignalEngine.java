package com.mimecast.phishguard.image;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.http.ImageFetcher;
import com.mimecast.phishguard.image.ocr.OcrEngine;
import com.mimecast.phishguard.image.vision.GrayImage;
import com.mimecast.phishguard.image.vision.VisionToolkit;
import com.mimecast.phishguard.signals.Aggregator;
import com.mimecast.phishguard.signals.HealthCheck;
import com.mimecast.phishguard.signals.SignalResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Image phishing signals.
 *
 * <p>Decodes the input, extracts OCR text and a grayscale copy once, then runs five sub-analyses and
 * folds them through the {@link Aggregator}:
 * <ul>
 *     <li><b>ocr_text</b> - {@link OcrTextAnalysis}.</li>
 *     <li><b>visual_elements</b> - {@link VisualElementAnalysis}.</li>
 *     <li><b>brand_impersonation</b> - {@link BrandImpersonationAnalysis}.</li>
 *     <li><b>layout_patterns</b> - {@link LayoutPatternAnalysis}.</li>
 *     <li><b>color_patterns</b> - {@link ColorPatternAnalysis}.</li>
 * </ul>
 *
 * <p>With neither OCR nor vision available every call returns the fixed degraded result.
 * <br>A failing sub-analysis contributes nothing and never stops its siblings.
 * <br>Given an executor the sub-analyses run concurrently, results are still folded in fixed order.
 */
public class ImageSignalEngine implements HealthCheck {
    private static final Logger log = LogManager.getLogger(ImageSignalEngine.class);

    private static final SignalResult BASIC_ONLY = SignalResult.degraded(10, 0.3, "basic_analysis_only",
            "Image processing not available - basic analysis only");

    private final OcrEngine ocr;
    private final VisionToolkit vision;
    private final ImageLoader loader;
    private final List<ImageSubAnalysis> analyses;
    private final ExecutorService executor;

    /**
     * Constructs a new ImageSignalEngine instance running sub-analyses sequentially.
     *
     * @param config  DetectionConfig instance.
     * @param ocr     OcrEngine instance.
     * @param vision  VisionToolkit instance.
     * @param fetcher ImageFetcher instance.
     */
    public ImageSignalEngine(DetectionConfig config, OcrEngine ocr, VisionToolkit vision, ImageFetcher fetcher) {
        this(config, ocr, vision, fetcher, null);
    }

    /**
     * Constructs a new ImageSignalEngine instance.
     *
     * @param config   DetectionConfig instance.
     * @param ocr      OcrEngine instance.
     * @param vision   VisionToolkit instance.
     * @param fetcher  ImageFetcher instance.
     * @param executor ExecutorService for concurrent sub-analyses or null to run them in the caller.
     */
    public ImageSignalEngine(DetectionConfig config, OcrEngine ocr, VisionToolkit vision, ImageFetcher fetcher, ExecutorService executor) {
        this.ocr = ocr;
        this.vision = vision;
        this.loader = new ImageLoader(fetcher);
        this.executor = executor;
        this.analyses = List.of(
                new OcrTextAnalysis(config),
                new VisualElementAnalysis(vision),
                new BrandImpersonationAnalysis(config, vision),
                new LayoutPatternAnalysis(vision),
                new ColorPatternAnalysis(config, vision)
        );

        if (isDegraded()) {
            log.warn("Neither OCR nor vision available, image analysis limited to basic results");
        } else {
            log.debug("Image engine ready with OCR {} and vision {}", ocr.isAvailable(), vision.isAvailable());
        }
    }

    /**
     * Analyzes an image given as data URI, URL or file path.
     *
     * @param imageData Image input.
     * @return SignalResult, degraded without collaborators and error when the image cannot be loaded.
     */
    public SignalResult analyze(String imageData) {
        if (isDegraded()) {
            return BASIC_ONLY;
        }

        BufferedImage image;
        try {
            image = loader.load(imageData);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load image: {}", e.getMessage());
            return SignalResult.error("Failed to load image: " + e.getMessage());
        }

        return analyze(image);
    }

    /**
     * Analyzes a decoded image.
     *
     * @param image BufferedImage instance.
     * @return SignalResult instance.
     */
    public SignalResult analyze(BufferedImage image) {
        if (isDegraded()) {
            return BASIC_ONLY;
        }
        if (image == null) {
            return SignalResult.error("Failed to load image");
        }

        try {
            ImageContext context = createContext(image);
            if (executor == null) {
                List<SignalResult> results = new ArrayList<>();
                for (ImageSubAnalysis analysis : analyses) {
                    results.add(run(analysis, context));
                }
                return Aggregator.combine(results);
            }

            List<CompletableFuture<SignalResult>> futures = new ArrayList<>();
            for (ImageSubAnalysis analysis : analyses) {
                futures.add(CompletableFuture.supplyAsync(() -> run(analysis, context), executor));
            }

            List<SignalResult> results = new ArrayList<>();
            for (CompletableFuture<SignalResult> future : futures) {
                results.add(future.join());
            }
            return Aggregator.combine(results);
        } catch (Exception e) {
            log.error("Image analysis failed: {}", e.getMessage());
            return SignalResult.error("Analysis error: " + e.getMessage());
        }
    }

    /**
     * Checks if the engine runs in degraded mode.
     *
     * @return True when neither OCR nor vision is available.
     */
    public boolean isDegraded() {
        return !ocr.isAvailable() && !vision.isAvailable();
    }

    @Override
    public boolean isHealthy() {
        try {
            SignalResult result = analyze(new BufferedImage(100, 100, BufferedImage.TYPE_INT_RGB));
            return result != null && result.getVariant() != SignalResult.Variant.ERROR;
        } catch (Exception e) {
            log.error("Image engine health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Computes the per call shared inputs.
     * <p>OCR failures are logged and leave the text empty.
     */
    private ImageContext createContext(BufferedImage image) {
        GrayImage gray = vision.isAvailable() ? vision.grayscale(image) : null;

        String text = null;
        if (ocr.isAvailable()) {
            try {
                text = ocr.extractText(image);
            } catch (Exception e) {
                log.error("OCR failed: {}", e.getMessage());
            }
        }

        return new ImageContext(image, gray, text);
    }

    private SignalResult run(ImageSubAnalysis analysis, ImageContext context) {
        try {
            SignalResult result = analysis.analyze(context);
            log.debug("Image sub-analysis {} gave {}", analysis.getName(), result);
            return result;
        } catch (Exception e) {
            log.error("Image sub-analysis {} failed: {}", analysis.getName(), e.getMessage());
            return SignalResult.empty();
        }
    }
}
