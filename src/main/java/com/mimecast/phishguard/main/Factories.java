package com.mimecast.phishguard.main;

import com.mimecast.phishguard.config.RspamdConfig;
import com.mimecast.phishguard.config.ServiceConfig;
import com.mimecast.phishguard.http.ImageFetcher;
import com.mimecast.phishguard.http.OkHttpImageFetcher;
import com.mimecast.phishguard.image.ocr.NoOpOcrEngine;
import com.mimecast.phishguard.image.ocr.OcrEngine;
import com.mimecast.phishguard.image.ocr.TesseractOcrEngine;
import com.mimecast.phishguard.image.vision.NoOpVision;
import com.mimecast.phishguard.image.vision.RasterVision;
import com.mimecast.phishguard.image.vision.VisionToolkit;
import com.mimecast.phishguard.scanners.RspamdClient;
import com.mimecast.phishguard.scanners.RspamdTextClassifier;
import com.mimecast.phishguard.text.NoOpTextClassifier;
import com.mimecast.phishguard.text.TextClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;

/**
 * Factories for pluggable collaborators.
 *
 * <p>This is a factories container for the collaborators the engines depend on.
 * <br>Without an injected factory the collaborator is built from the services configuration,
 * falling back to its no-op stand in when disabled.
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * Text classifier.
     * <p>Pretrained spam classifier used by the text engine.
     */
    private static Callable<TextClassifier> textClassifier;

    /**
     * OCR engine.
     * <p>Extracts text from images.
     */
    private static Callable<OcrEngine> ocrEngine;

    /**
     * Vision toolkit.
     * <p>Edge, contour and colour primitives.
     */
    private static Callable<VisionToolkit> visionToolkit;

    /**
     * Image fetcher.
     * <p>Downloads images given as URLs.
     */
    private static Callable<ImageFetcher> imageFetcher;

    /**
     * Protected constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Sets TextClassifier.
     *
     * @param callable TextClassifier callable.
     */
    public static void setTextClassifier(Callable<TextClassifier> callable) {
        textClassifier = callable;
    }

    /**
     * Gets TextClassifier.
     *
     * @param config ServiceConfig instance.
     * @return TextClassifier instance.
     */
    public static TextClassifier getTextClassifier(ServiceConfig config) {
        if (textClassifier != null) {
            try {
                return textClassifier.call();
            } catch (Exception e) {
                log.error("Error calling text classifier: {}", e.getMessage());
            }
        }

        RspamdConfig rspamd = config.getRspamd();
        if (rspamd.isEnabled()) {
            return new RspamdTextClassifier(new RspamdClient(rspamd), rspamd.getRejectThreshold());
        }
        return new NoOpTextClassifier();
    }

    /**
     * Sets OcrEngine.
     *
     * @param callable OcrEngine callable.
     */
    public static void setOcrEngine(Callable<OcrEngine> callable) {
        ocrEngine = callable;
    }

    /**
     * Gets OcrEngine.
     *
     * @param config ServiceConfig instance.
     * @return OcrEngine instance.
     */
    public static OcrEngine getOcrEngine(ServiceConfig config) {
        if (ocrEngine != null) {
            try {
                return ocrEngine.call();
            } catch (Exception e) {
                log.error("Error calling OCR engine: {}", e.getMessage());
            }
        }

        if (config.getOcr().isEnabled()) {
            return new TesseractOcrEngine(config.getOcr());
        }
        return new NoOpOcrEngine();
    }

    /**
     * Sets VisionToolkit.
     *
     * @param callable VisionToolkit callable.
     */
    public static void setVisionToolkit(Callable<VisionToolkit> callable) {
        visionToolkit = callable;
    }

    /**
     * Gets VisionToolkit.
     *
     * @param config ServiceConfig instance.
     * @return VisionToolkit instance.
     */
    public static VisionToolkit getVisionToolkit(ServiceConfig config) {
        if (visionToolkit != null) {
            try {
                return visionToolkit.call();
            } catch (Exception e) {
                log.error("Error calling vision toolkit: {}", e.getMessage());
            }
        }

        return config.isVisionEnabled() ? new RasterVision() : new NoOpVision();
    }

    /**
     * Sets ImageFetcher.
     *
     * @param callable ImageFetcher callable.
     */
    public static void setImageFetcher(Callable<ImageFetcher> callable) {
        imageFetcher = callable;
    }

    /**
     * Gets ImageFetcher.
     *
     * @param config ServiceConfig instance.
     * @return ImageFetcher instance.
     */
    public static ImageFetcher getImageFetcher(ServiceConfig config) {
        if (imageFetcher != null) {
            try {
                return imageFetcher.call();
            } catch (Exception e) {
                log.error("Error calling image fetcher: {}", e.getMessage());
            }
        }

        return new OkHttpImageFetcher(config.getFetch());
    }

    /**
     * Clears injected factories.
     */
    public static void reset() {
        textClassifier = null;
        ocrEngine = null;
        visionToolkit = null;
        imageFetcher = null;
    }
}
