package com.mimecast.phishguard.image.ocr;

import com.mimecast.phishguard.config.OcrConfig;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Tesseract OCR through Tess4J.
 *
 * <p>The native Tesseract handle is not thread safe so calls are serialised.
 * <br>A missing native library surfaces as an {@link IOException} on first use.
 */
public class TesseractOcrEngine implements OcrEngine {
    private static final Logger log = LogManager.getLogger(TesseractOcrEngine.class);

    private final ITesseract tesseract;

    /**
     * Constructs a new TesseractOcrEngine instance.
     *
     * @param config OcrConfig instance.
     */
    public TesseractOcrEngine(OcrConfig config) {
        this(new Tesseract());
        if (StringUtils.isNotBlank(config.getDatapath())) {
            tesseract.setDatapath(config.getDatapath());
        }
        tesseract.setLanguage(config.getLanguage());
        log.debug("Tesseract configured with language {} and datapath {}", config.getLanguage(), config.getDatapath());
    }

    /**
     * Constructs a new TesseractOcrEngine instance.
     *
     * @param tesseract ITesseract instance.
     */
    public TesseractOcrEngine(ITesseract tesseract) {
        this.tesseract = tesseract;
    }

    @Override
    public String extractText(BufferedImage image) throws IOException {
        try {
            synchronized (tesseract) {
                String text = tesseract.doOCR(image);
                return text != null ? text : "";
            }
        } catch (TesseractException | LinkageError e) {
            throw new IOException("Tesseract OCR failed: " + e.getMessage(), e);
        }
    }
}
