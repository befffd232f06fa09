package com.mimecast.phishguard.image;

import com.mimecast.phishguard.image.vision.GrayImage;

import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.Optional;

/**
 * Per call inputs shared by the image sub-analyses.
 *
 * <p>Holds the decoded image, its grayscale version and the OCR text, each computed once per call.
 * <br>Sub-analyses only read from it.
 */
public final class ImageContext {
    private final BufferedImage image;
    private final GrayImage gray;
    private final String ocrText;

    /**
     * Constructs a new ImageContext instance.
     *
     * @param image   Decoded image.
     * @param gray    Grayscale image or null when vision is unavailable.
     * @param ocrText OCR text or null when OCR is unavailable or failed.
     */
    public ImageContext(BufferedImage image, GrayImage gray, String ocrText) {
        this.image = image;
        this.gray = gray;
        this.ocrText = ocrText;
    }

    public BufferedImage getImage() {
        return image;
    }

    /**
     * Gets grayscale image.
     *
     * @return Optional of GrayImage.
     */
    public Optional<GrayImage> getGray() {
        return Optional.ofNullable(gray);
    }

    /**
     * Gets OCR text as extracted.
     *
     * @return Optional of String.
     */
    public Optional<String> getOcrText() {
        return Optional.ofNullable(ocrText);
    }

    /**
     * Gets lower case OCR text.
     *
     * @return Lower case text, empty when there is none.
     */
    public String getOcrTextLowerCase() {
        return ocrText != null ? ocrText.toLowerCase(Locale.ROOT) : "";
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }
}
