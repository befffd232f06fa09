package com.mimecast.phishguard.image.ocr;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * OCR collaborator.
 */
public interface OcrEngine {

    /**
     * Extracts text from an image.
     *
     * @param image BufferedImage instance.
     * @return Extracted text, possibly empty.
     * @throws IOException OCR failed.
     */
    String extractText(BufferedImage image) throws IOException;

    /**
     * Checks if OCR is configured.
     *
     * @return Boolean.
     */
    default boolean isAvailable() {
        return true;
    }
}
