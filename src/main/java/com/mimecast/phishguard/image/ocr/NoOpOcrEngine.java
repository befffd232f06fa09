package com.mimecast.phishguard.image.ocr;

import java.awt.image.BufferedImage;

/**
 * Stand in used when OCR is disabled.
 */
public class NoOpOcrEngine implements OcrEngine {

    @Override
    public String extractText(BufferedImage image) {
        return "";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
