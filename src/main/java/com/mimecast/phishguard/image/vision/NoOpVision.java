package com.mimecast.phishguard.image.vision;

import com.mimecast.phishguard.signals.detect.Rgb;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Stand in used when vision is disabled.
 * <p>Never available, every primitive yields nothing to detect.
 */
public class NoOpVision implements VisionToolkit {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public GrayImage grayscale(BufferedImage image) {
        return new GrayImage(0, 0);
    }

    @Override
    public GrayImage threshold(GrayImage image, int threshold) {
        return new GrayImage(0, 0);
    }

    @Override
    public GrayImage canny(GrayImage image, double lowThreshold, double highThreshold) {
        return new GrayImage(0, 0);
    }

    @Override
    public GrayImage dilate(GrayImage image) {
        return new GrayImage(0, 0);
    }

    @Override
    public List<Contour> findExternalContours(GrayImage binary) {
        return new ArrayList<>();
    }

    @Override
    public Contour approxPolygon(Contour contour, double epsilon) {
        return contour;
    }

    @Override
    public HsvImage toHsv(BufferedImage image) {
        return new HsvImage(0, 0, new int[0], new int[0], new int[0]);
    }

    @Override
    public List<Rgb> dominantColors(BufferedImage image, int k) {
        return new ArrayList<>();
    }
}
