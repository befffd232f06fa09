package com.mimecast.phishguard.image.vision;

import com.mimecast.phishguard.signals.detect.Rgb;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Pure Java vision primitives over {@link BufferedImage} rasters.
 */
public class RasterVision implements VisionToolkit {

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public GrayImage grayscale(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = new int[width * height];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                pixels[y * width + x] = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return new GrayImage(width, height, pixels);
    }

    @Override
    public GrayImage threshold(GrayImage image, int threshold) {
        GrayImage out = new GrayImage(image.getWidth(), image.getHeight());
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                out.set(x, y, image.get(x, y) > threshold ? 255 : 0);
            }
        }
        return out;
    }

    @Override
    public GrayImage canny(GrayImage image, double lowThreshold, double highThreshold) {
        return new CannyEdgeDetector(lowThreshold, highThreshold).detect(image);
    }

    @Override
    public GrayImage dilate(GrayImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        GrayImage out = new GrayImage(width, height);

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int max = 0;
                for (int dy = -1; dy <= 1 && max < 255; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = x + dx;
                        int ny = y + dy;
                        if (nx >= 0 && ny >= 0 && nx < width && ny < height) {
                            max = Math.max(max, image.get(nx, ny));
                        }
                    }
                }
                out.set(x, y, max);
            }
        }
        return out;
    }

    @Override
    public List<Contour> findExternalContours(GrayImage binary) {
        return ContourTracer.traceExternal(binary);
    }

    @Override
    public Contour approxPolygon(Contour contour, double epsilon) {
        return PolygonApproximator.approximate(contour, epsilon);
    }

    @Override
    public HsvImage toHsv(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] hue = new int[width * height];
        int[] saturation = new int[width * height];
        int[] value = new int[width * height];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                int max = Math.max(r, Math.max(g, b));
                int min = Math.min(r, Math.min(g, b));
                int delta = max - min;
                int i = y * width + x;

                value[i] = max;
                saturation[i] = max == 0 ? 0 : (int) Math.round(255.0 * delta / max);

                double h = 0;
                if (delta != 0) {
                    if (max == r) {
                        h = 60.0 * (g - b) / delta;
                    } else if (max == g) {
                        h = 120.0 + 60.0 * (b - r) / delta;
                    } else {
                        h = 240.0 + 60.0 * (r - g) / delta;
                    }
                    if (h < 0) h += 360;
                }
                hue[i] = (int) Math.round(h / 2) % 180;
            }
        }
        return new HsvImage(width, height, hue, saturation, value);
    }

    @Override
    public List<Rgb> dominantColors(BufferedImage image, int k) {
        return ColorClusterer.dominantColors(image, k);
    }
}
