package com.mimecast.phishguard.image.vision;

import com.mimecast.phishguard.signals.detect.Rgb;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Vision primitives collaborator.
 *
 * <p>Everything the image analyses need from computer vision: grayscale and HSV conversion,
 * thresholding, edge detection, outer contours, polygon approximation and colour clustering.
 * <br>Implementations must be stateless or thread safe.
 */
public interface VisionToolkit {

    /**
     * Checks if the toolkit is configured.
     *
     * @return Boolean.
     */
    boolean isAvailable();

    /**
     * Converts to grayscale with ITU-R BT.601 weights.
     *
     * @param image BufferedImage instance.
     * @return GrayImage instance.
     */
    GrayImage grayscale(BufferedImage image);

    /**
     * Binary threshold.
     *
     * @param image     Source image.
     * @param threshold Pixels strictly above become 255, others 0.
     * @return GrayImage instance.
     */
    GrayImage threshold(GrayImage image, int threshold);

    /**
     * Canny edge detection.
     *
     * @param image         Source image.
     * @param lowThreshold  Hysteresis low threshold.
     * @param highThreshold Hysteresis high threshold.
     * @return Binary edge map.
     */
    GrayImage canny(GrayImage image, double lowThreshold, double highThreshold);

    /**
     * 3x3 dilation of a binary image.
     *
     * @param image Binary image.
     * @return Dilated image.
     */
    GrayImage dilate(GrayImage image);

    /**
     * Finds outer contours of a binary image.
     *
     * @param binary Binary image.
     * @return List of contours.
     */
    List<Contour> findExternalContours(GrayImage binary);

    /**
     * Approximates a closed contour with a polygon.
     *
     * @param contour Contour instance.
     * @param epsilon Maximum deviation.
     * @return Polygon as a contour.
     */
    Contour approxPolygon(Contour contour, double epsilon);

    /**
     * Converts to HSV.
     *
     * @param image BufferedImage instance.
     * @return HsvImage instance.
     */
    HsvImage toHsv(BufferedImage image);

    /**
     * Gets dominant colours.
     *
     * @param image BufferedImage instance.
     * @param k     Number of colours.
     * @return Colours, most frequent first.
     */
    List<Rgb> dominantColors(BufferedImage image, int k);

    /**
     * Finds edge contours.
     * <p>Canny, dilation to close gaps, then outer contours.
     *
     * @param image         Source image.
     * @param lowThreshold  Canny low threshold.
     * @param highThreshold Canny high threshold.
     * @return List of contours.
     */
    default List<Contour> edgeContours(GrayImage image, double lowThreshold, double highThreshold) {
        return findExternalContours(dilate(canny(image, lowThreshold, highThreshold)));
    }

    /**
     * Counts polygon vertices of a contour approximated within the given fraction of its perimeter.
     *
     * @param contour  Contour instance.
     * @param fraction Fraction of the perimeter used as epsilon.
     * @return Vertex count.
     */
    default int vertexCount(Contour contour, double fraction) {
        return approxPolygon(contour, fraction * contour.perimeter()).size();
    }
}
