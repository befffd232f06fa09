/**
 * Raster vision primitives over {@link java.awt.image.BufferedImage}.
 *
 * <p>Grayscale, thresholding, Canny edges, dilation, external contours, polygon approximation,
 * <br>HSV conversion and k-means colour clustering.
 * <br>All operations are deterministic.
 */
package com.mimecast.phishguard.image.vision;
