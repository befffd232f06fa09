package com.mimecast.phishguard.image.vision;

import java.util.Arrays;

/**
 * Closed polygon of pixel coordinates.
 *
 * <p>Traced boundaries and their polygon approximations are both contours.
 */
public final class Contour {
    private final int[] xs;
    private final int[] ys;

    /**
     * Constructs a new Contour instance.
     *
     * @param xs Columns.
     * @param ys Rows.
     */
    public Contour(int[] xs, int[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("Coordinate arrays differ in length");
        }
        this.xs = xs.clone();
        this.ys = ys.clone();
    }

    /**
     * Gets number of points.
     *
     * @return Point count.
     */
    public int size() {
        return xs.length;
    }

    public int getX(int index) {
        return xs[index];
    }

    public int getY(int index) {
        return ys[index];
    }

    /**
     * Gets enclosed area.
     * <p>Shoelace formula over the points, so a traced 10x10 square encloses 81.
     *
     * @return Non-negative area.
     */
    public double area() {
        long twice = 0;
        for (int i = 0, n = xs.length; i < n; i++) {
            int j = (i + 1) % n;
            twice += (long) xs[i] * ys[j] - (long) xs[j] * ys[i];
        }
        return Math.abs(twice) / 2.0;
    }

    /**
     * Gets closed perimeter.
     *
     * @return Length including the closing segment.
     */
    public double perimeter() {
        double length = 0;
        for (int i = 0, n = xs.length; i < n && n > 1; i++) {
            int j = (i + 1) % n;
            length += Math.hypot(xs[j] - xs[i], ys[j] - ys[i]);
        }
        return length;
    }

    /**
     * Gets bounding rectangle.
     *
     * @return Bounds instance.
     */
    public Bounds bounds() {
        if (xs.length == 0) {
            return new Bounds(0, 0, 0, 0);
        }
        int minX = Arrays.stream(xs).min().getAsInt();
        int maxX = Arrays.stream(xs).max().getAsInt();
        int minY = Arrays.stream(ys).min().getAsInt();
        int maxY = Arrays.stream(ys).max().getAsInt();
        return new Bounds(minX, minY, maxX - minX + 1, maxY - minY + 1);
    }

    @Override
    public String toString() {
        return "Contour{points=" + xs.length + ", " + bounds() + "}";
    }
}
