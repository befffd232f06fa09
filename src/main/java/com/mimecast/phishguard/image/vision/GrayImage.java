package com.mimecast.phishguard.image.vision;

/**
 * Single channel 8 bit image.
 *
 * <p>Pixels are stored row major as ints within 0-255.
 */
public final class GrayImage {
    private final int width;
    private final int height;
    private final int[] pixels;

    /**
     * Constructs a new black GrayImage instance.
     *
     * @param width  Width in pixels.
     * @param height Height in pixels.
     */
    public GrayImage(int width, int height) {
        this(width, height, new int[Math.multiplyExact(width, height)]);
    }

    /**
     * Constructs a new GrayImage instance over the given pixels.
     *
     * @param width  Width in pixels.
     * @param height Height in pixels.
     * @param pixels Row major pixels, not copied.
     */
    GrayImage(int width, int height, int[] pixels) {
        if (width < 0 || height < 0 || pixels.length != width * height) {
            throw new IllegalArgumentException("Bad image dimensions " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Gets pixel value.
     *
     * @param x Column.
     * @param y Row.
     * @return Value 0-255.
     */
    public int get(int x, int y) {
        return pixels[y * width + x];
    }

    /**
     * Sets pixel value.
     *
     * @param x     Column.
     * @param y     Row.
     * @param value Value, clamped to 0-255.
     */
    public void set(int x, int y, int value) {
        pixels[y * width + x] = Math.max(0, Math.min(255, value));
    }

    /**
     * Gets pixel value with coordinates clamped to the image, replicating the border.
     */
    int getClamped(int x, int y) {
        int cx = Math.max(0, Math.min(width - 1, x));
        int cy = Math.max(0, Math.min(height - 1, y));
        return pixels[cy * width + cx];
    }

    /**
     * Copies a region.
     * <p>The region is intersected with the image.
     *
     * @param x      Left column.
     * @param y      Top row.
     * @param width  Region width.
     * @param height Region height.
     * @return New GrayImage instance.
     */
    public GrayImage crop(int x, int y, int width, int height) {
        int left = Math.max(0, x);
        int top = Math.max(0, y);
        int right = Math.min(this.width, x + Math.max(0, width));
        int bottom = Math.min(this.height, y + Math.max(0, height));
        int w = Math.max(0, right - left);
        int h = Math.max(0, bottom - top);

        int[] region = new int[w * h];
        for (int row = 0; row < h; row++) {
            System.arraycopy(pixels, (top + row) * this.width + left, region, row * w, w);
        }
        return new GrayImage(w, h, region);
    }

    /**
     * Counts pixels strictly between two values.
     *
     * @param low  Exclusive lower bound.
     * @param high Exclusive upper bound.
     * @return Pixel count.
     */
    public long countBetween(int low, int high) {
        long count = 0;
        for (int value : pixels) {
            if (value > low && value < high) count++;
        }
        return count;
    }

    /**
     * Checks if pixel is set.
     *
     * @param x Column.
     * @param y Row.
     * @return True for non-zero pixels.
     */
    public boolean isSet(int x, int y) {
        return pixels[y * width + x] != 0;
    }

    /**
     * Gets pixel count.
     *
     * @return Width times height.
     */
    public int size() {
        return pixels.length;
    }
}
