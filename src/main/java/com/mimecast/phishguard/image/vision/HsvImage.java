package com.mimecast.phishguard.image.vision;

/**
 * HSV image with 8 bit channels.
 *
 * <p>Hue is halved to fit 0-179, saturation and value are 0-255.
 */
public final class HsvImage {
    private final int width;
    private final int height;
    private final int[] hue;
    private final int[] saturation;
    private final int[] value;

    HsvImage(int width, int height, int[] hue, int[] saturation, int[] value) {
        this.width = width;
        this.height = height;
        this.hue = hue;
        this.saturation = saturation;
        this.value = value;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getHue(int x, int y) {
        return hue[y * width + x];
    }

    public int getSaturation(int x, int y) {
        return saturation[y * width + x];
    }

    public int getValue(int x, int y) {
        return value[y * width + x];
    }

    /**
     * Counts pixels with saturation and value both strictly above the given minimums.
     *
     * @param minSaturation Exclusive saturation minimum.
     * @param minValue      Exclusive value minimum.
     * @return Pixel count.
     */
    public long countBright(int minSaturation, int minValue) {
        long count = 0;
        for (int i = 0; i < value.length; i++) {
            if (saturation[i] > minSaturation && value[i] > minValue) count++;
        }
        return count;
    }

    /**
     * Gets pixel count.
     *
     * @return Width times height.
     */
    public int size() {
        return value.length;
    }
}
