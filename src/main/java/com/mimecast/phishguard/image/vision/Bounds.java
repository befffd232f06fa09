package com.mimecast.phishguard.image.vision;

/**
 * Upright bounding rectangle.
 * <p>Width and height count pixels, so a single pixel has 1x1 bounds.
 */
public final class Bounds {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public Bounds(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Gets width over height.
     *
     * @return Aspect ratio, 0 for zero height.
     */
    public double getAspectRatio() {
        return height > 0 ? (double) width / height : 0;
    }

    @Override
    public String toString() {
        return "Bounds{" + x + "," + y + " " + width + "x" + height + "}";
    }
}
