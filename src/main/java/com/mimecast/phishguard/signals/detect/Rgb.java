package com.mimecast.phishguard.signals.detect;

import java.util.List;
import java.util.Objects;

/**
 * 8 bit RGB colour.
 */
public final class Rgb {
    private final int red;
    private final int green;
    private final int blue;

    /**
     * Constructs a new Rgb instance.
     *
     * @param red   Red channel 0-255.
     * @param green Green channel 0-255.
     * @param blue  Blue channel 0-255.
     */
    public Rgb(int red, int green, int blue) {
        this.red = clamp(red);
        this.green = clamp(green);
        this.blue = clamp(blue);
    }

    /**
     * Constructs from a packed ARGB/RGB int as returned by {@code BufferedImage.getRGB}.
     *
     * @param packed Packed pixel.
     * @return Rgb instance.
     */
    public static Rgb fromPacked(int packed) {
        return new Rgb((packed >> 16) & 0xFF, (packed >> 8) & 0xFF, packed & 0xFF);
    }

    /**
     * Constructs from a three element list as found in JSON configuration.
     *
     * @param values List of numbers.
     * @return Rgb instance.
     * @throws IllegalArgumentException If the list does not hold three numbers.
     */
    public static Rgb fromList(List<?> values) {
        if (values == null || values.size() != 3) {
            throw new IllegalArgumentException("RGB colour needs exactly three values: " + values);
        }
        int[] channels = new int[3];
        for (int i = 0; i < 3; i++) {
            if (!(values.get(i) instanceof Number)) {
                throw new IllegalArgumentException("RGB channel is not a number: " + values.get(i));
            }
            channels[i] = ((Number) values.get(i)).intValue();
        }
        return new Rgb(channels[0], channels[1], channels[2]);
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rgb)) return false;
        Rgb rgb = (Rgb) o;
        return red == rgb.red && green == rgb.green && blue == rgb.blue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(red, green, blue);
    }

    @Override
    public String toString() {
        return "(" + red + ", " + green + ", " + blue + ")";
    }
}
