package com.mimecast.phishguard.image.vision;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Canny edge detector.
 *
 * <p>3x3 Sobel gradients with replicated borders, L1 magnitude, non maximum suppression along four
 * quantised directions and hysteresis over 8-connected neighbours.
 * <br>Output pixels are 255 on edges and 0 elsewhere.
 */
final class CannyEdgeDetector {

    private static final double TAN_22_5 = Math.tan(Math.toRadians(22.5));
    private static final double TAN_67_5 = Math.tan(Math.toRadians(67.5));

    private static final byte WEAK = 1;
    private static final byte STRONG = 2;

    private final double lowThreshold;
    private final double highThreshold;

    /**
     * Constructs a new CannyEdgeDetector instance.
     *
     * @param lowThreshold  Hysteresis low threshold.
     * @param highThreshold Hysteresis high threshold.
     */
    CannyEdgeDetector(double lowThreshold, double highThreshold) {
        this.lowThreshold = Math.min(lowThreshold, highThreshold);
        this.highThreshold = Math.max(lowThreshold, highThreshold);
    }

    /**
     * Detects edges.
     *
     * @param image Source image.
     * @return Binary edge map.
     */
    GrayImage detect(GrayImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] gx = new int[width * height];
        int[] gy = new int[width * height];
        int[] magnitude = new int[width * height];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int tl = image.getClamped(x - 1, y - 1);
                int t = image.getClamped(x, y - 1);
                int tr = image.getClamped(x + 1, y - 1);
                int l = image.getClamped(x - 1, y);
                int r = image.getClamped(x + 1, y);
                int bl = image.getClamped(x - 1, y + 1);
                int b = image.getClamped(x, y + 1);
                int br = image.getClamped(x + 1, y + 1);

                int i = y * width + x;
                gx[i] = (tr + 2 * r + br) - (tl + 2 * l + bl);
                gy[i] = (bl + 2 * b + br) - (tl + 2 * t + tr);
                magnitude[i] = Math.abs(gx[i]) + Math.abs(gy[i]);
            }
        }

        byte[] state = suppress(width, height, gx, gy, magnitude);
        return hysteresis(width, height, state);
    }

    /**
     * Thins edges to local maxima across the gradient and classifies them.
     */
    private byte[] suppress(int width, int height, int[] gx, int[] gy, int[] magnitude) {
        byte[] state = new byte[width * height];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                int m = magnitude[i];
                if (m <= lowThreshold) {
                    continue;
                }

                double ax = Math.abs(gx[i]);
                double ay = Math.abs(gy[i]);
                int prev;
                int next;
                if (ay <= ax * TAN_22_5) {
                    prev = at(magnitude, width, height, x - 1, y);
                    next = at(magnitude, width, height, x + 1, y);
                } else if (ay > ax * TAN_67_5) {
                    prev = at(magnitude, width, height, x, y - 1);
                    next = at(magnitude, width, height, x, y + 1);
                } else if ((gx[i] < 0) == (gy[i] < 0)) {
                    prev = at(magnitude, width, height, x - 1, y - 1);
                    next = at(magnitude, width, height, x + 1, y + 1);
                } else {
                    prev = at(magnitude, width, height, x + 1, y - 1);
                    next = at(magnitude, width, height, x - 1, y + 1);
                }

                if (m > prev && m >= next) {
                    state[i] = m > highThreshold ? STRONG : WEAK;
                }
            }
        }
        return state;
    }

    /**
     * Keeps weak edges connected to strong ones.
     */
    private GrayImage hysteresis(int width, int height, byte[] state) {
        int[] out = new int[width * height];
        Deque<Integer> queue = new ArrayDeque<>();

        for (int i = 0; i < state.length; i++) {
            if (state[i] == STRONG) {
                out[i] = 255;
                queue.add(i);
            }
        }

        while (!queue.isEmpty()) {
            int i = queue.poll();
            int x = i % width;
            int y = i / width;
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    int nx = x + dx;
                    int ny = y + dy;
                    if (nx < 0 || ny < 0 || nx >= width || ny >= height) continue;
                    int n = ny * width + nx;
                    if (state[n] == WEAK && out[n] == 0) {
                        out[n] = 255;
                        queue.add(n);
                    }
                }
            }
        }

        return new GrayImage(width, height, out);
    }

    private static int at(int[] values, int width, int height, int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            return 0;
        }
        return values[y * width + x];
    }
}
