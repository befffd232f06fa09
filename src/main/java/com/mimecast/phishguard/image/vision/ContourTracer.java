package com.mimecast.phishguard.image.vision;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Outer boundary tracer for binary images.
 *
 * <p>Foreground is 8-connected and background 4-connected.
 * <br>Only components whose surrounding background reaches the image border are traced, so shapes
 * sitting in the hole of another shape are skipped.
 * <br>Boundaries are followed with Moore neighbour tracing from the first pixel of each component in
 * raster order and stop on re-entering that pixel from the starting direction.
 */
final class ContourTracer {

    // Clockwise on screen starting west: W, NW, N, NE, E, SE, S, SW.
    private static final int[] DX = {-1, -1, 0, 1, 1, 1, 0, -1};
    private static final int[] DY = {0, -1, -1, -1, 0, 1, 1, 1};
    private static final int[][] DIRECTION = {
            {1, 2, 3},
            {0, -1, 4},
            {7, 6, 5}
    };

    private ContourTracer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Traces the outer boundary of every external component.
     *
     * @param binary Binary image, non-zero is foreground.
     * @return List of contours in raster order of their first pixel.
     */
    static List<Contour> traceExternal(GrayImage binary) {
        int width = binary.getWidth();
        int height = binary.getHeight();
        List<Contour> contours = new ArrayList<>();
        if (width == 0 || height == 0) {
            return contours;
        }

        boolean[] outside = floodOutside(binary);
        int[] labels = new int[width * height];
        int label = 0;

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int i = y * width + x;
                if (!binary.isSet(x, y) || labels[i] != 0) {
                    continue;
                }

                label++;
                int size = labelComponent(binary, labels, x, y, label);
                if (y == 0 || outside[(y - 1) * width + x]) {
                    contours.add(trace(labels, width, height, x, y, label, size));
                }
            }
        }
        return contours;
    }

    /**
     * Marks background pixels 4-connected to the image border.
     */
    private static boolean[] floodOutside(GrayImage binary) {
        int width = binary.getWidth();
        int height = binary.getHeight();
        boolean[] outside = new boolean[width * height];
        Deque<Integer> queue = new ArrayDeque<>();

        for (int x = 0; x < width; x++) {
            seed(binary, outside, queue, x, 0);
            seed(binary, outside, queue, x, height - 1);
        }
        for (int y = 0; y < height; y++) {
            seed(binary, outside, queue, 0, y);
            seed(binary, outside, queue, width - 1, y);
        }

        while (!queue.isEmpty()) {
            int i = queue.poll();
            int x = i % width;
            int y = i / width;
            seed(binary, outside, queue, x - 1, y);
            seed(binary, outside, queue, x + 1, y);
            seed(binary, outside, queue, x, y - 1);
            seed(binary, outside, queue, x, y + 1);
        }
        return outside;
    }

    private static void seed(GrayImage binary, boolean[] outside, Deque<Integer> queue, int x, int y) {
        if (x < 0 || y < 0 || x >= binary.getWidth() || y >= binary.getHeight()) {
            return;
        }
        int i = y * binary.getWidth() + x;
        if (!outside[i] && !binary.isSet(x, y)) {
            outside[i] = true;
            queue.add(i);
        }
    }

    /**
     * Labels an 8-connected component.
     *
     * @return Component size in pixels.
     */
    private static int labelComponent(GrayImage binary, int[] labels, int startX, int startY, int label) {
        int width = binary.getWidth();
        int height = binary.getHeight();
        Deque<Integer> queue = new ArrayDeque<>();
        labels[startY * width + startX] = label;
        queue.add(startY * width + startX);
        int size = 0;

        while (!queue.isEmpty()) {
            int i = queue.poll();
            size++;
            int x = i % width;
            int y = i / width;
            for (int d = 0; d < 8; d++) {
                int nx = x + DX[d];
                int ny = y + DY[d];
                if (nx < 0 || ny < 0 || nx >= width || ny >= height) continue;
                int n = ny * width + nx;
                if (labels[n] == 0 && binary.isSet(nx, ny)) {
                    labels[n] = label;
                    queue.add(n);
                }
            }
        }
        return size;
    }

    /**
     * Moore neighbour tracing with Jacob's stopping criterion.
     */
    private static Contour trace(int[] labels, int width, int height, int startX, int startY, int label, int size) {
        List<int[]> points = new ArrayList<>();
        points.add(new int[]{startX, startY});

        int x = startX;
        int y = startY;
        int back = 0;
        int limit = 4 * size + 16;

        for (int step = 0; step < limit; step++) {
            int found = -1;
            for (int i = 1; i <= 8; i++) {
                int d = (back + i) % 8;
                int nx = x + DX[d];
                int ny = y + DY[d];
                if (nx >= 0 && ny >= 0 && nx < width && ny < height && labels[ny * width + nx] == label) {
                    found = d;
                    break;
                }
            }
            if (found < 0) {
                break;
            }

            int previous = (found + 7) % 8;
            int bx = DX[previous] - DX[found];
            int by = DY[previous] - DY[found];
            x += DX[found];
            y += DY[found];
            back = DIRECTION[by + 1][bx + 1];

            if (x == startX && y == startY && back == 0) {
                break;
            }
            points.add(new int[]{x, y});
        }

        int[] xs = new int[points.size()];
        int[] ys = new int[points.size()];
        for (int i = 0; i < points.size(); i++) {
            xs[i] = points.get(i)[0];
            ys[i] = points.get(i)[1];
        }
        return new Contour(xs, ys);
    }
}
