package com.mimecast.phishguard.image.vision;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Douglas-Peucker simplification of closed contours.
 *
 * <p>The curve is split at two mutually distant points and each half is simplified on its own.
 * <br>A point is kept when it lies further than epsilon from the chord of its segment.
 */
final class PolygonApproximator {

    private PolygonApproximator() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Simplifies a closed contour.
     *
     * @param contour Contour to simplify.
     * @param epsilon Maximum distance of dropped points.
     * @return Simplified contour.
     */
    static Contour approximate(Contour contour, double epsilon) {
        int n = contour.size();
        if (n <= 2) {
            return contour;
        }

        int far = farthest(contour, 0);
        int start = farthest(contour, far);
        if (start == far) {
            return new Contour(new int[]{contour.getX(0)}, new int[]{contour.getY(0)});
        }

        boolean[] keep = new boolean[n];
        keep[start] = true;
        keep[far] = true;
        simplify(contour, start, far, epsilon, keep);
        simplify(contour, far, start, epsilon, keep);

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            int index = (start + i) % n;
            if (keep[index]) {
                order.add(index);
            }
        }

        int[] xs = new int[order.size()];
        int[] ys = new int[order.size()];
        for (int i = 0; i < order.size(); i++) {
            xs[i] = contour.getX(order.get(i));
            ys[i] = contour.getY(order.get(i));
        }
        return new Contour(xs, ys);
    }

    /**
     * Simplifies the chain running forward from first to last, wrapping around.
     */
    private static void simplify(Contour contour, int first, int last, double epsilon, boolean[] keep) {
        int n = contour.size();
        Deque<int[]> segments = new ArrayDeque<>();
        segments.push(new int[]{first, last});

        while (!segments.isEmpty()) {
            int[] segment = segments.pop();
            int from = segment[0];
            int to = segment[1];
            int length = Math.floorMod(to - from, n);
            if (length < 2) {
                continue;
            }

            double max = -1;
            int split = -1;
            for (int step = 1; step < length; step++) {
                int index = (from + step) % n;
                double distance = distance(contour, index, from, to);
                if (distance > max) {
                    max = distance;
                    split = index;
                }
            }

            if (max > epsilon) {
                keep[split] = true;
                segments.push(new int[]{from, split});
                segments.push(new int[]{split, to});
            }
        }
    }

    /**
     * Distance of a point to the line through two others, or to the first when they coincide.
     */
    private static double distance(Contour contour, int point, int from, int to) {
        double px = contour.getX(point);
        double py = contour.getY(point);
        double ax = contour.getX(from);
        double ay = contour.getY(from);
        double dx = contour.getX(to) - ax;
        double dy = contour.getY(to) - ay;

        double length = Math.hypot(dx, dy);
        if (length == 0) {
            return Math.hypot(px - ax, py - ay);
        }
        return Math.abs(dx * (py - ay) - dy * (px - ax)) / length;
    }

    private static int farthest(Contour contour, int from) {
        int best = from;
        double max = -1;
        for (int i = 0; i < contour.size(); i++) {
            double distance = Math.hypot(contour.getX(i) - contour.getX(from), contour.getY(i) - contour.getY(from));
            if (distance > max) {
                max = distance;
                best = i;
            }
        }
        return best;
    }
}
