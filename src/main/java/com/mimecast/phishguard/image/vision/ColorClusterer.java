package com.mimecast.phishguard.image.vision;

import com.mimecast.phishguard.signals.detect.Rgb;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * K-means colour clustering.
 *
 * <p>Pixels are sampled on a regular stride, centres are seeded with k-means++ from a fixed seed and
 * refined until no centre moves more than the tolerance.
 * <br>The same image always yields the same centres.
 */
final class ColorClusterer {

    static final int MAX_SAMPLES = 20000;
    static final int MAX_ITERATIONS = 200;
    static final double TOLERANCE = 0.1;
    private static final long SEED = 0x5eedL;

    private ColorClusterer() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets cluster centres.
     *
     * @param image BufferedImage instance.
     * @param k     Number of clusters.
     * @return Centres ordered by cluster size, largest first; empty for an empty image.
     */
    static List<Rgb> dominantColors(BufferedImage image, int k) {
        double[][] samples = sample(image);
        if (samples.length == 0 || k <= 0) {
            return new ArrayList<>();
        }

        double[][] centers = seed(samples, k, new Random(SEED));
        int[] assignment = new int[samples.length];
        int[] counts = new int[k];

        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            assign(samples, centers, assignment);

            double[][] sums = new double[k][3];
            Arrays.fill(counts, 0);
            for (int i = 0; i < samples.length; i++) {
                int c = assignment[i];
                counts[c]++;
                sums[c][0] += samples[i][0];
                sums[c][1] += samples[i][1];
                sums[c][2] += samples[i][2];
            }

            double shift = 0;
            for (int c = 0; c < k; c++) {
                if (counts[c] == 0) {
                    continue;
                }
                double[] updated = {sums[c][0] / counts[c], sums[c][1] / counts[c], sums[c][2] / counts[c]};
                shift = Math.max(shift, Math.sqrt(squared(updated, centers[c])));
                centers[c] = updated;
            }

            if (shift < TOLERANCE) {
                break;
            }
        }

        assign(samples, centers, assignment);
        Arrays.fill(counts, 0);
        for (int c : assignment) {
            counts[c]++;
        }

        Integer[] order = new Integer[k];
        for (int c = 0; c < k; c++) {
            order[c] = c;
        }
        Arrays.sort(order, Comparator.comparingInt((Integer c) -> counts[c]).reversed().thenComparingInt(c -> c));

        List<Rgb> colors = new ArrayList<>();
        for (int c : order) {
            colors.add(new Rgb((int) Math.round(centers[c][0]), (int) Math.round(centers[c][1]), (int) Math.round(centers[c][2])));
        }
        return colors;
    }

    private static double[][] sample(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        long total = (long) width * height;
        if (total == 0) {
            return new double[0][];
        }

        int stride = (int) Math.max(1, (total + MAX_SAMPLES - 1) / MAX_SAMPLES);
        double[][] samples = new double[(int) ((total + stride - 1) / stride)][];
        int n = 0;
        for (long i = 0; i < total; i += stride) {
            int rgb = image.getRGB((int) (i % width), (int) (i / width));
            samples[n++] = new double[]{(rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF};
        }
        return Arrays.copyOf(samples, n);
    }

    /**
     * k-means++ seeding.
     */
    private static double[][] seed(double[][] samples, int k, Random random) {
        double[][] centers = new double[k][];
        centers[0] = samples[random.nextInt(samples.length)].clone();
        double[] nearest = new double[samples.length];
        Arrays.fill(nearest, Double.MAX_VALUE);

        for (int c = 1; c < k; c++) {
            double total = 0;
            for (int i = 0; i < samples.length; i++) {
                nearest[i] = Math.min(nearest[i], squared(samples[i], centers[c - 1]));
                total += nearest[i];
            }

            if (total == 0) {
                centers[c] = samples[random.nextInt(samples.length)].clone();
                continue;
            }

            double target = random.nextDouble() * total;
            int chosen = samples.length - 1;
            for (int i = 0; i < samples.length; i++) {
                target -= nearest[i];
                if (target <= 0) {
                    chosen = i;
                    break;
                }
            }
            centers[c] = samples[chosen].clone();
        }
        return centers;
    }

    private static void assign(double[][] samples, double[][] centers, int[] assignment) {
        for (int i = 0; i < samples.length; i++) {
            int best = 0;
            double min = Double.MAX_VALUE;
            for (int c = 0; c < centers.length; c++) {
                double distance = squared(samples[i], centers[c]);
                if (distance < min) {
                    min = distance;
                    best = c;
                }
            }
            assignment[i] = best;
        }
    }

    private static double squared(double[] a, double[] b) {
        double dr = a[0] - b[0];
        double dg = a[1] - b[1];
        double db = a[2] - b[2];
        return dr * dr + dg * dg + db * db;
    }
}
