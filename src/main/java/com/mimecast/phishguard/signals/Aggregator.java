package com.mimecast.phishguard.signals;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds partial signal results into one verdict.
 *
 * <p>Scores are summed, indicators are unioned and confidence is the mean confidence of the entries
 * that carry a valid score.
 * <br>Null entries and error results are skipped.
 * <br>When nothing valid is left the confidence is zero.
 *
 * <p>Scores and confidences are summed in ascending order so the outcome does not depend on the order
 * of the input, not even in the last floating point bit.
 */
public final class Aggregator {

    /**
     * Private constructor.
     */
    private Aggregator() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Combines results.
     *
     * @param results Results to combine.
     * @return Combined SignalResult.
     */
    public static SignalResult combine(List<SignalResult> results) {
        if (results == null || results.isEmpty()) {
            return SignalResult.empty();
        }

        double[] scores = new double[results.size()];
        double[] confidences = new double[results.size()];
        Set<String> indicators = new HashSet<>();
        int valid = 0;

        for (SignalResult result : results) {
            if (result == null || !result.hasValidScore()) {
                continue;
            }

            scores[valid] = result.getRiskScore();
            confidences[valid] = result.getConfidence();
            indicators.addAll(result.getIndicators());
            valid++;
        }

        if (valid == 0) {
            return SignalResult.empty();
        }

        double confidence = sortedSum(confidences, valid) / valid;
        return SignalResult.of(sortedSum(scores, valid), indicators, Math.min(1.0, confidence));
    }

    /**
     * Combines results.
     *
     * @param results Results to combine.
     * @return Combined SignalResult.
     */
    public static SignalResult combine(SignalResult... results) {
        return combine(Arrays.asList(results));
    }

    /**
     * Sums the first entries of an array in ascending order.
     *
     * @param values Values array.
     * @param length Number of entries to use.
     * @return Sum.
     */
    private static double sortedSum(double[] values, int length) {
        double[] copy = Arrays.copyOf(values, length);
        Arrays.sort(copy);

        double sum = 0;
        for (double value : copy) {
            sum += value;
        }
        return sum;
    }
}
