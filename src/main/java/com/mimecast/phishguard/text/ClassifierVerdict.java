package com.mimecast.phishguard.text;

import java.util.Locale;
import java.util.Objects;

/**
 * Label and confidence given by a text classifier.
 */
public final class ClassifierVerdict {

    /**
     * Spam label.
     */
    public static final String SPAM = "spam";

    /**
     * Ham label.
     */
    public static final String HAM = "ham";

    private final String label;
    private final double confidence;

    /**
     * Constructs a new ClassifierVerdict instance.
     *
     * @param label      Predicted label.
     * @param confidence Confidence within [0, 1].
     * @throws IllegalArgumentException If the confidence is out of range.
     */
    public ClassifierVerdict(String label, double confidence) {
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Classifier confidence must be within [0, 1]: " + confidence);
        }
        this.label = Objects.requireNonNull(label);
        this.confidence = confidence;
    }

    /**
     * Gets label.
     *
     * @return String.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Gets confidence.
     *
     * @return Confidence within [0, 1].
     */
    public double getConfidence() {
        return confidence;
    }

    /**
     * Checks if the label denotes spam.
     * <p>Case insensitive, classifiers disagree on casing.
     *
     * @return Boolean.
     */
    public boolean isSpam() {
        return SPAM.equals(label.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return label + " (" + confidence + ")";
    }
}
