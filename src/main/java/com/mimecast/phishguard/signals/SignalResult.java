package com.mimecast.phishguard.signals;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finding of a single signal or of an aggregated verdict.
 *
 * <p>Every sub-analysis and every engine returns one of these.
 * <br>The shape is fixed: an additive non-negative risk score, a deduplicated set of indicator tags
 * and a confidence within [0, 1].
 * <br>Two explicit variants exist next to the regular one:
 * <ul>
 *     <li><b>DEGRADED</b> - a fixed low-information result given when a required collaborator is missing.</li>
 *     <li><b>ERROR</b> - the input could not be analysed at all, see {@link #getError()}.</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share.
 */
public final class SignalResult {

    /**
     * Result variant.
     */
    public enum Variant {
        SUCCESS,
        DEGRADED,
        ERROR
    }

    private static final SignalResult EMPTY = new SignalResult(Variant.SUCCESS, 0, Collections.emptySet(), 0, null, null);

    private final Variant variant;
    private final double riskScore;
    private final Set<String> indicators;
    private final double confidence;
    private final String error;
    private final String note;

    private SignalResult(Variant variant, double riskScore, Collection<String> indicators, double confidence, String error, String note) {
        if (Double.isNaN(riskScore) || riskScore < 0) {
            throw new IllegalArgumentException("Risk score must be a non-negative number: " + riskScore);
        }
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
        }

        this.variant = variant;
        this.riskScore = riskScore;
        this.indicators = Collections.unmodifiableSet(new TreeSet<>(indicators));
        this.confidence = confidence;
        this.error = error;
        this.note = note;
    }

    /**
     * Constructs a regular result.
     *
     * @param riskScore  Non-negative risk score.
     * @param indicators Indicator tags, duplicates are dropped.
     * @param confidence Confidence within [0, 1].
     * @return SignalResult instance.
     */
    public static SignalResult of(double riskScore, Collection<String> indicators, double confidence) {
        return new SignalResult(Variant.SUCCESS, riskScore, Objects.requireNonNull(indicators), confidence, null, null);
    }

    /**
     * Gets the zero result.
     * <p>No score, no indicators, no confidence.
     *
     * @return SignalResult instance.
     */
    public static SignalResult empty() {
        return EMPTY;
    }

    /**
     * Constructs a degraded result.
     *
     * @param riskScore  Fixed risk score.
     * @param confidence Fixed confidence.
     * @param indicator  Single indicator explaining the degradation.
     * @param note       Human readable note.
     * @return SignalResult instance.
     */
    public static SignalResult degraded(double riskScore, double confidence, String indicator, String note) {
        return new SignalResult(Variant.DEGRADED, riskScore, Collections.singleton(indicator), confidence, null, note);
    }

    /**
     * Constructs an error result.
     * <p>Carries the {@code analysis_error} indicator and a zero score.
     *
     * @param message Error message.
     * @return SignalResult instance.
     */
    public static SignalResult error(String message) {
        return new SignalResult(Variant.ERROR, 0, Collections.singleton("analysis_error"), 0, message, null);
    }

    /**
     * Gets variant.
     *
     * @return Variant.
     */
    public Variant getVariant() {
        return variant;
    }

    /**
     * Gets risk score.
     *
     * @return Non-negative score, never clamped.
     */
    public double getRiskScore() {
        return riskScore;
    }

    /**
     * Gets indicators.
     *
     * @return Unmodifiable sorted set of tags.
     */
    public Set<String> getIndicators() {
        return indicators;
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
     * Gets risk level.
     * <p>Derived from the score unless this is an error result.
     *
     * @return RiskLevel.
     */
    public RiskLevel getRiskLevel() {
        return variant == Variant.ERROR ? RiskLevel.ERROR : RiskLevel.fromScore(riskScore);
    }

    /**
     * Gets error message.
     *
     * @return Optional of String, present for error results only.
     */
    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Gets degradation note.
     *
     * @return Optional of String, present for degraded results only.
     */
    public Optional<String> getNote() {
        return Optional.ofNullable(note);
    }

    /**
     * Checks if the result carries a usable score.
     *
     * @return True unless this is an error result.
     */
    public boolean hasValidScore() {
        return variant != Variant.ERROR && Double.isFinite(riskScore);
    }

    /**
     * Checks if an indicator is present.
     *
     * @param indicator Indicator tag.
     * @return Boolean.
     */
    public boolean hasIndicator(String indicator) {
        return indicators.contains(indicator);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalResult)) return false;
        SignalResult that = (SignalResult) o;
        return Double.compare(that.riskScore, riskScore) == 0 &&
                Double.compare(that.confidence, confidence) == 0 &&
                variant == that.variant &&
                indicators.equals(that.indicators) &&
                Objects.equals(error, that.error) &&
                Objects.equals(note, that.note);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variant, riskScore, indicators, confidence, error, note);
    }

    @Override
    public String toString() {
        return "SignalResult{" +
                "riskLevel=" + getRiskLevel() +
                ", riskScore=" + riskScore +
                ", confidence=" + confidence +
                ", indicators=" + indicators +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
