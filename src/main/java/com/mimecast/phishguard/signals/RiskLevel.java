package com.mimecast.phishguard.signals;

/**
 * Risk level derived from an additive risk score.
 *
 * <p>Levels are never stored on their own, they are always computed from the score:
 * <ul>
 *     <li><b>low</b> [0, 30)</li>
 *     <li><b>medium</b> [30, 60)</li>
 *     <li><b>high</b> [60, 80)</li>
 *     <li><b>critical</b> [80, ∞)</li>
 * </ul>
 * <p>{@link #ERROR} is reserved for results of analyses that could not run at all.
 */
public enum RiskLevel {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical"),
    ERROR("error");

    private static final double MEDIUM_THRESHOLD = 30;
    private static final double HIGH_THRESHOLD = 60;
    private static final double CRITICAL_THRESHOLD = 80;

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    /**
     * Gets the lower case label.
     *
     * @return Label string.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Derives the risk level for a score.
     *
     * @param score Risk score.
     * @return RiskLevel instance.
     */
    public static RiskLevel fromScore(double score) {
        if (score >= CRITICAL_THRESHOLD) {
            return CRITICAL;
        } else if (score >= HIGH_THRESHOLD) {
            return HIGH;
        } else if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    @Override
    public String toString() {
        return label;
    }
}
