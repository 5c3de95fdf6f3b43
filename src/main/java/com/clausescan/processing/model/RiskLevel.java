package com.clausescan.processing.model;

/**
 * Coarse banding of the 0-100 risk score.
 */
public enum RiskLevel {

    LOW("Low", "Mostly standard terms with no particularly aggressive conditions detected."),
    MEDIUM("Medium", "Has some notable clauses around liability, data use, or cancellation that deserve attention."),
    HIGH("High", "Contains several aggressive clauses such as liability waivers, arbitration requirements, or data-sharing terms.");

    public static final int MEDIUM_THRESHOLD = 25;
    public static final int HIGH_THRESHOLD = 50;

    private final String label;
    private final String reason;

    RiskLevel(String label, String reason) {
        this.label = label;
        this.reason = reason;
    }

    public String getLabel() {
        return label;
    }

    public String getReason() {
        return reason;
    }

    public static RiskLevel forScore(int score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
