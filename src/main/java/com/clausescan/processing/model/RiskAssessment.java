package com.clausescan.processing.model;

import java.util.List;

/**
 * Risk score with the evidence that produced it. The evidence list may be truncated;
 * {@link #getRawScore()} always reflects every match.
 */
public class RiskAssessment {

    private final int score;
    private final int rawScore;
    private final int matchCount;
    private final RiskLevel level;
    private final List<RiskEvidence> evidence;

    public RiskAssessment(int score, int rawScore, int matchCount, RiskLevel level, List<RiskEvidence> evidence) {
        this.score = score;
        this.rawScore = rawScore;
        this.matchCount = matchCount;
        this.level = level;
        this.evidence = List.copyOf(evidence);
    }

    public static RiskAssessment none() {
        return new RiskAssessment(0, 0, 0, RiskLevel.LOW, List.of());
    }

    public int getScore() {
        return score;
    }

    public int getRawScore() {
        return rawScore;
    }

    public int getMatchCount() {
        return matchCount;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getReason() {
        return level.getReason();
    }

    public List<RiskEvidence> getEvidence() {
        return evidence;
    }
}
