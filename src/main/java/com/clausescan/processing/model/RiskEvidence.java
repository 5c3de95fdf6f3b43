package com.clausescan.processing.model;

/**
 * One risk pattern match contributing to the risk score.
 */
public class RiskEvidence {

    private final String patternId;
    private final String description;
    private final String category;
    private final int weight;
    private final String matchedText;
    private final int offset;

    public RiskEvidence(String patternId, String description, String category, int weight,
                        String matchedText, int offset) {
        this.patternId = patternId;
        this.description = description;
        this.category = category;
        this.weight = weight;
        this.matchedText = matchedText;
        this.offset = offset;
    }

    public String getPatternId() {
        return patternId;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public int getWeight() {
        return weight;
    }

    public String getMatchedText() {
        return matchedText;
    }

    public int getOffset() {
        return offset;
    }
}
