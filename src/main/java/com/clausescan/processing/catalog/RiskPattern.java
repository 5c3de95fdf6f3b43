package com.clausescan.processing.catalog;

import java.util.regex.Pattern;

/**
 * Weighted aggressive-language pattern consumed by the risk scorer.
 */
public final class RiskPattern {

    private final String id;
    private final Pattern pattern;
    private final int weight;
    private final String category;
    private final String description;

    public RiskPattern(String id, Pattern pattern, int weight, String category, String description) {
        this.id = id;
        this.pattern = pattern;
        this.weight = weight;
        this.category = category;
        this.description = description;
    }

    public String getId() {
        return id;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getWeight() {
        return weight;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }
}
