package com.clausescan.processing.catalog;

import java.util.regex.Pattern;

/**
 * A compiled classification keyword with its discriminating weight.
 */
public final class WeightedPattern {

    private final String source;
    private final Pattern pattern;
    private final int weight;

    public WeightedPattern(String source, Pattern pattern, int weight) {
        this.source = source;
        this.pattern = pattern;
        this.weight = weight;
    }

    public String getSource() {
        return source;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public int getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return source + " (" + weight + ")";
    }
}
