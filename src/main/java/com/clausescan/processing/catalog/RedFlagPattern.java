package com.clausescan.processing.catalog;

import java.util.regex.Pattern;

/**
 * High-concern clause pattern. The category id is unique within a catalog and is
 * what checklist rules refer to.
 */
public final class RedFlagPattern {

    private final String category;
    private final Pattern pattern;
    private final Severity severity;
    private final String description;

    public RedFlagPattern(String category, Pattern pattern, Severity severity, String description) {
        this.category = category;
        this.pattern = pattern;
        this.severity = severity;
        this.description = description;
    }

    public String getCategory() {
        return category;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }
}
