package com.clausescan.processing.model;

import com.clausescan.processing.catalog.Severity;

/**
 * A matched high-concern clause. {@code matchedText} is the exact span at {@code offset};
 * {@code context} is the surrounding sentence for display.
 */
public class RedFlag {

    private final String category;
    private final String description;
    private final Severity severity;
    private final String matchedText;
    private final int offset;
    private final String context;

    public RedFlag(String category, String description, Severity severity,
                   String matchedText, int offset, String context) {
        this.category = category;
        this.description = description;
        this.severity = severity;
        this.matchedText = matchedText;
        this.offset = offset;
        this.context = context;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMatchedText() {
        return matchedText;
    }

    public int getOffset() {
        return offset;
    }

    public String getContext() {
        return context;
    }
}
