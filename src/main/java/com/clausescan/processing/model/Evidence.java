package com.clausescan.processing.model;

/**
 * Literal span of the analyzed text supporting a finding.
 * {@code text.substring(offset, offset + snippet.length())} equals {@code snippet}.
 */
public class Evidence {

    private final String snippet;
    private final int offset;

    public Evidence(String snippet, int offset) {
        this.snippet = snippet;
        this.offset = offset;
    }

    public String getSnippet() {
        return snippet;
    }

    public int getOffset() {
        return offset;
    }

    public int getEnd() {
        return offset + snippet.length();
    }
}
