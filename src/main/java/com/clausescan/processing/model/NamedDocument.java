package com.clausescan.processing.model;

/**
 * A document submitted to a multi-document flow, identified by a display name.
 */
public class NamedDocument {

    private final String name;
    private final String text;

    public NamedDocument(String name, String text) {
        this.name = name;
        this.text = text != null ? text : "";
    }

    public String getName() {
        return name;
    }

    public String getText() {
        return text;
    }
}
