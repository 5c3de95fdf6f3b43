package com.clausescan.processing.model;

import com.clausescan.processing.catalog.KeyPointCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidenced finding for a single contractual concern category.
 */
public class KeyPoint {

    private final KeyPointCategory category;
    private final String title;
    private final String detail;
    private final boolean watchOut;
    private final List<Evidence> evidence;
    private final Map<String, String> attributes;

    public KeyPoint(KeyPointCategory category, String title, String detail, boolean watchOut,
                    List<Evidence> evidence, Map<String, String> attributes) {
        this.category = category;
        this.title = title;
        this.detail = detail;
        this.watchOut = watchOut;
        this.evidence = List.copyOf(evidence);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public KeyPointCategory getCategory() {
        return category;
    }

    public String getCategoryLabel() {
        return category.getLabel();
    }

    public String getTitle() {
        return title;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Whether the clause is unfavourable enough to call out to the reader.
     */
    public boolean isWatchOut() {
        return watchOut;
    }

    public List<Evidence> getEvidence() {
        return evidence;
    }

    /**
     * Structured values pulled from the text, such as {@code noticePeriod} or {@code jurisdiction}.
     */
    public Map<String, String> getAttributes() {
        return attributes;
    }

    public boolean hasAttributes(List<String> names) {
        return names.stream().allMatch(name -> {
            String value = attributes.get(name);
            return value != null && !value.isBlank();
        });
    }
}
