package com.clausescan.processing.catalog;

import java.util.List;

/**
 * Keyword table for a single {@link DocumentType}, plus the key-point categories
 * the extractor runs for documents of that type.
 */
public final class ClassificationRule {

    private final DocumentType documentType;
    private final List<WeightedPattern> keywords;
    private final List<KeyPointCategory> keyPointCategories;

    public ClassificationRule(DocumentType documentType, List<WeightedPattern> keywords,
                              List<KeyPointCategory> keyPointCategories) {
        this.documentType = documentType;
        this.keywords = List.copyOf(keywords);
        this.keyPointCategories = List.copyOf(keyPointCategories);
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public List<WeightedPattern> getKeywords() {
        return keywords;
    }

    public List<KeyPointCategory> getKeyPointCategories() {
        return keyPointCategories;
    }
}
