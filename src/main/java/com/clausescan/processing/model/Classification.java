package com.clausescan.processing.model;

import com.clausescan.processing.catalog.DocumentType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of document-type classification.
 */
public class Classification {

    private final DocumentType documentType;
    private final int score;
    private final BigDecimal confidence;
    private final List<String> matchedKeywords;

    public Classification(DocumentType documentType, int score, BigDecimal confidence, List<String> matchedKeywords) {
        this.documentType = documentType;
        this.score = score;
        this.confidence = confidence;
        this.matchedKeywords = List.copyOf(matchedKeywords);
    }

    public static Classification fallback() {
        return new Classification(DocumentType.GENERAL, 0, BigDecimal.ZERO.setScale(2), List.of());
    }

    public DocumentType getDocumentType() {
        return documentType;
    }

    public int getScore() {
        return score;
    }

    /**
     * Share of the winning type in the total keyword score across all types, 0.00 to 1.00.
     */
    public BigDecimal getConfidence() {
        return confidence;
    }

    /**
     * Keyword patterns of the winning type that matched at least once.
     */
    public List<String> getMatchedKeywords() {
        return matchedKeywords;
    }
}
