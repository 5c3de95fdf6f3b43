package com.clausescan.processing.model;

import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.KeyPointCategory;

import java.util.List;
import java.util.Optional;

/**
 * Complete, immutable report for one analyzed document.
 * Created fresh per analysis and never mutated afterwards.
 */
public class AnalysisResult {

    private final Classification classification;
    private final String summary;
    private final RiskAssessment risk;
    private final List<KeyPoint> keyPoints;
    private final List<RedFlag> redFlags;
    private final List<String> checklist;
    private final ReadabilityScore readability;
    private final int wordCount;
    private final int characterCount;
    private final String catalogVersion;

    public AnalysisResult(Classification classification, String summary, RiskAssessment risk,
                          List<KeyPoint> keyPoints, List<RedFlag> redFlags, List<String> checklist,
                          ReadabilityScore readability, int wordCount, int characterCount,
                          String catalogVersion) {
        this.classification = classification;
        this.summary = summary;
        this.risk = risk;
        this.keyPoints = List.copyOf(keyPoints);
        this.redFlags = List.copyOf(redFlags);
        this.checklist = List.copyOf(checklist);
        this.readability = readability;
        this.wordCount = wordCount;
        this.characterCount = characterCount;
        this.catalogVersion = catalogVersion;
    }

    public DocumentType getDocumentType() {
        return classification.getDocumentType();
    }

    public String getDocumentTypeLabel() {
        return classification.getDocumentType().getLabel();
    }

    public Classification getClassification() {
        return classification;
    }

    public String getSummary() {
        return summary;
    }

    public int getRiskScore() {
        return risk.getScore();
    }

    public RiskAssessment getRisk() {
        return risk;
    }

    public List<KeyPoint> getKeyPoints() {
        return keyPoints;
    }

    public List<RedFlag> getRedFlags() {
        return redFlags;
    }

    public List<String> getChecklist() {
        return checklist;
    }

    /**
     * Readability indices, or {@code null} when the text was too short to measure.
     */
    public ReadabilityScore getReadability() {
        return readability;
    }

    public int getWordCount() {
        return wordCount;
    }

    public int getCharacterCount() {
        return characterCount;
    }

    public String getCatalogVersion() {
        return catalogVersion;
    }

    public long getWatchOutCount() {
        return keyPoints.stream().filter(KeyPoint::isWatchOut).count();
    }

    public Optional<KeyPoint> findKeyPoint(KeyPointCategory category) {
        return keyPoints.stream().filter(kp -> kp.getCategory() == category).findFirst();
    }
}
