package com.clausescan.processing.catalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw JSON shape of {@code pattern-catalog.json}, bound by Jackson before validation.
 * Unknown properties are rejected by the loader.
 */
public class CatalogDefinition {

    private String version;
    private List<DocumentTypeDefinition> documentTypes = new ArrayList<>();
    private List<String> universalKeyPoints = new ArrayList<>();
    private List<RiskPatternDefinition> riskPatterns = new ArrayList<>();
    private List<RedFlagDefinition> redFlags = new ArrayList<>();
    private List<ChecklistRuleDefinition> checklist = new ArrayList<>();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<DocumentTypeDefinition> getDocumentTypes() {
        return documentTypes;
    }

    public void setDocumentTypes(List<DocumentTypeDefinition> documentTypes) {
        this.documentTypes = documentTypes;
    }

    public List<String> getUniversalKeyPoints() {
        return universalKeyPoints;
    }

    public void setUniversalKeyPoints(List<String> universalKeyPoints) {
        this.universalKeyPoints = universalKeyPoints;
    }

    public List<RiskPatternDefinition> getRiskPatterns() {
        return riskPatterns;
    }

    public void setRiskPatterns(List<RiskPatternDefinition> riskPatterns) {
        this.riskPatterns = riskPatterns;
    }

    public List<RedFlagDefinition> getRedFlags() {
        return redFlags;
    }

    public void setRedFlags(List<RedFlagDefinition> redFlags) {
        this.redFlags = redFlags;
    }

    public List<ChecklistRuleDefinition> getChecklist() {
        return checklist;
    }

    public void setChecklist(List<ChecklistRuleDefinition> checklist) {
        this.checklist = checklist;
    }

    public static class DocumentTypeDefinition {
        private String type;
        private List<KeywordDefinition> keywords = new ArrayList<>();
        private List<String> keyPoints = new ArrayList<>();

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public List<KeywordDefinition> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<KeywordDefinition> keywords) {
            this.keywords = keywords;
        }

        public List<String> getKeyPoints() {
            return keyPoints;
        }

        public void setKeyPoints(List<String> keyPoints) {
            this.keyPoints = keyPoints;
        }
    }

    public static class KeywordDefinition {
        private String pattern;
        private int weight;

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public int getWeight() {
            return weight;
        }

        public void setWeight(int weight) {
            this.weight = weight;
        }
    }

    public static class RiskPatternDefinition {
        private String id;
        private String pattern;
        private int weight;
        private String category;
        private String description;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public int getWeight() {
            return weight;
        }

        public void setWeight(int weight) {
            this.weight = weight;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }

    public static class RedFlagDefinition {
        private String category;
        private String pattern;
        private String severity;
        private String description;

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public String getSeverity() {
            return severity;
        }

        public void setSeverity(String severity) {
            this.severity = severity;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }

    public static class ChecklistRuleDefinition {
        private String id;
        private String text;
        private List<String> documentTypes = new ArrayList<>();
        private List<String> keyPoints = new ArrayList<>();
        private List<String> redFlags = new ArrayList<>();
        private String redFlagSeverity;
        private Integer minRiskScore;
        private List<String> requiredAttributes = new ArrayList<>();
        private boolean baseline;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public List<String> getDocumentTypes() {
            return documentTypes;
        }

        public void setDocumentTypes(List<String> documentTypes) {
            this.documentTypes = documentTypes;
        }

        public List<String> getKeyPoints() {
            return keyPoints;
        }

        public void setKeyPoints(List<String> keyPoints) {
            this.keyPoints = keyPoints;
        }

        public List<String> getRedFlags() {
            return redFlags;
        }

        public void setRedFlags(List<String> redFlags) {
            this.redFlags = redFlags;
        }

        public String getRedFlagSeverity() {
            return redFlagSeverity;
        }

        public void setRedFlagSeverity(String redFlagSeverity) {
            this.redFlagSeverity = redFlagSeverity;
        }

        public Integer getMinRiskScore() {
            return minRiskScore;
        }

        public void setMinRiskScore(Integer minRiskScore) {
            this.minRiskScore = minRiskScore;
        }

        public List<String> getRequiredAttributes() {
            return requiredAttributes;
        }

        public void setRequiredAttributes(List<String> requiredAttributes) {
            this.requiredAttributes = requiredAttributes;
        }

        public boolean isBaseline() {
            return baseline;
        }

        public void setBaseline(boolean baseline) {
            this.baseline = baseline;
        }
    }
}
