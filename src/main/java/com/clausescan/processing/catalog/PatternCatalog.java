package com.clausescan.processing.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, validated rule tables shared by every analysis component.
 * Built once by {@link PatternCatalogLoader}; safe to read from any number of threads.
 */
public final class PatternCatalog {

    private final String version;
    private final Map<DocumentType, ClassificationRule> classificationRules;
    private final List<KeyPointCategory> universalKeyPointCategories;
    private final List<RiskPattern> riskPatterns;
    private final List<RedFlagPattern> redFlagPatterns;
    private final List<ChecklistRule> checklistRules;

    public PatternCatalog(String version,
                          Map<DocumentType, ClassificationRule> classificationRules,
                          List<KeyPointCategory> universalKeyPointCategories,
                          List<RiskPattern> riskPatterns,
                          List<RedFlagPattern> redFlagPatterns,
                          List<ChecklistRule> checklistRules) {
        this.version = version;
        this.classificationRules = Collections.unmodifiableMap(new EnumMap<>(classificationRules));
        this.universalKeyPointCategories = List.copyOf(universalKeyPointCategories);
        this.riskPatterns = List.copyOf(riskPatterns);
        this.redFlagPatterns = List.copyOf(redFlagPatterns);
        this.checklistRules = List.copyOf(checklistRules);
    }

    public String getVersion() {
        return version;
    }

    /**
     * Classification rules in tie-break priority order.
     */
    public List<ClassificationRule> getClassificationRules() {
        return new ArrayList<>(classificationRules.values());
    }

    public ClassificationRule getClassificationRule(DocumentType documentType) {
        return classificationRules.get(documentType);
    }

    public List<KeyPointCategory> getUniversalKeyPointCategories() {
        return universalKeyPointCategories;
    }

    /**
     * Categories to extract for a document type: its own set plus the universal set,
     * in category priority order.
     */
    public List<KeyPointCategory> keyPointCategoriesFor(DocumentType documentType) {
        EnumSet<KeyPointCategory> categories = EnumSet.noneOf(KeyPointCategory.class);
        categories.addAll(universalKeyPointCategories);
        ClassificationRule rule = classificationRules.get(documentType);
        if (rule != null) {
            categories.addAll(rule.getKeyPointCategories());
        }
        return List.copyOf(categories);
    }

    public List<RiskPattern> getRiskPatterns() {
        return riskPatterns;
    }

    public List<RedFlagPattern> getRedFlagPatterns() {
        return redFlagPatterns;
    }

    public Optional<RedFlagPattern> findRedFlagPattern(String category) {
        return redFlagPatterns.stream().filter(p -> p.getCategory().equals(category)).findFirst();
    }

    /**
     * Checklist rules in evaluation priority order.
     */
    public List<ChecklistRule> getChecklistRules() {
        return checklistRules;
    }

    public List<ChecklistRule> getBaselineRules() {
        return checklistRules.stream().filter(ChecklistRule::isBaseline).toList();
    }
}
