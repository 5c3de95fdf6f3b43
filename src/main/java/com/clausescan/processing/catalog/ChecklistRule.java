package com.clausescan.processing.catalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Condition over analysis findings plus the checklist item it contributes.
 *
 * <p>A rule is admitted for a document when {@link #getDocumentTypes()} is empty or contains
 * the detected type and the risk score reaches {@link #getMinRiskScore()}, if set. It then fires
 * when a finding triggers it: one of {@link #getKeyPointCategories()} was extracted carrying every
 * attribute in {@link #getRequiredAttributes()}, one of {@link #getRedFlagCategories()} was
 * detected, or a red flag of at least {@link #getRedFlagSeverity()} was detected.
 * Baseline rules fire unconditionally.
 */
public final class ChecklistRule {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9]*)}");

    private final String id;
    private final String text;
    private final Set<DocumentType> documentTypes;
    private final List<KeyPointCategory> keyPointCategories;
    private final List<String> redFlagCategories;
    private final Severity redFlagSeverity;
    private final Integer minRiskScore;
    private final List<String> requiredAttributes;
    private final boolean baseline;

    public ChecklistRule(String id, String text, Set<DocumentType> documentTypes,
                         List<KeyPointCategory> keyPointCategories, List<String> redFlagCategories,
                         Severity redFlagSeverity, Integer minRiskScore, List<String> requiredAttributes,
                         boolean baseline) {
        this.id = id;
        this.text = text;
        this.documentTypes = Set.copyOf(documentTypes);
        this.keyPointCategories = List.copyOf(keyPointCategories);
        this.redFlagCategories = List.copyOf(redFlagCategories);
        this.redFlagSeverity = redFlagSeverity;
        this.minRiskScore = minRiskScore;
        this.requiredAttributes = List.copyOf(requiredAttributes);
        this.baseline = baseline;
    }

    public String getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public Set<DocumentType> getDocumentTypes() {
        return documentTypes;
    }

    public List<KeyPointCategory> getKeyPointCategories() {
        return keyPointCategories;
    }

    public List<String> getRedFlagCategories() {
        return redFlagCategories;
    }

    /**
     * Lowest red flag severity that triggers the rule regardless of category, or null.
     */
    public Severity getRedFlagSeverity() {
        return redFlagSeverity;
    }

    public Integer getMinRiskScore() {
        return minRiskScore;
    }

    public List<String> getRequiredAttributes() {
        return requiredAttributes;
    }

    public boolean isBaseline() {
        return baseline;
    }

    public boolean admits(DocumentType documentType) {
        return documentTypes.isEmpty() || documentTypes.contains(documentType);
    }

    public boolean admitsRiskScore(int score) {
        return minRiskScore == null || score >= minRiskScore;
    }

    public boolean isTriggeredBy(String redFlagCategory, Severity severity) {
        return redFlagCategories.contains(redFlagCategory)
                || (redFlagSeverity != null && severity.compareTo(redFlagSeverity) >= 0);
    }

    public boolean hasPlaceholders() {
        return PLACEHOLDER.matcher(text).find();
    }

    /**
     * Attribute names referenced as {@code {name}} in the item text, in order of appearance.
     */
    public List<String> placeholderNames() {
        Matcher matcher = PLACEHOLDER.matcher(text);
        return matcher.results().map(r -> r.group(1)).distinct().toList();
    }

    /**
     * Fills placeholders from the given attributes.
     *
     * @return the final item text, or empty when a referenced attribute is missing
     */
    public Optional<String> render(Map<String, String> attributes) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = attributes.get(matcher.group(1));
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return Optional.of(out.toString());
    }
}
