package com.clausescan.processing.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads the declarative pattern catalog and turns it into a validated {@link PatternCatalog}.
 * Every pattern is compiled case-insensitively here, so a malformed rule stops startup
 * instead of surfacing during an analysis.
 */
public class PatternCatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(PatternCatalogLoader.class);

    public static final String DEFAULT_LOCATION = "catalog/pattern-catalog.json";

    private final ObjectMapper objectMapper;

    public PatternCatalogLoader() {
        this(new ObjectMapper());
    }

    public PatternCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads the catalog bundled with the application.
     */
    public PatternCatalog loadDefault() {
        return load(new ClassPathResource(DEFAULT_LOCATION));
    }

    public PatternCatalog load(Resource resource) {
        if (!resource.exists()) {
            throw new CatalogException("Pattern catalog not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            return load(in, resource.getDescription());
        } catch (IOException e) {
            throw new CatalogException("Failed to read pattern catalog " + resource.getDescription(), e);
        }
    }

    public PatternCatalog load(InputStream in, String sourceName) {
        CatalogDefinition definition;
        try {
            definition = objectMapper.readValue(in, CatalogDefinition.class);
        } catch (JsonProcessingException e) {
            throw new CatalogException("Malformed pattern catalog " + sourceName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogException("Failed to read pattern catalog " + sourceName, e);
        }
        PatternCatalog catalog = build(definition);
        logger.info("Loaded pattern catalog {} from {}: {} document types, {} risk patterns, {} red flags, {} checklist rules",
                catalog.getVersion(), sourceName, catalog.getClassificationRules().size(),
                catalog.getRiskPatterns().size(), catalog.getRedFlagPatterns().size(),
                catalog.getChecklistRules().size());
        return catalog;
    }

    PatternCatalog build(CatalogDefinition definition) {
        String version = requireText(definition.getVersion(), "Pattern catalog has no version");

        Map<DocumentType, ClassificationRule> rules = new EnumMap<>(DocumentType.class);
        for (CatalogDefinition.DocumentTypeDefinition typeDef : definition.getDocumentTypes()) {
            DocumentType type = parseEnum(DocumentType.class, typeDef.getType(), "document type");
            if (rules.containsKey(type)) {
                throw new CatalogException("Duplicate document type entry: " + type);
            }
            List<WeightedPattern> keywords = new ArrayList<>();
            for (CatalogDefinition.KeywordDefinition keyword : typeDef.getKeywords()) {
                String where = "keyword of " + type;
                requirePositive(keyword.getWeight(), where + " '" + keyword.getPattern() + "'");
                keywords.add(new WeightedPattern(keyword.getPattern(),
                        compile(keyword.getPattern(), where), keyword.getWeight()));
            }
            if (keywords.isEmpty() && !type.isFallback()) {
                throw new CatalogException("Document type " + type + " has no classification keywords");
            }
            rules.put(type, new ClassificationRule(type, keywords,
                    parseCategories(typeDef.getKeyPoints(), "key points of " + type)));
        }
        for (DocumentType type : DocumentType.values()) {
            if (!rules.containsKey(type)) {
                throw new CatalogException("Pattern catalog is missing document type " + type);
            }
        }

        List<KeyPointCategory> universal = parseCategories(definition.getUniversalKeyPoints(), "universal key points");

        List<RiskPattern> riskPatterns = new ArrayList<>();
        Set<String> riskIds = new HashSet<>();
        for (CatalogDefinition.RiskPatternDefinition riskDef : definition.getRiskPatterns()) {
            String id = requireText(riskDef.getId(), "Risk pattern without id");
            if (!riskIds.add(id)) {
                throw new CatalogException("Duplicate risk pattern id: " + id);
            }
            requirePositive(riskDef.getWeight(), "risk pattern " + id);
            riskPatterns.add(new RiskPattern(id, compile(riskDef.getPattern(), "risk pattern " + id),
                    riskDef.getWeight(), requireText(riskDef.getCategory(), "Risk pattern " + id + " has no category"),
                    requireText(riskDef.getDescription(), "Risk pattern " + id + " has no description")));
        }

        List<RedFlagPattern> redFlags = new ArrayList<>();
        Set<String> redFlagCategories = new HashSet<>();
        for (CatalogDefinition.RedFlagDefinition flagDef : definition.getRedFlags()) {
            String category = requireText(flagDef.getCategory(), "Red flag without category");
            if (!redFlagCategories.add(category)) {
                throw new CatalogException("Duplicate red flag category: " + category);
            }
            redFlags.add(new RedFlagPattern(category, compile(flagDef.getPattern(), "red flag " + category),
                    parseEnum(Severity.class, flagDef.getSeverity(), "severity of red flag " + category),
                    requireText(flagDef.getDescription(), "Red flag " + category + " has no description")));
        }

        List<ChecklistRule> checklist = new ArrayList<>();
        Set<String> ruleIds = new HashSet<>();
        for (CatalogDefinition.ChecklistRuleDefinition ruleDef : definition.getChecklist()) {
            checklist.add(buildChecklistRule(ruleDef, ruleIds, redFlagCategories));
        }
        if (checklist.stream().noneMatch(ChecklistRule::isBaseline)) {
            throw new CatalogException("Pattern catalog has no baseline checklist rule");
        }

        return new PatternCatalog(version, rules, universal, riskPatterns, redFlags, checklist);
    }

    private ChecklistRule buildChecklistRule(CatalogDefinition.ChecklistRuleDefinition ruleDef,
                                             Set<String> ruleIds, Set<String> redFlagCategories) {
        String id = requireText(ruleDef.getId(), "Checklist rule without id");
        if (!ruleIds.add(id)) {
            throw new CatalogException("Duplicate checklist rule id: " + id);
        }
        String text = requireText(ruleDef.getText(), "Checklist rule " + id + " has no text");

        Set<DocumentType> types = EnumSet.noneOf(DocumentType.class);
        for (String name : ruleDef.getDocumentTypes()) {
            types.add(parseEnum(DocumentType.class, name, "document type of checklist rule " + id));
        }
        List<KeyPointCategory> keyPoints = parseCategories(ruleDef.getKeyPoints(), "checklist rule " + id);
        for (String flag : ruleDef.getRedFlags()) {
            if (!redFlagCategories.contains(flag)) {
                throw new CatalogException("Checklist rule " + id + " references unknown red flag " + flag);
            }
        }
        Severity redFlagSeverity = ruleDef.getRedFlagSeverity() == null ? null
                : parseEnum(Severity.class, ruleDef.getRedFlagSeverity(), "red flag severity of checklist rule " + id);
        Integer minRiskScore = ruleDef.getMinRiskScore();
        if (minRiskScore != null && (minRiskScore < 0 || minRiskScore > 100)) {
            throw new CatalogException("Checklist rule " + id + " has minRiskScore outside 0..100: " + minRiskScore);
        }

        ChecklistRule rule = new ChecklistRule(id, text, types, keyPoints, ruleDef.getRedFlags(),
                redFlagSeverity, minRiskScore, ruleDef.getRequiredAttributes(), ruleDef.isBaseline());

        // The risk score only narrows a rule; every item must trace to a key point or red flag
        boolean hasTrigger = !keyPoints.isEmpty() || !ruleDef.getRedFlags().isEmpty() || redFlagSeverity != null;
        if (!rule.isBaseline() && !hasTrigger) {
            throw new CatalogException("Checklist rule " + id + " has no key point or red flag trigger");
        }
        if (rule.isBaseline() && rule.hasPlaceholders()) {
            throw new CatalogException("Baseline checklist rule " + id + " must not use placeholders");
        }
        for (String placeholder : rule.placeholderNames()) {
            if (!rule.getRequiredAttributes().contains(placeholder)) {
                throw new CatalogException("Checklist rule " + id + " uses {" + placeholder
                        + "} which is not listed in requiredAttributes");
            }
        }
        if (!rule.getRequiredAttributes().isEmpty() && keyPoints.isEmpty()) {
            throw new CatalogException("Checklist rule " + id + " requires attributes but has no key point trigger");
        }
        return rule;
    }

    private static Pattern compile(String regex, String where) {
        if (regex == null || regex.isEmpty()) {
            throw new CatalogException("Empty pattern in " + where);
        }
        try {
            return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new CatalogException("Invalid pattern in " + where + ": " + e.getDescription(), e);
        }
    }

    private static String requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new CatalogException(message);
        }
        return value;
    }

    private static void requirePositive(int weight, String where) {
        if (weight <= 0) {
            throw new CatalogException("Weight must be positive for " + where + ", was " + weight);
        }
    }

    private static List<KeyPointCategory> parseCategories(List<String> names, String where) {
        List<KeyPointCategory> categories = new ArrayList<>();
        for (String name : names) {
            categories.add(parseEnum(KeyPointCategory.class, name, "key point category in " + where));
        }
        return categories;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String where) {
        if (name == null || name.isBlank()) {
            throw new CatalogException("Missing " + where);
        }
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CatalogException("Unknown " + where + ": " + name, e);
        }
    }
}
