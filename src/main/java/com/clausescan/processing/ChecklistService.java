package com.clausescan.processing;

import com.clausescan.processing.catalog.ChecklistRule;
import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.RedFlag;
import com.clausescan.processing.model.RiskAssessment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the pre-signing checklist from the findings of one analysis.
 * Rules are evaluated against detected key points and red flags, never against the raw text,
 * so every item traces back to a finding. The risk score can only narrow a rule.
 */
@Service
public class ChecklistService {

    private static final Logger logger = LoggerFactory.getLogger(ChecklistService.class);

    private final PatternCatalog catalog;

    public ChecklistService(PatternCatalog catalog) {
        this.catalog = catalog;
    }

    public List<String> build(DocumentType documentType, RiskAssessment risk,
                              List<KeyPoint> keyPoints, List<RedFlag> redFlags) {
        Set<String> items = new LinkedHashSet<>();
        for (ChecklistRule rule : catalog.getChecklistRules()) {
            evaluate(rule, documentType, risk, keyPoints, redFlags).ifPresent(items::add);
        }
        logger.debug("Checklist has {} items", items.size());
        return new ArrayList<>(items);
    }

    /**
     * Checklist for a document with no findings: the baseline items only.
     */
    public List<String> baseline() {
        Set<String> items = new LinkedHashSet<>();
        for (ChecklistRule rule : catalog.getBaselineRules()) {
            items.add(rule.getText());
        }
        return new ArrayList<>(items);
    }

    public boolean isSatisfied(ChecklistRule rule, DocumentType documentType, RiskAssessment risk,
                               List<KeyPoint> keyPoints, List<RedFlag> redFlags) {
        return evaluate(rule, documentType, risk, keyPoints, redFlags).isPresent();
    }

    /**
     * Evaluates one rule.
     *
     * @return the final item text when the rule fires, empty otherwise
     */
    public Optional<String> evaluate(ChecklistRule rule, DocumentType documentType, RiskAssessment risk,
                                     List<KeyPoint> keyPoints, List<RedFlag> redFlags) {
        if (rule.isBaseline()) {
            return Optional.of(rule.getText());
        }
        if (!rule.admits(documentType) || !rule.admitsRiskScore(risk != null ? risk.getScore() : 0)) {
            return Optional.empty();
        }
        for (KeyPoint keyPoint : keyPoints) {
            if (rule.getKeyPointCategories().contains(keyPoint.getCategory())
                    && keyPoint.hasAttributes(rule.getRequiredAttributes())) {
                Optional<String> text = rule.render(keyPoint.getAttributes());
                if (text.isPresent()) {
                    return text;
                }
            }
        }
        boolean flagged = redFlags.stream().anyMatch(flag -> rule.isTriggeredBy(flag.getCategory(), flag.getSeverity()));
        return flagged ? rule.render(Map.of()) : Optional.empty();
    }
}
