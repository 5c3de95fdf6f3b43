package com.clausescan.processing;

import com.clausescan.processing.catalog.ClassificationRule;
import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.catalog.WeightedPattern;
import com.clausescan.processing.model.Classification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rules-based document type classifier.
 * Each type scores {@code occurrences x weight} over its catalog keywords; the highest total wins,
 * ties go to the type declared first, and weak evidence falls back to {@link DocumentType#GENERAL}.
 */
@Service
public class DocumentClassifierService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentClassifierService.class);
    static final int MAX_MATCHES_PER_KEYWORD = 500;

    private final PatternCatalog catalog;
    private final int minScore;
    private final int minDistinctKeywords;

    @Autowired
    public DocumentClassifierService(
            PatternCatalog catalog,
            @Value("${clausescan.classification.min-score:4}") int minScore,
            @Value("${clausescan.classification.min-distinct-keywords:2}") int minDistinctKeywords) {
        this.catalog = catalog;
        this.minScore = minScore;
        this.minDistinctKeywords = minDistinctKeywords;
    }

    /**
     * Classifies a document based on its text. Never fails; empty text yields the fallback type.
     *
     * @param text Full document text (may be null)
     * @return Classification with exactly one document type
     */
    public Classification classify(String text) {
        if (text == null || text.isBlank()) {
            return Classification.fallback();
        }

        ClassificationRule best = null;
        int bestScore = 0;
        List<String> bestKeywords = List.of();
        long total = 0;

        for (ClassificationRule rule : catalog.getClassificationRules()) {
            int score = 0;
            List<String> matched = new ArrayList<>();
            for (WeightedPattern keyword : rule.getKeywords()) {
                int occurrences = countMatches(keyword.getPattern(), text);
                if (occurrences > 0) {
                    score += occurrences * keyword.getWeight();
                    matched.add(keyword.getSource());
                }
            }
            total += score;
            // strictly greater keeps the earlier type on ties
            if (score > bestScore) {
                best = rule;
                bestScore = score;
                bestKeywords = matched;
            }
        }

        if (best == null || bestScore < minScore || bestKeywords.size() < minDistinctKeywords) {
            logger.debug("Classification below threshold (score={}, distinctKeywords={}), using {}",
                    bestScore, bestKeywords.size(), DocumentType.GENERAL);
            return Classification.fallback();
        }

        BigDecimal confidence = BigDecimal.valueOf(bestScore)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
        logger.debug("Rules-based classification: {} with score {} and confidence {}",
                best.getDocumentType(), bestScore, confidence);
        return new Classification(best.getDocumentType(), bestScore, confidence, bestKeywords);
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (count < MAX_MATCHES_PER_KEYWORD && matcher.find()) {
            count++;
        }
        return count;
    }
}
