package com.clausescan.processing;

import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.catalog.RiskPattern;
import com.clausescan.processing.model.RiskAssessment;
import com.clausescan.processing.model.RiskEvidence;
import com.clausescan.processing.model.RiskLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Computes the 0-100 aggressiveness score of a document.
 *
 * <p>Every match of every risk pattern adds the pattern's weight to a raw sum, which is mapped
 * through {@code min(100, round(100 * (1 - e^(-raw / K))))}. Evidence is ordered by weight
 * descending then position ascending and truncated for readability; truncation never changes
 * the score.
 */
@Service
public class RiskScoringService {

    private static final Logger logger = LoggerFactory.getLogger(RiskScoringService.class);
    static final int MAX_MATCHES_PER_PATTERN = 200;

    private static final Comparator<RiskEvidence> EVIDENCE_ORDER = Comparator
            .comparingInt(RiskEvidence::getWeight).reversed()
            .thenComparingInt(RiskEvidence::getOffset)
            .thenComparing(RiskEvidence::getPatternId);

    private final PatternCatalog catalog;
    private final double saturationConstant;
    private final int maxEvidence;

    @Autowired
    public RiskScoringService(
            PatternCatalog catalog,
            @Value("${clausescan.risk.saturation-constant:60}") double saturationConstant,
            @Value("${clausescan.risk.max-evidence:20}") int maxEvidence) {
        if (saturationConstant <= 0) {
            throw new IllegalArgumentException("Risk saturation constant must be positive, was " + saturationConstant);
        }
        if (maxEvidence < 0) {
            throw new IllegalArgumentException("Risk max-evidence must not be negative, was " + maxEvidence);
        }
        this.catalog = catalog;
        this.saturationConstant = saturationConstant;
        this.maxEvidence = maxEvidence;
    }

    public RiskAssessment score(String text) {
        if (text == null || text.isBlank()) {
            return RiskAssessment.none();
        }

        int raw = 0;
        List<RiskEvidence> evidence = new ArrayList<>();
        for (RiskPattern pattern : catalog.getRiskPatterns()) {
            Matcher matcher = pattern.getPattern().matcher(text);
            int found = 0;
            while (found < MAX_MATCHES_PER_PATTERN && matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                found++;
                raw += pattern.getWeight();
                evidence.add(new RiskEvidence(pattern.getId(), pattern.getDescription(), pattern.getCategory(),
                        pattern.getWeight(), matcher.group(), matcher.start()));
            }
        }

        evidence.sort(EVIDENCE_ORDER);
        int matchCount = evidence.size();
        List<RiskEvidence> kept = evidence.size() > maxEvidence ? evidence.subList(0, maxEvidence) : evidence;

        int score = saturate(raw, saturationConstant);
        RiskLevel level = RiskLevel.forScore(score);
        logger.debug("Risk score {} ({}) from raw {} across {} matches", score, level, raw, matchCount);
        return new RiskAssessment(score, raw, matchCount, level, kept);
    }

    /**
     * Bounded, monotonic mapping of a raw weight sum onto 0-100.
     */
    static int saturate(int raw, double saturationConstant) {
        if (raw <= 0) {
            return 0;
        }
        long scaled = Math.round(100.0 * (1.0 - Math.exp(-raw / saturationConstant)));
        return (int) Math.min(100, Math.max(0, scaled));
    }
}
