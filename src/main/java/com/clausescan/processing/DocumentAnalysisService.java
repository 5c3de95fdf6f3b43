package com.clausescan.processing;

import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.Classification;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.ReadabilityScore;
import com.clausescan.processing.model.RedFlag;
import com.clausescan.processing.model.RiskAssessment;
import com.clausescan.util.TextSpans;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Composes classification, risk scoring, key point extraction, red flag detection and
 * checklist synthesis into one {@link AnalysisResult}.
 *
 * <p>Stateless and side-effect free: the same text always yields an equal result, and
 * concurrent calls share nothing but the read-only catalog. Empty or very short text is not
 * an error; it produces the fallback result with only the baseline checklist.
 */
@Service
public class DocumentAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAnalysisService.class);
    static final int LONG_DOCUMENT_WORDS = 3000;

    private final PatternCatalog catalog;
    private final DocumentClassifierService classifier;
    private final RiskScoringService riskScorer;
    private final KeyPointExtractionService keyPointExtractor;
    private final RedFlagDetectionService redFlagDetector;
    private final ChecklistService checklistService;
    private final ReadabilityService readabilityService;
    private final int minTextLength;

    @Autowired
    public DocumentAnalysisService(
            PatternCatalog catalog,
            DocumentClassifierService classifier,
            RiskScoringService riskScorer,
            KeyPointExtractionService keyPointExtractor,
            RedFlagDetectionService redFlagDetector,
            ChecklistService checklistService,
            ReadabilityService readabilityService,
            @Value("${clausescan.analysis.min-text-length:20}") int minTextLength) {
        this.catalog = catalog;
        this.classifier = classifier;
        this.riskScorer = riskScorer;
        this.keyPointExtractor = keyPointExtractor;
        this.redFlagDetector = redFlagDetector;
        this.checklistService = checklistService;
        this.readabilityService = readabilityService;
        this.minTextLength = minTextLength;
    }

    public AnalysisResult analyze(String text) {
        String input = text != null ? text : "";
        if (isDegenerate(input)) {
            logger.debug("Text below {} characters, returning fallback analysis", minTextLength);
            return fallback(input);
        }

        Classification classification = classifier.classify(input);
        DocumentType type = classification.getDocumentType();
        RiskAssessment risk = riskScorer.score(input);
        List<KeyPoint> keyPoints = keyPointExtractor.extract(input, type);
        List<RedFlag> redFlags = redFlagDetector.detect(input);
        List<String> checklist = checklistService.build(type, risk, keyPoints, redFlags);
        ReadabilityScore readability = readabilityService.compute(input).orElse(null);
        int words = TextSpans.wordCount(input);

        logger.debug("Analyzed {} words: type={}, risk={}, keyPoints={}, redFlags={}, checklist={}",
                words, type, risk.getScore(), keyPoints.size(), redFlags.size(), checklist.size());
        return new AnalysisResult(classification, summarize(type, words), risk, keyPoints, redFlags, checklist,
                readability, words, input.length(), catalog.getVersion());
    }

    public boolean isDegenerate(String text) {
        return text == null || text.strip().length() < Math.max(1, minTextLength);
    }

    private AnalysisResult fallback(String input) {
        Classification classification = Classification.fallback();
        return new AnalysisResult(classification, classification.getDocumentType().getSummary(),
                RiskAssessment.none(), List.of(), List.of(), checklistService.baseline(), null,
                TextSpans.wordCount(input), input.length(), catalog.getVersion());
    }

    private static String summarize(DocumentType type, int words) {
        String summary = type.getSummary();
        if (words > LONG_DOCUMENT_WORDS) {
            summary += " The document is comprehensive, so take time to read key sections carefully.";
        }
        return summary;
    }
}
