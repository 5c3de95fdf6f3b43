package com.clausescan.processing;

import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.catalog.PatternCatalogLoader;
import com.clausescan.processing.detect.KeyPointDetectorRegistry;

/**
 * Builds engine services over the bundled catalog without a Spring context.
 */
public final class AnalysisTestFixtures {

    public static final PatternCatalog CATALOG = new PatternCatalogLoader().loadDefault();

    public static final String INSURANCE_SCENARIO = "This insurance policy's premium may be unilaterally modified by "
            + "the Insurer at any time without notice. Arbitration is mandatory and you waive your right to a jury trial.";

    private AnalysisTestFixtures() {
    }

    public static DocumentClassifierService classifier() {
        return new DocumentClassifierService(CATALOG, 4, 2);
    }

    public static RiskScoringService riskScorer() {
        return new RiskScoringService(CATALOG, 60, 20);
    }

    public static KeyPointExtractionService keyPointExtractor() {
        return new KeyPointExtractionService(CATALOG, KeyPointDetectorRegistry.standard());
    }

    public static RedFlagDetectionService redFlagDetector() {
        return new RedFlagDetectionService(CATALOG);
    }

    public static ChecklistService checklistService() {
        return new ChecklistService(CATALOG);
    }

    public static DocumentAnalysisService analysisService() {
        return new DocumentAnalysisService(CATALOG, classifier(), riskScorer(), keyPointExtractor(),
                redFlagDetector(), checklistService(), new ReadabilityService(), 20);
    }
}
