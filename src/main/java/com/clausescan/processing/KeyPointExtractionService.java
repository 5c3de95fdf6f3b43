package com.clausescan.processing;

import com.clausescan.processing.catalog.CatalogException;
import com.clausescan.processing.catalog.ClassificationRule;
import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.KeyPointCategory;
import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.detect.KeyPointDetectorRegistry;
import com.clausescan.processing.model.KeyPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the detectors registered for a document type plus the universal ones,
 * producing at most one key point per category in category priority order.
 */
@Service
public class KeyPointExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(KeyPointExtractionService.class);

    private final PatternCatalog catalog;
    private final KeyPointDetectorRegistry registry;

    public KeyPointExtractionService(PatternCatalog catalog, KeyPointDetectorRegistry registry) {
        this.catalog = catalog;
        this.registry = registry;
        verifyCoverage(catalog, registry);
    }

    public List<KeyPoint> extract(String text, DocumentType documentType) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        DocumentType type = documentType != null ? documentType : DocumentType.GENERAL;
        List<KeyPoint> keyPoints = new ArrayList<>();
        for (KeyPointCategory category : catalog.keyPointCategoriesFor(type)) {
            Optional<KeyPoint> found = registry.find(category).flatMap(detector -> detector.detect(text, type));
            if (found.isPresent() && found.get().getCategory() == category) {
                keyPoints.add(found.get());
            }
        }
        logger.debug("Extracted {} key points for {}", keyPoints.size(), type);
        return keyPoints;
    }

    private static void verifyCoverage(PatternCatalog catalog, KeyPointDetectorRegistry registry) {
        Set<KeyPointCategory> referenced = EnumSet.noneOf(KeyPointCategory.class);
        referenced.addAll(catalog.getUniversalKeyPointCategories());
        for (ClassificationRule rule : catalog.getClassificationRules()) {
            referenced.addAll(rule.getKeyPointCategories());
        }
        referenced.removeAll(registry.getCategories());
        if (!referenced.isEmpty()) {
            throw new CatalogException("No key point detector registered for categories " + referenced);
        }
    }
}
