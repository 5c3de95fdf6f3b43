package com.clausescan.config;

import com.clausescan.processing.catalog.PatternCatalog;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component("catalog")
public class CatalogHealthIndicator implements HealthIndicator {

    private final PatternCatalog catalog;

    public CatalogHealthIndicator(PatternCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("version", catalog.getVersion());
        details.put("documentTypes", catalog.getClassificationRules().size());
        details.put("riskPatterns", catalog.getRiskPatterns().size());
        details.put("redFlagPatterns", catalog.getRedFlagPatterns().size());
        details.put("checklistRules", catalog.getChecklistRules().size());

        if (catalog.getBaselineRules().isEmpty() || catalog.getRiskPatterns().isEmpty()) {
            details.put("catalog", "DOWN");
            return Health.down().withDetails(details).build();
        }
        details.put("catalog", "UP");
        return Health.up().withDetails(details).build();
    }
}
