package com.clausescan.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Stub implementation when Datadog is disabled.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class DatadogMetricsServiceStub implements DatadogMetricsServiceInterface {

    @Override
    public void recordAnalysis(String documentType, String riskLevel, long durationMs) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordRedFlags(Iterable<String> categories) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordExtractionFailure(String source, String errorType) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordMultiDocumentFlow(String flow, int documentCount) {
        // No-op when Datadog is disabled
    }

    @Override
    public void recordExport(String format, long durationMs) {
        // No-op when Datadog is disabled
    }
}
