package com.clausescan.observability;

/**
 * Interface for Datadog metrics service to support both enabled and disabled modes.
 */
public interface DatadogMetricsServiceInterface {
    void recordAnalysis(String documentType, String riskLevel, long durationMs);
    void recordRedFlags(Iterable<String> categories);
    void recordExtractionFailure(String source, String errorType);
    void recordMultiDocumentFlow(String flow, int documentCount);
    void recordExport(String format, long durationMs);
}
