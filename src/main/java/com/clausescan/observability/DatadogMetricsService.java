package com.clausescan.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.TimeUnit;

/**
 * Service for emitting custom Datadog metrics.
 * Only active when datadog.enabled=true.
 *
 * Metrics:
 * - clausescan.analysis.count: Counter of analyses by document type and risk level
 * - clausescan.analysis.duration: Timer for single-document analysis
 * - clausescan.redflag.count: Counter of red flags by category
 * - clausescan.extraction.failure: Counter for uploads that produced no text
 * - clausescan.multi.documents: Distribution of document counts in compare/rank flows
 * - clausescan.export.duration: Timer for report rendering by export format
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsService implements DatadogMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsService.class);
    private static final String SERVICE = "clause-scan";

    private final MeterRegistry meterRegistry;

    private Timer analysisTimer;

    @Autowired
    public DatadogMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initializeMetrics() {
        analysisTimer = Timer.builder("clausescan.analysis.duration")
                .description("Single-document analysis duration")
                .tag("service", SERVICE)
                .register(meterRegistry);

        logger.info("Datadog metrics service initialized");
    }

    @Override
    public void recordAnalysis(String documentType, String riskLevel, long durationMs) {
        analysisTimer.record(durationMs, TimeUnit.MILLISECONDS);
        Counter.builder("clausescan.analysis.count")
                .description("Number of analyzed documents")
                .tag("service", SERVICE)
                .tag("document_type", documentType != null ? documentType : "unknown")
                .tag("risk_level", riskLevel != null ? riskLevel : "unknown")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded analysis: type={}, level={}, {}ms", documentType, riskLevel, durationMs);
    }

    @Override
    public void recordRedFlags(Iterable<String> categories) {
        for (String category : categories) {
            Counter.builder("clausescan.redflag.count")
                    .description("Detected red flags")
                    .tag("service", SERVICE)
                    .tag("category", category != null ? category : "unknown")
                    .register(meterRegistry)
                    .increment();
        }
    }

    @Override
    public void recordExtractionFailure(String source, String errorType) {
        Counter.builder("clausescan.extraction.failure")
                .description("Uploads that yielded no text")
                .tag("service", SERVICE)
                .tag("source", source != null ? source : "unknown")
                .tag("error_type", errorType != null ? errorType : "unknown")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded extraction failure for source={}, errorType={}", source, errorType);
    }

    @Override
    public void recordMultiDocumentFlow(String flow, int documentCount) {
        DistributionSummary.builder("clausescan.multi.documents")
                .description("Documents per comparison or ranking request")
                .tag("service", SERVICE)
                .tag("flow", flow != null ? flow : "unknown")
                .register(meterRegistry)
                .record(documentCount);
    }

    @Override
    public void recordExport(String format, long durationMs) {
        Timer.builder("clausescan.export.duration")
                .description("Report rendering duration")
                .tag("service", SERVICE)
                .tag("format", format != null ? format : "unknown")
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
