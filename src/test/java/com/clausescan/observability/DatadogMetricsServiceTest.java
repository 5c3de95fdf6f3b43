package com.clausescan.observability;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DatadogMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private DatadogMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new DatadogMetricsService(registry);
        metricsService.initializeMetrics();
    }

    @Test
    void testRecordExport_TimedPerFormat() {
        metricsService.recordExport("WORD", 40);
        metricsService.recordExport("WORD", 60);
        metricsService.recordExport("CSV", 5);

        Timer word = registry.get("clausescan.export.duration").tag("format", "WORD").timer();
        assertThat(word.count()).isEqualTo(2);
        assertThat(word.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100.0);
        assertThat(registry.get("clausescan.export.duration").tag("format", "CSV").timer().count()).isEqualTo(1);
    }

    @Test
    void testRecordAnalysis_CountsByTypeAndLevel() {
        metricsService.recordAnalysis("LEASE", "HIGH", 12);
        metricsService.recordRedFlags(List.of("MANDATORY_ARBITRATION", "MANDATORY_ARBITRATION"));

        assertThat(registry.get("clausescan.analysis.count")
                .tags("document_type", "LEASE", "risk_level", "HIGH").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("clausescan.analysis.duration").timer().count()).isEqualTo(1);
        assertThat(registry.get("clausescan.redflag.count")
                .tag("category", "MANDATORY_ARBITRATION").counter().count()).isEqualTo(2.0);
    }

    @Test
    void testRecordExtractionFailure_TagsSourceAndError() {
        metricsService.recordExtractionFailure("IMAGE", "ocr_failed");

        assertThat(registry.get("clausescan.extraction.failure")
                .tags("source", "IMAGE", "error_type", "ocr_failed").counter().count()).isEqualTo(1.0);
    }
}
