package com.clausescan.api;

import com.clausescan.api.validation.UploadValidator;
import com.clausescan.observability.DatadogMetricsServiceInterface;
import com.clausescan.observability.TracingServiceInterface;
import com.clausescan.processing.CsvExportService;
import com.clausescan.processing.DocumentAnalysisService;
import com.clausescan.processing.DocumentComparisonService;
import com.clausescan.processing.DocumentRankingService;
import com.clausescan.processing.PdfExportService;
import com.clausescan.processing.TextExtractionService;
import com.clausescan.processing.WordExportService;
import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.ComparisonResult;
import com.clausescan.processing.model.DocumentFormat;
import com.clausescan.processing.model.ExportFormat;
import com.clausescan.processing.model.ExtractedText;
import com.clausescan.processing.model.NamedDocument;
import com.clausescan.processing.model.RankingResult;
import com.clausescan.processing.model.RedFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Entry point shared by the REST and HTML controllers. Wraps each flow in a span and records
 * metrics; the engine itself stays free of observability concerns.
 */
@Component
public class AnalysisGateway {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisGateway.class);

    private final DocumentAnalysisService analysisService;
    private final DocumentComparisonService comparisonService;
    private final DocumentRankingService rankingService;
    private final TextExtractionService extractionService;
    private final PdfExportService pdfExportService;
    private final WordExportService wordExportService;
    private final CsvExportService csvExportService;
    private final UploadValidator uploadValidator;
    private final TracingServiceInterface tracingService;
    private final DatadogMetricsServiceInterface metricsService;

    public AnalysisGateway(DocumentAnalysisService analysisService,
                           DocumentComparisonService comparisonService,
                           DocumentRankingService rankingService,
                           TextExtractionService extractionService,
                           PdfExportService pdfExportService,
                           WordExportService wordExportService,
                           CsvExportService csvExportService,
                           UploadValidator uploadValidator,
                           TracingServiceInterface tracingService,
                           DatadogMetricsServiceInterface metricsService) {
        this.analysisService = analysisService;
        this.comparisonService = comparisonService;
        this.rankingService = rankingService;
        this.extractionService = extractionService;
        this.pdfExportService = pdfExportService;
        this.wordExportService = wordExportService;
        this.csvExportService = csvExportService;
        this.uploadValidator = uploadValidator;
        this.tracingService = tracingService;
        this.metricsService = metricsService;
    }

    public AnalysisResult analyze(String text) {
        uploadValidator.validateMaxTextLength(text);
        return tracingService.trace("analyze", () -> timedAnalysis(text));
    }

    /**
     * Validates and extracts an uploaded file, then analyzes its text.
     *
     * @throws UnsupportedDocumentException for unknown extensions or a .pdf that is not a PDF
     * @throws IllegalArgumentException for empty uploads or oversized text
     */
    public AnalysisResult analyzeUpload(String filename, byte[] content) {
        DocumentFormat format = uploadValidator.requireSupportedFormat(filename);
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("File is empty");
        }
        if (format == DocumentFormat.PDF) {
            uploadValidator.requirePdf(content, filename);
        }
        return tracingService.trace("analyze_upload", () -> {
            ExtractedText extracted = extractionService.extract(content, format);
            String text = extracted.getFullText();
            uploadValidator.validateMaxTextLength(text);
            logger.info("Extracted {} characters from {} ({} pages, source={})",
                    text.length(), filename, extracted.getPages().size(), extracted.getSource());
            return timedAnalysis(text);
        });
    }

    public ComparisonResult compare(NamedDocument left, NamedDocument right) {
        uploadValidator.validateMaxTextLength(left.getText());
        uploadValidator.validateMaxTextLength(right.getText());
        metricsService.recordMultiDocumentFlow("compare", 2);
        return tracingService.trace("compare", () -> comparisonService.compare(left, right));
    }

    public RankingResult rank(List<NamedDocument> documents) {
        documents.forEach(document -> uploadValidator.validateMaxTextLength(document.getText()));
        metricsService.recordMultiDocumentFlow("rank", documents.size());
        return tracingService.trace("rank", () -> rankingService.rank(documents));
    }

    /**
     * Analyzes the text and renders the result in the requested format.
     */
    public byte[] export(ExportFormat format, String name, String text) {
        AnalysisResult result = analyze(text);
        return tracingService.trace("export_" + format.name().toLowerCase(Locale.ROOT), () -> {
            long start = System.currentTimeMillis();
            try {
                byte[] content = render(format, name, result);
                metricsService.recordExport(format.name(), System.currentTimeMillis() - start);
                return content;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    private byte[] render(ExportFormat format, String name, AnalysisResult result) throws IOException {
        switch (format) {
            case SUMMARY_PDF:
                return pdfExportService.generateSummaryPdf(name, result);
            case WORD:
                return wordExportService.generateDocx(name, result);
            case CSV:
                return csvExportService.generateCsv(result);
            default:
                return pdfExportService.generatePdf(name, result);
        }
    }

    private AnalysisResult timedAnalysis(String text) {
        long start = System.currentTimeMillis();
        AnalysisResult result = analysisService.analyze(text);
        long durationMs = System.currentTimeMillis() - start;
        metricsService.recordAnalysis(result.getDocumentType().name(), result.getRisk().getLevel().name(), durationMs);
        metricsService.recordRedFlags(result.getRedFlags().stream()
                .map(RedFlag::getCategory)
                .collect(Collectors.toList()));
        logger.info("Analysis complete: type={}, risk={}, redFlags={}, {}ms",
                result.getDocumentType(), result.getRiskScore(), result.getRedFlags().size(), durationMs);
        return result;
    }
}
