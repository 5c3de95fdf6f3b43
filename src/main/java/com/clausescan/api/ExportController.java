package com.clausescan.api;

import com.clausescan.processing.model.ExportFormat;
import com.clausescan.shared.dto.ExportRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequestMapping("/api/export")
@Tag(name = "Export", description = "Report downloads as PDF, Word and CSV")
public class ExportController {

    private static final Logger logger = LoggerFactory.getLogger(ExportController.class);

    private final AnalysisGateway analysisGateway;

    public ExportController(AnalysisGateway analysisGateway) {
        this.analysisGateway = analysisGateway;
    }

    @PostMapping("/pdf")
    @Operation(summary = "Export an analysis as PDF", description = "Analyzes the text and returns the full report as a PDF attachment")
    public ResponseEntity<byte[]> exportPdf(@Valid @RequestBody ExportRequest request) {
        return export(ExportFormat.PDF, request);
    }

    @PostMapping("/summary")
    @Operation(summary = "Export a one-page summary PDF", description = "Risk band, top key points, top red flags and the first checklist items")
    public ResponseEntity<byte[]> exportSummary(@Valid @RequestBody ExportRequest request) {
        return export(ExportFormat.SUMMARY_PDF, request);
    }

    @PostMapping("/word")
    @Operation(summary = "Export an analysis as a Word document", description = "Returns an editable .docx report")
    public ResponseEntity<byte[]> exportWord(@Valid @RequestBody ExportRequest request) {
        return export(ExportFormat.WORD, request);
    }

    @PostMapping("/csv")
    @Operation(summary = "Export an analysis as CSV", description = "Returns the summary, key points, red flags and checklist as UTF-8 CSV")
    public ResponseEntity<byte[]> exportCsv(@Valid @RequestBody ExportRequest request) {
        return export(ExportFormat.CSV, request);
    }

    private ResponseEntity<byte[]> export(ExportFormat format, ExportRequest request) {
        logger.info("Received {} export request: name={}, {} characters",
                format, request.getName(), request.getText().length());
        byte[] content = analysisGateway.export(format, request.getName(), request.getText());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.parseMediaType(format.getMediaType()));
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(fileName(request.getName(), format)).build());
        headers.setContentLength(content.length);
        return ResponseEntity.ok().headers(headers).body(content);
    }

    static String fileName(String name, ExportFormat format) {
        String suffix = "-" + format.getFileSuffix();
        if (name == null || name.isBlank()) {
            return "clausescan" + suffix;
        }
        String slug = name.strip().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return (slug.isEmpty() ? "clausescan" : slug) + suffix;
    }
}
