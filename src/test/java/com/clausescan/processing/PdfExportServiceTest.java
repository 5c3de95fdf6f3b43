package com.clausescan.processing;

import com.clausescan.processing.model.AnalysisResult;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class PdfExportServiceTest {

    private final PdfExportService pdfExportService = new PdfExportService();
    private final DocumentAnalysisService analysisService = AnalysisTestFixtures.analysisService();

    @Test
    void testGeneratePdf_ContainsReportSections() throws IOException {
        // Given
        AnalysisResult result = analysisService.analyze(AnalysisTestFixtures.INSURANCE_SCENARIO);

        // When
        byte[] pdf = pdfExportService.generatePdf("Home policy", result);

        // Then
        assertThat(new String(pdf, 0, 4, java.nio.charset.StandardCharsets.US_ASCII)).isEqualTo("%PDF");
        String text = extractText(pdf);
        assertThat(text)
                .contains("ClauseScan Analysis Report")
                .contains("Document: Home policy")
                .contains("NOT LEGAL ADVICE")
                .contains("Risk Assessment")
                .contains("Red Flags")
                .contains("Before You Sign")
                .contains("Insurance Policy");
    }

    @Test
    void testGeneratePdf_FallbackResult() throws IOException {
        AnalysisResult result = analysisService.analyze("");

        byte[] pdf = pdfExportService.generatePdf(null, result);

        String text = extractText(pdf);
        assertThat(text).contains("Untitled document").contains("Nothing detected in this section.");
    }

    @Test
    void testGenerateSummaryPdf_KeepsOnlyTopItems() throws IOException {
        // Given: the scenario yields six checklist items
        AnalysisResult result = analysisService.analyze(AnalysisTestFixtures.INSURANCE_SCENARIO);
        assertThat(result.getChecklist()).hasSizeGreaterThan(PdfExportService.SUMMARY_CHECKLIST_ITEMS);

        // When
        byte[] pdf = pdfExportService.generateSummaryPdf("Home policy", result);

        // Then
        String text = extractText(pdf);
        assertThat(text)
                .contains("ClauseScan Summary")
                .contains("Home policy")
                .contains("High Risk: " + result.getRiskScore() + "/100")
                .contains("[HIGH] ")
                .contains(result.getChecklist().get(0))
                .contains(PdfExportService.SUMMARY_DISCLAIMER)
                .doesNotContain(result.getChecklist().get(3))
                .doesNotContain("NOT LEGAL ADVICE");
        try (PDDocument document = Loader.loadPDF(pdf)) {
            assertThat(document.getNumberOfPages()).isEqualTo(1);
        }
    }

    @Test
    void testGenerateSummaryPdf_FallbackResult() throws IOException {
        AnalysisResult result = analysisService.analyze("");

        String text = extractText(pdfExportService.generateSummaryPdf(null, result));

        assertThat(text)
                .contains("Untitled document")
                .contains("Low Risk: 0/100")
                .contains("No key points detected.")
                .contains("No major red flags detected.")
                .doesNotContain("Readability:");
    }

    private static String extractText(byte[] pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            return new PDFTextStripper().getText(document);
        }
    }
}
