package com.clausescan.processing;

import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.ReadabilityScore;
import com.clausescan.processing.model.RedFlag;
import com.clausescan.processing.model.RiskLevel;
import com.itextpdf.kernel.colors.Color;
import com.itextpdf.kernel.colors.ColorConstants;
import com.itextpdf.kernel.colors.DeviceRgb;
import com.itextpdf.kernel.geom.PageSize;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.element.Text;
import com.itextpdf.layout.properties.TextAlignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for generating PDF exports of analysis reports.
 * The full report carries a disclaimer at the top and bottom; the one-page summary closes with a
 * shorter one.
 */
@Service
public class PdfExportService {

    private static final Logger logger = LoggerFactory.getLogger(PdfExportService.class);
    static final String DISCLAIMER_TEXT = "NOT LEGAL ADVICE\n\n"
            + "ClauseScan flags patterns commonly associated with unfavourable terms. "
            + "It is not a substitute for legal counsel. "
            + "This report is for informational purposes only.";
    static final String SUMMARY_DISCLAIMER = "This summary is for informational purposes only "
            + "and does not constitute legal advice.";

    static final int SUMMARY_KEY_POINTS = 5;
    static final int SUMMARY_RED_FLAGS = 4;
    static final int SUMMARY_CHECKLIST_ITEMS = 3;

    /**
     * Generate a PDF export of an analysis.
     *
     * @param documentName name shown in the header, may be null
     * @param result the analysis to render
     * @return PDF as byte array
     * @throws IOException if PDF generation fails
     */
    public byte[] generatePdf(String documentName, AnalysisResult result) throws IOException {
        String name = documentName != null && !documentName.isBlank() ? documentName : "Untitled document";
        logger.info("Generating PDF export for document: {}", name);

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try {
            PdfDocument pdfDoc = new PdfDocument(new PdfWriter(baos));
            Document document = new Document(pdfDoc, PageSize.A4);

            addHeader(document, name);
            addDisclaimer(document);
            addSection(document, "Document Overview", buildOverviewSection(result));
            addSection(document, "Risk Assessment", buildRiskSection(result));
            addSection(document, "Red Flags", buildRedFlagSection(result));
            addSection(document, "Key Points", buildKeyPointSection(result));
            addSection(document, "Before You Sign", buildChecklistSection(result));
            addSection(document, "Readability", buildReadabilitySection(result.getReadability()));
            addFooter(document);

            document.close();
            logger.info("PDF generated successfully: {} bytes", baos.size());
            return baos.toByteArray();
        } catch (RuntimeException e) {
            logger.error("Failed to generate PDF for document: {}", name, e);
            throw new IOException("PDF generation failed", e);
        }
    }

    /**
     * Generate a one-page summary: risk band, top key points, top red flags and the first
     * checklist items.
     */
    public byte[] generateSummaryPdf(String documentName, AnalysisResult result) throws IOException {
        String name = documentName != null && !documentName.isBlank() ? documentName : "Untitled document";
        logger.info("Generating summary PDF for document: {}", name);

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try {
            PdfDocument pdfDoc = new PdfDocument(new PdfWriter(baos));
            Document document = new Document(pdfDoc, PageSize.A4);

            document.add(new Paragraph()
                    .add(new Text("ClauseScan Summary\n").setBold().setFontSize(18))
                    .add(new Text(name + " | " + result.getDocumentTypeLabel()).setFontSize(10))
                    .setMarginBottom(12));
            document.add(new Paragraph(result.getSummary()).setFontSize(10));
            document.add(new Paragraph(result.getRisk().getLevel().getLabel() + " Risk: "
                    + result.getRiskScore() + "/100")
                    .setBold()
                    .setFontColor(ColorConstants.WHITE)
                    .setBackgroundColor(riskColor(result.getRisk().getLevel()))
                    .setPadding(6)
                    .setMarginBottom(4));
            document.add(new Paragraph(result.getRisk().getReason()).setFontSize(10).setMarginBottom(12));

            addSummaryList(document, "Key Points", result.getKeyPoints().stream()
                    .limit(SUMMARY_KEY_POINTS)
                    .map(keyPoint -> keyPoint.getTitle() + ": " + keyPoint.getDetail())
                    .collect(Collectors.toList()), "No key points detected.");
            addSummaryList(document, "Red Flags", result.getRedFlags().stream()
                    .limit(SUMMARY_RED_FLAGS)
                    .map(flag -> "[" + flag.getSeverity() + "] " + flag.getDescription())
                    .collect(Collectors.toList()), "No major red flags detected.");
            addSummaryList(document, "Before You Sign", result.getChecklist().stream()
                    .limit(SUMMARY_CHECKLIST_ITEMS)
                    .collect(Collectors.toList()), null);

            ReadabilityScore readability = result.getReadability();
            if (readability != null) {
                document.add(new Paragraph(String.format("Readability: %s (ease %.1f, grade %.1f)",
                        readability.getEaseLabel(), readability.getFleschEase(), readability.getFleschGrade()))
                        .setFontSize(10));
            }
            document.add(new Paragraph(SUMMARY_DISCLAIMER)
                    .setFontSize(8)
                    .setFontColor(ColorConstants.DARK_GRAY)
                    .setTextAlignment(TextAlignment.CENTER)
                    .setMarginTop(20));

            document.close();
            logger.info("Summary PDF generated successfully: {} bytes", baos.size());
            return baos.toByteArray();
        } catch (RuntimeException e) {
            logger.error("Failed to generate summary PDF for document: {}", name, e);
            throw new IOException("Summary PDF generation failed", e);
        }
    }

    private void addSummaryList(Document document, String title, List<String> items, String emptyText) {
        document.add(new Paragraph(title).setBold().setFontSize(12).setMarginTop(8).setMarginBottom(4));
        if (items.isEmpty() && emptyText != null) {
            document.add(new Paragraph(emptyText).setFontSize(10).setFontColor(ColorConstants.GRAY));
            return;
        }
        for (String item : items) {
            document.add(new Paragraph("- " + item).setFontSize(10).setMarginBottom(2));
        }
    }

    private static Color riskColor(RiskLevel level) {
        switch (level) {
            case HIGH:
                return new DeviceRgb(192, 57, 43);
            case MEDIUM:
                return new DeviceRgb(211, 124, 0);
            default:
                return new DeviceRgb(39, 138, 74);
        }
    }

    private void addHeader(Document document, String name) {
        Paragraph header = new Paragraph()
                .add(new Text("ClauseScan Analysis Report\n").setBold().setFontSize(18))
                .add(new Text("Generated: " + DateTimeFormatter.ISO_INSTANT.format(Instant.now()) + "\n").setFontSize(10))
                .add(new Text("Document: " + name + "\n").setFontSize(10))
                .setTextAlignment(TextAlignment.LEFT)
                .setMarginBottom(20);
        document.add(header);
    }

    private void addDisclaimer(Document document) {
        Paragraph disclaimer = new Paragraph(DISCLAIMER_TEXT)
                .setBackgroundColor(ColorConstants.YELLOW)
                .setPadding(10)
                .setMarginBottom(20)
                .setFontSize(10)
                .setBold();
        document.add(disclaimer);
    }

    private void addSection(Document document, String title, String content) {
        document.add(new Paragraph(title)
                .setBold()
                .setFontSize(14)
                .setMarginTop(15)
                .setMarginBottom(10));

        if (content != null && !content.isEmpty()) {
            document.add(new Paragraph(content)
                    .setFontSize(10)
                    .setMarginBottom(15));
        } else {
            document.add(new Paragraph("Nothing detected in this section.")
                    .setFontSize(10)
                    .setFontColor(ColorConstants.GRAY)
                    .setMarginBottom(15));
        }
    }

    private void addFooter(Document document) {
        document.add(new Paragraph("\n\n" + DISCLAIMER_TEXT)
                .setFontSize(8)
                .setFontColor(ColorConstants.DARK_GRAY)
                .setTextAlignment(TextAlignment.CENTER)
                .setMarginTop(20));
    }

    private String buildOverviewSection(AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Type: ").append(result.getDocumentTypeLabel()).append("\n");
        sb.append("Confidence: ").append(percent(result.getClassification().getConfidence())).append("\n");
        sb.append("Words: ").append(result.getWordCount()).append("\n");
        sb.append("Catalog version: ").append(result.getCatalogVersion()).append("\n\n");
        sb.append(result.getSummary());
        return sb.toString();
    }

    private String buildRiskSection(AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("Score: ").append(result.getRiskScore()).append("/100 (")
                .append(result.getRisk().getLevel().getLabel()).append(")\n");
        sb.append(result.getRisk().getReason());
        return sb.toString();
    }

    private String buildRedFlagSection(AnalysisResult result) {
        if (result.getRedFlags().isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (RedFlag flag : result.getRedFlags()) {
            sb.append("- [").append(flag.getSeverity()).append("] ").append(flag.getDescription()).append("\n");
            sb.append("  \"").append(flag.getContext()).append("\"\n");
        }
        return sb.toString();
    }

    private String buildKeyPointSection(AnalysisResult result) {
        if (result.getKeyPoints().isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (KeyPoint keyPoint : result.getKeyPoints()) {
            sb.append(keyPoint.isWatchOut() ? "! " : "- ")
                    .append(keyPoint.getTitle()).append(": ").append(keyPoint.getDetail()).append("\n");
            for (Map.Entry<String, String> attribute : keyPoint.getAttributes().entrySet()) {
                sb.append("    ").append(attribute.getKey()).append(" = ").append(attribute.getValue()).append("\n");
            }
        }
        return sb.toString();
    }

    private String buildChecklistSection(AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        for (String item : result.getChecklist()) {
            sb.append("[ ] ").append(item).append("\n");
        }
        return sb.toString();
    }

    private String buildReadabilitySection(ReadabilityScore readability) {
        if (readability == null) {
            return null;
        }
        return String.format("Flesch reading ease: %.1f (%s)%nGrade level: %.1f (%s)%nGunning fog: %.1f%n"
                        + "Average sentence length: %.1f words%nComplex words: %.1f%%",
                readability.getFleschEase(), readability.getEaseLabel(),
                readability.getFleschGrade(), readability.getGradeLabel(),
                readability.getGunningFog(), readability.getAvgSentenceLength(),
                readability.getComplexWordPercent());
    }

    private static String percent(BigDecimal confidence) {
        return confidence.multiply(BigDecimal.valueOf(100)).setScale(0, RoundingMode.HALF_UP) + "%";
    }
}
