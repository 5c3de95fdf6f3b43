package com.clausescan.processing;

import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.Evidence;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.ReadabilityScore;
import com.clausescan.processing.model.RedFlag;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Renders an analysis as an editable Word (.docx) report with Apache POI.
 */
@Service
public class WordExportService {

    private static final Logger logger = LoggerFactory.getLogger(WordExportService.class);

    public byte[] generateDocx(String documentName, AnalysisResult result) throws IOException {
        String name = documentName != null && !documentName.isBlank() ? documentName : "Untitled document";
        logger.info("Generating Word export for document: {}", name);

        try (XWPFDocument document = new XWPFDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XWPFParagraph title = document.createParagraph();
            title.setAlignment(ParagraphAlignment.CENTER);
            XWPFRun titleRun = title.createRun();
            titleRun.setBold(true);
            titleRun.setFontSize(18);
            titleRun.setText(result.getDocumentTypeLabel() + " Analysis Report");
            addText(document, "Document: " + name, false);

            addHeading(document, "Summary");
            addText(document, result.getSummary(), false);

            addHeading(document, "Risk Assessment");
            addText(document, "Risk score: " + result.getRiskScore() + "/100 ("
                    + result.getRisk().getLevel().getLabel() + ")", true);
            addText(document, result.getRisk().getReason(), false);

            addHeading(document, "Key Points");
            if (result.getKeyPoints().isEmpty()) {
                addText(document, "No key points detected.", false);
            }
            for (KeyPoint keyPoint : result.getKeyPoints()) {
                XWPFParagraph paragraph = document.createParagraph();
                XWPFRun heading = paragraph.createRun();
                heading.setBold(true);
                heading.setText((keyPoint.isWatchOut() ? "Watch out: " : "") + keyPoint.getTitle());
                paragraph.createRun().setText(" (" + keyPoint.getCategoryLabel() + ") " + keyPoint.getDetail());
                List<Evidence> evidence = keyPoint.getEvidence();
                if (!evidence.isEmpty()) {
                    XWPFRun quote = paragraph.createRun();
                    quote.addBreak();
                    quote.setItalic(true);
                    quote.setText("\"" + evidence.get(0).getSnippet() + "\"");
                }
            }

            addHeading(document, "Before You Sign");
            List<String> checklist = result.getChecklist();
            for (int i = 0; i < checklist.size(); i++) {
                addText(document, (i + 1) + ". " + checklist.get(i), false);
            }

            addHeading(document, "Red Flags");
            if (result.getRedFlags().isEmpty()) {
                addText(document, "No major red flags detected.", false);
            }
            for (RedFlag flag : result.getRedFlags()) {
                addText(document, "[" + flag.getSeverity() + "] " + flag.getDescription()
                        + ": \"" + flag.getContext() + "\"", false);
            }

            ReadabilityScore readability = result.getReadability();
            if (readability != null) {
                addHeading(document, "Readability");
                addReadabilityTable(document, readability);
            }

            XWPFParagraph disclaimer = document.createParagraph();
            disclaimer.setSpacingBefore(400);
            XWPFRun disclaimerRun = disclaimer.createRun();
            disclaimerRun.setItalic(true);
            disclaimerRun.setFontSize(8);
            disclaimerRun.setText(PdfExportService.DISCLAIMER_TEXT.replace("\n\n", ": "));

            document.write(out);
            logger.info("Word document generated successfully: {} bytes", out.size());
            return out.toByteArray();
        } catch (RuntimeException e) {
            logger.error("Failed to generate Word document for: {}", name, e);
            throw new IOException("Word generation failed", e);
        }
    }

    private static void addHeading(XWPFDocument document, String text) {
        XWPFParagraph paragraph = document.createParagraph();
        paragraph.setSpacingBefore(240);
        XWPFRun run = paragraph.createRun();
        run.setBold(true);
        run.setFontSize(14);
        run.setText(text);
    }

    private static void addText(XWPFDocument document, String text, boolean bold) {
        XWPFRun run = document.createParagraph().createRun();
        run.setBold(bold);
        run.setText(text);
    }

    private static void addReadabilityTable(XWPFDocument document, ReadabilityScore readability) {
        String[][] rows = {
                {"Metric", "Value", "Notes"},
                {"Flesch reading ease", format(readability.getFleschEase()), readability.getEaseLabel()},
                {"Grade level", format(readability.getFleschGrade()), readability.getGradeLabel()},
                {"Gunning fog", format(readability.getGunningFog()), "Years of schooling"},
                {"Average sentence length", format(readability.getAvgSentenceLength()), "Words per sentence"},
                {"Complex words", format(readability.getComplexWordPercent()) + "%", "Three or more syllables"},
        };
        XWPFTable table = document.createTable(rows.length, 3);
        for (int r = 0; r < rows.length; r++) {
            XWPFTableRow row = table.getRow(r);
            for (int c = 0; c < 3; c++) {
                row.getCell(c).setText(rows[r][c]);
            }
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
