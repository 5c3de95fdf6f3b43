package com.clausescan.processing;

import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.Evidence;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.ReadabilityScore;
import com.clausescan.processing.model.RedFlag;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Flattens an analysis into a spreadsheet-friendly CSV with Apache Commons CSV.
 *
 * <p>The file starts with a UTF-8 byte order mark so spreadsheet tools pick the right encoding.
 * Sections follow each other separated by a blank record: a SECTION/FIELD/VALUE block for the
 * summary and readability, then key points, red flags and the checklist, each under its own header.
 */
@Service
public class CsvExportService {

    private static final Logger logger = LoggerFactory.getLogger(CsvExportService.class);
    private static final char BOM = '\uFEFF';

    public byte[] generateCsv(AnalysisResult result) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
            writer.write(BOM);

            printer.printRecord("SECTION", "FIELD", "VALUE");
            printer.printRecord("Summary", "Document Type", result.getDocumentTypeLabel());
            printer.printRecord("Summary", "Risk Score", result.getRiskScore());
            printer.printRecord("Summary", "Risk Level", result.getRisk().getLevel().getLabel());
            printer.printRecord("Summary", "Risk Reason", result.getRisk().getReason());
            printer.printRecord("Summary", "Overview", result.getSummary());
            printer.printRecord("Summary", "Word Count", result.getWordCount());
            printer.printRecord("Summary", "Catalog Version", result.getCatalogVersion());
            ReadabilityScore readability = result.getReadability();
            if (readability != null) {
                printer.printRecord("Readability", "Flesch Reading Ease", format(readability.getFleschEase()));
                printer.printRecord("Readability", "Ease", readability.getEaseLabel());
                printer.printRecord("Readability", "Grade Level", format(readability.getFleschGrade()));
                printer.printRecord("Readability", "Grade", readability.getGradeLabel());
                printer.printRecord("Readability", "Gunning Fog", format(readability.getGunningFog()));
                printer.printRecord("Readability", "Complex Words %", format(readability.getComplexWordPercent()));
            }

            printer.println();
            printer.printRecord("KEY POINTS");
            printer.printRecord("Category", "Title", "Detail", "Watch Out", "Evidence");
            for (KeyPoint keyPoint : result.getKeyPoints()) {
                printer.printRecord(keyPoint.getCategoryLabel(), keyPoint.getTitle(), keyPoint.getDetail(),
                        keyPoint.isWatchOut() ? "YES" : "NO", joinEvidence(keyPoint.getEvidence()));
            }

            printer.println();
            printer.printRecord("RED FLAGS");
            printer.printRecord("Severity", "Category", "Description", "Evidence");
            for (RedFlag flag : result.getRedFlags()) {
                printer.printRecord(flag.getSeverity(), flag.getCategory(), flag.getDescription(), flag.getContext());
            }

            printer.println();
            printer.printRecord("BEFORE SIGNING CHECKLIST");
            printer.printRecord("#", "Action");
            List<String> checklist = result.getChecklist();
            for (int i = 0; i < checklist.size(); i++) {
                printer.printRecord(i + 1, checklist.get(i));
            }
        }
        logger.info("CSV export generated: {} bytes", out.size());
        return out.toByteArray();
    }

    private static String joinEvidence(List<Evidence> evidence) {
        return evidence.stream().map(Evidence::getSnippet).collect(Collectors.joining(" | "));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
