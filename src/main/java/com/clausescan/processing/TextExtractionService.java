package com.clausescan.processing;

import com.clausescan.observability.DatadogMetricsServiceInterface;
import com.clausescan.processing.model.DocumentFormat;
import com.clausescan.processing.model.ExtractedText;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns uploaded bytes into plain text.
 *
 * <p>Text files are decoded as UTF-8 with malformed sequences replaced. PDFs are read page by page
 * with PDFBox. A PDF whose text layer holds fewer than {@value #MIN_PDF_TEXT_CHARS} characters is
 * treated as scanned: its pages are rendered and passed through OCR. Images go straight to OCR.
 * Failures never propagate: they yield an empty {@link ExtractedText}, which analysis turns into
 * the fallback result.
 */
@Service
public class TextExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(TextExtractionService.class);
    private static final char BOM = '\uFEFF';

    static final int MIN_PDF_TEXT_CHARS = 100;
    private static final float OCR_RENDER_DPI = 200f;

    private final OcrService ocrService;
    private final DatadogMetricsServiceInterface metricsService;

    public TextExtractionService(OcrService ocrService, DatadogMetricsServiceInterface metricsService) {
        this.ocrService = ocrService;
        this.metricsService = metricsService;
    }

    public ExtractedText extract(byte[] content, DocumentFormat format) {
        if (content == null || content.length == 0) {
            metricsService.recordExtractionFailure(format.name(), "empty_file");
            return ExtractedText.empty("none");
        }
        switch (format) {
            case TEXT:
                return extractPlainText(content);
            case PDF:
                return extractPdf(content);
            default:
                return extractImage(content);
        }
    }

    private ExtractedText extractPlainText(byte[] content) {
        // String(byte[], Charset) substitutes U+FFFD for malformed input
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return new ExtractedText(List.of(new ExtractedText.PageText(1, text)), "text");
    }

    private ExtractedText extractImage(byte[] content) {
        String format = DocumentFormat.IMAGE.name();
        if (!ocrService.isAvailable()) {
            logger.warn("No OCR engine configured, image upload yields no text ({} bytes)", content.length);
            metricsService.recordExtractionFailure(format, "ocr_unavailable");
            return ExtractedText.empty("none");
        }
        try {
            ExtractedText extracted = new ExtractedText(
                    List.of(new ExtractedText.PageText(1, ocrService.recognize(content))), "ocr");
            if (extracted.isEmpty()) {
                logger.warn("OCR found no text in image ({} bytes)", content.length);
                metricsService.recordExtractionFailure(format, "no_text");
            }
            return extracted;
        } catch (IOException e) {
            logger.warn("Image OCR failed: {}", e.getMessage());
            metricsService.recordExtractionFailure(format, "ocr_failed");
            return ExtractedText.empty("none");
        }
    }

    private ExtractedText extractPdf(byte[] content) {
        String format = DocumentFormat.PDF.name();
        List<ExtractedText.PageText> pages = new ArrayList<>();
        ExtractedText extracted;
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int totalPages = document.getNumberOfPages();
            for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                pages.add(new ExtractedText.PageText(pageNum, stripper.getText(document)));
            }
            logger.debug("PDFBox extracted {} pages", totalPages);
            extracted = new ExtractedText(pages, "pdf");
            if (extracted.getFullText().length() < MIN_PDF_TEXT_CHARS && ocrService.isAvailable()) {
                ExtractedText scanned = ocrPages(document);
                if (!scanned.isEmpty()) {
                    return scanned;
                }
            }
        } catch (IOException e) {
            logger.warn("PDF text extraction failed: {}", e.getMessage());
            metricsService.recordExtractionFailure(format, e.getClass().getSimpleName());
            return ExtractedText.empty("none");
        }
        if (extracted.isEmpty()) {
            logger.warn("PDF contained no extractable text ({} pages)", pages.size());
            metricsService.recordExtractionFailure(format, "no_text");
        }
        return extracted;
    }

    /**
     * Render every page and recognize it. A failure keeps whatever the text layer gave.
     */
    private ExtractedText ocrPages(PDDocument document) {
        List<ExtractedText.PageText> pages = new ArrayList<>();
        PDFRenderer renderer = new PDFRenderer(document);
        try {
            for (int i = 0; i < document.getNumberOfPages(); i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, OCR_RENDER_DPI, ImageType.RGB);
                pages.add(new ExtractedText.PageText(i + 1, ocrService.recognize(image)));
            }
        } catch (IOException e) {
            logger.warn("OCR of scanned PDF failed after {} pages: {}", pages.size(), e.getMessage());
            metricsService.recordExtractionFailure(DocumentFormat.PDF.name(), "ocr_failed");
            return ExtractedText.empty("none");
        }
        logger.info("Text layer too thin, OCR read {} pages", pages.size());
        return new ExtractedText(pages, "ocr");
    }
}
