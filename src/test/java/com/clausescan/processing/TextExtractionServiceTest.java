package com.clausescan.processing;

import com.clausescan.TestPdfFactory;
import com.clausescan.observability.DatadogMetricsServiceInterface;
import com.clausescan.processing.model.DocumentFormat;
import com.clausescan.processing.model.ExtractedText;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TextExtractionServiceTest {

    static final String IMAGE_TEXT = "Binding arbitration applies to all disputes.";

    private DatadogMetricsServiceInterface metricsService;
    private ITesseract tesseract;
    private TextExtractionService extractionService;

    @BeforeEach
    void setUp() {
        metricsService = mock(DatadogMetricsServiceInterface.class);
        tesseract = mock(ITesseract.class);
        extractionService = new TextExtractionService(new OcrService(tesseract), metricsService);
    }

    /**
     * A white PNG with one dark block per word of the clause, so no system font is needed.
     */
    static byte[] pngOfClause(String clause) throws IOException {
        String[] words = clause.split(" ");
        BufferedImage image = new BufferedImage(900, 80, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.setColor(Color.BLACK);
            int x = 10;
            for (String word : words) {
                graphics.fillRect(x, 30, word.length() * 12, 24);
                x += word.length() * 12 + 14;
            }
        } finally {
            graphics.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    @Test
    void testExtract_PlainTextStripsByteOrderMark() {
        // Given: UTF-8 text with a BOM
        byte[] content = "\uFEFFBinding arbitration applies.".getBytes(StandardCharsets.UTF_8);

        // When
        ExtractedText extracted = extractionService.extract(content, DocumentFormat.TEXT);

        // Then
        assertThat(extracted.getFullText()).isEqualTo("Binding arbitration applies.");
        assertThat(extracted.getSource()).isEqualTo("text");
        verify(metricsService, never()).recordExtractionFailure(anyString(), anyString());
    }

    @Test
    void testExtract_MalformedUtf8IsReplaced() {
        byte[] content = {'a', 'b', (byte) 0xC3, 'c'};

        ExtractedText extracted = extractionService.extract(content, DocumentFormat.TEXT);

        assertThat(extracted.getFullText()).startsWith("ab").endsWith("c").contains("\uFFFD");
    }

    @Test
    void testExtract_PdfPerPage() throws IOException {
        byte[] pdf = TestPdfFactory.insuranceScenarioPdf();

        ExtractedText extracted = extractionService.extract(pdf, DocumentFormat.PDF);

        assertThat(extracted.getSource()).isEqualTo("pdf");
        assertThat(extracted.getPages()).hasSize(1);
        assertThat(extracted.getFullText())
                .contains("unilaterally modified by the Insurer at any time without notice")
                .contains("Arbitration is mandatory");
        // Text layer is long enough, so no page is rendered for OCR
        verifyNoInteractions(tesseract);
    }

    @Test
    void testExtract_CorruptPdfYieldsEmptyText() {
        byte[] corrupt = "%PDF-1.4 this is not really a pdf".getBytes(StandardCharsets.US_ASCII);

        ExtractedText extracted = extractionService.extract(corrupt, DocumentFormat.PDF);

        assertThat(extracted.isEmpty()).isTrue();
        verify(metricsService).recordExtractionFailure(eq("PDF"), anyString());
    }

    @Test
    void testExtract_ImageTextIsRecognized() throws Exception {
        // Given: a PNG showing a known sentence, read back by the engine
        byte[] png = pngOfClause(IMAGE_TEXT);
        when(tesseract.doOCR(any(BufferedImage.class))).thenReturn(IMAGE_TEXT + "\n");

        // When
        ExtractedText extracted = extractionService.extract(png, DocumentFormat.IMAGE);

        // Then: the decoded image reaches the engine flattened to RGB
        assertThat(extracted.getFullText()).isEqualTo(IMAGE_TEXT);
        assertThat(extracted.getSource()).isEqualTo("ocr");
        ArgumentCaptor<BufferedImage> captor = ArgumentCaptor.forClass(BufferedImage.class);
        verify(tesseract).doOCR(captor.capture());
        assertThat(captor.getValue().getWidth()).isEqualTo(900);
        assertThat(captor.getValue().getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        verify(metricsService, never()).recordExtractionFailure(anyString(), anyString());
    }

    @Test
    void testExtract_ImageOcrFailureYieldsEmptyText() throws Exception {
        when(tesseract.doOCR(any(BufferedImage.class))).thenThrow(new TesseractException("engine crashed"));

        ExtractedText extracted = extractionService.extract(pngOfClause(IMAGE_TEXT), DocumentFormat.IMAGE);

        assertThat(extracted.isEmpty()).isTrue();
        verify(metricsService).recordExtractionFailure("IMAGE", "ocr_failed");
    }

    @Test
    void testExtract_MissingNativeLibraryYieldsEmptyText() throws Exception {
        when(tesseract.doOCR(any(BufferedImage.class))).thenThrow(new UnsatisfiedLinkError("libtesseract"));

        ExtractedText extracted = extractionService.extract(pngOfClause(IMAGE_TEXT), DocumentFormat.IMAGE);

        assertThat(extracted.isEmpty()).isTrue();
        verify(metricsService).recordExtractionFailure("IMAGE", "ocr_failed");
    }

    @Test
    void testExtract_UnreadableImageYieldsEmptyText() {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};

        ExtractedText extracted = extractionService.extract(png, DocumentFormat.IMAGE);

        assertThat(extracted.isEmpty()).isTrue();
        verify(metricsService).recordExtractionFailure("IMAGE", "ocr_failed");
        verifyNoInteractions(tesseract);
    }

    @Test
    void testExtract_ImageWithoutOcrEngineYieldsNoText() throws IOException {
        TextExtractionService withoutOcr = new TextExtractionService(new OcrService((ITesseract) null), metricsService);

        ExtractedText extracted = withoutOcr.extract(pngOfClause(IMAGE_TEXT), DocumentFormat.IMAGE);

        assertThat(extracted.isEmpty()).isTrue();
        verify(metricsService).recordExtractionFailure("IMAGE", "ocr_unavailable");
    }

    @Test
    void testExtract_ScannedPdfFallsBackToOcr() throws Exception {
        // Given: two pages with no text layer
        byte[] pdf = TestPdfFactory.blankPdf(2);
        when(tesseract.doOCR(any(BufferedImage.class)))
                .thenReturn("Arbitration is mandatory.")
                .thenReturn("You waive your right to a jury trial.");

        // When
        ExtractedText extracted = extractionService.extract(pdf, DocumentFormat.PDF);

        // Then
        assertThat(extracted.getSource()).isEqualTo("ocr");
        assertThat(extracted.getPages()).hasSize(2);
        assertThat(extracted.getFullText())
                .isEqualTo("Arbitration is mandatory.\n\nYou waive your right to a jury trial.");
        verify(tesseract, times(2)).doOCR(any(BufferedImage.class));
        verify(metricsService, never()).recordExtractionFailure(anyString(), anyString());
    }

    @Test
    void testExtract_ShortTextLayerFallsBackToOcr() throws Exception {
        byte[] pdf = TestPdfFactory.pdfBytes("Page 1");
        when(tesseract.doOCR(any(BufferedImage.class))).thenReturn("Arbitration is mandatory. Page 1");

        ExtractedText extracted = extractionService.extract(pdf, DocumentFormat.PDF);

        assertThat(extracted.getSource()).isEqualTo("ocr");
        assertThat(extracted.getFullText()).contains("Arbitration is mandatory");
    }

    @Test
    void testExtract_ScannedPdfOcrFailureKeepsTextLayer() throws Exception {
        byte[] pdf = TestPdfFactory.pdfBytes("Page 1");
        when(tesseract.doOCR(any(BufferedImage.class))).thenThrow(new TesseractException("no tessdata"));

        ExtractedText extracted = extractionService.extract(pdf, DocumentFormat.PDF);

        assertThat(extracted.getSource()).isEqualTo("pdf");
        assertThat(extracted.getFullText()).isEqualTo("Page 1");
        verify(metricsService).recordExtractionFailure("PDF", "ocr_failed");
    }

    @Test
    void testExtract_ScannedPdfWithoutOcrEngineYieldsNoText() throws IOException {
        TextExtractionService withoutOcr = new TextExtractionService(new OcrService((ITesseract) null), metricsService);

        ExtractedText extracted = withoutOcr.extract(TestPdfFactory.blankPdf(1), DocumentFormat.PDF);

        assertThat(extracted.isEmpty()).isTrue();
        verify(metricsService).recordExtractionFailure("PDF", "no_text");
    }

    @Test
    void testExtract_EmptyContent() {
        assertThat(extractionService.extract(new byte[0], DocumentFormat.TEXT).isEmpty()).isTrue();
        verify(metricsService).recordExtractionFailure("TEXT", "empty_file");
    }
}
