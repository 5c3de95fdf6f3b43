package com.clausescan.api.validation;

import com.clausescan.api.UnsupportedDocumentException;
import com.clausescan.processing.model.DocumentFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Validates uploaded files: supported extension, PDF magic bytes (%PDF) and extracted text length.
 */
@Component
public class UploadValidator {

    private static final Logger logger = LoggerFactory.getLogger(UploadValidator.class);
    private static final byte[] PDF_MAGIC_BYTES = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final int maxTextLength;

    public UploadValidator(@Value("${clausescan.validation.max-text-length:1048576}") int maxTextLength) {
        this.maxTextLength = maxTextLength;
        logger.info("UploadValidator initialized: maxTextLength={}", maxTextLength);
    }

    /**
     * Resolves the upload format from its filename.
     *
     * @throws UnsupportedDocumentException for missing or unknown extensions
     */
    public DocumentFormat requireSupportedFormat(String filename) {
        return DocumentFormat.fromFilename(filename)
                .orElseThrow(() -> {
                    logger.warn("Upload rejected: unsupported file name '{}'", filename);
                    return new UnsupportedDocumentException(
                            "Unsupported file type: " + (filename != null ? filename : "<none>")
                                    + ". Upload a .txt, .pdf or image file.");
                });
    }

    /**
     * Checks that the content starts with the PDF signature.
     */
    public boolean validateMagicBytes(byte[] content) {
        if (content == null || content.length < PDF_MAGIC_BYTES.length) {
            logger.warn("PDF validation failed: file too short");
            return false;
        }
        for (int i = 0; i < PDF_MAGIC_BYTES.length; i++) {
            if (content[i] != PDF_MAGIC_BYTES[i]) {
                logger.warn("PDF validation failed: magic bytes mismatch at position {}", i);
                return false;
            }
        }
        return true;
    }

    /**
     * Rejects a .pdf upload that is not a PDF.
     */
    public void requirePdf(byte[] content, String filename) {
        if (!validateMagicBytes(content)) {
            throw new UnsupportedDocumentException("File " + filename + " does not look like a PDF document");
        }
    }

    /**
     * @throws IllegalArgumentException if the text exceeds the configured limit
     */
    public void validateMaxTextLength(String text) {
        int length = text != null ? text.length() : 0;
        if (length > maxTextLength) {
            logger.warn("Text validation failed: length ({}) exceeds maximum ({})", length, maxTextLength);
            throw new IllegalArgumentException(String.format(
                    "Text length (%d characters) exceeds maximum allowed (%d characters)", length, maxTextLength));
        }
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }
}
