package com.clausescan.config;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tesseract engine used for image uploads and scanned PDFs.
 * The native library is only loaded on the first recognition call, so a missing install
 * surfaces as an extraction failure rather than a startup error.
 */
@Configuration
@ConditionalOnProperty(name = "clausescan.ocr.enabled", havingValue = "true", matchIfMissing = true)
public class OcrConfig {

    private static final Logger logger = LoggerFactory.getLogger(OcrConfig.class);

    @Bean
    public ITesseract tesseract(@Value("${clausescan.ocr.datapath:}") String datapath,
                                @Value("${clausescan.ocr.language:eng}") String language,
                                @Value("${clausescan.ocr.dpi:300}") int dpi) {
        Tesseract tesseract = new Tesseract();
        if (!datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }
        tesseract.setLanguage(language);
        tesseract.setVariable("user_defined_dpi", String.valueOf(dpi));
        logger.info("Tesseract OCR configured: language={}, datapath={}", language,
                datapath.isBlank() ? "(default)" : datapath);
        return tesseract;
    }
}
