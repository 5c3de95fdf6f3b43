package com.clausescan.processing;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.annotation.Nullable;
import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Optical character recognition over Tesseract.
 *
 * <p>The engine bean is optional ({@code clausescan.ocr.enabled}). Without it {@link #isAvailable()}
 * is false and callers skip OCR. Every engine failure, including a missing native library, is
 * reported as an {@link IOException}.
 */
@Service
public class OcrService {

    private static final Logger logger = LoggerFactory.getLogger(OcrService.class);

    @Nullable
    private final ITesseract tesseract;

    @Autowired
    public OcrService(ObjectProvider<ITesseract> tesseractProvider) {
        this(tesseractProvider.getIfAvailable());
    }

    public OcrService(@Nullable ITesseract tesseract) {
        this.tesseract = tesseract;
    }

    public boolean isAvailable() {
        return tesseract != null;
    }

    /**
     * Decode an uploaded image and recognize its text.
     *
     * @throws IOException if the bytes are not a readable image or recognition fails
     */
    public String recognize(byte[] imageBytes) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        if (image == null) {
            throw new IOException("Unsupported or corrupt image");
        }
        return recognize(toRgb(image));
    }

    /**
     * Recognize the text of one rendered page or image.
     * Tesseract instances are not thread-safe, so calls are serialized.
     */
    public synchronized String recognize(BufferedImage image) throws IOException {
        if (tesseract == null) {
            throw new IOException("OCR engine is not configured");
        }
        long start = System.currentTimeMillis();
        try {
            String text = tesseract.doOCR(image);
            logger.debug("OCR recognized {} chars from {}x{} image in {}ms", text == null ? 0 : text.length(),
                    image.getWidth(), image.getHeight(), System.currentTimeMillis() - start);
            return text != null ? text : "";
        } catch (TesseractException e) {
            throw new IOException("OCR failed: " + e.getMessage(), e);
        } catch (LinkageError e) {
            throw new IOException("Tesseract native library unavailable: " + e.getMessage(), e);
        }
    }

    // Palette and alpha images are flattened onto white
    private static BufferedImage toRgb(BufferedImage image) {
        int type = image.getType();
        if (type == BufferedImage.TYPE_INT_RGB || type == BufferedImage.TYPE_3BYTE_BGR
                || type == BufferedImage.TYPE_BYTE_GRAY) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }
}
