package com.clausescan.processing.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Upload formats recognised by file extension.
 */
public enum DocumentFormat {
    TEXT(Set.of("txt")),
    PDF(Set.of("pdf")),
    IMAGE(Set.of("png", "jpg", "jpeg", "tif", "tiff", "bmp"));

    private final Set<String> extensions;

    DocumentFormat(Set<String> extensions) {
        this.extensions = extensions;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    public static Optional<DocumentFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return Optional.empty();
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (DocumentFormat format : values()) {
            if (format.extensions.contains(extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
