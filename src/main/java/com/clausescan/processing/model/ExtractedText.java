package com.clausescan.processing.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Text pulled out of an uploaded file, page by page.
 * An empty instance means extraction failed or the file held no text.
 */
public class ExtractedText {
    private final List<PageText> pages;
    private final String source;

    public ExtractedText(List<PageText> pages, String source) {
        this.pages = pages != null ? new ArrayList<>(pages) : new ArrayList<>();
        this.source = source;
    }

    public static ExtractedText empty(String source) {
        return new ExtractedText(List.of(), source);
    }

    public List<PageText> getPages() {
        return pages;
    }

    /**
     * Extraction method used: {@code text}, {@code pdf}, {@code ocr} or {@code none}.
     */
    public String getSource() {
        return source;
    }

    public boolean isEmpty() {
        return getFullText().isBlank();
    }

    /**
     * Get full text concatenated from all pages.
     */
    public String getFullText() {
        StringBuilder sb = new StringBuilder();
        for (PageText page : pages) {
            if (page.getText().isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(page.getText().strip());
        }
        return sb.toString();
    }

    public static class PageText {
        private final int pageNumber;
        private final String text;

        public PageText(int pageNumber, String text) {
            this.pageNumber = pageNumber;
            this.text = text != null ? text : "";
        }

        public int getPageNumber() {
            return pageNumber;
        }

        public String getText() {
            return text;
        }
    }
}
