package com.clausescan.processing.model;

/**
 * Downloadable renderings of an analysis report.
 */
public enum ExportFormat {
    PDF("application/pdf", "report.pdf"),
    SUMMARY_PDF("application/pdf", "summary.pdf"),
    WORD("application/vnd.openxmlformats-officedocument.wordprocessingml.document", "report.docx"),
    CSV("text/csv;charset=UTF-8", "report.csv");

    private final String mediaType;
    private final String fileSuffix;

    ExportFormat(String mediaType, String fileSuffix) {
        this.mediaType = mediaType;
        this.fileSuffix = fileSuffix;
    }

    public String getMediaType() {
        return mediaType;
    }

    /**
     * Appended to the document slug, e.g. {@code lease-report.docx}.
     */
    public String getFileSuffix() {
        return fileSuffix;
    }
}
