package com.clausescan.shared.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for exporting an analysis as a PDF, Word or CSV download.
 */
public class ExportRequest {

    @Size(max = DocumentInput.MAX_NAME_LENGTH, message = "Name must not exceed 120 characters")
    private String name;

    @NotBlank(message = "Text cannot be blank")
    @Size(max = DocumentInput.MAX_TEXT_LENGTH, message = "Text must not exceed 1048576 characters")
    private String text;

    public ExportRequest() {
    }

    public ExportRequest(String name, String text) {
        this.name = name;
        this.text = text;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
