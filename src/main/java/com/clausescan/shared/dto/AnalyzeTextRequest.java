package com.clausescan.shared.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * DTO for analyzing pasted text.
 */
public class AnalyzeTextRequest {

    @NotBlank(message = "Text cannot be blank")
    @Size(max = DocumentInput.MAX_TEXT_LENGTH, message = "Text must not exceed 1048576 characters")
    private String text;

    public AnalyzeTextRequest() {
    }

    public AnalyzeTextRequest(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
