package com.clausescan.shared.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * A named document inside a compare or rank request.
 */
public class DocumentInput {

    public static final int MAX_TEXT_LENGTH = 1048576;
    public static final int MAX_NAME_LENGTH = 120;

    @Size(max = MAX_NAME_LENGTH, message = "Name must not exceed 120 characters")
    private String name;

    @NotBlank(message = "Text cannot be blank")
    @Size(max = MAX_TEXT_LENGTH, message = "Text must not exceed 1048576 characters")
    private String text;

    public DocumentInput() {
    }

    public DocumentInput(String name, String text) {
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
