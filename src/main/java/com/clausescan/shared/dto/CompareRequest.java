package com.clausescan.shared.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * DTO for a two-document comparison.
 */
public class CompareRequest {

    @Valid
    @NotNull(message = "Left document is required")
    private DocumentInput left;

    @Valid
    @NotNull(message = "Right document is required")
    private DocumentInput right;

    public CompareRequest() {
    }

    public CompareRequest(DocumentInput left, DocumentInput right) {
        this.left = left;
        this.right = right;
    }

    public DocumentInput getLeft() {
        return left;
    }

    public void setLeft(DocumentInput left) {
        this.left = left;
    }

    public DocumentInput getRight() {
        return right;
    }

    public void setRight(DocumentInput right) {
        this.right = right;
    }
}
