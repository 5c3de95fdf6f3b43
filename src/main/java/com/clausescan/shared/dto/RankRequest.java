package com.clausescan.shared.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * DTO for ranking several documents. The 2-8 bound is enforced by the ranking service.
 */
public class RankRequest {

    @Valid
    @NotNull(message = "Documents are required")
    private List<DocumentInput> documents;

    public RankRequest() {
    }

    public RankRequest(List<DocumentInput> documents) {
        this.documents = documents;
    }

    public List<DocumentInput> getDocuments() {
        return documents;
    }

    public void setDocuments(List<DocumentInput> documents) {
        this.documents = documents;
    }
}
