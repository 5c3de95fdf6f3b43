package com.clausescan.processing.model;

import com.clausescan.processing.catalog.KeyPointCategory;

import java.util.List;

/**
 * One row of the ranking matrix: a category across all documents, columns in rank order.
 */
public class CategoryRow {

    private final KeyPointCategory category;
    private final List<CellState> cells;
    private final List<String> details;

    public CategoryRow(KeyPointCategory category, List<CellState> cells, List<String> details) {
        this.category = category;
        this.cells = List.copyOf(cells);
        this.details = List.copyOf(details);
    }

    public KeyPointCategory getCategory() {
        return category;
    }

    public String getCategoryLabel() {
        return category.getLabel();
    }

    public List<CellState> getCells() {
        return cells;
    }

    public List<String> getDetails() {
        return details;
    }
}
