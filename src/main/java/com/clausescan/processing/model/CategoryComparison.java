package com.clausescan.processing.model;

import com.clausescan.processing.catalog.KeyPointCategory;

/**
 * One key-point category compared across the two documents of a comparison.
 */
public class CategoryComparison {

    private final KeyPointCategory category;
    private final CellState left;
    private final CellState right;
    private final String leftDetail;
    private final String rightDetail;

    public CategoryComparison(KeyPointCategory category, CellState left, CellState right,
                              String leftDetail, String rightDetail) {
        this.category = category;
        this.left = left;
        this.right = right;
        this.leftDetail = leftDetail;
        this.rightDetail = rightDetail;
    }

    public KeyPointCategory getCategory() {
        return category;
    }

    public String getCategoryLabel() {
        return category.getLabel();
    }

    public CellState getLeft() {
        return left;
    }

    public CellState getRight() {
        return right;
    }

    public String getLeftDetail() {
        return leftDetail;
    }

    public String getRightDetail() {
        return rightDetail;
    }

    public boolean isDifferent() {
        return left != right;
    }
}
