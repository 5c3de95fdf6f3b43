package com.clausescan.processing.model;

/**
 * How one document fares in one key-point category.
 */
public enum CellState {
    /** Category present and not flagged as watch-out. */
    GOOD,
    /** Category present and flagged as watch-out. */
    WARN,
    /** Category not found in the document. */
    MISSING;

    public static CellState of(KeyPoint keyPoint) {
        if (keyPoint == null) {
            return MISSING;
        }
        return keyPoint.isWatchOut() ? WARN : GOOD;
    }
}
