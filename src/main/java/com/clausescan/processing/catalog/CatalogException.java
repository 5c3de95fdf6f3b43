package com.clausescan.processing.catalog;

/**
 * Raised when the pattern catalog cannot be loaded or fails validation.
 * Only ever thrown at startup; a loaded catalog is structurally valid.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
