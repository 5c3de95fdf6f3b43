package com.clausescan.api;

/**
 * Raised for uploads whose type the service cannot read. Mapped to HTTP 415.
 */
public class UnsupportedDocumentException extends RuntimeException {

    public UnsupportedDocumentException(String message) {
        super(message);
    }
}
