package com.clausescan.processing.detect;

import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.model.KeyPoint;

import java.util.Optional;

/**
 * Pure per-category scanner. Returns at most one key point, consolidating every match of its
 * triggers; absence of relevant clauses is an empty result, never an error.
 */
@FunctionalInterface
public interface KeyPointDetector {

    Optional<KeyPoint> detect(String text, DocumentType documentType);
}
