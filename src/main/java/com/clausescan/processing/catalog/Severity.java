package com.clausescan.processing.catalog;

/**
 * Red flag severity tiers, lowest first.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
