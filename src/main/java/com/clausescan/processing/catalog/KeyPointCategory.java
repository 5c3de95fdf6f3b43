package com.clausescan.processing.catalog;

/**
 * Contractual concern categories a key point can belong to.
 * Declaration order is the fixed report order.
 */
public enum KeyPointCategory {

    PRIVACY_DATA("Privacy & Data"),
    DISPUTE_RESOLUTION("Dispute Resolution"),
    ACCOUNT_TERMINATION("Account Termination"),
    AUTO_RENEWAL("Auto-Renewal"),
    CANCELLATION("Cancellation"),
    REFUNDS("Refunds"),
    PAYMENT_BILLING("Payment & Billing"),
    LIABILITY("Liability"),
    INTELLECTUAL_PROPERTY("Intellectual Property"),
    TERMS_CHANGES("Terms Changes"),
    COOKIES_TRACKING("Cookies & Tracking"),
    NON_COMPETE("Non-Compete"),
    HEALTH_DATA("Health Data"),
    DEFAULT_CONSEQUENCES("Default & Consequences"),
    SECURITY_DEPOSIT("Security Deposit"),
    NETWORK_ROAMING("Network & Roaming"),
    SERVICE_LEVEL("Service Level"),
    FORCE_MAJEURE("Force Majeure"),
    AGE_RESTRICTION("Age Restriction"),
    GOVERNING_LAW("Governing Law");

    private final String label;

    KeyPointCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
