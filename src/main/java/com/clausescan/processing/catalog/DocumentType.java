package com.clausescan.processing.catalog;

/**
 * Legal document categories recognized by the classifier.
 * Declaration order is the tie-break priority: more specific categories come first
 * so that, for example, a mortgage outranks a generic loan agreement on equal score.
 * {@link #GENERAL} is the fallback and is never selected by keyword score.
 */
public enum DocumentType {

    MORTGAGE("Mortgage Agreement",
            "This is a mortgage agreement securing a loan against real property. It covers repayment terms, "
                    + "interest, and default consequences including foreclosure rights."),
    INSURANCE("Insurance Policy",
            "This is an insurance policy outlining coverage terms, exclusions, premiums, and claim procedures. "
                    + "It defines your rights as a policyholder and what events or losses are covered."),
    LOAN_CREDIT("Loan / Credit Agreement",
            "This is a loan or credit agreement governing borrowed funds, repayment schedules, interest rates, "
                    + "and consequences of default."),
    INVESTMENT("Investment / Securities",
            "This is an investment or securities agreement covering risk disclosures, fees, fiduciary obligations, "
                    + "and the management of your assets or portfolio."),
    FINANCIAL_ADVISORY("Financial Advisory",
            "This is a financial advisory agreement covering the scope of advice, fee structures, fiduciary duty, "
                    + "conflicts of interest, and liability."),
    LEASE("Lease / Rental Agreement",
            "This is a lease or rental agreement outlining tenancy terms, rent obligations, maintenance "
                    + "responsibilities, and conditions for eviction."),
    EMPLOYMENT("Employment Contract",
            "This is an employment agreement covering compensation, confidentiality, intellectual property, "
                    + "non-compete obligations, and termination conditions."),
    HEALTHCARE("Healthcare / Medical",
            "This is a healthcare or medical services agreement covering patient rights, health data privacy, "
                    + "treatment consent, and billing."),
    PRIVACY_POLICY("Privacy Policy",
            "This is a privacy policy describing what personal data is collected, how it is used, who it is "
                    + "shared with, and your rights regarding that data."),
    CLOUD_SERVICES("Cloud Services Agreement",
            "This is a cloud services agreement covering infrastructure access, uptime guarantees, data ownership, "
                    + "and service availability."),
    SAAS("SaaS / Software License",
            "This is a software or SaaS agreement governing usage rights, billing, and the provider's ability to "
                    + "modify or terminate the service."),
    MOBILE_APP("Mobile App Terms",
            "These are terms of service for a mobile application covering acceptable use, in-app purchases, "
                    + "data handling, and your rights as a user."),
    OPEN_SOURCE("Open Source License",
            "This is an open-source license governing how the software can be used, modified, and redistributed."),
    STREAMING("Streaming / Media",
            "This is a streaming or media service agreement covering content access, billing, simultaneous "
                    + "streams, and usage restrictions."),
    SUBSCRIPTION("Subscription Service",
            "This is a subscription agreement governing recurring billing, plan features, upgrade and downgrade "
                    + "rights, and cancellation."),
    ECOMMERCE("E-Commerce / Shopping",
            "This is an e-commerce agreement covering purchases, returns, refunds, and seller and buyer "
                    + "obligations on the platform."),
    TRAVEL("Travel & Hospitality",
            "This is a travel or hospitality agreement covering bookings, cancellations, refunds, passenger "
                    + "obligations, and liability for travel disruptions."),
    TELECOM("Telecommunications",
            "This is a telecommunications agreement covering your mobile or broadband plan, data limits, roaming "
                    + "charges, and network usage policies."),
    SOCIAL_MEDIA("Social Media Platform",
            "These are terms of service for a social media platform covering content rights, community "
                    + "standards, data use, and account management."),
    WEBSITE_TERMS("Website Terms of Use",
            "These are website terms of use governing how you may access and interact with the site, including "
                    + "user accounts, content, and liability."),
    GENERAL("General Terms & Conditions",
            "This is a general terms and conditions document outlining the rules, rights, and obligations "
                    + "between you and the provider.");

    private final String label;
    private final String summary;

    DocumentType(String label, String summary) {
        this.label = label;
        this.summary = summary;
    }

    public String getLabel() {
        return label;
    }

    public String getSummary() {
        return summary;
    }

    public boolean isFallback() {
        return this == GENERAL;
    }
}
