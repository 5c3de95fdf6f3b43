package com.clausescan.processing.detect;

import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.KeyPointCategory;
import com.clausescan.processing.model.Evidence;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.util.TextSpans;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in key point detectors, one static function per {@link KeyPointCategory}.
 *
 * <p>Each detector checks its trigger patterns, gathers up to {@value #MAX_EVIDENCE} evidence
 * sentences and reads structured attributes from the sentences around its triggers.
 * All patterns are compiled once and shared; the functions hold no state.
 */
public final class KeyPointDetectors {

    static final int MAX_EVIDENCE = 3;
    static final int MAX_MATCHES_PER_PATTERN = 50;

    private static final Pattern WITHOUT_NOTICE = p("\\bwithout\\s+(?:any\\s+)?(?:prior\\s+|advance\\s+)?(?:written\\s+)?notice\\b");
    private static final Pattern NO_REFUND = p("\\bno\\s+refunds?\\b|\\bnon[- ]?refundable\\b|\\ball\\s+sales\\s+(?:are\\s+)?final\\b");
    private static final Pattern CURRENCY = p("[$€£]\\s?\\d{1,3}(?:,\\d{3})*(?:\\.\\d{2})?|\\b\\d+(?:,\\d{3})*(?:\\.\\d{2})?\\s?(?:USD|EUR|GBP|dollars)\\b");
    private static final Pattern NOTICE_PERIOD = p("\\b(\\d{1,3})\\s*(days?|weeks?|months?)(?:'|’)?\\s+(?:(?:prior|advance|written)\\s+)*notice\\b"
            + "|\\b(\\d{1,3})\\s*(days?|weeks?|months?)\\s+(?:before|prior\\s+to)\\b");

    // Payment & billing
    private static final Pattern PAYMENT = p("\\b(?:payments?|billing|billed|charges?|fees?|prices?|pricing)\\b");
    private static final Pattern AUTO_CHARGE = p("\\bautomatic(?:ally)?\\s+(?:charged?|billed?|renew\\w*)|\\bcharged?\\s+automatically\\b");
    private static final Pattern PRICE_CHANGE = p("\\bprices?\\b[^.]{0,40}?\\b(?:change|increase)\\w*|\\b(?:adjust|change|increase|modify)\\w*[^.]{0,30}?\\b(?:prices?|fees?)\\b");
    private static final Pattern LATE_FEE = p("\\blate\\s+(?:payment\\s+)?(?:fees?|charges?)\\b|\\bpenalt(?:y|ies)\\b[^.]{0,30}?\\bpayments?\\b");

    // Auto-renewal, cancellation, refunds
    private static final Pattern RENEWAL = p("\\bauto(?:matic(?:ally)?)?[- ]?renew\\w*|\\brenew\\w*[^.]{0,40}?\\bsubscriptions?\\b");
    private static final Pattern CANCEL = p("\\bcancel\\w*|\\bterminat\\w*");
    private static final Pattern CANCEL_ANY_TIME = p("\\bcancel\\w*[^.]{0,40}?\\b(?:at\\s+)?any\\s*time\\b");
    private static final Pattern CANCEL_NOTICE = p("\\bnotice\\b[^.]{0,40}?\\bcancel\\w*|\\bcancel\\w*[^.]{0,40}?\\bnotice\\b");
    private static final Pattern REFUND = p("\\brefund\\w*|\\bmoney[- ]back\\b|\\bchargebacks?\\b");
    private static final Pattern DAY_WINDOW = p("\\b(\\d{1,3})[- ]?(?:calendar\\s+|business\\s+)?days?\\b");

    // Privacy, cookies, health data
    private static final Pattern PERSONAL_DATA = p("\\bpersonal\\s+(?:data|information)\\b|\\bprivacy\\b|\\bcollect\\w*[^.]{0,40}?\\bdata\\b");
    private static final Pattern DATA_SALE = p("\\bsell\\w*[^.]{0,60}?\\b(?:data|information)\\b|\\bthird[- ]part(?:y|ies)\\b[^.]{0,40}?\\bsell\\w*");
    private static final Pattern DATA_SHARING = p("\\bshar\\w*[^.]{0,60}?\\bthird[- ]part(?:y|ies)\\b|\\bthird[- ]part(?:y|ies)\\b[^.]{0,40}?\\bshar\\w*");
    private static final Pattern PRIVACY_LAW = p("\\bgdpr\\b|\\bccpa\\b");
    private static final Pattern COOKIES = p("\\bcookies?\\b|\\btracking\\b|\\bweb\\s+beacons?\\b|\\bpixels?\\b");
    private static final Pattern AD_COOKIES = p("\\bthird[- ]party\\b[^.]{0,40}?\\bcookies?\\b|\\badvertis\\w*[^.]{0,40}?\\bcookies?\\b|\\bcookies?\\b[^.]{0,40}?\\badvertis\\w*");
    private static final Pattern HEALTH = p("\\bhipaa\\b|\\bhealth\\b[^.]{0,20}?\\b(?:data|information)\\b|\\bmedical\\s+records?\\b|\\bprotected\\s+health\\b|\\bphi\\b");
    private static final Pattern HEALTH_SHARING = p("\\b(?:shar|disclos)\\w*[^.]{0,40}?\\bhealth\\b|\\bthird[- ]part(?:y|ies)\\b[^.]{0,40}?\\bhealth\\b");

    // Liability and disputes
    private static final Pattern LIABILITY = p("\\bliabilit(?:y|ies)\\b|\\bliable\\b|\\bindemnif\\w*");
    private static final Pattern UNLIMITED_LIABILITY = p("\\bunlimited\\s+liability\\b");
    private static final Pattern LIMITED_LIABILITY = p("\\blimitation\\s+of\\s+liability\\b|\\bnot\\s+(?:be\\s+)?liable\\b|\\blimits?\\s+(?:its|our)\\s+(?:total\\s+)?liability\\b");
    private static final Pattern INDEMNIFY = p("\\bindemnif\\w*");
    private static final Pattern DISPUTE = p("\\barbitrat\\w*|\\bclass\\s+actions?\\b|\\bdispute\\s+resolution\\b|\\bjury\\s+trials?\\b");
    private static final Pattern FORCED_ARBITRATION = p("\\b(binding|mandatory)\\s+arbitration\\b|\\barbitration\\s+(?:is|shall\\s+be)\\s+(mandatory|binding|required)\\b");
    private static final Pattern CLASS_WAIVER = p("\\bclass\\s+action\\s+waiver\\b|\\bwaive\\w*[^.]{0,60}?\\bclass\\s+actions?\\b|\\bclass\\s+actions?\\b[^.]{0,40}?\\b(?:waived|prohibited|not\\s+permitted)\\b");
    private static final Pattern JURY_WAIVER = p("\\bwaive\\w*[^.]{0,40}?\\bjury\\b|\\bjury\\s+(?:trial\\s+)?waiver\\b");
    private static final Pattern GOVERNING_LAW = p("\\bgoverning\\s+law\\b|\\bjurisdiction\\b|\\blaws\\s+of\\s+the\\s+state\\b|\\bgoverned\\s+by\\b[^.]{0,40}?\\blaws?\\b");
    // Case-sensitive on purpose: place names are capitalized.
    private static final Pattern JURISDICTION = Pattern.compile(
            "\\blaws? of (?:the )?(?:(?:State|Commonwealth|Province) of )?([A-Z][a-z]+(?:\\s[A-Z][a-z]+)?)");

    // Content, accounts, terms
    private static final Pattern IP = p("\\bintellectual\\s+property\\b|\\bcopyrights?\\b|\\btrademarks?\\b|\\buser[- ]generated\\b|\\bcontent\\b[^.]{0,40}?\\blicen[cs]e\\b|\\binventions?\\b");
    private static final Pattern BROAD_LICENSE = p("\\bgrant\\w*[^.]{0,60}?\\blicen[cs]e\\b[^.]{0,60}?\\bcontent\\b|\\broyalty[- ]free\\b|\\bperpetual\\b[^.]{0,60}?\\blicen[cs]e\\b|\\birrevocabl\\w*[^.]{0,60}?\\blicen[cs]e\\b");
    private static final Pattern IP_ASSIGNMENT = p("\\bassign\\w*[^.]{0,60}?\\b(?:inventions?|intellectual\\s+property|work\\s+product)\\b");
    private static final Pattern ACCOUNT_TERMINATION = p("\\b(?:terminat|suspend)\\w*[^.]{0,40}?\\baccounts?\\b|\\bsole\\s+discretion\\b|\\bmay\\s+(?:terminate|suspend)\\b");
    private static final Pattern TERMINATE = p("\\bterminat\\w*");
    private static final Pattern TERMS_CHANGE = p("\\b(?:modif|chang|amend|updat|revis)\\w*[^.]{0,40}?\\b(?:terms|agreement|policy|policies)\\b"
            + "|\\bunilateral(?:ly)?\\b[^.]{0,40}?\\b(?:modif|chang|amend)\\w*");
    private static final Pattern CHANGE_ANY_TIME = p("\\bat\\s+any\\s+time\\b[^.]{0,40}?\\b(?:modif|chang|amend)\\w*|\\b(?:modif|chang|amend)\\w*[^.]{0,60}?\\bat\\s+any\\s+time\\b");

    // Employment, lending, leases
    private static final Pattern NON_COMPETE = p("\\bnon[- ]?compet\\w*|\\bnon[- ]?solicit\\w*|\\brestraint\\s+of\\s+trade\\b");
    private static final Pattern RESTRICTION_PERIOD = p("\\b(\\d{1,2}|one|two|three|four|five|six|twelve|eighteen)\\s*(?:\\(\\d+\\)\\s*)?(months?|years?)\\b");
    private static final Pattern DEFAULT = p("\\bdefaults?\\b|\\bacceleration\\b|\\bforeclos\\w*|\\brepossess\\w*|\\bevict\\w*");
    private static final Pattern ACCELERATION = p("\\baccelerat\\w*");
    private static final Pattern FORECLOSURE = p("\\bforeclos\\w*");
    private static final Pattern REPOSSESSION = p("\\brepossess\\w*");
    private static final Pattern EVICTION = p("\\bevict\\w*");
    private static final Pattern GARNISHMENT = p("\\bgarnish\\w*");
    private static final Pattern DEPOSIT = p("\\bsecurity\\s+deposit\\b|\\bdamage\\s+deposit\\b|\\bbond\\b");

    // Network, service levels, misc
    private static final Pattern NETWORK = p("\\broaming\\b|\\bdata\\s+caps?\\b|\\bfair\\s+use\\b|\\bthrottl\\w*|\\bnetwork\\s+management\\b");
    private static final Pattern THROTTLING = p("\\bthrottl\\w*|\\bspeeds?\\b[^.]{0,30}?\\breduc\\w*");
    private static final Pattern ROAMING = p("\\broaming\\b");
    private static final Pattern DATA_CAP = p("\\b(\\d+(?:\\.\\d+)?)\\s?(GB|MB|TB)\\b");
    private static final Pattern SLA = p("\\bsla\\b|\\bservice\\s+levels?\\b|\\buptime\\b|\\bdowntime\\b|\\bavailability\\b[^.]{0,30}?%");
    private static final Pattern UPTIME_PERCENT = p("\\b(\\d{2,3}(?:\\.\\d+)?)\\s?%");
    private static final Pattern CREDITS_ONLY = p("\\bno\\s+credits?\\b|\\bsole\\s+(?:and\\s+exclusive\\s+)?remedy\\b[^.]{0,60}?\\bcredits?\\b"
            + "|\\bservice\\s+credits?\\b[^.]{0,60}?\\bsole\\b|\\bnot\\s+liable\\b[^.]{0,40}?\\bdowntime\\b");
    private static final Pattern FORCE_MAJEURE = p("\\bforce\\s+majeure\\b|\\bacts?\\s+of\\s+god\\b|\\bbeyond\\b[^.]{0,30}?\\b(?:reasonable\\s+)?control\\b");
    private static final Pattern AGE = p("\\b\\d{1,2}\\s*years?\\s+(?:of\\s+age|old)\\b|\\bmust\\s+be\\s+(?:at\\s+least\\s+)?\\d{1,2}\\b|\\bage\\s+requirements?\\b|\\bminors?\\b|\\bminimum\\s+age\\b");
    private static final Pattern MINIMUM_AGE = p("\\b(\\d{1,2})\\s*years?\\s+(?:of\\s+age|old)\\b|\\bmust\\s+be\\s+(?:at\\s+least\\s+)?(\\d{1,2})\\b|\\bminimum\\s+age\\s+(?:of\\s+|is\\s+)?(\\d{1,2})\\b");

    private KeyPointDetectors() {
        // Static detector functions only
    }

    public static Optional<KeyPoint> paymentBilling(String text, DocumentType type) {
        if (!has(text, PAYMENT)) {
            return Optional.empty();
        }
        List<String> parts = new ArrayList<>();
        if (has(text, AUTO_CHARGE)) {
            parts.add("Payments may be charged automatically.");
        }
        if (has(text, PRICE_CHANGE)) {
            parts.add("Prices can change, so check for notice requirements.");
        }
        if (has(text, LATE_FEE)) {
            parts.add("Late payment fees or penalties may apply.");
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        valueNear(text, PAYMENT, CURRENCY).ifPresent(m -> attributes.put("amount", m.group().trim()));
        String detail = parts.isEmpty() ? "Document includes payment or billing terms." : String.join(" ", parts);
        return keyPoint(KeyPointCategory.PAYMENT_BILLING, "Payment Terms", detail, !parts.isEmpty(),
                text, List.of(PAYMENT), attributes);
    }

    public static Optional<KeyPoint> autoRenewal(String text, DocumentType type) {
        if (!has(text, RENEWAL)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        valueNear(text, RENEWAL, NOTICE_PERIOD).ifPresent(m -> attributes.put("noticePeriod", period(m)));
        String detail = "Your subscription may renew automatically. Check how far in advance you must cancel.";
        if (attributes.containsKey("noticePeriod")) {
            detail += " Notice of " + attributes.get("noticePeriod") + " appears to be required.";
        }
        return keyPoint(KeyPointCategory.AUTO_RENEWAL, "Automatic Renewal", detail, true,
                text, List.of(RENEWAL), attributes);
    }

    public static Optional<KeyPoint> cancellation(String text, DocumentType type) {
        if (!has(text, CANCEL)) {
            return Optional.empty();
        }
        String detail;
        boolean watchOut = false;
        if (has(text, NO_REFUND)) {
            detail = "Cancellations may not entitle you to a refund.";
            watchOut = true;
        } else if (has(text, CANCEL_ANY_TIME)) {
            detail = "You can cancel at any time, but verify whether unused periods are refunded.";
        } else if (has(text, CANCEL_NOTICE)) {
            detail = "A notice period may be required before cancellation takes effect.";
            watchOut = true;
        } else {
            detail = "Cancellation terms are defined in this document.";
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        valueNear(text, CANCEL, NOTICE_PERIOD).ifPresent(m -> attributes.put("noticePeriod", period(m)));
        return keyPoint(KeyPointCategory.CANCELLATION, "Cancellation Policy", detail, watchOut,
                text, List.of(CANCEL), attributes);
    }

    public static Optional<KeyPoint> refunds(String text, DocumentType type) {
        if (!has(text, REFUND)) {
            return Optional.empty();
        }
        if (has(text, NO_REFUND)) {
            return keyPoint(KeyPointCategory.REFUNDS, "Refund Policy",
                    "No refunds are available and all purchases are final.", true,
                    text, List.of(REFUND, NO_REFUND), Map.of("refundable", "false"));
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        valueNear(text, REFUND, DAY_WINDOW).ifPresent(m -> attributes.put("refundWindowDays", m.group(1)));
        String detail = attributes.containsKey("refundWindowDays")
                ? "A " + attributes.get("refundWindowDays") + "-day refund window is offered. Verify the conditions."
                : "Refund terms are addressed.";
        return keyPoint(KeyPointCategory.REFUNDS, "Refund Policy", detail, false,
                text, List.of(REFUND), attributes);
    }

    public static Optional<KeyPoint> privacyData(String text, DocumentType type) {
        if (!has(text, PERSONAL_DATA)) {
            return Optional.empty();
        }
        List<Pattern> evidence = List.of(PERSONAL_DATA, DATA_SHARING);
        if (has(text, DATA_SALE)) {
            return keyPoint(KeyPointCategory.PRIVACY_DATA, "Data & Privacy",
                    "Your personal data may be sold to third parties.", true,
                    text, evidence, Map.of("dataSharing", "sale"));
        }
        if (has(text, DATA_SHARING)) {
            return keyPoint(KeyPointCategory.PRIVACY_DATA, "Data & Privacy",
                    "Your data may be shared with third parties. Check which ones and why.", true,
                    text, evidence, Map.of("dataSharing", "third-party"));
        }
        String detail = has(text, PRIVACY_LAW)
                ? "GDPR or CCPA compliant data handling is referenced."
                : "The document describes how your personal data is handled.";
        return keyPoint(KeyPointCategory.PRIVACY_DATA, "Data & Privacy", detail, false, text, evidence, Map.of());
    }

    public static Optional<KeyPoint> cookiesTracking(String text, DocumentType type) {
        if (!has(text, COOKIES)) {
            return Optional.empty();
        }
        boolean advertising = has(text, AD_COOKIES);
        String detail = advertising
                ? "Third-party and advertising cookies may be placed on your device."
                : "Cookies and tracking technologies are used.";
        return keyPoint(KeyPointCategory.COOKIES_TRACKING, "Cookies & Tracking", detail, advertising,
                text, List.of(COOKIES), Map.of());
    }

    public static Optional<KeyPoint> liability(String text, DocumentType type) {
        if (!has(text, LIABILITY)) {
            return Optional.empty();
        }
        String detail;
        boolean watchOut = false;
        if (has(text, UNLIMITED_LIABILITY)) {
            detail = "You may be exposed to unlimited financial liability.";
            watchOut = true;
        } else if (has(text, LIMITED_LIABILITY)) {
            detail = "The provider limits its own liability, so you may have limited recourse for damages.";
            watchOut = true;
        } else {
            detail = "The document includes liability clauses.";
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        if (has(text, INDEMNIFY)) {
            detail += " You may be required to indemnify the provider against third-party claims.";
            watchOut = true;
            attributes.put("indemnification", "true");
        }
        return keyPoint(KeyPointCategory.LIABILITY, "Liability & Indemnification", detail, watchOut,
                text, List.of(LIABILITY), attributes);
    }

    public static Optional<KeyPoint> disputeResolution(String text, DocumentType type) {
        if (!has(text, DISPUTE)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        String detail = "Dispute resolution procedures are outlined.";
        boolean watchOut = false;
        Matcher arbitration = FORCED_ARBITRATION.matcher(text);
        if (arbitration.find()) {
            String kind = firstGroup(arbitration).toLowerCase(Locale.ROOT);
            attributes.put("arbitration", kind);
            detail = "Disputes must go to " + ("required".equals(kind) ? "mandatory" : kind)
                    + " arbitration, so you may not be able to sue in court.";
            watchOut = true;
        }
        if (has(text, CLASS_WAIVER)) {
            attributes.put("classActionWaiver", "true");
            detail += " Class action lawsuits are waived.";
            watchOut = true;
        }
        if (has(text, JURY_WAIVER)) {
            attributes.put("juryWaiver", "true");
            detail += " You give up the right to a jury trial.";
            watchOut = true;
        }
        return keyPoint(KeyPointCategory.DISPUTE_RESOLUTION, "Disputes & Arbitration", detail, watchOut,
                text, List.of(DISPUTE), attributes);
    }

    public static Optional<KeyPoint> intellectualProperty(String text, DocumentType type) {
        if (!has(text, IP)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        String detail;
        boolean watchOut;
        if (type == DocumentType.EMPLOYMENT && has(text, IP_ASSIGNMENT)) {
            attributes.put("assignment", "true");
            detail = "Inventions and work product you create may belong to the employer.";
            watchOut = true;
        } else if (has(text, BROAD_LICENSE)) {
            detail = "You grant the platform a broad license to use your content.";
            watchOut = true;
        } else {
            detail = "Intellectual property ownership is addressed.";
            watchOut = false;
        }
        return keyPoint(KeyPointCategory.INTELLECTUAL_PROPERTY, "Content & IP Rights", detail, watchOut,
                text, List.of(IP, BROAD_LICENSE), attributes);
    }

    public static Optional<KeyPoint> accountTermination(String text, DocumentType type) {
        if (!has(text, ACCOUNT_TERMINATION)) {
            return Optional.empty();
        }
        boolean withoutNotice = has(text, WITHOUT_NOTICE) && has(text, TERMINATE);
        String detail = withoutNotice
                ? "Your account may be terminated without prior notice at the provider's discretion."
                : "The provider can terminate or suspend accounts under defined conditions.";
        return keyPoint(KeyPointCategory.ACCOUNT_TERMINATION, "Account Suspension / Termination", detail,
                withoutNotice, text, List.of(ACCOUNT_TERMINATION), Map.of());
    }

    public static Optional<KeyPoint> termsChanges(String text, DocumentType type) {
        if (!has(text, TERMS_CHANGE)) {
            return Optional.empty();
        }
        boolean unannounced = has(text, WITHOUT_NOTICE) || has(text, CHANGE_ANY_TIME);
        String detail = unannounced
                ? "Terms can be changed at any time without notice, and continued use implies acceptance."
                : "The provider can update these terms over time.";
        return keyPoint(KeyPointCategory.TERMS_CHANGES, "Right to Modify Terms", detail, unannounced,
                text, List.of(TERMS_CHANGE), Map.of());
    }

    public static Optional<KeyPoint> governingLaw(String text, DocumentType type) {
        if (!has(text, GOVERNING_LAW)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        Matcher jurisdiction = JURISDICTION.matcher(text);
        if (jurisdiction.find()) {
            attributes.put("jurisdiction", jurisdiction.group(1));
        }
        String place = attributes.getOrDefault("jurisdiction", "a specific jurisdiction");
        return keyPoint(KeyPointCategory.GOVERNING_LAW, "Applicable Law & Jurisdiction",
                "This agreement is governed by the laws of " + place + ". Disputes may need to be resolved there.",
                false, text, List.of(GOVERNING_LAW, JURISDICTION), attributes);
    }

    public static Optional<KeyPoint> nonCompete(String text, DocumentType type) {
        if (!has(text, NON_COMPETE)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        String detail = "A non-compete or non-solicitation clause is present, so you may be restricted from working for competitors.";
        Optional<MatchResult> period = valueNear(text, NON_COMPETE, RESTRICTION_PERIOD);
        if (period.isPresent()) {
            String value = period.get().group(1).toLowerCase(Locale.ROOT) + " " + period.get().group(2).toLowerCase(Locale.ROOT);
            attributes.put("restrictionPeriod", value);
            detail += " The restriction period appears to be " + value + ".";
        }
        return keyPoint(KeyPointCategory.NON_COMPETE, "Non-Compete Clause", detail, true,
                text, List.of(NON_COMPETE), attributes);
    }

    public static Optional<KeyPoint> defaultConsequences(String text, DocumentType type) {
        if (!has(text, DEFAULT)) {
            return Optional.empty();
        }
        List<String> remedies = new ArrayList<>();
        if (has(text, ACCELERATION)) {
            remedies.add("acceleration");
        }
        if (has(text, FORECLOSURE)) {
            remedies.add("foreclosure");
        }
        if (has(text, REPOSSESSION)) {
            remedies.add("repossession");
        }
        if (has(text, EVICTION)) {
            remedies.add("eviction");
        }
        if (has(text, GARNISHMENT)) {
            remedies.add("wage garnishment");
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        if (!remedies.isEmpty()) {
            attributes.put("remedies", String.join(", ", remedies));
        }
        String detail;
        if (type == DocumentType.LEASE) {
            detail = "The document outlines what happens if you breach the lease, which may include eviction and loss of your deposit.";
        } else if (type == DocumentType.MORTGAGE) {
            detail = "The document outlines consequences for default, which may include acceleration of the loan and foreclosure on your property.";
        } else {
            detail = "The document outlines consequences for default, which may include acceleration of full repayment, asset seizure, or foreclosure.";
        }
        return keyPoint(KeyPointCategory.DEFAULT_CONSEQUENCES, "Default Provisions", detail, true,
                text, List.of(DEFAULT), attributes);
    }

    public static Optional<KeyPoint> healthData(String text, DocumentType type) {
        if (!has(text, HEALTH)) {
            return Optional.empty();
        }
        boolean shared = has(text, HEALTH_SHARING);
        String detail = shared
                ? "Your health data may be shared with third parties. Verify the scope and purpose."
                : "Health data is involved. HIPAA or equivalent protections may apply.";
        return keyPoint(KeyPointCategory.HEALTH_DATA, "Health & Medical Data", detail, shared,
                text, List.of(HEALTH), Map.of());
    }

    public static Optional<KeyPoint> networkRoaming(String text, DocumentType type) {
        if (!has(text, NETWORK)) {
            return Optional.empty();
        }
        String detail = "Network usage policies are defined.";
        boolean watchOut = false;
        if (has(text, THROTTLING)) {
            detail = "Your data speeds may be throttled after exceeding a usage threshold.";
            watchOut = true;
        }
        if (has(text, ROAMING)) {
            detail += " Roaming charges may apply outside your home network.";
            watchOut = true;
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        Matcher cap = DATA_CAP.matcher(text);
        if (cap.find()) {
            attributes.put("dataCap", cap.group(1) + " " + cap.group(2).toUpperCase(Locale.ROOT));
        }
        return keyPoint(KeyPointCategory.NETWORK_ROAMING, "Data Limits & Roaming", detail, watchOut,
                text, List.of(NETWORK), attributes);
    }

    public static Optional<KeyPoint> securityDeposit(String text, DocumentType type) {
        if (!has(text, DEPOSIT)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        valueNear(text, DEPOSIT, CURRENCY).ifPresent(m -> attributes.put("amount", m.group().trim()));
        return keyPoint(KeyPointCategory.SECURITY_DEPOSIT, "Security Deposit",
                "A security deposit is required. Review the conditions under which it can be withheld or deducted.",
                true, text, List.of(DEPOSIT), attributes);
    }

    public static Optional<KeyPoint> forceMajeure(String text, DocumentType type) {
        if (!has(text, FORCE_MAJEURE)) {
            return Optional.empty();
        }
        return keyPoint(KeyPointCategory.FORCE_MAJEURE, "Force Majeure",
                "A force majeure clause limits the provider's obligations during extraordinary events such as natural disasters or pandemics.",
                false, text, List.of(FORCE_MAJEURE), Map.of());
    }

    public static Optional<KeyPoint> serviceLevel(String text, DocumentType type) {
        if (!has(text, SLA)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        valueNear(text, SLA, UPTIME_PERCENT).ifPresent(m -> attributes.put("uptimePercent", m.group(1)));
        boolean creditsOnly = has(text, CREDITS_ONLY);
        String detail = attributes.containsKey("uptimePercent")
                ? "An SLA guarantees " + attributes.get("uptimePercent") + "% uptime."
                : "An SLA defines the expected service availability.";
        if (creditsOnly) {
            detail += " However, compensation for downtime may be limited to service credits only.";
        }
        return keyPoint(KeyPointCategory.SERVICE_LEVEL, "Uptime & SLA Guarantee", detail, creditsOnly,
                text, List.of(SLA), attributes);
    }

    public static Optional<KeyPoint> ageRestriction(String text, DocumentType type) {
        if (!has(text, AGE)) {
            return Optional.empty();
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        Matcher age = MINIMUM_AGE.matcher(text);
        if (age.find()) {
            attributes.put("minimumAge", firstGroup(age));
        }
        String detail = attributes.containsKey("minimumAge")
                ? "Users must be at least " + attributes.get("minimumAge") + " years old. Parental consent may be required for minors."
                : "An age requirement applies. Parental consent may be required for minors.";
        return keyPoint(KeyPointCategory.AGE_RESTRICTION, "Age Requirement", detail, false,
                text, List.of(AGE), attributes);
    }

    private static Optional<KeyPoint> keyPoint(KeyPointCategory category, String title, String detail, boolean watchOut,
                                               String text, List<Pattern> evidencePatterns,
                                               Map<String, String> attributes) {
        List<Evidence> evidence = TextSpans.collect(text, evidencePatterns, MAX_EVIDENCE, MAX_MATCHES_PER_PATTERN);
        return Optional.of(new KeyPoint(category, title, detail, watchOut, evidence, attributes));
    }

    private static boolean has(String text, Pattern pattern) {
        return pattern.matcher(text).find();
    }

    /**
     * Searches {@code value} inside the sentences that contain a match of {@code context}.
     */
    private static Optional<MatchResult> valueNear(String text, Pattern context, Pattern value) {
        Matcher contextMatcher = context.matcher(text);
        int seen = 0;
        int lastSentence = -1;
        while (seen < MAX_MATCHES_PER_PATTERN && contextMatcher.find()) {
            seen++;
            Evidence sentence = TextSpans.sentenceAround(text, contextMatcher.start(), contextMatcher.end());
            if (sentence.getOffset() == lastSentence) {
                continue;
            }
            lastSentence = sentence.getOffset();
            Matcher valueMatcher = value.matcher(sentence.getSnippet());
            if (valueMatcher.find()) {
                return Optional.of(valueMatcher.toMatchResult());
            }
        }
        return Optional.empty();
    }

    private static String period(MatchResult match) {
        String amount = match.group(1) != null ? match.group(1) : match.group(3);
        String unit = match.group(2) != null ? match.group(2) : match.group(4);
        return amount + " " + unit.toLowerCase(Locale.ROOT);
    }

    private static String firstGroup(MatchResult match) {
        for (int i = 1; i <= match.groupCount(); i++) {
            if (match.group(i) != null) {
                return match.group(i);
            }
        }
        return match.group();
    }

    private static Pattern p(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
