package com.clausescan.processing.detect;

import com.clausescan.processing.catalog.KeyPointCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps each {@link KeyPointCategory} to the detector function that handles it.
 * Adding a category means adding a catalog entry and registering one function here.
 */
public class KeyPointDetectorRegistry {

    private final Map<KeyPointCategory, KeyPointDetector> detectors;

    public KeyPointDetectorRegistry(Map<KeyPointCategory, KeyPointDetector> detectors) {
        this.detectors = Collections.unmodifiableMap(new EnumMap<>(detectors));
    }

    /**
     * Registry with the built-in detector for every category.
     */
    public static KeyPointDetectorRegistry standard() {
        Map<KeyPointCategory, KeyPointDetector> detectors = new EnumMap<>(KeyPointCategory.class);
        detectors.put(KeyPointCategory.PRIVACY_DATA, KeyPointDetectors::privacyData);
        detectors.put(KeyPointCategory.DISPUTE_RESOLUTION, KeyPointDetectors::disputeResolution);
        detectors.put(KeyPointCategory.ACCOUNT_TERMINATION, KeyPointDetectors::accountTermination);
        detectors.put(KeyPointCategory.AUTO_RENEWAL, KeyPointDetectors::autoRenewal);
        detectors.put(KeyPointCategory.CANCELLATION, KeyPointDetectors::cancellation);
        detectors.put(KeyPointCategory.REFUNDS, KeyPointDetectors::refunds);
        detectors.put(KeyPointCategory.PAYMENT_BILLING, KeyPointDetectors::paymentBilling);
        detectors.put(KeyPointCategory.LIABILITY, KeyPointDetectors::liability);
        detectors.put(KeyPointCategory.INTELLECTUAL_PROPERTY, KeyPointDetectors::intellectualProperty);
        detectors.put(KeyPointCategory.TERMS_CHANGES, KeyPointDetectors::termsChanges);
        detectors.put(KeyPointCategory.COOKIES_TRACKING, KeyPointDetectors::cookiesTracking);
        detectors.put(KeyPointCategory.NON_COMPETE, KeyPointDetectors::nonCompete);
        detectors.put(KeyPointCategory.HEALTH_DATA, KeyPointDetectors::healthData);
        detectors.put(KeyPointCategory.DEFAULT_CONSEQUENCES, KeyPointDetectors::defaultConsequences);
        detectors.put(KeyPointCategory.SECURITY_DEPOSIT, KeyPointDetectors::securityDeposit);
        detectors.put(KeyPointCategory.NETWORK_ROAMING, KeyPointDetectors::networkRoaming);
        detectors.put(KeyPointCategory.SERVICE_LEVEL, KeyPointDetectors::serviceLevel);
        detectors.put(KeyPointCategory.FORCE_MAJEURE, KeyPointDetectors::forceMajeure);
        detectors.put(KeyPointCategory.AGE_RESTRICTION, KeyPointDetectors::ageRestriction);
        detectors.put(KeyPointCategory.GOVERNING_LAW, KeyPointDetectors::governingLaw);
        return new KeyPointDetectorRegistry(detectors);
    }

    public Optional<KeyPointDetector> find(KeyPointCategory category) {
        return Optional.ofNullable(detectors.get(category));
    }

    public Set<KeyPointCategory> getCategories() {
        return detectors.keySet();
    }
}
