package com.clausescan.processing.detect;

import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.KeyPointCategory;
import com.clausescan.processing.model.Evidence;
import com.clausescan.processing.model.KeyPoint;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class KeyPointDetectorsTest {

    @Test
    void testAutoRenewal_ExtractsNoticePeriod() {
        String text = "Your subscription will automatically renew each year unless you cancel with 30 days' notice.";

        KeyPoint keyPoint = KeyPointDetectors.autoRenewal(text, DocumentType.SUBSCRIPTION).orElseThrow();

        assertThat(keyPoint.getCategory()).isEqualTo(KeyPointCategory.AUTO_RENEWAL);
        assertThat(keyPoint.isWatchOut()).isTrue();
        assertThat(keyPoint.getAttributes()).containsEntry("noticePeriod", "30 days");
        assertThat(keyPoint.getDetail()).contains("30 days");
    }

    @Test
    void testRefunds_ExtractsWindow() {
        KeyPoint keyPoint = KeyPointDetectors.refunds("You may request a refund within 14 days of purchase.",
                DocumentType.ECOMMERCE).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("refundWindowDays", "14");
        assertThat(keyPoint.isWatchOut()).isFalse();
    }

    @Test
    void testRefunds_NoRefundsIsWatchOut() {
        KeyPoint keyPoint = KeyPointDetectors.refunds("All sales are final and no refunds will be issued.",
                DocumentType.ECOMMERCE).orElseThrow();

        assertThat(keyPoint.isWatchOut()).isTrue();
        assertThat(keyPoint.getAttributes()).containsEntry("refundable", "false");
    }

    @Test
    void testGoverningLaw_ExtractsJurisdiction() {
        KeyPoint keyPoint = KeyPointDetectors.governingLaw(
                "This Agreement is governed by the laws of the State of California.", DocumentType.GENERAL).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("jurisdiction", "California");
        assertThat(keyPoint.getDetail()).contains("California");
    }

    @Test
    void testNonCompete_ExtractsRestrictionPeriod() {
        KeyPoint keyPoint = KeyPointDetectors.nonCompete(
                "Employee agrees to a non-compete covenant for a period of twelve (12) months after termination.",
                DocumentType.EMPLOYMENT).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("restrictionPeriod", "twelve months");
        assertThat(keyPoint.isWatchOut()).isTrue();
    }

    @Test
    void testServiceLevel_ExtractsUptimeAndFlagsCreditsOnly() {
        KeyPoint keyPoint = KeyPointDetectors.serviceLevel("The service level agreement guarantees 99.9% uptime. "
                + "Service credits are your sole and exclusive remedy.", DocumentType.CLOUD_SERVICES).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("uptimePercent", "99.9");
        assertThat(keyPoint.isWatchOut()).isTrue();
        assertThat(keyPoint.getDetail()).contains("service credits only");
    }

    @Test
    void testNetworkRoaming_ExtractsDataCap() {
        KeyPoint keyPoint = KeyPointDetectors.networkRoaming("Your plan includes a 10 GB data cap, after which speeds "
                + "are throttled. Roaming charges apply abroad.", DocumentType.TELECOM).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("dataCap", "10 GB");
        assertThat(keyPoint.isWatchOut()).isTrue();
        assertThat(keyPoint.getDetail()).contains("throttled").contains("Roaming");
    }

    @Test
    void testAgeRestriction_ExtractsMinimumAge() {
        KeyPoint keyPoint = KeyPointDetectors.ageRestriction("You must be at least 13 years old to use the service.",
                DocumentType.SOCIAL_MEDIA).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("minimumAge", "13");
    }

    @Test
    void testLiability_IndemnificationIsWatchOut() {
        KeyPoint keyPoint = KeyPointDetectors.liability("You agree to indemnify the Company. "
                + "The Company shall not be liable for indirect damages.", DocumentType.SAAS).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("indemnification", "true");
        assertThat(keyPoint.isWatchOut()).isTrue();
        assertThat(keyPoint.getEvidence()).hasSize(2);
    }

    @Test
    void testDisputeResolution_BindingArbitrationAndClassWaiver() {
        KeyPoint keyPoint = KeyPointDetectors.disputeResolution("All disputes shall be resolved by binding arbitration. "
                + "You waive any right to participate in a class action.", DocumentType.GENERAL).orElseThrow();

        assertThat(keyPoint.getAttributes())
                .containsEntry("arbitration", "binding")
                .containsEntry("classActionWaiver", "true")
                .doesNotContainKey("juryWaiver");
        assertThat(keyPoint.isWatchOut()).isTrue();
    }

    @Test
    void testPrivacyData_DataSale() {
        KeyPoint keyPoint = KeyPointDetectors.privacyData("We may sell your personal information to advertisers.",
                DocumentType.PRIVACY_POLICY).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("dataSharing", "sale");
        assertThat(keyPoint.isWatchOut()).isTrue();
    }

    @Test
    void testDefaultConsequences_ListsRemediesByType() {
        String text = "Upon default, the lender may accelerate the loan and begin foreclosure.";

        KeyPoint keyPoint = KeyPointDetectors.defaultConsequences(text, DocumentType.MORTGAGE).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("remedies", "acceleration, foreclosure");
        assertThat(keyPoint.getDetail()).contains("foreclosure on your property");
    }

    @Test
    void testSecurityDeposit_ExtractsAmount() {
        KeyPoint keyPoint = KeyPointDetectors.securityDeposit(
                "The Tenant shall pay a security deposit of $1,500 at signing.", DocumentType.LEASE).orElseThrow();

        assertThat(keyPoint.getAttributes()).containsEntry("amount", "$1,500");
    }

    @Test
    void testCookiesTracking_AdvertisingCookies() {
        KeyPoint keyPoint = KeyPointDetectors.cookiesTracking(
                "We use cookies. Advertising partners may place cookies on your device.", DocumentType.WEBSITE_TERMS)
                .orElseThrow();

        assertThat(keyPoint.isWatchOut()).isTrue();
        assertThat(keyPoint.getEvidence()).extracting(Evidence::getSnippet)
                .containsExactly("We use cookies.", "Advertising partners may place cookies on your device.");
    }

    @Test
    void testDetectors_AbsentClauseIsEmpty() {
        String text = "The weather is nice today and the sun is shining brightly.";

        assertThat(KeyPointDetectors.autoRenewal(text, DocumentType.GENERAL)).isEmpty();
        assertThat(KeyPointDetectors.disputeResolution(text, DocumentType.GENERAL)).isEmpty();
        assertThat(KeyPointDetectors.securityDeposit(text, DocumentType.GENERAL)).isEmpty();
        assertThat(KeyPointDetectors.forceMajeure(text, DocumentType.GENERAL)).isEmpty();
    }

    @Test
    void testEvidence_BoundedAndLiteral() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            builder.append("Clause ").append(i).append(" mentions arbitration. ");
        }
        String text = builder.toString();

        Optional<KeyPoint> keyPoint = KeyPointDetectors.disputeResolution(text, DocumentType.GENERAL);

        assertThat(keyPoint).isPresent();
        assertThat(keyPoint.get().getEvidence()).hasSize(KeyPointDetectors.MAX_EVIDENCE);
        for (Evidence evidence : keyPoint.get().getEvidence()) {
            assertThat(text.substring(evidence.getOffset(), evidence.getEnd())).isEqualTo(evidence.getSnippet());
        }
    }

    @Test
    void testRegistry_CoversEveryCategory() {
        KeyPointDetectorRegistry registry = KeyPointDetectorRegistry.standard();

        assertThat(registry.getCategories()).containsExactlyInAnyOrder(KeyPointCategory.values());
    }
}
