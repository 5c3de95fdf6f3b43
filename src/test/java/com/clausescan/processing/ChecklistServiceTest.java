package com.clausescan.processing;

import com.clausescan.processing.catalog.ChecklistRule;
import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.catalog.KeyPointCategory;
import com.clausescan.processing.catalog.Severity;
import com.clausescan.processing.model.Evidence;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.RedFlag;
import com.clausescan.processing.model.RiskAssessment;
import com.clausescan.processing.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChecklistServiceTest {

    private static final String BASELINE = "Read the full document carefully before signing.";
    private static final String HIGH_RISK =
            "Given the high risk score and serious red flags, consider having a legal professional review this document.";

    private final ChecklistService checklist = AnalysisTestFixtures.checklistService();

    @Test
    void testBuild_InsuranceScenario() {
        String text = AnalysisTestFixtures.INSURANCE_SCENARIO;
        RiskAssessment risk = AnalysisTestFixtures.riskScorer().score(text);
        List<KeyPoint> keyPoints = AnalysisTestFixtures.keyPointExtractor().extract(text, DocumentType.INSURANCE);
        List<RedFlag> redFlags = AnalysisTestFixtures.redFlagDetector().detect(text);

        List<String> items = checklist.build(DocumentType.INSURANCE, risk, keyPoints, redFlags);

        assertThat(items).containsExactly(
                BASELINE,
                "Understand that mandatory arbitration means you likely give up your right to sue in court.",
                "Ask the insurer how and when premiums or coverage can be changed.",
                "Ask how you will be told about changes or termination, since notice is not guaranteed.",
                "Identify each legal right you are asked to waive before signing.",
                HIGH_RISK);
    }

    @Test
    void testBuild_NoFindingsYieldsBaselineOnly() {
        List<String> items = checklist.build(DocumentType.GENERAL, RiskAssessment.none(), List.of(), List.of());

        assertThat(items).containsExactly(BASELINE);
        assertThat(checklist.baseline()).isEqualTo(items);
    }

    @Test
    void testBuild_FillsPlaceholderFromKeyPointAttributes() {
        KeyPoint renewal = keyPoint(KeyPointCategory.AUTO_RENEWAL, Map.of("noticePeriod", "30 days"));

        List<String> items = checklist.build(DocumentType.SUBSCRIPTION, RiskAssessment.none(), List.of(renewal), List.of());

        assertThat(items).contains(
                "Confirm the auto-renewal date and how to cancel before it triggers.",
                "Diary the 30 days notice you must give to stop an automatic renewal.");
        assertThat(items).noneMatch(item -> item.contains("{"));
    }

    @Test
    void testBuild_MissingAttributeSkipsPlaceholderRule() {
        KeyPoint renewal = keyPoint(KeyPointCategory.AUTO_RENEWAL, Map.of());

        List<String> items = checklist.build(DocumentType.SUBSCRIPTION, RiskAssessment.none(), List.of(renewal), List.of());

        assertThat(items).containsExactly(BASELINE,
                "Confirm the auto-renewal date and how to cancel before it triggers.");
    }

    @Test
    void testBuild_DocumentTypeFilter() {
        RedFlag modification = redFlag("UNILATERAL_MODIFICATION");

        List<String> general = checklist.build(DocumentType.GENERAL, RiskAssessment.none(), List.of(), List.of(modification));
        List<String> insurance = checklist.build(DocumentType.INSURANCE, RiskAssessment.none(), List.of(), List.of(modification));

        assertThat(general).doesNotContain("Ask the insurer how and when premiums or coverage can be changed.");
        assertThat(insurance).contains("Ask the insurer how and when premiums or coverage can be changed.");
    }

    @Test
    void testBuild_RiskScoreAloneAddsNothing() {
        // Given: risky wording that produces no key point or red flag
        String text = "This appointment is irrevocable for the term. "
                + "The goods are sold as-is and the seller disclaims all warranties.";
        RiskAssessment risk = AnalysisTestFixtures.riskScorer().score(text);
        List<KeyPoint> keyPoints = AnalysisTestFixtures.keyPointExtractor().extract(text, DocumentType.GENERAL);
        List<RedFlag> redFlags = AnalysisTestFixtures.redFlagDetector().detect(text);

        // When
        List<String> items = checklist.build(DocumentType.GENERAL, risk, keyPoints, redFlags);

        // Then
        assertThat(risk.getScore()).isEqualTo(36);
        assertThat(keyPoints).isEmpty();
        assertThat(redFlags).isEmpty();
        assertThat(items).containsExactly(BASELINE);
    }

    @Test
    void testBuild_NoFindingsYieldsBaselineAtAnyRiskScore() {
        for (int score = 0; score <= 100; score += 10) {
            RiskAssessment risk = new RiskAssessment(score, score, 1, RiskLevel.forScore(score), List.of());

            List<String> items = checklist.build(DocumentType.INSURANCE, risk, List.of(), List.of());

            assertThat(items).as("score %d", score).containsExactly(BASELINE);
        }
    }

    @Test
    void testBuild_HighRiskNeedsSeriousRedFlagAndHighScore() {
        RedFlag serious = redFlag("MANDATORY_ARBITRATION");
        RedFlag minor = new RedFlag("SOLE_DISCRETION", "description", Severity.LOW, "clause", 0, "clause");
        RiskAssessment medium = AnalysisTestFixtures.riskScorer().score("All disputes are subject to binding arbitration.");
        RiskAssessment high = new RiskAssessment(80, 97, 7, RiskLevel.HIGH, List.of());

        // score 22 is below the high-risk threshold of 50
        assertThat(medium.getScore()).isEqualTo(22);
        assertThat(checklist.build(DocumentType.GENERAL, medium, List.of(), List.of(serious))).doesNotContain(HIGH_RISK);
        assertThat(checklist.build(DocumentType.GENERAL, high, List.of(), List.of(minor))).doesNotContain(HIGH_RISK);
        assertThat(checklist.build(DocumentType.GENERAL, high, List.of(), List.of(serious))).contains(HIGH_RISK);
    }

    @Test
    void testBuild_ClassActionWaiverAloneDoesNotClaimArbitration() {
        RedFlag waiver = redFlag("CLASS_ACTION_WAIVER");

        List<String> items = checklist.build(DocumentType.GENERAL, RiskAssessment.none(), List.of(), List.of(waiver));

        assertThat(items).containsExactly(BASELINE,
                "Note that you give up the right to join a class action, so any claim must be brought on your own.");
        assertThat(items).noneMatch(item -> item.contains("arbitration"));
    }

    @Test
    void testBuild_EveryItemTracesToSatisfiedRule() {
        String text = AnalysisTestFixtures.INSURANCE_SCENARIO
                + " We may sell your personal data to third parties. You must be at least 13 years old.";
        RiskAssessment risk = AnalysisTestFixtures.riskScorer().score(text);
        List<KeyPoint> keyPoints = AnalysisTestFixtures.keyPointExtractor().extract(text, DocumentType.INSURANCE);
        List<RedFlag> redFlags = AnalysisTestFixtures.redFlagDetector().detect(text);

        List<String> items = checklist.build(DocumentType.INSURANCE, risk, keyPoints, redFlags);

        for (String item : items) {
            boolean traced = AnalysisTestFixtures.CATALOG.getChecklistRules().stream()
                    .filter(rule -> checklist.isSatisfied(rule, DocumentType.INSURANCE, risk, keyPoints, redFlags))
                    .map(rule -> checklist.evaluate(rule, DocumentType.INSURANCE, risk, keyPoints, redFlags))
                    .anyMatch(rendered -> rendered.isPresent() && rendered.get().equals(item));
            assertThat(traced).as("item traces to a satisfied rule: %s", item).isTrue();
        }
        assertThat(items).doesNotHaveDuplicates();
    }

    @Test
    void testIsSatisfied_BaselineAlwaysHolds() {
        ChecklistRule baseline = AnalysisTestFixtures.CATALOG.getBaselineRules().get(0);

        assertThat(checklist.isSatisfied(baseline, DocumentType.GENERAL, null, List.of(), List.of())).isTrue();
    }

    private static KeyPoint keyPoint(KeyPointCategory category, Map<String, String> attributes) {
        return new KeyPoint(category, category.getLabel(), "detail", true, List.of(new Evidence("clause", 0)), attributes);
    }

    private static RedFlag redFlag(String category) {
        return new RedFlag(category, "description", Severity.HIGH, "clause", 0, "clause");
    }
}
