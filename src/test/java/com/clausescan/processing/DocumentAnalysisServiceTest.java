package com.clausescan.processing;

import com.clausescan.processing.catalog.ChecklistRule;
import com.clausescan.processing.catalog.DocumentType;
import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.RedFlag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentAnalysisServiceTest {

    private static final String BASELINE = "Read the full document carefully before signing.";

    private final DocumentAnalysisService analysisService = AnalysisTestFixtures.analysisService();

    @Test
    void testAnalyze_InsuranceScenario() {
        AnalysisResult result = analysisService.analyze(AnalysisTestFixtures.INSURANCE_SCENARIO);

        assertThat(result.getDocumentType()).isEqualTo(DocumentType.INSURANCE);
        assertThat(result.getRiskScore()).isPositive();
        assertThat(result.getRedFlags()).extracting(RedFlag::getCategory)
                .contains("UNILATERAL_MODIFICATION", "MANDATORY_ARBITRATION");
        assertThat(result.getChecklist()).anyMatch(item -> item.contains("arbitration"));
        assertThat(result.getSummary()).isEqualTo(DocumentType.INSURANCE.getSummary());
        assertThat(result.getCatalogVersion()).isEqualTo(AnalysisTestFixtures.CATALOG.getVersion());
        assertThat(result.getReadability()).isNotNull();
        assertThat(result.getCharacterCount()).isEqualTo(AnalysisTestFixtures.INSURANCE_SCENARIO.length());
    }

    @Test
    void testAnalyze_EmptyTextFallsBack() {
        AnalysisResult result = analysisService.analyze("");

        assertThat(result.getDocumentType()).isEqualTo(DocumentType.GENERAL);
        assertThat(result.getRiskScore()).isZero();
        assertThat(result.getKeyPoints()).isEmpty();
        assertThat(result.getRedFlags()).isEmpty();
        assertThat(result.getChecklist()).containsExactly(BASELINE);
        assertThat(result.getReadability()).isNull();
    }

    @Test
    void testAnalyze_ShortTextFallsBackEvenWithRiskyWords() {
        // 19 characters after trimming
        AnalysisResult result = analysisService.analyze("  Binding arbitration  ");

        assertThat(result.getDocumentType()).isEqualTo(DocumentType.GENERAL);
        assertThat(result.getRiskScore()).isZero();
        assertThat(result.getRedFlags()).isEmpty();
        assertThat(result.getChecklist()).containsExactly(BASELINE);
        assertThat(analysisService.analyze(null).getChecklist()).containsExactly(BASELINE);
    }

    @Test
    void testAnalyze_RemovingHighWeightClauseLowersRisk() {
        String withClause = AnalysisTestFixtures.INSURANCE_SCENARIO;
        String withoutClause = "This insurance policy's premium may be unilaterally modified by the Insurer at any time "
                + "without notice. You waive your right to a jury trial.";

        AnalysisResult before = analysisService.analyze(withClause);
        AnalysisResult after = analysisService.analyze(withoutClause);

        assertThat(after.getRiskScore()).isLessThan(before.getRiskScore());
        assertThat(after.getRedFlags().size()).isLessThan(before.getRedFlags().size());
    }

    @Test
    void testAnalyze_Deterministic() {
        AnalysisResult first = analysisService.analyze(AnalysisTestFixtures.INSURANCE_SCENARIO);
        AnalysisResult second = analysisService.analyze(AnalysisTestFixtures.INSURANCE_SCENARIO);

        assertThat(second).usingRecursiveComparison().isEqualTo(first);
    }

    @Test
    void testAnalyze_ConcurrentCallsMatchSequentialResult() throws Exception {
        AnalysisResult expected = analysisService.analyze(AnalysisTestFixtures.INSURANCE_SCENARIO);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<AnalysisResult>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(pool.submit(() -> analysisService.analyze(AnalysisTestFixtures.INSURANCE_SCENARIO)));
            }
            for (Future<AnalysisResult> future : futures) {
                assertThat(future.get()).usingRecursiveComparison().isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testAnalyze_ScoreBoundedOnHugeInput() {
        String text = ("Binding arbitration applies. You waive your right to a jury trial. "
                + "We may sell your personal data. ").repeat(2000);

        AnalysisResult result = analysisService.analyze(text);

        assertThat(result.getRiskScore()).isBetween(0, 100);
        assertThat(result.getSummary()).contains("comprehensive");
    }

    @Test
    void testAnalyze_ChecklistItemsAreSound() {
        String text = AnalysisTestFixtures.INSURANCE_SCENARIO + " Your subscription will automatically renew "
                + "unless you cancel with 30 days' notice. You may request a refund within 14 days.";

        AnalysisResult result = analysisService.analyze(text);

        ChecklistService checklist = AnalysisTestFixtures.checklistService();
        for (String item : result.getChecklist()) {
            boolean traced = false;
            for (ChecklistRule rule : AnalysisTestFixtures.CATALOG.getChecklistRules()) {
                if (checklist.evaluate(rule, result.getDocumentType(), result.getRisk(), result.getKeyPoints(),
                        result.getRedFlags()).filter(item::equals).isPresent()) {
                    traced = true;
                    break;
                }
            }
            assertThat(traced).as("checklist item %s", item).isTrue();
        }
    }

    @Test
    void testAnalyze_RedFlagEvidenceIsLiteral() {
        String text = AnalysisTestFixtures.INSURANCE_SCENARIO + " We may sell your personal data to third parties.";

        AnalysisResult result = analysisService.analyze(text);

        assertThat(result.getRedFlags()).isNotEmpty().allSatisfy(flag -> assertThat(
                text.substring(flag.getOffset(), flag.getOffset() + flag.getMatchedText().length()))
                .isEqualTo(flag.getMatchedText()));
    }
}
