package com.clausescan.processing;

import com.clausescan.processing.catalog.KeyPointCategory;
import com.clausescan.processing.model.CategoryComparison;
import com.clausescan.processing.model.CellState;
import com.clausescan.processing.model.ComparisonResult;
import com.clausescan.processing.model.ComparisonWinner;
import com.clausescan.processing.model.NamedDocument;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentComparisonServiceTest {

    private static final String BENIGN = "You may request a refund within 14 days of purchase. "
            + "This Agreement is governed by the laws of the State of California.";

    private ExecutorService executor;
    private DocumentComparisonService comparisonService;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        comparisonService = new DocumentComparisonService(AnalysisTestFixtures.analysisService(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testCompare_SaferDocumentWins() {
        ComparisonResult result = comparisonService.compare(
                new NamedDocument("Policy A", AnalysisTestFixtures.INSURANCE_SCENARIO),
                new NamedDocument("Policy B", BENIGN));

        assertThat(result.getSaferDocument()).isEqualTo(ComparisonWinner.RIGHT);
        // 66 * 0.5 + 4 flags * 1.2 + 2 watch-outs * 0.6
        assertThat(result.getLeftCompositeScore()).isEqualTo(39.0);
        assertThat(result.getRightCompositeScore()).isEqualTo(0.0);
        assertThat(result.getRiskScoreDifference()).isEqualTo(66);
        assertThat(result.getVerdict()).startsWith("Policy B is the safer choice");
        assertThat(result.getVerdict()).contains("66/100 and 4 red flag(s) for Policy A");
    }

    @Test
    void testCompare_CategoryRowsInPriorityOrder() {
        ComparisonResult result = comparisonService.compare(
                new NamedDocument("Policy A", AnalysisTestFixtures.INSURANCE_SCENARIO),
                new NamedDocument("Policy B", BENIGN));

        assertThat(result.getCategories()).extracting(CategoryComparison::getCategory).containsExactly(
                KeyPointCategory.DISPUTE_RESOLUTION, KeyPointCategory.REFUNDS,
                KeyPointCategory.TERMS_CHANGES, KeyPointCategory.GOVERNING_LAW);

        CategoryComparison disputes = result.getCategories().get(0);
        assertThat(disputes.getLeft()).isEqualTo(CellState.WARN);
        assertThat(disputes.getRight()).isEqualTo(CellState.MISSING);
        assertThat(disputes.getRightDetail()).isEqualTo("Not mentioned");
        assertThat(disputes.isDifferent()).isTrue();

        CategoryComparison refunds = result.getCategories().get(1);
        assertThat(refunds.getLeft()).isEqualTo(CellState.MISSING);
        assertThat(refunds.getRight()).isEqualTo(CellState.GOOD);
    }

    @Test
    void testCompare_RedFlagDifferences() {
        ComparisonResult result = comparisonService.compare(
                new NamedDocument("Policy A", AnalysisTestFixtures.INSURANCE_SCENARIO),
                new NamedDocument("Terms", "We may sell your personal data to third parties. "
                        + "Binding arbitration applies to all disputes."));

        assertThat(result.getRedFlagsOnlyLeft()).containsExactly("UNILATERAL_MODIFICATION", "RIGHTS_WAIVER");
        assertThat(result.getRedFlagsOnlyRight()).containsExactly("DATA_SALE");
        assertThat(result.getSharedRedFlags()).containsExactly("MANDATORY_ARBITRATION");
    }

    @Test
    void testCompare_IdenticalDocumentsTie() {
        ComparisonResult result = comparisonService.compare(
                new NamedDocument("First", AnalysisTestFixtures.INSURANCE_SCENARIO),
                new NamedDocument("Second", AnalysisTestFixtures.INSURANCE_SCENARIO));

        assertThat(result.getSaferDocument()).isEqualTo(ComparisonWinner.TIE);
        assertThat(result.getRiskScoreDifference()).isZero();
        assertThat(result.getRedFlagsOnlyLeft()).isEmpty();
        assertThat(result.getRedFlagsOnlyRight()).isEmpty();
        assertThat(result.getCategories()).noneMatch(CategoryComparison::isDifferent);
        assertThat(result.getVerdict()).startsWith("Both documents carry a similar level of risk");
    }
}
