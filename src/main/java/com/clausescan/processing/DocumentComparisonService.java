package com.clausescan.processing;

import com.clausescan.processing.catalog.KeyPointCategory;
import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.CategoryComparison;
import com.clausescan.processing.model.CellState;
import com.clausescan.processing.model.ComparisonResult;
import com.clausescan.processing.model.ComparisonWinner;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.NamedDocument;
import com.clausescan.processing.model.RedFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Analyzes two documents in parallel and diffs their findings.
 */
@Service
public class DocumentComparisonService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentComparisonService.class);

    private final DocumentAnalysisService analysisService;
    private final Executor executor;

    public DocumentComparisonService(DocumentAnalysisService analysisService,
                                     @Qualifier("analysisExecutor") Executor executor) {
        this.analysisService = analysisService;
        this.executor = executor;
    }

    public ComparisonResult compare(NamedDocument left, NamedDocument right) {
        CompletableFuture<AnalysisResult> leftFuture =
                CompletableFuture.supplyAsync(() -> analysisService.analyze(left.getText()), executor);
        CompletableFuture<AnalysisResult> rightFuture =
                CompletableFuture.supplyAsync(() -> analysisService.analyze(right.getText()), executor);
        return compare(left.getName(), AnalysisFutures.await(leftFuture), right.getName(), AnalysisFutures.await(rightFuture));
    }

    /**
     * Diffs two results that were already analyzed.
     */
    public ComparisonResult compare(String leftName, AnalysisResult left, String rightName, AnalysisResult right) {
        List<CategoryComparison> categories = new ArrayList<>();
        Set<KeyPointCategory> present = EnumSet.noneOf(KeyPointCategory.class);
        left.getKeyPoints().forEach(kp -> present.add(kp.getCategory()));
        right.getKeyPoints().forEach(kp -> present.add(kp.getCategory()));
        for (KeyPointCategory category : present) {
            KeyPoint l = left.findKeyPoint(category).orElse(null);
            KeyPoint r = right.findKeyPoint(category).orElse(null);
            categories.add(new CategoryComparison(category, CellState.of(l), CellState.of(r),
                    l != null ? CompositeScores.detail(l.getDetail()) : "Not mentioned",
                    r != null ? CompositeScores.detail(r.getDetail()) : "Not mentioned"));
        }

        Set<String> leftFlags = flagCategories(left);
        Set<String> rightFlags = flagCategories(right);
        List<String> onlyLeft = new ArrayList<>(leftFlags);
        onlyLeft.removeAll(rightFlags);
        List<String> onlyRight = new ArrayList<>(rightFlags);
        onlyRight.removeAll(leftFlags);
        List<String> shared = new ArrayList<>(leftFlags);
        shared.retainAll(rightFlags);

        double leftScore = CompositeScores.of(left);
        double rightScore = CompositeScores.of(right);
        ComparisonWinner winner = leftScore < rightScore ? ComparisonWinner.LEFT
                : rightScore < leftScore ? ComparisonWinner.RIGHT : ComparisonWinner.TIE;

        String verdict = verdict(winner, leftName, left, rightName, right, leftScore);
        logger.debug("Compared '{}' ({}) with '{}' ({}): {}", leftName, leftScore, rightName, rightScore, winner);
        return new ComparisonResult(leftName, rightName, left, right, leftScore, rightScore, categories,
                onlyLeft, onlyRight, shared, winner, verdict);
    }

    private static Set<String> flagCategories(AnalysisResult result) {
        Set<String> categories = new LinkedHashSet<>();
        for (RedFlag flag : result.getRedFlags()) {
            categories.add(flag.getCategory());
        }
        return categories;
    }

    private static String verdict(ComparisonWinner winner, String leftName, AnalysisResult left,
                                  String rightName, AnalysisResult right, double tiedScore) {
        if (winner == ComparisonWinner.TIE) {
            return String.format("Both documents carry a similar level of risk (composite score %.1f). "
                    + "Compare the individual clauses before choosing.", tiedScore);
        }
        boolean leftSafer = winner == ComparisonWinner.LEFT;
        String saferName = leftSafer ? leftName : rightName;
        String riskierName = leftSafer ? rightName : leftName;
        AnalysisResult safer = leftSafer ? left : right;
        AnalysisResult riskier = leftSafer ? right : left;
        return String.format("%s is the safer choice, with a risk score of %d/100 and %d red flag(s) "
                        + "against %d/100 and %d red flag(s) for %s.",
                saferName, safer.getRiskScore(), safer.getRedFlags().size(),
                riskier.getRiskScore(), riskier.getRedFlags().size(), riskierName);
    }
}
