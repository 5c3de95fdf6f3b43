package com.clausescan.processing.model;

import java.util.List;

/**
 * Side-by-side diff of two analyzed documents.
 */
public class ComparisonResult {

    private final String leftName;
    private final String rightName;
    private final AnalysisResult left;
    private final AnalysisResult right;
    private final double leftCompositeScore;
    private final double rightCompositeScore;
    private final int riskScoreDifference;
    private final List<CategoryComparison> categories;
    private final List<String> redFlagsOnlyLeft;
    private final List<String> redFlagsOnlyRight;
    private final List<String> sharedRedFlags;
    private final ComparisonWinner saferDocument;
    private final String verdict;

    public ComparisonResult(String leftName, String rightName, AnalysisResult left, AnalysisResult right,
                            double leftCompositeScore, double rightCompositeScore,
                            List<CategoryComparison> categories, List<String> redFlagsOnlyLeft,
                            List<String> redFlagsOnlyRight, List<String> sharedRedFlags,
                            ComparisonWinner saferDocument, String verdict) {
        this.leftName = leftName;
        this.rightName = rightName;
        this.left = left;
        this.right = right;
        this.leftCompositeScore = leftCompositeScore;
        this.rightCompositeScore = rightCompositeScore;
        this.riskScoreDifference = left.getRiskScore() - right.getRiskScore();
        this.categories = List.copyOf(categories);
        this.redFlagsOnlyLeft = List.copyOf(redFlagsOnlyLeft);
        this.redFlagsOnlyRight = List.copyOf(redFlagsOnlyRight);
        this.sharedRedFlags = List.copyOf(sharedRedFlags);
        this.saferDocument = saferDocument;
        this.verdict = verdict;
    }

    public String getLeftName() {
        return leftName;
    }

    public String getRightName() {
        return rightName;
    }

    public AnalysisResult getLeft() {
        return left;
    }

    public AnalysisResult getRight() {
        return right;
    }

    public double getLeftCompositeScore() {
        return leftCompositeScore;
    }

    public double getRightCompositeScore() {
        return rightCompositeScore;
    }

    /**
     * Left risk score minus right risk score.
     */
    public int getRiskScoreDifference() {
        return riskScoreDifference;
    }

    public List<CategoryComparison> getCategories() {
        return categories;
    }

    public List<String> getRedFlagsOnlyLeft() {
        return redFlagsOnlyLeft;
    }

    public List<String> getRedFlagsOnlyRight() {
        return redFlagsOnlyRight;
    }

    public List<String> getSharedRedFlags() {
        return sharedRedFlags;
    }

    public ComparisonWinner getSaferDocument() {
        return saferDocument;
    }

    public String getVerdict() {
        return verdict;
    }
}
