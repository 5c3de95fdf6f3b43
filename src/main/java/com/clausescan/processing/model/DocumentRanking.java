package com.clausescan.processing.model;

import java.util.List;

/**
 * One document's position in a ranking. Rank 1 is the riskiest document.
 */
public class DocumentRanking {

    private final int rank;
    private final String name;
    private final int inputIndex;
    private final AnalysisResult result;
    private final double compositeScore;
    private final long watchOutCount;
    private final List<String> strengths;
    private final List<String> weaknesses;

    public DocumentRanking(int rank, String name, int inputIndex, AnalysisResult result, double compositeScore,
                           List<String> strengths, List<String> weaknesses) {
        this.rank = rank;
        this.name = name;
        this.inputIndex = inputIndex;
        this.result = result;
        this.compositeScore = compositeScore;
        this.watchOutCount = result.getWatchOutCount();
        this.strengths = List.copyOf(strengths);
        this.weaknesses = List.copyOf(weaknesses);
    }

    public int getRank() {
        return rank;
    }

    public String getName() {
        return name;
    }

    /**
     * Position of the document in the submitted list, zero based.
     */
    public int getInputIndex() {
        return inputIndex;
    }

    public AnalysisResult getResult() {
        return result;
    }

    /**
     * Blend of risk score, red flag count and watch-out count. Lower is safer.
     */
    public double getCompositeScore() {
        return compositeScore;
    }

    public long getWatchOutCount() {
        return watchOutCount;
    }

    public List<String> getStrengths() {
        return strengths;
    }

    public List<String> getWeaknesses() {
        return weaknesses;
    }
}
