package com.clausescan.processing.model;

import java.util.List;

/**
 * Ordered leaderboard of 2-8 analyzed documents, riskiest first.
 */
public class RankingResult {

    private final List<DocumentRanking> rankings;
    private final List<CategoryRow> matrix;
    private final String safestDocument;
    private final String recommendation;

    public RankingResult(List<DocumentRanking> rankings, List<CategoryRow> matrix,
                         String safestDocument, String recommendation) {
        this.rankings = List.copyOf(rankings);
        this.matrix = List.copyOf(matrix);
        this.safestDocument = safestDocument;
        this.recommendation = recommendation;
    }

    public List<DocumentRanking> getRankings() {
        return rankings;
    }

    public List<String> getDocumentNames() {
        return rankings.stream().map(DocumentRanking::getName).toList();
    }

    public List<CategoryRow> getMatrix() {
        return matrix;
    }

    public String getSafestDocument() {
        return safestDocument;
    }

    public String getRecommendation() {
        return recommendation;
    }
}
