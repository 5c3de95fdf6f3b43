package com.clausescan.processing;

import com.clausescan.processing.model.AnalysisResult;

/**
 * Composite safety score used by comparison and ranking. Lower is safer.
 */
final class CompositeScores {

    static final double RISK_WEIGHT = 0.5;
    static final double RED_FLAG_WEIGHT = 4 * 0.3;
    static final double WATCH_OUT_WEIGHT = 3 * 0.2;

    private CompositeScores() {
    }

    static double of(AnalysisResult result) {
        double score = result.getRiskScore() * RISK_WEIGHT
                + result.getRedFlags().size() * RED_FLAG_WEIGHT
                + result.getWatchOutCount() * WATCH_OUT_WEIGHT;
        return Math.round(score * 10.0) / 10.0;
    }

    static String detail(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 120 ? text.substring(0, 117) + "..." : text;
    }
}
