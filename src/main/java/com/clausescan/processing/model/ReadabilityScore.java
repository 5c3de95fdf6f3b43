package com.clausescan.processing.model;

/**
 * Standard readability indices for the analyzed text.
 */
public class ReadabilityScore {

    private final double fleschEase;
    private final double fleschGrade;
    private final double gunningFog;
    private final double avgSentenceLength;
    private final double avgWordLength;
    private final double complexWordPercent;
    private final String gradeLabel;
    private final String easeLabel;

    public ReadabilityScore(double fleschEase, double fleschGrade, double gunningFog,
                            double avgSentenceLength, double avgWordLength, double complexWordPercent,
                            String gradeLabel, String easeLabel) {
        this.fleschEase = fleschEase;
        this.fleschGrade = fleschGrade;
        this.gunningFog = gunningFog;
        this.avgSentenceLength = avgSentenceLength;
        this.avgWordLength = avgWordLength;
        this.complexWordPercent = complexWordPercent;
        this.gradeLabel = gradeLabel;
        this.easeLabel = easeLabel;
    }

    /** Flesch Reading Ease, 0 (hardest) to 100 (easiest). */
    public double getFleschEase() {
        return fleschEase;
    }

    /** Flesch-Kincaid US grade level. */
    public double getFleschGrade() {
        return fleschGrade;
    }

    public double getGunningFog() {
        return gunningFog;
    }

    public double getAvgSentenceLength() {
        return avgSentenceLength;
    }

    public double getAvgWordLength() {
        return avgWordLength;
    }

    public double getComplexWordPercent() {
        return complexWordPercent;
    }

    public String getGradeLabel() {
        return gradeLabel;
    }

    public String getEaseLabel() {
        return easeLabel;
    }
}
