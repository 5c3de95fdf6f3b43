package com.clausescan.processing;

import com.clausescan.processing.catalog.KeyPointCategory;
import com.clausescan.processing.model.AnalysisResult;
import com.clausescan.processing.model.CategoryRow;
import com.clausescan.processing.model.CellState;
import com.clausescan.processing.model.DocumentRanking;
import com.clausescan.processing.model.KeyPoint;
import com.clausescan.processing.model.NamedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import com.clausescan.processing.model.RankingResult;

/**
 * Ranks 2-8 documents from riskiest to safest.
 *
 * <p>Order: risk score descending, then red flag count descending, then name, then submission
 * order. Each entry gets strengths and weaknesses relative to the peer average, and the result
 * carries a category matrix with columns in rank order.
 */
@Service
public class DocumentRankingService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentRankingService.class);
    public static final int MIN_DOCUMENTS = 2;
    public static final int MAX_DOCUMENTS = 8;
    static final int MAX_NOTES = 3;

    private final DocumentAnalysisService analysisService;
    private final Executor executor;

    public DocumentRankingService(DocumentAnalysisService analysisService,
                                  @Qualifier("analysisExecutor") Executor executor) {
        this.analysisService = analysisService;
        this.executor = executor;
    }

    /**
     * @throws IllegalArgumentException if fewer than 2 or more than 8 documents are given
     */
    public RankingResult rank(List<NamedDocument> documents) {
        if (documents == null || documents.size() < MIN_DOCUMENTS || documents.size() > MAX_DOCUMENTS) {
            int count = documents == null ? 0 : documents.size();
            throw new IllegalArgumentException(String.format(
                    "Ranking requires between %d and %d documents, got %d", MIN_DOCUMENTS, MAX_DOCUMENTS, count));
        }

        List<CompletableFuture<AnalysisResult>> futures = new ArrayList<>();
        for (NamedDocument document : documents) {
            futures.add(CompletableFuture.supplyAsync(() -> analysisService.analyze(document.getText()), executor));
        }
        List<Entry> entries = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            entries.add(new Entry(displayName(documents.get(i), i), i, AnalysisFutures.await(futures.get(i))));
        }
        return rankAnalyzed(entries);
    }

    private RankingResult rankAnalyzed(List<Entry> entries) {
        entries.sort(Comparator.comparingInt((Entry e) -> e.result.getRiskScore()).reversed()
                .thenComparing(Comparator.comparingInt((Entry e) -> e.result.getRedFlags().size()).reversed())
                .thenComparing(e -> e.name)
                .thenComparingInt(e -> e.index));

        double avgRisk = entries.stream().mapToInt(e -> e.result.getRiskScore()).average().orElse(0);
        double avgFlags = entries.stream().mapToInt(e -> e.result.getRedFlags().size()).average().orElse(0);

        List<DocumentRanking> rankings = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            rankings.add(new DocumentRanking(i + 1, entry.name, entry.index, entry.result,
                    CompositeScores.of(entry.result),
                    strengths(entry.result, avgRisk, avgFlags),
                    weaknesses(entry.result, avgRisk)));
        }

        DocumentRanking riskiest = rankings.get(0);
        DocumentRanking safest = rankings.get(rankings.size() - 1);
        logger.debug("Ranked {} documents: riskiest='{}', safest='{}'", rankings.size(), riskiest.getName(), safest.getName());
        return new RankingResult(rankings, matrix(rankings), safest.getName(), recommendation(rankings));
    }

    static List<String> strengths(AnalysisResult result, double avgRisk, double avgFlags) {
        List<String> items = new ArrayList<>();
        if (result.getRiskScore() < avgRisk - 10) {
            items.add("Risk score (" + result.getRiskScore() + "/100) is well below average");
        }
        if (result.getRedFlags().size() < avgFlags) {
            items.add("Fewer red flags than most alternatives");
        }
        List<KeyPoint> favourable = result.getKeyPoints().stream().filter(kp -> !kp.isWatchOut()).toList();
        if (!favourable.isEmpty()) {
            items.add("Favourable terms on: " + labels(favourable));
        }
        if (result.getReadability() != null && result.getReadability().getFleschEase() >= 50) {
            items.add("Written in relatively plain language");
        }
        if (items.isEmpty()) {
            return List.of("No particular strengths identified");
        }
        return items.subList(0, Math.min(MAX_NOTES, items.size()));
    }

    static List<String> weaknesses(AnalysisResult result, double avgRisk) {
        List<String> items = new ArrayList<>();
        if (result.getRiskScore() > avgRisk + 10) {
            items.add("Risk score (" + result.getRiskScore() + "/100) is above average");
        }
        if (!result.getRedFlags().isEmpty()) {
            items.add(result.getRedFlags().size() + " red flag(s) detected");
        }
        List<KeyPoint> concerning = result.getKeyPoints().stream().filter(KeyPoint::isWatchOut).toList();
        if (!concerning.isEmpty()) {
            items.add("Concerning clauses: " + labels(concerning));
        }
        if (result.getReadability() != null && result.getReadability().getFleschEase() < 35) {
            items.add("Complex, hard-to-follow language");
        }
        return items.subList(0, Math.min(MAX_NOTES, items.size()));
    }

    private static List<CategoryRow> matrix(List<DocumentRanking> rankings) {
        Set<KeyPointCategory> present = EnumSet.noneOf(KeyPointCategory.class);
        for (DocumentRanking ranking : rankings) {
            ranking.getResult().getKeyPoints().forEach(kp -> present.add(kp.getCategory()));
        }
        List<CategoryRow> rows = new ArrayList<>();
        for (KeyPointCategory category : present) {
            List<CellState> cells = new ArrayList<>();
            List<String> details = new ArrayList<>();
            for (DocumentRanking ranking : rankings) {
                KeyPoint keyPoint = ranking.getResult().findKeyPoint(category).orElse(null);
                cells.add(CellState.of(keyPoint));
                details.add(keyPoint != null ? CompositeScores.detail(keyPoint.getDetail()) : "Not mentioned");
            }
            rows.add(new CategoryRow(category, cells, details));
        }
        return rows;
    }

    private static String recommendation(List<DocumentRanking> rankings) {
        DocumentRanking riskiest = rankings.get(0);
        DocumentRanking safest = rankings.get(rankings.size() - 1);
        int gap = riskiest.getResult().getRiskScore() - safest.getResult().getRiskScore();
        String strength = gap >= 30 ? "significantly" : gap >= 15 ? "meaningfully" : "slightly";

        StringBuilder sb = new StringBuilder();
        sb.append("Based on the analysis of ").append(rankings.size()).append(" documents, ")
                .append(safest.getName()).append(" is ").append(strength).append(" the safest choice.");
        String firstStrength = safest.getStrengths().get(0);
        if (!firstStrength.startsWith("No particular")) {
            sb.append(" It stands out for: ").append(Character.toLowerCase(firstStrength.charAt(0)))
                    .append(firstStrength.substring(1)).append('.');
        }
        if (rankings.size() > 2) {
            DocumentRanking runnerUp = rankings.get(rankings.size() - 2);
            if (runnerUp.getCompositeScore() - safest.getCompositeScore() < 5) {
                sb.append(' ').append(runnerUp.getName()).append(" is a close second and also a reasonable option.");
            }
        }
        if (!riskiest.getResult().getRedFlags().isEmpty()) {
            sb.append(" Avoid ").append(riskiest.getName()).append(" if possible: it carries ")
                    .append(riskiest.getResult().getRedFlags().size()).append(" red flag(s) and scored ")
                    .append(riskiest.getResult().getRiskScore()).append("/100 on risk.");
        }
        return sb.toString();
    }

    private static String labels(List<KeyPoint> keyPoints) {
        return keyPoints.stream().limit(MAX_NOTES).map(KeyPoint::getCategoryLabel).collect(Collectors.joining(", "));
    }

    private static String displayName(NamedDocument document, int index) {
        String name = document.getName();
        return name == null || name.isBlank() ? "Document " + (index + 1) : name.strip();
    }

    private static final class Entry {
        private final String name;
        private final int index;
        private final AnalysisResult result;

        private Entry(String name, int index, AnalysisResult result) {
            this.name = name;
            this.index = index;
            this.result = result;
        }
    }
}
