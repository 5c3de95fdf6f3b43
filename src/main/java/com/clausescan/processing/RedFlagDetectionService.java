package com.clausescan.processing;

import com.clausescan.processing.catalog.PatternCatalog;
import com.clausescan.processing.catalog.RedFlagPattern;
import com.clausescan.processing.model.RedFlag;
import com.clausescan.util.TextSpans;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Detects high-concern clauses independently of document type.
 * One red flag per distinct match span per pattern; overlapping matches of different
 * patterns are all kept. Ordered by severity descending, then position.
 */
@Service
public class RedFlagDetectionService {

    private static final Logger logger = LoggerFactory.getLogger(RedFlagDetectionService.class);
    static final int MAX_MATCHES_PER_PATTERN = 50;

    static final Comparator<RedFlag> ORDER = Comparator
            .comparing(RedFlag::getSeverity).reversed()
            .thenComparingInt(RedFlag::getOffset)
            .thenComparing(RedFlag::getCategory)
            .thenComparingInt(flag -> flag.getMatchedText().length());

    private final PatternCatalog catalog;

    public RedFlagDetectionService(PatternCatalog catalog) {
        this.catalog = catalog;
    }

    public List<RedFlag> detect(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<RedFlag> flags = new ArrayList<>();
        for (RedFlagPattern pattern : catalog.getRedFlagPatterns()) {
            Matcher matcher = pattern.getPattern().matcher(text);
            int found = 0;
            while (found < MAX_MATCHES_PER_PATTERN && matcher.find()) {
                if (matcher.end() == matcher.start()) {
                    continue;
                }
                found++;
                String context = TextSpans.sentenceAround(text, matcher.start(), matcher.end()).getSnippet();
                flags.add(new RedFlag(pattern.getCategory(), pattern.getDescription(), pattern.getSeverity(),
                        matcher.group(), matcher.start(), context));
            }
        }
        flags.sort(ORDER);
        logger.debug("Detected {} red flags", flags.size());
        return flags;
    }
}
