package com.clausescan.util;

import com.clausescan.processing.model.Evidence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sentence-level evidence windows over raw document text.
 * Every returned snippet is a literal substring of the input at its reported offset.
 */
public final class TextSpans {

    public static final int MAX_SNIPPET_LENGTH = 300;

    private TextSpans() {
        // Utility class
    }

    /**
     * Returns the sentence containing {@code [start, end)}, bounded to {@link #MAX_SNIPPET_LENGTH}
     * characters around the match.
     */
    public static Evidence sentenceAround(String text, int start, int end) {
        int sentenceStart = 0;
        for (int i = start - 1; i >= 0; i--) {
            if (isBoundary(text, i)) {
                sentenceStart = i + 1;
                break;
            }
        }
        int sentenceEnd = text.length();
        for (int j = Math.max(end, start); j < text.length(); j++) {
            if (text.charAt(j) == '\n') {
                sentenceEnd = j;
                break;
            }
            if (isBoundary(text, j)) {
                sentenceEnd = j + 1;
                break;
            }
        }
        while (sentenceStart < start && Character.isWhitespace(text.charAt(sentenceStart))) {
            sentenceStart++;
        }
        while (sentenceEnd > end && Character.isWhitespace(text.charAt(sentenceEnd - 1))) {
            sentenceEnd--;
        }

        if (sentenceEnd - sentenceStart > MAX_SNIPPET_LENGTH) {
            int matchLength = Math.min(end - start, MAX_SNIPPET_LENGTH);
            int windowStart = Math.max(sentenceStart, start - (MAX_SNIPPET_LENGTH - matchLength) / 2);
            int windowEnd = Math.min(sentenceEnd, windowStart + MAX_SNIPPET_LENGTH);
            windowStart = Math.max(sentenceStart, windowEnd - MAX_SNIPPET_LENGTH);
            sentenceStart = windowStart;
            sentenceEnd = windowEnd;
        }
        return new Evidence(text.substring(sentenceStart, sentenceEnd), sentenceStart);
    }

    /**
     * Collects up to {@code maxItems} distinct sentences containing a match of any pattern,
     * in document order.
     */
    public static List<Evidence> collect(String text, List<Pattern> patterns, int maxItems, int maxMatchesPerPattern) {
        List<int[]> spans = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            int found = 0;
            while (found < maxMatchesPerPattern && matcher.find()) {
                spans.add(new int[] {matcher.start(), matcher.end()});
                found++;
            }
        }
        spans.sort(Comparator.<int[]>comparingInt(s -> s[0]).thenComparingInt(s -> s[1]));

        Map<Integer, Evidence> byOffset = new LinkedHashMap<>();
        for (int[] span : spans) {
            if (byOffset.size() >= maxItems) {
                break;
            }
            Evidence evidence = sentenceAround(text, span[0], span[1]);
            byOffset.putIfAbsent(evidence.getOffset(), evidence);
        }
        return new ArrayList<>(byOffset.values());
    }

    /**
     * Counts words as whitespace-separated tokens.
     */
    public static int wordCount(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static boolean isBoundary(String text, int i) {
        char c = text.charAt(i);
        if (c == '\n') {
            return true;
        }
        if (c != '.' && c != '!' && c != '?') {
            return false;
        }
        return i + 1 >= text.length() || Character.isWhitespace(text.charAt(i + 1));
    }
}
