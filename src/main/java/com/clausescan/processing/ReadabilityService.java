package com.clausescan.processing;

import com.clausescan.processing.model.ReadabilityScore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flesch Reading Ease, Flesch-Kincaid grade and Gunning Fog for a document,
 * using a heuristic syllable counter.
 */
@Service
public class ReadabilityService {

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final Pattern WORD = Pattern.compile("[a-zA-Z']+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");
    private static final Pattern ION_SUFFIX = Pattern.compile("[^aeiouy]ion");

    /**
     * @return readability indices, or empty when the text contains no words
     */
    public Optional<ReadabilityScore> compute(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        if (words.isEmpty()) {
            return Optional.empty();
        }
        int sentences = 0;
        for (String sentence : SENTENCE_SPLIT.split(text)) {
            if (!sentence.isBlank()) {
                sentences++;
            }
        }
        sentences = Math.max(sentences, 1);
        int wordCount = words.size();

        int syllables = 0;
        int complexWords = 0;
        int letters = 0;
        for (String word : words) {
            int count = countSyllables(word);
            syllables += count;
            if (count >= 3) {
                complexWords++;
            }
            letters += word.length();
        }

        double wordsPerSentence = (double) wordCount / sentences;
        double syllablesPerWord = (double) syllables / wordCount;
        double avgSentenceLength = round1(wordsPerSentence);
        double avgWordLength = round1((double) letters / wordCount);
        double complexPercent = round1(100.0 * complexWords / wordCount);

        double fleschEase = clamp(round1(206.835 - 1.015 * wordsPerSentence - 84.6 * syllablesPerWord), 0.0, 100.0);
        double fleschGrade = Math.max(0.0, round1(0.39 * wordsPerSentence + 11.8 * syllablesPerWord - 15.59));
        double gunningFog = round1(0.4 * (avgSentenceLength + complexPercent));

        String gradeLabel;
        String easeLabel;
        if (fleschEase >= 80) {
            gradeLabel = "Very Easy";
            easeLabel = "Plain English that anyone can understand.";
        } else if (fleschEase >= 65) {
            gradeLabel = "Easy";
            easeLabel = "Fairly accessible language that most adults can follow.";
        } else if (fleschEase >= 50) {
            gradeLabel = "Moderate";
            easeLabel = "Requires some concentration, similar to a magazine article.";
        } else if (fleschEase >= 35) {
            gradeLabel = "Difficult";
            easeLabel = "Academic-level language that requires careful reading.";
        } else if (fleschEase >= 20) {
            gradeLabel = "Very Difficult";
            easeLabel = "Dense legal or technical writing that is hard to follow for most people.";
        } else {
            gradeLabel = "Very Confusing";
            easeLabel = "Extremely complex. Consider asking a professional to explain it.";
        }

        return Optional.of(new ReadabilityScore(fleschEase, fleschGrade, gunningFog, avgSentenceLength,
                avgWordLength, complexPercent, gradeLabel, easeLabel));
    }

    static int countSyllables(String word) {
        String letters = word.toLowerCase(Locale.ROOT).replaceAll("[^a-z]", "");
        if (letters.isEmpty()) {
            return 1;
        }
        int count = (int) VOWEL_GROUP.matcher(letters).results().count();
        // silent trailing e
        if (letters.endsWith("e") && letters.length() > 2 && "aeiou".indexOf(letters.charAt(letters.length() - 2)) < 0) {
            count--;
        }
        count += (int) ION_SUFFIX.matcher(letters).results().count();
        return Math.max(1, count);
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
