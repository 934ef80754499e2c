package com.deepansh.memorychat.text;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight lexical helpers shared by memory search, tagging and conversation analysis.
 * Works on lower-cased ASCII words of four or more letters.
 */
public final class Keywords {

    private static final Pattern WORD = Pattern.compile("\\b[a-z]{4,}\\b");

    public static final Set<String> STOP_WORDS = Set.of(
            "that", "this", "these", "those", "with", "from", "have", "been", "will", "would",
            "could", "should", "were", "what", "which", "when", "where", "they", "does", "there",
            "then", "them", "their", "about", "your", "just", "into", "also", "some", "than",
            "very", "much", "like", "want", "know", "tell", "please");

    private Keywords() {
    }

    /** All four-plus-letter words in order of appearance, stop words included. */
    public static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }
        return words;
    }

    /** Distinct significant words in order of first appearance. */
    public static List<String> significant(String text, int limit) {
        return words(text).stream()
                .filter(w -> !STOP_WORDS.contains(w))
                .distinct()
                .limit(limit)
                .toList();
    }

    /** Significant word frequencies, highest count first, ties by first appearance. */
    public static Map<String, Integer> frequencies(String text) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String word : words(text)) {
            if (!STOP_WORDS.contains(word)) {
                counts.merge(word, 1, Integer::sum);
            }
        }
        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEachOrdered(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    /** Whole-word or whole-phrase, case-insensitive containment. */
    public static boolean containsTerm(String text, String term) {
        if (text == null || term == null || term.isBlank()) {
            return false;
        }
        Pattern p = Pattern.compile("\\b" + Pattern.quote(term.toLowerCase(Locale.ROOT)) + "\\b");
        return p.matcher(text.toLowerCase(Locale.ROOT)).find();
    }

    public static boolean containsAny(String text, List<String> terms) {
        return terms.stream().anyMatch(t -> containsTerm(text, t));
    }

    public static long countMatching(String text, List<String> terms) {
        return terms.stream().filter(t -> containsTerm(text, t)).count();
    }
}
