package com.deepansh.memorychat.agent.memory;

import com.deepansh.memorychat.text.Keywords;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fallbacks used when the extraction model leaves out a type, an importance
 * score or tags.
 */
final class MemoryHeuristics {

    static final int MAX_TAGS = 5;

    private static final List<String> EMPHASIS_WORDS = List.of(
            "prefer", "prefers", "like", "likes", "dislike", "dislikes", "love", "loves",
            "hate", "hates", "important", "always", "never");

    private static final List<String> PREFERENCE_WORDS = List.of(
            "prefer", "prefers", "like", "likes", "dislike", "dislikes", "love", "loves",
            "hate", "hates", "favorite", "favourite", "opinion");
    private static final List<String> EVENT_WORDS = List.of(
            "event", "happened", "occurred", "date", "yesterday", "tomorrow", "birthday", "anniversary");
    private static final List<String> RELATIONSHIP_WORDS = List.of(
            "friend", "family", "colleague", "wife", "husband", "partner", "mother", "father",
            "sister", "brother", "daughter", "son", "knows", "met", "relationship");
    private static final List<String> FACT_WORDS = List.of(
            "is", "has", "works", "lives", "from", "studies", "owns", "uses");

    private MemoryHeuristics() {
    }

    static MemoryType categorize(String content) {
        if (Keywords.containsAny(content, PREFERENCE_WORDS)) {
            return MemoryType.PREFERENCE;
        }
        if (Keywords.containsAny(content, EVENT_WORDS)) {
            return MemoryType.EVENT;
        }
        if (Keywords.containsAny(content, RELATIONSHIP_WORDS)) {
            return MemoryType.RELATIONSHIP;
        }
        if (Keywords.containsAny(content, FACT_WORDS)) {
            return MemoryType.FACT;
        }
        return MemoryType.OTHER;
    }

    static double importance(String content, MemoryType type) {
        double score = type.baseImportance();
        if (Keywords.containsAny(content, EMPHASIS_WORDS)) {
            score += 0.2;
        }
        if (content.length() > 100) {
            score += 0.1;
        }
        return round(clamp(score));
    }

    /** Type first, then significant words of the content, at most five. */
    static List<String> generateTags(String content, MemoryType type) {
        Set<String> tags = new LinkedHashSet<>();
        tags.add(type.value());
        tags.addAll(Keywords.significant(content, MAX_TAGS));
        return new ArrayList<>(tags).subList(0, Math.min(MAX_TAGS, tags.size()));
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double round(double score) {
        return Math.round(score * 100.0) / 100.0;
    }
}
