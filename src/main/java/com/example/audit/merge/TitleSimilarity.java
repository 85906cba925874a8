package com.example.audit.merge;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Conservative title comparison based on substring containment and word overlap.
 */
final class TitleSimilarity {

    /** Jaccard similarity at or above which two titles are considered the same. */
    static final double JACCARD_THRESHOLD = 0.75;

    /** Share of the shorter title's words that must appear in the longer one. */
    static final double SHORTER_TITLE_COVERAGE = 0.5;

    private TitleSimilarity() {
    }

    /**
     * Lowercases, trims and collapses internal whitespace.
     */
    static String normalize(String title) {
        if (title == null) return "";
        String trimmed = title.strip().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) return trimmed;
        return String.join(" ", trimmed.split("\\s+"));
    }

    static boolean similar(String first, String second) {
        String norm1 = normalize(first);
        String norm2 = normalize(second);

        if (norm1.equals(norm2)) return true;

        // "reentrancy" vs "reentrancy vulnerability"
        if (norm1.contains(norm2) || norm2.contains(norm1)) return true;

        Set<String> words1 = words(norm1);
        Set<String> words2 = words(norm2);
        if (words1.isEmpty() || words2.isEmpty()) return false;

        Set<String> common = new HashSet<>(words1);
        common.retainAll(words2);
        int intersection = common.size();

        int shorter = Math.min(words1.size(), words2.size());
        if (intersection >= shorter * SHORTER_TITLE_COVERAGE) return true;

        int union = words1.size() + words2.size() - intersection;
        return (double) intersection / union >= JACCARD_THRESHOLD;
    }

    private static Set<String> words(String normalized) {
        if (normalized.isEmpty()) return Set.of();
        return new HashSet<>(Arrays.asList(normalized.split(" ")));
    }
}
