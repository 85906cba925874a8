package com.example.audit.merge;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Location comparison for duplicate detection.
 * <p>
 * Two location sets overlap when, after trimming and lowercasing, they share at least one
 * element. An empty set never overlaps anything, not even another empty set: findings that
 * do not say where they are cannot be proven to be the same issue.
 */
final class LocationOverlap {

    private LocationOverlap() {
    }

    static String normalize(String location) {
        return location.strip().toLowerCase(Locale.ROOT);
    }

    static boolean overlaps(Collection<String> first, Collection<String> second) {
        Set<String> set1 = normalizeAll(first);
        Set<String> set2 = normalizeAll(second);

        if (set1.isEmpty() || set2.isEmpty()) return false;

        // non-empty subsets always intersect, so this also covers the subset rule
        return !Collections.disjoint(set1, set2);
    }

    private static Set<String> normalizeAll(Collection<String> locations) {
        Set<String> normalized = new LinkedHashSet<>();
        if (locations == null) return normalized;
        for (String location : locations) {
            if (location != null) {
                normalized.add(normalize(location));
            }
        }
        return normalized;
    }
}
