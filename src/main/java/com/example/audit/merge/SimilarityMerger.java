package com.example.audit.merge;

import com.example.audit.event.AuditEventListener;
import com.example.audit.model.Finding;
import com.example.audit.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Deduplicates findings reported by different strategies.
 * <p>
 * Two findings are duplicates only when all of the following hold:
 * <ul>
 *   <li>their severities are equal (trimmed, case-insensitive; "High" and "Critical" never match)</li>
 *   <li>their locations overlap (see {@link LocationOverlap})</li>
 *   <li>their titles are similar (see {@link TitleSimilarity})</li>
 * </ul>
 * Each clustering pass uses "first representative wins": findings are visited in input
 * order and each one is folded into the first cluster, in creation order, whose current
 * representative it matches. Because the predicate is not transitive (A~B and B~C do not
 * imply A~C), the clusters depend on that order; this is the defined behavior.
 * <p>
 * A representative grows as findings are folded in (longer title, more locations), so after
 * one pass two representatives may have become duplicates of each other. The pass is then
 * repeated over the representatives until no more merges happen, which guarantees that no
 * two output findings are duplicates and that merging an already merged list is a no-op.
 * <p>
 * Combining a finding into a representative keeps the higher-ranked severity, the longer
 * description, the longer title (ties keep the representative's values) and the union of
 * locations, representative's first.
 * <p>
 * Holds no mutable state; one instance is shared by every batch.
 */
@Component
public class SimilarityMerger {

    private static final Logger log = LoggerFactory.getLogger(SimilarityMerger.class);

    private final AuditEventListener listener;

    public SimilarityMerger(AuditEventListener listener) {
        this.listener = listener != null ? listener : AuditEventListener.noop();
    }

    /**
     * Merges duplicate findings. Never fails; malformed findings are passed through.
     *
     * @param findings findings in the order they were collected
     * @return deduplicated findings, in the order their clusters were created
     */
    public List<Finding> merge(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) return List.of();

        List<Finding> current = findings.stream().filter(Objects::nonNull).toList();
        if (current.size() <= 1) return current;

        int incoming = current.size();
        log.info("Merging {} findings...", incoming);

        int passes = 0;
        List<Finding> clustered = current;
        do {
            current = clustered;
            clustered = clusterOnce(current);
            passes++;
        } while (clustered.size() > 1 && clustered.size() < current.size());

        log.info("Merged {} findings into {} unique findings ({} pass(es))",
                incoming, clustered.size(), passes);
        return clustered;
    }

    /**
     * Tests the duplicate predicate between two findings.
     */
    public static boolean isDuplicate(Finding first, Finding second) {
        return severitiesMatch(first.severity(), second.severity())
                && LocationOverlap.overlaps(first.locations(), second.locations())
                && TitleSimilarity.similar(first.title(), second.title());
    }

    /**
     * Folds {@code other} into {@code representative}. Ties keep the representative's values.
     */
    static Finding combine(Finding representative, Finding other) {
        String severity = Severity.higher(representative.severity(), other.severity());

        String description = other.description().length() > representative.description().length()
                ? other.description()
                : representative.description();

        String title = other.title().length() > representative.title().length()
                ? other.title()
                : representative.title();

        Set<String> locations = new LinkedHashSet<>(representative.locations());
        locations.addAll(other.locations());

        return new Finding(title, description, severity, new ArrayList<>(locations));
    }

    private List<Finding> clusterOnce(List<Finding> findings) {
        List<Finding> representatives = new ArrayList<>();

        for (Finding finding : findings) {
            int match = firstMatchingCluster(representatives, finding);
            if (match < 0) {
                representatives.add(finding);
                continue;
            }
            Finding merged = combine(representatives.get(match), finding);
            representatives.set(match, merged);
            listener.findingsMerged(finding, merged);
        }
        return representatives;
    }

    private static int firstMatchingCluster(List<Finding> representatives, Finding finding) {
        for (int i = 0; i < representatives.size(); i++) {
            if (isDuplicate(finding, representatives.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean severitiesMatch(String first, String second) {
        return first.strip().toLowerCase(Locale.ROOT).equals(second.strip().toLowerCase(Locale.ROOT));
    }
}
