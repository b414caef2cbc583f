package com.example.fleetsafety.detection;

import com.example.fleetsafety.domain.Signal;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Label normalization against a canonical label list.
 */
public final class BehaviorLabels {

    private BehaviorLabels() {
    }

    /**
     * Case-insensitive match against {@code canonical}; labels that are not in
     * the list pass through unchanged. Blank input yields null.
     */
    public static String normalize(String label, Collection<String> canonical) {
        if (label == null) return null;
        String trimmed = label.trim();
        if (trimmed.isEmpty()) return null;
        if (canonical != null) {
            for (String candidate : canonical) {
                if (candidate.equalsIgnoreCase(trimmed)) {
                    return candidate;
                }
            }
        }
        return trimmed;
    }

    /** Primary label first, then the remaining behavior labels, deduplicated. */
    public static List<String> normalizedLabels(Signal signal, Collection<String> canonical) {
        Set<String> labels = new LinkedHashSet<>();
        addNormalized(labels, signal.getPrimaryBehaviorLabel(), canonical);
        if (signal.getBehaviorLabels() != null) {
            for (String label : signal.getBehaviorLabels()) {
                addNormalized(labels, label, canonical);
            }
        }
        return new ArrayList<>(labels);
    }

    public static Set<String> normalizeAll(Collection<String> labels, Collection<String> canonical) {
        Set<String> normalized = new LinkedHashSet<>();
        if (labels != null) {
            for (String label : labels) {
                addNormalized(normalized, label, canonical);
            }
        }
        return normalized;
    }

    private static void addNormalized(Set<String> target, String label, Collection<String> canonical) {
        String normalized = normalize(label, canonical);
        if (normalized != null) target.add(normalized);
    }
}
