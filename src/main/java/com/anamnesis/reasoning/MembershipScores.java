package com.anamnesis.reasoning;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized category scores of one conversation. Uncategorized when there was nothing to normalize.
 */
public record MembershipScores(Map<String, Double> scores, boolean uncategorized) {
    public MembershipScores {
        scores = scores == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static MembershipScores uncategorizedScores() {
        return new MembershipScores(Map.of(), true);
    }

    public double scoreOf(String categoryId) {
        return scores.getOrDefault(categoryId, 0.0);
    }
}
