package com.dramacollector.collect.aggregate;

import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.DramaField;

import java.util.List;
import java.util.function.ToIntFunction;

public class CompletenessScorer {
    private static final int EXPECTED_FIELDS = DramaField.values().length;

    private final double corroborationBonus;

    public CompletenessScorer(double corroborationBonus) {
        this.corroborationBonus = Math.max(0.0, corroborationBonus);
    }

    /**
     * Populated fraction of the expected fields, plus {@code bonus / priority} for every
     * contributing source after the first. Capped at 1.0.
     *
     * @param sources contributing sources, highest priority first
     */
    public double score(DramaAttributes attributes, List<String> sources, ToIntFunction<String> priorityOf) {
        double score = (double) attributes.populatedCount() / EXPECTED_FIELDS;
        for (int i = 1; i < sources.size(); i++) {
            int priority = Math.max(1, priorityOf.applyAsInt(sources.get(i)));
            score += corroborationBonus / priority;
        }
        return Math.min(1.0, score);
    }
}
