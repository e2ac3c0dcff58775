package com.dramacollector.collect.aggregate;

import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.DramaField;
import com.dramacollector.collect.model.RawRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Field-wise merge of one dedup group. For every field the value comes from the
 * highest-priority source that has it; equal priorities prefer the larger value, then the
 * record seen first.
 */
public class RecordMerger {
    private final CompletenessScorer scorer;

    public RecordMerger(CompletenessScorer scorer) {
        this.scorer = scorer;
    }

    /**
     * @param members the group's records in first-seen order
     */
    public CanonicalRecord merge(String dedupKey, List<RawRecord> members, ToIntFunction<String> priorityOf) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("cannot merge an empty group for " + dedupKey);
        }
        DramaAttributes.Builder merged = DramaAttributes.builder();
        Map<DramaField, String> provenance = new EnumMap<>(DramaField.class);
        for (DramaField field : DramaField.values()) {
            RawRecord winner = null;
            for (RawRecord candidate : members) {
                if (!candidate.attributes().has(field)) {
                    continue;
                }
                if (winner == null || beats(candidate, winner, field, priorityOf)) {
                    winner = candidate;
                }
            }
            if (winner != null) {
                merged.set(field, winner.attributes().get(field));
                provenance.put(field, winner.source());
            }
        }

        List<RawRecord> byPriority = new ArrayList<>(members);
        byPriority.sort(Comparator.comparingInt(record -> priorityOf.applyAsInt(record.source())));
        Set<String> sources = new LinkedHashSet<>();
        for (RawRecord record : byPriority) {
            sources.add(record.source());
        }
        List<String> sourceList = List.copyOf(sources);

        DramaAttributes attributes = merged.build();
        double score = scorer.score(attributes, sourceList, priorityOf);
        return new CanonicalRecord(dedupKey, sourceList, attributes, provenance, score);
    }

    private static boolean beats(RawRecord candidate, RawRecord current, DramaField field, ToIntFunction<String> priorityOf) {
        int candidatePriority = priorityOf.applyAsInt(candidate.source());
        int currentPriority = priorityOf.applyAsInt(current.source());
        if (candidatePriority != currentPriority) {
            return candidatePriority < currentPriority;
        }
        return field.weight(candidate.attributes().get(field)) > field.weight(current.attributes().get(field));
    }
}
