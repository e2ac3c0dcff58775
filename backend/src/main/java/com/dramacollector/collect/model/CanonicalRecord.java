package com.dramacollector.collect.model;

import java.util.List;
import java.util.Map;

public record CanonicalRecord(
    String dedupKey,
    List<String> sources,
    DramaAttributes attributes,
    Map<DramaField, String> provenance,
    double completenessScore
) {
    public CanonicalRecord {
        sources = sources == null ? List.of() : List.copyOf(sources);
        provenance = provenance == null ? Map.of() : Map.copyOf(provenance);
    }

    public String title() {
        return attributes.title();
    }
}
