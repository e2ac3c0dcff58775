package com.dramacollector.collect.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record StoredDrama(
    String dedupKey,
    String title,
    Integer year,
    Double rating,
    List<String> genres,
    String synopsis,
    Integer episodes,
    List<String> directors,
    List<String> casts,
    List<String> tags,
    List<String> sources,
    Map<String, String> provenance,
    double completenessScore,
    Double qualityScore,
    String lastJobId,
    Instant firstSeenAt,
    Instant updatedAt
) {}
