package com.dramacollector.collect.model;

public record RawRecord(
    String source,
    String sourceId,
    DramaAttributes attributes
) {
    public RawRecord {
        attributes = attributes == null ? DramaAttributes.empty() : attributes;
    }

    public RawRecord withAttributes(DramaAttributes replacement) {
        return new RawRecord(source, sourceId, replacement);
    }
}
