package com.dramacollector.collect.model;

public record ExportOptions(String baseName, boolean compress, boolean includeMetadata) {}
