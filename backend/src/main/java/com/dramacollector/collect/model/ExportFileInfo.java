package com.dramacollector.collect.model;

public record ExportFileInfo(String path, long sizeBytes, String format, String checksum) {}
