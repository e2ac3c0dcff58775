package com.dramacollector.collect.export;

import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.ExportFileInfo;
import com.dramacollector.collect.model.ExportOptions;
import com.dramacollector.collect.model.ValidatedRecord;
import com.dramacollector.collect.util.HashUtils;
import com.dramacollector.config.CollectorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPOutputStream;

@Service
public class DramaExportService implements RecordExporter {
    private static final Logger log = LoggerFactory.getLogger(DramaExportService.class);
    private static final Set<String> SUPPORTED_FORMATS = Set.of("json", "csv");
    private static final DateTimeFormatter FILE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final String SCHEMA_VERSION = "2.0";
    private static final String[] CSV_HEADER = {
        "dedup_key",
        "title",
        "year",
        "rating",
        "genres",
        "synopsis",
        "episodes",
        "directors",
        "casts",
        "tags",
        "sources",
        "completeness_score",
        "quality_score"
    };

    private final CollectorProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DramaExportService(CollectorProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    @Override
    public List<ExportFileInfo> export(List<ValidatedRecord> records, List<String> formats, ExportOptions options) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String format : formats) {
            String value = format == null ? "" : format.trim().toLowerCase(Locale.ROOT);
            if (!SUPPORTED_FORMATS.contains(value)) {
                throw new ExportFailureException("unsupported export format: " + format);
            }
            normalized.add(value);
        }

        Path directory = Paths.get(properties.getExport().getOutputDirectory());
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ExportFailureException("cannot create export directory " + directory, e);
        }

        Instant now = clock.instant();
        String baseName = options.baseName() == null || options.baseName().isBlank() ? "dramas" : options.baseName();
        List<ExportFileInfo> files = new ArrayList<>();
        for (String format : normalized) {
            String fileName = baseName + "_" + FILE_TIMESTAMP.format(now) + "." + format + (options.compress() ? ".gz" : "");
            Path path = directory.resolve(fileName);
            try {
                try (OutputStream out = open(path, options.compress())) {
                    if ("json".equals(format)) {
                        writeJson(out, records, options.includeMetadata(), now);
                    } else {
                        writeCsv(out, records, options.includeMetadata(), now);
                    }
                }
                ExportFileInfo info = new ExportFileInfo(
                    path.toString(),
                    Files.size(path),
                    format,
                    HashUtils.sha256Hex(path)
                );
                files.add(info);
                log.info("Exported {} records to {} ({} bytes)", records.size(), path, info.sizeBytes());
            } catch (IOException e) {
                deleteQuietly(path);
                throw new ExportFailureException("failed to write " + format + " export to " + path + ": " + e.getMessage(), e);
            }
        }
        return files;
    }

    private void writeJson(OutputStream out, List<ValidatedRecord> records, boolean includeMetadata, Instant now)
        throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (ValidatedRecord record : records) {
            rows.add(toJsonRow(record));
        }
        Object payload = rows;
        if (includeMetadata) {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("export_info", exportInfo("json", records.size(), now));
            envelope.put("records", rows);
            payload = envelope;
        }
        objectMapper.writeValue(out, payload);
    }

    private void writeCsv(OutputStream out, List<ValidatedRecord> records, boolean includeMetadata, Instant now)
        throws IOException {
        CSVFormat.Builder format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER);
        if (includeMetadata) {
            Map<String, Object> info = exportInfo("csv", records.size(), now);
            List<String> comments = new ArrayList<>();
            info.forEach((key, value) -> comments.add(key + ": " + value));
            format.setCommentMarker('#').setHeaderComments(comments.toArray());
        }
        Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        try (CSVPrinter printer = new CSVPrinter(writer, format.build())) {
            for (ValidatedRecord record : records) {
                CanonicalRecord canonical = record.record();
                DramaAttributes attributes = canonical.attributes();
                printer.printRecord(
                    canonical.dedupKey(),
                    attributes.title(),
                    attributes.year(),
                    attributes.rating(),
                    String.join("|", attributes.genres()),
                    attributes.synopsis(),
                    attributes.episodes(),
                    String.join("|", attributes.directors()),
                    String.join("|", attributes.casts()),
                    String.join("|", attributes.tags()),
                    String.join("|", canonical.sources()),
                    canonical.completenessScore(),
                    record.validation() == null ? null : record.qualityScore()
                );
            }
        }
    }

    private Map<String, Object> toJsonRow(ValidatedRecord record) {
        CanonicalRecord canonical = record.record();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("dedup_key", canonical.dedupKey());
        row.putAll(canonical.attributes().toMap());
        row.put("sources", canonical.sources());
        Map<String, String> provenance = new LinkedHashMap<>();
        canonical.provenance().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> provenance.put(entry.getKey().key(), entry.getValue()));
        row.put("provenance", provenance);
        row.put("completeness_score", canonical.completenessScore());
        if (record.validation() != null) {
            row.put("quality_score", record.qualityScore());
            row.put("issues", record.validation().issues());
        }
        return row;
    }

    private Map<String, Object> exportInfo(String format, int count, Instant now) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("timestamp", now.toString());
        info.put("format", format);
        info.put("record_count", count);
        info.put("schema_version", SCHEMA_VERSION);
        info.put("exported_by", "drama-collector");
        return info;
    }

    private static OutputStream open(Path path, boolean compress) throws IOException {
        return wrap(Files.newOutputStream(path), compress);
    }

    /**
     * Applies gzip on top of {@code out}. If the gzip header cannot be written, {@code out} is
     * closed before the failure propagates.
     */
    static OutputStream wrap(OutputStream out, boolean compress) throws IOException {
        if (!compress) {
            return out;
        }
        try {
            return new GZIPOutputStream(out);
        } catch (IOException | RuntimeException e) {
            try {
                out.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to remove partial export {}", path, e);
        }
    }
}
