package com.dramacollector.collect.persistence;

import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.StoredDrama;
import com.dramacollector.collect.model.ValidatedRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcDramaStore implements DramaRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcDramaStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final String UPDATE_SQL = """
        UPDATE dramas
        SET title = :title,
            release_year = :year,
            rating = :rating,
            genres = :genres,
            synopsis = :synopsis,
            episodes = :episodes,
            directors = :directors,
            casts = :casts,
            tags = :tags,
            sources = :sources,
            provenance = :provenance,
            completeness_score = :completenessScore,
            quality_score = :qualityScore,
            last_job_id = :jobId,
            updated_at = :now
        WHERE dedup_key = :dedupKey
        """;
    private static final String INSERT_SQL = """
        INSERT INTO dramas (
            dedup_key, title, release_year, rating, genres, synopsis, episodes, directors, casts, tags,
            sources, provenance, completeness_score, quality_score, last_job_id, first_seen_at, updated_at
        )
        VALUES (
            :dedupKey, :title, :year, :rating, :genres, :synopsis, :episodes, :directors, :casts, :tags,
            :sources, :provenance, :completenessScore, :qualityScore, :jobId, :now, :now
        )
        """;
    private static final String SELECT_COLUMNS = """
        SELECT dedup_key, title, release_year, rating, genres, synopsis, episodes, directors, casts, tags,
               sources, provenance, completeness_score, quality_score, last_job_id, first_seen_at, updated_at
        FROM dramas
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RowMapper<StoredDrama> rowMapper = this::mapRow;

    public JdbcDramaStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper, Clock clock) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public int upsert(String jobId, List<ValidatedRecord> records) {
        int written = 0;
        Timestamp now = Timestamp.from(clock.instant());
        try {
            for (ValidatedRecord record : records) {
                MapSqlParameterSource params = toParams(jobId, record, now);
                int updated = jdbc.update(UPDATE_SQL, params);
                if (updated == 0) {
                    try {
                        updated = jdbc.update(INSERT_SQL, params);
                    } catch (DataIntegrityViolationException raced) {
                        updated = jdbc.update(UPDATE_SQL, params);
                        if (updated == 0) {
                            // not a concurrent insert of the same key: the row itself was refused
                            throw raced;
                        }
                    }
                }
                written += updated;
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException(
                "failed to upsert dramas after " + written + " rows: " + e.getMessage(),
                e,
                written
            );
        }
        log.info("Upserted {} dramas for job {}", written, jobId);
        return written;
    }

    @Override
    public List<StoredDrama> findDramas(int limit, String genre) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", Math.max(1, limit));
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS);
        if (genre != null && !genre.isBlank()) {
            sql.append(" WHERE LOWER(genres) LIKE :genrePattern");
            params.addValue("genrePattern", "%\"" + genre.trim().toLowerCase(Locale.ROOT) + "\"%");
        }
        sql.append(" ORDER BY quality_score DESC NULLS LAST, updated_at DESC, dedup_key LIMIT :limit");
        try {
            return jdbc.query(sql.toString(), params, rowMapper);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to query dramas", e);
        }
    }

    @Override
    public Optional<StoredDrama> findByKey(String dedupKey) {
        try {
            List<StoredDrama> rows = jdbc.query(
                SELECT_COLUMNS + " WHERE dedup_key = :dedupKey",
                new MapSqlParameterSource("dedupKey", dedupKey),
                rowMapper
            );
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to load drama " + dedupKey, e);
        }
    }

    @Override
    public long count() {
        try {
            Long count = jdbc.queryForObject("SELECT COUNT(*) FROM dramas", new MapSqlParameterSource(), Long.class);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("failed to count dramas", e);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (DataAccessException e) {
            log.warn("Drama store unreachable: {}", e.getMessage());
            return false;
        }
    }

    private MapSqlParameterSource toParams(String jobId, ValidatedRecord validated, Timestamp now) {
        CanonicalRecord record = validated.record();
        DramaAttributes attributes = record.attributes();
        Map<String, String> provenance = new LinkedHashMap<>();
        record.provenance().entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> provenance.put(entry.getKey().key(), entry.getValue()));
        return new MapSqlParameterSource()
            .addValue("dedupKey", record.dedupKey())
            .addValue("title", attributes.title())
            .addValue("year", attributes.year())
            .addValue("rating", attributes.rating())
            .addValue("genres", toJson(attributes.genres()))
            .addValue("synopsis", attributes.synopsis())
            .addValue("episodes", attributes.episodes())
            .addValue("directors", toJson(attributes.directors()))
            .addValue("casts", toJson(attributes.casts()))
            .addValue("tags", toJson(attributes.tags()))
            .addValue("sources", toJson(record.sources()))
            .addValue("provenance", toJson(provenance))
            .addValue("completenessScore", record.completenessScore())
            .addValue("qualityScore", validated.validation() == null ? null : validated.qualityScore())
            .addValue("jobId", jobId)
            .addValue("now", now);
    }

    private StoredDrama mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new StoredDrama(
            rs.getString("dedup_key"),
            rs.getString("title"),
            rs.getObject("release_year", Integer.class),
            rs.getObject("rating", Double.class),
            fromJson(rs.getString("genres"), STRING_LIST, List.of()),
            rs.getString("synopsis"),
            rs.getObject("episodes", Integer.class),
            fromJson(rs.getString("directors"), STRING_LIST, List.of()),
            fromJson(rs.getString("casts"), STRING_LIST, List.of()),
            fromJson(rs.getString("tags"), STRING_LIST, List.of()),
            fromJson(rs.getString("sources"), STRING_LIST, List.of()),
            fromJson(rs.getString("provenance"), STRING_MAP, Map.of()),
            rs.getDouble("completeness_score"),
            rs.getObject("quality_score", Double.class),
            rs.getString("last_job_id"),
            toInstant(rs.getTimestamp("first_seen_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize " + value, e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable JSON column value: {}", e.getMessage());
            return fallback;
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
