package com.dramacollector.collect.persistence;

import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.DramaField;
import com.dramacollector.collect.model.StoredDrama;
import com.dramacollector.collect.model.ValidatedRecord;
import com.dramacollector.collect.model.ValidationResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcDramaStoreTest {

    @Autowired
    private DramaRecordStore store;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void upsertInsertsThenUpdatesByDedupKey() {
        String key = "闪婚总裁" + suffix() + "|2024";
        int inserted = store.upsert("job-1", List.of(validated(key, 8.1, List.of("都市"), 7.5)));
        StoredDrama first = store.findByKey(key).orElseThrow();

        int updated = store.upsert("job-2", List.of(validated(key, 8.4, List.of("都市", "爱情"), 8.0)));

        assertThat(inserted).isEqualTo(1);
        assertThat(updated).isEqualTo(1);
        Integer rows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM dramas WHERE dedup_key = :key",
            new MapSqlParameterSource("key", key),
            Integer.class
        );
        assertThat(rows).isEqualTo(1);

        StoredDrama stored = store.findByKey(key).orElseThrow();
        assertThat(stored.rating()).isEqualTo(8.4);
        assertThat(stored.genres()).containsExactly("都市", "爱情");
        assertThat(stored.qualityScore()).isEqualTo(8.0);
        assertThat(stored.lastJobId()).isEqualTo("job-2");
        assertThat(stored.sources()).containsExactly("douban", "mock");
        assertThat(stored.provenance()).containsEntry("title", "douban").containsEntry("rating", "douban");
        assertThat(stored.firstSeenAt()).isEqualTo(first.firstSeenAt());
        assertThat(stored.updatedAt()).isAfterOrEqualTo(first.updatedAt());
    }

    @Test
    void findDramasFiltersByGenreAndOrdersByQuality() {
        String genre = "genre-" + suffix();
        store.upsert("job-1", List.of(
            validated("low" + suffix() + "|2024", 7.0, List.of(genre), 6.5),
            validated("high" + suffix() + "|2024", 8.0, List.of("都市", genre.toUpperCase()), 9.5),
            validated("other" + suffix() + "|2024", 9.0, List.of("古装"), 9.9)
        ));

        List<StoredDrama> matches = store.findDramas(10, genre);

        assertThat(matches).hasSize(2);
        assertThat(matches).extracting(StoredDrama::qualityScore).containsExactly(9.5, 6.5);
        assertThat(store.findDramas(1, genre)).hasSize(1);
    }

    @Test
    void absentOptionalFieldsReadBackAsEmpty() {
        String key = "sparse" + suffix() + "|";
        CanonicalRecord sparse = new CanonicalRecord(
            key,
            List.of("mock"),
            DramaAttributes.builder().title("Sparse").build(),
            Map.of(DramaField.TITLE, "mock"),
            0.11
        );
        store.upsert("job-1", List.of(new ValidatedRecord(sparse, new ValidationResult(5.0, List.of(), List.of()))));

        StoredDrama stored = store.findByKey(key).orElseThrow();
        assertThat(stored.year()).isNull();
        assertThat(stored.episodes()).isNull();
        assertThat(stored.casts()).isEmpty();
        assertThat(stored.completenessScore()).isEqualTo(0.11);
    }

    @Test
    void refusedRowFailsTheBatchAndReportsRowsAlreadyWritten() {
        String keptKey = "kept" + suffix() + "|2024";
        String refusedKey = "短".repeat(600) + "|2024";

        StoreUnavailableException failure = catchThrowableOfType(
            () -> store.upsert("job-1", List.of(
                validated(keptKey, 7.0, List.of(), 7.0),
                validated(refusedKey, 7.0, List.of(), 7.0)
            )),
            StoreUnavailableException.class
        );

        assertThat(failure).isNotNull();
        assertThat(failure.getWritten()).isEqualTo(1);
        assertThat(failure).hasMessageContaining("after 1 rows");
        assertThat(store.findByKey(keptKey)).isPresent();
    }

    @Test
    void overlongTitleIsNeverDroppedSilently() {
        String key = "long" + suffix() + "|2024";
        CanonicalRecord record = new CanonicalRecord(
            key,
            List.of("mock"),
            DramaAttributes.builder().title("短".repeat(600)).year(2024).build(),
            Map.of(DramaField.TITLE, "mock"),
            0.2
        );

        StoreUnavailableException failure = catchThrowableOfType(
            () -> store.upsert("job-1", List.of(new ValidatedRecord(record, new ValidationResult(7.0, List.of(), List.of())))),
            StoreUnavailableException.class
        );

        assertThat(failure).isNotNull();
        assertThat(failure.getWritten()).isZero();
        assertThat(store.findByKey(key)).isEmpty();
    }

    @Test
    void storeIsReachableAndCounts() {
        long before = store.count();
        store.upsert("job-1", List.of(validated("count" + suffix() + "|2024", 7.0, List.of(), 7.0)));

        assertThat(store.isReachable()).isTrue();
        assertThat(store.count()).isEqualTo(before + 1);
        assertThat(store.findByKey("missing|1999")).isEmpty();
    }

    private static ValidatedRecord validated(String key, double rating, List<String> genres, double quality) {
        CanonicalRecord record = new CanonicalRecord(
            key,
            List.of("douban", "mock"),
            DramaAttributes.builder()
                .title(key.substring(0, key.indexOf('|')))
                .year(2024)
                .rating(rating)
                .genres(genres)
                .build(),
            Map.of(DramaField.TITLE, "douban", DramaField.RATING, "douban", DramaField.GENRES, "mock"),
            0.5
        );
        return new ValidatedRecord(record, new ValidationResult(quality, List.of(), List.of()));
    }

    private static String suffix() {
        return UUID.randomUUID().toString().substring(0, 6);
    }
}
