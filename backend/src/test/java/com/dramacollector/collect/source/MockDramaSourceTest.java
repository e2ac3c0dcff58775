package com.dramacollector.collect.source;

import com.dramacollector.collect.model.RawRecord;
import com.dramacollector.collect.model.SourceDescriptor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockDramaSourceTest {
    private final MockDramaSource source = new MockDramaSource(new SourceDescriptor(
        "mock", "mock", 3, 0, 1, 0, Duration.ZERO, Duration.ofSeconds(5), true
    ));

    @Test
    void listingReturnsCatalogInOrder() throws Exception {
        List<RawRecord> records = source.fetchList(2);

        assertThat(records).extracting(RawRecord::sourceId).containsExactly("35267208", "35267209");
        assertThat(records.get(0).attributes().title()).isEqualTo("霸道总裁爱上我");
        assertThat(records.get(0).attributes().populatedCount()).isEqualTo(9);
    }

    @Test
    void askingForMoreThanTheCatalogIsExhausted() {
        assertThatThrownBy(() -> source.fetchList(8))
            .isInstanceOfSatisfying(SourceExhaustedException.class, exhausted ->
                assertThat(exhausted.getPartialRecords()).hasSize(source.catalogSize()));
    }

    @Test
    void detailForUnknownIdIsRejected() throws Exception {
        assertThat(source.fetchDetail("35267210").attributes().title()).isEqualTo("重生之娱乐圈女王");
        assertThatThrownBy(() -> source.fetchDetail("1"))
            .isInstanceOf(SourceRejectedException.class);
    }
}
