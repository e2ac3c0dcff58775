package com.dramacollector.collect.aggregate;

import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.DramaField;
import com.dramacollector.collect.model.RawRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordMergerTest {
    private final RecordMerger merger = new RecordMerger(new CompletenessScorer(0.05));

    @Test
    void higherPrioritySourceWinsEachFieldItHas() {
        ToIntFunction<String> priorities = priorities(Map.of("douban", 1, "mydramalist", 2));
        RawRecord secondary = new RawRecord("mydramalist", "m1", DramaAttributes.builder()
            .title("Flash Marriage")
            .year(2024)
            .rating(9.1)
            .synopsis("A hasty wedding turns into something real.")
            .build());
        RawRecord primary = new RawRecord("douban", "d1", DramaAttributes.builder()
            .title("闪婚")
            .year(2024)
            .rating(8.2)
            .build());

        CanonicalRecord merged = merger.merge("闪婚|2024", List.of(secondary, primary), priorities);

        assertThat(merged.attributes().title()).isEqualTo("闪婚");
        assertThat(merged.attributes().rating()).isEqualTo(8.2);
        assertThat(merged.attributes().synopsis()).startsWith("A hasty wedding");
        assertThat(merged.provenance())
            .containsEntry(DramaField.TITLE, "douban")
            .containsEntry(DramaField.RATING, "douban")
            .containsEntry(DramaField.SYNOPSIS, "mydramalist")
            .doesNotContainKey(DramaField.GENRES);
        assertThat(merged.sources()).containsExactly("douban", "mydramalist");
    }

    @Test
    void equalPriorityPrefersTheLargerValueThenFirstSeen() {
        ToIntFunction<String> priorities = name -> 1;
        RawRecord first = new RawRecord("a", "1", DramaAttributes.builder()
            .title("Same")
            .synopsis("short one")
            .genres(List.of("都市"))
            .build());
        RawRecord second = new RawRecord("b", "2", DramaAttributes.builder()
            .title("Same")
            .synopsis("a noticeably longer synopsis")
            .genres(List.of("古装"))
            .build());

        CanonicalRecord merged = merger.merge("same|", List.of(first, second), priorities);

        assertThat(merged.attributes().synopsis()).isEqualTo("a noticeably longer synopsis");
        assertThat(merged.provenance().get(DramaField.SYNOPSIS)).isEqualTo("b");
        assertThat(merged.attributes().genres()).containsExactly("都市");
        assertThat(merged.provenance().get(DramaField.GENRES)).isEqualTo("a");
        assertThat(merged.provenance().get(DramaField.TITLE)).isEqualTo("a");
    }

    @Test
    void duplicateRecordsFromOneSourceListItOnce() {
        ToIntFunction<String> priorities = name -> 3;
        RawRecord one = new RawRecord("mock", "1", DramaAttributes.builder().title("X").build());
        RawRecord two = new RawRecord("mock", "2", DramaAttributes.builder().title("X").episodes(12).build());

        CanonicalRecord merged = merger.merge("x|", List.of(one, two), priorities);

        assertThat(merged.sources()).containsExactly("mock");
        assertThat(merged.attributes().episodes()).isEqualTo(12);
        assertThat(merged.completenessScore()).isEqualTo(2.0 / 9.0);
    }

    @Test
    void emptyGroupIsRejected() {
        assertThatThrownBy(() -> merger.merge("k", List.of(), name -> 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergingTheSameContributorsAgainGivesTheSameRecord() {
        ToIntFunction<String> priorities = priorities(Map.of("douban", 1, "mydramalist", 2, "mock", 3));
        RawRecord douban = new RawRecord("douban", "d1", DramaAttributes.builder()
            .title("重生之娱乐圈女王")
            .year(2023)
            .rating(7.9)
            .build());
        RawRecord web = new RawRecord("mydramalist", "m1", DramaAttributes.builder()
            .title("Rebirth Queen")
            .year(2023)
            .genres(List.of("都市", "重生"))
            .episodes(80)
            .build());
        RawRecord mock = new RawRecord("mock", "35267210", DramaAttributes.builder()
            .title("重生之娱乐圈女王")
            .synopsis("被陷害致死的女星重生回到十八岁。")
            .casts(List.of("张雪", "陈昊"))
            .build());

        CanonicalRecord first = merger.merge("重生之娱乐圈女王|2023", List.of(douban, web, mock), priorities);
        CanonicalRecord again = merger.merge("重生之娱乐圈女王|2023", List.of(douban, web, mock), priorities);
        CanonicalRecord reordered = merger.merge("重生之娱乐圈女王|2023", List.of(mock, web, douban), priorities);

        assertThat(again).isEqualTo(first);
        assertThat(reordered.attributes()).isEqualTo(first.attributes());
        assertThat(reordered.provenance()).isEqualTo(first.provenance());
        assertThat(reordered.completenessScore()).isEqualTo(first.completenessScore());
    }

    private static ToIntFunction<String> priorities(Map<String, Integer> byName) {
        return name -> byName.getOrDefault(name, Integer.MAX_VALUE);
    }
}
