package com.dramacollector.collect.aggregate;

import com.dramacollector.collect.model.RawRecord;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds dedup keys of the form {@code normalized-title|year}. Titles are NFKC-folded,
 * lower-cased, stripped of punctuation and symbols and whitespace-collapsed, so
 * {@code "霸道总裁：爱上我"} and {@code "霸道总裁 爱上我"} share a key.
 */
public final class DedupKeyNormalizer {
    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{P}\\p{S}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DedupKeyNormalizer() {
    }

    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String folded = Normalizer.normalize(title, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        String stripped = PUNCTUATION.matcher(folded).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    public static String key(String normalizedTitle, Integer year) {
        return normalizedTitle + "|" + (year == null ? "" : year);
    }

    /**
     * Returns one key per record, in input order. A record without a year joins the dated
     * group of the same title only when exactly one such group exists; otherwise it keys on
     * the title alone. Records without a usable title never merge with anything.
     */
    public static List<String> assignKeys(List<RawRecord> records) {
        Map<String, Set<Integer>> yearsByTitle = new HashMap<>();
        for (RawRecord record : records) {
            String title = normalizeTitle(record.attributes().title());
            Integer year = record.attributes().year();
            if (!title.isEmpty() && year != null) {
                yearsByTitle.computeIfAbsent(title, ignored -> new LinkedHashSet<>()).add(year);
            }
        }
        List<String> keys = new ArrayList<>(records.size());
        for (RawRecord record : records) {
            String title = normalizeTitle(record.attributes().title());
            if (title.isEmpty()) {
                keys.add("untitled:" + record.source() + ":" + record.sourceId());
                continue;
            }
            Integer year = record.attributes().year();
            if (year == null) {
                Set<Integer> years = yearsByTitle.get(title);
                if (years != null && years.size() == 1) {
                    year = years.iterator().next();
                }
            }
            keys.add(key(title, year));
        }
        return keys;
    }
}
