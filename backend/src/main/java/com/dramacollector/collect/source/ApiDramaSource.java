package com.dramacollector.collect.source;

import com.dramacollector.collect.http.SourceHttpClient;
import com.dramacollector.collect.model.DramaAttributes;
import com.dramacollector.collect.model.RawRecord;
import com.dramacollector.collect.model.SourceDescriptor;
import com.dramacollector.collect.model.SourceFetchResult;
import com.dramacollector.collect.ratelimit.TokenBucketRateLimiter;
import com.dramacollector.collect.util.SourceFailureClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Douban-style JSON API: paged {@code /movie/search} for listings and
 * {@code /movie/subject/{id}} for details.
 */
public class ApiDramaSource implements DramaSource {
    private static final String ACCEPT_JSON = "application/json, text/plain, */*";
    private static final int PAGE_SIZE = 20;
    private static final String SEARCH_QUERY = "短剧";

    private final SourceDescriptor descriptor;
    private final String baseUrl;
    private final String apiKey;
    private final SourceHttpClient httpClient;
    private final TokenBucketRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public ApiDramaSource(
        SourceDescriptor descriptor,
        String baseUrl,
        String apiKey,
        SourceHttpClient httpClient,
        TokenBucketRateLimiter rateLimiter,
        ObjectMapper objectMapper
    ) {
        this.descriptor = descriptor;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return descriptor.name();
    }

    @Override
    public List<RawRecord> fetchList(int count) throws SourceException, InterruptedException {
        List<RawRecord> records = new ArrayList<>();
        int start = 0;
        while (records.size() < count) {
            int pageSize = Math.min(PAGE_SIZE, count - records.size());
            String url = baseUrl + "/movie/search?q=" + encode(SEARCH_QUERY)
                + "&start=" + start
                + "&count=" + pageSize
                + apiKeyParam();
            JsonNode payload = fetchJson(url);
            JsonNode subjects = payload.path("subjects");
            if (!subjects.isArray() || subjects.isEmpty()) {
                break;
            }
            for (JsonNode subject : subjects) {
                if (records.size() >= count) {
                    break;
                }
                RawRecord record = toRecord(subject);
                if (record != null) {
                    records.add(record);
                }
            }
            if (subjects.size() < pageSize) {
                break;
            }
            start += subjects.size();
        }
        if (records.size() < count) {
            throw new SourceExhaustedException(name(), count, records);
        }
        return records;
    }

    @Override
    public RawRecord fetchDetail(String sourceId) throws SourceException, InterruptedException {
        String url = baseUrl + "/movie/subject/" + encode(sourceId);
        if (apiKey != null && !apiKey.isBlank()) {
            url += "?apikey=" + encode(apiKey);
        }
        RawRecord record = toRecord(fetchJson(url));
        if (record == null) {
            throw new SourceRejectedException(name(), "detail payload for " + sourceId + " has no id");
        }
        return record;
    }

    private JsonNode fetchJson(String url) throws SourceException, InterruptedException {
        SourceFetchResult result = httpClient.get(url, ACCEPT_JSON, descriptor.timeout(), rateLimiter);
        if (!result.isSuccessful()) {
            throw SourceFailureClassifier.toException(name(), result);
        }
        if (result.body() == null || result.body().isBlank()) {
            throw new SourceRejectedException(name(), "empty payload from " + url);
        }
        try {
            return objectMapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new SourceRejectedException(name(), "invalid_payload from " + url, e);
        }
    }

    private RawRecord toRecord(JsonNode node) {
        String id = text(node, "id");
        if (id == null) {
            return null;
        }
        DramaAttributes attributes = DramaAttributes.builder()
            .title(text(node, "title"))
            .year(parseInteger(node.path("year")))
            .rating(parseRating(node.path("rating")))
            .genres(strings(node.path("genres")))
            .synopsis(text(node, "summary"))
            .episodes(parseInteger(node.path("episodes_count")))
            .directors(names(node.path("directors")))
            .casts(names(node.path("casts")))
            .tags(names(node.path("tags")))
            .build();
        return new RawRecord(name(), id, attributes);
    }

    private static Double parseRating(JsonNode rating) {
        JsonNode average = rating.isObject() ? rating.path("average") : rating;
        if (average.isNumber()) {
            return average.asDouble();
        }
        if (average.isTextual()) {
            try {
                return Double.parseDouble(average.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    private static Integer parseInteger(JsonNode node) {
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            String digits = node.asText().replaceAll("[^0-9]", "");
            if (!digits.isEmpty() && digits.length() <= 9) {
                return Integer.parseInt(digits);
            }
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode item : array) {
                if (item.isTextual()) {
                    out.add(item.asText());
                }
            }
        }
        return out;
    }

    private static List<String> names(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode item : array) {
                if (item.isTextual()) {
                    out.add(item.asText());
                } else if (item.hasNonNull("name")) {
                    out.add(item.get("name").asText());
                }
            }
        }
        return out;
    }

    private String apiKeyParam() {
        if (apiKey == null || apiKey.isBlank()) {
            return "";
        }
        return "&apikey=" + encode(apiKey);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
