package com.dramacollector.collect.source;

import com.dramacollector.collect.http.SourceHttpClient;
import com.dramacollector.collect.model.RawRecord;
import com.dramacollector.collect.model.SourceDescriptor;
import com.dramacollector.collect.ratelimit.TokenBucketRateLimiter;
import com.dramacollector.config.CollectorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiDramaSourceTest {
    private static final String TWO_SUBJECTS = """
        {"count": 3, "start": 0, "total": 2, "subjects": [
          {"id": "101", "title": "闪婚后大佬他宠我", "year": "2024",
           "rating": {"average": 8.3, "max": 10}, "genres": ["都市", "爱情"],
           "episodes_count": 80, "directors": [{"name": "陈导"}], "casts": [{"name": "演员甲"}, {"name": "演员乙"}]},
          {"id": "102", "title": "逆天改命", "year": 2023, "rating": {"average": 0}}
        ]}
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private ApiDramaSource source;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        CollectorProperties properties = new CollectorProperties();
        properties.setRequestTimeoutSeconds(5);
        SourceHttpClient httpClient = new SourceHttpClient(properties, executor);
        SourceDescriptor descriptor = new SourceDescriptor(
            "douban", "api", 1, 0, 1, 0, Duration.ZERO, Duration.ofSeconds(5), true
        );
        source = new ApiDramaSource(
            descriptor,
            server.url("/v2/").toString(),
            "secret-key",
            httpClient,
            TokenBucketRateLimiter.unlimited(),
            new ObjectMapper()
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void shortListingRaisesExhaustedWithWhatWasFound() throws Exception {
        server.enqueue(json(200, TWO_SUBJECTS));

        assertThatThrownBy(() -> source.fetchList(3))
            .isInstanceOfSatisfying(SourceExhaustedException.class, exhausted -> {
                assertThat(exhausted.getRequested()).isEqualTo(3);
                assertThat(exhausted.getPartialRecords()).extracting(RawRecord::sourceId).containsExactly("101", "102");
            });

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).startsWith("/v2/movie/search?q=");
        assertThat(request.getPath()).contains("start=0", "count=3", "apikey=secret-key");
        assertThat(request.getHeader("User-Agent")).isEqualTo(CollectorProperties.normalizeUserAgent(null));
    }

    @Test
    void listingParsesNestedFields() throws Exception {
        server.enqueue(json(200, TWO_SUBJECTS));

        List<RawRecord> records = source.fetchList(2);

        RawRecord first = records.get(0);
        assertThat(first.source()).isEqualTo("douban");
        assertThat(first.attributes().title()).isEqualTo("闪婚后大佬他宠我");
        assertThat(first.attributes().year()).isEqualTo(2024);
        assertThat(first.attributes().rating()).isEqualTo(8.3);
        assertThat(first.attributes().genres()).containsExactly("都市", "爱情");
        assertThat(first.attributes().episodes()).isEqualTo(80);
        assertThat(first.attributes().directors()).containsExactly("陈导");
        assertThat(first.attributes().casts()).containsExactly("演员甲", "演员乙");
        // A zero average means unrated.
        assertThat(records.get(1).attributes().rating()).isNull();
    }

    @Test
    void detailUsesSubjectEndpoint() throws Exception {
        server.enqueue(json(200, """
            {"id": "101", "title": "闪婚后大佬他宠我", "summary": "  一场意外的闪婚。  ", "tags": ["甜宠", {"name": "豪门"}]}
            """));

        RawRecord detail = source.fetchDetail("101");

        assertThat(detail.attributes().synopsis()).isEqualTo("一场意外的闪婚。");
        assertThat(detail.attributes().tags()).containsExactly("甜宠", "豪门");
        assertThat(server.takeRequest().getPath()).isEqualTo("/v2/movie/subject/101?apikey=secret-key");
    }

    @Test
    void serverErrorIsUnavailable() {
        server.enqueue(json(503, "{}"));

        assertThatThrownBy(() -> source.fetchList(1))
            .isInstanceOf(SourceUnavailableException.class)
            .hasMessageStartingWith("http_5xx");
    }

    @Test
    void forbiddenIsRejected() {
        server.enqueue(json(403, "{\"msg\": \"invalid apikey\"}"));

        assertThatThrownBy(() -> source.fetchList(1))
            .isInstanceOfSatisfying(SourceRejectedException.class, rejected -> {
                assertThat(rejected.isRetryable()).isFalse();
                assertThat(rejected.getSource()).isEqualTo("douban");
            });
    }

    @Test
    void malformedPayloadIsRejected() {
        server.enqueue(json(200, "<html>not json</html>"));

        assertThatThrownBy(() -> source.fetchDetail("101"))
            .isInstanceOf(SourceRejectedException.class)
            .hasMessageContaining("invalid_payload");
    }

    private static MockResponse json(int status, String body) {
        return new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json; charset=utf-8")
            .setBody(body);
    }
}
