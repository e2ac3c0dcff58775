package com.dramacollector.collect.http;

import com.dramacollector.collect.model.SourceFetchResult;
import com.dramacollector.collect.ratelimit.TokenBucketRateLimiter;
import com.dramacollector.config.CollectorProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;

/**
 * Shared HTTP transport for the network-backed sources. Every request first takes a token
 * from the caller's rate limiter; transport failures come back as error results rather
 * than exceptions so callers can classify them.
 */
@Service
public class SourceHttpClient {
    private final CollectorProperties properties;
    private final HttpClient client;

    public SourceHttpClient(
        CollectorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public SourceFetchResult get(
        String url,
        String acceptHeader,
        Duration timeout,
        TokenBucketRateLimiter rateLimiter
    ) throws InterruptedException {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        rateLimiter.acquire();

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        Duration safeTimeout = timeout == null ? Duration.ofSeconds(properties.getRequestTimeoutSeconds()) : timeout;
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(safeTimeout)
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", safeAccept)
            .header("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8")
            .GET()
            .build();
        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            return new SourceFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        }
    }

    private SourceFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new SourceFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
