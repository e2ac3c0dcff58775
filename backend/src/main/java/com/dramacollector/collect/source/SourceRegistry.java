package com.dramacollector.collect.source;

import com.dramacollector.collect.http.SourceHttpClient;
import com.dramacollector.collect.model.SourceDescriptor;
import com.dramacollector.collect.ratelimit.TokenBucketRateLimiter;
import com.dramacollector.config.CollectorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds one adapter per configured source. Adapter types map to factories, so adding a
 * source type means registering a factory here and nothing else.
 */
@Component
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final List<RegisteredSource> sources;

    @Autowired
    public SourceRegistry(CollectorProperties properties, SourceHttpClient httpClient, ObjectMapper objectMapper) {
        this(properties, defaultFactories(httpClient, objectMapper));
    }

    SourceRegistry(CollectorProperties properties, Map<String, SourceAdapterFactory> factories) {
        List<RegisteredSource> built = new ArrayList<>();
        for (Map.Entry<String, CollectorProperties.Source> entry : properties.getSources().entrySet()) {
            SourceDescriptor descriptor = SourceDescriptor.from(entry.getKey(), entry.getValue());
            SourceAdapterFactory factory = factories.get(descriptor.type());
            if (factory == null) {
                log.warn("Skipping source {} with unknown type {}", descriptor.name(), descriptor.type());
                continue;
            }
            TokenBucketRateLimiter limiter = "mock".equals(descriptor.type())
                ? TokenBucketRateLimiter.unlimited()
                : new TokenBucketRateLimiter(descriptor.rateLimit(), descriptor.burst());
            built.add(new RegisteredSource(descriptor, factory.create(descriptor, entry.getValue(), limiter)));
        }
        this.sources = sortByPriority(built);
        log.info("Registered {} sources: {}", sources.size(), sources.stream().map(RegisteredSource::name).toList());
    }

    public SourceRegistry(List<RegisteredSource> sources) {
        this.sources = sortByPriority(sources);
    }

    public static Map<String, SourceAdapterFactory> defaultFactories(SourceHttpClient httpClient, ObjectMapper objectMapper) {
        Map<String, SourceAdapterFactory> factories = new LinkedHashMap<>();
        factories.put("api", (descriptor, settings, limiter) -> new ApiDramaSource(
            descriptor,
            settings.getBaseUrl(),
            settings.getApiKey(),
            httpClient,
            limiter,
            objectMapper
        ));
        factories.put("web", (descriptor, settings, limiter) -> new WebDramaSource(
            descriptor,
            settings.getBaseUrl(),
            settings.getMaxPages(),
            httpClient,
            limiter
        ));
        factories.put("mock", (descriptor, settings, limiter) -> new MockDramaSource(descriptor, limiter));
        return factories;
    }

    public List<RegisteredSource> all() {
        return sources;
    }

    public List<RegisteredSource> enabled() {
        return sources.stream().filter(source -> source.descriptor().enabled()).toList();
    }

    public Optional<RegisteredSource> find(String name) {
        return sources.stream().filter(source -> source.name().equals(name)).findFirst();
    }

    private static List<RegisteredSource> sortByPriority(List<RegisteredSource> sources) {
        List<RegisteredSource> sorted = new ArrayList<>(sources);
        sorted.sort(Comparator.comparingInt(RegisteredSource::priority));
        return List.copyOf(sorted);
    }
}
