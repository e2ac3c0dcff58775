package com.dramacollector.collect.source;

import com.dramacollector.collect.http.SourceHttpClient;
import com.dramacollector.config.CollectorProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;

class SourceRegistryTest {

    @Test
    void buildsConfiguredSourcesSortedByPriority() {
        CollectorProperties properties = new CollectorProperties();
        properties.getSources().put("mock", source("mock", 3, true));
        properties.getSources().put("mydramalist", source("web", 2, true));
        properties.getSources().put("douban", source("api", 1, false));
        properties.getSources().put("imdb", source("graphql", 0, true));

        SourceRegistry registry = new SourceRegistry(
            properties,
            SourceRegistry.defaultFactories(Mockito.mock(SourceHttpClient.class), new ObjectMapper())
        );

        assertThat(registry.all()).extracting(RegisteredSource::name).containsExactly("douban", "mydramalist", "mock");
        assertThat(registry.enabled()).extracting(RegisteredSource::name).containsExactly("mydramalist", "mock");
        assertThat(registry.find("douban")).get().extracting(RegisteredSource::source).isInstanceOf(ApiDramaSource.class);
        assertThat(registry.find("mydramalist")).get().extracting(RegisteredSource::source).isInstanceOf(WebDramaSource.class);
        assertThat(registry.find("mock")).get().extracting(RegisteredSource::source).isInstanceOf(MockDramaSource.class);
        assertThat(registry.find("imdb")).isEmpty();
    }

    @Test
    void typeMatchingIgnoresCase() {
        CollectorProperties properties = new CollectorProperties();
        properties.getSources().put("fallback", source(" MOCK ", 5, true));

        SourceRegistry registry = new SourceRegistry(
            properties,
            SourceRegistry.defaultFactories(Mockito.mock(SourceHttpClient.class), new ObjectMapper())
        );

        assertThat(registry.find("fallback")).get().satisfies(registered -> {
            assertThat(registered.descriptor().type()).isEqualTo("mock");
            assertThat(registered.priority()).isEqualTo(5);
        });
    }

    private static CollectorProperties.Source source(String type, int priority, boolean enabled) {
        CollectorProperties.Source source = new CollectorProperties.Source();
        source.setType(type);
        source.setBaseUrl("https://example.invalid");
        source.setPriority(priority);
        source.setEnabled(enabled);
        return source;
    }
}
