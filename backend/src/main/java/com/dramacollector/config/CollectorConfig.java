package com.dramacollector.config;

import com.dramacollector.collect.util.MonotonicClock;
import com.dramacollector.collect.util.Sleeper;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CollectorConfig {

    @Bean(name = "jobExecutor", destroyMethod = "shutdown")
    public ExecutorService jobExecutor(CollectorProperties properties) {
        return Executors.newFixedThreadPool(
            properties.getProcessing().getMaxConcurrentJobs(),
            namedThreads("collection-job")
        );
    }

    @Bean(name = "sourceExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceExecutor() {
        return Executors.newCachedThreadPool(namedThreads("source-fetch"));
    }

    @Bean(name = "sourceCallExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceCallExecutor() {
        return Executors.newCachedThreadPool(namedThreads("source-call"));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CollectorProperties properties) {
        int size = Math.max(4, properties.getSources().size() * 2);
        return Executors.newFixedThreadPool(size, namedThreads("source-http"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return MonotonicClock.SYSTEM;
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
