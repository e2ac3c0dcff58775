package com.dramacollector.collect.aggregate;

import com.dramacollector.collect.model.AggregationResult;
import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.RawRecord;
import com.dramacollector.collect.model.SourceError;
import com.dramacollector.collect.model.SourceErrorKind;
import com.dramacollector.collect.source.RegisteredSource;
import com.dramacollector.collect.source.SourceException;
import com.dramacollector.collect.source.SourceExhaustedException;
import com.dramacollector.collect.source.SourceRegistry;
import com.dramacollector.collect.source.SourceUnavailableException;
import com.dramacollector.collect.util.Sleeper;
import com.dramacollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.ToIntFunction;

/**
 * Fans a fetch out to every enabled source, retries transient failures with exponential
 * backoff, then deduplicates and merges the results into scored canonical records.
 *
 * <p>Sources fail independently. Their errors come back as data; only a run in which every
 * source failed raises {@link AggregatorTotalFailureException}.
 */
@Service
public class MultiSourceAggregator {
    private static final Logger log = LoggerFactory.getLogger(MultiSourceAggregator.class);

    private final SourceRegistry registry;
    private final CollectorProperties properties;
    private final ExecutorService sourceExecutor;
    private final ExecutorService sourceCallExecutor;
    private final Sleeper sleeper;
    private final Clock clock;

    public MultiSourceAggregator(
        SourceRegistry registry,
        CollectorProperties properties,
        @Qualifier("sourceExecutor") ExecutorService sourceExecutor,
        @Qualifier("sourceCallExecutor") ExecutorService sourceCallExecutor,
        Sleeper sleeper,
        Clock clock
    ) {
        this.registry = registry;
        this.properties = properties;
        this.sourceExecutor = sourceExecutor;
        this.sourceCallExecutor = sourceCallExecutor;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public AggregationResult collect(int requestedCount) {
        return collect(requestedCount, new CancellationToken());
    }

    public AggregationResult collect(int requestedCount, CancellationToken cancellation) {
        return collect(requestedCount, registry.enabled(), cancellation);
    }

    public AggregationResult collect(int requestedCount, List<RegisteredSource> candidates, CancellationToken cancellation) {
        int count = Math.max(1, requestedCount);
        List<RegisteredSource> sources = candidates.stream()
            .filter(source -> source.descriptor().enabled())
            .sorted(Comparator.comparingInt(RegisteredSource::priority))
            .toList();
        if (sources.isEmpty()) {
            throw new AggregatorTotalFailureException("no enabled sources", List.of());
        }

        List<CompletableFuture<SourceOutcome>> futures = new ArrayList<>();
        for (RegisteredSource source : sources) {
            futures.add(CompletableFuture.supplyAsync(() -> fetchWithRetry(source, count, cancellation), sourceExecutor));
        }

        List<SourceOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            RegisteredSource source = sources.get(i);
            try {
                outcomes.add(futures.get(i).join());
            } catch (CompletionException e) {
                log.warn("Fetch task for source {} failed unexpectedly", source.name(), e.getCause());
                outcomes.add(SourceOutcome.failed(source, sourceError(source, SourceErrorKind.UNAVAILABLE, describe(e.getCause()), 1)));
            }
        }

        List<SourceError> errors = new ArrayList<>();
        boolean anySucceeded = false;
        for (SourceOutcome outcome : outcomes) {
            if (outcome.error() != null) {
                errors.add(outcome.error());
            } else {
                anySucceeded = true;
            }
        }
        if (!anySucceeded) {
            throw new AggregatorTotalFailureException("all " + sources.size() + " sources failed", errors);
        }

        if (properties.getAggregation().isEnrichDetails()) {
            for (SourceOutcome outcome : outcomes) {
                if (outcome.error() == null && !cancellation.isCancelled()) {
                    enrich(outcome, errors);
                }
            }
        }

        Map<String, Integer> rawCounts = new LinkedHashMap<>();
        List<RawRecord> allRecords = new ArrayList<>();
        for (SourceOutcome outcome : outcomes) {
            rawCounts.put(outcome.source().name(), outcome.records().size());
            allRecords.addAll(outcome.records());
        }

        List<CanonicalRecord> merged = mergeAll(allRecords, priorityLookup(sources));
        List<CanonicalRecord> result = merged.size() > count ? merged.subList(0, count) : merged;
        log.info(
            "Aggregated {} canonical records from {} raw (requested={}, sources={}, errors={})",
            result.size(),
            allRecords.size(),
            count,
            rawCounts,
            errors.size()
        );
        return new AggregationResult(result, errors, rawCounts);
    }

    List<CanonicalRecord> mergeAll(List<RawRecord> records, ToIntFunction<String> priorityOf) {
        List<String> keys = DedupKeyNormalizer.assignKeys(records);
        Map<String, List<RawRecord>> groups = new LinkedHashMap<>();
        for (int i = 0; i < records.size(); i++) {
            groups.computeIfAbsent(keys.get(i), ignored -> new ArrayList<>()).add(records.get(i));
        }
        RecordMerger merger = new RecordMerger(new CompletenessScorer(properties.getAggregation().getCorroborationBonus()));
        List<CanonicalRecord> merged = new ArrayList<>(groups.size());
        groups.forEach((key, members) -> merged.add(merger.merge(key, members, priorityOf)));
        // List.sort is stable, so equal scores keep first-seen order.
        merged.sort(Comparator.comparingDouble(CanonicalRecord::completenessScore).reversed());
        return merged;
    }

    private SourceOutcome fetchWithRetry(RegisteredSource source, int count, CancellationToken cancellation) {
        RetryState retry = new RetryState(BackoffPolicy.of(
            source.descriptor(),
            Duration.ofMillis(properties.getAggregation().getMaxRetryDelayMs())
        ));
        while (true) {
            if (cancellation.isCancelled()) {
                return SourceOutcome.failed(source, sourceError(source, SourceErrorKind.CANCELLED, "job_cancelled", retry.attempts()));
            }
            retry.beginAttempt();
            try {
                List<RawRecord> records = callWithTimeout(source, () -> source.source().fetchList(count));
                log.info("Source {} returned {} records", source.name(), records.size());
                return SourceOutcome.succeeded(source, records);
            } catch (SourceExhaustedException e) {
                log.info("Source {} exhausted with {} of {} records", source.name(), e.getPartialRecords().size(), count);
                return SourceOutcome.succeeded(source, e.getPartialRecords());
            } catch (SourceException e) {
                if (!e.isRetryable()) {
                    log.warn("Source {} rejected the request: {}", source.name(), e.getMessage());
                    return SourceOutcome.failed(source, sourceError(source, SourceErrorKind.REJECTED, e.getMessage(), retry.attempts()));
                }
                if (!retry.canRetry()) {
                    log.warn("Source {} unavailable after {} attempts: {}", source.name(), retry.attempts(), e.getMessage());
                    return SourceOutcome.failed(source, sourceError(source, SourceErrorKind.UNAVAILABLE, e.getMessage(), retry.attempts()));
                }
                Duration delay = retry.nextDelay();
                log.debug("Retrying source {} in {}ms after attempt {}: {}", source.name(), delay.toMillis(), retry.attempts(), e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    return SourceOutcome.failed(source, sourceError(source, SourceErrorKind.CANCELLED, "interrupted", retry.attempts()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return SourceOutcome.failed(source, sourceError(source, SourceErrorKind.CANCELLED, "interrupted", retry.attempts()));
            }
        }
    }

    private void enrich(SourceOutcome outcome, List<SourceError> errors) {
        RegisteredSource source = outcome.source();
        List<RawRecord> enriched = new ArrayList<>(outcome.records().size());
        for (RawRecord record : outcome.records()) {
            try {
                RawRecord detail = callWithTimeout(source, () -> source.source().fetchDetail(record.sourceId()));
                enriched.add(record.withAttributes(record.attributes().overlay(detail.attributes())));
            } catch (SourceException e) {
                log.warn("Detail fetch for {}/{} failed: {}", source.name(), record.sourceId(), e.getMessage());
                errors.add(sourceError(source, SourceErrorKind.DETAIL_FAILED, record.sourceId() + ": " + e.getMessage(), 1));
                enriched.add(record);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                enriched.add(record);
            }
        }
        outcome.records().clear();
        outcome.records().addAll(enriched);
    }

    private <T> T callWithTimeout(RegisteredSource source, SourceCall<T> call) throws SourceException, InterruptedException {
        Duration timeout = source.descriptor().timeout();
        Future<T> future = sourceCallExecutor.submit(call::call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // Abandoned rather than interrupted; the limiter token is already spent.
            future.cancel(false);
            throw new SourceUnavailableException(source.name(), "timeout after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SourceException sourceException) {
                throw sourceException;
            }
            if (cause instanceof InterruptedException interruptedException) {
                throw interruptedException;
            }
            throw new SourceUnavailableException(source.name(), "unexpected_error: " + describe(cause), cause);
        }
    }

    private SourceError sourceError(RegisteredSource source, SourceErrorKind kind, String message, int attempts) {
        return new SourceError(source.name(), kind, message, clock.instant(), Math.max(0, attempts));
    }

    private static ToIntFunction<String> priorityLookup(List<RegisteredSource> sources) {
        Map<String, Integer> priorities = new HashMap<>();
        for (RegisteredSource source : sources) {
            priorities.put(source.name(), source.priority());
        }
        return name -> priorities.getOrDefault(name, Integer.MAX_VALUE);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    @FunctionalInterface
    private interface SourceCall<T> {
        T call() throws SourceException, InterruptedException;
    }

    private record SourceOutcome(RegisteredSource source, List<RawRecord> records, SourceError error) {
        static SourceOutcome succeeded(RegisteredSource source, List<RawRecord> records) {
            return new SourceOutcome(source, new ArrayList<>(records), null);
        }

        static SourceOutcome failed(RegisteredSource source, SourceError error) {
            return new SourceOutcome(source, new ArrayList<>(), error);
        }
    }
}
