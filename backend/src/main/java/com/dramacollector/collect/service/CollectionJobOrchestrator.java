package com.dramacollector.collect.service;

import com.dramacollector.collect.aggregate.AggregatorTotalFailureException;
import com.dramacollector.collect.aggregate.MultiSourceAggregator;
import com.dramacollector.collect.export.ExportFailureException;
import com.dramacollector.collect.export.RecordExporter;
import com.dramacollector.collect.model.AggregationResult;
import com.dramacollector.collect.model.CanonicalRecord;
import com.dramacollector.collect.model.ExportFileInfo;
import com.dramacollector.collect.model.ExportOptions;
import com.dramacollector.collect.model.JobError;
import com.dramacollector.collect.model.JobRequest;
import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobState;
import com.dramacollector.collect.model.JobTrigger;
import com.dramacollector.collect.model.SourceError;
import com.dramacollector.collect.model.ValidatedRecord;
import com.dramacollector.collect.model.ValidationResult;
import com.dramacollector.collect.persistence.DramaRecordStore;
import com.dramacollector.collect.persistence.StoreUnavailableException;
import com.dramacollector.collect.validation.RecordValidator;
import com.dramacollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Drives collection jobs through collecting, processing, storing and exporting. A semaphore
 * caps the number of non-terminal jobs; a request that finds it full is rejected without
 * creating a job.
 */
@Service
public class CollectionJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CollectionJobOrchestrator.class);

    private final MultiSourceAggregator aggregator;
    private final RecordValidator validator;
    private final DramaRecordStore store;
    private final RecordExporter exporter;
    private final CollectorProperties properties;
    private final ExecutorService jobExecutor;
    private final Clock clock;
    private final List<JobStatusListener> listeners;
    private final Semaphore gate;
    private final JobHistory history;
    private final Object lock = new Object();
    private final Map<String, CollectionJob> active = new LinkedHashMap<>();

    public CollectionJobOrchestrator(
        MultiSourceAggregator aggregator,
        RecordValidator validator,
        DramaRecordStore store,
        RecordExporter exporter,
        CollectorProperties properties,
        @Qualifier("jobExecutor") ExecutorService jobExecutor,
        Clock clock,
        List<JobStatusListener> listeners
    ) {
        this.aggregator = aggregator;
        this.validator = validator;
        this.store = store;
        this.exporter = exporter;
        this.properties = properties;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.gate = new Semaphore(properties.getProcessing().getMaxConcurrentJobs());
        this.history = new JobHistory(properties.getHistory().getMaxJobs());
    }

    public String start(JobTrigger trigger, int requestedCount, boolean exportEnabled, double qualityThreshold) {
        return submit(new JobRequest(trigger, requestedCount, exportEnabled, qualityThreshold)).jobId();
    }

    public JobTicket submit(JobRequest request) {
        if (!gate.tryAcquire()) {
            throw new JobAlreadyRunningException(
                "a collection job is already running (max " + properties.getProcessing().getMaxConcurrentJobs() + ")"
            );
        }
        CollectionJob job = new CollectionJob(UUID.randomUUID().toString(), request, clock.instant());
        CompletableFuture<JobSnapshot> completion = new CompletableFuture<>();
        synchronized (lock) {
            active.put(job.id(), job);
            history.add(job);
        }
        log.info(
            "Job {} created: trigger={}, requested={}, export={}, threshold={}, attempt={}",
            job.id(),
            request.trigger(),
            request.requestedCount(),
            request.exportEnabled(),
            request.qualityThreshold(),
            request.attempt()
        );
        try {
            jobExecutor.submit(() -> runJob(job, completion));
        } catch (RejectedExecutionException e) {
            log.warn("Job {} rejected by executor", job.id(), e);
            job.addError(new JobError("orchestrator", "executor_rejected", clock.instant()));
            finish(job, job.fail(clock.instant()), completion);
        }
        return new JobTicket(job.id(), completion);
    }

    public Optional<JobSnapshot> current() {
        synchronized (lock) {
            CollectionJob latest = null;
            for (CollectionJob job : active.values()) {
                latest = job;
            }
            return latest == null ? Optional.empty() : Optional.of(latest.snapshot());
        }
    }

    public List<JobSnapshot> activeJobs() {
        synchronized (lock) {
            return active.values().stream().map(CollectionJob::snapshot).toList();
        }
    }

    public List<JobSnapshot> history(int limit) {
        return history.recent(Math.max(0, limit));
    }

    /**
     * Requests cooperative cancellation of every active job.
     *
     * @return the number of jobs signalled
     */
    public int stop() {
        List<CollectionJob> targets;
        synchronized (lock) {
            targets = new ArrayList<>(active.values());
        }
        for (CollectionJob job : targets) {
            job.requestCancel();
            log.info("Cancellation requested for job {}", job.id());
        }
        return targets.size();
    }

    public boolean cancel(String jobId) {
        CollectionJob job;
        synchronized (lock) {
            job = active.get(jobId);
        }
        if (job == null) {
            return false;
        }
        job.requestCancel();
        log.info("Cancellation requested for job {}", jobId);
        return true;
    }

    public int maintenance(Instant now) {
        int removed = history.prune(now, Duration.ofHours(properties.getHistory().getRetentionHours()));
        log.info("History maintenance removed {} jobs, {} remain", removed, history.size());
        return removed;
    }

    public int availableSlots() {
        return gate.availablePermits();
    }

    private void runJob(CollectionJob job, CompletableFuture<JobSnapshot> completion) {
        JobState previous;
        try {
            runStages(job);
            previous = null;
        } catch (JobCancelledException e) {
            job.markCancelled(clock.instant());
            previous = job.fail(clock.instant());
        } catch (AggregatorTotalFailureException e) {
            log.warn("Job {} collection failed: {}", job.id(), e.getMessage());
            copySourceErrors(job, e.getErrors());
            job.addError(new JobError("aggregator", e.getMessage(), clock.instant()));
            previous = failOrCancel(job);
        } catch (StoreUnavailableException e) {
            log.warn("Job {} store failed after {} rows", job.id(), e.getWritten(), e);
            job.recordStored(e.getWritten());
            job.addError(new JobError("store", e.getMessage(), clock.instant()));
            previous = failOrCancel(job);
        } catch (ExportFailureException e) {
            log.warn("Job {} export failed", job.id(), e);
            job.addError(new JobError("exporter", e.getMessage(), clock.instant()));
            previous = failOrCancel(job);
        } catch (Exception e) {
            log.warn("Job {} failed unexpectedly", job.id(), e);
            job.addError(new JobError("orchestrator", "unexpected_error: " + e.getMessage(), clock.instant()));
            previous = failOrCancel(job);
        }
        finish(job, previous, completion);
    }

    private void runStages(CollectionJob job) {
        JobRequest request = job.request();
        checkCancelled(job);
        advance(job, JobState.COLLECTING);
        AggregationResult result = aggregator.collect(request.requestedCount(), job.cancellation());
        copySourceErrors(job, result.errors());
        job.recordCollected(result.records().size());

        checkCancelled(job);
        advance(job, JobState.PROCESSING);
        List<ValidatedRecord> kept = new ArrayList<>();
        for (CanonicalRecord record : result.records()) {
            ValidationResult validation = validator.validate(record);
            if (validation.isValid() && validation.qualityScore() >= request.qualityThreshold()) {
                kept.add(new ValidatedRecord(record, validation));
            }
        }
        job.recordProcessed(kept.size(), result.records().size() - kept.size());

        checkCancelled(job);
        advance(job, JobState.STORING);
        job.recordStored(store.upsert(job.id(), kept));

        if (request.exportEnabled()) {
            checkCancelled(job);
            advance(job, JobState.EXPORTING);
            CollectorProperties.Export settings = properties.getExport();
            ExportOptions options = new ExportOptions(
                "dramas_" + job.id().substring(0, 8),
                settings.isCompress(),
                settings.isIncludeMetadata()
            );
            List<ExportFileInfo> files = exporter.export(kept, settings.getFormats(), options);
            job.addExports(files);
        }
        advance(job, JobState.COMPLETED);
    }

    private void advance(CollectionJob job, JobState next) {
        JobState previous = job.advance(next, clock.instant());
        notifyListeners(job.snapshot(), previous);
    }

    private void checkCancelled(CollectionJob job) {
        if (job.isCancelRequested()) {
            throw new JobCancelledException();
        }
    }

    private JobState failOrCancel(CollectionJob job) {
        if (job.isCancelRequested()) {
            job.markCancelled(clock.instant());
        }
        return job.fail(clock.instant());
    }

    private void finish(CollectionJob job, JobState previous, CompletableFuture<JobSnapshot> completion) {
        synchronized (lock) {
            active.remove(job.id());
        }
        gate.release();
        JobSnapshot snapshot = job.snapshot();
        if (previous != null) {
            notifyListeners(snapshot, previous);
        }
        completion.complete(snapshot);
    }

    private void copySourceErrors(CollectionJob job, List<SourceError> errors) {
        for (SourceError error : errors) {
            job.addError(new JobError(
                error.source(),
                error.kind().name().toLowerCase(Locale.ROOT) + ": " + error.message(),
                error.timestamp()
            ));
        }
    }

    private void notifyListeners(JobSnapshot snapshot, JobState previous) {
        for (JobStatusListener listener : listeners) {
            try {
                listener.onStateChange(snapshot, previous);
            } catch (Exception e) {
                log.warn("Job status listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private static final class JobCancelledException extends RuntimeException {
        private JobCancelledException() {
            super("job_cancelled");
        }
    }
}
