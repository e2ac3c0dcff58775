package com.dramacollector.collect.service;

import com.dramacollector.collect.aggregate.CancellationToken;
import com.dramacollector.collect.model.ExportFileInfo;
import com.dramacollector.collect.model.JobError;
import com.dramacollector.collect.model.JobRequest;
import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mutable job record owned by the orchestrator. All mutation goes through synchronized
 * methods; everyone else sees {@link JobSnapshot} copies.
 */
public class CollectionJob {
    private static final Map<JobState, Set<JobState>> FORWARD = Map.of(
        JobState.IDLE, Set.of(JobState.COLLECTING),
        JobState.COLLECTING, Set.of(JobState.PROCESSING),
        JobState.PROCESSING, Set.of(JobState.STORING),
        JobState.STORING, Set.of(JobState.EXPORTING, JobState.COMPLETED),
        JobState.EXPORTING, Set.of(JobState.COMPLETED)
    );

    private final String id;
    private final JobRequest request;
    private final Instant startTime;
    private final CancellationToken cancellation = new CancellationToken();
    private final List<JobError> errors = new ArrayList<>();
    private final List<ExportFileInfo> exports = new ArrayList<>();
    private final EnumMap<JobState, Long> stageMillis = new EnumMap<>(JobState.class);

    private JobState state = JobState.IDLE;
    private Instant stageStartedAt;
    private Instant endTime;
    private int totalCollected;
    private int totalProcessed;
    private int totalStored;
    private int droppedLowQuality;
    private boolean cancelled;

    public CollectionJob(String id, JobRequest request, Instant startTime) {
        this.id = id;
        this.request = request;
        this.startTime = startTime;
    }

    public String id() {
        return id;
    }

    public JobRequest request() {
        return request;
    }

    public Instant startTime() {
        return startTime;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public synchronized JobState state() {
        return state;
    }

    public synchronized boolean isTerminal() {
        return state.isTerminal();
    }

    public synchronized Instant endTime() {
        return endTime;
    }

    /**
     * Moves forward one stage. COMPLETED also stamps the end time.
     *
     * @return the previous state
     */
    public synchronized JobState advance(JobState next, Instant now) {
        if (next == JobState.ERROR) {
            throw new IllegalArgumentException("use fail() to enter ERROR");
        }
        if (!FORWARD.getOrDefault(state, Set.of()).contains(next)) {
            throw new IllegalStateException("job " + id + " cannot move from " + state + " to " + next);
        }
        JobState previous = state;
        closeStage(now);
        state = next;
        stageStartedAt = now;
        if (next.isTerminal()) {
            endTime = now;
        }
        return previous;
    }

    /**
     * Enters ERROR from any non-terminal state.
     *
     * @return the previous state, or {@code null} when the job had already finished
     */
    public synchronized JobState fail(Instant now) {
        if (state.isTerminal()) {
            return null;
        }
        JobState previous = state;
        closeStage(now);
        state = JobState.ERROR;
        endTime = now;
        return previous;
    }

    public void requestCancel() {
        cancellation.cancel();
    }

    public boolean isCancelRequested() {
        return cancellation.isCancelled();
    }

    public synchronized void markCancelled(Instant now) {
        if (!cancelled) {
            cancelled = true;
            errors.add(new JobError("orchestrator", "job_cancelled", now));
        }
    }

    public synchronized void addError(JobError error) {
        errors.add(error);
    }

    public synchronized void addExports(List<ExportFileInfo> files) {
        exports.addAll(files);
    }

    public synchronized void recordCollected(int count) {
        totalCollected = Math.max(totalCollected, count);
    }

    public synchronized void recordProcessed(int kept, int dropped) {
        totalProcessed = Math.max(totalProcessed, kept);
        droppedLowQuality = Math.max(droppedLowQuality, dropped);
    }

    public synchronized void recordStored(int count) {
        totalStored = Math.max(totalStored, count);
    }

    /**
     * Wall time spent in each working stage, in stage order. The stage in progress is not
     * included until it ends.
     */
    public synchronized Map<String, Long> stageDurationsMs() {
        Map<String, Long> out = new LinkedHashMap<>();
        stageMillis.forEach((stage, millis) -> out.put(stage.name().toLowerCase(Locale.ROOT), millis));
        return out;
    }

    public synchronized JobSnapshot snapshot() {
        return new JobSnapshot(
            id,
            state,
            request.trigger(),
            request.requestedCount(),
            request.exportEnabled(),
            request.qualityThreshold(),
            request.attempt(),
            startTime,
            endTime,
            totalCollected,
            totalProcessed,
            totalStored,
            droppedLowQuality,
            cancelled,
            List.copyOf(errors),
            List.copyOf(exports),
            Collections.unmodifiableMap(stageDurationsMs())
        );
    }

    private void closeStage(Instant now) {
        if (state == JobState.IDLE || state.isTerminal() || stageStartedAt == null) {
            return;
        }
        long millis = Math.max(0, Duration.between(stageStartedAt, now).toMillis());
        stageMillis.merge(state, millis, Long::sum);
    }
}
