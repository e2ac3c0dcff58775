package com.dramacollector.collect.service;

import com.dramacollector.collect.model.JobRequest;
import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobState;
import com.dramacollector.collect.model.JobTrigger;
import com.dramacollector.collect.model.SchedulerStatus;
import com.dramacollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic trigger for scheduled collections. The first tick fires at once; later ones
 * trigger when the collection interval has elapsed. During the maintenance hour (UTC) it
 * prunes job history once per day and starts nothing.
 */
@Service
public class CollectionScheduler {
    private static final Logger log = LoggerFactory.getLogger(CollectionScheduler.class);

    public enum TickOutcome {
        NOT_DUE,
        MAINTENANCE,
        COMPLETED,
        FAILED,
        SKIPPED,
        TIMED_OUT
    }

    private final CollectionJobOrchestrator orchestrator;
    private final CollectorProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;
    private final Object lifecycleLock = new Object();
    private final Object tickLock = new Object();

    private ScheduledExecutorService executor;
    private volatile Instant nextScheduledAt;
    private volatile Instant lastTriggeredAt;
    private volatile String lastJobId;
    private volatile TickOutcome lastOutcome;
    private volatile Instant lastMaintenanceAt;
    private LocalDate lastMaintenanceDate;

    public CollectionScheduler(CollectionJobOrchestrator orchestrator, CollectorProperties properties, Clock clock) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("collection-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            stopRequested = false;
            running.set(true);
            executor.scheduleWithFixedDelay(
                this::safeTick,
                0,
                properties.getScheduler().getTickSeconds(),
                TimeUnit.SECONDS
            );
            log.info(
                "Collection scheduler started: interval={}h, maintenanceHour={} UTC, tick={}s",
                properties.getScheduler().getCollectionIntervalHours(),
                properties.getScheduler().getMaintenanceHour(),
                properties.getScheduler().getTickSeconds()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            stopRequested = true;
            if (executor != null) {
                // a tick waiting on a job keeps waiting; the job itself is left running
                executor.shutdown();
                executor = null;
            }
            log.info("Collection scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(
            running.get(),
            nextScheduledAt,
            lastTriggeredAt,
            lastJobId,
            lastOutcome == null ? null : lastOutcome.name().toLowerCase(Locale.ROOT),
            lastMaintenanceAt
        );
    }

    public TickOutcome tick(Instant now) {
        synchronized (tickLock) {
            CollectorProperties.Scheduler settings = properties.getScheduler();
            ZonedDateTime utc = now.atZone(ZoneOffset.UTC);
            if (utc.getHour() == settings.getMaintenanceHour()) {
                LocalDate today = utc.toLocalDate();
                if (!today.equals(lastMaintenanceDate)) {
                    orchestrator.maintenance(now);
                    lastMaintenanceDate = today;
                    lastMaintenanceAt = now;
                }
                return TickOutcome.MAINTENANCE;
            }
            if (nextScheduledAt != null && now.isBefore(nextScheduledAt)) {
                return TickOutcome.NOT_DUE;
            }
            lastTriggeredAt = now;
            TickOutcome outcome = runScheduledCycle();
            lastOutcome = outcome;
            nextScheduledAt = now.plus(Duration.ofHours(settings.getCollectionIntervalHours()));
            log.info("Scheduled collection finished with {}; next at {}", outcome, nextScheduledAt);
            return outcome;
        }
    }

    private void safeTick() {
        try {
            tick(clock.instant());
        } catch (Exception e) {
            log.warn("Scheduler tick failed", e);
        }
    }

    private TickOutcome runScheduledCycle() {
        CollectorProperties.Scheduler settings = properties.getScheduler();
        JobRequest request = new JobRequest(
            JobTrigger.SCHEDULED,
            settings.getScheduledCount(),
            properties.getExport().isEnabled(),
            properties.getProcessing().getQualityThreshold()
        );
        int retriesLeft = settings.isAutoRetryFailedJobs() ? settings.getScheduledRetryAttempts() : 0;
        while (true) {
            JobTicket ticket;
            try {
                ticket = orchestrator.submit(request);
            } catch (JobAlreadyRunningException e) {
                log.info("Skipping scheduled collection: {}", e.getMessage());
                return TickOutcome.SKIPPED;
            }
            lastJobId = ticket.jobId();
            log.info("Scheduled collection job {} started (attempt {})", ticket.jobId(), request.attempt());

            JobSnapshot result;
            try {
                result = ticket.completion().get(settings.getMaxCollectionDurationHours(), TimeUnit.HOURS);
            } catch (TimeoutException e) {
                log.warn("Scheduled job {} exceeded {}h; cancelling", ticket.jobId(), settings.getMaxCollectionDurationHours());
                orchestrator.cancel(ticket.jobId());
                return TickOutcome.TIMED_OUT;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                orchestrator.cancel(ticket.jobId());
                return TickOutcome.FAILED;
            } catch (ExecutionException e) {
                log.warn("Scheduled job {} completion failed", ticket.jobId(), e.getCause());
                return TickOutcome.FAILED;
            }

            if (result.state() == JobState.COMPLETED) {
                return TickOutcome.COMPLETED;
            }
            if (result.cancelled() || retriesLeft <= 0 || stopRequested) {
                return TickOutcome.FAILED;
            }
            retriesLeft--;
            request = request.nextAttempt();
            log.info("Retrying failed scheduled job {} as attempt {}", ticket.jobId(), request.attempt());
        }
    }
}
