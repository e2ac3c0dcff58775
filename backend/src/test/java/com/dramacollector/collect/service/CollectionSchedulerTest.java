package com.dramacollector.collect.service;

import com.dramacollector.collect.model.JobRequest;
import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobState;
import com.dramacollector.collect.model.JobTrigger;
import com.dramacollector.config.CollectorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CollectionSchedulerTest {
    private static final Instant MORNING = Instant.parse("2024-06-01T08:00:00Z");

    @Mock
    private CollectionJobOrchestrator orchestrator;

    private CollectorProperties properties;
    private CollectionScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new CollectorProperties();
        properties.getScheduler().setCollectionIntervalHours(6);
        properties.getScheduler().setMaintenanceHour(2);
        properties.getScheduler().setScheduledCount(25);
        properties.getScheduler().setAutoRetryFailedJobs(true);
        properties.getScheduler().setScheduledRetryAttempts(1);
        scheduler = new CollectionScheduler(orchestrator, properties, Clock.fixed(MORNING, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void firstTickRunsImmediatelyThenWaitsForTheInterval() {
        when(orchestrator.submit(any())).thenReturn(ticket("job-1", JobState.COMPLETED, false));

        assertThat(scheduler.tick(MORNING)).isEqualTo(CollectionScheduler.TickOutcome.COMPLETED);
        assertThat(scheduler.tick(MORNING.plusSeconds(3_600))).isEqualTo(CollectionScheduler.TickOutcome.NOT_DUE);
        assertThat(scheduler.status().nextScheduledAt()).isEqualTo(Instant.parse("2024-06-01T14:00:00Z"));
        assertThat(scheduler.status().lastJobId()).isEqualTo("job-1");
        assertThat(scheduler.status().lastOutcome()).isEqualTo("completed");

        ArgumentCaptor<JobRequest> request = ArgumentCaptor.forClass(JobRequest.class);
        verify(orchestrator).submit(request.capture());
        assertThat(request.getValue().trigger()).isEqualTo(JobTrigger.SCHEDULED);
        assertThat(request.getValue().requestedCount()).isEqualTo(25);
    }

    @Test
    void maintenanceHourPrunesOncePerDayAndStartsNothing() {
        Instant twoAm = Instant.parse("2024-06-02T02:05:00Z");

        assertThat(scheduler.tick(twoAm)).isEqualTo(CollectionScheduler.TickOutcome.MAINTENANCE);
        assertThat(scheduler.tick(twoAm.plusSeconds(1_800))).isEqualTo(CollectionScheduler.TickOutcome.MAINTENANCE);
        assertThat(scheduler.tick(twoAm.plusSeconds(86_400))).isEqualTo(CollectionScheduler.TickOutcome.MAINTENANCE);

        verify(orchestrator, times(1)).maintenance(twoAm);
        verify(orchestrator, times(1)).maintenance(twoAm.plusSeconds(86_400));
        verify(orchestrator, never()).submit(any());
        assertThat(scheduler.status().lastMaintenanceAt()).isEqualTo(twoAm.plusSeconds(86_400));
    }

    @Test
    void failedJobIsRetriedWithTheNextAttempt() {
        when(orchestrator.submit(any()))
            .thenReturn(ticket("job-1", JobState.ERROR, false))
            .thenReturn(ticket("job-2", JobState.COMPLETED, false));

        assertThat(scheduler.tick(MORNING)).isEqualTo(CollectionScheduler.TickOutcome.COMPLETED);

        ArgumentCaptor<JobRequest> requests = ArgumentCaptor.forClass(JobRequest.class);
        verify(orchestrator, times(2)).submit(requests.capture());
        assertThat(requests.getAllValues()).extracting(JobRequest::attempt).containsExactly(1, 2);
        assertThat(scheduler.status().lastJobId()).isEqualTo("job-2");
    }

    @Test
    void retriesStopAfterTheConfiguredAttempts() {
        when(orchestrator.submit(any())).thenReturn(ticket("job-x", JobState.ERROR, false));

        assertThat(scheduler.tick(MORNING)).isEqualTo(CollectionScheduler.TickOutcome.FAILED);

        verify(orchestrator, times(2)).submit(any());
    }

    @Test
    void autoRetryDisabledMeansOneAttempt() {
        properties.getScheduler().setAutoRetryFailedJobs(false);
        when(orchestrator.submit(any())).thenReturn(ticket("job-x", JobState.ERROR, false));

        assertThat(scheduler.tick(MORNING)).isEqualTo(CollectionScheduler.TickOutcome.FAILED);

        verify(orchestrator, times(1)).submit(any());
    }

    @Test
    void cancelledJobIsNotRetried() {
        when(orchestrator.submit(any())).thenReturn(ticket("job-x", JobState.ERROR, true));

        assertThat(scheduler.tick(MORNING)).isEqualTo(CollectionScheduler.TickOutcome.FAILED);

        verify(orchestrator, times(1)).submit(any());
    }

    @Test
    void busyOrchestratorSkipsTheCycle() {
        when(orchestrator.submit(any())).thenThrow(new JobAlreadyRunningException("a collection job is already running (max 1)"));

        assertThat(scheduler.tick(MORNING)).isEqualTo(CollectionScheduler.TickOutcome.SKIPPED);
        assertThat(scheduler.status().nextScheduledAt()).isEqualTo(Instant.parse("2024-06-01T14:00:00Z"));
    }

    @Test
    void startAndStopToggleTheBackgroundLoop() {
        properties.getScheduler().setTickSeconds(3_600);
        lenient().when(orchestrator.submit(any())).thenThrow(new JobAlreadyRunningException("busy"));

        scheduler.start();
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(scheduler.status().running()).isTrue();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void stoppingTheSchedulerLeavesTheInFlightJobRunning() {
        properties.getScheduler().setTickSeconds(3_600);
        CompletableFuture<JobSnapshot> completion = new CompletableFuture<>();
        when(orchestrator.submit(any())).thenReturn(new JobTicket("job-1", completion));

        scheduler.start();
        verify(orchestrator, timeout(2_000)).submit(any());
        scheduler.stop();

        completion.complete(snapshot("job-1", JobState.ERROR, false));

        verify(orchestrator, after(200).never()).cancel(anyString());
        verify(orchestrator, times(1)).submit(any());
    }

    @Test
    void disabledSchedulerDoesNotStartOnBoot() {
        properties.getScheduler().setEnabled(false);

        scheduler.startIfEnabled();

        assertThat(scheduler.isRunning()).isFalse();
    }

    private static JobTicket ticket(String id, JobState state, boolean cancelled) {
        return new JobTicket(id, CompletableFuture.completedFuture(snapshot(id, state, cancelled)));
    }

    private static JobSnapshot snapshot(String id, JobState state, boolean cancelled) {
        return new JobSnapshot(
            id,
            state,
            JobTrigger.SCHEDULED,
            25,
            true,
            7.0,
            1,
            MORNING,
            MORNING,
            0,
            0,
            0,
            0,
            cancelled,
            List.of(),
            List.of(),
            Map.of()
        );
    }
}
