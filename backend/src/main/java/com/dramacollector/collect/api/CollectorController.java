package com.dramacollector.collect.api;

import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobStartResponse;
import com.dramacollector.collect.model.JobTrigger;
import com.dramacollector.collect.model.SchedulerStatus;
import com.dramacollector.collect.model.SourceView;
import com.dramacollector.collect.model.StatusResponse;
import com.dramacollector.collect.model.StoredDrama;
import com.dramacollector.collect.persistence.DramaRecordStore;
import com.dramacollector.collect.service.CollectionJobOrchestrator;
import com.dramacollector.collect.service.CollectionScheduler;
import com.dramacollector.collect.service.CollectorStatusService;
import com.dramacollector.config.CollectorProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class CollectorController {
    private static final int MAX_PAGE = 500;

    private final CollectionJobOrchestrator orchestrator;
    private final CollectionScheduler scheduler;
    private final CollectorStatusService statusService;
    private final DramaRecordStore store;
    private final CollectorProperties properties;

    public CollectorController(
        CollectionJobOrchestrator orchestrator,
        CollectionScheduler scheduler,
        CollectorStatusService statusService,
        DramaRecordStore store,
        CollectorProperties properties
    ) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.statusService = statusService;
        this.store = store;
        this.properties = properties;
    }

    @PostMapping("/jobs/start")
    public JobStartResponse startJob(@RequestBody(required = false) JobStartRequest request) {
        int count = request == null || request.count() == null
            ? properties.getProcessing().getDefaultRequestedCount()
            : request.count();
        if (count < 1) {
            throw new ResponseStatusException(BAD_REQUEST, "count must be positive");
        }
        boolean export = request == null || request.exportEnabled() == null
            ? properties.getExport().isEnabled()
            : request.exportEnabled();
        double threshold = request == null || request.qualityThreshold() == null
            ? properties.getProcessing().getQualityThreshold()
            : request.qualityThreshold();
        if (threshold < 0 || threshold > 10) {
            throw new ResponseStatusException(BAD_REQUEST, "qualityThreshold must be between 0 and 10");
        }
        String jobId = orchestrator.start(JobTrigger.MANUAL, count, export, threshold);
        return new JobStartResponse(jobId, "collection job started");
    }

    @PostMapping("/jobs/stop")
    public Map<String, Object> stopJobs() {
        int signalled = orchestrator.stop();
        return Map.of("stopRequested", signalled > 0, "jobs", signalled);
    }

    @GetMapping("/jobs/current")
    public ResponseEntity<JobSnapshot> currentJob() {
        return orchestrator.current()
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/jobs/history")
    public List<JobSnapshot> jobHistory(@RequestParam(name = "limit", required = false, defaultValue = "10") int limit) {
        return orchestrator.history(Math.max(1, Math.min(limit, properties.getHistory().getMaxJobs())));
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/config")
    public Map<String, Object> config() {
        return statusService.configView();
    }

    @GetMapping("/sources")
    public List<SourceView> sources() {
        return statusService.sources();
    }

    @GetMapping("/dramas")
    public List<StoredDrama> dramas(
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit,
        @RequestParam(name = "genre", required = false) String genre
    ) {
        return store.findDramas(Math.max(1, Math.min(limit, MAX_PAGE)), genre);
    }

    @GetMapping("/dramas/{key}")
    public StoredDrama drama(@PathVariable("key") String key) {
        return store.findByKey(key)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "drama not found: " + key));
    }

    @PostMapping("/scheduler/start")
    public SchedulerStatus startScheduler() {
        scheduler.start();
        return scheduler.status();
    }

    @PostMapping("/scheduler/stop")
    public SchedulerStatus stopScheduler() {
        scheduler.stop();
        return scheduler.status();
    }
}
