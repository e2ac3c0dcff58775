package com.dramacollector.collect.service;

import com.dramacollector.collect.model.SourceView;
import com.dramacollector.collect.model.StatusResponse;
import com.dramacollector.collect.persistence.DramaRecordStore;
import com.dramacollector.collect.source.RegisteredSource;
import com.dramacollector.collect.source.SourceRegistry;
import com.dramacollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class CollectorStatusService {
    private static final Logger log = LoggerFactory.getLogger(CollectorStatusService.class);

    private final CollectionJobOrchestrator orchestrator;
    private final CollectionScheduler scheduler;
    private final DramaRecordStore store;
    private final SourceRegistry registry;
    private final CollectorProperties properties;

    public CollectorStatusService(
        CollectionJobOrchestrator orchestrator,
        CollectionScheduler scheduler,
        DramaRecordStore store,
        SourceRegistry registry,
        CollectorProperties properties
    ) {
        this.orchestrator = orchestrator;
        this.scheduler = scheduler;
        this.store = store;
        this.registry = registry;
        this.properties = properties;
    }

    public StatusResponse getStatus() {
        boolean reachable = store.isReachable();
        long stored = 0;
        if (reachable) {
            try {
                stored = store.count();
            } catch (Exception e) {
                log.warn("Failed to count stored dramas", e);
            }
        }
        return new StatusResponse(
            reachable,
            stored,
            orchestrator.availableSlots(),
            orchestrator.current().orElse(null),
            scheduler.status()
        );
    }

    public List<SourceView> sources() {
        return registry.all().stream()
            .map(RegisteredSource::descriptor)
            .map(SourceView::from)
            .toList();
    }

    /**
     * Effective configuration without credentials. API keys are reported only as present or
     * absent.
     */
    public Map<String, Object> configView() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("userAgent", properties.getUserAgent());
        view.put("requestTimeoutSeconds", properties.getRequestTimeoutSeconds());

        CollectorProperties.Processing processing = properties.getProcessing();
        Map<String, Object> processingView = new LinkedHashMap<>();
        processingView.put("maxConcurrentJobs", processing.getMaxConcurrentJobs());
        processingView.put("qualityThreshold", processing.getQualityThreshold());
        processingView.put("validationLevel", processing.getValidationLevel());
        processingView.put("defaultRequestedCount", processing.getDefaultRequestedCount());
        view.put("processing", processingView);

        CollectorProperties.Aggregation aggregation = properties.getAggregation();
        Map<String, Object> aggregationView = new LinkedHashMap<>();
        aggregationView.put("enrichDetails", aggregation.isEnrichDetails());
        aggregationView.put("corroborationBonus", aggregation.getCorroborationBonus());
        aggregationView.put("maxRetryDelayMs", aggregation.getMaxRetryDelayMs());
        view.put("aggregation", aggregationView);

        CollectorProperties.Scheduler schedulerSettings = properties.getScheduler();
        Map<String, Object> schedulerView = new LinkedHashMap<>();
        schedulerView.put("enabled", schedulerSettings.isEnabled());
        schedulerView.put("collectionIntervalHours", schedulerSettings.getCollectionIntervalHours());
        schedulerView.put("maintenanceHour", schedulerSettings.getMaintenanceHour());
        schedulerView.put("autoRetryFailedJobs", schedulerSettings.isAutoRetryFailedJobs());
        schedulerView.put("scheduledRetryAttempts", schedulerSettings.getScheduledRetryAttempts());
        schedulerView.put("scheduledCount", schedulerSettings.getScheduledCount());
        schedulerView.put("maxCollectionDurationHours", schedulerSettings.getMaxCollectionDurationHours());
        view.put("scheduler", schedulerView);

        Map<String, Object> historyView = new LinkedHashMap<>();
        historyView.put("retentionHours", properties.getHistory().getRetentionHours());
        historyView.put("maxJobs", properties.getHistory().getMaxJobs());
        view.put("history", historyView);

        CollectorProperties.Export export = properties.getExport();
        Map<String, Object> exportView = new LinkedHashMap<>();
        exportView.put("enabled", export.isEnabled());
        exportView.put("formats", export.getFormats());
        exportView.put("outputDirectory", export.getOutputDirectory());
        exportView.put("includeMetadata", export.isIncludeMetadata());
        exportView.put("compress", export.isCompress());
        view.put("export", exportView);

        Map<String, Object> sourcesView = new LinkedHashMap<>();
        properties.getSources().forEach((name, source) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", source.getType());
            entry.put("baseUrl", source.getBaseUrl());
            entry.put("apiKeyConfigured", source.getApiKey() != null && !source.getApiKey().isBlank());
            entry.put("priority", source.getPriority());
            entry.put("rateLimit", source.getRateLimit());
            entry.put("burst", source.getBurst());
            entry.put("maxRetries", source.getMaxRetries());
            entry.put("retryDelayMs", source.getRetryDelayMs());
            entry.put("timeoutSeconds", source.getTimeoutSeconds());
            entry.put("enabled", source.isEnabled());
            sourcesView.put(name, entry);
        });
        view.put("sources", sourcesView);
        return view;
    }
}
