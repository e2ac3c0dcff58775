package com.dramacollector.collect.service;

import com.dramacollector.collect.model.ExportFileInfo;
import com.dramacollector.collect.model.JobError;
import com.dramacollector.collect.model.JobRequest;
import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobState;
import com.dramacollector.collect.model.JobTrigger;
import com.dramacollector.config.CollectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class CollectorCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CollectorCliRunner.class);

    private final CollectorProperties properties;
    private final CollectionJobOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public CollectorCliRunner(
        CollectorProperties properties,
        CollectionJobOrchestrator orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        JobRequest request = new JobRequest(
            JobTrigger.MANUAL,
            properties.getCli().getCount(),
            properties.getExport().isEnabled(),
            properties.getProcessing().getQualityThreshold()
        );
        JobSnapshot summary = orchestrator.submit(request).completion().join();
        log.info(
            "Collection job {} finished with state {}: collected={}, processed={}, stored={}, dropped={}, stageMs={}",
            summary.id(),
            summary.state(),
            summary.totalCollected(),
            summary.totalProcessed(),
            summary.totalStored(),
            summary.droppedLowQuality(),
            summary.stageDurationsMs()
        );
        for (JobError error : summary.errors()) {
            log.info("Error from {}: {}", error.source(), error.message());
        }
        for (ExportFileInfo file : summary.exports()) {
            log.info("Export {}: {} ({} bytes, sha256={})", file.format(), file.path(), file.sizeBytes(), file.checksum());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> summary.state() == JobState.COMPLETED ? 0 : 1);
            System.exit(exitCode);
        }
    }
}
