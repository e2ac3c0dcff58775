package com.dramacollector.collect.service;

import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingJobStatusListener implements JobStatusListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingJobStatusListener.class);

    @Override
    public void onStateChange(JobSnapshot job, JobState previous) {
        if (job.isTerminal()) {
            log.info(
                "Job {} {} -> {}: collected={}, processed={}, stored={}, dropped={}, errors={}, cancelled={}, stageMs={}",
                job.id(),
                previous,
                job.state(),
                job.totalCollected(),
                job.totalProcessed(),
                job.totalStored(),
                job.droppedLowQuality(),
                job.errors().size(),
                job.cancelled(),
                job.stageDurationsMs()
            );
        } else {
            log.info("Job {} {} -> {}", job.id(), previous, job.state());
        }
    }
}
