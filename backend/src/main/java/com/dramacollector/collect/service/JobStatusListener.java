package com.dramacollector.collect.service;

import com.dramacollector.collect.model.JobSnapshot;
import com.dramacollector.collect.model.JobState;

public interface JobStatusListener {
    void onStateChange(JobSnapshot job, JobState previous);
}
