package com.dramacollector.collect.service;

import com.dramacollector.collect.model.JobSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Handle for a submitted job. The future completes with the terminal snapshot once the job
 * has released its concurrency slot.
 */
public record JobTicket(String jobId, CompletableFuture<JobSnapshot> completion) {}
