package com.dramacollector.collect.service;

import com.dramacollector.collect.model.JobSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Jobs in start order, oldest first. Only terminal jobs are ever evicted, so an active job
 * is always visible here.
 */
public class JobHistory {
    private final int maxJobs;
    private final Deque<CollectionJob> jobs = new ArrayDeque<>();

    public JobHistory(int maxJobs) {
        this.maxJobs = Math.max(1, maxJobs);
    }

    public synchronized void add(CollectionJob job) {
        jobs.addLast(job);
        evictOverflow();
    }

    /**
     * Most recent first.
     */
    public synchronized List<JobSnapshot> recent(int limit) {
        List<JobSnapshot> out = new ArrayList<>();
        Iterator<CollectionJob> newestFirst = jobs.descendingIterator();
        while (newestFirst.hasNext() && out.size() < limit) {
            out.add(newestFirst.next().snapshot());
        }
        return out;
    }

    /**
     * Drops terminal jobs that ended before {@code now - retention}, then trims overflow.
     *
     * @return number of jobs removed
     */
    public synchronized int prune(Instant now, Duration retention) {
        Instant horizon = now.minus(retention);
        int before = jobs.size();
        jobs.removeIf(job -> job.isTerminal() && job.endTime() != null && job.endTime().isBefore(horizon));
        evictOverflow();
        return before - jobs.size();
    }

    public synchronized int size() {
        return jobs.size();
    }

    private void evictOverflow() {
        Iterator<CollectionJob> oldestFirst = jobs.iterator();
        while (jobs.size() > maxJobs && oldestFirst.hasNext()) {
            if (oldestFirst.next().isTerminal()) {
                oldestFirst.remove();
            }
        }
    }
}
