package io.sentinel.service.queue;

import io.sentinel.domain.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory FIFO of jobs awaiting execution, deduplicated by job id.
 *
 * Mutations are serialized by a single lock. Each mutation publishes an immutable
 * snapshot, so reads never take the lock and never observe a half-applied change.
 * Never persisted: after a restart the scheduler's next heartbeat rebuilds it.
 */
public final class JobQueue {
    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Job> jobs = new LinkedHashMap<>();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Add a job at the tail unless a job with the same id is already queued.
     *
     * @return true if added, false if the id was already present
     */
    public boolean enqueue(Job job) {
        lock.lock();
        try {
            if (jobs.containsKey(job.id())) {
                log.debug("[QUEUE] {} already queued", job.id());
                return false;
            }
            jobs.put(job.id(), job);
            publish();
            log.debug("[QUEUE] Enqueued {} (depth={})", job.id(), jobs.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Head of the queue without removing it.
     */
    public Optional<Job> peek() {
        List<Job> order = snapshot.order();
        return order.isEmpty() ? Optional.empty() : Optional.of(order.get(0));
    }

    /**
     * Remove the job with the given id.
     *
     * @return the removed job, empty if it was not queued
     */
    public Optional<Job> remove(String jobId) {
        lock.lock();
        try {
            Job removed = jobs.remove(jobId);
            if (removed != null) {
                publish();
            }
            return Optional.ofNullable(removed);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String jobId) {
        return snapshot.byId().containsKey(jobId);
    }

    public int size() {
        return snapshot.order().size();
    }

    public boolean isEmpty() {
        return snapshot.order().isEmpty();
    }

    /**
     * Queued ids in insertion order.
     */
    public List<String> listIds() {
        List<Job> order = snapshot.order();
        List<String> ids = new ArrayList<>(order.size());
        for (Job job : order) {
            ids.add(job.id());
        }
        return ids;
    }

    /**
     * Snapshot of queued jobs in insertion order.
     */
    public List<Job> allJobs() {
        return snapshot.order();
    }

    // Caller holds the lock
    private void publish() {
        snapshot = new Snapshot(List.copyOf(jobs.values()), Map.copyOf(jobs));
    }

    private record Snapshot(List<Job> order, Map<String, Job> byId) {
        static final Snapshot EMPTY = new Snapshot(List.of(), Map.of());
    }
}
