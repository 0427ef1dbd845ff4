package com.urlfetcher.fetch.store;

import com.urlfetcher.fetch.model.FetchJob;
import com.urlfetcher.fetch.model.JobStatus;
import com.urlfetcher.fetch.model.UrlResponse;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Every job submitted since startup, keyed by id. Entries are never removed.
 */
public class JobRegistry {
    private final Map<Long, FetchJob> jobs = new ConcurrentHashMap<>();

    public void register(FetchJob job) {
        FetchJob existing = jobs.putIfAbsent(job.id(), job);
        if (existing != null) {
            throw new IllegalStateException("Job id already registered: " + job.id());
        }
    }

    public Optional<FetchJob> find(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public List<FetchJob> list() {
        return jobs.values().stream()
            .sorted(Comparator.comparingLong(FetchJob::id))
            .toList();
    }

    public int size() {
        return jobs.size();
    }

    /**
     * Atomically moves a job to {@code next}, attaching {@code response} when given.
     *
     * @return the updated snapshot, or empty when no job has that id
     * @throws IllegalStateException when the state machine forbids the move
     */
    public Optional<FetchJob> transition(long id, JobStatus next, UrlResponse response) {
        AtomicReference<FetchJob> updated = new AtomicReference<>();
        jobs.computeIfPresent(id, (key, current) -> {
            if (!current.status().canTransitionTo(next)) {
                throw new IllegalStateException(
                    "Job " + id + " cannot move from " + current.status().label() + " to " + next.label());
            }
            FetchJob replacement = current.withStatus(next, response);
            updated.set(replacement);
            return replacement;
        });
        return Optional.ofNullable(updated.get());
    }
}
