package com.urlfetcher.fetch.service;

import com.urlfetcher.fetch.queue.JobQueue;
import com.urlfetcher.fetch.store.JobRegistry;
import com.urlfetcher.fetch.store.ResponseCache;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared state of one fetcher instance: the job registry, the response cache, the work queue
 * and the job id sequence. Built once per application context.
 */
public class FetchContext {
    private final JobRegistry registry = new JobRegistry();
    private final ResponseCache cache = new ResponseCache();
    private final AtomicLong lastJobId = new AtomicLong();
    private final JobQueue queue;

    public FetchContext(int queueCapacity) {
        this.queue = new JobQueue(queueCapacity);
    }

    public JobRegistry registry() {
        return registry;
    }

    public ResponseCache cache() {
        return cache;
    }

    public JobQueue queue() {
        return queue;
    }

    long nextJobId() {
        return lastJobId.incrementAndGet();
    }
}
