package com.urlfetcher.fetch.service;

import com.urlfetcher.fetch.model.FetchJob;
import com.urlfetcher.fetch.model.JobStatus;
import com.urlfetcher.fetch.model.UrlResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for submitting fetch jobs and reading back jobs and cached responses.
 */
@Service
public class UrlFetchService {
    private static final Logger log = LoggerFactory.getLogger(UrlFetchService.class);

    private final FetchContext context;

    public UrlFetchService(FetchContext context) {
        this.context = context;
    }

    /**
     * Registers a new job for {@code url}, kept exactly as given, and queues it. Blocks while the
     * queue is full. If interrupted while blocked, the job is marked {@code error}.
     *
     * @return the job as registered, always in {@code waiting} state
     */
    public FetchJob submit(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        FetchJob job = FetchJob.waiting(context.nextJobId(), url);
        context.registry().register(job);
        try {
            context.queue().enqueue(job.id());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // never queued, so no worker will ever pick it up
            context.registry().transition(job.id(), JobStatus.ERROR, null);
            throw new IllegalStateException("Interrupted while queueing job " + job.id(), e);
        }
        log.info("Queued job {} for {}", job.id(), job.url());
        return job;
    }

    public Optional<FetchJob> getJob(long id) {
        return context.registry().find(id);
    }

    public List<FetchJob> listJobs() {
        return context.registry().list();
    }

    public Optional<UrlResponse> getResponse(String url) {
        return context.cache().lookup(url);
    }

    public List<UrlResponse> listResponses() {
        return context.cache().list();
    }
}
