package com.urlfetcher.fetch.service;

import com.urlfetcher.config.FetcherProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts the worker pool on application startup and queues the configured warm-up URLs.
 */
@Component
public class WorkerBootstrapRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkerBootstrapRunner.class);

    private final FetcherProperties properties;
    private final FetchWorkerPool workerPool;
    private final UrlFetchService fetchService;

    public WorkerBootstrapRunner(
        FetcherProperties properties,
        FetchWorkerPool workerPool,
        UrlFetchService fetchService
    ) {
        this.properties = properties;
        this.workerPool = workerPool;
        this.fetchService = fetchService;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getWorkers().isAutoStart()) {
            log.info("Fetch worker auto-start disabled");
            return;
        }
        workerPool.startWorkers(properties.getWorkers().getCount());

        List<String> warmupUrls = properties.getWarmupUrls().stream()
            .filter(url -> url != null && !url.isBlank())
            .map(String::trim)
            .toList();
        if (!warmupUrls.isEmpty()) {
            log.info("Submitting {} warm-up URLs", warmupUrls.size());
            warmupUrls.forEach(fetchService::submit);
        }
    }
}
