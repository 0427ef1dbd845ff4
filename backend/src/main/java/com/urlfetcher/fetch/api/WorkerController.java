package com.urlfetcher.fetch.api;

import com.urlfetcher.config.FetcherProperties;
import com.urlfetcher.fetch.model.WorkerPoolStatusResponse;
import com.urlfetcher.fetch.service.FetchWorkerPool;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workers")
public class WorkerController {
    private final FetchWorkerPool workerPool;
    private final FetcherProperties properties;

    public WorkerController(FetchWorkerPool workerPool, FetcherProperties properties) {
        this.workerPool = workerPool;
        this.properties = properties;
    }

    @PostMapping("/start")
    public WorkerPoolStatusResponse start(@RequestParam(name = "count", required = false) Integer count) {
        int workerCount = count == null ? properties.getWorkers().getCount() : count;
        workerPool.startWorkers(workerCount);
        return workerPool.status();
    }

    @GetMapping("/status")
    public WorkerPoolStatusResponse status() {
        return workerPool.status();
    }
}
