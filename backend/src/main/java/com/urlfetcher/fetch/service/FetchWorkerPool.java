package com.urlfetcher.fetch.service;

import com.urlfetcher.fetch.model.FetchJob;
import com.urlfetcher.fetch.model.JobStatus;
import com.urlfetcher.fetch.model.WorkerPoolStatusResponse;
import com.urlfetcher.fetch.queue.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class FetchWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(FetchWorkerPool.class);
    private static final long IDLE_POLL_MS = 250;

    private final FetchContext context;
    private final FetchJobProcessor processor;
    private final Object lifecycleLock = new Object();

    // one flag per start() so workers of an earlier run never rejoin a later one
    private volatile AtomicBoolean running = new AtomicBoolean(false);
    private volatile int activeWorkerCount;
    private ExecutorService executor;

    public FetchWorkerPool(FetchContext context, FetchJobProcessor processor) {
        this.context = context;
        this.processor = processor;
    }

    @PreDestroy
    public void stopOnShutdown() {
        synchronized (lifecycleLock) {
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
        }
    }

    /**
     * Starts {@code count} workers draining the shared queue. Does nothing if already running.
     */
    public void startWorkers(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Worker count must be positive: " + count);
        }
        synchronized (lifecycleLock) {
            if (running.get()) {
                log.info("Fetch workers already running ({}), ignoring start request for {}",
                    activeWorkerCount, count);
                return;
            }
            AtomicBoolean runFlag = new AtomicBoolean(true);
            running = runFlag;
            activeWorkerCount = count;
            executor = Executors.newFixedThreadPool(count, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("fetch-worker");
                thread.setDaemon(true);
                return thread;
            });
            for (int i = 0; i < count; i++) {
                int workerIndex = i + 1;
                executor.submit(() -> workerLoop(workerIndex, runFlag));
            }
            log.info("Started {} fetch workers", count);
        }
    }

    /**
     * Stops taking new jobs. A job a worker is already processing runs to completion; idle
     * workers have exited by the time this returns, so nothing is dequeued afterwards.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdown();
                try {
                    // long enough for every idle poll to time out; busy workers are not waited for
                    executor.awaitTermination(IDLE_POLL_MS * 4, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
            log.info("Fetch workers stopping after their current job");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public WorkerPoolStatusResponse status() {
        JobQueue queue = context.queue();
        return new WorkerPoolStatusResponse(running.get(), activeWorkerCount, queue.size(), queue.capacity());
    }

    private void workerLoop(int workerIndex, AtomicBoolean runFlag) {
        Thread.currentThread().setName("fetch-worker-" + workerIndex);
        while (runFlag.get() && !Thread.currentThread().isInterrupted()) {
            Long jobId;
            try {
                jobId = context.queue().poll(IDLE_POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (jobId == null) {
                continue;
            }

            try {
                FetchJob finished = processor.process(jobId);
                log.info("Worker {} finished job {} as {}", workerIndex, jobId, finished.status().label());
            } catch (JobNotFoundException e) {
                log.error("Worker {} dequeued job {} that was never registered", workerIndex, jobId);
            } catch (Exception e) {
                log.warn("Worker {} failed while processing job {}", workerIndex, jobId, e);
                recordUnexpectedFailure(jobId);
            }
        }
    }

    private void recordUnexpectedFailure(long jobId) {
        try {
            Optional<FetchJob> job = context.registry().find(jobId);
            if (job.isPresent() && !job.get().status().isTerminal()) {
                context.registry().transition(jobId, JobStatus.ERROR, null);
            }
        } catch (Exception ex) {
            log.warn("Failed to record worker failure for job {}", jobId, ex);
        }
    }
}
