package com.urlfetcher.fetch.queue;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO of job ids between submission and the worker pool.
 */
public class JobQueue {
    private final BlockingQueue<Long> ids;
    private final int capacity;

    public JobQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.ids = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Appends a job id, blocking while the queue is full.
     */
    public void enqueue(long jobId) throws InterruptedException {
        ids.put(jobId);
    }

    /**
     * Takes the oldest job id, blocking while the queue is empty.
     */
    public long dequeue() throws InterruptedException {
        return ids.take();
    }

    /**
     * Takes the oldest job id, waiting up to {@code timeout} for one to arrive.
     *
     * @return the id, or null when the wait timed out
     */
    public Long poll(long timeout, TimeUnit unit) throws InterruptedException {
        return ids.poll(timeout, unit);
    }

    public int size() {
        return ids.size();
    }

    public int capacity() {
        return capacity;
    }
}
