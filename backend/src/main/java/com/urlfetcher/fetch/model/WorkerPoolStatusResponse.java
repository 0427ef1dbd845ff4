package com.urlfetcher.fetch.model;

public record WorkerPoolStatusResponse(boolean running, int workerCount, int queueDepth, int queueCapacity) {}
