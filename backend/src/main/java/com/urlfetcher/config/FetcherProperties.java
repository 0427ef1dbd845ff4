package com.urlfetcher.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "fetcher")
public class FetcherProperties {
    private static final String DEFAULT_USER_AGENT = "url-fetcher/0.1 (+contact)";

    private String userAgent;
    private List<String> warmupUrls = new ArrayList<>();
    private Workers workers = new Workers();
    private Queue queue = new Queue();
    private Cache cache = new Cache();
    private Http http = new Http();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public List<String> getWarmupUrls() {
        return warmupUrls;
    }

    public void setWarmupUrls(List<String> warmupUrls) {
        this.warmupUrls = warmupUrls == null ? new ArrayList<>() : warmupUrls;
    }

    public Workers getWorkers() {
        return workers;
    }

    public void setWorkers(Workers workers) {
        this.workers = workers;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Workers {
        private boolean autoStart = true;
        private int count = 2;

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getCount() {
            return Math.max(1, count);
        }

        public void setCount(int count) {
            this.count = Math.max(1, count);
        }
    }

    public static class Queue {
        private int capacity = 1000;

        public int getCapacity() {
            return Math.max(1, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }
    }

    public static class Cache {
        private static final Duration DEFAULT_FRESHNESS = Duration.ofHours(1);

        private Duration freshness = DEFAULT_FRESHNESS;

        public Duration getFreshness() {
            return freshness;
        }

        public void setFreshness(Duration freshness) {
            if (freshness == null || freshness.isNegative() || freshness.isZero()) {
                this.freshness = DEFAULT_FRESHNESS;
                return;
            }
            this.freshness = freshness;
        }
    }

    public static class Http {
        private int connectTimeoutSeconds = 20;
        // 0 leaves requests unbounded once connected
        private int requestTimeoutSeconds = 0;
        private int executorThreads = 4;

        public int getConnectTimeoutSeconds() {
            return Math.max(1, connectTimeoutSeconds);
        }

        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
            this.connectTimeoutSeconds = Math.max(1, connectTimeoutSeconds);
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(0, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(0, requestTimeoutSeconds);
        }

        public int getExecutorThreads() {
            return Math.max(1, executorThreads);
        }

        public void setExecutorThreads(int executorThreads) {
            this.executorThreads = Math.max(1, executorThreads);
        }
    }
}
