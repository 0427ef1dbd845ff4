package com.urlfetcher.fetch.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fetch job lifecycle states.
 *
 * State transitions:
 * WAITING → FETCHING → {DONE, ERROR}
 * WAITING → DONE_CACHED
 * WAITING → ERROR (job failed before a fetch was attempted)
 */
public enum JobStatus {
    /**
     * Registered and queued, not yet picked up by a worker
     */
    WAITING("waiting"),

    /**
     * A worker is performing the HTTP GET
     */
    FETCHING("fetching"),

    /**
     * Fetched from the network and published to the cache
     */
    DONE("done"),

    /**
     * Served from a fresh cache entry without network access
     */
    DONE_CACHED("done-cached"),

    /**
     * Transport or read failure; never retried
     */
    ERROR("error");

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == DONE || this == DONE_CACHED || this == ERROR;
    }

    public boolean canTransitionTo(JobStatus next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case WAITING -> next == FETCHING || next == DONE_CACHED || next == ERROR;
            case FETCHING -> next == DONE || next == ERROR;
            case DONE, DONE_CACHED, ERROR -> false;
        };
    }
}
