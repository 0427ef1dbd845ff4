package com.urlfetcher.fetch.api;

public record AddJobRequest(String url) {}
