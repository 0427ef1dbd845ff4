package com.urlfetcher.fetch.store;

import com.urlfetcher.fetch.model.UrlResponse;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest response per URL. Freshness is judged by callers; nothing here expires.
 */
public class ResponseCache {
    private final Map<String, UrlResponse> responses = new ConcurrentHashMap<>();

    public Optional<UrlResponse> lookup(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(responses.get(url));
    }

    public void publish(UrlResponse response) {
        responses.put(response.url(), response);
    }

    public List<UrlResponse> list() {
        return responses.values().stream()
            .sorted(Comparator.comparing(UrlResponse::url))
            .toList();
    }

    public int size() {
        return responses.size();
    }
}
