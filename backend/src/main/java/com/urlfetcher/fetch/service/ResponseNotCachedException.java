package com.urlfetcher.fetch.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ResponseNotCachedException extends RuntimeException {
    public ResponseNotCachedException(String url) {
        super("No cached response for " + url);
    }
}
