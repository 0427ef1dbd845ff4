package com.urlfetcher.fetch.model;

public record HttpFetchResult(
    int statusCode,
    String body,
    String contentType,
    String errorCode,
    String errorMessage
) {
    public static final String INVALID_URL = "invalid_url";
    public static final String IO_ERROR = "io_error";
    public static final String READ_ERROR = "read_error";
    public static final String INTERRUPTED = "interrupted";
    public static final String HTTP_ERROR = "http_error";

    /**
     * True when a response arrived and its body was read in full, whatever the status code.
     */
    public boolean isSuccessful() {
        return errorCode == null && statusCode > 0;
    }
}
