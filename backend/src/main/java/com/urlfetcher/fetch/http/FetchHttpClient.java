package com.urlfetcher.fetch.http;

import com.urlfetcher.config.FetcherProperties;
import com.urlfetcher.fetch.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

@Service
public class FetchHttpClient implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(FetchHttpClient.class);

    private final FetcherProperties properties;
    private final HttpClient client;

    public FetchHttpClient(
        FetcherProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    @Override
    public HttpFetchResult get(String url) {
        URI uri = parseUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(HttpFetchResult.INVALID_URL, "URL missing scheme, host or malformed: " + url);
        }

        HttpResponse<InputStream> response;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "*/*")
                .GET();
            int requestTimeoutSeconds = properties.getHttp().getRequestTimeoutSeconds();
            if (requestTimeoutSeconds > 0) {
                builder.timeout(Duration.ofSeconds(requestTimeoutSeconds));
            }
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            return errorResult(HttpFetchResult.IO_ERROR, "timeout: " + e.getMessage());
        } catch (IOException e) {
            return errorResult(HttpFetchResult.IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(HttpFetchResult.INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(HttpFetchResult.HTTP_ERROR, e.getMessage());
        }

        String body;
        try (InputStream in = response.body()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Body read failed for {}", url, e);
            return errorResult(HttpFetchResult.READ_ERROR, e.getMessage());
        }

        return new HttpFetchResult(
            response.statusCode(),
            body,
            response.headers().firstValue("Content-Type").orElse(null),
            null,
            null
        );
    }

    private HttpFetchResult errorResult(String code, String message) {
        return new HttpFetchResult(0, null, null, code, message);
    }

    // fetched as given: no trimming, no scheme guessing
    private URI parseUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        if (!input.startsWith("http://") && !input.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(input);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
