package com.urlfetcher.fetch.http;

import com.urlfetcher.config.FetcherProperties;
import com.urlfetcher.fetch.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FetchHttpClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private FetchHttpClient client;

    @BeforeEach
    void setUp() {
        FetcherProperties properties = new FetcherProperties();
        properties.getHttp().setConnectTimeoutSeconds(5);
        properties.getHttp().setRequestTimeoutSeconds(10);
        executor = Executors.newFixedThreadPool(1);
        client = new FetchHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void returnsBodyOfSuccessfulGet() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "text/html")
            .setBody("<html>hello</html>"));
        server.start();

        HttpFetchResult result = client.get(server.url("/page").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.body()).isEqualTo("<html>hello</html>");
        assertThat(result.contentType()).isEqualTo("text/html");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getHeader("User-Agent")).startsWith("url-fetcher/0.1");
    }

    @Test
    void nonSuccessStatusStillCountsAsFetched() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404).setBody("missing"));
        server.start();

        HttpFetchResult result = client.get(server.url("/gone").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.body()).isEqualTo("missing");
    }

    @Test
    void refusedConnectionIsTransportFailure() throws Exception {
        server = new MockWebServer();
        server.start();
        String url = server.url("/down").toString();
        server.shutdown();
        server = null;

        HttpFetchResult result = client.get(url);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo(HttpFetchResult.IO_ERROR);
        assertThat(result.body()).isNull();
    }

    @Test
    void truncatedBodyIsNotSuccessful() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setBody("x".repeat(64 * 1024))
            .setSocketPolicy(SocketPolicy.DISCONNECT_DURING_RESPONSE_BODY));
        server.start();

        HttpFetchResult result = client.get(server.url("/partial").toString());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isIn(HttpFetchResult.READ_ERROR, HttpFetchResult.IO_ERROR);
    }

    @Test
    void urlWithoutSchemeIsRejectedInsteadOfGuessed() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("should not be fetched"));
        server.start();
        String hostAndPath = server.getHostName() + ":" + server.getPort() + "/page";

        HttpFetchResult result = client.get(hostAndPath);

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo(HttpFetchResult.INVALID_URL);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void surroundingWhitespaceIsNotStripped() {
        HttpFetchResult result = client.get(" http://example.test/a ");

        assertThat(result.errorCode()).isEqualTo(HttpFetchResult.INVALID_URL);
    }

    @Test
    void blankUrlIsRejectedWithoutNetworkAccess() {
        HttpFetchResult result = client.get("  ");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo(HttpFetchResult.INVALID_URL);
    }
}
