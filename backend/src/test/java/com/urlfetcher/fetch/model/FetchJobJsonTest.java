package com.urlfetcher.fetch.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urlfetcher.config.FetchConfig;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FetchJobJsonTest {
    private final ObjectMapper objectMapper = new FetchConfig().objectMapper();

    @Test
    void rendersStatusLabelAndIsoTimestamp() throws Exception {
        UrlResponse response = new UrlResponse("http://example.test/a", "X", Instant.parse("2026-01-01T00:00:00Z"));
        FetchJob job = new FetchJob(7, "http://example.test/a", JobStatus.DONE_CACHED, response);

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(job));

        assertThat(json.get("id").asLong()).isEqualTo(7);
        assertThat(json.get("status").asText()).isEqualTo("done-cached");
        assertThat(json.get("response").get("body").asText()).isEqualTo("X");
        assertThat(json.get("response").get("timestamp").asText()).isEqualTo("2026-01-01T00:00:00Z");
    }

    @Test
    void keepsExistingResponseWhenMovingWithoutOne() {
        UrlResponse response = new UrlResponse("u", "b", Instant.EPOCH);
        FetchJob job = new FetchJob(1, "u", JobStatus.DONE, response);

        assertThat(job.withStatus(JobStatus.ERROR, null).response()).isSameAs(response);
    }
}
