package com.urlfetcher.fetch.store;

import com.urlfetcher.fetch.model.UrlResponse;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseCacheTest {
    private final ResponseCache cache = new ResponseCache();

    @Test
    void lookupMissesUntilPublished() {
        assertThat(cache.lookup("http://example.test/a")).isEmpty();
        assertThat(cache.lookup(null)).isEmpty();

        UrlResponse response = new UrlResponse("http://example.test/a", "X", Instant.now());
        cache.publish(response);

        assertThat(cache.lookup("http://example.test/a")).containsSame(response);
    }

    @Test
    void publishReplacesPreviousEntryWithoutTouchingIt() {
        Instant first = Instant.parse("2026-01-01T00:00:00Z");
        UrlResponse older = new UrlResponse("http://example.test/a", "old", first);
        UrlResponse newer = new UrlResponse("http://example.test/a", "new", first.plusSeconds(3700));

        cache.publish(older);
        cache.publish(newer);

        assertThat(cache.lookup("http://example.test/a")).containsSame(newer);
        assertThat(older.body()).isEqualTo("old");
        assertThat(older.timestamp()).isEqualTo(first);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void listReturnsLatestPerUrl() {
        cache.publish(new UrlResponse("http://example.test/b", "B", Instant.now()));
        cache.publish(new UrlResponse("http://example.test/a", "A", Instant.now()));

        assertThat(cache.list()).extracting(UrlResponse::url)
            .containsExactly("http://example.test/a", "http://example.test/b");
    }
}
