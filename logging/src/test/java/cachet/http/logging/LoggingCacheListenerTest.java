/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.logging;

import cachet.http.*;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public final class LoggingCacheListenerTest {
    private static final String URL = "https://example.com/widgets/1";

    private final List<String> messages = new ArrayList<>();
    private final Cache cache = Cache.builder()
            .listener(LoggingCacheListener.create(messages::add))
            .build();

    @Test
    public void logsMissStoreAndHit() {
        final var transport = cache.wrap(new QueueTransport(200, "Cache-Control", "max-age=60"));

        try (final var response = transport.execute(ClientRequest.get(URL))) {
            assertThat(response.getBody().string()).isEqualTo("body");
        }
        try (final var response = transport.execute(ClientRequest.get(URL))) {
            assertThat(response.getCacheStatus()).isEqualTo(CacheStatus.HIT_FRESH);
        }

        assertThat(messages).hasSize(3);
        assertThat(messages.get(0)).isEqualTo("cacheMiss: GET " + URL);
        assertThat(messages.get(1)).matches("\\[\\d+ ms] cacheStored: GET " + URL + " -> 200");
        assertThat(messages.get(2)).isEqualTo("cacheHit: GET " + URL + " -> 200");
    }

    @Test
    public void logsInvalidation() {
        final var transport = cache.wrap(new QueueTransport(204));

        transport.execute(ClientRequest.builder().url(URL).delete()).close();

        assertThat(messages).containsExactly(
                "cacheInvalidated: DELETE " + URL + " key=" + cache.cacheUrl(URL));
    }

    @Test
    public void defaultLoggerIsTheSystemLogger() {
        assertThat(LoggingCacheListener.Logger.DEFAULT)
                .isInstanceOf(LoggingCacheListener.Logger.SystemLogger.class);
        // Must not throw.
        LoggingCacheListener.create().cacheMiss(ClientRequest.get(URL), true);
    }

    private static final class QueueTransport implements Transport {
        private final int code;
        private final String[] headers;

        private QueueTransport(final int code, final String... headers) {
            this.code = code;
            this.headers = headers;
        }

        @Override
        public @NonNull ClientResponse execute(final @NonNull ClientRequest request) {
            return ClientResponse.builder()
                    .request(request)
                    .code(code)
                    .headers(Headers.of(headers))
                    .body(ResponseBody.create("body"))
                    .build();
        }
    }
}
