/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.logging.internal;

import cachet.http.ClientRequest;
import cachet.http.ClientResponse;
import cachet.http.logging.LoggingCacheListener;
import org.jspecify.annotations.NonNull;

import java.time.Duration;

public final class RealLoggingCacheListener implements LoggingCacheListener {
    private final @NonNull Logger logger;
    /**
     * Start of the network exchange of the current thread, set on a miss.
     */
    private final @NonNull ThreadLocal<Long> startNs = new ThreadLocal<>();

    public RealLoggingCacheListener(final @NonNull Logger logger) {
        assert logger != null;
        this.logger = logger;
    }

    @Override
    public void cacheHit(final @NonNull ClientRequest request, final @NonNull ClientResponse response) {
        startNs.remove();
        logger.log("cacheHit: " + request.getMethod() + " " + request.getUrl() + " -> " + response.getStatusCode());
    }

    @Override
    public void cacheMiss(final @NonNull ClientRequest request, final boolean conditional) {
        startNs.set(System.nanoTime());
        logger.log("cacheMiss: " + request.getMethod() + " " + request.getUrl() +
                ((conditional) ? " (conditional)" : ""));
    }

    @Override
    public void cacheConditionalHit(final @NonNull ClientRequest request,
                                    final @NonNull ClientResponse mergedResponse) {
        logWithTime("cacheConditionalHit: " + request.getMethod() + " " + request.getUrl() + " -> " +
                mergedResponse.getStatusCode());
    }

    @Override
    public void cacheStored(final @NonNull ClientRequest request, final @NonNull ClientResponse response) {
        logWithTime("cacheStored: " + request.getMethod() + " " + request.getUrl() + " -> " +
                response.getStatusCode());
    }

    @Override
    public void cacheInvalidated(final @NonNull ClientRequest request, final @NonNull String key) {
        logger.log("cacheInvalidated: " + request.getMethod() + " " + request.getUrl() + " key=" + key);
    }

    private void logWithTime(final @NonNull String message) {
        final var start = startNs.get();
        startNs.remove();
        if (start == null) {
            logger.log(message);
            return;
        }
        final var timeMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        logger.log("[" + timeMs + " ms] " + message);
    }
}
