/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 *
 * Forked from OkHttp (https://github.com/square/okhttp), original copyright is below
 *
 * Copyright (C) 2015 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package cachet.http.internal.cache;

import cachet.http.*;
import org.jspecify.annotations.NonNull;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Set;

import static cachet.http.internal.Utils.discard;
import static java.lang.System.Logger.Level.DEBUG;

/**
 * Serves requests from the cache and writes responses to the cache.
 */
final class CacheInterceptor implements Transport {
    private static final System.Logger LOGGER = System.getLogger("cachet.http.Cache");

    private final @NonNull RealCache cache;
    private final @NonNull Transport network;
    private final @NonNull Set<String> cacheableMethods;

    CacheInterceptor(final @NonNull RealCache cache,
                     final @NonNull Transport network,
                     final @NonNull Set<String> cacheableMethods) {
        assert cache != null;
        assert network != null;
        assert cacheableMethods != null;

        this.cache = cache;
        this.network = network;
        this.cacheableMethods = cacheableMethods;
    }

    @Override
    public @NonNull ClientResponse execute(final @NonNull ClientRequest request) {
        Objects.requireNonNull(request);

        final var controller = cache.controller();
        final var listener = cache.listener();
        final var cacheable = cacheableMethods.contains(request.getMethod());
        cache.trackRequest();

        var networkRequest = request;
        if (cacheable) {
            final var cacheResponse = controller.cachedRequest(request);
            if (cacheResponse != null) {
                // We don't need the network. We're done.
                cache.trackHit();
                listener.cacheHit(request, cacheResponse);
                return cacheResponse;
            }

            final var conditions = controller.conditionalHeaders(request);
            if (!conditions.isEmpty()) {
                final var builder = request.newBuilder();
                conditions.forEach(builder::header);
                networkRequest = builder.method(request.getMethod(), request.getBody());
            }
            listener.cacheMiss(request, !conditions.isEmpty());
        }

        final var sentRequestAt = cache.clock().instant();
        // A transport failure propagates as is, nothing was stored.
        final var rawResponse = network.execute(networkRequest);
        cache.trackNetwork();
        var response = rawResponse.newBuilder()
                .request(request)
                .sentRequestAt(sentRequestAt)
                .receivedResponseAt(cache.clock().instant())
                .cacheStatus((cacheable) ? CacheStatus.MISS : CacheStatus.PASSTHROUGH)
                .build();

        if (cacheable) {
            response = handleNetworkResponse(request, controller.applyHeuristic(response));
        }

        // See if we should invalidate the cache.
        final var statusCode = response.getStatusCode();
        if (cache.invalidatingMethods().contains(request.getMethod()) && statusCode >= 200 && statusCode < 400) {
            final var key = controller.invalidate(request);
            listener.cacheInvalidated(request, key);
            response = response.newBuilder()
                    .cacheStatus(CacheStatus.INVALIDATED)
                    .build();
        }

        return response;
    }

    private @NonNull ClientResponse handleNetworkResponse(final @NonNull ClientRequest request,
                                                          final @NonNull ClientResponse response) {
        final var controller = cache.controller();
        final var listener = cache.listener();

        if (response.getStatusCode() == 304) {
            final var merged = controller.updateCachedResponse(request, response);
            if (merged == response) {
                return response;
            }
            // We are done with the network response, read a possible body and release it.
            try {
                discard(response.getBody().byteStream());
            } catch (UncheckedIOException e) {
                LOGGER.log(DEBUG, "Failed to drain the 304 body of " + request.getUrl(), e);
            }
            cache.trackHit();
            listener.cacheConditionalHit(request, merged);
            return merged;
        }

        if (CacheController.PERMANENT_REDIRECT_STATUSES.contains(response.getStatusCode())) {
            // Stored right away, the body of a redirect is not kept.
            final var stored = controller.storeResponse(request, response, new byte[0]);
            cache.trackWrite(stored);
            if (!stored) {
                return response;
            }
            listener.cacheStored(request, response);
            return response.newBuilder()
                    .cacheStatus(CacheStatus.STORED)
                    .build();
        }

        if (!controller.isCacheable(request, response)) {
            return response;
        }

        return cacheWritingResponse(request, response);
    }

    /**
     * @return a response that stores itself once its body has been read to the end.
     */
    private @NonNull ClientResponse cacheWritingResponse(final @NonNull ClientRequest request,
                                                         final @NonNull ClientResponse response) {
        final var controller = cache.controller();
        final var body = response.getBody();
        final var capture = new StreamingCapture(body.byteStream(), body.contentByteSize(), body.isChunked(),
                bytes -> {
                    final var stored = controller.storeResponse(request, response, bytes);
                    cache.trackWrite(stored);
                    if (stored) {
                        cache.listener().cacheStored(request, response);
                    }
                });

        final var cacheWritingBody = new ResponseBody() {
            @Override
            public long contentByteSize() {
                return body.contentByteSize();
            }

            @Override
            public boolean isChunked() {
                return body.isChunked();
            }

            @Override
            public @NonNull InputStream byteStream() {
                return capture;
            }
        };
        return response.newBuilder()
                .body(cacheWritingBody)
                .cacheStatus(CacheStatus.STORED)
                .build();
    }
}
