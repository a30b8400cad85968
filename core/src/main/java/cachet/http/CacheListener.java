/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import org.jspecify.annotations.NonNull;

/**
 * Listener for the decisions of a {@link Cache}. Use it to monitor the hit rate or to log cache activity.
 * <p>
 * All methods are invoked on the thread executing the request, and must not block.
 */
public interface CacheListener {
    /**
     * Invoked when a fresh stored response is served without contacting the network.
     */
    default void cacheHit(final @NonNull ClientRequest request, final @NonNull ClientResponse response) {
    }

    /**
     * Invoked when the network will be used for a request of a cacheable method.
     *
     * @param conditional true if the request carries validators of a stored response.
     */
    default void cacheMiss(final @NonNull ClientRequest request, final boolean conditional) {
    }

    /**
     * Invoked when a stored response was revalidated by a {@code 304 Not Modified}.
     */
    default void cacheConditionalHit(final @NonNull ClientRequest request,
                                     final @NonNull ClientResponse mergedResponse) {
    }

    /**
     * Invoked when a response has been written to the storage.
     */
    default void cacheStored(final @NonNull ClientRequest request, final @NonNull ClientResponse response) {
    }

    /**
     * Invoked when an unsafe request removed the stored entry of its URL.
     */
    default void cacheInvalidated(final @NonNull ClientRequest request, final @NonNull String key) {
    }

    @NonNull
    CacheListener NONE = new CacheListener() {
    };
}
