/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

/**
 * How a {@link Cache} handled a response.
 */
public enum CacheStatus {
    /**
     * Nothing usable was stored, the response comes from the network and will not be stored.
     */
    MISS,
    /**
     * A fresh stored response was served without contacting the network.
     */
    HIT_FRESH,
    /**
     * A stale stored response was revalidated by a {@code 304 Not Modified} and served with the merged headers.
     */
    HIT_STALE_REVALIDATING,
    /**
     * The network response is eligible for storage. It is stored once its body has been read to the end.
     */
    STORED,
    /**
     * The request method is not handled by the cache, the response comes straight from the network.
     */
    PASSTHROUGH,
    /**
     * The successful response to an unsafe method removed the stored entry of its URL.
     */
    INVALIDATED
}
