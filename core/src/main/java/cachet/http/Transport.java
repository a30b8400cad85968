/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import org.jspecify.annotations.NonNull;

/**
 * Sends requests and receives responses. The network side of a {@link Cache}, which decorates a transport with
 * {@link Cache#wrap(Transport)}.
 * <p>
 * Implementations stream the response body: the returned {@link ClientResponse#getBody()} must not be read ahead.
 */
@FunctionalInterface
public interface Transport {
    /**
     * @throws java.io.UncheckedIOException if the request could not be executed due to a connectivity problem or
     *                                      timeout.
     */
    @NonNull
    ClientResponse execute(final @NonNull ClientRequest request);
}
