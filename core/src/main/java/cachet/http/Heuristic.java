/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import org.jspecify.annotations.NonNull;

/**
 * Rewrites the headers of a network response before the cache decides whether to store it, for instance to add an
 * explicit {@code Cache-Control: max-age} to responses of a server that sends none.
 * <pre>
 * {@code
 * Heuristic oneHour = response -> response.newBuilder()
 *         .header("Cache-Control", "max-age=3600")
 *         .build();
 * }
 * </pre>
 * The heuristic sees every network response of a cacheable method, and the application receives the rewritten
 * response. Implementations must keep the body of {@code response} untouched.
 */
@FunctionalInterface
public interface Heuristic {
    @NonNull
    ClientResponse apply(final @NonNull ClientResponse response);
}
