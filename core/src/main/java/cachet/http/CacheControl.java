/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 *
 * Forked from OkHttp (https://github.com/square/okhttp), original copyright is below
 *
 * Copyright (C) 2013 Square, Inc.
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

package cachet.http;

import cachet.http.internal.RealCacheControl;
import org.jspecify.annotations.NonNull;

import java.time.Duration;

/**
 * The directives of the {@code Cache-Control} (and legacy {@code Pragma}) headers of a request or a response. They
 * decide which responses may be stored, and which requests may be answered by those stored responses.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7234#section-5.2">RFC 7234, 5.2</a>.
 */
public sealed interface CacheControl permits RealCacheControl {
    /**
     * Request directives that skip the stored entry. The response may still be revalidated and stored.
     */
    @NonNull
    CacheControl FORCE_NETWORK = builder().noCache().build();

    static @NonNull Builder builder() {
        return new RealCacheControl.Builder();
    }

    /**
     * Reads every {@code Cache-Control} and {@code Pragma} line of {@code headers}. Directives may be separated by
     * commas or semicolons, values may be quoted, and directives this cache does not know are skipped.
     */
    static @NonNull CacheControl parse(final @NonNull Headers headers) {
        return RealCacheControl.parse(headers);
    }

    /**
     * On a response, the entry may be stored but has to be revalidated before each use. On a request, no stored entry
     * may answer it without asking the origin.
     */
    boolean noCache();

    /**
     * Nothing about this exchange may be written to the storage.
     */
    boolean noStore();

    /**
     * Response side: the freshness lifetime in seconds. Request side: the oldest entry the client will take.
     * {@code -1} when absent.
     */
    int maxAgeSeconds();

    boolean isPrivate();

    boolean isPublic();

    /**
     * Once stale, the entry must be revalidated whatever {@code max-stale} the request carries.
     */
    boolean mustRevalidate();

    /**
     * A request directive, the number of seconds of staleness the client accepts. {@link Integer#MAX_VALUE} when the
     * directive has no value, {@code -1} when absent.
     */
    int maxStaleSeconds();

    /**
     * A request directive, the number of seconds a response must stay fresh for. {@code -1} when absent.
     */
    int minFreshSeconds();

    boolean immutable();

    /**
     * The builder used to create a {@link CacheControl} instance.
     */
    sealed interface Builder permits RealCacheControl.Builder {
        /**
         * Asks the cache to revalidate instead of serving a stored entry as is.
         */
        @NonNull
        Builder noCache();

        /**
         * Asks the cache to keep the response out of the storage.
         */
        @NonNull
        Builder noStore();

        /**
         * Entries older than {@code maxAge} are not served to this request. Truncated to whole seconds.
         *
         * @throws IllegalArgumentException if {@code maxAge} is negative.
         */
        @NonNull
        Builder maxAge(final @NonNull Duration maxAge);

        @NonNull
        Builder maxStale(final @NonNull Duration maxStale);

        @NonNull
        Builder minFresh(final @NonNull Duration minFresh);

        @NonNull
        CacheControl build();
    }
}
