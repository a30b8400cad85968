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

import cachet.http.internal.cache.RealCache;
import cachet.http.storage.CacheStorage;
import cachet.http.storage.InMemoryStorage;
import org.jspecify.annotations.NonNull;

import java.net.URI;
import java.time.Clock;
import java.util.Set;

/**
 * Caches HTTP responses in a {@link CacheStorage} so they may be reused, saving time and bandwidth. A cache decorates
 * any {@link Transport}:
 * <pre>
 * {@code
 * Cache cache = Cache.builder()
 *     .storage(new SeparateBodyFileStorage(Path.of("http-cache")))
 *     .build();
 * Transport transport = cache.wrap(new JdkHttpTransport(HttpClient.newHttpClient()));
 * try (ClientResponse response = transport.execute(ClientRequest.get("https://example.com/"))) {
 *   System.out.println(response.getCacheStatus() + " " + response.getBody().string());
 * }
 * }
 * </pre>
 * A response is stored once its body has been read to the end, so an application that closes a body early never
 * stores a truncated response.
 * <h2>Cache Optimization</h2>
 * To measure cache effectiveness, this class tracks three statistics:
 * <ul>
 * <li>{@linkplain #requestCount() Request Count:} the number of HTTP requests issued since this cache was created.
 * <li>{@linkplain #networkCount() Network Count:} the number of those requests that required network use.
 * <li>{@linkplain #hitCount() Hit Count:} the number of those requests whose responses were served by the cache.
 * </ul>
 * Sometimes a request will result in a conditional cache hit. If the cache contains a stale copy of the response, the
 * transport sends a conditional {@code GET}. The server will then send either the updated response if it has changed,
 * or a short 'not modified' response if the stored copy is still valid. Such responses increment both the network
 * count and hit count.
 * <h2>Force a Network Response</h2>
 * To skip the stored response, for instance after a user clicks a 'refresh' button, add the {@code no-cache} directive
 * to the request, see {@link CacheControl#FORCE_NETWORK}. The {@code max-age=0} directive has the same effect.
 * <h2>Invalidation</h2>
 * A successful {@code PUT}, {@code PATCH} or {@code DELETE} removes the stored response of a {@code GET} of the same
 * URL.
 */
public sealed interface Cache extends AutoCloseable permits RealCache {
    static @NonNull Builder builder() {
        return new RealCache.Builder();
    }

    /**
     * @return a transport that serves the requests of the configured cacheable methods from this cache when possible,
     * and sends everything else to {@code network}.
     */
    @NonNull
    Transport wrap(final @NonNull Transport network);

    /**
     * @return a transport like {@link #wrap(Transport)}, that caches the requests of {@code cacheableMethods} instead
     * of the configured ones.
     */
    @NonNull
    Transport wrap(final @NonNull Transport network, final @NonNull Set<String> cacheableMethods);

    /**
     * @return the storage key of a {@code GET} of {@code url}.
     * @throws IllegalArgumentException if {@code url} is not an absolute URL.
     */
    @NonNull
    String cacheUrl(final @NonNull String url);

    /**
     * Removes the stored response of a {@code GET} of {@code url}, and all its variants.
     */
    void invalidate(final @NonNull URI url);

    @NonNull
    CacheStorage getStorage();

    int writeAbortCount();

    int writeSuccessCount();

    int networkCount();

    int hitCount();

    int requestCount();

    /**
     * Closes the storage of this cache. Stored values remain where the storage keeps them.
     */
    @Override
    void close();

    /**
     * The builder used to create a {@link Cache} instance. All options have a default value.
     */
    sealed interface Builder permits RealCache.Builder {
        /**
         * Sets where responses are stored. Defaults to a new {@link InMemoryStorage}.
         */
        @NonNull
        Builder storage(final @NonNull CacheStorage storage);

        /**
         * Defaults to {@link EntrySerializer#standard()}.
         */
        @NonNull
        Builder serializer(final @NonNull EntrySerializer serializer);

        /**
         * Sets a heuristic applied to every network response of a cacheable method. There is none by default.
         */
        @NonNull
        Builder heuristic(final @NonNull Heuristic heuristic);

        /**
         * Sets the methods whose responses are looked up and stored. Defaults to {@code GET} only.
         */
        @NonNull
        Builder cacheableMethods(final @NonNull Set<String> cacheableMethods);

        /**
         * Whether an {@code ETag} makes a response eligible for storage and is used to revalidate it. Defaults to
         * true.
         */
        @NonNull
        Builder cacheEtags(final boolean cacheEtags);

        /**
         * Sets the methods whose successful responses invalidate the stored response of their URL. Defaults to
         * {@code PUT}, {@code PATCH} and {@code DELETE}.
         */
        @NonNull
        Builder invalidatingMethods(final @NonNull Set<String> invalidatingMethods);

        /**
         * Sets the clock used for freshness and timestamps. Defaults to {@link Clock#systemUTC()}.
         */
        @NonNull
        Builder clock(final @NonNull Clock clock);

        /**
         * Defaults to {@link CacheListener#NONE}.
         */
        @NonNull
        Builder listener(final @NonNull CacheListener listener);

        @NonNull
        Cache build();
    }
}
