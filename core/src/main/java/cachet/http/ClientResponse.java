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

import cachet.http.internal.RealClientResponse;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * A response returned by a {@link Transport}, possibly rebuilt from a stored entry. Everything but the body is
 * immutable. The body streams once and closing the response closes it.
 */
public sealed interface ClientResponse extends AutoCloseable permits RealClientResponse {
    static @NonNull Builder builder() {
        return new RealClientResponse.Builder();
    }

    /**
     * @return the request that initiated this HTTP response. For a response served or revalidated by the cache, this
     * is the application's request, not the conditional one sent over the network.
     */
    @NonNull
    ClientRequest getRequest();

    int getStatusCode();

    /**
     * @return the HTTP reason phrase, which may be empty.
     */
    @NonNull
    String getReason();

    @NonNull
    Headers getHeaders();

    /**
     * @return the one-shot body of this response. It must be closed.
     */
    @NonNull
    ResponseBody getBody();

    /**
     * @return how the cache handled this response. A response that never went through a cache is
     * {@link CacheStatus#PASSTHROUGH}.
     */
    @NonNull
    CacheStatus getCacheStatus();

    /**
     * @return true if this response was served from a stored entry, either fresh or revalidated by a {@code 304}.
     */
    boolean isFromCache();

    /**
     * @return when the request was handed to the network. For a stored entry, the time of the exchange that produced
     * it.
     */
    @NonNull
    Instant getSentRequestAt();

    /**
     * @return when the response head arrived. For a stored entry, the time it was received or last revalidated. The
     * current age of an entry is computed from this instant.
     */
    @NonNull
    Instant getReceivedResponseAt();

    /**
     * @return true for a {@code 2xx} status code.
     */
    boolean isSuccessful();

    @Nullable
    String header(final @NonNull String name);

    @NonNull
    List<String> headers(final @NonNull String name);

    /**
     * @return the parsed {@code Cache-Control} and {@code Pragma} directives, empty ones when the headers are absent.
     */
    @NonNull
    CacheControl getCacheControl();

    @NonNull
    Builder newBuilder();

    /**
     * Closes the response body.
     */
    @Override
    void close();

    /**
     * The builder used to create a {@link ClientResponse} instance.
     */
    sealed interface Builder permits RealClientResponse.Builder {
        @NonNull
        Builder request(final @NonNull ClientRequest request);

        @NonNull
        Builder code(final int code);

        @NonNull
        Builder reason(final @NonNull String reason);

        /**
         * Replaces every existing {@code name} header with a single one.
         */
        @NonNull
        Builder header(final @NonNull String name, final @NonNull String value);

        /**
         * Appends a {@code name} header, keeping the existing ones.
         */
        @NonNull
        Builder addHeader(final @NonNull String name, final @NonNull String value);

        @NonNull
        Builder removeHeader(final @NonNull String name);

        /**
         * Replaces the headers collected so far.
         */
        @NonNull
        Builder headers(final @NonNull Headers headers);

        @NonNull
        Builder body(final @NonNull ResponseBody body);

        @NonNull
        Builder cacheStatus(final @NonNull CacheStatus cacheStatus);

        @NonNull
        Builder sentRequestAt(final @NonNull Instant sentRequestAt);

        @NonNull
        Builder receivedResponseAt(final @NonNull Instant receivedResponseAt);

        @NonNull
        ClientResponse build();
    }
}
