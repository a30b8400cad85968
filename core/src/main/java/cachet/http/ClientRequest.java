/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import cachet.http.internal.RealClientRequest;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * An HTTP client request, as handed to a {@link Transport}. Instances of this class are immutable.
 */
public sealed interface ClientRequest permits RealClientRequest {
    static @NonNull ClientRequest get(final @NonNull String url) {
        Objects.requireNonNull(url);
        return builder().url(url).get();
    }

    static @NonNull Builder builder() {
        return new RealClientRequest.Builder();
    }

    /**
     * @return the absolute target of this request.
     */
    @NonNull
    URI getUrl();

    @NonNull
    String getMethod();

    @NonNull
    Headers getHeaders();

    /**
     * @return the request body, or null if this request has none. The returned array must not be modified.
     */
    byte @Nullable [] getBody();

    @Nullable
    String header(final @NonNull String name);

    @NonNull
    List<String> headers(final @NonNull String name);

    /**
     * @return the cache control directives for this request. This is never null, even if this request contains no
     * {@code Cache-Control} header.
     */
    @NonNull
    CacheControl getCacheControl();

    /**
     * @return a builder based on this request.
     */
    @NonNull
    Builder newBuilder();

    /**
     * The builder used to create a {@link ClientRequest} instance. The terminal methods ({@link #get()},
     * {@link #delete()}, {@link #method(String, byte[])}...) set the method and build the request.
     */
    sealed interface Builder permits RealClientRequest.Builder {
        /**
         * Sets the URL target of this request.
         *
         * @throws IllegalArgumentException if {@code url} is not an absolute HTTP or HTTPS URI.
         */
        @NonNull
        Builder url(final @NonNull String url);

        /**
         * Sets the URL target of this request.
         *
         * @throws IllegalArgumentException if {@code url} is not an absolute HTTP or HTTPS URI.
         */
        @NonNull
        Builder url(final @NonNull URI url);

        /**
         * Sets the header named {@code name} to {@code value}. If this request already has any headers with that name,
         * they are all replaced.
         */
        @NonNull
        Builder header(final @NonNull String name, final @NonNull String value);

        /**
         * Adds a header with {@code name} to {@code value}.
         */
        @NonNull
        Builder addHeader(final @NonNull String name, final @NonNull String value);

        /**
         * Removes all headers named {@code name} on this builder.
         */
        @NonNull
        Builder removeHeader(final @NonNull String name);

        /**
         * Remove all headers on this builder and adds {@code headers}.
         */
        @NonNull
        Builder headers(final @NonNull Headers headers);

        /**
         * Sets this request's {@code Cache-Control} header, replacing any cache control headers already present. If
         * {@code cacheControl} doesn't define any directives, this clears this request's cache-control headers.
         */
        @NonNull
        Builder cacheControl(final @NonNull CacheControl cacheControl);

        @NonNull
        ClientRequest get();

        @NonNull
        ClientRequest head();

        @NonNull
        ClientRequest delete();

        @NonNull
        ClientRequest post(final byte @NonNull [] body);

        @NonNull
        ClientRequest put(final byte @NonNull [] body);

        @NonNull
        ClientRequest patch(final byte @NonNull [] body);

        /**
         * @param method a non-empty HTTP method token, such as {@code GET} or {@code OPTIONS}.
         * @param body   the request body, or null for none.
         */
        @NonNull
        ClientRequest method(final @NonNull String method, final byte @Nullable [] body);
    }
}
