/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal;

import cachet.http.CacheControl;
import cachet.http.ClientRequest;
import cachet.http.Headers;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class RealClientRequest implements ClientRequest {
    private final @NonNull URI url;
    private final @NonNull String method;
    private final @NonNull Headers headers;
    private final byte @Nullable [] body;
    private @Nullable CacheControl cacheControl = null;

    private RealClientRequest(final @NonNull Builder builder) {
        assert builder != null;
        assert builder.url != null;

        this.url = builder.url;
        this.method = builder.method;
        this.headers = builder.headers.build();
        this.body = builder.body;
    }

    @Override
    public @NonNull URI getUrl() {
        return url;
    }

    @Override
    public @NonNull String getMethod() {
        return method;
    }

    @Override
    public @NonNull Headers getHeaders() {
        return headers;
    }

    @Override
    public byte @Nullable [] getBody() {
        return body;
    }

    @Override
    public @Nullable String header(final @NonNull String name) {
        Objects.requireNonNull(name);
        return headers.get(name);
    }

    @Override
    public @NonNull List<String> headers(final @NonNull String name) {
        Objects.requireNonNull(name);
        return headers.values(name);
    }

    @Override
    public @NonNull CacheControl getCacheControl() {
        var result = cacheControl;
        if (result == null) {
            result = CacheControl.parse(headers);
            cacheControl = result;
        }
        return result;
    }

    @Override
    public ClientRequest.@NonNull Builder newBuilder() {
        return new Builder(this);
    }

    @Override
    public @NonNull String toString() {
        return "ClientRequest{method=" + method + ", url=" + url + "}";
    }

    public static final class Builder implements ClientRequest.Builder {
        private @Nullable URI url = null;
        private @NonNull String method = "GET";
        private Headers.@NonNull Builder headers;
        private byte @Nullable [] body = null;

        public Builder() {
            headers = Headers.builder();
        }

        private Builder(final @NonNull RealClientRequest request) {
            assert request != null;

            this.url = request.url;
            this.method = request.method;
            this.headers = request.headers.newBuilder();
            this.body = request.body;
        }

        @Override
        public ClientRequest.@NonNull Builder url(final @NonNull String url) {
            Objects.requireNonNull(url);
            final URI parsed;
            try {
                parsed = URI.create(url);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid URL: " + url, e);
            }
            return url(parsed);
        }

        @Override
        public ClientRequest.@NonNull Builder url(final @NonNull URI url) {
            Objects.requireNonNull(url);
            final var scheme = url.getScheme();
            if (!url.isAbsolute() || url.getHost() == null ||
                    !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException("Expected an absolute http or https URL: " + url);
            }
            this.url = url;
            return this;
        }

        @Override
        public ClientRequest.@NonNull Builder header(final @NonNull String name, final @NonNull String value) {
            headers.set(name, value);
            return this;
        }

        @Override
        public ClientRequest.@NonNull Builder addHeader(final @NonNull String name, final @NonNull String value) {
            headers.add(name, value);
            return this;
        }

        @Override
        public ClientRequest.@NonNull Builder removeHeader(final @NonNull String name) {
            headers.removeAll(name);
            return this;
        }

        @Override
        public ClientRequest.@NonNull Builder headers(final @NonNull Headers headers) {
            Objects.requireNonNull(headers);
            this.headers = headers.newBuilder();
            return this;
        }

        @Override
        public ClientRequest.@NonNull Builder cacheControl(final @NonNull CacheControl cacheControl) {
            Objects.requireNonNull(cacheControl);
            final var value = cacheControl.toString();
            if (value.isEmpty()) {
                return removeHeader("Cache-Control");
            }
            return header("Cache-Control", value);
        }

        @Override
        public @NonNull ClientRequest get() {
            return method("GET", null);
        }

        @Override
        public @NonNull ClientRequest head() {
            return method("HEAD", null);
        }

        @Override
        public @NonNull ClientRequest delete() {
            return method("DELETE", null);
        }

        @Override
        public @NonNull ClientRequest post(final byte @NonNull [] body) {
            Objects.requireNonNull(body);
            return method("POST", body);
        }

        @Override
        public @NonNull ClientRequest put(final byte @NonNull [] body) {
            Objects.requireNonNull(body);
            return method("PUT", body);
        }

        @Override
        public @NonNull ClientRequest patch(final byte @NonNull [] body) {
            Objects.requireNonNull(body);
            return method("PATCH", body);
        }

        @Override
        public @NonNull ClientRequest method(final @NonNull String method, final byte @Nullable [] body) {
            Objects.requireNonNull(method);
            if (method.isBlank()) {
                throw new IllegalArgumentException("method.isBlank()");
            }
            if (url == null) {
                throw new IllegalStateException("url == null");
            }
            this.method = method.toUpperCase(Locale.US);
            this.body = body;
            return new RealClientRequest(this);
        }
    }
}
