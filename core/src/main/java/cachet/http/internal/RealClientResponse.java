/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal;

import cachet.http.*;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public final class RealClientResponse implements ClientResponse {
    private final @NonNull ClientRequest request;
    private final int statusCode;
    private final @NonNull String reason;
    private final @NonNull Headers headers;
    private final @NonNull ResponseBody body;
    private final @NonNull CacheStatus cacheStatus;
    private final @NonNull Instant sentRequestAt;
    private final @NonNull Instant receivedResponseAt;
    private @Nullable CacheControl lazyCacheControl = null;

    private RealClientResponse(final @NonNull Builder builder) {
        assert builder != null;
        assert builder.request != null;

        this.request = builder.request;
        this.statusCode = builder.code;
        this.reason = builder.reason;
        this.headers = builder.headers.build();
        this.body = builder.body;
        this.cacheStatus = builder.cacheStatus;
        this.sentRequestAt = (builder.sentRequestAt != null) ? builder.sentRequestAt : Instant.EPOCH;
        this.receivedResponseAt = (builder.receivedResponseAt != null) ? builder.receivedResponseAt : Instant.EPOCH;
    }

    @Override
    public @NonNull ClientRequest getRequest() {
        return request;
    }

    @Override
    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public @NonNull String getReason() {
        return reason;
    }

    @Override
    public @NonNull Headers getHeaders() {
        return headers;
    }

    @Override
    public @NonNull ResponseBody getBody() {
        return body;
    }

    @Override
    public @NonNull CacheStatus getCacheStatus() {
        return cacheStatus;
    }

    @Override
    public boolean isFromCache() {
        return cacheStatus == CacheStatus.HIT_FRESH || cacheStatus == CacheStatus.HIT_STALE_REVALIDATING;
    }

    @Override
    public @NonNull Instant getSentRequestAt() {
        return sentRequestAt;
    }

    @Override
    public @NonNull Instant getReceivedResponseAt() {
        return receivedResponseAt;
    }

    @Override
    public boolean isSuccessful() {
        return statusCode > 199 && statusCode < 300;
    }

    @Override
    public @Nullable String header(final @NonNull String name) {
        return headers.get(name);
    }

    @Override
    public @NonNull List<String> headers(final @NonNull String name) {
        return headers.values(name);
    }

    @Override
    public @NonNull CacheControl getCacheControl() {
        if (lazyCacheControl == null) {
            lazyCacheControl = CacheControl.parse(headers);
        }
        return lazyCacheControl;
    }

    @Override
    public ClientResponse.@NonNull Builder newBuilder() {
        return new Builder(this);
    }

    @Override
    public void close() {
        body.close();
    }

    @Override
    public @NonNull String toString() {
        return "ClientResponse{code=" + statusCode +
                ", reason=" + reason +
                ", url=" + request.getUrl() +
                ", cacheStatus=" + cacheStatus +
                "}";
    }

    public static final class Builder implements ClientResponse.Builder {
        private @Nullable ClientRequest request = null;
        private int code = -1;
        private @NonNull String reason = "";
        private Headers.@NonNull Builder headers;
        private @NonNull ResponseBody body = ResponseBody.EMPTY;
        private @NonNull CacheStatus cacheStatus = CacheStatus.PASSTHROUGH;
        private @Nullable Instant sentRequestAt = null;
        private @Nullable Instant receivedResponseAt = null;

        public Builder() {
            headers = Headers.builder();
        }

        private Builder(final @NonNull RealClientResponse response) {
            this.request = response.request;
            this.code = response.statusCode;
            this.reason = response.reason;
            this.headers = response.headers.newBuilder();
            this.body = response.body;
            this.cacheStatus = response.cacheStatus;
            this.sentRequestAt = response.sentRequestAt;
            this.receivedResponseAt = response.receivedResponseAt;
        }

        @Override
        public ClientResponse.@NonNull Builder request(final @NonNull ClientRequest request) {
            this.request = Objects.requireNonNull(request);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder code(final int code) {
            this.code = code;
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder reason(final @NonNull String reason) {
            this.reason = Objects.requireNonNull(reason);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder header(final @NonNull String name, final @NonNull String value) {
            headers.set(name, value);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder addHeader(final @NonNull String name, final @NonNull String value) {
            headers.add(name, value);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder removeHeader(final @NonNull String name) {
            headers.removeAll(name);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder headers(final @NonNull Headers headers) {
            Objects.requireNonNull(headers);
            this.headers = headers.newBuilder();
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder body(final @NonNull ResponseBody body) {
            this.body = Objects.requireNonNull(body);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder cacheStatus(final @NonNull CacheStatus cacheStatus) {
            this.cacheStatus = Objects.requireNonNull(cacheStatus);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder sentRequestAt(final @NonNull Instant sentRequestAt) {
            this.sentRequestAt = Objects.requireNonNull(sentRequestAt);
            return this;
        }

        @Override
        public ClientResponse.@NonNull Builder receivedResponseAt(final @NonNull Instant receivedResponseAt) {
            this.receivedResponseAt = Objects.requireNonNull(receivedResponseAt);
            return this;
        }

        @Override
        public @NonNull ClientResponse build() {
            if (code < 0) {
                throw new IllegalStateException("code < 0: " + code);
            }
            if (request == null) {
                throw new IllegalStateException("request == null");
            }
            return new RealClientResponse(this);
        }
    }
}
