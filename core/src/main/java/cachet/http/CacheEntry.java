/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * A stored response, as written by an {@link EntrySerializer}.
 *
 * @param url                the URL of the request that produced the response.
 * @param requestMethod      the method of that request.
 * @param varyHeaders        the request headers named by the response's {@code Vary} header.
 * @param statusCode         the status code of the response.
 * @param reason             the reason phrase of the response, possibly empty.
 * @param responseHeaders    the response headers, in order, with duplicates kept.
 * @param body               the body bytes, or null when the body is stored apart from the metadata.
 * @param sentRequestAt      the instant the request was sent.
 * @param receivedResponseAt the instant the response was received, or last revalidated.
 */
public record CacheEntry(
        @NonNull String url,
        @NonNull String requestMethod,
        @NonNull Headers varyHeaders,
        int statusCode,
        @NonNull String reason,
        @NonNull Headers responseHeaders,
        byte @Nullable [] body,
        @NonNull Instant sentRequestAt,
        @NonNull Instant receivedResponseAt) {
    public CacheEntry {
        Objects.requireNonNull(url);
        Objects.requireNonNull(requestMethod);
        Objects.requireNonNull(varyHeaders);
        Objects.requireNonNull(reason);
        Objects.requireNonNull(responseHeaders);
        Objects.requireNonNull(sentRequestAt);
        Objects.requireNonNull(receivedResponseAt);
    }

    /**
     * @return a copy of this entry with {@code body}.
     */
    public @NonNull CacheEntry withBody(final byte @Nullable [] body) {
        return new CacheEntry(url, requestMethod, varyHeaders, statusCode, reason, responseHeaders, body,
                sentRequestAt, receivedResponseAt);
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return other instanceof CacheEntry that
                && statusCode == that.statusCode
                && url.equals(that.url)
                && requestMethod.equals(that.requestMethod)
                && varyHeaders.equals(that.varyHeaders)
                && reason.equals(that.reason)
                && responseHeaders.equals(that.responseHeaders)
                && Arrays.equals(body, that.body)
                && sentRequestAt.equals(that.sentRequestAt)
                && receivedResponseAt.equals(that.receivedResponseAt);
    }

    @Override
    public int hashCode() {
        var result = Objects.hash(url, requestMethod, varyHeaders, statusCode, reason, responseHeaders,
                sentRequestAt, receivedResponseAt);
        result = 31 * result + Arrays.hashCode(body);
        return result;
    }

    @Override
    public @NonNull String toString() {
        return "CacheEntry{" + requestMethod + " " + url + " -> " + statusCode +
                ", body=" + ((body != null) ? body.length + " bytes" : "separate") + "}";
    }
}
