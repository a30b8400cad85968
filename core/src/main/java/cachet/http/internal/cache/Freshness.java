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

package cachet.http.internal.cache;

import cachet.http.CacheControl;
import cachet.http.Headers;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

import static cachet.http.internal.DateFormatting.toHttpInstantOrNull;
import static cachet.http.internal.Utils.toNonNegativeInt;
import static java.time.temporal.ChronoUnit.MILLIS;

/**
 * The age and freshness of a stored response, as seen by a request at a given instant.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7234#section-4.2">RFC 7234, 4.2</a>.
 */
final class Freshness {
    private final @NonNull Instant now;
    private final @NonNull CacheControl responseCaching;

    /**
     * The server's time when the stored response was served, if known.
     */
    private @Nullable Instant served = null;

    /**
     * The expiration date of the stored response, if known. If both this field and the max age are set, the max age
     * is preferred.
     */
    private @Nullable Instant expires = null;

    private final @NonNull Instant sentRequest;
    private final @NonNull Instant receivedResponse;

    /**
     * The value of the {@code Age} header of the stored response, or -1.
     */
    private int ageSeconds = -1;

    Freshness(final @NonNull Instant now,
              final @NonNull Headers responseHeaders,
              final @NonNull Instant sentRequest,
              final @NonNull Instant receivedResponse) {
        assert now != null;
        assert responseHeaders != null;
        assert sentRequest != null;
        assert receivedResponse != null;

        this.now = now;
        this.responseCaching = CacheControl.parse(responseHeaders);
        this.sentRequest = sentRequest;
        this.receivedResponse = receivedResponse;
        for (var i = 0; i < responseHeaders.size(); i++) {
            final var fieldName = responseHeaders.name(i);
            final var value = responseHeaders.value(i);
            if (fieldName.equalsIgnoreCase("Date")) {
                served = toHttpInstantOrNull(value);
            } else if (fieldName.equalsIgnoreCase("Expires")) {
                expires = toHttpInstantOrNull(value);
            } else if (fieldName.equalsIgnoreCase("Age")) {
                ageSeconds = toNonNegativeInt(value, -1);
            }
        }
    }

    /**
     * @return true if the stored response may be served for a request with {@code requestCaching} directives without
     * revalidation.
     */
    boolean isFresh(final @NonNull CacheControl requestCaching) {
        assert requestCaching != null;

        if (responseCaching.noCache()) {
            return false;
        }

        final var ageMillis = currentAgeMillis();
        var freshMillis = freshnessLifetimeMillis();

        if (requestCaching.maxAgeSeconds() != -1) {
            freshMillis = Math.min(freshMillis, Duration.ofSeconds(requestCaching.maxAgeSeconds()).toMillis());
        }

        var minFreshMillis = 0L;
        if (requestCaching.minFreshSeconds() != -1) {
            minFreshMillis = Duration.ofSeconds(requestCaching.minFreshSeconds()).toMillis();
        }

        var maxStaleMillis = 0L;
        if (!responseCaching.mustRevalidate() && requestCaching.maxStaleSeconds() != -1) {
            maxStaleMillis = Duration.ofSeconds(requestCaching.maxStaleSeconds()).toMillis();
        }

        return ageMillis + minFreshMillis < saturatedAdd(freshMillis, maxStaleMillis);
    }

    /**
     * @return true if the response carries explicit freshness information, {@code max-age} or {@code Expires}.
     */
    boolean hasExplicitLifetime() {
        return responseCaching.maxAgeSeconds() != -1 || expires != null;
    }

    /**
     * @return the number of milliseconds that the response is fresh for, starting from the served date.
     */
    long freshnessLifetimeMillis() {
        if (responseCaching.maxAgeSeconds() != -1) {
            return Duration.ofSeconds(responseCaching.maxAgeSeconds()).toMillis();
        }

        if (expires != null) {
            final var realServed = (served != null) ? served : receivedResponse;
            final var delta = realServed.until(expires, MILLIS);
            return Math.max(delta, 0L);
        }

        return 0L;
    }

    /**
     * @return the current age of the response, in milliseconds. The calculation is specified by RFC 7234, 4.2.3
     * Calculating Age.
     */
    long currentAgeMillis() {
        final var apparentReceivedAge = (served != null)
                ? Math.max(0, served.until(receivedResponse, MILLIS))
                : 0;

        final var receivedAge = (ageSeconds != -1)
                ? Math.max(apparentReceivedAge, Duration.ofSeconds(ageSeconds).toMillis())
                : apparentReceivedAge;

        final var responseDuration = Math.max(0, sentRequest.until(receivedResponse, MILLIS));
        final var residentDuration = Math.max(0, receivedResponse.until(now, MILLIS));
        return receivedAge + responseDuration + residentDuration;
    }

    private static long saturatedAdd(final long a, final long b) {
        final var result = a + b;
        return (((a ^ result) & (b ^ result)) < 0) ? Long.MAX_VALUE : result;
    }
}
