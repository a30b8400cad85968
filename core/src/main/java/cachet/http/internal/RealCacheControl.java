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

package cachet.http.internal;

import cachet.http.CacheControl;
import cachet.http.Headers;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;

import static cachet.http.internal.Utils.toNonNegativeInt;

public final class RealCacheControl implements CacheControl {
    private static final int NO_CACHE = 1;
    private static final int NO_STORE = 1 << 1;
    private static final int PRIVATE = 1 << 2;
    private static final int PUBLIC = 1 << 3;
    private static final int MUST_REVALIDATE = 1 << 4;
    private static final int IMMUTABLE = 1 << 5;

    private final int flags;
    private final int maxAgeSeconds;
    private final int maxStaleSeconds;
    private final int minFreshSeconds;

    private RealCacheControl(final int flags,
                             final int maxAgeSeconds,
                             final int maxStaleSeconds,
                             final int minFreshSeconds) {
        this.flags = flags;
        this.maxAgeSeconds = maxAgeSeconds;
        this.maxStaleSeconds = maxStaleSeconds;
        this.minFreshSeconds = minFreshSeconds;
    }

    private boolean has(final int flag) {
        return (flags & flag) != 0;
    }

    @Override
    public boolean noCache() {
        return has(NO_CACHE);
    }

    @Override
    public boolean noStore() {
        return has(NO_STORE);
    }

    @Override
    public int maxAgeSeconds() {
        return maxAgeSeconds;
    }

    @Override
    public boolean isPrivate() {
        return has(PRIVATE);
    }

    @Override
    public boolean isPublic() {
        return has(PUBLIC);
    }

    @Override
    public boolean mustRevalidate() {
        return has(MUST_REVALIDATE);
    }

    @Override
    public int maxStaleSeconds() {
        return maxStaleSeconds;
    }

    @Override
    public int minFreshSeconds() {
        return minFreshSeconds;
    }

    @Override
    public boolean immutable() {
        return has(IMMUTABLE);
    }

    /**
     * @return the directives as a {@code Cache-Control} header value, in a canonical order.
     */
    @Override
    public @NonNull String toString() {
        final var joiner = new StringJoiner(", ");
        flag(joiner, NO_CACHE, "no-cache");
        flag(joiner, NO_STORE, "no-store");
        seconds(joiner, "max-age", maxAgeSeconds);
        flag(joiner, PRIVATE, "private");
        flag(joiner, PUBLIC, "public");
        flag(joiner, MUST_REVALIDATE, "must-revalidate");
        seconds(joiner, "max-stale", maxStaleSeconds);
        seconds(joiner, "min-fresh", minFreshSeconds);
        flag(joiner, IMMUTABLE, "immutable");
        return joiner.toString();
    }

    private void flag(final @NonNull StringJoiner joiner, final int flag, final @NonNull String directive) {
        if (has(flag)) {
            joiner.add(directive);
        }
    }

    private static void seconds(final @NonNull StringJoiner joiner, final @NonNull String directive, final int value) {
        if (value != -1) {
            joiner.add(directive + "=" + value);
        }
    }

    public static @NonNull CacheControl parse(final @NonNull Headers headers) {
        Objects.requireNonNull(headers);

        final var parser = new DirectiveParser();
        for (var i = 0; i < headers.size(); i++) {
            final var name = headers.name(i);
            if (name.equalsIgnoreCase("Cache-Control") || name.equalsIgnoreCase("Pragma")) {
                parser.parse(headers.value(i));
            }
        }
        return new RealCacheControl(parser.flags, parser.maxAgeSeconds, parser.maxStaleSeconds,
                parser.minFreshSeconds);
    }

    /**
     * Reads {@code directive[=value]} elements separated by commas or semicolons. A value may be a quoted string.
     * Unknown directives are skipped.
     */
    private static final class DirectiveParser {
        private int flags = 0;
        private int maxAgeSeconds = -1;
        private int maxStaleSeconds = -1;
        private int minFreshSeconds = -1;

        private void parse(final @NonNull String headerValue) {
            final var length = headerValue.length();
            var pos = 0;
            while (pos < length) {
                final var nameEnd = scan(headerValue, pos, true);
                final var directive = headerValue.substring(pos, nameEnd).strip().toLowerCase(Locale.US);
                pos = nameEnd;

                String argument = null;
                if (pos < length && headerValue.charAt(pos) == '=') {
                    pos++;
                    while (pos < length && (headerValue.charAt(pos) == ' ' || headerValue.charAt(pos) == '\t')) {
                        pos++;
                    }
                    if (pos < length && headerValue.charAt(pos) == '"') {
                        final var closingQuote = headerValue.indexOf('"', pos + 1);
                        final var argumentEnd = (closingQuote == -1) ? length : closingQuote;
                        argument = headerValue.substring(pos + 1, argumentEnd);
                        pos = scan(headerValue, Math.min(argumentEnd + 1, length), false);
                    } else {
                        final var argumentEnd = scan(headerValue, pos, false);
                        argument = headerValue.substring(pos, argumentEnd).strip();
                        pos = argumentEnd;
                    }
                }
                // skip the separator
                pos++;

                apply(directive, argument);
            }
        }

        private void apply(final @NonNull String directive, final @Nullable String argument) {
            switch (directive) {
                case "no-cache" -> flags |= NO_CACHE;
                case "no-store" -> flags |= NO_STORE;
                case "private" -> flags |= PRIVATE;
                case "public" -> flags |= PUBLIC;
                case "must-revalidate" -> flags |= MUST_REVALIDATE;
                case "immutable" -> flags |= IMMUTABLE;
                case "max-age" -> maxAgeSeconds = toNonNegativeInt(argument, -1);
                case "max-stale" -> maxStaleSeconds = toNonNegativeInt(argument, Integer.MAX_VALUE);
                case "min-fresh" -> minFreshSeconds = toNonNegativeInt(argument, -1);
                default -> {
                    // extension directive
                }
            }
        }

        /**
         * @return the index of the next separator at or after {@code from}, or the length of {@code value}. When
         * {@code stopAtEquals} is true, {@code '='} also ends the scan.
         */
        private static int scan(final @NonNull String value, final int from, final boolean stopAtEquals) {
            for (var i = from; i < value.length(); i++) {
                final var c = value.charAt(i);
                if (c == ',' || c == ';' || (stopAtEquals && c == '=')) {
                    return i;
                }
            }
            return value.length();
        }
    }

    public static final class Builder implements CacheControl.Builder {
        private int flags = 0;
        private int maxAgeSeconds = -1;
        private int maxStaleSeconds = -1;
        private int minFreshSeconds = -1;

        @Override
        public CacheControl.@NonNull Builder noCache() {
            flags |= NO_CACHE;
            return this;
        }

        @Override
        public CacheControl.@NonNull Builder noStore() {
            flags |= NO_STORE;
            return this;
        }

        @Override
        public CacheControl.@NonNull Builder maxAge(final @NonNull Duration maxAge) {
            maxAgeSeconds = clampedSeconds(maxAge, "maxAge");
            return this;
        }

        @Override
        public CacheControl.@NonNull Builder maxStale(final @NonNull Duration maxStale) {
            maxStaleSeconds = clampedSeconds(maxStale, "maxStale");
            return this;
        }

        @Override
        public CacheControl.@NonNull Builder minFresh(final @NonNull Duration minFresh) {
            minFreshSeconds = clampedSeconds(minFresh, "minFresh");
            return this;
        }

        @Override
        public @NonNull CacheControl build() {
            return new RealCacheControl(flags, maxAgeSeconds, maxStaleSeconds, minFreshSeconds);
        }

        private static int clampedSeconds(final @NonNull Duration duration, final @NonNull String name) {
            Objects.requireNonNull(duration, name);
            if (duration.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative: " + duration);
            }
            return (int) Math.min(duration.toSeconds(), Integer.MAX_VALUE);
        }
    }
}
