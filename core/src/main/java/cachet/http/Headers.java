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

import cachet.http.internal.RealHeaders;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The header fields of a request, a response or a stored entry, in message order. Field names are matched ignoring
 * case, repeated fields stay distinct lines and values are trimmed.
 * <p>
 * A line is never split on commas. Use {@link #tokens(String)} for list-valued fields like {@code Vary}.
 * <p>
 * Instances are immutable, use {@link #builder()} or {@link #newBuilder()} to make new ones.
 */
public sealed interface Headers permits RealHeaders {
    static @NonNull Builder builder() {
        return new RealHeaders.Builder();
    }

    @NonNull
    Headers EMPTY = RealHeaders.of();

    /**
     * @return headers made of alternating field names and values.
     * @throws IllegalArgumentException if the count is odd, or if a name or a value is not a valid header token.
     */
    static @NonNull Headers of(final @NonNull String @NonNull ... namesAndValues) {
        return RealHeaders.of(namesAndValues);
    }

    /**
     * @return the value of the last {@code name} line, or null.
     */
    @Nullable
    String get(final @NonNull String name);

    /**
     * @return the value of the last {@code name} line as an HTTP date, or null if it is absent or is not a date.
     */
    @Nullable
    Instant getInstant(final @NonNull String name);

    boolean contains(final @NonNull String name);

    /**
     * @return the number of lines.
     */
    int size();

    @NonNull
    String name(final int index);

    @NonNull
    String value(final int index);

    /**
     * @return the distinct field names, ignoring case.
     */
    @NonNull
    Set<@NonNull String> names();

    /**
     * @return the values of every {@code name} line, in message order.
     */
    @NonNull
    List<@NonNull String> values(final @NonNull String name);

    /**
     * @return the comma-separated elements of every {@code name} line, trimmed, without empty elements. For
     * {@code Vary: Accept, Accept-Language} this is {@code [Accept, Accept-Language]}.
     */
    @NonNull
    List<@NonNull String> tokens(final @NonNull String name);

    @NonNull
    Builder newBuilder();

    /**
     * @return true if {@code other} has the same lines, with the same case, in the same order.
     */
    @Override
    boolean equals(final @Nullable Object other);

    /**
     * @return one {@code name: value} line per field. The values of {@code Authorization}, {@code Cookie},
     * {@code Proxy-Authorization} and {@code Set-Cookie} are redacted.
     */
    @Override
    @NonNull
    String toString();

    /**
     * @return the values of each lowercase field name.
     */
    @NonNull
    Map<@NonNull String, @NonNull List<@NonNull String>> toMultimap();

    sealed interface Builder permits RealHeaders.Builder {
        /**
         * Adds a {@code name: value} line.
         */
        @NonNull
        Builder add(final @NonNull String line);

        @NonNull
        Builder add(final @NonNull String name, final @NonNull String value);

        @NonNull
        Builder addAll(final @NonNull Headers headers);

        /**
         * Replaces all {@code name} lines with a single one.
         */
        @NonNull
        Builder set(final @NonNull String name, final @NonNull String value);

        /**
         * Replaces all {@code name} lines with a single one holding {@code value} as an HTTP date.
         */
        @NonNull
        Builder set(final @NonNull String name, final @NonNull Instant value);

        @NonNull
        Builder removeAll(final @NonNull String name);

        /**
         * @return the value of the last {@code name} line added so far, or null.
         */
        @Nullable
        String get(final @NonNull String name);

        @NonNull
        Headers build();
    }
}
