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

import cachet.http.Headers;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.*;

import static cachet.http.internal.DateFormatting.toHttpInstantOrNull;
import static cachet.http.internal.DateFormatting.toHttpInstantString;
import static cachet.http.internal.Utils.isSensitiveHeader;

public final class RealHeaders implements Headers {
    private final @NonNull String @NonNull [] names;
    private final @NonNull String @NonNull [] values;

    private RealHeaders(final @NonNull String @NonNull [] names, final @NonNull String @NonNull [] values) {
        assert names.length == values.length;

        this.names = names;
        this.values = values;
    }

    @Override
    public @Nullable String get(final @NonNull String name) {
        Objects.requireNonNull(name);
        final var index = lastIndexOf(names, names.length, name);
        return (index != -1) ? values[index] : null;
    }

    @Override
    public @Nullable Instant getInstant(final @NonNull String name) {
        final var value = get(name);
        return (value != null) ? toHttpInstantOrNull(value) : null;
    }

    @Override
    public boolean contains(final @NonNull String name) {
        Objects.requireNonNull(name);
        return lastIndexOf(names, names.length, name) != -1;
    }

    @Override
    public int size() {
        return names.length;
    }

    @Override
    public @NonNull String name(final int index) {
        Objects.checkIndex(index, names.length);
        return names[index];
    }

    @Override
    public @NonNull String value(final int index) {
        Objects.checkIndex(index, values.length);
        return values[index];
    }

    @Override
    public @NonNull Set<@NonNull String> names() {
        final var result = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        result.addAll(Arrays.asList(names));
        return Collections.unmodifiableSet(result);
    }

    @Override
    public @NonNull List<@NonNull String> values(final @NonNull String name) {
        Objects.requireNonNull(name);
        final var result = new ArrayList<String>(1);
        for (var i = 0; i < names.length; i++) {
            if (names[i].equalsIgnoreCase(name)) {
                result.add(values[i]);
            }
        }
        return List.copyOf(result);
    }

    @Override
    public @NonNull List<@NonNull String> tokens(final @NonNull String name) {
        Objects.requireNonNull(name);
        final var result = new ArrayList<String>();
        for (final var line : values(name)) {
            for (final var element : line.split(",")) {
                final var token = element.strip();
                if (!token.isEmpty()) {
                    result.add(token);
                }
            }
        }
        return List.copyOf(result);
    }

    @Override
    public Headers.@NonNull Builder newBuilder() {
        final var result = new Builder();
        for (var i = 0; i < names.length; i++) {
            result.addLenient(names[i], values[i]);
        }
        return result;
    }

    @Override
    public @NonNull Map<@NonNull String, @NonNull List<@NonNull String>> toMultimap() {
        final var result = new TreeMap<String, List<String>>(String.CASE_INSENSITIVE_ORDER);
        for (var i = 0; i < names.length; i++) {
            result.computeIfAbsent(names[i].toLowerCase(Locale.US), k -> new ArrayList<>(1)).add(values[i]);
        }
        return result;
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        if (!(other instanceof RealHeaders that)) {
            return false;
        }
        return Arrays.equals(names, that.names) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(names) + Arrays.hashCode(values);
    }

    @Override
    public @NonNull String toString() {
        final var sb = new StringBuilder();
        for (var i = 0; i < names.length; i++) {
            sb.append(names[i])
                    .append(": ")
                    .append(isSensitiveHeader(names[i]) ? "\u2588\u2588" : values[i])
                    .append('\n');
        }
        return sb.toString();
    }

    public static @NonNull Headers of(final @NonNull String @NonNull ... namesAndValues) {
        Objects.requireNonNull(namesAndValues);
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating header names and values, got " +
                    namesAndValues.length + " strings");
        }

        final var builder = new Builder();
        for (var i = 0; i < namesAndValues.length; i += 2) {
            final var name = namesAndValues[i];
            final var value = namesAndValues[i + 1];
            if (name == null || value == null) {
                throw new IllegalArgumentException("Header names and values cannot be null");
            }
            builder.add(name.strip(), value);
        }
        return builder.build();
    }

    private static int lastIndexOf(final @NonNull String @NonNull [] names,
                                   final int size,
                                   final @NonNull String name) {
        for (var i = size - 1; i >= 0; i--) {
            if (names[i].equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Field names are visible ASCII, values are visible ASCII, spaces and tabs.
     */
    private static void checkField(final @NonNull String name, final @NonNull String value) {
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Header name is empty");
        }
        for (var i = 0; i < name.length(); i++) {
            final var c = name.charAt(i);
            if (c <= ' ' || c >= 0x7f) {
                throw new IllegalArgumentException(String.format(
                        "Unexpected char 0x%02x at %d in header name: %s", (int) c, i, name));
            }
        }
        for (var i = 0; i < value.length(); i++) {
            final var c = value.charAt(i);
            if ((c < ' ' && c != '\t') || c >= 0x7f) {
                // Never echo a secret.
                final var shown = isSensitiveHeader(name) ? "" : ": " + value;
                throw new IllegalArgumentException(String.format(
                        "Unexpected char 0x%02x at %d in %s value%s", (int) c, i, name, shown));
            }
        }
    }

    public static final class Builder implements Headers.Builder {
        private final @NonNull List<String> names = new ArrayList<>(16);
        private final @NonNull List<String> values = new ArrayList<>(16);

        @Override
        public Headers.@NonNull Builder add(final @NonNull String line) {
            Objects.requireNonNull(line);
            final var colon = line.indexOf(':');
            if (colon == -1) {
                throw new IllegalArgumentException("Expected a header line \"name: value\" but was " + line);
            }
            return add(line.substring(0, colon).strip(), line.substring(colon + 1));
        }

        @Override
        public Headers.@NonNull Builder add(final @NonNull String name, final @NonNull String value) {
            Objects.requireNonNull(name);
            Objects.requireNonNull(value);
            final var trimmed = value.strip();
            checkField(name, trimmed);
            return addLenient(name, trimmed);
        }

        @Override
        public Headers.@NonNull Builder addAll(final @NonNull Headers headers) {
            Objects.requireNonNull(headers);
            for (var i = 0; i < headers.size(); i++) {
                addLenient(headers.name(i), headers.value(i));
            }
            return this;
        }

        @Override
        public Headers.@NonNull Builder set(final @NonNull String name, final @NonNull String value) {
            Objects.requireNonNull(name);
            Objects.requireNonNull(value);
            final var trimmed = value.strip();
            checkField(name, trimmed);
            removeAll(name);
            return addLenient(name, trimmed);
        }

        @Override
        public Headers.@NonNull Builder set(final @NonNull String name, final @NonNull Instant value) {
            Objects.requireNonNull(value);
            return set(name, toHttpInstantString(value));
        }

        @Override
        public Headers.@NonNull Builder removeAll(final @NonNull String name) {
            Objects.requireNonNull(name);
            for (var i = names.size() - 1; i >= 0; i--) {
                if (names.get(i).equalsIgnoreCase(name)) {
                    names.remove(i);
                    values.remove(i);
                }
            }
            return this;
        }

        @Override
        public @Nullable String get(final @NonNull String name) {
            Objects.requireNonNull(name);
            for (var i = names.size() - 1; i >= 0; i--) {
                if (names.get(i).equalsIgnoreCase(name)) {
                    return values.get(i);
                }
            }
            return null;
        }

        @Override
        public @NonNull Headers build() {
            return new RealHeaders(names.toArray(String[]::new), values.toArray(String[]::new));
        }

        /**
         * Adds a {@code name: value} line read from the network or from the storage, without validation. A line
         * without a name keeps its value under an empty name.
         */
        public Headers.@NonNull Builder addLenient(final @NonNull String line) {
            Objects.requireNonNull(line);
            // A leading colon belongs to the name of an HTTP/2 pseudo header.
            final var colon = line.indexOf(':', 1);
            if (colon == -1) {
                return addLenient("", line);
            }
            return addLenient(line.substring(0, colon), line.substring(colon + 1));
        }

        public Headers.@NonNull Builder addLenient(final @NonNull String name, final @NonNull String value) {
            Objects.requireNonNull(name);
            Objects.requireNonNull(value);
            names.add(name);
            values.add(value.strip());
            return this;
        }
    }
}
