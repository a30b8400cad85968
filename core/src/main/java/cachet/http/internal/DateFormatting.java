/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 *
 * Forked from OkHttp (https://github.com/square/okhttp), original copyright is below
 *
 * Copyright (C) 2011 The Android Open Source Project
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;

import static java.time.ZoneOffset.UTC;

/**
 * HTTP-date values of headers like {@code Date}, {@code Expires} and {@code Last-Modified}, see
 * <a href="https://tools.ietf.org/html/rfc7231#section-7.1.1.1">RFC 7231, 7.1.1.1</a>. Dates are always written in
 * the IMF-fixdate form, the two obsolete forms are still accepted when reading.
 */
public final class DateFormatting {
    // un-instantiable
    private DateFormatting() {
    }

    private static final @NonNull DateTimeFormatter IMF_FIXDATE = pattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'");

    /**
     * Tried in order. Two-digit RFC 850 years fall between 1970 and 2069.
     */
    private static final @NonNull List<@NonNull DateTimeFormatter> READ_FORMATS = List.of(
            IMF_FIXDATE,
            new DateTimeFormatterBuilder()
                    .parseCaseInsensitive()
                    .appendPattern("EEEE, dd-MMM-")
                    .appendValueReduced(ChronoField.YEAR, 2, 2, 1970)
                    .appendPattern(" HH:mm:ss 'GMT'")
                    .toFormatter(Locale.US)
                    .withZone(UTC),
            pattern("EEE MMM ppd HH:mm:ss yyyy"),
            // numeric offsets and unpadded days
            DateTimeFormatter.RFC_1123_DATE_TIME);

    private static @NonNull DateTimeFormatter pattern(final @NonNull String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withZone(UTC);
    }

    /**
     * @return the instant written in {@code value}, or null if it is not an HTTP-date. Invalid dates like
     * {@code Expires: 0} are common and are not an error.
     */
    public static @Nullable Instant toHttpInstantOrNull(final @NonNull String value) {
        assert value != null;

        final var trimmed = value.strip();
        if (trimmed.isEmpty()) {
            return null;
        }
        for (final var format : READ_FORMATS) {
            try {
                return format.parse(trimmed, Instant::from);
            } catch (DateTimeParseException notThisFormat) {
                // next one
            }
        }
        return null;
    }

    public static @NonNull String toHttpInstantString(final @NonNull Instant instant) {
        assert instant != null;
        return IMF_FIXDATE.format(instant);
    }
}
