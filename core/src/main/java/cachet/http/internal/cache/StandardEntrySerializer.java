/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 *
 * Forked from OkHttp (https://github.com/square/okhttp), original copyright is below
 *
 * Copyright (C) 2010 The Android Open Source Project
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

import cachet.http.CacheEntry;
import cachet.http.EntrySerializer;
import cachet.http.Headers;
import cachet.http.internal.RealHeaders;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import static java.lang.System.Logger.Level.WARNING;

/**
 * The default {@link EntrySerializer}. An entry is written as GZIP-compressed, newline separated text followed by the
 * raw body:
 * <pre>
 * {@code
 * cachet-entry 1
 * http://google.com/foo
 * GET
 * 2
 * Accept-Language: fr-CA
 * Accept-Charset: UTF-8
 * 200 OK
 * 5
 * Content-Type: image/png
 * Content-Length: 100
 * Cache-Control: max-age=600
 * Cachet-Sent-Millis: 1735689600000
 * Cachet-Received-Millis: 1735689600120
 * 100
 * <100 bytes of body>
 * }
 * </pre>
 * The first line is the format version. Next are the URL and the request method, the number of HTTP Vary request
 * header lines followed by those lines, then the status code and reason, the number of response header lines followed
 * by those lines. The sent and received instants are synthetic response headers. The last line is the body length,
 * {@code -1} when the body is stored apart, and the body bytes follow it.
 */
public final class StandardEntrySerializer implements EntrySerializer {
    private static final System.Logger LOGGER = System.getLogger("cachet.http.Cache");

    public static final @NonNull StandardEntrySerializer INSTANCE = new StandardEntrySerializer();

    private static final @NonNull String VERSION_LINE = "cachet-entry 1";

    /**
     * Synthetic response header: the local time when the request was sent.
     */
    private static final @NonNull String SENT_MILLIS = "Cachet-Sent-Millis";

    /**
     * Synthetic response header: the local time when the response was received.
     */
    private static final @NonNull String RECEIVED_MILLIS = "Cachet-Received-Millis";

    private StandardEntrySerializer() {
    }

    @Override
    public byte @NonNull [] encode(final @NonNull CacheEntry entry) {
        Objects.requireNonNull(entry);

        final var text = new StringBuilder()
                .append(VERSION_LINE).append('\n')
                .append(entry.url()).append('\n')
                .append(entry.requestMethod()).append('\n');
        appendHeaders(text, entry.varyHeaders());
        text.append(entry.statusCode()).append(' ').append(entry.reason()).append('\n');
        text.append(entry.responseHeaders().size() + 2).append('\n');
        for (var i = 0; i < entry.responseHeaders().size(); i++) {
            text.append(entry.responseHeaders().name(i))
                    .append(": ")
                    .append(entry.responseHeaders().value(i))
                    .append('\n');
        }
        text.append(SENT_MILLIS).append(": ").append(entry.sentRequestAt().toEpochMilli()).append('\n');
        text.append(RECEIVED_MILLIS).append(": ").append(entry.receivedResponseAt().toEpochMilli()).append('\n');
        final var body = entry.body();
        text.append((body != null) ? body.length : -1).append('\n');

        final var out = new ByteArrayOutputStream();
        try (final var gzip = new GZIPOutputStream(out)) {
            gzip.write(text.toString().getBytes(StandardCharsets.UTF_8));
            if (body != null) {
                gzip.write(body);
            }
        } catch (IOException e) {
            // In-memory streams do not fail.
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private static void appendHeaders(final @NonNull StringBuilder text, final @NonNull Headers headers) {
        text.append(headers.size()).append('\n');
        for (var i = 0; i < headers.size(); i++) {
            text.append(headers.name(i)).append(": ").append(headers.value(i)).append('\n');
        }
    }

    @Override
    public @Nullable CacheEntry decode(final byte @NonNull [] data) {
        Objects.requireNonNull(data);

        final byte[] raw;
        try (final var gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            raw = gzip.readAllBytes();
        } catch (IOException e) {
            LOGGER.log(WARNING, "Cache corruption: unreadable entry", e);
            return null;
        }

        try {
            return parse(new LineReader(raw));
        } catch (CorruptEntryException | IllegalArgumentException e) {
            LOGGER.log(WARNING, "Cache corruption: " + e.getMessage());
            return null;
        }
    }

    private static @NonNull CacheEntry parse(final @NonNull LineReader reader) throws CorruptEntryException {
        final var version = reader.readLine();
        if (!VERSION_LINE.equals(version)) {
            throw new CorruptEntryException("unexpected version \"" + version + "\"");
        }
        final var url = reader.readLine();
        final var requestMethod = reader.readLine();

        final var varyHeaders = new RealHeaders.Builder();
        final var varyHeaderLineCount = reader.readInt();
        for (var i = 0; i < varyHeaderLineCount; i++) {
            varyHeaders.addLenient(reader.readLine());
        }

        final var statusLine = reader.readLine();
        final var space = statusLine.indexOf(' ');
        if (space != 3) {
            throw new CorruptEntryException("unexpected status line \"" + statusLine + "\"");
        }
        final int statusCode;
        try {
            statusCode = Integer.parseInt(statusLine.substring(0, 3));
        } catch (NumberFormatException e) {
            throw new CorruptEntryException("unexpected status line \"" + statusLine + "\"");
        }
        final var reason = statusLine.substring(space + 1);

        final var responseHeaders = new RealHeaders.Builder();
        final var responseHeaderLineCount = reader.readInt();
        for (var i = 0; i < responseHeaderLineCount; i++) {
            responseHeaders.addLenient(reader.readLine());
        }
        final var sentRequestMillis = parseMillis(responseHeaders.get(SENT_MILLIS));
        final var receivedResponseMillis = parseMillis(responseHeaders.get(RECEIVED_MILLIS));
        responseHeaders.removeAll(SENT_MILLIS);
        responseHeaders.removeAll(RECEIVED_MILLIS);

        final var bodyLength = reader.readInt();
        final byte[] body;
        if (bodyLength == -1) {
            body = null;
            if (reader.remaining() != 0) {
                throw new CorruptEntryException("unexpected trailing bytes");
            }
        } else {
            if (bodyLength != reader.remaining()) {
                throw new CorruptEntryException(
                        "expected a body of " + bodyLength + " bytes but was " + reader.remaining());
            }
            body = reader.rest();
        }

        return new CacheEntry(
                url,
                requestMethod,
                varyHeaders.build(),
                statusCode,
                reason,
                responseHeaders.build(),
                body,
                Instant.ofEpochMilli(sentRequestMillis),
                Instant.ofEpochMilli(receivedResponseMillis));
    }

    private static long parseMillis(final @Nullable String value) throws CorruptEntryException {
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new CorruptEntryException("unexpected instant \"" + value + "\"");
        }
    }

    private static final class LineReader {
        private final byte @NonNull [] data;
        private int pos = 0;

        private LineReader(final byte @NonNull [] data) {
            this.data = data;
        }

        private @NonNull String readLine() throws CorruptEntryException {
            for (var i = pos; i < data.length; i++) {
                if (data[i] == '\n') {
                    final var line = new String(data, pos, i - pos, StandardCharsets.UTF_8);
                    pos = i + 1;
                    return line;
                }
            }
            throw new CorruptEntryException("unexpected end of entry");
        }

        private int readInt() throws CorruptEntryException {
            final var line = readLine();
            try {
                final var result = Integer.parseInt(line);
                if (result < -1) {
                    throw new CorruptEntryException("expected an int but was \"" + line + "\"");
                }
                return result;
            } catch (NumberFormatException e) {
                throw new CorruptEntryException("expected an int but was \"" + line + "\"");
            }
        }

        private int remaining() {
            return data.length - pos;
        }

        private byte @NonNull [] rest() {
            return Arrays.copyOfRange(data, pos, data.length);
        }
    }

    private static final class CorruptEntryException extends Exception {
        private CorruptEntryException(final @NonNull String message) {
            super(message);
        }
    }
}
