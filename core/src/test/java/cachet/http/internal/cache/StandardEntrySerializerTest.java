/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import cachet.http.CacheEntry;
import cachet.http.EntrySerializer;
import cachet.http.Headers;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;

public final class StandardEntrySerializerTest {
    private final EntrySerializer serializer = EntrySerializer.standard();

    private final CacheEntry entry = new CacheEntry(
            "https://example.com/widgets",
            "GET",
            Headers.of("Accept-Language", "fr"),
            200,
            "OK",
            Headers.of("Cache-Control", "max-age=60", "Vary", "Accept-Language", "Content-Type", "text/plain"),
            "bonjour".getBytes(StandardCharsets.UTF_8),
            Instant.ofEpochMilli(1_748_772_000_000L),
            Instant.ofEpochMilli(1_748_772_000_250L));

    @Test
    public void entryIsRestored() {
        assertThat(serializer.decode(serializer.encode(entry))).isEqualTo(entry);
    }

    @Test
    public void entryWithoutBodyIsRestored() {
        final var metadata = entry.withBody(null);

        final var decoded = serializer.decode(serializer.encode(metadata));
        assertThat(decoded).isEqualTo(metadata);
        assertThat(decoded.body()).isNull();
    }

    @Test
    public void entryWithEmptyReasonIsRestored() {
        final var noReason = new CacheEntry(entry.url(), "GET", Headers.EMPTY, 301, "", Headers.EMPTY, new byte[0],
                entry.sentRequestAt(), entry.receivedResponseAt());

        assertThat(serializer.decode(serializer.encode(noReason))).isEqualTo(noReason);
    }

    @Test
    public void encodedEntryIsCompressed() {
        assertThat(serializer.encode(entry)).startsWith((byte) 0x1f, (byte) 0x8b);
    }

    @Test
    public void garbageIsNotAnEntry() {
        assertThat(serializer.decode("not an entry".getBytes(StandardCharsets.UTF_8))).isNull();
        assertThat(serializer.decode(new byte[0])).isNull();
    }

    @Test
    public void truncatedEntryIsNotAnEntry() {
        final var encoded = serializer.encode(entry);

        assertThat(serializer.decode(Arrays.copyOf(encoded, encoded.length / 2))).isNull();
    }

    @Test
    public void unknownVersionIsNotAnEntry() throws IOException {
        assertThat(serializer.decode(gzip("cachet-entry 2\nhttps://example.com/\nGET\n0\n200 OK\n0\n-1\n"))).isNull();
    }

    @Test
    public void bodyLengthMismatchIsNotAnEntry() throws IOException {
        assertThat(serializer.decode(gzip("cachet-entry 1\nhttps://example.com/\nGET\n0\n200 OK\n0\n5\nabc"))).isNull();
    }

    @Test
    public void malformedStatusLineIsNotAnEntry() throws IOException {
        assertThat(serializer.decode(gzip("cachet-entry 1\nhttps://example.com/\nGET\n0\nOK\n0\n-1\n"))).isNull();
    }

    private static byte[] gzip(final String text) throws IOException {
        final var out = new ByteArrayOutputStream();
        try (final var gzip = new GZIPOutputStream(out)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }
}
