/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import cachet.http.*;
import cachet.http.storage.SeparateBodyFileStorage;
import cachet.http.storage.SeparateBodyStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

public final class SeparateBodyReplacementTest {
    private static final String URL = "https://example.com/report";

    @TempDir
    Path directory;

    private final MutableClock clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
    private InterleavingStorage storage;
    private CacheController controller;

    @BeforeEach
    public void setUp() {
        storage = new InterleavingStorage(new SeparateBodyFileStorage(directory));
        controller = new CacheController(storage, EntrySerializer.standard(), true, null, clock);
    }

    @Test
    public void readerBetweenBodyAndMetadataSeesTheOldEntry() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, "\"a\"", 1), bytes("A"));

        final var seen = new ArrayList<String>();
        storage.beforeNextMetadata = () -> {
            try (final var cached = controller.cachedRequest(request)) {
                assertThat(cached).isNotNull();
                seen.add(cached.header("ETag") + " " + cached.getBody().string());
            }
        };
        controller.cacheResponse(request, response(request, "\"b\"", 2), bytes("BB"));

        assertThat(seen).containsExactly("\"a\" A");
        try (final var cached = controller.cachedRequest(request)) {
            assertThat(cached).isNotNull();
            assertThat(cached.header("ETag")).isEqualTo("\"b\"");
            assertThat(cached.header("Content-Length")).isEqualTo("2");
            assertThat(cached.getBody().string()).isEqualTo("BB");
        }
    }

    @Test
    public void replacedBodyIsDeleted() {
        final var request = ClientRequest.get(URL);

        controller.cacheResponse(request, response(request, "\"a\"", 1), bytes("A"));
        controller.cacheResponse(request, response(request, "\"b\"", 2), bytes("BB"));

        assertThat(bodyFiles()).hasSize(1);
    }

    @Test
    public void bodyGenerationIsNotServed() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, "\"a\"", 1), bytes("A"));

        try (final var cached = controller.cachedRequest(request)) {
            assertThat(cached).isNotNull();
            assertThat(cached.getHeaders().contains(CacheController.BODY_GENERATION)).isFalse();
        }
    }

    @Test
    public void invalidateDeletesMetadataAndBody() {
        final var request = ClientRequest.get(URL);
        controller.cacheResponse(request, response(request, "\"a\"", 1), bytes("A"));

        controller.invalidate(request);

        assertThat(controller.cachedRequest(request)).isNull();
        assertThat(bodyFiles()).isEmpty();
    }

    private List<Path> bodyFiles() {
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(path -> path.getFileName().toString().endsWith(".body")).toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ClientResponse response(final ClientRequest request, final String etag, final int contentLength) {
        return ClientResponse.builder()
                .request(request)
                .code(200)
                .headers(Headers.of(
                        "Cache-Control", "max-age=60",
                        "ETag", etag,
                        "Content-Length", String.valueOf(contentLength)))
                .sentRequestAt(clock.instant())
                .receivedResponseAt(clock.instant())
                .build();
    }

    private static byte[] bytes(final String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Runs a one-shot action right before the next metadata write, after the body of that write is in place.
     */
    private static final class InterleavingStorage implements SeparateBodyStorage {
        private final SeparateBodyStorage delegate;
        private Runnable beforeNextMetadata = null;

        private InterleavingStorage(final SeparateBodyStorage delegate) {
            this.delegate = delegate;
        }

        @Override
        public byte [] getMetadata(final String key) {
            return delegate.getMetadata(key);
        }

        @Override
        public void setMetadata(final String key, final byte [] metadata) {
            final var action = beforeNextMetadata;
            beforeNextMetadata = null;
            if (action != null) {
                action.run();
            }
            delegate.setMetadata(key, metadata);
        }

        @Override
        public InputStream getBody(final String key) {
            return delegate.getBody(key);
        }

        @Override
        public void setBody(final String key, final byte [] body) {
            delegate.setBody(key, body);
        }

        @Override
        public void delete(final String key) {
            delegate.delete(key);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
