/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import cachet.http.Cache;
import cachet.http.CacheStatus;
import cachet.http.ClientRequest;
import cachet.http.FakeTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static cachet.http.internal.Utils.hexDigest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public final class FileStorageTest {
    @TempDir
    Path directory;

    @Test
    public void setGetDelete() {
        final var storage = new FileStorage(directory);

        assertThat(storage.get("key")).isNull();
        storage.set("key", bytes("value"));
        assertThat(storage.get("key")).isEqualTo(bytes("value"));
        storage.set("key", bytes("other"));
        assertThat(storage.get("key")).isEqualTo(bytes("other"));

        storage.delete("key");
        assertThat(storage.get("key")).isNull();
        // Deleting a missing key is not an error.
        storage.delete("key");
    }

    @Test
    public void pathIsFannedOutFromTheKeyDigest() {
        final var storage = new FileStorage(directory);

        final var path = storage.pathFor("key");
        final var digest = hexDigest("SHA-224", "key");

        final var relative = storage.getDirectory().relativize(path);
        assertThat(relative.getNameCount()).isEqualTo(6);
        for (var i = 0; i < 5; i++) {
            assertThat(relative.getName(i).toString()).isEqualTo(String.valueOf(digest.charAt(i)));
        }
        assertThat(relative.getFileName().toString()).isEqualTo(digest).hasSize(56);
    }

    @Test
    public void pathForUrlUsesTheGetKey() {
        final var storage = new FileStorage(directory);

        assertThat(storage.pathForUrl("https://example.com/a"))
                .isEqualTo(storage.pathFor(Cache.builder().build().cacheUrl("https://example.com/a")));
    }

    @Test
    public void foreverStorageNeverDeletes() {
        final var storage = new FileStorage(directory, true);
        storage.set("key", bytes("value"));

        storage.delete("key");

        assertThat(storage.isForever()).isTrue();
        assertThat(storage.get("key")).isEqualTo(bytes("value"));
    }

    @Test
    public void filesAreOwnerOnly() throws IOException {
        assumeTrue(directory.getFileSystem().supportedFileAttributeViews().contains("posix"));
        final var storage = new FileStorage(directory);

        storage.set("key", bytes("value"));

        final var path = storage.pathFor("key");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(path))).isEqualTo("rw-------");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(path.getParent())))
                .isEqualTo("rwx------");
    }

    @Test
    public void concurrentWritersNeverInterleave() throws Exception {
        final var storage = new FileStorage(directory);
        final var writers = 8;
        final var values = new ArrayList<byte[]>();
        for (var i = 0; i < writers; i++) {
            // Large enough to need several writes.
            values.add(String.valueOf((char) ('a' + i)).repeat(256 * 1024).getBytes(StandardCharsets.UTF_8));
        }

        final ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            final var start = new CountDownLatch(1);
            final var futures = new ArrayList<Future<?>>();
            for (final var value : values) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (var i = 0; i < 10; i++) {
                        storage.set("key", value);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (final var future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        final var stored = storage.get("key");
        assertThat(stored).isNotNull();
        assertThat(values).anySatisfy(value -> assertThat(stored).isEqualTo(value));
        // No temporary file is left behind.
        try (final var files = Files.list(storage.pathFor("key").getParent())) {
            assertThat(files.map(file -> file.getFileName().toString()))
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    public void cacheSurvivesReopening() {
        final var network = new FakeTransport()
                .enqueue(200, "A", "Cache-Control", "max-age=60");

        try (final var cache = Cache.builder().storage(new FileStorage(directory)).build()) {
            assertThat(cache.wrap(network).execute(ClientRequest.get("https://example.com/")).getBody().string())
                    .isEqualTo("A");
        }

        try (final var cache = Cache.builder().storage(new FileStorage(directory)).build();
             final var cached = cache.wrap(network).execute(ClientRequest.get("https://example.com/"))) {
            assertThat(cached.getCacheStatus()).isEqualTo(CacheStatus.HIT_FRESH);
            assertThat(cached.getBody().string()).isEqualTo("A");
        }
        assertThat(network.requestCount()).isEqualTo(1);
    }

    private static byte[] bytes(final String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
