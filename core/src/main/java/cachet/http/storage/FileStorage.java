/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import cachet.http.internal.cache.CacheKeys;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A {@link UnifiedStorage} that keeps each entry in a file under a directory. The whole entry is read in memory, so
 * prefer {@link SeparateBodyFileStorage} for large downloads.
 * <p>
 * Writers of the same key are serialized, both between threads of this process and between processes sharing the
 * directory. Readers never wait for writers and never see a partially written entry. Files are created readable by
 * their owner only, where the file system supports POSIX permissions.
 */
public final class FileStorage implements UnifiedStorage {
    private final @NonNull FileLayout layout;

    public FileStorage(final @NonNull Path directory) {
        this(directory, false);
    }

    /**
     * @param forever true to keep entries forever: {@link #delete(String)} does nothing.
     */
    public FileStorage(final @NonNull Path directory, final boolean forever) {
        Objects.requireNonNull(directory);
        this.layout = new FileLayout(directory, forever);
    }

    public @NonNull Path getDirectory() {
        return layout.directory();
    }

    public boolean isForever() {
        return layout.forever();
    }

    /**
     * @return the file that holds the entry of {@code key}. The file may not exist.
     */
    public @NonNull Path pathFor(final @NonNull String key) {
        Objects.requireNonNull(key);
        return layout.pathFor(key);
    }

    /**
     * @return the file that holds the entry of a {@code GET} request of {@code url}. The file may not exist.
     */
    public @NonNull Path pathForUrl(final @NonNull String url) {
        Objects.requireNonNull(url);
        return layout.pathFor(CacheKeys.cacheUrl(url));
    }

    @Override
    public byte @Nullable [] get(final @NonNull String key) {
        Objects.requireNonNull(key);
        return layout.read(layout.pathFor(key));
    }

    @Override
    public void set(final @NonNull String key, final byte @NonNull [] value) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
        layout.write(layout.pathFor(key), value);
    }

    @Override
    public void delete(final @NonNull String key) {
        Objects.requireNonNull(key);
        layout.delete(layout.pathFor(key));
    }

    @Override
    public void close() {
    }

    @Override
    public @NonNull String toString() {
        return "FileStorage{directory=" + layout.directory() + ", forever=" + layout.forever() + "}";
    }
}
