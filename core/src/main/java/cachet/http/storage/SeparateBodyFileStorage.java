/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import cachet.http.internal.cache.CacheKeys;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A {@link SeparateBodyStorage} that keeps the metadata of each entry in a file and its body in a {@code .body}
 * sibling, with the layout and the write guarantees of {@link FileStorage}. Bodies are streamed from disk.
 */
public final class SeparateBodyFileStorage implements SeparateBodyStorage {
    private final @NonNull FileLayout layout;

    public SeparateBodyFileStorage(final @NonNull Path directory) {
        this(directory, false);
    }

    /**
     * @param forever true to keep entries forever: {@link #delete(String)} does nothing.
     */
    public SeparateBodyFileStorage(final @NonNull Path directory, final boolean forever) {
        Objects.requireNonNull(directory);
        this.layout = new FileLayout(directory, forever);
    }

    public @NonNull Path getDirectory() {
        return layout.directory();
    }

    /**
     * @return the file that holds the metadata of {@code key}. The body is the sibling with a {@code .body} suffix.
     * The files may not exist.
     */
    public @NonNull Path pathFor(final @NonNull String key) {
        Objects.requireNonNull(key);
        return layout.pathFor(key);
    }

    /**
     * @return the file that holds the metadata of a {@code GET} request of {@code url}. The file may not exist.
     */
    public @NonNull Path pathForUrl(final @NonNull String url) {
        Objects.requireNonNull(url);
        return layout.pathFor(CacheKeys.cacheUrl(url));
    }

    @Override
    public byte @Nullable [] getMetadata(final @NonNull String key) {
        Objects.requireNonNull(key);
        return layout.read(layout.pathFor(key));
    }

    @Override
    public void setMetadata(final @NonNull String key, final byte @NonNull [] metadata) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(metadata);
        layout.write(layout.pathFor(key), metadata);
    }

    @Override
    public @Nullable InputStream getBody(final @NonNull String key) {
        Objects.requireNonNull(key);
        return layout.open(bodyPath(key));
    }

    @Override
    public void setBody(final @NonNull String key, final byte @NonNull [] body) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(body);
        layout.write(bodyPath(key), body);
    }

    @Override
    public void delete(final @NonNull String key) {
        Objects.requireNonNull(key);
        // Metadata first: an entry without metadata is absent for readers.
        layout.delete(layout.pathFor(key));
        layout.delete(bodyPath(key));
    }

    private @NonNull Path bodyPath(final @NonNull String key) {
        final var path = layout.pathFor(key);
        return path.resolveSibling(path.getFileName() + FileLayout.BODY_SUFFIX);
    }

    @Override
    public void close() {
    }

    @Override
    public @NonNull String toString() {
        return "SeparateBodyFileStorage{directory=" + layout.directory() + ", forever=" + layout.forever() + "}";
    }
}
