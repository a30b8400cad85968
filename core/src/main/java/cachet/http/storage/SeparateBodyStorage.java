/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.io.InputStream;

/**
 * A storage that keeps the metadata and the body of each entry apart. Bodies are read back as streams, so serving a
 * large stored response does not load it in memory.
 * <p>
 * The cache writes each body under a key of its own, before the metadata that names it, and deletes the replaced body
 * afterwards. An entry whose metadata is visible has its body in place, and metadata is never paired with the body of
 * another write.
 */
public non-sealed interface SeparateBodyStorage extends CacheStorage {
    /**
     * @return the metadata stored under {@code key}, or null if there is none.
     * @throws java.io.UncheckedIOException if the storage failed.
     */
    byte @Nullable [] getMetadata(final @NonNull String key);

    /**
     * @throws java.io.UncheckedIOException if the storage failed.
     */
    void setMetadata(final @NonNull String key, final byte @NonNull [] metadata);

    /**
     * @return a stream of the body stored under {@code key}, or null if there is none. The caller closes it.
     * @throws java.io.UncheckedIOException if the storage failed.
     */
    @Nullable
    InputStream getBody(final @NonNull String key);

    /**
     * @throws java.io.UncheckedIOException if the storage failed.
     */
    void setBody(final @NonNull String key, final byte @NonNull [] body);

    /**
     * Removes both the metadata and the body stored under {@code key}.
     */
    @Override
    void delete(final @NonNull String key);
}
