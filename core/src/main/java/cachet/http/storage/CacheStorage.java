/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import org.jspecify.annotations.NonNull;

/**
 * Where a {@link cachet.http.Cache} keeps its entries. A storage either keeps each entry as a single value
 * ({@link UnifiedStorage}), or keeps the metadata and the body of each entry apart ({@link SeparateBodyStorage}) so
 * large bodies are streamed from the storage instead of being loaded in memory.
 * <p>
 * Keys are opaque strings derived by the cache. A storage may evict any entry at any time.
 */
public sealed interface CacheStorage extends AutoCloseable permits UnifiedStorage, SeparateBodyStorage {
    /**
     * Removes everything stored under {@code key}. Removing a missing key does nothing.
     *
     * @throws java.io.UncheckedIOException if the storage failed.
     */
    void delete(final @NonNull String key);

    /**
     * Releases the resources held by this storage.
     */
    @Override
    void close();
}
