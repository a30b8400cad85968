/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * A storage that keeps each entry, metadata and body, as a single value.
 */
public non-sealed interface UnifiedStorage extends CacheStorage {
    /**
     * @return the value stored under {@code key}, or null if there is none.
     * @throws java.io.UncheckedIOException if the storage failed.
     */
    byte @Nullable [] get(final @NonNull String key);

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     *
     * @throws java.io.UncheckedIOException if the storage failed.
     */
    void set(final @NonNull String key, final byte @NonNull [] value);
}
