/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import cachet.http.internal.cache.StandardEntrySerializer;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Turns a {@link CacheEntry} into the bytes a {@link cachet.http.storage.CacheStorage} keeps, and back.
 */
public interface EntrySerializer {
    /**
     * @return the serializer used when none is configured. Its format is versioned and compressed.
     */
    static @NonNull EntrySerializer standard() {
        return StandardEntrySerializer.INSTANCE;
    }

    byte @NonNull [] encode(final @NonNull CacheEntry entry);

    /**
     * @return the decoded entry, or null if {@code data} is corrupt, truncated, or of an unknown format. This never
     * throws for bad input, a stored entry that cannot be read is a cache miss.
     */
    @Nullable
    CacheEntry decode(final byte @NonNull [] data);
}
