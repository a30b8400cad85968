/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link UnifiedStorage} kept in a map, the default storage of a {@link cachet.http.Cache}. Entries live as long as
 * this object and are never evicted.
 * <p>
 * This class is not thread-safe. Share it between threads only with external synchronization.
 */
public final class InMemoryStorage implements UnifiedStorage {
    private final @NonNull Map<String, byte[]> data = new HashMap<>();

    @Override
    public byte @Nullable [] get(final @NonNull String key) {
        Objects.requireNonNull(key);
        return data.get(key);
    }

    @Override
    public void set(final @NonNull String key, final byte @NonNull [] value) {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
        data.put(key, value);
    }

    @Override
    public void delete(final @NonNull String key) {
        Objects.requireNonNull(key);
        data.remove(key);
    }

    /**
     * @return the number of stored values.
     */
    public int size() {
        return data.size();
    }

    @Override
    public void close() {
    }
}
