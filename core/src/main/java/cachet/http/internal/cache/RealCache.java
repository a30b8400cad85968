/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import cachet.http.*;
import cachet.http.storage.CacheStorage;
import cachet.http.storage.InMemoryStorage;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

public final class RealCache implements Cache {
    private final @NonNull CacheStorage storage;
    private final @NonNull CacheController controller;
    private final @NonNull Set<String> cacheableMethods;
    private final @NonNull Set<String> invalidatingMethods;
    private final @NonNull Clock clock;
    private final @NonNull CacheListener listener;

    // read and write statistics, all guarded by 'lock'.
    private int writeSuccessCount = 0;
    private int writeAbortCount = 0;
    private int networkCount = 0;
    private int hitCount = 0;
    private int requestCount = 0;
    private final @NonNull Lock lock = new ReentrantLock();

    private RealCache(final @NonNull Builder builder) {
        assert builder != null;

        this.storage = (builder.storage != null) ? builder.storage : new InMemoryStorage();
        this.clock = builder.clock;
        this.controller = new CacheController(storage, builder.serializer, builder.cacheEtags, builder.heuristic,
                clock);
        this.cacheableMethods = builder.cacheableMethods;
        this.invalidatingMethods = builder.invalidatingMethods;
        this.listener = builder.listener;
    }

    @Override
    public @NonNull Transport wrap(final @NonNull Transport network) {
        Objects.requireNonNull(network);
        return new CacheInterceptor(this, network, cacheableMethods);
    }

    @Override
    public @NonNull Transport wrap(final @NonNull Transport network, final @NonNull Set<String> cacheableMethods) {
        Objects.requireNonNull(network);
        return new CacheInterceptor(this, network, methods(cacheableMethods));
    }

    @Override
    public @NonNull String cacheUrl(final @NonNull String url) {
        Objects.requireNonNull(url);
        return CacheController.cacheUrl(url);
    }

    @Override
    public void invalidate(final @NonNull URI url) {
        Objects.requireNonNull(url);
        controller.invalidate(ClientRequest.builder().url(url).get());
    }

    @Override
    public @NonNull CacheStorage getStorage() {
        return storage;
    }

    @NonNull
    CacheController controller() {
        return controller;
    }

    @NonNull
    Set<String> invalidatingMethods() {
        return invalidatingMethods;
    }

    @NonNull
    Clock clock() {
        return clock;
    }

    @NonNull
    CacheListener listener() {
        return listener;
    }

    void trackRequest() {
        lock.lock();
        try {
            requestCount++;
        } finally {
            lock.unlock();
        }
    }

    void trackNetwork() {
        lock.lock();
        try {
            networkCount++;
        } finally {
            lock.unlock();
        }
    }

    void trackHit() {
        lock.lock();
        try {
            hitCount++;
        } finally {
            lock.unlock();
        }
    }

    void trackWrite(final boolean success) {
        lock.lock();
        try {
            if (success) {
                writeSuccessCount++;
            } else {
                writeAbortCount++;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int writeAbortCount() {
        lock.lock();
        try {
            return writeAbortCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int writeSuccessCount() {
        lock.lock();
        try {
            return writeSuccessCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int networkCount() {
        lock.lock();
        try {
            return networkCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int hitCount() {
        lock.lock();
        try {
            return hitCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int requestCount() {
        lock.lock();
        try {
            return requestCount;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        storage.close();
    }

    @Override
    public @NonNull String toString() {
        return "Cache{storage=" + storage + "}";
    }

    private static @NonNull Set<String> methods(final @NonNull Set<String> methods) {
        Objects.requireNonNull(methods);
        final var result = new TreeSet<String>();
        for (final var method : methods) {
            Objects.requireNonNull(method);
            result.add(method.toUpperCase(Locale.US));
        }
        return Set.copyOf(result);
    }

    public static final class Builder implements Cache.Builder {
        private @Nullable CacheStorage storage = null;
        private @NonNull EntrySerializer serializer = EntrySerializer.standard();
        private @Nullable Heuristic heuristic = null;
        private @NonNull Set<String> cacheableMethods = Set.of("GET");
        private boolean cacheEtags = true;
        private @NonNull Set<String> invalidatingMethods = Set.of("PUT", "PATCH", "DELETE");
        private @NonNull Clock clock = Clock.systemUTC();
        private @NonNull CacheListener listener = CacheListener.NONE;

        @Override
        public Cache.@NonNull Builder storage(final @NonNull CacheStorage storage) {
            this.storage = Objects.requireNonNull(storage);
            return this;
        }

        @Override
        public Cache.@NonNull Builder serializer(final @NonNull EntrySerializer serializer) {
            this.serializer = Objects.requireNonNull(serializer);
            return this;
        }

        @Override
        public Cache.@NonNull Builder heuristic(final @NonNull Heuristic heuristic) {
            this.heuristic = Objects.requireNonNull(heuristic);
            return this;
        }

        @Override
        public Cache.@NonNull Builder cacheableMethods(final @NonNull Set<String> cacheableMethods) {
            this.cacheableMethods = methods(cacheableMethods);
            return this;
        }

        @Override
        public Cache.@NonNull Builder cacheEtags(final boolean cacheEtags) {
            this.cacheEtags = cacheEtags;
            return this;
        }

        @Override
        public Cache.@NonNull Builder invalidatingMethods(final @NonNull Set<String> invalidatingMethods) {
            this.invalidatingMethods = methods(invalidatingMethods);
            return this;
        }

        @Override
        public Cache.@NonNull Builder clock(final @NonNull Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        @Override
        public Cache.@NonNull Builder listener(final @NonNull CacheListener listener) {
            this.listener = Objects.requireNonNull(listener);
            return this;
        }

        @Override
        public @NonNull Cache build() {
            return new RealCache(this);
        }
    }
}
