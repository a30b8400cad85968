/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.logging;

import cachet.http.CacheListener;
import cachet.http.logging.internal.RealLoggingCacheListener;
import org.jspecify.annotations.NonNull;

import java.util.Objects;

import static java.lang.System.Logger.Level.INFO;

/**
 * A {@link CacheListener} which logs cache events. Register it with
 * {@link cachet.http.Cache.Builder#listener(CacheListener)}.
 * <p>
 * The format of the logs created by this class should not be considered stable and may change slightly between
 * releases. If you need a stable logging format, use your own listener.
 */
public sealed interface LoggingCacheListener extends CacheListener permits RealLoggingCacheListener {
    static @NonNull LoggingCacheListener create() {
        return create(Logger.DEFAULT);
    }

    static @NonNull LoggingCacheListener create(final @NonNull Logger logger) {
        Objects.requireNonNull(logger);
        return new RealLoggingCacheListener(logger);
    }

    @FunctionalInterface
    interface Logger {
        void log(final @NonNull String message);

        /**
         * The default logger, relying on {@link System.Logger}.
         */
        @NonNull
        Logger DEFAULT = new SystemLogger();

        final class SystemLogger implements Logger {
            private static final System.Logger LOGGER = System.getLogger("cachet.http.logging.LoggingCacheListener");

            @Override
            public void log(final @NonNull String message) {
                LOGGER.log(INFO, message);
            }
        }
    }
}
