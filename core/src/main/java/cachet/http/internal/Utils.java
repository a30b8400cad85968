/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Utils {
    // un-instantiable
    private Utils() {
    }

    static boolean isSensitiveHeader(final @NonNull String name) {
        assert name != null;

        return name.equalsIgnoreCase("Authorization") ||
                name.equalsIgnoreCase("Cookie") ||
                name.equalsIgnoreCase("Proxy-Authorization") ||
                name.equalsIgnoreCase("Set-Cookie");
    }

    /**
     * @return the value of {@code string} as a non-negative int, clamped to [0, Integer.MAX_VALUE], or
     * {@code defaultValue} if it is absent or not a number.
     */
    public static int toNonNegativeInt(final @Nullable String string, final int defaultValue) {
        if (string == null) {
            return defaultValue;
        }
        try {
            final var value = Long.parseLong(string);
            if (value > Integer.MAX_VALUE) {
                return Integer.MAX_VALUE;
            } else if (value < 0) {
                return 0;
            }
            return (int) value;
        } catch (NumberFormatException _unused) {
            return defaultValue;
        }
    }

    /**
     * @return the value of {@code string} as a long, or -1 if it is absent or not a non-negative number.
     */
    public static long toNonNegativeLongOrMinusOne(final @Nullable String string) {
        if (string == null) {
            return -1L;
        }
        try {
            final var value = Long.parseLong(string.strip());
            return (value < 0) ? -1L : value;
        } catch (NumberFormatException _unused) {
            return -1L;
        }
    }

    /**
     * Closes {@code closeable}, ignoring any checked exception. Runtime exceptions other than I/O ones are rethrown.
     */
    public static void closeQuietly(final @NonNull Closeable closeable) {
        assert closeable != null;

        try {
            closeable.close();
        } catch (UncheckedIOException | IOException ignored) {
            // Nothing useful to do, the resource is released anyway.
        }
    }

    /**
     * Reads {@code in} until its end so the underlying transport can release its resources, then closes it.
     */
    public static void discard(final @NonNull InputStream in) {
        assert in != null;

        try (in) {
            in.transferTo(OutputStream.nullOutputStream());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return the lowercase hex digest of {@code value} encoded in UTF-8, with {@code algorithm}.
     */
    public static @NonNull String hexDigest(final @NonNull String algorithm, final @NonNull String value) {
        assert algorithm != null;
        assert value != null;

        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " is not available", e);
        }
        return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    }

}
