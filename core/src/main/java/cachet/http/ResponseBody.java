/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http;

import org.jspecify.annotations.NonNull;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A one-shot stream from the origin server, or from the cache, to the client application with the raw bytes of the
 * response body. Each response body is supported by an active connection or a storage resource.
 * <p>
 * The response body must be closed. Each response body holds a resource like a socket or an open file, and failing to
 * close it releases nothing. Both {@link #bytes()} and {@link #string()} read the entire body and close it.
 * <p>
 * When the body is captured by the cache, it is stored only once it has been read to its end. Closing it before that
 * discards what was captured.
 */
public abstract class ResponseBody implements AutoCloseable {
    public static final @NonNull ResponseBody EMPTY = create(new byte[0]);

    public static @NonNull ResponseBody create(final @NonNull String content) {
        Objects.requireNonNull(content);
        return create(content.getBytes(StandardCharsets.UTF_8));
    }

    public static @NonNull ResponseBody create(final byte @NonNull [] content) {
        Objects.requireNonNull(content);
        return create(new ByteArrayInputStream(content), content.length, false);
    }

    /**
     * @param contentByteSize the number of bytes of {@code stream}, or -1 if unknown.
     * @param chunked         true if the body is delimited by the transfer coding rather than by a
     *                        {@code Content-Length}.
     */
    public static @NonNull ResponseBody create(final @NonNull InputStream stream,
                                               final long contentByteSize,
                                               final boolean chunked) {
        Objects.requireNonNull(stream);
        return new ResponseBody() {
            @Override
            public long contentByteSize() {
                return contentByteSize;
            }

            @Override
            public boolean isChunked() {
                return chunked;
            }

            @Override
            public @NonNull InputStream byteStream() {
                return stream;
            }
        };
    }

    /**
     * @return the number of bytes in this body, or -1 if unknown.
     */
    public abstract long contentByteSize();

    /**
     * @return true if this body is delimited by the chunked transfer coding.
     */
    public boolean isChunked() {
        return false;
    }

    /**
     * @return the stream of this body. Every call returns the same stream.
     */
    public abstract @NonNull InputStream byteStream();

    /**
     * @return the remaining bytes of this body. The body is closed afterward.
     */
    public final byte @NonNull [] bytes() {
        try (final var in = byteStream()) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return the remaining bytes of this body as a UTF-8 string. The body is closed afterward.
     */
    public final @NonNull String string() {
        return new String(bytes(), StandardCharsets.UTF_8);
    }

    /**
     * Releases the resource backing this body.
     *
     * @throws UncheckedIOException if closing the underlying stream fails.
     */
    @Override
    public void close() {
        try {
            byteStream().close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
