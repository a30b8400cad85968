/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.internal.cache;

import org.jspecify.annotations.NonNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Passes the bytes of a response body through unchanged while keeping a copy of them. Once the body is known to be
 * complete, the copy is handed to the commit callback, exactly once:
 * <ul>
 * <li>when the source reports its end, or
 * <li>when the body has a known length and is not chunked, as soon as that many bytes have been read.
 * </ul>
 * Closing this stream before that point discards the copy. A read failure is rethrown unchanged and the copy is
 * discarded as well.
 */
final class StreamingCapture extends InputStream {
    private final @NonNull InputStream source;
    private final long expectedLength;
    private final @NonNull Consumer<byte @NonNull []> onComplete;
    private final @NonNull ByteArrayOutputStream copy = new ByteArrayOutputStream();
    private long bytesRead = 0L;
    private boolean done = false;

    /**
     * @param contentLength the length of the body, or -1 if unknown.
     * @param chunked       true if the body is delimited by the chunked transfer coding, in which case
     *                      {@code contentLength} is not trusted.
     */
    StreamingCapture(final @NonNull InputStream source,
                     final long contentLength,
                     final boolean chunked,
                     final @NonNull Consumer<byte @NonNull []> onComplete) {
        this.source = Objects.requireNonNull(source);
        this.expectedLength = (chunked) ? -1L : contentLength;
        this.onComplete = Objects.requireNonNull(onComplete);
    }

    @Override
    public int read() throws IOException {
        final int b;
        try {
            b = source.read();
        } catch (IOException e) {
            abort();
            throw e;
        }

        if (b == -1) {
            commit();
            return -1;
        }
        if (!done) {
            copy.write(b);
            bytesRead++;
            commitIfComplete();
        }
        return b;
    }

    @Override
    public int read(final byte @NonNull [] destination, final int offset, final int length) throws IOException {
        final int read;
        try {
            read = source.read(destination, offset, length);
        } catch (IOException e) {
            abort();
            throw e;
        }

        if (read == -1) {
            commit();
            return -1;
        }
        if (!done) {
            copy.write(destination, offset, read);
            bytesRead += read;
            commitIfComplete();
        }
        return read;
    }

    @Override
    public int available() throws IOException {
        return source.available();
    }

    @Override
    public void close() throws IOException {
        // Not read to the end: the copy may be partial.
        abort();
        source.close();
    }

    // visible for testing
    boolean isDone() {
        return done;
    }

    private void commitIfComplete() {
        if (expectedLength >= 0 && bytesRead >= expectedLength) {
            commit();
        }
    }

    private void commit() {
        if (done) {
            return;
        }
        done = true;
        onComplete.accept(copy.toByteArray());
        copy.reset();
    }

    private void abort() {
        if (done) {
            return;
        }
        done = true;
        copy.reset();
    }
}
