/*
 * Copyright (c) 2025-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package cachet.http.storage;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.*;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import static cachet.http.internal.Utils.hexDigest;
import static java.lang.System.Logger.Level.DEBUG;
import static java.nio.file.StandardOpenOption.*;

/**
 * The on-disk layout shared by {@link FileStorage} and {@link SeparateBodyFileStorage}. A key is hashed with SHA-224,
 * the first five hex characters of the hash name five nested directories and the full hash names the file. A body
 * stored apart lives next to it with a {@code .body} suffix, and writers of a file coordinate on a {@code .lock}
 * sibling.
 * <p>
 * A write goes to an exclusively created temporary sibling which is then moved over the target, so readers only ever
 * see complete files and never wait for writers.
 */
final class FileLayout {
    private static final System.Logger LOGGER = System.getLogger("cachet.http.storage.FileStorage");

    static final @NonNull String BODY_SUFFIX = ".body";
    private static final @NonNull String LOCK_SUFFIX = ".lock";
    private static final int FAN_OUT_DEPTH = 5;

    /**
     * A JVM only holds one {@link FileChannel#lock()} per file, so threads of this process serialize on these first.
     */
    private static final @NonNull ReentrantLock @NonNull [] LOCK_STRIPES = new ReentrantLock[64];

    static {
        for (var i = 0; i < LOCK_STRIPES.length; i++) {
            LOCK_STRIPES[i] = new ReentrantLock();
        }
    }

    private final @NonNull Path directory;
    private final boolean forever;
    private final boolean posix;

    FileLayout(final @NonNull Path directory, final boolean forever) {
        assert directory != null;

        this.directory = directory.toAbsolutePath().normalize();
        this.forever = forever;
        this.posix = this.directory.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    @NonNull
    Path directory() {
        return directory;
    }

    boolean forever() {
        return forever;
    }

    @NonNull
    Path pathFor(final @NonNull String key) {
        assert key != null;

        final var hashed = hexDigest("SHA-224", key);
        var path = directory;
        for (var i = 0; i < FAN_OUT_DEPTH; i++) {
            path = path.resolve(String.valueOf(hashed.charAt(i)));
        }
        return path.resolve(hashed);
    }

    byte @Nullable [] read(final @NonNull Path path) {
        assert path != null;

        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException ignored) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    @Nullable
    InputStream open(final @NonNull Path path) {
        assert path != null;

        try {
            return Files.newInputStream(path);
        } catch (NoSuchFileException ignored) {
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to open " + path, e);
        }
    }

    void write(final @NonNull Path path, final byte @NonNull [] data) {
        assert path != null;
        assert data != null;

        final var parent = path.getParent();
        final var stripe = LOCK_STRIPES[Math.floorMod(path.hashCode(), LOCK_STRIPES.length)];
        stripe.lock();
        try {
            if (posix) {
                Files.createDirectories(parent,
                        PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
            } else {
                Files.createDirectories(parent);
            }
            final var lockPath = parent.resolve(path.getFileName() + LOCK_SUFFIX);
            try (final var lockChannel = FileChannel.open(lockPath, CREATE, WRITE);
                 final var ignored = lockChannel.lock()) {
                writeAtomically(path, data);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        } finally {
            stripe.unlock();
        }
    }

    private void writeAtomically(final @NonNull Path path, final byte @NonNull [] data) throws IOException {
        final var temp = path.resolveSibling(path.getFileName() + "." + UUID.randomUUID() + ".tmp");
        final FileAttribute<?>[] attributes = posix
                ? new FileAttribute<?>[]{
                PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------"))}
                : new FileAttribute<?>[0];
        try {
            try (final var channel = Files.newByteChannel(temp,
                    Set.<OpenOption>of(CREATE_NEW, WRITE, LinkOption.NOFOLLOW_LINKS), attributes)) {
                final var buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOGGER.log(DEBUG, "Atomic move not supported in " + directory + ", replacing " + path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    void delete(final @NonNull Path path) {
        assert path != null;

        if (forever) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + path, e);
        }
    }
}
