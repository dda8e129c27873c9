/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.docstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * Replaces a document's content so that no reader ever sees a half-written file.
 * <p>
 * <b>Protocol:</b> write temp → fsync → (verify) → atomic rename → fsync dir.
 * <ol>
 *   <li>The payload is staged at {@code <name>.tmp.<pid>.<epoch-ms>}, unique per writer even
 *       when locking is degraded.</li>
 *   <li>The temp file is forced to disk. This is best-effort: filesystems that reject
 *       {@code fsync} (some network mounts) only produce a warning.</li>
 *   <li>With {@code verifyWrites}, the staged bytes are read back and compared.</li>
 *   <li>The temp file is moved onto the canonical path with {@code ATOMIC_MOVE}; a concurrent
 *       open sees either the complete old file or the complete new one.</li>
 * </ol>
 * The caller must hold the document's exclusive lock for the whole call.
 * Move failures propagate; the staged file is removed on the way out when possible.
 */
public final class AtomicFileWriter {

    private static final Logger LOG = LoggerFactory.getLogger(AtomicFileWriter.class);

    private static final boolean WINDOWS = System.getProperty("os.name", "").toLowerCase().contains("win");

    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final long minFreeSpace;
    private final long maxDocumentSize;

    public AtomicFileWriter(boolean syncEnabled, boolean verifyWrites, long minFreeSpace, long maxDocumentSize) {
        this.syncEnabled = syncEnabled;
        this.verifyWrites = verifyWrites;
        this.minFreeSpace = minFreeSpace;
        this.maxDocumentSize = maxDocumentSize;
    }

    public AtomicFileWriter(DocumentStoreConfig config) {
        this(config.syncEnabled(), config.verifyWrites(),
                config.minFreeSpaceBytes(), config.maxDocumentSizeBytes());
    }

    /**
     * Durably replaces the document with {@code payload}.
     *
     * @throws StorageException if a pre-flight check, the write, the verification or the rename fails
     */
    public void write(DocumentPaths paths, byte[] payload) {
        if (payload.length > maxDocumentSize) {
            LOG.error("Document too large: {} bytes (max: {})", payload.length, maxDocumentSize);
            throw new StorageException("Document too large: " + payload.length +
                    " bytes (max: " + maxDocumentSize + ")");
        }

        Path target = paths.file();
        Path tmp = paths.tempFile(ProcessHandle.current().pid(), System.currentTimeMillis());
        try {
            Files.createDirectories(paths.directory());
            checkDiskSpace(paths.directory());

            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(payload);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (syncEnabled) {
                    forceQuietly(ch, tmp);
                }
            }

            if (verifyWrites) {
                verifyStaged(tmp, payload);
            }

            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmp, target);

            if (syncEnabled) {
                syncDirectory(paths.directory());
            }
            LOG.debug("Wrote {} bytes to {}", payload.length, target);
        } catch (IOException e) {
            LOG.error("Failed to write {}: {}", target, e.getMessage(), e);
            deleteQuietly(tmp);
            throw new StorageException("Failed to write " + target, e);
        } catch (StorageException e) {
            deleteQuietly(tmp);
            throw e;
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void forceQuietly(FileChannel ch, Path tmp) {
        try {
            ch.force(true);
            LOG.trace("Synced temp file {}", tmp);
        } catch (IOException e) {
            LOG.warn("Could not fsync {}: {}", tmp, e.getMessage());
        }
    }

    /**
     * Fsyncs a directory so the rename itself survives a crash.
     * <p>
     * Skipped on Windows, where directories cannot be opened as channels.
     */
    private void syncDirectory(Path dir) {
        if (WINDOWS) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    private void verifyStaged(Path tmp, byte[] expected) throws IOException {
        byte[] actual = Files.readAllBytes(tmp);
        if (!Arrays.equals(expected, actual)) {
            LOG.error("Write verification failed for {}: wrote {} bytes, read back {} bytes",
                    tmp, expected.length, actual.length);
            throw new StorageException("Write verification failed for " + tmp +
                    ". Possible silent data corruption!");
        }
        LOG.trace("Write verification passed for {}", tmp);
    }

    private void checkDiskSpace(Path dir) throws IOException {
        if (minFreeSpace <= 0) {
            return;
        }
        FileStore store = Files.getFileStore(dir);
        long usableSpace = store.getUsableSpace();
        if (usableSpace < minFreeSpace) {
            long usableSpaceMb = usableSpace / 1024 / 1024;
            long minFreeSpaceMb = minFreeSpace / 1024 / 1024;
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new StorageException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB");
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove staging file {}: {}", tmp, e.getMessage());
        }
    }
}
