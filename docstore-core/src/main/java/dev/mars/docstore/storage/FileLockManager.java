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
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link LockManager} backed by OS advisory locks ({@link FileChannel#lock(long, long, boolean)})
 * on a zero-length companion file.
 * <p>
 * <b>Two layers:</b>
 * <ul>
 *   <li><b>In-process:</b> the JVM refuses overlapping {@link FileLock}s from one process
 *       ({@link OverlappingFileLockException}), so threads are coordinated first by a fair
 *       read/write lock shared by every manager of the same lock path. The first reader in the
 *       process takes the OS shared lock, the last one to leave releases it.</li>
 *   <li><b>Cross-process:</b> the OS lock itself, shared for reads and exclusive for writes.</li>
 * </ul>
 * <p>
 * A fresh {@link FileChannel} is opened per acquisition (per first reader); nothing is cached
 * between calls. There is no timeout: callers under heavy contention must bound their own waits.
 */
public final class FileLockManager implements LockManager {

    private static final Logger LOG = LoggerFactory.getLogger(FileLockManager.class);

    /** One coordination record per canonical lock path, shared across store instances. */
    private static final ConcurrentMap<Path, ProcessLocal> PROCESS_LOCAL = new ConcurrentHashMap<>();

    private final Path lockPath;
    private final ProcessLocal local;

    public FileLockManager(Path lockPath) {
        this.lockPath = lockPath.toAbsolutePath().normalize();
        this.local = PROCESS_LOCAL.computeIfAbsent(this.lockPath, p -> new ProcessLocal());
    }

    /** The lock file this manager locks. */
    public Path lockPath() {
        return lockPath;
    }

    @Override
    public LockHandle acquire(boolean shared) {
        return shared ? acquireShared() : acquireExclusive();
    }

    @Override
    public boolean isCrossProcess() {
        return true;
    }

    // ========================================================================
    // Acquisition
    // ========================================================================

    private LockHandle acquireExclusive() {
        local.rw.writeLock().lock();
        try {
            FileChannel channel = openLockChannel();
            FileLock lock = lockChannel(channel, false);
            LOG.trace("Exclusive lock acquired: {}", lockPath);
            return new ExclusiveHandle(channel, lock);
        } catch (RuntimeException e) {
            local.rw.writeLock().unlock();
            throw e;
        }
    }

    private LockHandle acquireShared() {
        local.rw.readLock().lock();
        try {
            synchronized (local) {
                if (local.sharedHolders == 0) {
                    FileChannel channel = openLockChannel();
                    local.sharedLock = lockChannel(channel, true);
                    local.sharedChannel = channel;
                    LOG.trace("Shared lock acquired: {}", lockPath);
                }
                local.sharedHolders++;
            }
            return new SharedHandle();
        } catch (RuntimeException e) {
            local.rw.readLock().unlock();
            throw e;
        }
    }

    private FileChannel openLockChannel() {
        try {
            Path parent = lockPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return FileChannel.open(lockPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
        } catch (IOException e) {
            LOG.error("Cannot open lock file {}: {}", lockPath, e.getMessage(), e);
            throw new LockAcquisitionException("Cannot open lock file " + lockPath, e);
        }
    }

    private FileLock lockChannel(FileChannel channel, boolean shared) {
        try {
            return channel.lock(0L, Long.MAX_VALUE, shared);
        } catch (IOException | OverlappingFileLockException | UnsupportedOperationException e) {
            closeQuietly(channel);
            LOG.error("Failed to acquire {} lock on {}: {}",
                    shared ? "shared" : "exclusive", lockPath, e.getMessage(), e);
            throw new LockAcquisitionException(
                    "Failed to acquire " + (shared ? "shared" : "exclusive") + " lock on " + lockPath, e);
        }
    }

    // ========================================================================
    // Release
    // ========================================================================

    private void releaseQuietly(FileLock lock) {
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock on {}: {}", lockPath, e.getMessage());
        }
    }

    private void closeQuietly(FileChannel channel) {
        try {
            if (channel != null && channel.isOpen()) {
                channel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close lock channel {}: {}", lockPath, e.getMessage());
        }
    }

    private final class ExclusiveHandle implements LockHandle {
        private final FileChannel channel;
        private final FileLock lock;
        private final AtomicBoolean released = new AtomicBoolean();

        ExclusiveHandle(FileChannel channel, FileLock lock) {
            this.channel = channel;
            this.lock = lock;
        }

        @Override
        public boolean shared() {
            return false;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                releaseQuietly(lock);
                closeQuietly(channel);
                LOG.trace("Exclusive lock released: {}", lockPath);
            } finally {
                local.rw.writeLock().unlock();
            }
        }
    }

    private final class SharedHandle implements LockHandle {
        private final AtomicBoolean released = new AtomicBoolean();

        @Override
        public boolean shared() {
            return true;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                synchronized (local) {
                    local.sharedHolders--;
                    if (local.sharedHolders == 0) {
                        releaseQuietly(local.sharedLock);
                        closeQuietly(local.sharedChannel);
                        local.sharedLock = null;
                        local.sharedChannel = null;
                        LOG.trace("Shared lock released: {}", lockPath);
                    }
                }
            } finally {
                local.rw.readLock().unlock();
            }
        }
    }

    /**
     * In-process state for one lock path. Guarded by its own monitor, except {@code rw}.
     */
    private static final class ProcessLocal {
        final ReentrantReadWriteLock rw = new ReentrantReadWriteLock(true);
        int sharedHolders;
        FileChannel sharedChannel;
        FileLock sharedLock;
    }
}
