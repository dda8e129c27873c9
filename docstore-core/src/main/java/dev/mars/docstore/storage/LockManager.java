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

import java.nio.file.FileSystems;
import java.nio.file.Path;

/**
 * Per-document lock capability.
 * <p>
 * Two implementations exist and one is chosen when a store is constructed:
 * <ul>
 *   <li>{@link FileLockManager} - OS advisory locks on the document's {@code <name>.lock}
 *       companion file. Readers share, writers are exclusive, across threads and processes
 *       of one host.</li>
 *   <li>{@link NoOpLockManager} - no locking at all. {@link #isCrossProcess()} reports
 *       {@code false} and callers are only safe from a single thread of a single process.</li>
 * </ul>
 * <p>
 * Locks are never held across calls: every operation acquires, does its work, and
 * closes the returned {@link LockHandle} on the same thread.
 */
public interface LockManager {

    /**
     * Blocks until the lock is granted. No timeout, no spin-wait.
     *
     * @param shared {@code true} for a read (shared) lock, {@code false} for a write (exclusive) lock
     * @return a handle that releases the lock when closed
     * @throws LockAcquisitionException if the lock call fails; nothing stays open in that case
     */
    LockHandle acquire(boolean shared);

    /**
     * Whether this manager excludes other processes. {@code false} means the reduced,
     * single-process guarantee of the no-op mode.
     */
    boolean isCrossProcess();

    /**
     * Selects the lock implementation for a document.
     * <p>
     * {@link LockMode#AUTO} uses advisory locks on the default filesystem and degrades to the
     * no-op manager on filesystem providers that have no lock support.
     *
     * @param lockPath the {@code <name>.lock} companion file
     * @param mode     the configured lock mode
     */
    static LockManager create(Path lockPath, LockMode mode) {
        Logger log = LoggerFactory.getLogger(LockManager.class);
        return switch (mode) {
            case NONE -> new NoOpLockManager(lockPath);
            case ADVISORY -> new FileLockManager(lockPath);
            case AUTO -> {
                if (lockPath.getFileSystem() == FileSystems.getDefault()) {
                    yield new FileLockManager(lockPath);
                }
                log.warn("Filesystem {} offers no advisory locks; {} falls back to no-op locking",
                        lockPath.getFileSystem(), lockPath);
                yield new NoOpLockManager(lockPath);
            }
        };
    }
}
