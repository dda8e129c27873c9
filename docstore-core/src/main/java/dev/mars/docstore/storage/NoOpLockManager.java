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

import java.nio.file.Path;

/**
 * Lock manager that locks nothing.
 * <p>
 * <b>Reduced guarantee:</b> with this manager readers may observe a document while it is
 * being replaced and concurrent writers may both win. The atomic rename and the unique
 * temp file names still keep every individual file intact, and the recovery decoder
 * repairs documents that end up with concatenated values, but mutual exclusion is gone.
 * Only use it where one thread of one process owns the document.
 */
public final class NoOpLockManager implements LockManager {

    private static final Logger LOG = LoggerFactory.getLogger(NoOpLockManager.class);

    private static final LockHandle SHARED = new NoOpHandle(true);
    private static final LockHandle EXCLUSIVE = new NoOpHandle(false);

    public NoOpLockManager(Path lockPath) {
        LOG.warn("Locking DISABLED for {}: document is only safe from a single thread of a single process",
                lockPath);
    }

    @Override
    public LockHandle acquire(boolean shared) {
        return shared ? SHARED : EXCLUSIVE;
    }

    @Override
    public boolean isCrossProcess() {
        return false;
    }

    private record NoOpHandle(boolean shared) implements LockHandle {
        @Override
        public void close() {
        }
    }
}
