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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileLockManager} and {@link LockManager#create}.
 * <p>
 * Lock handles are always closed on the thread that acquired them.
 */
@Timeout(30)
class FileLockManagerTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private Path lockPath() {
        return tempDir.resolve("doc.json.lock");
    }

    // ========================================================================
    // Exclusion
    // ========================================================================

    @Nested
    @DisplayName("In-process exclusion")
    class ExclusionTests {

        @Test
        void testExclusive_BlocksSecondExclusive() throws Exception {
            FileLockManager first = new FileLockManager(lockPath());
            FileLockManager second = new FileLockManager(lockPath());
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<?> holder = executor.submit(() -> {
                try (LockHandle lock = first.acquire(false)) {
                    held.countDown();
                    release.await(10, TimeUnit.SECONDS);
                }
                return null;
            });
            assertTrue(held.await(5, TimeUnit.SECONDS));

            Future<?> waiter = executor.submit(() -> {
                try (LockHandle lock = second.acquire(false)) {
                    assertFalse(lock.shared());
                }
                return null;
            });

            assertThrows(TimeoutException.class, () -> waiter.get(300, TimeUnit.MILLISECONDS));

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            waiter.get(5, TimeUnit.SECONDS);
        }

        @Test
        void testShared_ReadersOverlap() throws Exception {
            FileLockManager locks = new FileLockManager(lockPath());
            int readers = 4;
            CountDownLatch allInside = new CountDownLatch(readers);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger maxConcurrent = new AtomicInteger();
            AtomicInteger inside = new AtomicInteger();

            Future<?>[] futures = new Future<?>[readers];
            for (int i = 0; i < readers; i++) {
                futures[i] = executor.submit(() -> {
                    try (LockHandle lock = locks.acquire(true)) {
                        assertTrue(lock.shared());
                        maxConcurrent.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        allInside.countDown();
                        release.await(10, TimeUnit.SECONDS);
                        inside.decrementAndGet();
                    }
                    return null;
                });
            }

            assertTrue(allInside.await(5, TimeUnit.SECONDS), "all readers should hold the lock together");
            release.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
            assertEquals(readers, maxConcurrent.get());
        }

        @Test
        void testExclusive_WaitsForReaders() throws Exception {
            FileLockManager locks = new FileLockManager(lockPath());
            CountDownLatch readerIn = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<?> reader = executor.submit(() -> {
                try (LockHandle lock = locks.acquire(true)) {
                    readerIn.countDown();
                    release.await(10, TimeUnit.SECONDS);
                }
                return null;
            });
            assertTrue(readerIn.await(5, TimeUnit.SECONDS));

            Future<?> writer = executor.submit(() -> {
                try (LockHandle lock = locks.acquire(false)) {
                    return lock.shared();
                }
            });

            assertThrows(TimeoutException.class, () -> writer.get(300, TimeUnit.MILLISECONDS));
            release.countDown();
            reader.get(5, TimeUnit.SECONDS);
            assertEquals(Boolean.FALSE, writer.get(5, TimeUnit.SECONDS));
        }

        @Test
        void testShared_WaitsForWriter() throws Exception {
            FileLockManager locks = new FileLockManager(lockPath());
            CountDownLatch writerIn = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            Future<?> writer = executor.submit(() -> {
                try (LockHandle lock = locks.acquire(false)) {
                    writerIn.countDown();
                    release.await(10, TimeUnit.SECONDS);
                }
                return null;
            });
            assertTrue(writerIn.await(5, TimeUnit.SECONDS));

            Future<?> reader = executor.submit(() -> {
                try (LockHandle lock = locks.acquire(true)) {
                    return lock.shared();
                }
            });

            assertThrows(TimeoutException.class, () -> reader.get(300, TimeUnit.MILLISECONDS));
            release.countDown();
            writer.get(5, TimeUnit.SECONDS);
            assertEquals(Boolean.TRUE, reader.get(5, TimeUnit.SECONDS));
        }

        @Test
        void testDifferentPaths_DoNotBlockEachOther() throws Exception {
            FileLockManager a = new FileLockManager(tempDir.resolve("a.json.lock"));
            FileLockManager b = new FileLockManager(tempDir.resolve("b.json.lock"));

            try (LockHandle lockA = a.acquire(false)) {
                Future<Boolean> other = executor.submit(() -> {
                    try (LockHandle lockB = b.acquire(false)) {
                        return lockB.shared();
                    }
                });
                assertEquals(Boolean.FALSE, other.get(5, TimeUnit.SECONDS));
            }
        }

        @Test
        void testMutualExclusion_UnderContention() throws Exception {
            FileLockManager locks = new FileLockManager(lockPath());
            AtomicInteger inside = new AtomicInteger();
            AtomicInteger violations = new AtomicInteger();
            int threads = 8;
            int iterations = 50;
            CountDownLatch start = new CountDownLatch(1);

            Future<?>[] futures = new Future<?>[threads];
            for (int t = 0; t < threads; t++) {
                futures[t] = executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < iterations; i++) {
                        try (LockHandle lock = locks.acquire(false)) {
                            if (inside.incrementAndGet() != 1) {
                                violations.incrementAndGet();
                            }
                            Thread.yield();
                            inside.decrementAndGet();
                        }
                    }
                    return null;
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(20, TimeUnit.SECONDS);
            }

            assertEquals(0, violations.get());
        }
    }

    // ========================================================================
    // Handles
    // ========================================================================

    @Nested
    @DisplayName("Lock handles")
    class HandleTests {

        @Test
        void testAcquire_CreatesLockFileAndParents() {
            Path nested = tempDir.resolve("x").resolve("doc.json.lock");
            FileLockManager locks = new FileLockManager(nested);

            try (LockHandle lock = locks.acquire(false)) {
                assertTrue(Files.exists(nested));
            }
            assertTrue(Files.exists(nested), "lock file is never removed");
        }

        @Test
        void testClose_IsIdempotent() {
            FileLockManager locks = new FileLockManager(lockPath());

            LockHandle exclusive = locks.acquire(false);
            exclusive.close();
            exclusive.close();

            LockHandle shared = locks.acquire(true);
            shared.close();
            shared.close();

            try (LockHandle again = locks.acquire(false)) {
                assertFalse(again.shared());
            }
        }

        @Test
        void testSameThread_SequentialReacquire() {
            FileLockManager locks = new FileLockManager(lockPath());
            for (int i = 0; i < 20; i++) {
                try (LockHandle lock = locks.acquire(i % 2 == 0)) {
                    assertEquals(i % 2 == 0, lock.shared());
                }
            }
        }

        @Test
        void testLockPath_IsAbsolute() {
            FileLockManager locks = new FileLockManager(lockPath());

            assertTrue(locks.lockPath().isAbsolute());
            assertTrue(locks.isCrossProcess());
        }
    }

    // ========================================================================
    // Factory
    // ========================================================================

    @Nested
    @DisplayName("LockManager.create")
    class FactoryTests {

        @Test
        void testCreate_Auto_UsesFileLocksOnDefaultFileSystem() {
            assertTrue(LockManager.create(lockPath(), LockMode.AUTO) instanceof FileLockManager);
        }

        @Test
        void testCreate_Advisory_UsesFileLocks() {
            assertTrue(LockManager.create(lockPath(), LockMode.ADVISORY).isCrossProcess());
        }

        @Test
        void testCreate_None_UsesNoOp() {
            LockManager locks = LockManager.create(lockPath(), LockMode.NONE);

            assertTrue(locks instanceof NoOpLockManager);
            assertFalse(locks.isCrossProcess());
            try (LockHandle lock = locks.acquire(true)) {
                assertTrue(lock.shared());
            }
            assertFalse(Files.exists(lockPath()));
        }

        @Test
        void testCreate_DoesNotTouchFileSystem() {
            Path missing = tempDir.resolve("not-yet").resolve("doc.json.lock");

            LockManager.create(missing, LockMode.AUTO);

            assertFalse(Files.exists(missing.getParent()));
        }
    }
}
