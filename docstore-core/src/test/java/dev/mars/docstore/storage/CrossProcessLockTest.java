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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.File;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Verifies that a lock held by another JVM blocks this one.
 * <p>
 * Spawns {@link LockHolderMain} with the test classpath.
 */
@Timeout(60)
class CrossProcessLockTest {

    @TempDir
    Path tempDir;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private Process child;

    @AfterEach
    void tearDown() {
        if (child != null && child.isAlive()) {
            child.destroyForcibly();
        }
        executor.shutdownNow();
    }

    private Process startHolder(Path lockPath) throws Exception {
        Path javaBin = Path.of(System.getProperty("java.home"), "bin",
                File.separatorChar == '\\' ? "java.exe" : "java");
        assumeTrue(Files.isExecutable(javaBin), "no java launcher at " + javaBin);

        String classPath = System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
        ProcessBuilder pb = new ProcessBuilder(javaBin.toString(), "-cp", classPath,
                LockHolderMain.class.getName(), lockPath.toString());
        pb.redirectErrorStream(true);
        return pb.start();
    }

    private static void awaitLine(BufferedReader out, String expected) throws Exception {
        String line;
        while ((line = out.readLine()) != null) {
            if (line.contains(expected)) {
                return;
            }
        }
        fail("child exited before printing " + expected);
    }

    @Test
    void testReaderInThisProcess_WaitsForWriterInAnotherProcess() throws Exception {
        Path lockPath = tempDir.resolve("doc.json.lock");
        child = startHolder(lockPath);
        BufferedReader out = new BufferedReader(new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8));

        executor.submit(() -> {
            awaitLine(out, LockHolderMain.READY);
            return null;
        }).get(30, TimeUnit.SECONDS);

        FileLockManager locks = new FileLockManager(lockPath);
        Future<Boolean> reader = executor.submit(() -> {
            try (LockHandle lock = locks.acquire(true)) {
                return lock.shared();
            }
        });

        assertThrows(TimeoutException.class, () -> reader.get(500, TimeUnit.MILLISECONDS),
                "shared lock must wait while another process holds the exclusive lock");

        child.getOutputStream().close();

        assertEquals(Boolean.TRUE, reader.get(30, TimeUnit.SECONDS));
        assertTrue(child.waitFor(30, TimeUnit.SECONDS));
        assertEquals(0, child.exitValue());
    }

    @Test
    void testStoreWrite_WaitsForLockHeldByAnotherProcess() throws Exception {
        JsonDocumentStore store = new JsonDocumentStore(tempDir, "doc.json", JsonNodeFactory.instance::arrayNode,
                DocumentStoreConfig.builder().encryptionSecret(null).syncEnabled(false).minFreeSpaceMb(0)
                        .lockMode(LockMode.ADVISORY).build());
        child = startHolder(tempDir.resolve("doc.json.lock"));
        BufferedReader out = new BufferedReader(new InputStreamReader(child.getInputStream(), StandardCharsets.UTF_8));

        executor.submit(() -> {
            awaitLine(out, LockHolderMain.READY);
            return null;
        }).get(30, TimeUnit.SECONDS);

        Future<?> write = executor.submit(() -> store.write(JsonNodeFactory.instance.arrayNode().add(1)));

        assertThrows(TimeoutException.class, () -> write.get(500, TimeUnit.MILLISECONDS));
        assertFalse(Files.exists(store.path()), "nothing may be written while the other process holds the lock");

        child.getOutputStream().close();

        write.get(30, TimeUnit.SECONDS);
        assertEquals(JsonNodeFactory.instance.arrayNode().add(1), store.read());
    }
}
