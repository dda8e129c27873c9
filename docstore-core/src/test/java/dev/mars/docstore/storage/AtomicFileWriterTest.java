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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AtomicFileWriter}.
 */
class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private List<String> listing(Path dir) throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
    }

    @Test
    void testWrite_CreatesFileWithExactBytes() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter(true, false, 0, 1024);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");

        writer.write(paths, utf8("[1,2,3]"));

        assertArrayEquals(utf8("[1,2,3]"), Files.readAllBytes(paths.file()));
        assertEquals(List.of("doc.json"), listing(tempDir));
    }

    @Test
    void testWrite_ReplacesExisting() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter(false, false, 0, 1024);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");
        Files.writeString(paths.file(), "a much longer previous document body");

        writer.write(paths, utf8("{}"));

        assertEquals("{}", Files.readString(paths.file()));
    }

    @Test
    void testWrite_CreatesMissingDirectory() throws Exception {
        Path dir = tempDir.resolve("nested").resolve("deeper");
        AtomicFileWriter writer = new AtomicFileWriter(true, false, 0, 1024);

        writer.write(DocumentPaths.of(dir, "doc.json"), utf8("[]"));

        assertTrue(Files.isRegularFile(dir.resolve("doc.json")));
    }

    @Test
    void testWrite_WithVerification() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter(true, true, 0, 1024);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");

        writer.write(paths, utf8("{\"verified\":true}"));

        assertEquals("{\"verified\":true}", Files.readString(paths.file()));
    }

    @Test
    void testWrite_EmptyPayload() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter(false, true, 0, 1024);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");

        writer.write(paths, new byte[0]);

        assertEquals(0, Files.size(paths.file()));
    }

    @Test
    void testWrite_TooLarge_RejectedAndOriginalKept() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter(false, false, 0, 8);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");
        Files.writeString(paths.file(), "[0]");

        StorageException e = assertThrows(StorageException.class,
                () -> writer.write(paths, utf8("[1,2,3,4,5,6]")));

        assertTrue(e.getMessage().contains("too large"));
        assertEquals("[0]", Files.readString(paths.file()));
        assertEquals(List.of("doc.json"), listing(tempDir));
    }

    @Test
    void testWrite_InsufficientDiskSpace_RejectedAndNoTempLeft() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter(false, false, Long.MAX_VALUE, 1024);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");

        StorageException e = assertThrows(StorageException.class, () -> writer.write(paths, utf8("[]")));

        assertTrue(e.getMessage().contains("Insufficient disk space"));
        assertTrue(listing(tempDir).isEmpty());
    }

    @Test
    void testWrite_RenameFails_PropagatesAndRemovesTemp() throws Exception {
        AtomicFileWriter writer = new AtomicFileWriter(false, false, 0, 1024);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");
        // A non-empty directory in place of the document cannot be replaced by a rename
        Files.createDirectories(paths.file());
        Files.writeString(paths.file().resolve("occupant"), "x");

        assertThrows(StorageException.class, () -> writer.write(paths, utf8("[]")));

        assertEquals(List.of("doc.json"), listing(tempDir));
        assertTrue(Files.isDirectory(paths.file()));
    }

    @Test
    void testConfigConstructor_UsesByteLimits() {
        DocumentStoreConfig config = DocumentStoreConfig.builder()
                .encryptionSecret(null)
                .minFreeSpaceMb(0)
                .maxDocumentSizeMb(1)
                .build();
        AtomicFileWriter writer = new AtomicFileWriter(config);
        DocumentPaths paths = DocumentPaths.of(tempDir, "doc.json");

        writer.write(paths, new byte[1024 * 1024]);
        assertThrows(StorageException.class, () -> writer.write(paths, new byte[1024 * 1024 + 1]));
    }

    @Test
    void testPaths_CompanionFileNames() {
        DocumentPaths paths = DocumentPaths.of(tempDir, "users.json");

        assertEquals(tempDir.resolve("users.json.lock"), paths.lockFile());
        assertEquals(tempDir.resolve("users.json.tmp.42.1700000000000"), paths.tempFile(42, 1700000000000L));
        assertEquals(tempDir.resolve("users.json.corrupt.1700000000"), paths.quarantineFile(1700000000L));
        assertEquals("users.json", paths.fileName());
        assertEquals(tempDir, paths.directory());
    }
}
