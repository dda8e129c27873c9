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

import java.nio.file.Path;

/**
 * On-disk names belonging to one logical document.
 * <pre>
 * data/
 *  ├─ users.json                          // canonical file: plain JSON or envelope
 *  ├─ users.json.lock                     // advisory-lock companion, never holds data
 *  ├─ users.json.tmp.&lt;pid&gt;.&lt;epoch-ms&gt;     // staging file, gone after a successful rename
 *  └─ users.json.corrupt.&lt;epoch-seconds&gt;  // quarantined unreadable snapshot
 * </pre>
 *
 * @param file the canonical document file
 */
public record DocumentPaths(Path file) {

    public static DocumentPaths of(Path baseDir, String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
        Path file = baseDir.resolve(fileName);
        if (!baseDir.equals(file.getParent())) {
            throw new IllegalArgumentException("fileName must name a file directly inside " + baseDir + ": " + fileName);
        }
        return new DocumentPaths(file);
    }

    public Path directory() {
        return file.getParent();
    }

    public String fileName() {
        return file.getFileName().toString();
    }

    public Path lockFile() {
        return file.resolveSibling(fileName() + ".lock");
    }

    public Path tempFile(long pid, long epochMillis) {
        return file.resolveSibling(fileName() + ".tmp." + pid + "." + epochMillis);
    }

    public Path quarantineFile(long epochSeconds) {
        return file.resolveSibling(fileName() + ".corrupt." + epochSeconds);
    }
}
