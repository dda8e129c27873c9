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
 * Thrown by a store configured with {@link RaceRecoveryPolicy#FAIL} when a document
 * holds more than one concatenated top-level JSON value.
 */
public class ConcurrentWriteException extends StorageException {

    private final Path document;
    private final int valueCount;

    public ConcurrentWriteException(Path document, int valueCount) {
        super("Document " + document + " contains " + valueCount +
                " concatenated JSON values; refusing to merge");
        this.document = document;
        this.valueCount = valueCount;
    }

    /** The document that showed the race artifact. */
    public Path document() {
        return document;
    }

    /** Number of top-level values found in the file. */
    public int valueCount() {
        return valueCount;
    }
}
