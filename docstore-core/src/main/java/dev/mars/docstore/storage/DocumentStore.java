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

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * A single JSON document persisted in one file.
 * <p>
 * Collaborators (repositories, services) depend on this interface only. Every call runs
 * synchronously on the calling thread and takes its lock for the duration of the call.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>{@link #read()} never fails because of corruption, tampering or a detected writer
 *       race: it returns the stored value, a merged value, or the default.</li>
 *   <li>{@link #write(JsonNode)} is atomic and durable before it returns, and may fail
 *       (disk full, permissions, lock failure). Retrying is up to the caller.</li>
 * </ul>
 *
 * @see JsonDocumentStore
 */
public interface DocumentStore {

    /**
     * Creates the document with its default value if it does not exist yet. Idempotent.
     */
    void init();

    /**
     * Loads the current value.
     *
     * @return the stored value, or a fresh default if the file is absent, empty or unreadable;
     *         the caller owns the returned tree
     */
    JsonNode read();

    /**
     * Atomically replaces the document with {@code value}.
     *
     * @throws SerializationException   if the value cannot be encoded
     * @throws LockAcquisitionException if the exclusive lock cannot be taken
     * @throws StorageException         if the file cannot be written
     */
    void write(JsonNode value);

    /** The canonical document file. */
    Path path();

    /**
     * Whether readers and writers in other processes are excluded. {@code false} when the
     * store runs with the no-op lock manager.
     */
    boolean isCrossProcessSafe();
}
