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
/**
 * Single-file JSON document storage.
 * <p>
 * Each document lives in one file and is replaced whole on every write:
 * <ul>
 *   <li>{@link dev.mars.docstore.storage.DocumentStore} - The storage interface</li>
 *   <li>{@link dev.mars.docstore.storage.JsonDocumentStore} - File-based implementation</li>
 *   <li>{@link dev.mars.docstore.storage.LockManager} - Shared/exclusive advisory locking</li>
 *   <li>{@link dev.mars.docstore.storage.AtomicFileWriter} - Temp file, fsync, atomic rename</li>
 *   <li>{@link dev.mars.docstore.storage.RecoveryDecoder} - Tolerant decoding of concatenated values</li>
 *   <li>{@link dev.mars.docstore.storage.EncryptionEnvelope} - Optional AES-256-GCM at rest</li>
 *   <li>{@link dev.mars.docstore.storage.DocumentRegistry} - Named stores sharing one key</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Whole-file replacement:</b> readers see the old or the new document, never a mix</li>
 *   <li><b>Reads always answer:</b> corruption and tampering yield the default value</li>
 *   <li><b>Nothing is discarded:</b> unreadable files are renamed, not deleted</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * server-data/
 *  ├─ users.json                    // the document (plain JSON or an encryption envelope)
 *  ├─ users.json.lock               // advisory lock target, never renamed
 *  ├─ users.json.tmp.4711.17000000  // staged write, exists only during a write
 *  └─ users.json.corrupt.1700000000 // quarantined unreadable content
 * </pre>
 *
 * @see dev.mars.docstore.storage.DocumentStore
 */
package dev.mars.docstore.storage;
