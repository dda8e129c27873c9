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

/**
 * What a store does when it finds several concatenated top-level JSON values in a document,
 * the footprint of writers that raced without holding the lock.
 */
public enum RaceRecoveryPolicy {

    /**
     * Merge the values left to right (arrays extend, objects update) and rewrite the
     * document in its single-value form.
     */
    MERGE,

    /**
     * Leave the file untouched and raise {@link ConcurrentWriteException}. Use for documents
     * where guessing the writers' intent is not acceptable.
     */
    FAIL
}
