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
 * How a store obtains cross-process mutual exclusion.
 */
public enum LockMode {

    /** Use OS advisory locks on the default filesystem, otherwise degrade to {@link #NONE}. */
    AUTO,

    /** Always use OS advisory locks; operations fail if the platform rejects the lock call. */
    ADVISORY,

    /**
     * Take no locks. Only safe when a single thread of a single process touches the document.
     */
    NONE
}
