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
 * Thrown when the OS refuses or errors the advisory lock call on a document's lock file.
 * <p>
 * Fatal for the call that raised it. No retry is attempted by the store.
 */
public class LockAcquisitionException extends StorageException {

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
