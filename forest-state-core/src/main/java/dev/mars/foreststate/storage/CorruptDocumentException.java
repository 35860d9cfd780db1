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
package dev.mars.foreststate.storage;

/**
 * A committed file exists but cannot be decoded as a document.
 */
public class CorruptDocumentException extends StorageException {

    private final StorageKey key;

    public CorruptDocumentException(StorageKey key, Throwable cause) {
        super("Corrupt document at " + key + ": " + cause.getMessage(), cause);
        this.key = key;
    }

    /** Key of the unreadable document. */
    public StorageKey key() {
        return key;
    }
}
