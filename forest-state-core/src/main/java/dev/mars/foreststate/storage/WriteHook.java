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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interception points around the rename step of {@link AtomicFileStore}.
 * Used to simulate crashes on either side of the commit point.
 */
interface WriteHook {

    WriteHook NONE = new WriteHook() {
    };

    /** Called after the temp file is fully written, before the rename. */
    default void beforeRename(StorageKey key, Path tempFile) throws IOException {
    }

    /** Called right after the rename made the new value visible. */
    default void afterRename(StorageKey key, Path target) throws IOException {
    }
}
