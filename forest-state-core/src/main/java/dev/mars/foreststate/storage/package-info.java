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
 * Project file storage - crash-safe JSON documents with a write-through cache.
 * <p>
 * This package provides the persistence layer for per-project learning state:
 * <ul>
 *   <li>{@link dev.mars.foreststate.storage.ProjectFileStore} - The storage interface</li>
 *   <li>{@link dev.mars.foreststate.storage.AtomicFileStore} - File-based implementation</li>
 *   <li>{@link dev.mars.foreststate.storage.DocumentCache} - Invalidation-safe document cache</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Persist-before-response:</b> A write future completes only after the rename and directory sync</li>
 *   <li><b>Crash safety:</b> A reader sees the previous or the new document, never a partial one</li>
 *   <li><b>No stale reads:</b> The cache is invalidated around every write and never repopulated with old data</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * ~/.forest-data/
 *  ├─ .forest.lock            // held while a store is open
 *  ├─ dialogues.db            // dialogue sessions (SQLite)
 *  └─ &lt;projectId&gt;/
 *      ├─ config.json
 *      ├─ paths/&lt;pathName&gt;/hta.json
 *      └─ config.json.tmp     // only while a write is in flight
 * </pre>
 *
 * @see dev.mars.foreststate.storage.ProjectFileStore
 */
package dev.mars.foreststate.storage;
