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
 * Multi-document transactions over a {@link dev.mars.foreststate.storage.ProjectFileStore}.
 * <p>
 * Snapshots are taken from disk before the first write, and a failed transaction restores
 * them in reverse order. Failures during the restore are reported as
 * {@link dev.mars.foreststate.tx.IntegrityWarning}s.
 */
package dev.mars.foreststate.tx;
