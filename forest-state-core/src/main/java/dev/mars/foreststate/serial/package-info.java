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
 * Per-project operation serialization.
 * <p>
 * {@link dev.mars.foreststate.serial.ProjectOperationSerializer} is the only
 * mutual-exclusion primitive of the state layer. It is scoped strictly per project
 * and assumes every writer runs in this process; it offers no multi-process safety.
 */
package dev.mars.foreststate.serial;
