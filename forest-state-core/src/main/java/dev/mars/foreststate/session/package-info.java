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
 * Durable storage for goal-clarification dialogue sessions.
 * <p>
 * {@link dev.mars.foreststate.session.SqliteDialogueSessionStore} keeps sessions in an
 * embedded database so an interrupted dialogue can be resumed after a restart.
 * {@link dev.mars.foreststate.session.DialogueSessionStores#open} degrades to memory
 * when the database is unavailable.
 */
package dev.mars.foreststate.session;
