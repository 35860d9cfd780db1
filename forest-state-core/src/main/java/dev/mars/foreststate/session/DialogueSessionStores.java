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
package dev.mars.foreststate.session;

import dev.mars.foreststate.ForestStateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the session store used by {@link dev.mars.foreststate.ForestState}.
 */
public final class DialogueSessionStores {

    private static final Logger LOG = LoggerFactory.getLogger(DialogueSessionStores.class);

    private DialogueSessionStores() {
    }

    /**
     * Opens the SQLite store at {@link ForestStateConfig#sessionDbPath()}, wrapped so that
     * runtime failures fall back to memory. If the database cannot be opened at all, the
     * returned store is in-memory only and {@link DialogueSessionStore#durable()} is false.
     */
    public static DialogueSessionStore open(ForestStateConfig config) {
        try {
            return new FailoverDialogueSessionStore(
                    SqliteDialogueSessionStore.open(config.sessionDbPath()),
                    new InMemoryDialogueSessionStore());
        } catch (SessionStoreException e) {
            LOG.warn("Session database unavailable ({}); dialogue sessions will be kept in memory only",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return new InMemoryDialogueSessionStore();
        }
    }
}
