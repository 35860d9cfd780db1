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

import java.util.Locale;

/**
 * Lifecycle state of a dialogue session.
 */
public enum DialogueStatus {
    ACTIVE,
    COMPLETED;

    /** Value stored in the {@code status} column. */
    public String columnValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored status, case-insensitively.
     *
     * @throws SessionStoreException if the value is not a known status
     */
    public static DialogueStatus fromColumn(String value) {
        if (value != null) {
            for (DialogueStatus status : values()) {
                if (status.name().equalsIgnoreCase(value.trim())) {
                    return status;
                }
            }
        }
        throw new SessionStoreException("Unknown dialogue status: " + value);
    }
}
