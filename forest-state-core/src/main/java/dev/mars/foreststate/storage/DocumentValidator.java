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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Check applied to a document before it is written.
 * <p>
 * Validators are registered per file name with {@link AtomicFileStore#registerValidator}.
 * A rejection raises {@link ValidationException} before any I/O happens.
 */
@FunctionalInterface
public interface DocumentValidator {

    /**
     * @param key      destination of the write
     * @param document value about to be written
     * @throws ValidationException if the document must not be stored
     */
    void validate(StorageKey key, JsonNode document);

    /**
     * Requires the document to be a JSON object containing the given fields.
     * Task trees ({@code hta.json}) are registered with this by default.
     */
    static DocumentValidator objectWithFields(String... requiredFields) {
        return (key, document) -> {
            if (document == null || !document.isObject()) {
                throw new ValidationException(key + " must be a JSON object");
            }
            for (String field : requiredFields) {
                if (!document.has(field)) {
                    throw new ValidationException(key + " is missing required field '" + field + "'");
                }
            }
        };
    }
}
