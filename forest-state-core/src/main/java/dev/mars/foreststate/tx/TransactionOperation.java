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
package dev.mars.foreststate.tx;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.foreststate.storage.Identifiers;
import dev.mars.foreststate.storage.StorageKey;
import dev.mars.foreststate.storage.ValidationException;

import java.util.Objects;

/**
 * One step of a transaction: replace or remove a document of the project.
 *
 * @param kind         write or delete
 * @param relativePath target inside the project
 * @param value        new document for {@link Kind#WRITE}, null for {@link Kind#DELETE}
 */
public record TransactionOperation(Kind kind, String relativePath, JsonNode value) {

    public enum Kind {
        WRITE,
        DELETE
    }

    public TransactionOperation {
        Objects.requireNonNull(kind, "kind");
        Identifiers.requireRelativePath(relativePath);
        if (kind == Kind.WRITE && value == null) {
            throw new ValidationException("Write of " + relativePath + " needs a value");
        }
        if (kind == Kind.DELETE && value != null) {
            throw new ValidationException("Delete of " + relativePath + " must not carry a value");
        }
    }

    public static TransactionOperation write(String relativePath, JsonNode value) {
        return new TransactionOperation(Kind.WRITE, relativePath, value);
    }

    public static TransactionOperation delete(String relativePath) {
        return new TransactionOperation(Kind.DELETE, relativePath, null);
    }

    /** Resolves the target against a project. */
    public StorageKey keyIn(String projectId) {
        return StorageKey.of(projectId, relativePath);
    }
}
