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

import dev.mars.foreststate.storage.StorageKey;

import java.util.List;

/**
 * Outcome of {@link TransactionCoordinator#transact}.
 *
 * @param committed         operations durably committed; 0 unless every operation succeeded
 * @param attempted         operations applied before the first failure, including the failed one
 * @param rolledBack        keys restored to their pre-transaction value, in restore order
 * @param integrityWarnings rollback steps that failed
 */
public record TransactionResult(int committed, int attempted, List<StorageKey> rolledBack,
                                List<IntegrityWarning> integrityWarnings) {

    public TransactionResult {
        rolledBack = List.copyOf(rolledBack);
        integrityWarnings = List.copyOf(integrityWarnings);
    }

    static TransactionResult committed(int count) {
        return new TransactionResult(count, count, List.of(), List.of());
    }

    static TransactionResult aborted(int attempted, List<StorageKey> rolledBack, List<IntegrityWarning> warnings) {
        return new TransactionResult(0, attempted, rolledBack, warnings);
    }

    /** True when the rollback left every touched key exactly as it was. */
    public boolean clean() {
        return integrityWarnings.isEmpty();
    }
}
