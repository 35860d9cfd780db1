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

/**
 * A key whose pre-transaction value could not be restored, or whose restored
 * value did not match the snapshot. Requires out-of-band repair.
 *
 * @param transactionId transaction that was being rolled back
 * @param key           affected document
 * @param step          rollback step that went wrong
 * @param detail        what happened
 */
public record IntegrityWarning(String transactionId, StorageKey key, Step step, String detail) {

    public enum Step {
        /** Writing the previous value back failed. */
        RESTORE,
        /** Removing a document that did not exist before failed. */
        REMOVE,
        /** The value read after the restore differs from the snapshot. */
        VERIFY
    }

    @Override
    public String toString() {
        return "IntegrityWarning[" + transactionId + " " + step + " " + key + ": " + detail + "]";
    }
}
