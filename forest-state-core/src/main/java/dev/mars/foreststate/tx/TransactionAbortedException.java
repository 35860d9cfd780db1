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

import dev.mars.foreststate.storage.DurabilityException;

/**
 * A transaction failed and was rolled back.
 * <p>
 * The cause is the failure that aborted the transaction. {@link #result()} reports
 * zero committed operations and any integrity warnings raised by the rollback.
 */
public class TransactionAbortedException extends DurabilityException {

    private final transient TransactionResult result;

    public TransactionAbortedException(String message, Throwable cause, TransactionResult result) {
        super(message, cause);
        this.result = result;
    }

    public TransactionResult result() {
        return result;
    }
}
