/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.kvtable.table.tblctx;

/**
 * Lease state shared by the buffers of {@link MutationBufferPool}. A buffer is leased between
 * the pool handing it out and {@link #close()}.
 */
abstract class PooledBuffer implements AutoCloseable {
    private boolean leased;

    void acquire() {
        if (leased) {
            throw new BufferInUseException(getClass().getSimpleName());
        }
        leased = true;
    }

    void checkLeased() {
        if (!leased) {
            throw new IllegalStateException(getClass().getSimpleName() + " is not leased from its pool");
        }
    }

    public boolean isLeased() {
        return leased;
    }

    /**
     * Ends the current use cycle and returns the buffer to its pool. Idempotent.
     */
    @Override
    public void close() {
        leased = false;
    }
}
