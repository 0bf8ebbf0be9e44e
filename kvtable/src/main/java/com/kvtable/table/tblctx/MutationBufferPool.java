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

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * MutationBufferPool holds the memory that table mutations (add, update and remove record)
 * reuse from row to row.
 *
 * <p><b>Lease discipline:</b></p>
 * <p>There is one {@link EncodeRowBuffer} and one {@link CheckRowBuffer} per pool. A getter hands
 * out the buffer as a lease that lasts until {@link PooledBuffer#close()}. Requesting a buffer
 * whose lease is still open fails with {@link BufferInUseException} instead of overwriting the
 * row in flight.</p>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>A pool belongs to a single session and must not be shared across threads.</p>
 */
public class MutationBufferPool {
    private final WriteStatementBuffers statementBuffers;
    private final EncodeRowBuffer encodeRow = new EncodeRowBuffer();
    private final CheckRowBuffer checkRow = new CheckRowBuffer();

    /**
     * @param statementBuffers the session's scratch buffers, borrowed for the pool's lifetime
     */
    public MutationBufferPool(@Nonnull WriteStatementBuffers statementBuffers) {
        this.statementBuffers = Objects.requireNonNull(statementBuffers, "statementBuffers");
    }

    private static void checkCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be non-negative: " + capacity);
        }
    }

    /**
     * Leases the encode buffer, emptied and sized for {@code capacity} columns.
     *
     * @throws BufferInUseException if the previous lease was not closed
     */
    public EncodeRowBuffer getEncodeRowBufferWithCap(int capacity) {
        checkCapacity(capacity);
        encodeRow.acquire();
        encodeRow.reset(capacity);
        return encodeRow;
    }

    /**
     * Leases the check buffer, emptied and sized for {@code capacity} columns.
     *
     * @throws BufferInUseException if the previous lease was not closed
     */
    public CheckRowBuffer getCheckRowBufferWithCap(int capacity) {
        checkCapacity(capacity);
        checkRow.acquire();
        checkRow.reset(capacity);
        return checkRow;
    }

    public WriteStatementBuffers getWriteStatementBuffers() {
        return statementBuffers;
    }
}
