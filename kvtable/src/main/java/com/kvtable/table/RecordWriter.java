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

package com.kvtable.table;

import com.kvtable.kv.Handle;
import com.kvtable.kv.KeyFlag;
import com.kvtable.kv.MemBuffer;
import com.kvtable.table.tblctx.CheckRowBuffer;
import com.kvtable.table.tblctx.EncodeRowBuffer;
import com.kvtable.table.tblctx.MutationBufferPool;
import com.kvtable.table.tblctx.MutationContext;
import com.kvtable.table.tblctx.ReplicationLog;
import com.kvtable.types.Datum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * RecordWriter performs the record mutations of a single table. Every call borrows the buffers
 * of the session's {@link MutationBufferPool} and returns them before it completes.
 *
 * <p>Values are given in column order. NULL values are checked against the table's constraints
 * but are not stored in the record.</p>
 */
public class RecordWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordWriter.class);

    private final TableInfo table;
    private final RecordKeys recordKeys;
    private final ConstraintChecker constraintChecker;

    public RecordWriter(@Nonnull TableInfo table) {
        this(table, new NotNullConstraintChecker(table));
    }

    public RecordWriter(@Nonnull TableInfo table, @Nonnull ConstraintChecker constraintChecker) {
        this.table = Objects.requireNonNull(table, "table");
        this.constraintChecker = Objects.requireNonNull(constraintChecker, "constraintChecker");
        this.recordKeys = new RecordKeys(table.id());
    }

    public RecordKeys getRecordKeys() {
        return recordKeys;
    }

    /**
     * Inserts a new record. The key is flagged with {@link KeyFlag#PRESUME_KEY_NOT_EXISTS}.
     *
     * @return true if the record was written, false if an encoding error was suppressed
     * @throws ConstraintViolationException if the row violates a constraint
     */
    public boolean addRecord(MutationContext ctx, MemBuffer memBuffer, Handle handle, List<Datum> values) {
        checkRowLength(values);
        checkConstraints(ctx, values);
        return writeRecord(ctx, memBuffer, handle, values, ReplicationLog.Operation.INSERT, KeyFlag.PRESUME_KEY_NOT_EXISTS);
    }

    /**
     * Overwrites the record of {@code handle} with the new values.
     *
     * @return true if the record was written, false if an encoding error was suppressed
     * @throws ConstraintViolationException if the row violates a constraint
     */
    public boolean updateRecord(MutationContext ctx, MemBuffer memBuffer, Handle handle, List<Datum> values) {
        checkRowLength(values);
        checkConstraints(ctx, values);
        return writeRecord(ctx, memBuffer, handle, values, ReplicationLog.Operation.UPDATE);
    }

    /**
     * Deletes the record of {@code handle}. The old values are only used for the replication log
     * and are encoded before the delete is staged, so an encoding failure leaves the mem buffer
     * untouched.
     */
    public void removeRecord(MutationContext ctx, MemBuffer memBuffer, Handle handle, List<Datum> oldValues) {
        checkRowLength(oldValues);
        byte[] key = recordKeys.recordKey(handle);
        ReplicationLog replicationLog = ctx.getReplicationLog();
        if (replicationLog == null) {
            memBuffer.delete(key);
            return;
        }

        byte[] row;
        MutationBufferPool pool = ctx.getBufferPool();
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(oldValues.size())) {
            for (int i = 0; i < oldValues.size(); i++) {
                buffer.addColVal(table.columns().get(i).id(), oldValues.get(i));
            }
            row = buffer.encodeForReplicationLog(ctx.getZone(), ctx.getErrorContext());
        }
        memBuffer.delete(key);
        if (row != null) {
            replicationLog.append(table.id(), handle, ReplicationLog.Operation.DELETE, row);
        }
    }

    private void checkRowLength(List<Datum> values) {
        if (values.size() != table.columnCount()) {
            throw new IllegalArgumentException(String.format(
                    "Table '%s' has %d columns, got %d values", table.name(), table.columnCount(), values.size()));
        }
    }

    private void checkConstraints(MutationContext ctx, List<Datum> values) {
        try (CheckRowBuffer buffer = ctx.getBufferPool().getCheckRowBufferWithCap(values.size())) {
            for (Datum value : values) {
                buffer.addColVal(value);
            }
            constraintChecker.check(buffer.getRowToCheck());
        }
    }

    private boolean writeRecord(MutationContext ctx,
                                MemBuffer memBuffer,
                                Handle handle,
                                List<Datum> values,
                                ReplicationLog.Operation operation,
                                KeyFlag... flags) {
        MutationBufferPool pool = ctx.getBufferPool();
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(values.size())) {
            for (int i = 0; i < values.size(); i++) {
                Datum value = values.get(i);
                if (value.isNull()) {
                    continue;
                }
                buffer.addColVal(table.columns().get(i).id(), value);
            }

            boolean written = buffer.writeMemBufferEncoded(
                    ctx.getRowEncodingConfig(),
                    ctx.getZone(),
                    ctx.getErrorContext(),
                    pool.getWriteStatementBuffers(),
                    memBuffer,
                    recordKeys.recordKey(handle),
                    handle,
                    flags
            );
            if (!written) {
                LOGGER.debug("Record {} of table '{}' was not written", handle, table.name());
                return false;
            }
            if (ctx.isReplicationLogEnabled()) {
                appendToReplicationLog(ctx, buffer, handle, operation);
            }
            return true;
        }
    }

    private void appendToReplicationLog(MutationContext ctx, EncodeRowBuffer buffer, Handle handle, ReplicationLog.Operation operation) {
        byte[] row = buffer.encodeForReplicationLog(ctx.getZone(), ctx.getErrorContext());
        if (row == null) {
            return;
        }
        ReplicationLog replicationLog = ctx.getReplicationLog();
        if (replicationLog != null) {
            replicationLog.append(table.id(), handle, operation, row);
        }
    }
}
