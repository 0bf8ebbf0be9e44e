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

import com.kvtable.codec.RowChecksum;
import com.kvtable.codec.RowEncoder;
import com.kvtable.codec.RowEncodingException;
import com.kvtable.codec.RowFormat;
import com.kvtable.codec.TableRowEncoder;
import com.kvtable.common.KvTableException;
import com.kvtable.errctx.ErrorContext;
import com.kvtable.internal.ByteSlice;
import com.kvtable.internal.ReusableSlice;
import com.kvtable.kv.Handle;
import com.kvtable.kv.KeyFlag;
import com.kvtable.kv.MemBuffer;
import com.kvtable.types.ColumnValue;
import com.kvtable.types.Datum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.ZoneId;
import java.util.List;

/**
 * EncodeRowBuffer stages the column id/value pairs of one row and encodes them into a record
 * value.
 *
 * <p>Obtained from {@link MutationBufferPool#getEncodeRowBufferWithCap(int)}:</p>
 * <pre>{@code
 * try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(columns.size())) {
 *     for (...) {
 *         buffer.addColVal(columnId, value);
 *     }
 *     buffer.writeMemBufferEncoded(cfg, zone, ec, pool.getWriteStatementBuffers(), memBuffer, key, handle);
 * }
 * }</pre>
 */
public class EncodeRowBuffer extends PooledBuffer {
    private static final Logger LOGGER = LoggerFactory.getLogger(EncodeRowBuffer.class);
    private static final RowEncoder LEGACY_ENCODER = new TableRowEncoder(RowFormat.LEGACY);

    private ReusableSlice<ColumnValue> row;

    EncodeRowBuffer() {
    }

    /**
     * Empties the staged row, keeping at least {@code capacity} slots.
     */
    public void reset(int capacity) {
        checkLeased();
        row = ReusableSlice.ensureCapacityAndReset(row, 0, capacity);
    }

    /**
     * Appends a column value. Duplicate column ids are not rejected.
     */
    public void addColVal(long columnId, @Nonnull Datum value) {
        checkLeased();
        row.append(new ColumnValue(columnId, value));
    }

    /**
     * Returns a read-only view of the staged pairs, valid until the next reset.
     */
    public List<ColumnValue> row() {
        checkLeased();
        return row.asList();
    }

    public int capacity() {
        return row == null ? 0 : row.capacity();
    }

    /**
     * Encodes the staged row and writes it to {@code memBuffer} under {@code key}.
     *
     * <p>An encoding failure goes through {@code errorContext}: a returned error is thrown, a
     * suppressed one skips the write. Errors raised by the mem buffer are not intercepted.</p>
     *
     * @param cfg              encoding settings
     * @param zone             session time zone
     * @param errorContext     decides the fate of encoding errors
     * @param statementBuffers the session's scratch buffers
     * @param memBuffer        destination of the record
     * @param key              record key
     * @param handle           row identity, bound into the checksum
     * @param flags            flags attached to the key, if any
     * @return true if the record was written, false if an encoding error was suppressed
     */
    public boolean writeMemBufferEncoded(@Nonnull RowEncodingConfig cfg,
                                         @Nonnull ZoneId zone,
                                         @Nonnull ErrorContext errorContext,
                                         @Nonnull WriteStatementBuffers statementBuffers,
                                         @Nonnull MemBuffer memBuffer,
                                         @Nonnull byte[] key,
                                         @Nonnull Handle handle,
                                         KeyFlag... flags) {
        checkLeased();
        RowChecksum checksum = null;
        if (cfg.rowLevelChecksumEnabled()) {
            checksum = new RowChecksum(handle);
        }

        // The legacy layout interleaves ids and values, so the scratch must hold exactly
        // 2 * row length datums. Rows skip null columns, the length changes from row to row.
        statementBuffers.setAddRowValues(
                ReusableSlice.ensureCapacityAndReset(statementBuffers.getAddRowValues(), row.length() * 2));

        ByteSlice encoded;
        try {
            encoded = cfg.rowEncoder().encode(
                    zone, row.asList(), statementBuffers.getRowValueBuffer(), statementBuffers.getAddRowValues(), checksum);
        } catch (RowEncodingException e) {
            KvTableException handled = errorContext.handleError(e);
            if (handled != null) {
                throw handled;
            }
            LOGGER.debug("Skipped writing row {}: {}", handle, e.getMessage());
            return false;
        }
        statementBuffers.setRowValueBuffer(encoded);

        if (flags.length == 0) {
            memBuffer.set(key, encoded);
        } else {
            memBuffer.setWithFlags(key, encoded, flags);
        }
        return true;
    }

    /**
     * Encodes the staged row in the legacy layout for the replication log. The result does not
     * share memory with the pool, callers may keep and modify it.
     *
     * @return the encoded row, or null if an encoding error was suppressed
     */
    @Nullable
    public byte[] encodeForReplicationLog(@Nonnull ZoneId zone, @Nonnull ErrorContext errorContext) {
        checkLeased();
        try {
            return LEGACY_ENCODER.encodeLegacy(zone, row.asList());
        } catch (RowEncodingException e) {
            KvTableException handled = errorContext.handleError(e);
            if (handled != null) {
                throw handled;
            }
            return null;
        }
    }
}
