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

import com.kvtable.codec.InvalidTimeException;
import com.kvtable.codec.RowChecksum;
import com.kvtable.codec.RowDecoder;
import com.kvtable.codec.RowFormat;
import com.kvtable.codec.TableRowEncoder;
import com.kvtable.common.KvTableException;
import com.kvtable.errctx.ErrorContext;
import com.kvtable.errctx.ErrorGroup;
import com.kvtable.errctx.ErrorLevel;
import com.kvtable.internal.ByteSlice;
import com.kvtable.internal.ReusableSlice;
import com.kvtable.kv.IntHandle;
import com.kvtable.kv.KeyFlag;
import com.kvtable.kv.KvStoreException;
import com.kvtable.types.ColumnValue;
import com.kvtable.types.Datum;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EncodeRowBufferTest {
    private static final ZoneId UTC = ZoneOffset.UTC;
    private static final byte[] KEY = "record-key".getBytes(StandardCharsets.UTF_8);
    private static final IntHandle HANDLE = new IntHandle(42);

    private final CapturingRowEncoder encoder = new CapturingRowEncoder();
    private final RecordingMemBuffer memBuffer = new RecordingMemBuffer();
    private final ErrorContext errorContext = new ErrorContext();
    private WriteStatementBuffers statementBuffers;
    private MutationBufferPool pool;

    private static byte[] expectedV2(List<ColumnValue> row) {
        ReusableSlice<Datum> interleaved = ReusableSlice.ensureCapacityAndReset(null, row.size() * 2);
        return new TableRowEncoder(RowFormat.V2).encode(UTC, row, null, interleaved, null).toByteArray();
    }

    @BeforeEach
    void setUp() {
        statementBuffers = new WriteStatementBuffers();
        pool = new MutationBufferPool(statementBuffers);
    }

    private RowEncodingConfig config(boolean checksum) {
        return new RowEncodingConfig(checksum, encoder);
    }

    private boolean write(EncodeRowBuffer buffer, KeyFlag... flags) {
        return buffer.writeMemBufferEncoded(config(false), UTC, errorContext, statementBuffers, memBuffer, KEY, HANDLE, flags);
    }

    @Test
    void test_writeMemBufferEncoded_without_flags_uses_set() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(3)) {
            buffer.addColVal(1, Datum.ofString("a"));
            buffer.addColVal(2, Datum.ofString("b"));
            assertTrue(write(buffer));
        }

        RecordingMemBuffer.Call call = memBuffer.lastCall();
        assertEquals("set", call.method());
        assertArrayEquals(KEY, call.key());
        byte[] expected = expectedV2(List.of(
                new ColumnValue(1, Datum.ofString("a")),
                new ColumnValue(2, Datum.ofString("b"))));
        assertArrayEquals(expected, call.value());
    }

    @Test
    void test_writeMemBufferEncoded_with_flag_uses_setWithFlags() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(2)) {
            buffer.addColVal(5, Datum.ofLong(10));
            assertTrue(write(buffer, KeyFlag.PRESUME_KEY_NOT_EXISTS));
        }

        RecordingMemBuffer.Call call = memBuffer.lastCall();
        assertEquals("setWithFlags", call.method());
        assertEquals(List.of(KeyFlag.PRESUME_KEY_NOT_EXISTS), call.flags());
        assertArrayEquals(expectedV2(List.of(new ColumnValue(5, Datum.ofLong(10)))), call.value());
    }

    @Test
    void test_encoder_receives_pairs_in_insertion_order() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(9, Datum.ofLong(1));
            buffer.addColVal(3, Datum.ofLong(2));
            buffer.addColVal(7, Datum.ofString("x"));
            write(buffer);
        }

        assertEquals(List.of(
                new ColumnValue(9, Datum.ofLong(1)),
                new ColumnValue(3, Datum.ofLong(2)),
                new ColumnValue(7, Datum.ofString("x"))
        ), encoder.lastRow);
    }

    @Test
    void test_duplicate_column_ids_are_kept() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(2)) {
            buffer.addColVal(1, Datum.ofLong(1));
            buffer.addColVal(1, Datum.ofLong(2));
            assertEquals(2, buffer.row().size());
            write(buffer);
        }
        assertEquals(2, encoder.lastRow.size());
        assertEquals(1, encoder.lastRow.get(1).columnId());
    }

    @Test
    void test_reset_isolates_rows() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(4)) {
            buffer.addColVal(1, Datum.ofLong(1));
            buffer.addColVal(2, Datum.ofLong(2));
            buffer.addColVal(3, Datum.ofLong(3));
            write(buffer);
        }
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(4)) {
            buffer.addColVal(4, Datum.ofLong(4));
            write(buffer);
        }

        assertEquals(List.of(new ColumnValue(4, Datum.ofLong(4))), encoder.lastRow);
        assertArrayEquals(expectedV2(List.of(new ColumnValue(4, Datum.ofLong(4)))), memBuffer.lastCall().value());
    }

    @Test
    void test_interleaved_scratch_is_resized_to_twice_the_row_length() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(3)) {
            buffer.addColVal(1, Datum.ofLong(1));
            buffer.addColVal(2, Datum.ofLong(2));
            buffer.addColVal(3, Datum.ofLong(3));
            write(buffer);
        }
        assertEquals(6, statementBuffers.getAddRowValues().length());
        assertEquals(6, encoder.lastInterleavedLength);
        int capacity = statementBuffers.getAddRowValues().capacity();

        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(3)) {
            buffer.addColVal(1, Datum.ofLong(1));
            write(buffer);
        }
        assertEquals(2, statementBuffers.getAddRowValues().length());
        assertEquals(capacity, statementBuffers.getAddRowValues().capacity());
    }

    @Test
    void test_encoded_value_buffer_is_kept_for_the_next_row() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofString("first row"));
            write(buffer);
        }
        ByteSlice afterFirst = statementBuffers.getRowValueBuffer();

        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofString("x"));
            write(buffer);
        }
        assertSame(afterFirst, encoder.lastValueBuffer);
        assertSame(afterFirst, statementBuffers.getRowValueBuffer());
    }

    @Test
    void test_checksum_is_bound_to_handle_when_enabled() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofLong(7));
            buffer.writeMemBufferEncoded(config(true), UTC, errorContext, statementBuffers, memBuffer, KEY, HANDLE);
        }
        assertEquals(new RowChecksum(HANDLE), encoder.lastChecksum);
        assertTrue(RowDecoder.verifyChecksum(memBuffer.lastCall().value(), HANDLE));
        assertFalse(RowDecoder.verifyChecksum(memBuffer.lastCall().value(), new IntHandle(43)));
    }

    @Test
    void test_no_checksum_when_disabled() {
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofLong(7));
            write(buffer);
        }
        assertNull(encoder.lastChecksum);
        assertFalse(RowDecoder.hasChecksum(memBuffer.lastCall().value()));
    }

    @Test
    void test_encoding_error_is_propagated_at_error_level() {
        encoder.failure = new InvalidTimeException(LocalDateTime.of(2024, 3, 10, 2, 30), ZoneId.of("America/New_York"));
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofLong(1));
            KvTableException e = assertThrows(KvTableException.class, () -> write(buffer));
            assertSame(encoder.failure, e);
        }
        assertTrue(memBuffer.calls.isEmpty());
    }

    @Test
    void test_suppressed_encoding_error_skips_the_write() {
        ErrorContext lenient = new ErrorContext(Map.of(ErrorGroup.TIME_CONVERSION, ErrorLevel.WARN));
        encoder.failure = new InvalidTimeException(LocalDateTime.of(2024, 3, 10, 2, 30), ZoneId.of("America/New_York"));
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofLong(1));
            boolean written = buffer.writeMemBufferEncoded(config(false), UTC, lenient, statementBuffers, memBuffer, KEY, HANDLE);
            assertFalse(written);
        }
        assertTrue(memBuffer.calls.isEmpty());
        assertEquals(1, lenient.warnings().size());
    }

    @Test
    void test_store_error_is_propagated_verbatim() {
        KvStoreException failure = new KvStoreException("value is too large");
        memBuffer.failWith(failure);
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofLong(1));
            KvStoreException e = assertThrows(KvStoreException.class, () -> write(buffer));
            assertSame(failure, e);
        }
    }

    @Test
    void test_encodeForReplicationLog_is_not_aliased() {
        byte[] first;
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(2)) {
            buffer.addColVal(1, Datum.ofString("a"));
            buffer.addColVal(2, Datum.ofLong(2));
            first = buffer.encodeForReplicationLog(UTC, errorContext);
        }
        assertNotNull(first);
        byte[] copy = first.clone();
        List<ColumnValue> decoded = RowDecoder.decode(first, UTC);
        assertEquals(List.of(new ColumnValue(1, Datum.ofString("a")), new ColumnValue(2, Datum.ofLong(2))), decoded);

        Arrays.fill(first, (byte) 0x7F);

        byte[] second;
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(2)) {
            buffer.addColVal(1, Datum.ofString("a"));
            buffer.addColVal(2, Datum.ofLong(2));
            assertEquals(List.of(new ColumnValue(1, Datum.ofString("a")), new ColumnValue(2, Datum.ofLong(2))), buffer.row());
            second = buffer.encodeForReplicationLog(UTC, errorContext);
        }
        assertArrayEquals(copy, second);
        assertNotSame(first, second);
    }

    @Test
    void test_encodeForReplicationLog_returns_null_when_suppressed() {
        ErrorContext ignoring = new ErrorContext(Map.of(ErrorGroup.TIME_CONVERSION, ErrorLevel.IGNORE));
        ZoneId newYork = ZoneId.of("America/New_York");
        try (EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1)) {
            buffer.addColVal(1, Datum.ofTimestamp(LocalDateTime.of(2024, 3, 10, 2, 30)));
            assertNull(buffer.encodeForReplicationLog(newYork, ignoring));
            assertThrows(InvalidTimeException.class, () -> buffer.encodeForReplicationLog(newYork, errorContext));
        }
        assertTrue(ignoring.warnings().isEmpty());
    }

    @Test
    void test_operations_require_a_lease() {
        EncodeRowBuffer buffer = pool.getEncodeRowBufferWithCap(1);
        buffer.close();
        assertThrows(IllegalStateException.class, () -> buffer.addColVal(1, Datum.ofLong(1)));
        assertThrows(IllegalStateException.class, () -> write(buffer));
        assertThrows(IllegalStateException.class, () -> buffer.encodeForReplicationLog(UTC, errorContext));
    }
}
