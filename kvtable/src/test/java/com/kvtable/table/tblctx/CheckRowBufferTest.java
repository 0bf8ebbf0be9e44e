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

import com.kvtable.types.Datum;
import com.kvtable.types.RowView;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CheckRowBufferTest {
    private final MutationBufferPool pool = new MutationBufferPool(new WriteStatementBuffers());

    @Test
    void test_getRowToCheck_keeps_insertion_order() {
        try (CheckRowBuffer buffer = pool.getCheckRowBufferWithCap(2)) {
            buffer.addColVal(Datum.ofLong(1));
            buffer.addColVal(Datum.ofString("v2"));
            RowView row = buffer.getRowToCheck();
            assertEquals(2, row.size());
            assertEquals(1, row.getLong(0));
            assertEquals("v2", row.getString(1));
        }
    }

    @Test
    void test_getRowToCheck_after_reset_is_empty() {
        try (CheckRowBuffer buffer = pool.getCheckRowBufferWithCap(2)) {
            buffer.addColVal(Datum.ofLong(1));
            buffer.reset(2);
            assertEquals(0, buffer.getRowToCheck().size());
        }
    }

    @Test
    void test_row_view_is_a_snapshot() {
        RowView first;
        try (CheckRowBuffer buffer = pool.getCheckRowBufferWithCap(2)) {
            buffer.addColVal(Datum.ofLong(1));
            buffer.addColVal(Datum.ofNull());
            first = buffer.getRowToCheck();
        }
        try (CheckRowBuffer buffer = pool.getCheckRowBufferWithCap(2)) {
            buffer.addColVal(Datum.ofString("other"));
        }
        assertEquals(List.of(Datum.ofLong(1), Datum.ofNull()), first.toList());
        assertTrue(first.isNull(1));
    }

    @Test
    void test_more_values_than_capacity() {
        try (CheckRowBuffer buffer = pool.getCheckRowBufferWithCap(1)) {
            for (int i = 0; i < 10; i++) {
                buffer.addColVal(Datum.ofLong(i));
            }
            assertEquals(10, buffer.getRowToCheck().size());
            assertTrue(buffer.capacity() >= 10);
        }
    }

    @Test
    void test_operations_require_a_lease() {
        CheckRowBuffer buffer = pool.getCheckRowBufferWithCap(1);
        buffer.close();
        assertThrows(IllegalStateException.class, () -> buffer.addColVal(Datum.ofLong(1)));
        assertThrows(IllegalStateException.class, buffer::getRowToCheck);
        assertThrows(IllegalStateException.class, () -> buffer.reset(1));
    }

    @Test
    void test_null_value_is_rejected() {
        try (CheckRowBuffer buffer = pool.getCheckRowBufferWithCap(1)) {
            assertThrows(NullPointerException.class, () -> buffer.addColVal(null));
        }
    }
}
