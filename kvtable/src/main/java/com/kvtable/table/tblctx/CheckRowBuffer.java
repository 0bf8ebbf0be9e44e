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

import com.kvtable.internal.ReusableSlice;
import com.kvtable.types.Datum;
import com.kvtable.types.RowView;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * CheckRowBuffer stages the values of one row for constraint checking.
 */
public class CheckRowBuffer extends PooledBuffer {
    private ReusableSlice<Datum> rowToCheck;

    CheckRowBuffer() {
    }

    public void reset(int capacity) {
        checkLeased();
        rowToCheck = ReusableSlice.ensureCapacityAndReset(rowToCheck, 0, capacity);
    }

    public void addColVal(@Nonnull Datum value) {
        checkLeased();
        rowToCheck.append(Objects.requireNonNull(value, "value"));
    }

    /**
     * Returns the values added since the last reset, in order. The view is a snapshot and stays
     * valid after the buffer is reused.
     */
    public RowView getRowToCheck() {
        checkLeased();
        return RowView.copyOf(rowToCheck.asList());
    }

    public int capacity() {
        return rowToCheck == null ? 0 : rowToCheck.capacity();
    }
}
