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

import com.kvtable.internal.ByteSlice;
import com.kvtable.internal.ReusableSlice;
import com.kvtable.types.Datum;

/**
 * Per-session scratch memory consumed by the row encoder. Owned by the session, borrowed by
 * {@link MutationBufferPool} and {@link EncodeRowBuffer}.
 */
public class WriteStatementBuffers {
    // Encoded row bytes, reused by the next row.
    private ByteSlice rowValueBuffer;

    // Interleaved id/value datums of the legacy layout, 2 * row length.
    private ReusableSlice<Datum> addRowValues;

    public WriteStatementBuffers() {
        this(0);
    }

    public WriteStatementBuffers(int rowValueBufferSize) {
        this.rowValueBuffer = ByteSlice.ensureCapacityAndReset(null, 0, rowValueBufferSize);
        this.addRowValues = ReusableSlice.ensureCapacityAndReset(null, 0);
    }

    public ByteSlice getRowValueBuffer() {
        return rowValueBuffer;
    }

    public void setRowValueBuffer(ByteSlice rowValueBuffer) {
        this.rowValueBuffer = rowValueBuffer;
    }

    public ReusableSlice<Datum> getAddRowValues() {
        return addRowValues;
    }

    public void setAddRowValues(ReusableSlice<Datum> addRowValues) {
        this.addRowValues = addRowValues;
    }
}
