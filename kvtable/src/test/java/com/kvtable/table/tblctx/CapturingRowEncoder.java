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
import com.kvtable.internal.ByteSlice;
import com.kvtable.internal.ReusableSlice;
import com.kvtable.types.ColumnValue;
import com.kvtable.types.Datum;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Delegates to a V2 {@link TableRowEncoder} and keeps a copy of what it was asked to encode.
 */
public class CapturingRowEncoder implements RowEncoder {
    private final RowEncoder delegate = new TableRowEncoder(RowFormat.V2);
    public List<ColumnValue> lastRow;
    public RowChecksum lastChecksum;
    public ByteSlice lastValueBuffer;
    public int lastInterleavedLength;
    public RowEncodingException failure;

    @Override
    public RowFormat format() {
        return delegate.format();
    }

    @Override
    public ByteSlice encode(ZoneId zone, List<ColumnValue> row, ByteSlice valueBuffer, ReusableSlice<Datum> interleaved, RowChecksum checksum) {
        lastRow = new ArrayList<>(row);
        lastChecksum = checksum;
        lastValueBuffer = valueBuffer;
        lastInterleavedLength = interleaved.length();
        if (failure != null) {
            throw failure;
        }
        return delegate.encode(zone, row, valueBuffer, interleaved, checksum);
    }

    @Override
    public byte[] encodeLegacy(ZoneId zone, List<ColumnValue> row) {
        return delegate.encodeLegacy(zone, row);
    }
}
