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

package com.kvtable.codec;

import com.kvtable.internal.ByteSlice;
import com.kvtable.internal.ReusableSlice;
import com.kvtable.types.ColumnValue;
import com.kvtable.types.Datum;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.ZoneId;
import java.util.List;

/**
 * Turns a positional row of column id/value pairs into its persisted byte form.
 */
public interface RowEncoder {

    RowFormat format();

    /**
     * Encodes a row for the record key-value pair.
     *
     * @param zone        session time zone used to convert timestamps
     * @param row         column id/value pairs in the order they were staged
     * @param valueBuffer byte scratch to encode into, may be null
     * @param interleaved datum scratch of length {@code 2 * row.size()}, used by the legacy layout
     * @param checksum    row-level checksum to append, or null
     * @return the slice holding the encoded row, either {@code valueBuffer} or a larger replacement
     * @throws RowEncodingException if a value cannot be encoded
     */
    ByteSlice encode(@Nonnull ZoneId zone,
                     @Nonnull List<ColumnValue> row,
                     @Nullable ByteSlice valueBuffer,
                     @Nonnull ReusableSlice<Datum> interleaved,
                     @Nullable RowChecksum checksum);

    /**
     * Encodes a row in the legacy layout into a newly allocated array.
     *
     * @throws RowEncodingException if a value cannot be encoded
     */
    byte[] encodeLegacy(@Nonnull ZoneId zone, @Nonnull List<ColumnValue> row);
}
