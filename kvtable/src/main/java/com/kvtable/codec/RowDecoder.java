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

import com.apple.foundationdb.tuple.Tuple;
import com.kvtable.common.utils.ByteUtils;
import com.kvtable.kv.Handle;
import com.kvtable.types.ColumnValue;
import com.kvtable.types.Datum;
import com.kvtable.types.DatumKind;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads rows written by {@link TableRowEncoder}, in either layout.
 */
public final class RowDecoder {

    private RowDecoder() {
    }

    public static boolean isV2(byte[] data) {
        return data.length > 0 && (data[0] & 0xFF) == TableRowEncoder.CODEC_VERSION;
    }

    public static boolean hasChecksum(byte[] data) {
        return isV2(data) && data.length >= TableRowEncoder.HEADER_SIZE && (data[1] & TableRowEncoder.FLAG_CHECKSUM) != 0;
    }

    /**
     * Recomputes the checksum of a V2 row for the given handle.
     *
     * @return true if the row carries a checksum and it matches
     */
    public static boolean verifyChecksum(byte[] data, Handle handle) {
        if (!hasChecksum(data) || data.length < TableRowEncoder.HEADER_SIZE + 4) {
            return false;
        }
        int end = data.length - 4;
        int expected = ByteUtils.getInt(data, end);
        return new RowChecksum(handle).compute(data, 0, end) == expected;
    }

    /**
     * Decodes a row into its column id/value pairs. V2 rows list not-null columns first, then
     * the null ones; legacy rows keep the staged order.
     *
     * @throws IllegalArgumentException if the data is malformed
     */
    public static List<ColumnValue> decode(byte[] data, ZoneId zone) {
        if (isV2(data)) {
            return decodeV2(data, zone);
        }
        return decodeLegacy(data, zone);
    }

    private static List<ColumnValue> decodeV2(byte[] data, ZoneId zone) {
        if (data.length < TableRowEncoder.HEADER_SIZE) {
            throw new IllegalArgumentException("Malformed row: truncated header");
        }
        int end = hasChecksum(data) ? data.length - 4 : data.length;
        int notNull = ByteUtils.getUnsignedShort(data, 2);
        int nulls = ByteUtils.getUnsignedShort(data, 4);

        int idsPosition = TableRowEncoder.HEADER_SIZE;
        int offsetsPosition = idsPosition + (notNull + nulls) * 8;
        int dataStart = offsetsPosition + notNull * 4;
        if (dataStart > end) {
            throw new IllegalArgumentException("Malformed row: truncated column index");
        }

        List<ColumnValue> row = new ArrayList<>(notNull + nulls);
        int valueStart = dataStart;
        for (int i = 0; i < notNull; i++) {
            long columnId = ByteUtils.getLong(data, idsPosition + i * 8);
            int valueEnd = dataStart + ByteUtils.getInt(data, offsetsPosition + i * 4);
            if (valueEnd <= valueStart || valueEnd > end) {
                throw new IllegalArgumentException("Malformed row: bad offset for column " + columnId);
            }
            row.add(new ColumnValue(columnId, readValue(data, valueStart, valueEnd, zone)));
            valueStart = valueEnd;
        }
        for (int i = 0; i < nulls; i++) {
            long columnId = ByteUtils.getLong(data, idsPosition + (notNull + i) * 8);
            row.add(new ColumnValue(columnId, Datum.ofNull()));
        }
        return row;
    }

    private static Datum readValue(byte[] data, int start, int end, ZoneId zone) {
        DatumKind kind = DatumKind.fromCode(data[start]);
        int payload = start + 1;
        return switch (kind) {
            case INT64 -> Datum.ofLong(ByteUtils.getLong(data, payload));
            case FLOAT64 -> Datum.ofDouble(Double.longBitsToDouble(ByteUtils.getLong(data, payload)));
            case DECIMAL -> Datum.ofDecimal(new BigDecimal(new String(data, payload, end - payload, StandardCharsets.US_ASCII)));
            case STRING -> Datum.ofString(new String(data, payload, end - payload, StandardCharsets.UTF_8));
            case BYTES -> Datum.ofBytes(Arrays.copyOfRange(data, payload, end));
            case TIMESTAMP -> Datum.ofTimestamp(fromEpochMicros(ByteUtils.getLong(data, payload), zone));
            case NULL -> throw new IllegalArgumentException("Malformed row: NULL stored as a value");
        };
    }

    private static List<ColumnValue> decodeLegacy(byte[] data, ZoneId zone) {
        Tuple tuple = Tuple.fromBytes(data);
        if (tuple.size() % 2 != 0) {
            throw new IllegalArgumentException("Malformed row: odd number of legacy elements");
        }
        List<ColumnValue> row = new ArrayList<>(tuple.size() / 2);
        for (int i = 0; i < tuple.size(); i += 2) {
            long columnId = tuple.getLong(i);
            row.add(new ColumnValue(columnId, fromTupleElement(tuple.get(i + 1), zone)));
        }
        return row;
    }

    private static Datum fromTupleElement(Object element, ZoneId zone) {
        if (element == null) {
            return Datum.ofNull();
        }
        if (element instanceof Long value) {
            return Datum.ofLong(value);
        }
        if (element instanceof Double value) {
            return Datum.ofDouble(value);
        }
        if (element instanceof String value) {
            return Datum.ofString(value);
        }
        if (element instanceof byte[] value) {
            return Datum.ofBytes(value);
        }
        if (element instanceof Tuple nested && nested.size() == 2) {
            DatumKind kind = DatumKind.fromCode((int) nested.getLong(0));
            if (kind == DatumKind.DECIMAL) {
                return Datum.ofDecimal(new BigDecimal(nested.getString(1)));
            }
            if (kind == DatumKind.TIMESTAMP) {
                return Datum.ofTimestamp(fromEpochMicros(nested.getLong(1), zone));
            }
        }
        throw new IllegalArgumentException("Malformed row: unexpected legacy element " + element);
    }

    private static LocalDateTime fromEpochMicros(long micros, ZoneId zone) {
        Instant instant = Instant.ofEpochSecond(Math.floorDiv(micros, 1_000_000L), Math.floorMod(micros, 1_000_000L) * 1_000L);
        return LocalDateTime.ofInstant(instant, zone);
    }
}
