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
import com.kvtable.internal.ByteSlice;
import com.kvtable.internal.ReusableSlice;
import com.kvtable.types.ColumnValue;
import com.kvtable.types.Datum;
import com.kvtable.types.DatumKind;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default {@link RowEncoder}.
 *
 * <p><b>V2 layout</b></p>
 * <pre>
 * | 0x80 | flags | u16 not-null count | u16 null count |
 * | not-null column ids (i64) | null column ids (i64) |
 * | u32 end offset per not-null value | tagged values | [crc32c] |
 * </pre>
 * Every value starts with its {@link DatumKind} code. Offsets are relative to the first value.
 * The checksum, when present, covers all preceding bytes and the row's handle.
 *
 * <p><b>Legacy layout</b></p>
 * <p>A FoundationDB tuple of interleaved {@code id, value} elements. Decimal and timestamp
 * values are nested {@code (kind code, payload)} tuples.</p>
 */
public class TableRowEncoder implements RowEncoder {
    public static final int CODEC_VERSION = 128;
    public static final byte FLAG_CHECKSUM = 0x02;
    static final int HEADER_SIZE = 6;
    static final int MAX_COLUMNS = 0xFFFF;

    private final RowFormat format;

    public TableRowEncoder(@Nonnull RowFormat format) {
        this.format = Objects.requireNonNull(format, "format");
    }

    static long toEpochMicros(LocalDateTime dateTime, ZoneId zone) {
        List<ZoneOffset> offsets = zone.getRules().getValidOffsets(dateTime);
        if (offsets.isEmpty()) {
            throw new InvalidTimeException(dateTime, zone);
        }
        // Overlaps resolve to the earlier offset.
        Instant instant = dateTime.toInstant(offsets.get(0));
        try {
            return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000);
        } catch (ArithmeticException e) {
            throw new RowEncodingException("Timestamp out of range: " + dateTime, e);
        }
    }

    @Override
    public RowFormat format() {
        return format;
    }

    @Override
    public ByteSlice encode(@Nonnull ZoneId zone,
                            @Nonnull List<ColumnValue> row,
                            @Nullable ByteSlice valueBuffer,
                            @Nonnull ReusableSlice<Datum> interleaved,
                            @Nullable RowChecksum checksum) {
        if (format == RowFormat.LEGACY) {
            // The legacy layout carries no checksum.
            byte[] packed = packLegacy(zone, row, interleaved);
            ByteSlice out = ByteSlice.ensureCapacityAndReset(valueBuffer, 0, packed.length);
            out.append(packed);
            return out;
        }
        return encodeV2(zone, row, valueBuffer, checksum);
    }

    @Override
    public byte[] encodeLegacy(@Nonnull ZoneId zone, @Nonnull List<ColumnValue> row) {
        ReusableSlice<Datum> interleaved = ReusableSlice.ensureCapacityAndReset(null, row.size() * 2);
        return packLegacy(zone, row, interleaved);
    }

    private ByteSlice encodeV2(ZoneId zone, List<ColumnValue> row, @Nullable ByteSlice valueBuffer, @Nullable RowChecksum checksum) {
        int notNull = 0;
        for (ColumnValue column : row) {
            if (!column.value().isNull()) {
                notNull++;
            }
        }
        int nulls = row.size() - notNull;
        if (notNull > MAX_COLUMNS || nulls > MAX_COLUMNS) {
            throw new RowEncodingException("Too many columns in row: " + row.size());
        }

        ByteSlice out = ByteSlice.ensureCapacityAndReset(valueBuffer, 0, HEADER_SIZE + row.size() * 12);
        out.append((byte) CODEC_VERSION);
        out.append(checksum == null ? 0 : FLAG_CHECKSUM);
        out.appendShort(notNull);
        out.appendShort(nulls);
        for (ColumnValue column : row) {
            if (!column.value().isNull()) {
                out.appendLong(column.columnId());
            }
        }
        for (ColumnValue column : row) {
            if (column.value().isNull()) {
                out.appendLong(column.columnId());
            }
        }

        int offsetsPosition = out.length();
        for (int i = 0; i < notNull; i++) {
            out.appendInt(0);
        }

        int dataStart = out.length();
        int index = 0;
        for (ColumnValue column : row) {
            if (column.value().isNull()) {
                continue;
            }
            writeValue(out, zone, column.value());
            out.putInt(offsetsPosition + index * 4, out.length() - dataStart);
            index++;
        }

        if (checksum != null) {
            out.appendInt(checksum.compute(out.array(), 0, out.length()));
        }
        return out;
    }

    private void writeValue(ByteSlice out, ZoneId zone, Datum value) {
        out.append(value.kind().getCode());
        switch (value.kind()) {
            case INT64 -> out.appendLong(value.getLong());
            case FLOAT64 -> out.appendLong(Double.doubleToLongBits(value.getDouble()));
            case DECIMAL -> out.append(value.getDecimal().toString().getBytes(StandardCharsets.US_ASCII));
            case STRING -> out.append(value.getString().getBytes(StandardCharsets.UTF_8));
            case BYTES -> out.append(value.getBytes());
            case TIMESTAMP -> out.appendLong(toEpochMicros(value.getTimestamp(), zone));
            default -> throw new RowEncodingException("Unsupported datum kind: " + value.kind());
        }
    }

    private byte[] packLegacy(ZoneId zone, List<ColumnValue> row, ReusableSlice<Datum> interleaved) {
        if (interleaved.length() != row.size() * 2) {
            throw new IllegalArgumentException(
                    "interleaved scratch length " + interleaved.length() + " does not match row length " + row.size());
        }
        for (int i = 0; i < row.size(); i++) {
            ColumnValue column = row.get(i);
            interleaved.set(2 * i, Datum.ofLong(column.columnId()));
            interleaved.set(2 * i + 1, column.value());
        }

        List<Object> items = new ArrayList<>(interleaved.length());
        for (Datum datum : interleaved) {
            items.add(toTupleElement(datum, zone));
        }
        return Tuple.fromList(items).pack();
    }

    private Object toTupleElement(Datum datum, ZoneId zone) {
        return switch (datum.kind()) {
            case NULL -> null;
            case INT64 -> datum.getLong();
            case FLOAT64 -> datum.getDouble();
            case STRING -> datum.getString();
            case BYTES -> datum.getBytes();
            case DECIMAL -> Tuple.from((long) DatumKind.DECIMAL.getCode(), datum.getDecimal().toString());
            case TIMESTAMP -> Tuple.from((long) DatumKind.TIMESTAMP.getCode(), toEpochMicros(datum.getTimestamp(), zone));
        };
    }
}
