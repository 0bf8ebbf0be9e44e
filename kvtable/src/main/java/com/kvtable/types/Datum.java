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

package com.kvtable.types;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * Datum is an immutable, tagged column value.
 * <p>
 * Timestamps are stored as session-local date-times; converting them to an absolute
 * instant requires the session's zone and happens at encoding time.
 */
public final class Datum {
    public static final Datum NULL = new Datum(DatumKind.NULL, null);

    private final DatumKind kind;
    private final Object value;

    private Datum(DatumKind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static Datum ofNull() {
        return NULL;
    }

    public static Datum ofLong(long value) {
        return new Datum(DatumKind.INT64, value);
    }

    public static Datum ofDouble(double value) {
        return new Datum(DatumKind.FLOAT64, value);
    }

    public static Datum ofDecimal(@Nonnull BigDecimal value) {
        return new Datum(DatumKind.DECIMAL, Objects.requireNonNull(value));
    }

    public static Datum ofString(@Nonnull String value) {
        return new Datum(DatumKind.STRING, Objects.requireNonNull(value));
    }

    public static Datum ofBytes(@Nonnull byte[] value) {
        return new Datum(DatumKind.BYTES, Objects.requireNonNull(value).clone());
    }

    public static Datum ofTimestamp(@Nonnull LocalDateTime value) {
        return new Datum(DatumKind.TIMESTAMP, Objects.requireNonNull(value));
    }

    public DatumKind kind() {
        return kind;
    }

    public boolean isNull() {
        return kind == DatumKind.NULL;
    }

    public long getLong() {
        checkKind(DatumKind.INT64);
        return (Long) value;
    }

    public double getDouble() {
        checkKind(DatumKind.FLOAT64);
        return (Double) value;
    }

    public BigDecimal getDecimal() {
        checkKind(DatumKind.DECIMAL);
        return (BigDecimal) value;
    }

    public String getString() {
        checkKind(DatumKind.STRING);
        return (String) value;
    }

    /**
     * Returns a copy of the stored bytes.
     */
    public byte[] getBytes() {
        checkKind(DatumKind.BYTES);
        return ((byte[]) value).clone();
    }

    public LocalDateTime getTimestamp() {
        checkKind(DatumKind.TIMESTAMP);
        return (LocalDateTime) value;
    }

    private void checkKind(DatumKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Datum kind is " + kind + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Datum other)) {
            return false;
        }
        if (kind != other.kind) {
            return false;
        }
        if (kind == DatumKind.BYTES) {
            return Arrays.equals((byte[]) value, (byte[]) other.value);
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (kind == DatumKind.BYTES) {
            return 31 * kind.hashCode() + Arrays.hashCode((byte[]) value);
        }
        return 31 * kind.hashCode() + Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case NULL -> "NULL";
            case BYTES -> "BYTES" + Arrays.toString((byte[]) value);
            default -> kind + "(" + value + ")";
        };
    }
}
