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

public enum DatumKind {
    NULL((byte) 0),
    INT64((byte) 1),
    FLOAT64((byte) 2),
    DECIMAL((byte) 3),
    STRING((byte) 4),
    BYTES((byte) 5),
    TIMESTAMP((byte) 6);

    private static final DatumKind[] BY_CODE = new DatumKind[values().length];

    static {
        for (DatumKind kind : values()) {
            BY_CODE[kind.code] = kind;
        }
    }

    private final byte code;

    DatumKind(byte code) {
        this.code = code;
    }

    /**
     * Returns the kind with the given wire code.
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    public static DatumKind fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            throw new IllegalArgumentException("Unknown datum kind code: " + code);
        }
        return BY_CODE[code];
    }

    public byte getCode() {
        return code;
    }
}
