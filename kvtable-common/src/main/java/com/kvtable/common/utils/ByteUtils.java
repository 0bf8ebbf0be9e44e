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

package com.kvtable.common.utils;

public class ByteUtils {
    private static final char[] HEX_ARRAY = "0123456789abcdef".toCharArray();

    public static byte[] fromLong(long data) {
        byte[] result = new byte[8];
        putLong(result, 0, data);
        return result;
    }

    public static long toLong(byte[] data) {
        if (data.length != 8) {
            throw new IllegalArgumentException("Size of data is not 8");
        }
        return getLong(data, 0);
    }

    /**
     * Writes {@code value} in big-endian order at {@code offset}.
     */
    public static void putLong(byte[] dest, int offset, long value) {
        for (int i = 7; i >= 0; i--) {
            dest[offset + i] = (byte) value;
            value >>>= 8;
        }
    }

    public static long getLong(byte[] src, int offset) {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value <<= 8;
            value |= src[offset + i] & 0xFF;
        }
        return value;
    }

    public static void putInt(byte[] dest, int offset, int value) {
        dest[offset] = (byte) (value >>> 24);
        dest[offset + 1] = (byte) (value >>> 16);
        dest[offset + 2] = (byte) (value >>> 8);
        dest[offset + 3] = (byte) value;
    }

    public static int getInt(byte[] src, int offset) {
        return ((src[offset] & 0xFF) << 24)
                | ((src[offset + 1] & 0xFF) << 16)
                | ((src[offset + 2] & 0xFF) << 8)
                | (src[offset + 3] & 0xFF);
    }

    public static int getUnsignedShort(byte[] src, int offset) {
        return ((src[offset] & 0xFF) << 8) | (src[offset + 1] & 0xFF);
    }

    public static String toHex(byte[] bytes) {
        return toHex(bytes, 0, bytes.length);
    }

    public static String toHex(byte[] bytes, int offset, int length) {
        char[] hexChars = new char[length * 2];
        for (int j = 0; j < length; j++) {
            int v = bytes[offset + j] & 0xFF;
            hexChars[j * 2] = HEX_ARRAY[v >>> 4];
            hexChars[j * 2 + 1] = HEX_ARRAY[v & 0x0F];
        }
        return new String(hexChars);
    }
}
