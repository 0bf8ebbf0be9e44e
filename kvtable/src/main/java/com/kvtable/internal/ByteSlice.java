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

package com.kvtable.internal;

import com.kvtable.common.utils.ByteUtils;

import javax.annotation.Nullable;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Byte counterpart of {@link ReusableSlice}: a reusable byte array with a logical length.
 * Multi-byte values are written in big-endian order.
 */
public final class ByteSlice {
    private byte[] bytes;
    private int length;

    private ByteSlice(byte[] bytes, int length) {
        this.bytes = bytes;
        this.length = length;
    }

    /**
     * Wraps a copy of the given bytes.
     */
    public static ByteSlice copyOf(byte[] data) {
        return new ByteSlice(data.clone(), data.length);
    }

    public static ByteSlice ensureCapacityAndReset(@Nullable ByteSlice slice, int size) {
        return ensureCapacityAndReset(slice, size, size);
    }

    /**
     * Returns a slice with logical length {@code size}, reusing {@code slice} when its capacity
     * is at least {@code capacity}. A reallocation drops the old contents.
     */
    public static ByteSlice ensureCapacityAndReset(@Nullable ByteSlice slice, int size, int capacity) {
        if (size < 0 || capacity < 0) {
            throw new IllegalArgumentException("size and capacity must be non-negative");
        }
        int required = Math.max(size, capacity);
        if (slice == null || slice.capacity() < required) {
            return new ByteSlice(new byte[required], size);
        }
        slice.length = size;
        return slice;
    }

    private void grow(int extra) {
        int required = length + extra;
        if (required > bytes.length) {
            bytes = Arrays.copyOf(bytes, Math.max(required, Math.max(16, bytes.length * 2)));
        }
    }

    public void append(byte b) {
        grow(1);
        bytes[length++] = b;
    }

    public void append(byte[] src) {
        append(src, 0, src.length);
    }

    public void append(byte[] src, int offset, int len) {
        grow(len);
        System.arraycopy(src, offset, bytes, length, len);
        length += len;
    }

    public void appendShort(int value) {
        grow(2);
        bytes[length++] = (byte) (value >>> 8);
        bytes[length++] = (byte) value;
    }

    public void appendInt(int value) {
        grow(4);
        ByteUtils.putInt(bytes, length, value);
        length += 4;
    }

    public void appendLong(long value) {
        grow(8);
        ByteUtils.putLong(bytes, length, value);
        length += 8;
    }

    /**
     * Overwrites four bytes at {@code position}, which must lie inside the logical length.
     */
    public void putInt(int position, int value) {
        if (position < 0 || position + 4 > length) {
            throw new IndexOutOfBoundsException("Position: " + position + ", length: " + length);
        }
        ByteUtils.putInt(bytes, position, value);
    }

    public byte get(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index: " + index + ", length: " + length);
        }
        return bytes[index];
    }

    /**
     * Returns the backing array. Only {@code [0, length())} is meaningful.
     */
    public byte[] array() {
        return bytes;
    }

    public int length() {
        return length;
    }

    public int capacity() {
        return bytes.length;
    }

    /**
     * Returns a read-only buffer over {@code [0, length())} that shares the backing array.
     */
    public ByteBuffer asReadOnlyBuffer() {
        return ByteBuffer.wrap(bytes, 0, length).asReadOnlyBuffer();
    }

    /**
     * Returns a detached copy of {@code [0, length())}.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(bytes, length);
    }

    @Override
    public String toString() {
        return "ByteSlice[" + ByteUtils.toHex(bytes, 0, length) + "]";
    }
}
