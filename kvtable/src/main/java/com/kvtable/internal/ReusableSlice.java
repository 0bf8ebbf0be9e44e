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

import javax.annotation.Nullable;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.RandomAccess;

/**
 * ReusableSlice is a backing array with a logical length, reused across many short-lived
 * use cycles.
 *
 * <p>{@link #ensureCapacityAndReset(ReusableSlice, int, int)} never shrinks the backing array:
 * when the existing capacity is sufficient only the logical length changes. Elements beyond
 * the logical length keep whatever a previous cycle left there, so callers must only read
 * positions they have written since the last reset.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @param <T> element type
 */
public final class ReusableSlice<T> implements Iterable<T> {
    private Object[] elements;
    private int length;

    private ReusableSlice(int length, int capacity) {
        this.elements = new Object[capacity];
        this.length = length;
    }

    /**
     * Same as {@link #ensureCapacityAndReset(ReusableSlice, int, int)} with {@code capacity == size}.
     */
    public static <T> ReusableSlice<T> ensureCapacityAndReset(@Nullable ReusableSlice<T> slice, int size) {
        return ensureCapacityAndReset(slice, size, size);
    }

    /**
     * Returns a slice whose logical length is {@code size}. The given slice is reused if its
     * capacity is at least {@code capacity}; otherwise a new slice is allocated and the old
     * contents are dropped.
     *
     * @param slice    the slice to reuse, may be null
     * @param size     the requested logical length
     * @param capacity the requested minimum capacity
     * @return the reused or newly allocated slice
     */
    public static <T> ReusableSlice<T> ensureCapacityAndReset(@Nullable ReusableSlice<T> slice, int size, int capacity) {
        if (size < 0 || capacity < 0) {
            throw new IllegalArgumentException("size and capacity must be non-negative");
        }
        int required = Math.max(size, capacity);
        if (slice == null || slice.capacity() < required) {
            return new ReusableSlice<>(size, required);
        }
        slice.length = size;
        return slice;
    }

    public void append(T element) {
        if (length == elements.length) {
            elements = Arrays.copyOf(elements, Math.max(4, elements.length * 2));
        }
        elements[length++] = element;
    }

    @SuppressWarnings("unchecked")
    public T get(int index) {
        checkIndex(index);
        return (T) elements[index];
    }

    public void set(int index, T element) {
        checkIndex(index);
        elements[index] = element;
    }

    public int length() {
        return length;
    }

    public int capacity() {
        return elements.length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Returns a read-only view over {@code [0, length)}. The view follows later changes of this
     * slice, copy it to keep a snapshot.
     */
    public List<T> asList() {
        return new ListView();
    }

    @Override
    public Iterator<T> iterator() {
        return asList().iterator();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index: " + index + ", length: " + length);
        }
    }

    private final class ListView extends AbstractList<T> implements RandomAccess {
        @Override
        public T get(int index) {
            return ReusableSlice.this.get(index);
        }

        @Override
        public int size() {
            return length;
        }
    }
}
