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

package com.kvtable.kv;

import com.kvtable.internal.ByteSlice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TransactionMemBufferTest {
    private TransactionMemBuffer memBuffer;

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static ByteSlice slice(String value) {
        return ByteSlice.copyOf(bytes(value));
    }

    @BeforeEach
    void setUp() {
        memBuffer = new TransactionMemBuffer();
    }

    @Test
    void test_set_and_get() {
        memBuffer.set(bytes("k1"), slice("v1"));
        assertArrayEquals(bytes("v1"), memBuffer.get(bytes("k1")));
        assertNull(memBuffer.get(bytes("k2")));
        assertEquals(1, memBuffer.size());
    }

    @Test
    void test_stored_value_is_detached_from_slice() {
        ByteSlice value = slice("v1");
        memBuffer.set(bytes("k1"), value);
        ByteSlice.ensureCapacityAndReset(value, 0).append(bytes("zz"));
        assertArrayEquals(bytes("v1"), memBuffer.get(bytes("k1")));
    }

    @Test
    void test_flags_are_merged() {
        memBuffer.setWithFlags(bytes("k1"), slice("v1"), KeyFlag.PRESUME_KEY_NOT_EXISTS);
        memBuffer.setWithFlags(bytes("k1"), slice("v2"), KeyFlag.NEED_CONSTRAINT_CHECK_IN_PREWRITE);
        assertEquals(Set.of(KeyFlag.PRESUME_KEY_NOT_EXISTS, KeyFlag.NEED_CONSTRAINT_CHECK_IN_PREWRITE), memBuffer.flags(bytes("k1")));
        assertArrayEquals(bytes("v2"), memBuffer.get(bytes("k1")));
        assertTrue(memBuffer.flags(bytes("unknown")).isEmpty());
    }

    @Test
    void test_delete() {
        memBuffer.set(bytes("k1"), slice("v1"));
        memBuffer.delete(bytes("k1"));
        assertNull(memBuffer.get(bytes("k1")));
        assertTrue(memBuffer.isDeleted(bytes("k1")));
        assertFalse(memBuffer.isDeleted(bytes("k2")));
    }

    @Test
    void test_empty_key() {
        assertThrows(KvStoreException.class, () -> memBuffer.set(new byte[0], slice("v")));
        assertThrows(KvStoreException.class, () -> memBuffer.delete(null));
    }

    @Test
    void test_key_too_large() {
        byte[] key = new byte[TransactionMemBuffer.MAX_KEY_SIZE + 1];
        KvStoreException e = assertThrows(KvStoreException.class, () -> memBuffer.set(key, slice("v")));
        assertTrue(e.getMessage().contains("key is too large"));
    }

    @Test
    void test_value_too_large() {
        ByteSlice value = ByteSlice.copyOf(new byte[TransactionMemBuffer.MAX_VALUE_SIZE + 1]);
        assertThrows(KvStoreException.class, () -> memBuffer.set(bytes("k"), value));
        assertEquals(0, memBuffer.size());
    }

    @Test
    void test_flush() {
        RecordingWriteTarget target = new RecordingWriteTarget();
        memBuffer.set(bytes("b"), slice("2"));
        memBuffer.setWithFlags(bytes("a"), slice("1"), KeyFlag.PRESUME_KEY_NOT_EXISTS);
        memBuffer.delete(bytes("c"));
        memBuffer.flushTo(target);

        assertEquals(List.of("conflict a", "set a=1", "set b=2", "clear c"), target.calls);
        assertEquals(0, memBuffer.size());
    }

    @Test
    void test_flush_empty_buffer() {
        RecordingWriteTarget target = new RecordingWriteTarget();
        memBuffer.flushTo(target);
        assertTrue(target.calls.isEmpty());
    }

    private static class RecordingWriteTarget implements TransactionMemBuffer.WriteTarget {
        private final List<String> calls = new ArrayList<>();

        @Override
        public void addReadConflictKey(byte[] key) {
            calls.add("conflict " + new String(key, StandardCharsets.UTF_8));
        }

        @Override
        public void set(byte[] key, byte[] value) {
            calls.add("set " + new String(key, StandardCharsets.UTF_8) + "=" + new String(value, StandardCharsets.UTF_8));
        }

        @Override
        public void clear(byte[] key) {
            calls.add("clear " + new String(key, StandardCharsets.UTF_8));
        }
    }
}
