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

import com.apple.foundationdb.Transaction;
import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.kvtable.internal.ByteSlice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * TransactionMemBuffer keeps a transaction's writes in key order until they are flushed into a
 * FoundationDB {@link Transaction}.
 *
 * <p>Key and value sizes are checked against FoundationDB's limits when the write is staged,
 * so a row that can never be committed fails the statement that produced it.</p>
 *
 * <pre>{@code
 * TransactionMemBuffer memBuffer = new TransactionMemBuffer();
 * writer.addRecord(ctx, memBuffer, handle, values);
 * try (Transaction tr = database.createTransaction()) {
 *     memBuffer.flush(tr);
 *     tr.commit().join();
 * }
 * }</pre>
 *
 * <p>Not thread-safe.</p>
 */
public class TransactionMemBuffer implements MemBuffer {
    public static final int MAX_KEY_SIZE = 10_000;
    public static final int MAX_VALUE_SIZE = 100_000;
    private static final Logger LOGGER = LoggerFactory.getLogger(TransactionMemBuffer.class);

    private final TreeMap<byte[], Entry> entries = new TreeMap<>(ByteArrayUtil::compareUnsigned);

    private static void checkKey(byte[] key) {
        if (key == null || key.length == 0) {
            throw new KvStoreException("key cannot be empty");
        }
        if (key.length > MAX_KEY_SIZE) {
            throw new KvStoreException("key is too large: " + key.length + " bytes, limit is " + MAX_KEY_SIZE);
        }
    }

    private static void checkValue(ByteSlice value) {
        if (value.length() > MAX_VALUE_SIZE) {
            throw new KvStoreException("value is too large: " + value.length() + " bytes, limit is " + MAX_VALUE_SIZE);
        }
    }

    @Override
    public void set(byte[] key, @Nonnull ByteSlice value) {
        put(key, value, EnumSet.noneOf(KeyFlag.class));
    }

    @Override
    public void setWithFlags(byte[] key, @Nonnull ByteSlice value, KeyFlag... flags) {
        EnumSet<KeyFlag> flagSet = EnumSet.noneOf(KeyFlag.class);
        Collections.addAll(flagSet, flags);
        put(key, value, flagSet);
    }

    private void put(byte[] key, ByteSlice value, EnumSet<KeyFlag> flags) {
        checkKey(key);
        checkValue(value);
        Entry previous = entries.get(key);
        if (previous != null) {
            flags.addAll(previous.flags());
        }
        entries.put(key.clone(), new Entry(value.toByteArray(), flags));
    }

    @Override
    public void delete(byte[] key) {
        checkKey(key);
        Entry previous = entries.get(key);
        EnumSet<KeyFlag> flags = previous == null ? EnumSet.noneOf(KeyFlag.class) : previous.flags();
        entries.put(key.clone(), new Entry(null, flags));
    }

    @Override
    public byte[] get(byte[] key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.value() == null) {
            return null;
        }
        return entry.value().clone();
    }

    public boolean isDeleted(byte[] key) {
        Entry entry = entries.get(key);
        return entry != null && entry.value() == null;
    }

    @Override
    public Set<KeyFlag> flags(byte[] key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(entry.flags());
    }

    @Override
    public int size() {
        return entries.size();
    }

    /**
     * Writes every staged entry into the transaction and empties this buffer. Committing the
     * transaction is left to the caller.
     */
    public void flush(@Nonnull Transaction tr) {
        flushTo(new WriteTarget() {
            @Override
            public void addReadConflictKey(byte[] key) {
                tr.addReadConflictKey(key);
            }

            @Override
            public void set(byte[] key, byte[] value) {
                tr.set(key, value);
            }

            @Override
            public void clear(byte[] key) {
                tr.clear(key);
            }
        });
    }

    void flushTo(WriteTarget target) {
        int sets = 0;
        int clears = 0;
        for (Map.Entry<byte[], Entry> item : entries.entrySet()) {
            byte[] key = item.getKey();
            Entry entry = item.getValue();
            if (entry.flags().contains(KeyFlag.PRESUME_KEY_NOT_EXISTS)) {
                target.addReadConflictKey(key);
            }
            if (entry.value() == null) {
                target.clear(key);
                clears++;
            } else {
                target.set(key, entry.value());
                sets++;
            }
        }
        entries.clear();
        LOGGER.debug("Flushed {} sets and {} clears into the transaction", sets, clears);
    }

    /**
     * The part of a FoundationDB transaction that a flush writes to.
     */
    interface WriteTarget {
        void addReadConflictKey(byte[] key);

        void set(byte[] key, byte[] value);

        void clear(byte[] key);
    }

    private record Entry(byte[] value, EnumSet<KeyFlag> flags) {
    }
}
