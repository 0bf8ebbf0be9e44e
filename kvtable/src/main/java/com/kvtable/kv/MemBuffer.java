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

import java.util.Set;

/**
 * MemBuffer stages the writes of a transaction before they reach the store.
 * <p>
 * Values are copied on write, so callers may reuse the slice they pass in.
 */
public interface MemBuffer {

    /**
     * @throws KvStoreException if the key or value violates the store's limits
     */
    void set(byte[] key, ByteSlice value);

    /**
     * Same as {@link #set(byte[], ByteSlice)}, additionally attaching the flags to the key.
     *
     * @throws KvStoreException if the key or value violates the store's limits
     */
    void setWithFlags(byte[] key, ByteSlice value, KeyFlag... flags);

    /**
     * @throws KvStoreException if the key violates the store's limits
     */
    void delete(byte[] key);

    /**
     * Returns a copy of the staged value, or null if the key is absent or deleted.
     */
    byte[] get(byte[] key);

    Set<KeyFlag> flags(byte[] key);

    int size();
}
