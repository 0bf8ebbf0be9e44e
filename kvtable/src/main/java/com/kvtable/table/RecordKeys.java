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

package com.kvtable.table;

import com.apple.foundationdb.subspace.Subspace;
import com.apple.foundationdb.tuple.Tuple;
import com.kvtable.kv.Handle;

/**
 * RecordKeys builds the keys of a table's records.
 */
public class RecordKeys {
    public static final String TABLE_PREFIX = "t";
    public static final String RECORD_PREFIX = "r";

    private final Subspace records;

    public RecordKeys(long tableId) {
        // t | table-id | r | handle
        this.records = new Subspace(Tuple.from(TABLE_PREFIX, tableId, RECORD_PREFIX));
    }

    public byte[] recordKey(Handle handle) {
        return records.pack(Tuple.from(handle.tupleElement()));
    }

    public Subspace getSubspace() {
        return records;
    }
}
