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

package com.kvtable.table.tblctx;

import com.kvtable.kv.Handle;

/**
 * Receives the legacy encoding of every row a session mutates, for downstream replication.
 */
public interface ReplicationLog {

    enum Operation {
        INSERT,
        UPDATE,
        DELETE
    }

    /**
     * @param tableId   table of the mutated row
     * @param handle    row identity
     * @param operation kind of mutation
     * @param row       row encoded with the legacy layout, owned by the log from now on
     */
    void append(long tableId, Handle handle, Operation operation, byte[] row);
}
