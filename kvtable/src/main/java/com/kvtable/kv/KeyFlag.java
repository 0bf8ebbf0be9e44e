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

/**
 * Per-key hints attached to a staged write.
 */
public enum KeyFlag {
    /**
     * The writer assumes the key does not exist yet. On flush the key joins the transaction's
     * read conflict set, so a concurrent writer of the same key aborts the commit.
     */
    PRESUME_KEY_NOT_EXISTS,

    /**
     * The uniqueness check of this key was deferred to commit time.
     */
    NEED_CONSTRAINT_CHECK_IN_PREWRITE
}
