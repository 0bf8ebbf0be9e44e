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

import com.kvtable.common.KvTableException;

/**
 * Thrown when a pooled buffer is requested again before its previous use was closed.
 */
public class BufferInUseException extends KvTableException {
    public BufferInUseException(String bufferName) {
        super(bufferName + " is already in use, close it before requesting it again");
    }
}
