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

import com.kvtable.common.utils.ByteUtils;

public record IntHandle(long value) implements Handle {

    @Override
    public byte[] encoded() {
        // Sign bit flipped so that negative ids sort first.
        return ByteUtils.fromLong(value ^ Long.MIN_VALUE);
    }

    @Override
    public Object tupleElement() {
        return value;
    }
}
