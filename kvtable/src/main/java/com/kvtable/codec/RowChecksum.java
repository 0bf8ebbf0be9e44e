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

package com.kvtable.codec;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.kvtable.kv.Handle;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Row-level checksum bound to the row's handle. The same encoded row stored under another handle
 * yields a different checksum.
 */
public record RowChecksum(@Nonnull Handle handle) {
    private static final HashFunction CRC32C = Hashing.crc32c();

    public RowChecksum {
        Objects.requireNonNull(handle, "handle");
    }

    public int compute(byte[] data, int offset, int length) {
        return CRC32C.newHasher()
                .putBytes(data, offset, length)
                .putBytes(handle.encoded())
                .hash()
                .asInt();
    }
}
