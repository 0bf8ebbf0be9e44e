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

import com.kvtable.codec.RowEncoder;
import com.kvtable.codec.RowFormat;
import com.kvtable.codec.TableRowEncoder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Settings that control how record values are encoded.
 *
 * @param rowLevelChecksumEnabled append a checksum bound to the row's handle
 * @param rowEncoder              the encoder that produces the record value
 */
public record RowEncodingConfig(boolean rowLevelChecksumEnabled, @Nonnull RowEncoder rowEncoder) {
    public RowEncodingConfig {
        Objects.requireNonNull(rowEncoder, "rowEncoder");
    }

    /**
     * Reads {@code kvtable.mutation.row_format} and {@code kvtable.mutation.row_level_checksum}.
     *
     * @throws ConfigException.BadValue if the row format is unknown
     */
    public static RowEncodingConfig load(Config config) {
        String format = config.getString("kvtable.mutation.row_format");
        RowFormat rowFormat;
        try {
            rowFormat = RowFormat.valueOf(format.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(
                    config.origin(), "kvtable.mutation.row_format", "unknown row format: " + format, e);
        }
        boolean checksum = config.getBoolean("kvtable.mutation.row_level_checksum");
        return new RowEncodingConfig(checksum, new TableRowEncoder(rowFormat));
    }
}
