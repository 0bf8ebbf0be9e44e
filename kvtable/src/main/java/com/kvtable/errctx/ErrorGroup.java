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

package com.kvtable.errctx;

import com.kvtable.codec.InvalidTimeException;
import com.kvtable.codec.RowEncodingException;

/**
 * Groups of errors whose handling level can be configured independently.
 */
public enum ErrorGroup {
    TIME_CONVERSION("time_conversion"),
    ENCODING("encoding");

    private final String configKey;

    ErrorGroup(String configKey) {
        this.configKey = configKey;
    }

    /**
     * Classifies an error.
     *
     * @return the group, or null if the error is not subject to a configurable level
     */
    public static ErrorGroup of(Throwable error) {
        if (error instanceof InvalidTimeException) {
            return TIME_CONVERSION;
        }
        if (error instanceof RowEncodingException) {
            return ENCODING;
        }
        return null;
    }

    public String getConfigKey() {
        return configKey;
    }
}
