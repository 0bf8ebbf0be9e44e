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

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Thrown when a local date-time does not exist in the session zone, for example inside a
 * daylight-saving gap.
 */
public class InvalidTimeException extends RowEncodingException {
    public InvalidTimeException(LocalDateTime dateTime, ZoneId zone) {
        super(String.format("Invalid time value '%s' in time zone %s", dateTime, zone));
    }
}
