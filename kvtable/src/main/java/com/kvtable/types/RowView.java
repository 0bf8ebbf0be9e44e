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

package com.kvtable.types;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * RowView is a read-only, positional row of values, used to evaluate constraints.
 */
public final class RowView {
    private final Datum[] values;

    private RowView(Datum[] values) {
        this.values = values;
    }

    /**
     * Creates a view holding a snapshot of the given values.
     */
    public static RowView copyOf(List<Datum> values) {
        return new RowView(values.toArray(new Datum[0]));
    }

    public int size() {
        return values.length;
    }

    public Datum get(int index) {
        return values[index];
    }

    public boolean isNull(int index) {
        return values[index].isNull();
    }

    public long getLong(int index) {
        return values[index].getLong();
    }

    public String getString(int index) {
        return values[index].getString();
    }

    public List<Datum> toList() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public String toString() {
        return "RowView" + Arrays.toString(values);
    }
}
