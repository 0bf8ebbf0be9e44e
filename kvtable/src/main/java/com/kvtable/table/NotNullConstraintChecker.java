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

import com.kvtable.types.RowView;

import java.util.List;

/**
 * Rejects rows that hold NULL in a column declared NOT NULL.
 */
public class NotNullConstraintChecker implements ConstraintChecker {
    private final List<ColumnInfo> columns;

    public NotNullConstraintChecker(TableInfo table) {
        this.columns = table.columns();
    }

    @Override
    public void check(RowView row) {
        for (int i = 0; i < columns.size() && i < row.size(); i++) {
            ColumnInfo column = columns.get(i);
            if (column.notNull() && row.isNull(i)) {
                throw new ConstraintViolationException(String.format("Column '%s' cannot be null", column.name()));
            }
        }
    }
}
