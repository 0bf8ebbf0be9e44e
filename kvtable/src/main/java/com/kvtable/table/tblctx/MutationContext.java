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

import com.kvtable.errctx.ErrorContext;
import com.typesafe.config.Config;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Per-session state needed to mutate table records.
 */
public class MutationContext {
    private final RowEncodingConfig rowEncodingConfig;
    private final ZoneId zone;
    private final ErrorContext errorContext;
    private final MutationBufferPool bufferPool;
    private final ReplicationLog replicationLog;

    public MutationContext(@Nonnull RowEncodingConfig rowEncodingConfig,
                           @Nonnull ZoneId zone,
                           @Nonnull ErrorContext errorContext,
                           @Nonnull MutationBufferPool bufferPool,
                           @Nullable ReplicationLog replicationLog) {
        this.rowEncodingConfig = Objects.requireNonNull(rowEncodingConfig, "rowEncodingConfig");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.errorContext = Objects.requireNonNull(errorContext, "errorContext");
        this.bufferPool = Objects.requireNonNull(bufferPool, "bufferPool");
        this.replicationLog = replicationLog;
    }

    /**
     * Builds a session's context from the {@code kvtable.mutation} settings.
     *
     * @param config         configuration containing {@code kvtable.mutation}
     * @param zone           the session time zone
     * @param replicationLog where removed and written rows are logged, or null to disable logging
     */
    public static MutationContext create(@Nonnull Config config, @Nonnull ZoneId zone, @Nullable ReplicationLog replicationLog) {
        int rowValueBufferSize = config.getInt("kvtable.mutation.row_value_buffer_size");
        WriteStatementBuffers statementBuffers = new WriteStatementBuffers(rowValueBufferSize);
        return new MutationContext(
                RowEncodingConfig.load(config),
                zone,
                ErrorContext.load(config),
                new MutationBufferPool(statementBuffers),
                replicationLog
        );
    }

    public RowEncodingConfig getRowEncodingConfig() {
        return rowEncodingConfig;
    }

    public ZoneId getZone() {
        return zone;
    }

    public ErrorContext getErrorContext() {
        return errorContext;
    }

    public MutationBufferPool getBufferPool() {
        return bufferPool;
    }

    @Nullable
    public ReplicationLog getReplicationLog() {
        return replicationLog;
    }

    public boolean isReplicationLogEnabled() {
        return replicationLog != null;
    }
}
