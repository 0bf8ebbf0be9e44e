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

import com.kvtable.common.KvTableException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ErrorContext decides, per {@link ErrorGroup}, whether an error fails the statement, is
 * downgraded to a warning or is ignored.
 *
 * <p>Callers hand every error they get from a collaborator to {@link #handleError(KvTableException)}
 * and throw whatever it returns. Errors that belong to no group are always returned unchanged.</p>
 */
public class ErrorContext {
    private static final Logger LOGGER = LoggerFactory.getLogger(ErrorContext.class);

    private final Map<ErrorGroup, ErrorLevel> levels = new EnumMap<>(ErrorGroup.class);
    private final List<KvTableException> warnings = new ArrayList<>();

    public ErrorContext() {
        for (ErrorGroup group : ErrorGroup.values()) {
            levels.put(group, ErrorLevel.ERROR);
        }
    }

    public ErrorContext(Map<ErrorGroup, ErrorLevel> levels) {
        this();
        this.levels.putAll(levels);
    }

    /**
     * Reads the levels from {@code kvtable.mutation.errors}.
     *
     * @throws ConfigException.BadValue if a level is not one of error, warn or ignore
     */
    public static ErrorContext load(Config config) {
        Config errors = config.getConfig("kvtable.mutation.errors");
        Map<ErrorGroup, ErrorLevel> levels = new EnumMap<>(ErrorGroup.class);
        for (ErrorGroup group : ErrorGroup.values()) {
            if (!errors.hasPath(group.getConfigKey())) {
                continue;
            }
            String value = errors.getString(group.getConfigKey());
            try {
                levels.put(group, ErrorLevel.valueOf(value.toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(
                        errors.origin(), group.getConfigKey(), "unknown error level: " + value, e);
            }
        }
        return new ErrorContext(levels);
    }

    public ErrorLevel levelOf(ErrorGroup group) {
        return levels.get(group);
    }

    /**
     * Applies the configured level to an error.
     *
     * @param error the error reported by a collaborator, may be null
     * @return the error to propagate, or null if it was downgraded or ignored
     */
    @Nullable
    public KvTableException handleError(@Nullable KvTableException error) {
        if (error == null) {
            return null;
        }
        ErrorGroup group = ErrorGroup.of(error);
        if (group == null) {
            return error;
        }
        return switch (levels.get(group)) {
            case ERROR -> error;
            case WARN -> {
                warnings.add(error);
                LOGGER.debug("Downgraded {} error to warning: {}", group, error.getMessage());
                yield null;
            }
            case IGNORE -> null;
        };
    }

    public List<KvTableException> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void clearWarnings() {
        warnings.clear();
    }
}
