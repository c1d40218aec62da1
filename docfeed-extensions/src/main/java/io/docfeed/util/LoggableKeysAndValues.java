/*
 * LoggableKeysAndValues.java
 *
 * This source file is part of the docfeed open source project
 *
 * Copyright 2026 the docfeed project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.docfeed.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * An object that carries searchable key/value context for log output.
 *
 * <p>
 * Log lines written by docfeed have a fixed title plus a set of keys and values, e.g. a failed fetch logs
 * {@code feed_range} and {@code status_code} next to "backend request failed". Exceptions implement this
 * interface so the same context travels with the failure until someone logs it.
 * </p>
 *
 * @param <T> the implementing type, returned from the fluent adders
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    @Nonnull
    Map<String, Object> getLogInfo();

    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add alternating keys and values, e.g. {@code ["k0", "v0", "k1", "v1"]}.
     *
     * @param keyValue flattened key/value pairs
     * @return this object
     * @throws IllegalArgumentException if {@code keyValue} has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object ... keyValue);

    /**
     * Flatten the log info into alternating keys and values, the format {@link #addLogInfo(Object...)} accepts.
     *
     * @return the flattened pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}
