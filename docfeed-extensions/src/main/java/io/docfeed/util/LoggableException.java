/*
 * LoggableException.java
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

import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;

/**
 * Runtime exception that carries key/value log info, so that whoever finally logs it can emit
 * searchable context rather than a bare message.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException implements LoggableKeysAndValues<LoggableException> {
    @Nonnull
    private final LoggableKeysAndValuesImpl logInfo = new LoggableKeysAndValuesImpl();

    /**
     * Create an exception with a message and alternating keys and values.
     *
     * @param msg error message
     * @param keyValues flattened key/value pairs
     * @throws IllegalArgumentException if {@code keyValues} has odd length
     */
    public LoggableException(@Nonnull String msg, @Nullable Object ... keyValues) {
        super(msg);
        if (keyValues != null) {
            logInfo.addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause, @Nullable Object ... keyValues) {
        super(msg, cause);
        if (keyValues != null) {
            logInfo.addLogInfo(keyValues);
        }
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    public LoggableException(Throwable cause) {
        super(cause);
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        return logInfo.getLogInfo();
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull String description, Object object) {
        logInfo.addLogInfo(description, object);
        return this;
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull Object ... keyValue) {
        logInfo.addLogInfo(keyValue);
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        return logInfo.exportLogInfo();
    }

    /**
     * Collect the log info of {@code t} and of every {@link LoggableException} in its cause chain. Entries of an
     * outer exception win over entries with the same key further down the chain.
     *
     * @param t the throwable to inspect
     * @return the merged log info, possibly empty
     */
    @Nonnull
    public static Map<String, Object> collectLogInfo(@Nullable Throwable t) {
        final LoggableKeysAndValuesImpl merged = new LoggableKeysAndValuesImpl();
        collectInto(merged, t, 0);
        return merged.getLogInfo();
    }

    private static void collectInto(@Nonnull LoggableKeysAndValuesImpl merged, @Nullable Throwable t, int depth) {
        // Bounded so that a cyclic cause chain cannot loop forever.
        if (t == null || depth > 16) {
            return;
        }
        collectInto(merged, t.getCause(), depth + 1);
        if (t instanceof LoggableException) {
            ((LoggableException)t).getLogInfo().forEach(merged::addLogInfo);
        }
    }
}
