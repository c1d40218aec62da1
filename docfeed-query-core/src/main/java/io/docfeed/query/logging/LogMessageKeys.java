/*
 * LogMessageKeys.java
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

package io.docfeed.query.logging;

import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} and {@link io.docfeed.util.LoggableException} keys logged by the query core.
 * Keeping them in one place makes collisions easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    MESSAGE,
    STAGE_KIND,
    EXPECTED,
    ACTUAL,

    // ranges and topology
    FEED_RANGE,
    CHILD_RANGES,
    MERGED_RANGES,
    RANGE_COUNT,
    REFRESH_ATTEMPT,

    // fetching
    MAX_CONCURRENCY,
    PREFETCH_POLICY,
    IN_FLIGHT,
    STATUS_CODE,
    SUB_STATUS_CODE,
    REQUEST_CHARGE,
    ACTIVITY_ID,
    PAGE_SIZE,
    DOCUMENT_COUNT,

    // continuations
    RAW_BYTES,
    CONTINUATION,
    ORDER_BY_ITEMS,
    COLUMN_COUNT,

    // stages
    EMPTY_PAGES_SKIPPED,
    GROUP_COUNT,
    SKIP_COUNT,
    TAKE_COUNT,
    EXCEPTION_CLASS;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
