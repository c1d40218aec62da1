/*
 * QueryCoreException.java
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

package io.docfeed.query;

import io.docfeed.annotation.API;
import io.docfeed.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Root of the unchecked exceptions raised or reported by the query pipeline.
 *
 * <p>
 * Most failures do not propagate as thrown exceptions. They travel through the pipeline as the error half of a
 * {@link io.docfeed.query.util.Result}, so that every {@link QueryPipelineStage} can report at most one failure per
 * {@link QueryPipelineStage#moveNext} call. Throwing is reserved for construction errors and caller bugs.
 * </p>
 */
@API(API.Status.STABLE)
@SuppressWarnings("serial")
public class QueryCoreException extends LoggableException {

    public QueryCoreException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public QueryCoreException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public QueryCoreException(@Nonnull String msg, @Nullable Throwable cause, @Nullable Object... keyValues) {
        super(msg, cause, keyValues);
    }

    public QueryCoreException(Throwable cause) {
        super(cause);
    }

    /**
     * Whether retrying the same request later might succeed.
     * @return {@code true} if the failure is transient
     */
    public boolean isRetryable() {
        return false;
    }
}
