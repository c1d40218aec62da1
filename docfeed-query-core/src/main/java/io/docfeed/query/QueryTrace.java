/*
 * QueryTrace.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Diagnostics handle threaded through every {@link QueryPipelineStage#moveNext} call. The pipeline only writes to
 * it; where the data ends up is up to the caller.
 */
@API(API.Status.UNSTABLE)
public interface QueryTrace extends AutoCloseable {
    /**
     * A trace that discards everything.
     */
    QueryTrace NO_OP = new QueryTrace() {
        @Nonnull
        @Override
        public QueryTrace startChild(@Nonnull String name) {
            return this;
        }

        @Override
        public void addDatum(@Nonnull String key, @Nullable Object value) {
            // discarded
        }

        @Override
        public void close() {
            // nothing to close
        }
    };

    /**
     * Open a nested scope, e.g. for one backend fetch. Callers close the child when the scope ends.
     * @param name name of the scope
     * @return the child trace
     */
    @Nonnull
    QueryTrace startChild(@Nonnull String name);

    void addDatum(@Nonnull String key, @Nullable Object value);

    @Override
    void close();
}
