/*
 * QueryPipelineStage.java
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
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * An asynchronous, pull-based stage of a query pipeline.
 *
 * <p>
 * A pipeline is a chain of stages, each one wrapping the stage inside it. The innermost stage reads pages from the
 * backend across feed ranges. Every other stage implements one relational operator (skip, take, distinct,
 * aggregate, ...) by pulling pages from its inner stage. One call to {@link #moveNext} on an outer stage may pull
 * zero, one or many inner pages.
 * </p>
 *
 * <p>
 * Each successful call to {@link #moveNext} that completes with {@code true} makes a new {@link #getCurrent()}
 * available. The current value is either a {@link QueryPage} or the single failure of that call. Failures are
 * values, not exceptions: a failed {@code moveNext} still completes with {@code true}. The state of a returned page
 * is the continuation of the whole stage after that page; passing it to the pipeline factory rebuilds an
 * equivalent stage that picks up exactly where this one stopped.
 * </p>
 *
 * <p>
 * {@code moveNext} completes with {@code false} exactly once, when the stage can produce nothing more. Calling it
 * again afterwards is a caller error and throws {@link QueryCoreException}. A stage is used by one consumer at a
 * time: a new {@code moveNext} must not be issued before the previous future completes.
 * </p>
 *
 * <p>
 * Stages must be {@link #close() closed}. Closing a stage closes everything inside it, and closing twice does
 * nothing.
 * </p>
 */
@API(API.Status.STABLE)
public interface QueryPipelineStage extends AutoCloseable {
    /**
     * Get the result of the most recent {@link #moveNext} that completed with {@code true}.
     *
     * @return the current page or failure
     * @throws QueryCoreException if {@code moveNext} has not completed with {@code true} yet, or the stage is exhausted
     */
    @Nonnull
    Result<QueryPage, QueryCoreException> getCurrent();

    /**
     * Advance to the next page.
     *
     * @param trace diagnostics handle for this call
     * @return a future that completes with {@code true} if a new current result is available and {@code false}
     * when the stage is exhausted
     * @throws QueryCoreException if the stage has already reported exhaustion
     */
    @Nonnull
    CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace);

    /**
     * Get the executor used to chain asynchronous steps of this stage.
     * @return the executor
     */
    @Nonnull
    Executor getExecutor();

    @Override
    void close();

    boolean isClosed();
}
