/*
 * ListQueryPipelineStage.java
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

package io.docfeed.query.pipeline;

import com.apple.foundationdb.tuple.Tuple;
import com.google.protobuf.Value;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.StageAccessChecker;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage that returns a fixed list of results, for testing the stages that wrap it.
 * The state of the page at index {@code i} resumes at index {@code i + 1}; the last page has no state.
 */
public class ListQueryPipelineStage implements QueryPipelineStage {
    public static final Executor DIRECT = Runnable::run;

    @Nonnull
    private final List<Result<QueryPage, QueryCoreException>> results;
    private int nextIndex;
    private int pulls;
    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    public ListQueryPipelineStage(@Nonnull List<Result<QueryPage, QueryCoreException>> results, int startIndex) {
        this.results = results;
        this.nextIndex = startIndex;
    }

    /**
     * Build the results for pages of rows, each costing one request unit.
     * @param pages the rows of each page
     * @return the results, with states that resume after each page
     */
    @Nonnull
    public static List<Result<QueryPage, QueryCoreException>> pages(@Nonnull List<List<Value>> pages) {
        final List<Result<QueryPage, QueryCoreException>> results = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            final QueryState state = i + 1 < pages.size() ? stateAt(i + 1) : null;
            results.add(Result.success(new QueryPage(pages.get(i), 1.0, "page-" + i, state)));
        }
        return results;
    }

    @Nonnull
    public static QueryState stateAt(int index) {
        return QueryState.fromBytes(Tuple.from((long)index).pack());
    }

    /**
     * A factory that resumes a list stage from the states of {@link #pages}.
     * @param results the results
     * @return the factory
     */
    @Nonnull
    public static StageFactory factory(@Nonnull List<Result<QueryPage, QueryCoreException>> results) {
        return continuation -> {
            if (continuation == null) {
                return Result.success(new ListQueryPipelineStage(results, 0));
            }
            final long index;
            try {
                index = Tuple.fromBytes(continuation.toByteArray()).getLong(0);
            } catch (RuntimeException ex) {
                return Result.failure(new MalformedContinuationTokenException("not a list continuation"));
            }
            if (index <= 0 || index >= results.size()) {
                return Result.failure(new MalformedContinuationTokenException("list continuation out of range"));
            }
            return Result.success(new ListQueryPipelineStage(results, (int)index));
        };
    }

    @Nonnull
    @Override
    public Result<QueryPage, QueryCoreException> getCurrent() {
        return StageAccessChecker.checkCurrent(current, this);
    }

    @Nonnull
    @Override
    public CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace) {
        StageAccessChecker.checkMoveNext(exhausted, this);
        pulls++;
        if (nextIndex >= results.size()) {
            exhausted = true;
            current = null;
            return CompletableFuture.completedFuture(false);
        }
        current = results.get(nextIndex++);
        return CompletableFuture.completedFuture(true);
    }

    @Nonnull
    @Override
    public Executor getExecutor() {
        return DIRECT;
    }

    @Override
    public void close() {
        closed = true;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * The number of times {@link #moveNext} was called.
     * @return the count
     */
    public int getPulls() {
        return pulls;
    }
}
