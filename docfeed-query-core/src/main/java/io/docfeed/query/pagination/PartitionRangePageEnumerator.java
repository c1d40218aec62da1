/*
 * PartitionRangePageEnumerator.java
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

package io.docfeed.query.pagination;

import com.apple.foundationdb.async.AsyncUtil;
import io.docfeed.annotation.API;
import io.docfeed.query.CancellationToken;
import io.docfeed.query.QueryCancelledException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPaginationOptions;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reads the pages of a single feed range, one backend fetch per {@link #moveNext}.
 *
 * <p>
 * The enumerator owns the {@link FeedRangeState} of its range and moves it forward to each page's state. It never
 * retries and never interprets failures; a {@link FeedRangeGoneException} is left for the owning
 * {@link CrossPartitionRangePageEnumerator} to repair.
 * </p>
 */
@API(API.Status.INTERNAL)
public class PartitionRangePageEnumerator {
    @Nonnull
    private final MonadicQueryDataSource dataSource;
    @Nonnull
    private final SqlQuerySpec querySpec;
    @Nonnull
    private final QueryPaginationOptions paginationOptions;
    @Nonnull
    private final FetchLimiter limiter;
    @Nonnull
    private final CancellationToken cancellation;

    @Nonnull
    private FeedRangeState feedRangeState;
    private boolean started;
    private boolean drained;
    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    @Nullable
    private CompletableFuture<Result<QueryPage, QueryCoreException>> pendingFetch;

    public PartitionRangePageEnumerator(@Nonnull MonadicQueryDataSource dataSource,
                                        @Nonnull SqlQuerySpec querySpec,
                                        @Nonnull FeedRangeState feedRangeState,
                                        @Nonnull QueryPaginationOptions paginationOptions,
                                        @Nonnull FetchLimiter limiter,
                                        @Nonnull CancellationToken cancellation) {
        this.dataSource = dataSource;
        this.querySpec = querySpec;
        this.feedRangeState = feedRangeState;
        this.paginationOptions = paginationOptions;
        this.limiter = limiter;
        this.cancellation = cancellation;
    }

    /**
     * Fetch the next page of the range.
     *
     * @param trace diagnostics handle
     * @return a future completing with {@code false} if the range was already drained, and otherwise with
     * {@code true} once {@link #getCurrent()} holds the page or the failure
     */
    @Nonnull
    public CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace) {
        if (drained) {
            current = null;
            return AsyncUtil.READY_FALSE;
        }
        final CompletableFuture<Result<QueryPage, QueryCoreException>> fetch = pendingFetch != null ? pendingFetch : fetch(trace);
        pendingFetch = null;
        return fetch.thenApply(result -> {
            current = result;
            if (result.isSuccess()) {
                final QueryPage page = result.getValue();
                started = true;
                feedRangeState = new FeedRangeState(feedRangeState.getFeedRange(), page.getState());
                drained = page.getState() == null;
            }
            return true;
        });
    }

    /**
     * Start the next fetch now, without waiting for {@link #moveNext}. The next {@code moveNext} picks up its result.
     * @param trace diagnostics handle
     */
    public void prefetch(@Nonnull QueryTrace trace) {
        if (!drained && pendingFetch == null) {
            pendingFetch = fetch(trace);
        }
    }

    @Nonnull
    private CompletableFuture<Result<QueryPage, QueryCoreException>> fetch(@Nonnull QueryTrace trace) {
        final FeedRangeState requested = feedRangeState;
        final QueryTrace child = trace.startChild("fetch " + requested.getFeedRange());
        return limiter.submit(() -> dataSource.monadicQuery(querySpec, requested, paginationOptions, child, cancellation))
                .handle((result, err) -> {
                    if (result != null) {
                        child.addDatum(LogMessageKeys.REQUEST_CHARGE.toString(),
                                result.isSuccess() ? result.getValue().getRequestCharge() : 0.0);
                    }
                    child.close();
                    if (err != null) {
                        return Result.<QueryPage, QueryCoreException>failure(asQueryCoreException(err, requested.getFeedRange()));
                    }
                    return result;
                });
    }

    @Nonnull
    static QueryCoreException asQueryCoreException(@Nonnull Throwable err, @Nonnull FeedRange feedRange) {
        Throwable cause = err;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof QueryCoreException) {
            return (QueryCoreException)cause;
        }
        if (cause instanceof CancellationException) {
            return new QueryCancelledException("fetch cancelled", cause);
        }
        return new QueryCoreException("fetch failed", cause, LogMessageKeys.FEED_RANGE, feedRange);
    }

    @Nonnull
    public FeedRange getFeedRange() {
        return feedRangeState.getFeedRange();
    }

    @Nonnull
    public FeedRangeState getFeedRangeState() {
        return feedRangeState;
    }

    @Nullable
    public Result<QueryPage, QueryCoreException> getCurrent() {
        return current;
    }

    @Nonnull
    public SqlQuerySpec getQuerySpec() {
        return querySpec;
    }

    @Nonnull
    protected MonadicQueryDataSource getDataSource() {
        return dataSource;
    }

    @Nonnull
    protected QueryPaginationOptions getPaginationOptions() {
        return paginationOptions;
    }

    @Nonnull
    protected FetchLimiter getLimiter() {
        return limiter;
    }

    @Nonnull
    protected CancellationToken getCancellation() {
        return cancellation;
    }

    /**
     * Whether a page has been read successfully since this enumerator was created.
     * @return {@code true} once a page arrived
     */
    public boolean hasStarted() {
        return started;
    }

    public boolean isDrained() {
        return drained;
    }

    public boolean hasPendingFetch() {
        return pendingFetch != null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + feedRangeState + "}";
    }
}
