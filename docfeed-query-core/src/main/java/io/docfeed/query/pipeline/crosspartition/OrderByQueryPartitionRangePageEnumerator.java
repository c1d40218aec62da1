/*
 * OrderByQueryPartitionRangePageEnumerator.java
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

package io.docfeed.query.pipeline.crosspartition;

import com.google.common.base.Verify;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.CancellationToken;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPaginationOptions;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.pagination.FeedRangeState;
import io.docfeed.query.pagination.FetchLimiter;
import io.docfeed.query.pagination.MonadicQueryDataSource;
import io.docfeed.query.pagination.PartitionRangePageEnumerator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Reads one feed range of an order-by query and buffers the rows of its current page for merging.
 *
 * <p>
 * Besides the state of the next fetch, the enumerator remembers the state its buffered page was fetched with and
 * the key of the last row taken from it, together with how many rows of that page have that key. Those three make
 * up the range's resume point: re-reading from the page's state, dropping rows before the key and then dropping that
 * many rows equal to it returns exactly the rows not yet taken.
 * </p>
 *
 * <p>
 * An enumerator may start with a {@link OrderByResumeFilter}, which drops the rows already returned before it was
 * created. The filter may take more than one page to get past.
 * </p>
 */
@API(API.Status.INTERNAL)
public class OrderByQueryPartitionRangePageEnumerator extends PartitionRangePageEnumerator {
    @Nonnull
    private final OrderByQueryResultComparator comparator;
    @Nonnull
    private final Deque<OrderByQueryResult> buffer = new ArrayDeque<>();

    @Nullable
    private QueryState fetchState;
    @Nullable
    private QueryState pageStartState;
    private boolean pageBuffered;

    // key of the last row returned from this range, or of the filter while it is active
    @Nullable
    private OrderByResumeFilter lastKey;
    private boolean filterActive;
    private long filterSkipRemaining;
    // rows of the buffered page with a key equal to lastKey, returned or dropped
    private long pageEqualCount;

    public OrderByQueryPartitionRangePageEnumerator(@Nonnull MonadicQueryDataSource dataSource,
                                                    @Nonnull SqlQuerySpec querySpec,
                                                    @Nonnull FeedRangeState feedRangeState,
                                                    @Nonnull QueryPaginationOptions paginationOptions,
                                                    @Nonnull FetchLimiter limiter,
                                                    @Nonnull CancellationToken cancellation,
                                                    @Nonnull OrderByQueryResultComparator comparator,
                                                    @Nullable OrderByResumeFilter resumeFilter) {
        super(dataSource, querySpec, feedRangeState, paginationOptions, limiter, cancellation);
        this.comparator = comparator;
        if (resumeFilter != null) {
            this.lastKey = resumeFilter.withSkipCount(0);
            this.filterActive = true;
            this.filterSkipRemaining = resumeFilter.getSkipCount();
        }
    }

    @Nonnull
    @Override
    public CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace) {
        Verify.verify(buffer.isEmpty(), "fetching a new page before the buffered rows were taken");
        fetchState = getFeedRangeState().getState();
        return super.moveNext(trace);
    }

    /**
     * Buffer the rows of the page just read, dropping those the resume filter excludes.
     * @param page the page returned by the last {@link #moveNext}
     * @throws io.docfeed.query.QueryCoreException if a row does not have the order-by row shape
     */
    public void bufferPage(@Nonnull QueryPage page) {
        pageStartState = fetchState;
        pageEqualCount = 0;
        for (Value document : page.getDocuments()) {
            final OrderByQueryResult row = OrderByQueryResult.parse(document, comparator.getColumnCount(), getFeedRange());
            if (filterActive && lastKey != null) {
                final int comparison = comparator.compareKey(row, lastKey);
                if (comparison < 0) {
                    continue;
                }
                if (comparison == 0 && filterSkipRemaining > 0) {
                    filterSkipRemaining--;
                    pageEqualCount++;
                    continue;
                }
                filterActive = false;
            }
            buffer.addLast(row);
        }
        pageBuffered = !buffer.isEmpty();
    }

    public boolean hasBufferedRows() {
        return !buffer.isEmpty();
    }

    @Nonnull
    public OrderByQueryResult peek() {
        final OrderByQueryResult head = buffer.peekFirst();
        Verify.verifyNotNull(head, "no buffered rows");
        return head;
    }

    /**
     * Take the next buffered row.
     * @return the row
     */
    @Nonnull
    public OrderByQueryResult pop() {
        final OrderByQueryResult row = buffer.removeFirst();
        if (lastKey != null && comparator.compareKey(row, lastKey) == 0) {
            pageEqualCount++;
        } else {
            lastKey = OrderByResumeFilter.after(row, 0);
            pageEqualCount = 1;
        }
        if (buffer.isEmpty()) {
            pageBuffered = false;
        }
        return row;
    }

    /**
     * The state to read from to get the rows this range has not returned yet, possibly preceded by some it has.
     * @return the state, {@code null} for the start of the range
     */
    @Nullable
    public QueryState getResumeState() {
        return pageBuffered ? pageStartState : getFeedRangeState().getState();
    }

    /**
     * The filter that drops the rows before the first row not yet returned, when reading from
     * {@link #getResumeState()}.
     * @return the filter, or {@code null} if no row has to be dropped
     */
    @Nullable
    public OrderByResumeFilter getResumeFilter() {
        if (lastKey == null) {
            return null;
        }
        if (pageBuffered) {
            return lastKey.withSkipCount(pageEqualCount);
        }
        return lastKey.withSkipCount(filterActive ? filterSkipRemaining : 0);
    }

    @Nonnull
    public OrderByQueryResultComparator getComparator() {
        return comparator;
    }
}
