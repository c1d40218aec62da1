/*
 * OrderByCrossPartitionQueryPipelineStage.java
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

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.CancellationToken;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPaginationOptions;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.StageAccessChecker;
import io.docfeed.query.logging.KeyValueLogMessage;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pagination.CrossFeedRangePage;
import io.docfeed.query.pagination.CrossPartitionRangePageEnumerator;
import io.docfeed.query.pagination.DocumentContainer;
import io.docfeed.query.pagination.FeedRange;
import io.docfeed.query.pagination.FeedRangeState;
import io.docfeed.query.pagination.FetchLimiter;
import io.docfeed.query.pagination.PrefetchPolicy;
import io.docfeed.query.pipeline.SortOrder;
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The source stage for {@code ORDER BY} queries: a streaming merge of the sorted rows of every feed range.
 *
 * <p>
 * Each range returns its rows sorted, and the stage merges them by {@link OrderByQueryResultComparator}. Before a
 * row can be returned, every range that still has rows must have some buffered, so while ranges are waiting for a
 * page, each {@link #moveNext} fetches one page and returns an empty page carrying its charge. Once all ranges have
 * rows, {@code moveNext} returns up to a page of merged rows, stopping early if a range that has more pages runs out
 * of buffered rows.
 * </p>
 *
 * <p>
 * The continuation records, for each range with rows left, the state its buffered page was read from and the key of
 * its last returned row with the number of rows of that page equal to it. It also records the key of the last row
 * returned overall, which is where a range merged from several others resumes. Rows with exactly that key may be
 * returned again after a merge; no other row is returned twice or out of order.
 * </p>
 */
@API(API.Status.INTERNAL)
public class OrderByCrossPartitionQueryPipelineStage implements QueryPipelineStage {
    private static final Logger LOGGER = LoggerFactory.getLogger(OrderByCrossPartitionQueryPipelineStage.class);

    @Nonnull
    private final CrossPartitionRangePageEnumerator<OrderByQueryPartitionRangePageEnumerator> crossPartitionEnumerator;
    @Nonnull
    private final PriorityQueue<OrderByQueryPartitionRangePageEnumerator> ready;
    @Nonnull
    private final List<String> orderByExpressions;
    @Nonnull
    private final List<SortOrder> sortOrders;
    private final int pageSize;

    // key of the last row returned, where a merged range resumes
    @Nullable
    private OrderByResumeFilter frontier;
    @Nonnull
    private String lastActivityId = "";
    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    private OrderByCrossPartitionQueryPipelineStage(@Nonnull Builder builder, @Nonnull List<FeedRangeState> feedRangeStates,
                                                    @Nonnull List<OrderByResumeFilter> resumeFilters,
                                                    @Nullable OrderByResumeFilter frontier) {
        this.orderByExpressions = builder.orderByExpressions;
        this.sortOrders = builder.sortOrders;
        this.pageSize = builder.paginationOptions.getPageSizeLimit();
        this.frontier = frontier;
        final OrderByQueryResultComparator comparator = new OrderByQueryResultComparator(sortOrders);
        this.ready = new PriorityQueue<>((left, right) -> comparator.compare(left.peek(), right.peek()));
        final FetchLimiter limiter = new FetchLimiter(builder.maxConcurrency, builder.cancellation);
        final List<OrderByQueryPartitionRangePageEnumerator> enumerators = new ArrayList<>(feedRangeStates.size());
        for (int i = 0; i < feedRangeStates.size(); i++) {
            enumerators.add(newEnumerator(builder, limiter, comparator, feedRangeStates.get(i), resumeFilters.get(i)));
        }
        final CrossPartitionRangePageEnumerator.ChildEnumeratorFactory<OrderByQueryPartitionRangePageEnumerator> childFactory =
                new CrossPartitionRangePageEnumerator.ChildEnumeratorFactory<>() {
                    @Nonnull
                    @Override
                    public OrderByQueryPartitionRangePageEnumerator createForSplit(@Nonnull OrderByQueryPartitionRangePageEnumerator parent,
                                                                                   @Nonnull FeedRange childRange) {
                        return newEnumerator(builder, limiter, comparator,
                                new FeedRangeState(childRange, parent.getResumeState()), parent.getResumeFilter());
                    }

                    @Nonnull
                    @Override
                    public OrderByQueryPartitionRangePageEnumerator createForMerge(@Nonnull List<OrderByQueryPartitionRangePageEnumerator> parents,
                                                                                   @Nonnull FeedRange mergedRange) {
                        QueryState lowest = null;
                        boolean first = true;
                        for (OrderByQueryPartitionRangePageEnumerator parent : parents) {
                            if (first || QueryState.compareNullable(parent.getResumeState(), lowest) < 0) {
                                lowest = parent.getResumeState();
                                first = false;
                            }
                        }
                        return newEnumerator(builder, limiter, comparator,
                                new FeedRangeState(mergedRange, lowest), OrderByCrossPartitionQueryPipelineStage.this.frontier);
                    }
                };
        this.crossPartitionEnumerator = new CrossPartitionRangePageEnumerator<>(builder.documentContainer, enumerators,
                Comparator.comparing(OrderByQueryPartitionRangePageEnumerator::getFeedRange),
                childFactory, this::removeReadyWithin, limiter, builder.prefetchPolicy, false,
                builder.cancellation, builder.executor);
    }

    @Nonnull
    private OrderByQueryPartitionRangePageEnumerator newEnumerator(@Nonnull Builder builder,
                                                                   @Nonnull FetchLimiter limiter,
                                                                   @Nonnull OrderByQueryResultComparator comparator,
                                                                   @Nonnull FeedRangeState feedRangeState,
                                                                   @Nullable OrderByResumeFilter resumeFilter) {
        final String filter = resumeFilter == null ? null
                : OrderByFilters.resumeFilter(orderByExpressions, sortOrders, resumeFilter.getOrderByItems());
        return new OrderByQueryPartitionRangePageEnumerator(builder.documentContainer,
                OrderByFilters.format(builder.querySpec, filter), feedRangeState, builder.paginationOptions,
                limiter, builder.cancellation, comparator, resumeFilter);
    }

    @Nonnull
    private List<OrderByQueryPartitionRangePageEnumerator> removeReadyWithin(@Nonnull FeedRange mergedRange) {
        final List<OrderByQueryPartitionRangePageEnumerator> removed = new ArrayList<>();
        final Iterator<OrderByQueryPartitionRangePageEnumerator> iterator = ready.iterator();
        while (iterator.hasNext()) {
            final OrderByQueryPartitionRangePageEnumerator enumerator = iterator.next();
            if (mergedRange.contains(enumerator.getFeedRange())) {
                removed.add(enumerator);
                iterator.remove();
            }
        }
        return removed;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
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
        if (crossPartitionEnumerator.isEmpty()) {
            return CompletableFuture.completedFuture(emitRows());
        }
        return crossPartitionEnumerator.moveNext(trace).thenApply(hasNext -> {
            if (!hasNext) {
                return emitRows();
            }
            final Result<CrossFeedRangePage<OrderByQueryPartitionRangePageEnumerator>, QueryCoreException> result =
                    crossPartitionEnumerator.getCurrent();
            if (!result.isSuccess()) {
                current = Result.failure(result.getError());
                return true;
            }
            final QueryPage page = result.getValue().getPage();
            final OrderByQueryPartitionRangePageEnumerator source = result.getValue().getSource();
            try {
                source.bufferPage(page);
            } catch (QueryCoreException ex) {
                current = Result.failure(ex);
                return true;
            }
            lastActivityId = page.getActivityId();
            place(source);
            current = Result.success(QueryPage.empty(page.getRequestCharge(), page.getActivityId(), continuation()));
            return true;
        });
    }

    private boolean emitRows() {
        if (ready.isEmpty()) {
            exhausted = true;
            current = null;
            return false;
        }
        final List<Value> documents = new ArrayList<>(Math.min(pageSize, 64));
        while (documents.size() < pageSize && !ready.isEmpty()) {
            final OrderByQueryPartitionRangePageEnumerator enumerator = ready.poll();
            final OrderByQueryResult row = enumerator.pop();
            documents.add(row.getPayload());
            frontier = OrderByResumeFilter.after(row, 0);
            if (!place(enumerator)) {
                // that range needs another page before anything can be compared with it
                break;
            }
        }
        current = Result.success(new QueryPage(documents, 0.0, lastActivityId, continuation()));
        return true;
    }

    // Returns false if the enumerator must fetch before the merge can go on.
    private boolean place(@Nonnull OrderByQueryPartitionRangePageEnumerator enumerator) {
        if (enumerator.hasBufferedRows()) {
            ready.add(enumerator);
            return true;
        }
        if (enumerator.isDrained()) {
            return true;
        }
        crossPartitionEnumerator.enqueue(enumerator);
        return false;
    }

    @Nullable
    private QueryState continuation() {
        final List<OrderByQueryPartitionRangePageEnumerator> remaining = new ArrayList<>(ready);
        remaining.addAll(crossPartitionEnumerator.getEnumerators());
        if (remaining.isEmpty()) {
            return null;
        }
        remaining.sort(Comparator.comparing(OrderByQueryPartitionRangePageEnumerator::getFeedRange));
        final ContinuationProto.OrderByContinuation.Builder builder = ContinuationProto.OrderByContinuation.newBuilder();
        for (OrderByQueryPartitionRangePageEnumerator enumerator : remaining) {
            final ContinuationProto.OrderByRangeContinuation.Builder rangeBuilder = builder.addRangesBuilder()
                    .setRange(enumerator.getFeedRange().toProto());
            final QueryState state = enumerator.getResumeState();
            if (state != null) {
                rangeBuilder.setState(state.getBytes());
            }
            final OrderByResumeFilter resumeFilter = enumerator.getResumeFilter();
            if (resumeFilter != null) {
                rangeBuilder.addAllOrderByItems(resumeFilter.getOrderByItems())
                        .setRid(resumeFilter.getRid())
                        .setSkipCount(resumeFilter.getSkipCount());
                final String filter = OrderByFilters.resumeFilter(orderByExpressions, sortOrders, resumeFilter.getOrderByItems());
                if (filter != null) {
                    rangeBuilder.setFilter(filter);
                }
            }
        }
        if (frontier != null) {
            builder.addAllFrontierItems(frontier.getOrderByItems()).setFrontierRid(frontier.getRid());
        }
        return StageContinuations.wrap(ContinuationProto.StageKind.ORDER_BY, builder.build());
    }

    @Nonnull
    @Override
    public Executor getExecutor() {
        return crossPartitionEnumerator.getExecutor();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            ready.clear();
            crossPartitionEnumerator.close();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * A builder for {@link OrderByCrossPartitionQueryPipelineStage}.
     */
    public static class Builder {
        private DocumentContainer documentContainer;
        private SqlQuerySpec querySpec;
        @Nonnull
        private List<FeedRange> targetRanges = ImmutableList.of();
        @Nonnull
        private List<SortOrder> sortOrders = ImmutableList.of();
        @Nonnull
        private List<String> orderByExpressions = ImmutableList.of();
        @Nonnull
        private QueryPaginationOptions paginationOptions = QueryPaginationOptions.DEFAULT;
        private int maxConcurrency;
        @Nonnull
        private PrefetchPolicy prefetchPolicy = PrefetchPolicy.PREFETCH_SINGLE_PAGE;
        private Executor executor;
        @Nonnull
        private CancellationToken cancellation = CancellationToken.none();

        private Builder() {
        }

        @Nonnull
        public Builder setDocumentContainer(@Nonnull DocumentContainer documentContainer) {
            this.documentContainer = documentContainer;
            return this;
        }

        @Nonnull
        public Builder setQuerySpec(@Nonnull SqlQuerySpec querySpec) {
            this.querySpec = querySpec;
            return this;
        }

        @Nonnull
        public Builder setTargetRanges(@Nonnull List<FeedRange> targetRanges) {
            this.targetRanges = targetRanges;
            return this;
        }

        @Nonnull
        public Builder setOrderBy(@Nonnull List<SortOrder> sortOrders, @Nonnull List<String> orderByExpressions) {
            this.sortOrders = ImmutableList.copyOf(sortOrders);
            this.orderByExpressions = ImmutableList.copyOf(orderByExpressions);
            return this;
        }

        @Nonnull
        public Builder setPaginationOptions(@Nonnull QueryPaginationOptions paginationOptions) {
            this.paginationOptions = paginationOptions;
            return this;
        }

        @Nonnull
        public Builder setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        @Nonnull
        public Builder setPrefetchPolicy(@Nonnull PrefetchPolicy prefetchPolicy) {
            this.prefetchPolicy = prefetchPolicy;
            return this;
        }

        @Nonnull
        public Builder setExecutor(@Nonnull Executor executor) {
            this.executor = executor;
            return this;
        }

        @Nonnull
        public Builder setCancellation(@Nonnull CancellationToken cancellation) {
            this.cancellation = cancellation;
            return this;
        }

        /**
         * Build the stage, resuming from a continuation if one is given.
         * @param continuation continuation of this stage, or {@code null} to start from the beginning
         * @return the stage, or the reason the continuation could not be used
         */
        @Nonnull
        public Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nullable QueryState continuation) {
            final List<FeedRangeState> feedRangeStates = new ArrayList<>();
            final List<OrderByResumeFilter> resumeFilters = new ArrayList<>();
            OrderByResumeFilter frontier = null;
            if (continuation == null) {
                for (FeedRange range : targetRanges) {
                    feedRangeStates.add(new FeedRangeState(range, null));
                    resumeFilters.add(null);
                }
            } else {
                try {
                    frontier = decodeContinuation(continuation, feedRangeStates, resumeFilters);
                } catch (MalformedContinuationTokenException ex) {
                    return Result.failure(ex);
                }
            }
            return Result.success(new OrderByCrossPartitionQueryPipelineStage(this, feedRangeStates, resumeFilters, frontier));
        }

        @Nullable
        private OrderByResumeFilter decodeContinuation(@Nonnull QueryState continuation,
                                                       @Nonnull List<FeedRangeState> feedRangeStates,
                                                       @Nonnull List<OrderByResumeFilter> resumeFilters) {
            final ContinuationProto.OrderByContinuation proto = StageContinuations.unwrap(continuation,
                    ContinuationProto.StageKind.ORDER_BY, ContinuationProto.OrderByContinuation.parser());
            final List<FeedRange> ranges = new ArrayList<>(proto.getRangesCount());
            for (ContinuationProto.OrderByRangeContinuation rangeContinuation : proto.getRangesList()) {
                final FeedRange range = FeedRange.fromProto(rangeContinuation.getRange());
                ranges.add(range);
                feedRangeStates.add(new FeedRangeState(range,
                        StageContinuations.nested(rangeContinuation.hasState(), rangeContinuation.getState())));
                if (rangeContinuation.getOrderByItemsCount() == 0) {
                    resumeFilters.add(null);
                    continue;
                }
                checkKey(rangeContinuation.getOrderByItemsCount(), rangeContinuation.hasRid(), continuation);
                if (rangeContinuation.getSkipCount() < 0) {
                    throw new MalformedContinuationTokenException("order by continuation has a negative skip count",
                            LogMessageKeys.SKIP_COUNT, rangeContinuation.getSkipCount(),
                            LogMessageKeys.RAW_BYTES, continuation);
                }
                resumeFilters.add(new OrderByResumeFilter(rangeContinuation.getOrderByItemsList(),
                        rangeContinuation.getRid(), rangeContinuation.getSkipCount()));
            }
            ContinuationRanges.validate(ranges, targetRanges, continuation);
            if (proto.getFrontierItemsCount() == 0) {
                return null;
            }
            checkKey(proto.getFrontierItemsCount(), proto.hasFrontierRid(), continuation);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("resuming order by",
                        LogMessageKeys.RANGE_COUNT, ranges.size(),
                        LogMessageKeys.ORDER_BY_ITEMS, proto.getFrontierItemsList()));
            }
            return new OrderByResumeFilter(proto.getFrontierItemsList(), proto.getFrontierRid(), 0);
        }

        private void checkKey(int itemCount, boolean hasRid, @Nonnull QueryState continuation) {
            if (itemCount != sortOrders.size() || !hasRid) {
                throw new MalformedContinuationTokenException("order by continuation does not match the order by columns",
                        LogMessageKeys.COLUMN_COUNT, sortOrders.size(),
                        LogMessageKeys.ACTUAL, itemCount,
                        LogMessageKeys.RAW_BYTES, continuation);
            }
        }
    }
}
