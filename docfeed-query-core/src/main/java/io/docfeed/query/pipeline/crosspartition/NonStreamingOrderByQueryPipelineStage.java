/*
 * NonStreamingOrderByQueryPipelineStage.java
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

import com.apple.foundationdb.async.AsyncUtil;
import com.google.common.collect.MinMaxPriorityQueue;
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
import io.docfeed.query.pagination.PartitionRangePageEnumerator;
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
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The source stage for {@code ORDER BY} queries whose ranges cannot return sorted rows: reads everything, sorts it,
 * then returns it a page at a time.
 *
 * <p>
 * Every page of every range is fetched exactly once, with all ranges prefetched, before the first page is returned,
 * and that page carries the charge of all of them. A failed fetch is returned as the current failure and retried by
 * the next {@link #moveNext}. When the rows the query can return are bounded, e.g. by {@code TOP k}, only the best
 * {@code k} rows are kept. The continuation is the number of rows already returned; resuming reads and sorts
 * everything again and skips that many rows.
 * </p>
 */
@API(API.Status.INTERNAL)
public class NonStreamingOrderByQueryPipelineStage implements QueryPipelineStage {
    private static final Logger LOGGER = LoggerFactory.getLogger(NonStreamingOrderByQueryPipelineStage.class);

    @Nonnull
    private final CrossPartitionRangePageEnumerator<PartitionRangePageEnumerator> crossPartitionEnumerator;
    @Nonnull
    private final OrderByQueryResultComparator comparator;
    @Nonnull
    private final Collection<OrderByQueryResult> collected;
    private final int pageSize;

    @Nullable
    private List<OrderByQueryResult> sorted;
    private long emitted;
    // charge of the fetches made since the last page returned
    private double pendingCharge;
    private boolean lastPageReturned;
    @Nonnull
    private String lastActivityId = "";
    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    private NonStreamingOrderByQueryPipelineStage(@Nonnull CrossPartitionRangePageEnumerator<PartitionRangePageEnumerator> crossPartitionEnumerator,
                                                  @Nonnull OrderByQueryResultComparator comparator,
                                                  @Nullable Long maxRetained,
                                                  int pageSize,
                                                  long emitted) {
        this.crossPartitionEnumerator = crossPartitionEnumerator;
        this.comparator = comparator;
        if (maxRetained != null) {
            this.collected = MinMaxPriorityQueue.orderedBy(comparator)
                    .maximumSize((int)Math.min(Integer.MAX_VALUE, Math.max(1L, maxRetained)))
                    .create();
        } else {
            this.collected = new ArrayList<>();
        }
        this.pageSize = pageSize;
        this.emitted = emitted;
    }

    /**
     * Create the stage.
     *
     * @param documentContainer the backend
     * @param querySpec the rewritten order-by query
     * @param targetRanges the ranges to read
     * @param sortOrders direction of each order-by column
     * @param maxRetained the number of best rows to keep, or {@code null} to keep all of them
     * @param paginationOptions page size and headers of each fetch
     * @param maxConcurrency maximum number of fetches in flight
     * @param executor executor for asynchronous steps
     * @param cancellation cancellation of the query
     * @param continuation continuation of this stage, or {@code null} to start from the beginning
     * @return the stage, or the reason the continuation could not be used
     */
    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nonnull DocumentContainer documentContainer,
                                                                             @Nonnull SqlQuerySpec querySpec,
                                                                             @Nonnull List<FeedRange> targetRanges,
                                                                             @Nonnull List<SortOrder> sortOrders,
                                                                             @Nullable Long maxRetained,
                                                                             @Nonnull QueryPaginationOptions paginationOptions,
                                                                             int maxConcurrency,
                                                                             @Nonnull Executor executor,
                                                                             @Nonnull CancellationToken cancellation,
                                                                             @Nullable QueryState continuation) {
        long emitted = 0L;
        if (continuation != null) {
            final ContinuationProto.NonStreamingOrderByContinuation proto;
            try {
                proto = StageContinuations.unwrap(continuation, ContinuationProto.StageKind.NON_STREAMING_ORDER_BY,
                        ContinuationProto.NonStreamingOrderByContinuation.parser());
            } catch (MalformedContinuationTokenException ex) {
                return Result.failure(ex);
            }
            if (proto.getEmitted() < 0 || (maxRetained != null && proto.getEmitted() > maxRetained)) {
                return Result.failure(new MalformedContinuationTokenException("invalid non-streaming order by continuation",
                        LogMessageKeys.SKIP_COUNT, proto.getEmitted(),
                        LogMessageKeys.RAW_BYTES, continuation));
            }
            emitted = proto.getEmitted();
        }
        final SqlQuerySpec formatted = OrderByFilters.format(querySpec, null);
        final FetchLimiter limiter = new FetchLimiter(maxConcurrency, cancellation);
        final List<PartitionRangePageEnumerator> enumerators = new ArrayList<>(targetRanges.size());
        for (FeedRange range : targetRanges) {
            enumerators.add(new PartitionRangePageEnumerator(documentContainer, formatted, new FeedRangeState(range, null),
                    paginationOptions, limiter, cancellation));
        }
        final CrossPartitionRangePageEnumerator.ChildEnumeratorFactory<PartitionRangePageEnumerator> childFactory =
                new CrossPartitionRangePageEnumerator.ChildEnumeratorFactory<>() {
                    @Nonnull
                    @Override
                    public PartitionRangePageEnumerator createForSplit(@Nonnull PartitionRangePageEnumerator parent, @Nonnull FeedRange childRange) {
                        return new PartitionRangePageEnumerator(documentContainer, formatted,
                                new FeedRangeState(childRange, parent.getFeedRangeState().getState()),
                                paginationOptions, limiter, cancellation);
                    }

                    @Nonnull
                    @Override
                    public PartitionRangePageEnumerator createForMerge(@Nonnull List<PartitionRangePageEnumerator> parents, @Nonnull FeedRange mergedRange) {
                        return new PartitionRangePageEnumerator(documentContainer, formatted,
                                new FeedRangeState(mergedRange, CrossPartitionRangePageEnumerator.lowestState(parents)),
                                paginationOptions, limiter, cancellation);
                    }
                };
        final CrossPartitionRangePageEnumerator<PartitionRangePageEnumerator> crossPartitionEnumerator =
                new CrossPartitionRangePageEnumerator<>(documentContainer, enumerators,
                        Comparator.comparing(PartitionRangePageEnumerator::getFeedRange),
                        childFactory, null, limiter, PrefetchPolicy.PREFETCH_ALL, true, cancellation, executor);
        return Result.success(new NonStreamingOrderByQueryPipelineStage(crossPartitionEnumerator,
                new OrderByQueryResultComparator(sortOrders), maxRetained, paginationOptions.getPageSizeLimit(), emitted));
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
        if (sorted != null) {
            return CompletableFuture.completedFuture(emitRows());
        }
        return AsyncUtil.whileTrue(() -> crossPartitionEnumerator.moveNext(trace).thenApply(hasNext -> {
            if (!hasNext) {
                sort();
                return false;
            }
            final Result<CrossFeedRangePage<PartitionRangePageEnumerator>, QueryCoreException> result = crossPartitionEnumerator.getCurrent();
            if (!result.isSuccess()) {
                current = Result.failure(result.getError());
                return false;
            }
            final QueryPage page = result.getValue().getPage();
            final FeedRange range = result.getValue().getSource().getFeedRange();
            try {
                for (Value document : page.getDocuments()) {
                    collected.add(OrderByQueryResult.parse(document, comparator.getColumnCount(), range));
                }
            } catch (QueryCoreException ex) {
                current = Result.failure(ex);
                return false;
            }
            pendingCharge += page.getRequestCharge();
            lastActivityId = page.getActivityId();
            return true;
        }), getExecutor()).thenApply(vignore -> sorted == null || emitRows());
    }

    private void sort() {
        final List<OrderByQueryResult> rows = new ArrayList<>(collected);
        rows.sort(comparator);
        collected.clear();
        sorted = rows;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("sorted order by rows",
                    LogMessageKeys.DOCUMENT_COUNT, rows.size(),
                    LogMessageKeys.SKIP_COUNT, emitted));
        }
    }

    private boolean emitRows() {
        final List<OrderByQueryResult> rows = sorted;
        if (rows == null || lastPageReturned) {
            exhausted = true;
            current = null;
            return false;
        }
        final int from = (int)Math.min(emitted, rows.size());
        final int to = Math.min(rows.size(), from + pageSize);
        final List<Value> documents = new ArrayList<>(to - from);
        for (OrderByQueryResult row : rows.subList(from, to)) {
            documents.add(row.getPayload());
        }
        emitted = to;
        lastPageReturned = to == rows.size();
        current = Result.success(new QueryPage(documents, pendingCharge, lastActivityId, lastPageReturned ? null : continuation(to)));
        pendingCharge = 0.0;
        return true;
    }

    @Nonnull
    private static QueryState continuation(long emitted) {
        return StageContinuations.wrap(ContinuationProto.StageKind.NON_STREAMING_ORDER_BY,
                ContinuationProto.NonStreamingOrderByContinuation.newBuilder().setEmitted(emitted).build());
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
            collected.clear();
            crossPartitionEnumerator.close();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
