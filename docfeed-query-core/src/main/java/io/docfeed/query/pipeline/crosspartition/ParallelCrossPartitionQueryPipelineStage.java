/*
 * ParallelCrossPartitionQueryPipelineStage.java
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
import io.docfeed.query.pagination.CrossFeedRangePage;
import io.docfeed.query.pagination.CrossPartitionRangePageEnumerator;
import io.docfeed.query.pagination.DocumentContainer;
import io.docfeed.query.pagination.FeedRange;
import io.docfeed.query.pagination.FeedRangeState;
import io.docfeed.query.pagination.FetchLimiter;
import io.docfeed.query.pagination.PartitionRangePageEnumerator;
import io.docfeed.query.pagination.PrefetchPolicy;
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The source stage for queries without {@code ORDER BY}: pages from all feed ranges, unchanged, one range after another.
 *
 * <p>
 * Rows keep their order within a range, and there is no order across ranges. The continuation lists every range that
 * still has rows, with its state if it has started; a range that is not listed is finished. A failed fetch is
 * reported as the current failure and retried by the next {@link #moveNext}.
 * </p>
 */
@API(API.Status.INTERNAL)
public class ParallelCrossPartitionQueryPipelineStage implements QueryPipelineStage {
    @Nonnull
    private final CrossPartitionRangePageEnumerator<PartitionRangePageEnumerator> crossPartitionEnumerator;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    private ParallelCrossPartitionQueryPipelineStage(@Nonnull CrossPartitionRangePageEnumerator<PartitionRangePageEnumerator> crossPartitionEnumerator) {
        this.crossPartitionEnumerator = crossPartitionEnumerator;
    }

    /**
     * Create the stage.
     *
     * @param documentContainer the backend
     * @param querySpec the query sent to each range
     * @param targetRanges the ranges to read when starting from the beginning
     * @param paginationOptions page size and headers of each fetch
     * @param maxConcurrency maximum number of fetches in flight
     * @param prefetchPolicy how eagerly to fetch ranges other than the one being read
     * @param executor executor for asynchronous steps
     * @param cancellation cancellation of the query
     * @param continuation continuation of this stage, or {@code null} to start from the beginning
     * @return the stage, or the reason the continuation could not be used
     */
    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nonnull DocumentContainer documentContainer,
                                                                             @Nonnull SqlQuerySpec querySpec,
                                                                             @Nonnull List<FeedRange> targetRanges,
                                                                             @Nonnull QueryPaginationOptions paginationOptions,
                                                                             int maxConcurrency,
                                                                             @Nonnull PrefetchPolicy prefetchPolicy,
                                                                             @Nonnull Executor executor,
                                                                             @Nonnull CancellationToken cancellation,
                                                                             @Nullable QueryState continuation) {
        final List<FeedRangeState> feedRangeStates;
        try {
            feedRangeStates = decodeContinuation(targetRanges, continuation);
        } catch (MalformedContinuationTokenException ex) {
            return Result.failure(ex);
        }
        final FetchLimiter limiter = new FetchLimiter(maxConcurrency, cancellation);
        final List<PartitionRangePageEnumerator> enumerators = new ArrayList<>(feedRangeStates.size());
        for (FeedRangeState feedRangeState : feedRangeStates) {
            enumerators.add(new PartitionRangePageEnumerator(documentContainer, querySpec, feedRangeState,
                    paginationOptions, limiter, cancellation));
        }
        final CrossPartitionRangePageEnumerator.ChildEnumeratorFactory<PartitionRangePageEnumerator> childFactory =
                new CrossPartitionRangePageEnumerator.ChildEnumeratorFactory<>() {
                    @Nonnull
                    @Override
                    public PartitionRangePageEnumerator createForSplit(@Nonnull PartitionRangePageEnumerator parent, @Nonnull FeedRange childRange) {
                        return new PartitionRangePageEnumerator(documentContainer, querySpec,
                                new FeedRangeState(childRange, parent.getFeedRangeState().getState()),
                                paginationOptions, limiter, cancellation);
                    }

                    @Nonnull
                    @Override
                    public PartitionRangePageEnumerator createForMerge(@Nonnull List<PartitionRangePageEnumerator> parents, @Nonnull FeedRange mergedRange) {
                        return new PartitionRangePageEnumerator(documentContainer, querySpec,
                                new FeedRangeState(mergedRange, CrossPartitionRangePageEnumerator.lowestState(parents)),
                                paginationOptions, limiter, cancellation);
                    }
                };
        return Result.success(new ParallelCrossPartitionQueryPipelineStage(
                new CrossPartitionRangePageEnumerator<>(documentContainer, enumerators,
                        Comparator.comparing(PartitionRangePageEnumerator::getFeedRange),
                        childFactory, null, limiter, prefetchPolicy, true, cancellation, executor)));
    }

    @Nonnull
    private static List<FeedRangeState> decodeContinuation(@Nonnull List<FeedRange> targetRanges,
                                                           @Nullable QueryState continuation) {
        final List<FeedRangeState> feedRangeStates = new ArrayList<>();
        if (continuation == null) {
            for (FeedRange range : targetRanges) {
                feedRangeStates.add(new FeedRangeState(range, null));
            }
            return feedRangeStates;
        }
        final ContinuationProto.ParallelContinuation proto = StageContinuations.unwrap(continuation,
                ContinuationProto.StageKind.PARALLEL, ContinuationProto.ParallelContinuation.parser());
        final List<FeedRange> ranges = new ArrayList<>(proto.getRangesCount());
        for (ContinuationProto.RangeContinuation rangeContinuation : proto.getRangesList()) {
            final FeedRange range = FeedRange.fromProto(rangeContinuation.getRange());
            ranges.add(range);
            feedRangeStates.add(new FeedRangeState(range,
                    StageContinuations.nested(rangeContinuation.hasState(), rangeContinuation.getState())));
        }
        ContinuationRanges.validate(ranges, targetRanges, continuation);
        return feedRangeStates;
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
        return crossPartitionEnumerator.moveNext(trace).thenApply(hasNext -> {
            if (!hasNext) {
                exhausted = true;
                current = null;
                return false;
            }
            final Result<CrossFeedRangePage<PartitionRangePageEnumerator>, QueryCoreException> result = crossPartitionEnumerator.getCurrent();
            current = result.map(crossFeedRangePage -> crossFeedRangePage.getPage().withState(continuation()));
            return true;
        });
    }

    @Nullable
    private QueryState continuation() {
        final List<PartitionRangePageEnumerator> remaining = crossPartitionEnumerator.getEnumerators();
        if (remaining.isEmpty()) {
            return null;
        }
        final ContinuationProto.ParallelContinuation.Builder builder = ContinuationProto.ParallelContinuation.newBuilder();
        for (PartitionRangePageEnumerator enumerator : remaining) {
            final ContinuationProto.RangeContinuation.Builder rangeBuilder = builder.addRangesBuilder()
                    .setRange(enumerator.getFeedRange().toProto());
            final QueryState state = enumerator.getFeedRangeState().getState();
            if (state != null) {
                rangeBuilder.setState(state.getBytes());
            }
        }
        return StageContinuations.wrap(ContinuationProto.StageKind.PARALLEL, builder.build());
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
            crossPartitionEnumerator.close();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
