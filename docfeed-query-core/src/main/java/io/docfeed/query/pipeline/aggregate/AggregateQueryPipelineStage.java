/*
 * AggregateQueryPipelineStage.java
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

package io.docfeed.query.pipeline.aggregate;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.StageAccessChecker;
import io.docfeed.query.item.Items;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pipeline.QueryInfo;
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.pipeline.StageFactory;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage that aggregates the whole result of a query without {@code GROUP BY} into a single row.
 *
 * <p>
 * Every inner page is folded into a {@link SingleGroupAggregator} and answered with an empty page whose continuation
 * holds the aggregator state and the inner continuation. Once the inner stage is done, one page with the result and
 * no continuation follows. A {@code SELECT VALUE} aggregate without a value gives a page with no rows.
 * </p>
 */
@API(API.Status.INTERNAL)
public class AggregateQueryPipelineStage implements QueryPipelineStage {
    @Nonnull
    private final QueryPipelineStage inner;
    @Nonnull
    private final SingleGroupAggregator aggregator;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean resultReturned;
    private boolean exhausted;
    private boolean closed;

    public AggregateQueryPipelineStage(@Nonnull QueryPipelineStage inner, @Nonnull SingleGroupAggregator aggregator) {
        this.inner = inner;
        this.aggregator = aggregator;
    }

    /**
     * Create the stage, resuming from a continuation if one is given.
     * @param queryInfo the query plan, describing the aggregates
     * @param continuation continuation of this stage, or {@code null} to start from the beginning
     * @param innerFactory creates the stage whose rows are aggregated
     * @return the stage, or the reason it could not be built
     */
    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nonnull QueryInfo queryInfo,
                                                                             @Nullable QueryState continuation,
                                                                             @Nonnull StageFactory innerFactory) {
        final SingleGroupAggregator aggregator;
        final QueryState innerContinuation;
        try {
            if (continuation == null) {
                aggregator = SingleGroupAggregator.create(queryInfo, null);
                innerContinuation = null;
            } else {
                final ContinuationProto.AggregateContinuation proto = StageContinuations.unwrap(continuation,
                        ContinuationProto.StageKind.AGGREGATE, ContinuationProto.AggregateContinuation.parser());
                if (!proto.hasInner()) {
                    throw new MalformedContinuationTokenException("aggregate continuation has no inner continuation",
                            LogMessageKeys.RAW_BYTES, continuation);
                }
                aggregator = SingleGroupAggregator.create(queryInfo, proto.getAggregator());
                innerContinuation = QueryState.of(proto.getInner());
            }
        } catch (MalformedContinuationTokenException ex) {
            return Result.failure(ex);
        }
        return innerFactory.create(innerContinuation).map(inner -> new AggregateQueryPipelineStage(inner, aggregator));
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
        if (resultReturned) {
            exhausted = true;
            current = null;
            return CompletableFuture.completedFuture(false);
        }
        return inner.moveNext(trace).thenApply(hasNext -> {
            if (!hasNext) {
                returnResult(0.0, "");
                return true;
            }
            final Result<QueryPage, QueryCoreException> innerResult = inner.getCurrent();
            if (!innerResult.isSuccess()) {
                current = innerResult;
                return true;
            }
            final QueryPage page = innerResult.getValue();
            try {
                for (Value document : page.getDocuments()) {
                    aggregator.addValues(document);
                }
            } catch (QueryCoreException ex) {
                current = Result.failure(ex);
                return true;
            }
            if (page.getState() == null) {
                returnResult(page.getRequestCharge(), page.getActivityId());
            } else {
                current = Result.success(QueryPage.empty(page.getRequestCharge(), page.getActivityId(),
                        StageContinuations.wrap(ContinuationProto.StageKind.AGGREGATE,
                                ContinuationProto.AggregateContinuation.newBuilder()
                                        .setAggregator(aggregator.toProto())
                                        .setInner(page.getState().getBytes())
                                        .build())));
            }
            return true;
        });
    }

    private void returnResult(double requestCharge, @Nonnull String activityId) {
        final Value result = aggregator.getResult();
        final List<Value> documents = Items.isUndefined(result) ? ImmutableList.of() : ImmutableList.of(result);
        current = Result.success(new QueryPage(documents, requestCharge, activityId, null));
        resultReturned = true;
    }

    @Nonnull
    @Override
    public Executor getExecutor() {
        return inner.getExecutor();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            inner.close();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
