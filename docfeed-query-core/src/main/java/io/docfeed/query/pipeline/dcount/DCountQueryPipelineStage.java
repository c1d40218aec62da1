/*
 * DCountQueryPipelineStage.java
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

package io.docfeed.query.pipeline.dcount;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
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
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.pipeline.StageFactory;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage that counts the rows of its inner stage, for {@code COUNT(DISTINCT ...)}.
 *
 * <p>
 * Inner pages are answered with empty pages. The last page holds the count, either as a bare number or as an object
 * with the count under the given alias.
 * </p>
 */
@API(API.Status.INTERNAL)
public class DCountQueryPipelineStage implements QueryPipelineStage {
    @Nonnull
    private final QueryPipelineStage inner;
    @Nullable
    private final String alias;
    private long count;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean resultReturned;
    private boolean exhausted;
    private boolean closed;

    public DCountQueryPipelineStage(@Nonnull QueryPipelineStage inner, @Nullable String alias, long count) {
        this.inner = inner;
        this.alias = alias;
        this.count = count;
    }

    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nullable String alias,
                                                                             @Nullable QueryState continuation,
                                                                             @Nonnull StageFactory innerFactory) {
        if (continuation == null) {
            return innerFactory.create(null).map(inner -> new DCountQueryPipelineStage(inner, alias, 0L));
        }
        final ContinuationProto.DCountContinuation proto;
        try {
            proto = StageContinuations.unwrap(continuation, ContinuationProto.StageKind.DCOUNT,
                    ContinuationProto.DCountContinuation.parser());
        } catch (MalformedContinuationTokenException ex) {
            return Result.failure(ex);
        }
        if (proto.getCount() < 0 || !proto.hasInner()) {
            return Result.failure(new MalformedContinuationTokenException("invalid distinct count continuation",
                    LogMessageKeys.DOCUMENT_COUNT, proto.getCount(),
                    LogMessageKeys.RAW_BYTES, continuation));
        }
        return innerFactory.create(QueryState.of(proto.getInner()))
                .map(inner -> new DCountQueryPipelineStage(inner, alias, proto.getCount()));
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
                returnCount(0.0, "");
                return true;
            }
            final Result<QueryPage, QueryCoreException> innerResult = inner.getCurrent();
            if (!innerResult.isSuccess()) {
                current = innerResult;
                return true;
            }
            final QueryPage page = innerResult.getValue();
            count += page.getDocuments().size();
            if (page.getState() == null) {
                returnCount(page.getRequestCharge(), page.getActivityId());
            } else {
                current = Result.success(QueryPage.empty(page.getRequestCharge(), page.getActivityId(),
                        StageContinuations.wrap(ContinuationProto.StageKind.DCOUNT,
                                ContinuationProto.DCountContinuation.newBuilder()
                                        .setCount(count)
                                        .setInner(page.getState().getBytes())
                                        .build())));
            }
            return true;
        });
    }

    private void returnCount(double requestCharge, @Nonnull String activityId) {
        final Value number = Items.number(count);
        final Value result = alias == null ? number : Items.struct(ImmutableMap.of(alias, number));
        current = Result.success(new QueryPage(ImmutableList.of(result), requestCharge, activityId, null));
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
