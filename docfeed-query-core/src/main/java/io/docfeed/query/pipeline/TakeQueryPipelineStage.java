/*
 * TakeQueryPipelineStage.java
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

import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.StageAccessChecker;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage that returns at most a given number of rows, for {@code LIMIT} and {@code TOP}.
 *
 * <p>
 * Once the budget is used up the stage is exhausted without reading further from its inner stage, and the page that
 * used it up has no continuation. A budget of zero never reads from the inner stage at all.
 * </p>
 */
@API(API.Status.INTERNAL)
public class TakeQueryPipelineStage implements QueryPipelineStage {
    /**
     * The clause a take stage implements. Both behave the same; the flavor only shows in diagnostics.
     */
    public enum TakeType {
        LIMIT,
        TOP
    }

    @Nonnull
    private final QueryPipelineStage inner;
    @Nonnull
    private final TakeType takeType;
    private long takeRemaining;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    public TakeQueryPipelineStage(@Nonnull QueryPipelineStage inner, @Nonnull TakeType takeType, long takeRemaining) {
        this.inner = inner;
        this.takeType = takeType;
        this.takeRemaining = takeRemaining;
    }

    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreateLimitStage(long limit,
                                                                                       @Nullable QueryState continuation,
                                                                                       @Nonnull StageFactory innerFactory) {
        return monadicCreate(TakeType.LIMIT, limit, continuation, innerFactory);
    }

    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreateTopStage(long top,
                                                                                     @Nullable QueryState continuation,
                                                                                     @Nonnull StageFactory innerFactory) {
        return monadicCreate(TakeType.TOP, top, continuation, innerFactory);
    }

    @Nonnull
    private static Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nonnull TakeType takeType, long count,
                                                                              @Nullable QueryState continuation,
                                                                              @Nonnull StageFactory innerFactory) {
        if (continuation == null) {
            return innerFactory.create(null).map(inner -> new TakeQueryPipelineStage(inner, takeType, count));
        }
        final ContinuationProto.TakeContinuation proto;
        try {
            proto = StageContinuations.unwrap(continuation, ContinuationProto.StageKind.TAKE,
                    ContinuationProto.TakeContinuation.parser());
        } catch (MalformedContinuationTokenException ex) {
            return Result.failure(ex);
        }
        if (proto.getRemaining() <= 0 || proto.getRemaining() > count || !proto.hasInner()) {
            return Result.failure(new MalformedContinuationTokenException("invalid take continuation",
                    LogMessageKeys.TAKE_COUNT, proto.getRemaining(),
                    LogMessageKeys.EXPECTED, count,
                    LogMessageKeys.RAW_BYTES, continuation));
        }
        return innerFactory.create(QueryState.of(proto.getInner()))
                .map(inner -> new TakeQueryPipelineStage(inner, takeType, proto.getRemaining()));
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
        if (takeRemaining <= 0) {
            exhausted = true;
            current = null;
            return CompletableFuture.completedFuture(false);
        }
        return inner.moveNext(trace).thenApply(hasNext -> {
            if (!hasNext) {
                exhausted = true;
                current = null;
                return false;
            }
            current = inner.getCurrent().map(this::take);
            return true;
        });
    }

    @Nonnull
    private QueryPage take(@Nonnull QueryPage page) {
        final List<Value> documents = page.getDocuments();
        final int taken = (int)Math.min(takeRemaining, documents.size());
        takeRemaining -= taken;
        final QueryState state;
        if (takeRemaining == 0 || page.getState() == null) {
            takeRemaining = 0;
            state = null;
        } else {
            state = StageContinuations.wrap(ContinuationProto.StageKind.TAKE,
                    ContinuationProto.TakeContinuation.newBuilder()
                            .setRemaining(takeRemaining)
                            .setInner(page.getState().getBytes())
                            .build());
        }
        return page.withDocumentsAndState(documents.subList(0, taken), state);
    }

    @Nonnull
    public TakeType getTakeType() {
        return takeType;
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

    @Override
    public String toString() {
        return "TakeQueryPipelineStage{" + takeType + ", remaining=" + takeRemaining + "}";
    }
}
