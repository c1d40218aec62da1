/*
 * SkipQueryPipelineStage.java
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
 * A stage that drops a given number of initial rows, for {@code OFFSET}.
 * An inner page may be partly dropped; pages after the offset pass through unchanged.
 */
@API(API.Status.INTERNAL)
public class SkipQueryPipelineStage implements QueryPipelineStage {
    @Nonnull
    private final QueryPipelineStage inner;
    private long skipRemaining;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    public SkipQueryPipelineStage(@Nonnull QueryPipelineStage inner, long skipRemaining) {
        this.inner = inner;
        this.skipRemaining = skipRemaining;
    }

    /**
     * Create a skip stage, resuming from a continuation if one is given.
     *
     * @param offset the number of rows to skip from the start of the query
     * @param continuation the stage's continuation, or {@code null} to start from the beginning
     * @param innerFactory creates the stage whose rows are skipped
     * @return the stage, or the reason it could not be built
     */
    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreate(long offset,
                                                                             @Nullable QueryState continuation,
                                                                             @Nonnull StageFactory innerFactory) {
        if (continuation == null) {
            return innerFactory.create(null).map(inner -> new SkipQueryPipelineStage(inner, offset));
        }
        final ContinuationProto.SkipContinuation proto;
        try {
            proto = StageContinuations.unwrap(continuation, ContinuationProto.StageKind.SKIP,
                    ContinuationProto.SkipContinuation.parser());
        } catch (MalformedContinuationTokenException ex) {
            return Result.failure(ex);
        }
        if (proto.getRemaining() < 0 || proto.getRemaining() > offset || !proto.hasInner()) {
            return Result.failure(new MalformedContinuationTokenException("invalid skip continuation",
                    LogMessageKeys.SKIP_COUNT, proto.getRemaining(),
                    LogMessageKeys.RAW_BYTES, continuation));
        }
        return innerFactory.create(QueryState.of(proto.getInner()))
                .map(inner -> new SkipQueryPipelineStage(inner, proto.getRemaining()));
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
        return inner.moveNext(trace).thenApply(hasNext -> {
            if (!hasNext) {
                exhausted = true;
                current = null;
                return false;
            }
            final Result<QueryPage, QueryCoreException> innerResult = inner.getCurrent();
            current = innerResult.map(this::skip);
            return true;
        });
    }

    @Nonnull
    private QueryPage skip(@Nonnull QueryPage page) {
        final List<Value> documents = page.getDocuments();
        final int skipped = (int)Math.min(skipRemaining, documents.size());
        skipRemaining -= skipped;
        final QueryState state;
        if (page.getState() == null) {
            state = null;
        } else {
            state = StageContinuations.wrap(ContinuationProto.StageKind.SKIP,
                    ContinuationProto.SkipContinuation.newBuilder()
                            .setRemaining(skipRemaining)
                            .setInner(page.getState().getBytes())
                            .build());
        }
        return page.withDocumentsAndState(documents.subList(skipped, documents.size()), state);
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
