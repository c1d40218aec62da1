/*
 * DistinctQueryPipelineStage.java
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

package io.docfeed.query.pipeline.distinct;

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
import io.docfeed.query.pipeline.DistinctQueryType;
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.pipeline.StageFactory;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage that drops rows equal to a row it has already returned, for {@code DISTINCT}.
 */
@API(API.Status.INTERNAL)
public class DistinctQueryPipelineStage implements QueryPipelineStage {
    @Nonnull
    private final QueryPipelineStage inner;
    @Nonnull
    private final DistinctMap distinctMap;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    public DistinctQueryPipelineStage(@Nonnull QueryPipelineStage inner, @Nonnull DistinctMap distinctMap) {
        this.inner = inner;
        this.distinctMap = distinctMap;
    }

    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nonnull DistinctQueryType distinctType,
                                                                             @Nullable QueryState continuation,
                                                                             @Nonnull StageFactory innerFactory) {
        final DistinctMap distinctMap;
        final QueryState innerContinuation;
        try {
            if (continuation == null) {
                distinctMap = DistinctMap.create(distinctType, null);
                innerContinuation = null;
            } else {
                final ContinuationProto.DistinctContinuation proto = StageContinuations.unwrap(continuation,
                        ContinuationProto.StageKind.DISTINCT, ContinuationProto.DistinctContinuation.parser());
                if (!proto.hasInner()) {
                    throw new MalformedContinuationTokenException("distinct continuation has no inner continuation",
                            LogMessageKeys.RAW_BYTES, continuation);
                }
                distinctMap = DistinctMap.create(distinctType, proto);
                innerContinuation = QueryState.of(proto.getInner());
            }
        } catch (MalformedContinuationTokenException ex) {
            return Result.failure(ex);
        }
        return innerFactory.create(innerContinuation).map(inner -> new DistinctQueryPipelineStage(inner, distinctMap));
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
            current = inner.getCurrent().map(this::distinct);
            return true;
        });
    }

    @Nonnull
    private QueryPage distinct(@Nonnull QueryPage page) {
        final List<Value> documents = new ArrayList<>(page.getDocuments().size());
        for (Value document : page.getDocuments()) {
            if (distinctMap.add(document)) {
                documents.add(document);
            }
        }
        QueryState state = null;
        if (page.getState() != null) {
            final ContinuationProto.DistinctContinuation.Builder builder = ContinuationProto.DistinctContinuation.newBuilder()
                    .setInner(page.getState().getBytes());
            distinctMap.save(builder);
            state = StageContinuations.wrap(ContinuationProto.StageKind.DISTINCT, builder.build());
        }
        return page.withDocumentsAndState(documents, state);
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
