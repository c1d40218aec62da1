/*
 * CatchAllQueryPipelineStage.java
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

import io.docfeed.annotation.API;
import io.docfeed.query.QueryCancelledException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.StageAccessChecker;
import io.docfeed.query.logging.KeyValueLogMessage;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * The outermost stage, which turns anything thrown inside the pipeline into a failure result.
 *
 * <p>
 * Exceptions thrown while starting {@code moveNext}, exceptional completion of its future and exceptions from
 * {@code getCurrent} all become the current failure. The pipeline cannot be trusted after that, so the next
 * {@code moveNext} reports exhaustion.
 * </p>
 */
@API(API.Status.INTERNAL)
public class CatchAllQueryPipelineStage implements QueryPipelineStage {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatchAllQueryPipelineStage.class);

    @Nonnull
    private final QueryPipelineStage inner;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean caughtException;
    private boolean exhausted;
    private boolean closed;

    public CatchAllQueryPipelineStage(@Nonnull QueryPipelineStage inner) {
        this.inner = inner;
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
        if (caughtException) {
            exhausted = true;
            current = null;
            return CompletableFuture.completedFuture(false);
        }
        final CompletableFuture<Boolean> innerMoveNext;
        try {
            innerMoveNext = inner.moveNext(trace);
        } catch (RuntimeException ex) {
            catchException(ex);
            return CompletableFuture.completedFuture(true);
        }
        return innerMoveNext.handle((hasNext, err) -> {
            if (err != null) {
                catchException(err);
                return true;
            }
            if (!hasNext) {
                exhausted = true;
                current = null;
                return false;
            }
            try {
                current = inner.getCurrent();
            } catch (RuntimeException ex) {
                catchException(ex);
            }
            return true;
        });
    }

    private void catchException(@Nonnull Throwable err) {
        final QueryCoreException failure = toQueryCoreException(err);
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn(KeyValueLogMessage.of("query pipeline failed",
                    LogMessageKeys.EXCEPTION_CLASS, failure.getClass().getSimpleName(),
                    LogMessageKeys.MESSAGE, failure.getMessage()), failure);
        }
        caughtException = true;
        current = Result.failure(failure);
    }

    /**
     * Convert anything thrown by a stage into the exception reported to the caller.
     * @param err the exception
     * @return {@code err} itself if it is a {@link QueryCoreException}, otherwise a wrapper around it
     */
    @Nonnull
    public static QueryCoreException toQueryCoreException(@Nonnull Throwable err) {
        Throwable cause = err;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof QueryCoreException) {
            return (QueryCoreException)cause;
        }
        if (cause instanceof CancellationException) {
            return new QueryCancelledException("query was cancelled", cause);
        }
        return new QueryCoreException("unexpected failure in query pipeline", cause);
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
