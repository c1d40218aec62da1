/*
 * CatchAllQueryPipelineStageTest.java
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

import com.google.common.collect.ImmutableList;
import io.docfeed.query.LogAppenderRule;
import io.docfeed.query.QueryCancelledException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.item.Items;
import io.docfeed.query.util.Result;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import javax.annotation.Nonnull;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link CatchAllQueryPipelineStage}.
 */
public class CatchAllQueryPipelineStageTest {
    @RegisterExtension
    final LogAppenderRule logs = new LogAppenderRule("catchAllLogs", CatchAllQueryPipelineStage.class, Level.WARN);

    /**
     * A stage whose {@code moveNext} does whatever the test says.
     */
    private static final class MisbehavingStage implements QueryPipelineStage {
        @Nonnull
        private final Supplier<CompletableFuture<Boolean>> onMoveNext;
        private boolean closed;

        private MisbehavingStage(@Nonnull Supplier<CompletableFuture<Boolean>> onMoveNext) {
            this.onMoveNext = onMoveNext;
        }

        @Nonnull
        @Override
        public Result<QueryPage, QueryCoreException> getCurrent() {
            throw new IllegalStateException("no current page");
        }

        @Nonnull
        @Override
        public CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace) {
            return onMoveNext.get();
        }

        @Nonnull
        @Override
        public Executor getExecutor() {
            return ListQueryPipelineStage.DIRECT;
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public boolean isClosed() {
            return closed;
        }
    }

    @Nonnull
    private static QueryCoreException failureOf(@Nonnull QueryPipelineStage inner) {
        final QueryPipelineStage stage = new CatchAllQueryPipelineStage(inner);
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final Result<QueryPage, QueryCoreException> current = stage.getCurrent();
        assertFalse(current.isSuccess());
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
        stage.close();
        assertTrue(inner.isClosed());
        return current.getError();
    }

    @Test
    public void synchronousThrow() {
        final QueryCoreException failure = failureOf(new MisbehavingStage(() -> {
            throw new IllegalStateException("bug in a stage");
        }));
        assertThat(failure)
                .hasMessageContaining("unexpected failure in query pipeline")
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    public void exceptionalFuture() {
        final CompletableFuture<Boolean> future = new CompletableFuture<>();
        future.completeExceptionally(new CompletionException(new ArithmeticException("/ by zero")));
        final QueryCoreException failure = failureOf(new MisbehavingStage(() -> future));
        assertThat(failure.getCause()).isInstanceOf(ArithmeticException.class);
    }

    @Test
    public void queryCoreExceptionKeptAsIs() {
        final QueryCoreException thrown = new QueryCoreException("already reported");
        final QueryCoreException failure = failureOf(new MisbehavingStage(() -> {
            throw thrown;
        }));
        assertThat(failure).isSameAs(thrown);
    }

    @Test
    public void cancellation() {
        final CompletableFuture<Boolean> future = new CompletableFuture<>();
        future.cancel(false);
        final QueryCoreException failure = failureOf(new MisbehavingStage(() -> future));
        assertThat(failure).isInstanceOf(QueryCancelledException.class);
        assertThat(failure.getCause()).isInstanceOf(CancellationException.class);
    }

    @Test
    public void getCurrentThrowing() {
        final QueryCoreException failure = failureOf(new MisbehavingStage(() -> CompletableFuture.completedFuture(true)));
        assertThat(failure.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void failureIsLogged() {
        failureOf(new MisbehavingStage(() -> {
            throw new IllegalStateException("bug in a stage");
        }));
        assertThat(logs.getLogEvents()).hasSize(1);
        assertThat(logs.getLastLogEvent().getLevel()).isEqualTo(Level.WARN);
        assertThat(logs.getLastLogEventMessage()).startsWith("query pipeline failed");
    }

    @Test
    public void pagesPassThrough() {
        final QueryPage page = new QueryPage(ImmutableList.of(Items.number(1)), 1.0, "rows", null);
        final QueryPipelineStage stage = new CatchAllQueryPipelineStage(
                new ListQueryPipelineStage(ImmutableList.of(Result.success(page)), 0));
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertThat(stage.getCurrent().get()).isSameAs(page);
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
        assertThat(logs.getLogEvents()).isEmpty();
    }
}
