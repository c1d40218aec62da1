/*
 * SkipEmptyPageQueryPipelineStageTest.java
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
import io.docfeed.query.BackendRequestException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.item.Items;
import io.docfeed.query.util.Result;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SkipEmptyPageQueryPipelineStage}.
 */
public class SkipEmptyPageQueryPipelineStageTest {
    @Nonnull
    private static List<Result<QueryPage, QueryCoreException>> emptyPages(int count) {
        final List<Result<QueryPage, QueryCoreException>> results = new ArrayList<>(count + 1);
        for (int i = 0; i < count; i++) {
            results.add(Result.success(QueryPage.empty(1.0, "empty-" + i, ListQueryPipelineStage.stateAt(i + 1))));
        }
        return results;
    }

    @Nonnull
    private static QueryPipelineStage skipEmpty(@Nonnull List<Result<QueryPage, QueryCoreException>> results) {
        return new SkipEmptyPageQueryPipelineStage(new ListQueryPipelineStage(results, 0));
    }

    @Test
    public void emptyPageStormThenFailure() {
        final List<Result<QueryPage, QueryCoreException>> results = emptyPages(2000);
        final BackendRequestException throttled = new BackendRequestException("request rate is too large",
                BackendRequestException.TOO_MANY_REQUESTS, 3200, Duration.ofMillis(50));
        results.add(Result.failure(throttled));

        final QueryPipelineStage stage = skipEmpty(results);
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final Result<QueryPage, QueryCoreException> current = stage.getCurrent();
        assertFalse(current.isSuccess());
        assertThat(current.getError()).isSameAs(throttled);
        assertTrue(((BackendRequestException)current.getError()).isThrottled());
    }

    @Test
    public void emptyPageStormThenRows() {
        final List<Result<QueryPage, QueryCoreException>> results = emptyPages(2000);
        results.add(Result.success(new QueryPage(ImmutableList.of(Items.number(1), Items.number(2)), 1.0, "rows", null)));

        final QueryPipelineStage stage = skipEmpty(results);
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final QueryPage page = stage.getCurrent().get();
        assertEquals(2, page.getDocuments().size());
        assertEquals(2001.0, page.getRequestCharge(), 1e-9);
        assertEquals("rows", page.getActivityId());
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
    }

    @Test
    public void chargeOfTrailingEmptyPagesIsReturned() {
        final List<Result<QueryPage, QueryCoreException>> results = new ArrayList<>();
        results.add(Result.success(new QueryPage(ImmutableList.of(Items.number(1)), 1.0, "rows", ListQueryPipelineStage.stateAt(1))));
        results.add(Result.success(QueryPage.empty(2.5, "empty", ListQueryPipelineStage.stateAt(2))));

        final QueryPipelineStage stage = skipEmpty(results);
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertEquals(1, stage.getCurrent().get().getDocuments().size());
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final QueryPage last = stage.getCurrent().get();
        assertTrue(last.isEmpty());
        assertNull(last.getState());
        assertEquals(2.5, last.getRequestCharge(), 1e-9);
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
    }

    @Test
    public void noTrailingPageWithoutPendingCharge() {
        final List<Result<QueryPage, QueryCoreException>> results = new ArrayList<>();
        results.add(Result.success(new QueryPage(ImmutableList.of(Items.number(1)), 1.0, "rows", ListQueryPipelineStage.stateAt(1))));

        final QueryPipelineStage stage = skipEmpty(results);
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
    }

    @Test
    public void finalEmptyPageWithoutChargeIsDropped() {
        final List<Result<QueryPage, QueryCoreException>> results = new ArrayList<>();
        results.add(Result.success(new QueryPage(ImmutableList.of(Items.number(1)), 1.0, "rows-1", ListQueryPipelineStage.stateAt(1))));
        results.add(Result.success(new QueryPage(ImmutableList.of(Items.number(2)), 1.0, "rows-2", ListQueryPipelineStage.stateAt(2))));
        results.add(Result.success(QueryPage.empty(0.0, "last", null)));

        final QueryPipelineStage stage = skipEmpty(results);
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertEquals(ImmutableList.of(Items.number(1)), stage.getCurrent().get().getDocuments());
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertEquals(ImmutableList.of(Items.number(2)), stage.getCurrent().get().getDocuments());
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
    }

    @Test
    public void finalEmptyPageKeepsPendingCharge() {
        final List<Result<QueryPage, QueryCoreException>> results = new ArrayList<>();
        results.add(Result.success(new QueryPage(ImmutableList.of(Items.number(1)), 1.0, "rows", ListQueryPipelineStage.stateAt(1))));
        results.add(Result.success(QueryPage.empty(1.5, "empty", ListQueryPipelineStage.stateAt(2))));
        results.add(Result.success(QueryPage.empty(0.5, "last", null)));

        final QueryPipelineStage stage = skipEmpty(results);
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final QueryPage last = stage.getCurrent().get();
        assertTrue(last.isEmpty());
        assertNull(last.getState());
        assertEquals(2.0, last.getRequestCharge(), 1e-9);
        assertEquals("last", last.getActivityId());
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
    }

    @Test
    public void emptyQueryStillReturnsOnePage() {
        final QueryPipelineStage stage = skipEmpty(ImmutableList.of());
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final QueryPage page = stage.getCurrent().get();
        assertTrue(page.isEmpty());
        assertNull(page.getState());
        assertFalse(stage.moveNext(QueryTrace.NO_OP).join());
    }

    @Test
    public void innerCompletingLater() {
        final List<Result<QueryPage, QueryCoreException>> results = emptyPages(3);
        results.add(Result.success(new QueryPage(ImmutableList.of(Items.string("x")), 1.0, "rows", null)));
        final FirableQueryPipelineStage firable = new FirableQueryPipelineStage(new ListQueryPipelineStage(results, 0));
        final QueryPipelineStage stage = new SkipEmptyPageQueryPipelineStage(firable);

        final CompletableFuture<Boolean> moveNext = stage.moveNext(QueryTrace.NO_OP);
        assertFalse(moveNext.isDone());
        firable.fire();
        assertFalse(moveNext.isDone());
        firable.fireAll();
        assertTrue(moveNext.join());
        final QueryPage page = stage.getCurrent().get();
        assertEquals(ImmutableList.of(Items.string("x")), page.getDocuments());
        assertEquals(4.0, page.getRequestCharge(), 1e-9);
    }
}
