/*
 * SkipTakeQueryPipelineStageTest.java
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
import com.google.protobuf.Value;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drain;
import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drainWithResume;
import static io.docfeed.query.pipeline.QueryPipelineTestUtils.numberPages;
import static io.docfeed.query.pipeline.QueryPipelineTestUtils.numbers;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SkipQueryPipelineStage} and {@link TakeQueryPipelineStage}.
 */
public class SkipTakeQueryPipelineStageTest {
    private static List<Double> range(long from, long to) {
        return LongStream.range(from, to).mapToObj(i -> (double)i).collect(Collectors.toList());
    }

    @Nonnull
    private static StageFactory offsetLimit(@Nonnull List<Result<QueryPage, QueryCoreException>> results, long offset, long limit) {
        final StageFactory source = ListQueryPipelineStage.factory(results);
        final StageFactory skip = continuation -> SkipQueryPipelineStage.monadicCreate(offset, continuation, source);
        return continuation -> TakeQueryPipelineStage.monadicCreateLimitStage(limit, continuation, skip);
    }

    @Test
    public void offsetThenLimit() {
        final StageFactory factory = offsetLimit(ListQueryPipelineStage.pages(numberPages(2000, 100)), 42, 1337);
        final List<Value> rows = drain(factory.create(null).get()).getRows();
        assertThat(numbers(rows)).isEqualTo(range(42, 42 + 1337));
    }

    @Test
    public void offsetThenLimitResumed() {
        final StageFactory factory = offsetLimit(ListQueryPipelineStage.pages(numberPages(2000, 100)), 42, 1337);
        final QueryPipelineTestUtils.Drained drained = drainWithResume(factory);
        assertThat(numbers(drained.getRows())).isEqualTo(range(42, 42 + 1337));
        assertThat(drained.getInstances()).isGreaterThan(1);
    }

    @ParameterizedTest(name = "offsetLimit [offset = {0}, limit = {1}, pageSize = {2}]")
    @CsvSource({"0, 10, 3", "5, 0, 3", "7, 100, 3", "100, 5, 7", "3, 3, 1", "20, 20, 20"})
    public void offsetLimitArithmetic(long offset, long limit, int pageSize) {
        final int total = 30;
        final StageFactory factory = offsetLimit(ListQueryPipelineStage.pages(numberPages(total, pageSize)), offset, limit);
        final List<Double> expected = range(Math.min(offset, total), Math.min(total, offset + limit));
        assertThat(numbers(drain(factory.create(null).get()).getRows())).isEqualTo(expected);
        assertThat(numbers(drainWithResume(factory).getRows())).isEqualTo(expected);
    }

    @Test
    public void takeZeroNeverPullsInner() {
        final ListQueryPipelineStage source = new ListQueryPipelineStage(ListQueryPipelineStage.pages(numberPages(10, 5)), 0);
        final QueryPipelineStage take = TakeQueryPipelineStage.monadicCreateTopStage(0, null, continuation -> Result.success(source)).get();
        assertFalse(take.moveNext(QueryTrace.NO_OP).join());
        assertEquals(0, source.getPulls());
        take.close();
        assertTrue(source.isClosed());
    }

    @Test
    public void pageThatFinishesTheBudgetHasNoState() {
        final StageFactory source = ListQueryPipelineStage.factory(ListQueryPipelineStage.pages(numberPages(10, 5)));
        final QueryPipelineStage take = TakeQueryPipelineStage.monadicCreateLimitStage(5, null, source).get();
        assertTrue(take.moveNext(QueryTrace.NO_OP).join());
        final QueryPage page = take.getCurrent().get();
        assertEquals(5, page.getDocuments().size());
        assertNull(page.getState());
        assertFalse(take.moveNext(QueryTrace.NO_OP).join());
    }

    @Test
    public void failurePassesThrough() {
        final QueryCoreException failure = new QueryCoreException("boom");
        final List<Result<QueryPage, QueryCoreException>> results = ImmutableList.of(Result.failure(failure));
        final QueryPipelineStage stage = offsetLimit(results, 1, 1).create(null).get();
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertThat(stage.getCurrent().getError()).isSameAs(failure);
    }

    @Test
    public void rejectsInvalidContinuations() {
        final StageFactory source = ListQueryPipelineStage.factory(ListQueryPipelineStage.pages(numberPages(10, 5)));
        final QueryState innerState = ListQueryPipelineStage.stateAt(1);
        final QueryState tooMuchLeft = StageContinuations.wrap(ContinuationProto.StageKind.TAKE,
                ContinuationProto.TakeContinuation.newBuilder().setRemaining(11).setInner(innerState.getBytes()).build());
        final QueryState nothingLeft = StageContinuations.wrap(ContinuationProto.StageKind.TAKE,
                ContinuationProto.TakeContinuation.newBuilder().setRemaining(0).setInner(innerState.getBytes()).build());
        final QueryState skipState = StageContinuations.wrap(ContinuationProto.StageKind.SKIP,
                ContinuationProto.SkipContinuation.newBuilder().setRemaining(3).setInner(innerState.getBytes()).build());

        assertThat(TakeQueryPipelineStage.monadicCreateLimitStage(10, tooMuchLeft, source).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
        assertThat(TakeQueryPipelineStage.monadicCreateLimitStage(10, nothingLeft, source).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
        assertThat(TakeQueryPipelineStage.monadicCreateLimitStage(10, skipState, source).getError())
                .isInstanceOf(MalformedContinuationTokenException.class)
                .hasMessageContaining("different stage");
        assertThat(SkipQueryPipelineStage.monadicCreate(2, skipState, source).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
        assertTrue(SkipQueryPipelineStage.monadicCreate(3, skipState, source).isSuccess());
    }
}
