/*
 * ParallelCrossPartitionQueryPipelineStageTest.java
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

import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Value;
import io.docfeed.query.BackendRequestException;
import io.docfeed.query.CancellationToken;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCancelledException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPaginationOptions;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.pagination.FeedRange;
import io.docfeed.query.pagination.InMemoryDocumentContainer;
import io.docfeed.query.pagination.PrefetchPolicy;
import io.docfeed.query.pipeline.ListQueryPipelineStage;
import io.docfeed.query.pipeline.QueryPipelineTestUtils;
import io.docfeed.query.pipeline.StageFactory;
import io.docfeed.query.util.Result;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drain;
import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drainWithResume;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ParallelCrossPartitionQueryPipelineStage}.
 */
public class ParallelCrossPartitionQueryPipelineStageTest {
    private static final SqlQuerySpec QUERY = new SqlQuerySpec("SELECT * FROM c");
    private static final QueryPaginationOptions OPTIONS = QueryPaginationOptions.newBuilder().setPageSizeLimit(5).build();

    @Nonnull
    private static InMemoryDocumentContainer container(int documentCount, int rangeCount) {
        return new InMemoryDocumentContainer(InMemoryDocumentContainer.documents(documentCount, i -> ImmutableMap.of("n", i)),
                InMemoryDocumentContainer.evenRanges(rangeCount), InMemoryDocumentContainer.select());
    }

    @Nonnull
    private static StageFactory parallel(@Nonnull InMemoryDocumentContainer container, @Nonnull List<FeedRange> targetRanges,
                                         @Nonnull PrefetchPolicy prefetchPolicy, @Nonnull CancellationToken cancellation) {
        return continuation -> ParallelCrossPartitionQueryPipelineStage.monadicCreate(container, QUERY, targetRanges,
                OPTIONS, 2, prefetchPolicy, ListQueryPipelineStage.DIRECT, cancellation, continuation);
    }

    @Nonnull
    private static StageFactory parallel(@Nonnull InMemoryDocumentContainer container) {
        return parallel(container, container.getRanges(), PrefetchPolicy.PREFETCH_SINGLE_PAGE, CancellationToken.none());
    }

    @Nonnull
    private static List<String> ids(@Nonnull List<Value> rows) {
        return rows.stream().map(InMemoryDocumentContainer::id).collect(Collectors.toList());
    }

    @Nonnull
    private static List<String> allIds(@Nonnull InMemoryDocumentContainer container) {
        return ids(container.getDocuments());
    }

    @ParameterizedTest(name = "readsEveryDocument [prefetchPolicy = {0}]")
    @EnumSource(PrefetchPolicy.class)
    public void readsEveryDocument(PrefetchPolicy prefetchPolicy) {
        final InMemoryDocumentContainer container = container(60, 4);
        final QueryPipelineTestUtils.Drained drained = drain(
                parallel(container, container.getRanges(), prefetchPolicy, CancellationToken.none()).create(null).get());
        assertThat(ids(drained.getRows())).containsExactlyInAnyOrderElementsOf(allIds(container));
        assertEquals(container.getFetchCount(), drained.getRequestCharge(), 1e-9);
        final QueryPage last = drained.getPages().get(drained.getPages().size() - 1);
        assertThat(last.getState()).isNull();
        for (QueryPage page : drained.getPages()) {
            assertThat(page.getDocuments().size()).isLessThanOrEqualTo(OPTIONS.getPageSizeLimit());
        }
    }

    @Test
    public void prefetchAllStaysWithinMaxConcurrency() {
        final InMemoryDocumentContainer container = container(120, 8);
        container.completeAfter(Duration.ofMillis(20));
        final QueryPipelineStage stage = ParallelCrossPartitionQueryPipelineStage.monadicCreate(container, QUERY,
                container.getRanges(), OPTIONS, 3, PrefetchPolicy.PREFETCH_ALL, ListQueryPipelineStage.DIRECT,
                CancellationToken.none(), null).get();
        final QueryPipelineTestUtils.Drained drained = drain(stage);
        assertThat(ids(drained.getRows())).containsExactlyInAnyOrderElementsOf(allIds(container));
        assertThat(container.getMaxInFlight()).isGreaterThan(1).isLessThanOrEqualTo(3);
        assertEquals(container.getFetchCount(), drained.getRequestCharge(), 1e-9);
    }

    @Test
    public void resumesAfterEveryPage() {
        final InMemoryDocumentContainer container = container(47, 3);
        final QueryPipelineTestUtils.Drained drained = drainWithResume(parallel(container));
        assertThat(ids(drained.getRows())).containsExactlyInAnyOrderElementsOf(allIds(container));
        assertThat(drained.getInstances()).isGreaterThan(3);
    }

    @Test
    public void emptyRangesFinish() {
        final InMemoryDocumentContainer container = container(0, 4);
        final QueryPipelineTestUtils.Drained drained = drain(parallel(container).create(null).get());
        assertThat(drained.getRows()).isEmpty();
        assertEquals(4, drained.getPages().size());
        assertEquals(4.0, drained.getRequestCharge(), 1e-9);
    }

    @Test
    public void splitIsReadExactlyOnce() {
        final InMemoryDocumentContainer container = container(80, 2);
        final FeedRange left = container.getRanges().get(0);
        container.beforeFetch(1, () -> container.split(left, "40"));
        final QueryPipelineTestUtils.Drained drained = drain(parallel(container).create(null).get());
        assertThat(ids(drained.getRows())).containsExactlyInAnyOrderElementsOf(allIds(container));
        assertThat(container.getRanges()).hasSize(3);
    }

    @Test
    public void splitBetweenResumes() {
        final InMemoryDocumentContainer container = container(80, 2);
        final FeedRange left = container.getRanges().get(0);
        container.beforeFetch(3, () -> container.split(left, "40"));
        final QueryPipelineTestUtils.Drained drained = drainWithResume(parallel(container));
        assertThat(ids(drained.getRows())).containsExactlyInAnyOrderElementsOf(allIds(container));
    }

    @Test
    public void mergeReadsEveryDocument() {
        final InMemoryDocumentContainer container = container(80, 4);
        final List<FeedRange> ranges = container.getRanges();
        container.beforeFetch(1, () -> container.merge(ranges.get(0), ranges.get(1)));
        final QueryPipelineTestUtils.Drained drained = drain(parallel(container).create(null).get());
        final Set<String> seen = new HashSet<>(ids(drained.getRows()));
        assertThat(seen).containsExactlyInAnyOrderElementsOf(allIds(container));
        assertThat(container.getRanges()).hasSize(3);
    }

    @Test
    public void retriesAfterThrottling() {
        final InMemoryDocumentContainer container = container(30, 2);
        final QueryPipelineStage stage = parallel(container).create(null).get();
        container.failNextFetch(new BackendRequestException("request rate is large",
                BackendRequestException.TOO_MANY_REQUESTS, 3200, Duration.ofMillis(5)));
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final Result<QueryPage, QueryCoreException> throttled = stage.getCurrent();
        assertFalse(throttled.isSuccess());
        assertThat(throttled.getError()).isInstanceOfSatisfying(BackendRequestException.class,
                ex -> assertTrue(ex.isThrottled()));
        final QueryPipelineTestUtils.Drained drained = drain(stage);
        assertThat(ids(drained.getRows())).containsExactlyInAnyOrderElementsOf(allIds(container));
    }

    @Test
    public void cancellation() {
        final InMemoryDocumentContainer container = container(30, 2);
        final CancellationToken cancellation = new CancellationToken();
        final QueryPipelineStage stage = parallel(container, container.getRanges(),
                PrefetchPolicy.PREFETCH_SINGLE_PAGE, cancellation).create(null).get();
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertTrue(stage.getCurrent().isSuccess());
        cancellation.cancel();
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertThat(stage.getCurrent().getError()).isInstanceOf(QueryCancelledException.class);
        stage.close();
    }

    @Test
    public void rejectsRangesOutsideTheTargets() {
        final InMemoryDocumentContainer container = container(60, 4);
        final QueryPipelineStage stage = parallel(container).create(null).get();
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        final QueryPage page = stage.getCurrent().get();
        stage.close();

        final List<FeedRange> firstHalf = container.getRanges().subList(0, 2);
        assertThat(parallel(container, firstHalf, PrefetchPolicy.PREFETCH_SINGLE_PAGE, CancellationToken.none())
                .create(page.getState()).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
        assertThat(parallel(container).create(ListQueryPipelineStage.stateAt(3)).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
    }
}
