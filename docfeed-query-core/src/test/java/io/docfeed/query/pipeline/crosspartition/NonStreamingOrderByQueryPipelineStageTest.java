/*
 * NonStreamingOrderByQueryPipelineStageTest.java
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

import com.google.common.collect.ImmutableList;
import io.docfeed.query.BackendRequestException;
import io.docfeed.query.CancellationToken;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.pagination.InMemoryDocumentContainer;
import io.docfeed.query.pipeline.ListQueryPipelineStage;
import io.docfeed.query.pipeline.QueryPipelineTestUtils;
import io.docfeed.query.pipeline.SortOrder;
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.pipeline.StageFactory;
import io.docfeed.query.proto.ContinuationProto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drain;
import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drainWithResume;
import static io.docfeed.query.pipeline.crosspartition.OrderByCrossPartitionQueryPipelineStageTest.OPTIONS;
import static io.docfeed.query.pipeline.crosspartition.OrderByCrossPartitionQueryPipelineStageTest.QUERY;
import static io.docfeed.query.pipeline.crosspartition.OrderByCrossPartitionQueryPipelineStageTest.container;
import static io.docfeed.query.pipeline.crosspartition.OrderByCrossPartitionQueryPipelineStageTest.ids;
import static io.docfeed.query.pipeline.crosspartition.OrderByCrossPartitionQueryPipelineStageTest.orderBy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link NonStreamingOrderByQueryPipelineStage}.
 */
public class NonStreamingOrderByQueryPipelineStageTest {
    @Nonnull
    private static StageFactory nonStreaming(@Nonnull InMemoryDocumentContainer container, @Nonnull SortOrder sortOrder,
                                             @Nullable Long maxRetained) {
        return continuation -> NonStreamingOrderByQueryPipelineStage.monadicCreate(container, QUERY, container.getRanges(),
                ImmutableList.of(sortOrder), maxRetained, OPTIONS, 4, ListQueryPipelineStage.DIRECT,
                CancellationToken.none(), continuation);
    }

    @ParameterizedTest(name = "matchesStreaming [sortOrder = {0}]")
    @EnumSource(SortOrder.class)
    public void matchesStreaming(SortOrder sortOrder) {
        final InMemoryDocumentContainer streamingContainer = container(90, 4, sortOrder);
        final QueryPipelineTestUtils.Drained streaming = drain(
                orderBy(streamingContainer, streamingContainer.getRanges(), sortOrder).create(null).get());
        final InMemoryDocumentContainer container = container(90, 4, sortOrder);
        final QueryPipelineTestUtils.Drained drained = drain(nonStreaming(container, sortOrder, null).create(null).get());

        assertEquals(ids(streaming.getRows()), ids(drained.getRows()));
        assertEquals(streaming.getRequestCharge(), drained.getRequestCharge(), 1e-9);
        assertEquals(streamingContainer.getFetchCount(), container.getFetchCount());
    }

    @Test
    public void firstPageCarriesEveryFetch() {
        final InMemoryDocumentContainer container = container(23, 3, SortOrder.ASCENDING);
        final QueryPipelineTestUtils.Drained drained = drain(nonStreaming(container, SortOrder.ASCENDING, null).create(null).get());
        assertEquals(5, drained.getPages().size());
        assertEquals(container.getFetchCount(), drained.getPages().get(0).getRequestCharge(), 1e-9);
        for (QueryPage page : drained.getPages().subList(1, drained.getPages().size())) {
            assertEquals(0.0, page.getRequestCharge(), 1e-9);
        }
        assertThat(drained.getPages().get(4).getDocuments()).hasSize(3);
    }

    @Test
    public void keepsOnlyTheBestRows() {
        final InMemoryDocumentContainer container = container(90, 4, SortOrder.DESCENDING);
        final QueryPipelineTestUtils.Drained drained = drain(nonStreaming(container, SortOrder.DESCENDING, 12L).create(null).get());
        assertEquals(ids(container.getDocuments()).subList(0, 12), ids(drained.getRows()));
    }

    @Test
    public void resumes() {
        final InMemoryDocumentContainer container = container(60, 3, SortOrder.ASCENDING);
        final QueryPipelineTestUtils.Drained drained = drainWithResume(nonStreaming(container, SortOrder.ASCENDING, null));
        assertEquals(ids(container.getDocuments()), ids(drained.getRows()));
        assertEquals(12, drained.getInstances());
    }

    @Test
    public void retriesFailedFetch() {
        final InMemoryDocumentContainer container = container(40, 2, SortOrder.ASCENDING);
        final QueryPipelineStage stage = nonStreaming(container, SortOrder.ASCENDING, null).create(null).get();
        container.beforeFetch(3, () -> container.failNextFetch(new BackendRequestException("service unavailable",
                BackendRequestException.SERVICE_UNAVAILABLE, 0, null)));
        assertTrue(stage.moveNext(QueryTrace.NO_OP).join());
        assertFalse(stage.getCurrent().isSuccess());
        assertThat(stage.getCurrent().getError()).isInstanceOf(BackendRequestException.class);
        final QueryPipelineTestUtils.Drained drained = drain(stage);
        assertEquals(ids(container.getDocuments()), ids(drained.getRows()));
    }

    @Test
    public void malformedContinuations() {
        final InMemoryDocumentContainer container = container(10, 2, SortOrder.ASCENDING);
        assertThat(nonStreaming(container, SortOrder.ASCENDING, null).create(StageContinuations.wrap(
                ContinuationProto.StageKind.NON_STREAMING_ORDER_BY,
                ContinuationProto.NonStreamingOrderByContinuation.newBuilder().setEmitted(-1).build())).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
        assertThat(nonStreaming(container, SortOrder.ASCENDING, 5L).create(StageContinuations.wrap(
                ContinuationProto.StageKind.NON_STREAMING_ORDER_BY,
                ContinuationProto.NonStreamingOrderByContinuation.newBuilder().setEmitted(6).build())).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
        assertThat(nonStreaming(container, SortOrder.ASCENDING, null).create(StageContinuations.wrap(
                ContinuationProto.StageKind.ORDER_BY, ContinuationProto.OrderByContinuation.getDefaultInstance())).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
    }
}
