/*
 * DistinctQueryPipelineStageTest.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.ByteString;
import com.google.protobuf.Value;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryState;
import io.docfeed.query.item.Items;
import io.docfeed.query.pipeline.DistinctQueryType;
import io.docfeed.query.pipeline.ListQueryPipelineStage;
import io.docfeed.query.pipeline.QueryPipelineTestUtils;
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.pipeline.StageFactory;
import io.docfeed.query.proto.ContinuationProto;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drain;
import static io.docfeed.query.pipeline.QueryPipelineTestUtils.drainWithResume;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link DistinctQueryPipelineStage} and {@link DistinctMap}.
 */
public class DistinctQueryPipelineStageTest {
    @Nonnull
    private static StageFactory distinct(@Nonnull DistinctQueryType type, @Nonnull List<List<Value>> pages) {
        final StageFactory source = ListQueryPipelineStage.factory(ListQueryPipelineStage.pages(pages));
        return continuation -> DistinctQueryPipelineStage.monadicCreate(type, continuation, source);
    }

    @Nonnull
    private static List<List<Value>> split(@Nonnull List<Value> rows, int pageSize) {
        final List<List<Value>> pages = new ArrayList<>();
        for (int i = 0; i < rows.size(); i += pageSize) {
            pages.add(rows.subList(i, Math.min(rows.size(), i + pageSize)));
        }
        return pages;
    }

    @Test
    public void unordered() {
        final List<Value> rows = ImmutableList.of(
                Items.number(1), Items.string("1"), Items.number(1), Items.NULL,
                Items.struct(ImmutableMap.of("a", Items.number(1), "b", Items.number(2))),
                Items.number(-0.0),
                Items.struct(ImmutableMap.of("b", Items.number(2), "a", Items.number(1))),
                Items.NULL, Items.number(0.0), Items.list(Items.number(1)));
        final List<Value> expected = ImmutableList.of(
                Items.number(1), Items.string("1"), Items.NULL,
                Items.struct(ImmutableMap.of("a", Items.number(1), "b", Items.number(2))),
                Items.number(-0.0), Items.list(Items.number(1)));
        for (int pageSize = 1; pageSize <= rows.size(); pageSize++) {
            final List<List<Value>> pages = split(rows, pageSize);
            assertEquals(expected, drain(distinct(DistinctQueryType.UNORDERED, pages).create(null).get()).getRows());
            assertEquals(expected, drainWithResume(distinct(DistinctQueryType.UNORDERED, pages)).getRows());
        }
    }

    @Test
    public void ordered() {
        final List<Value> rows = ImmutableList.of(
                Items.number(1), Items.number(1), Items.number(2), Items.number(3), Items.number(3),
                Items.number(3), Items.string("x"), Items.string("x"));
        for (int pageSize = 1; pageSize <= rows.size(); pageSize++) {
            final List<List<Value>> pages = split(rows, pageSize);
            assertThat(drainWithResume(distinct(DistinctQueryType.ORDERED, pages)).getRows(),
                    contains(Items.number(1), Items.number(2), Items.number(3), Items.string("x")));
        }
    }

    @ParameterizedTest(name = "idempotent [type = {0}]")
    @EnumSource(value = DistinctQueryType.class, names = {"ORDERED", "UNORDERED"})
    public void idempotent(DistinctQueryType type) {
        final List<Value> rows = ImmutableList.of(Items.number(1), Items.number(1), Items.number(2), Items.number(3));
        final List<Value> once = drain(distinct(type, ImmutableList.of(rows)).create(null).get()).getRows();
        final List<Value> twice = drain(distinct(type, ImmutableList.of(once)).create(null).get()).getRows();
        assertEquals(once, twice);
        assertThat(once, containsInAnyOrder(Items.number(1), Items.number(2), Items.number(3)));
    }

    @Test
    public void keepsPageCharge() {
        final List<List<Value>> pages = ImmutableList.of(
                ImmutableList.of(Items.number(1)), ImmutableList.of(Items.number(1)), ImmutableList.of(Items.number(1)));
        final QueryPipelineTestUtils.Drained drained = drain(distinct(DistinctQueryType.UNORDERED, pages).create(null).get());
        assertEquals(3, drained.getPages().size());
        assertEquals(3.0, drained.getRequestCharge(), 1e-9);
        assertEquals(ImmutableList.of(Items.number(1)), drained.getRows());
    }

    @Test
    public void malformedContinuations() {
        final List<List<Value>> pages = ImmutableList.of(ImmutableList.of(Items.number(1)), ImmutableList.of(Items.number(2)));
        final QueryState inner = ListQueryPipelineStage.stateAt(1);
        final ByteString hash = ByteString.copyFrom(new byte[16]);

        final QueryState orderedWithSet = StageContinuations.wrap(ContinuationProto.StageKind.DISTINCT,
                ContinuationProto.DistinctContinuation.newBuilder().setInner(inner.getBytes()).addHashes(hash).build());
        assertThat(distinct(DistinctQueryType.ORDERED, pages).create(orderedWithSet).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
        // the same token is fine for an unordered distinct
        assertThat(distinct(DistinctQueryType.UNORDERED, pages).create(orderedWithSet).isSuccess()).isTrue();

        final QueryState unorderedWithLast = StageContinuations.wrap(ContinuationProto.StageKind.DISTINCT,
                ContinuationProto.DistinctContinuation.newBuilder().setInner(inner.getBytes()).setLastHash(hash).build());
        assertThat(distinct(DistinctQueryType.UNORDERED, pages).create(unorderedWithLast).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);

        final QueryState shortHash = StageContinuations.wrap(ContinuationProto.StageKind.DISTINCT,
                ContinuationProto.DistinctContinuation.newBuilder().setInner(inner.getBytes())
                        .setLastHash(ByteString.copyFrom(new byte[3])).build());
        assertThat(distinct(DistinctQueryType.ORDERED, pages).create(shortHash).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);

        final QueryState noInner = StageContinuations.wrap(ContinuationProto.StageKind.DISTINCT,
                ContinuationProto.DistinctContinuation.newBuilder().setLastHash(hash).build());
        assertThat(distinct(DistinctQueryType.ORDERED, pages).create(noInner).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);

        final QueryState wrongKind = StageContinuations.wrap(ContinuationProto.StageKind.TAKE,
                ContinuationProto.DistinctContinuation.newBuilder().setInner(inner.getBytes()).build());
        assertThat(distinct(DistinctQueryType.ORDERED, pages).create(wrongKind).getError())
                .isInstanceOf(MalformedContinuationTokenException.class);
    }
}
