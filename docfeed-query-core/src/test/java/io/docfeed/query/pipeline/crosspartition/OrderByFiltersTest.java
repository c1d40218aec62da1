/*
 * OrderByFiltersTest.java
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
import com.google.protobuf.Value;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.item.Items;
import io.docfeed.query.pipeline.SortOrder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link OrderByFilters}.
 */
public class OrderByFiltersTest {
    static Stream<Arguments> filters() {
        return Stream.of(
                Arguments.of(SortOrder.ASCENDING, Items.number(5),
                        "( c.v >= 5 OR IS_STRING(c.v) OR IS_ARRAY(c.v) OR IS_OBJECT(c.v) )"),
                Arguments.of(SortOrder.DESCENDING, Items.number(5),
                        "( c.v <= 5 OR NOT IS_DEFINED(c.v) OR IS_NULL(c.v) OR IS_BOOL(c.v) )"),
                Arguments.of(SortOrder.ASCENDING, Items.number(2.5),
                        "( c.v >= 2.5 OR IS_STRING(c.v) OR IS_ARRAY(c.v) OR IS_OBJECT(c.v) )"),
                Arguments.of(SortOrder.ASCENDING, Items.string("say \"hi\""),
                        "( c.v >= \"say \\\"hi\\\"\" OR IS_ARRAY(c.v) OR IS_OBJECT(c.v) )"),
                Arguments.of(SortOrder.DESCENDING, Items.bool(true),
                        "( c.v <= true OR NOT IS_DEFINED(c.v) OR IS_NULL(c.v) )")
        );
    }

    @ParameterizedTest(name = "resumeFilter [{0} {1}]")
    @MethodSource("filters")
    public void resumeFilter(SortOrder sortOrder, Value item, String expected) {
        assertEquals(expected, OrderByFilters.resumeFilter(ImmutableList.of("c.v"), ImmutableList.of(sortOrder),
                ImmutableList.of(item)));
    }

    @Test
    public void noFilterForNullOrStructuredKeys() {
        assertNull(OrderByFilters.resumeFilter(ImmutableList.of("c.v"), ImmutableList.of(SortOrder.ASCENDING),
                ImmutableList.of(Items.NULL)));
        assertNull(OrderByFilters.resumeFilter(ImmutableList.of("c.v"), ImmutableList.of(SortOrder.ASCENDING),
                ImmutableList.of(Items.list(Items.number(1)))));
        assertNull(OrderByFilters.resumeFilter(ImmutableList.of(), ImmutableList.of(SortOrder.ASCENDING),
                ImmutableList.of(Items.number(1))));
    }

    @Test
    public void onlyTheFirstColumnIsFiltered() {
        assertEquals("( c.a >= \"x\" OR IS_ARRAY(c.a) OR IS_OBJECT(c.a) )",
                OrderByFilters.resumeFilter(ImmutableList.of("c.a", "c.b"),
                        ImmutableList.of(SortOrder.ASCENDING, SortOrder.DESCENDING),
                        ImmutableList.of(Items.string("x"), Items.number(3))));
    }

    @Test
    public void format() {
        final SqlQuerySpec query = new SqlQuerySpec("SELECT * FROM c WHERE " + OrderByFilters.FORMAT_PLACEHOLDER + " ORDER BY c.v");
        assertEquals("SELECT * FROM c WHERE true ORDER BY c.v", OrderByFilters.format(query, null).getQueryText());
        assertEquals("SELECT * FROM c WHERE ( c.v >= 1 ) ORDER BY c.v",
                OrderByFilters.format(query, "( c.v >= 1 )").getQueryText());
    }
}
