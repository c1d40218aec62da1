/*
 * OrderByResumeFilter.java
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
import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Where an order-by range resumes within the rows read from its state: after all rows whose key sorts before this
 * one, and after the first {@link #getSkipCount()} rows whose key is equal to it.
 */
@API(API.Status.INTERNAL)
public final class OrderByResumeFilter {
    @Nonnull
    private final List<Value> orderByItems;
    @Nonnull
    private final String rid;
    private final long skipCount;

    public OrderByResumeFilter(@Nonnull List<Value> orderByItems, @Nonnull String rid, long skipCount) {
        this.orderByItems = ImmutableList.copyOf(orderByItems);
        this.rid = rid;
        this.skipCount = skipCount;
    }

    @Nonnull
    public static OrderByResumeFilter after(@Nonnull OrderByQueryResult row, long skipCount) {
        return new OrderByResumeFilter(row.getOrderByItems(), row.getRid(), skipCount);
    }

    @Nonnull
    public List<Value> getOrderByItems() {
        return orderByItems;
    }

    @Nonnull
    public String getRid() {
        return rid;
    }

    public long getSkipCount() {
        return skipCount;
    }

    @Nonnull
    public OrderByResumeFilter withSkipCount(long newSkipCount) {
        return new OrderByResumeFilter(orderByItems, rid, newSkipCount);
    }

    @Override
    public String toString() {
        return "OrderByResumeFilter{" + orderByItems + ", rid=" + rid + ", skip=" + skipCount + "}";
    }
}
