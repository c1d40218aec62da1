/*
 * OrderByQueryResultComparator.java
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
import io.docfeed.query.item.ItemComparator;
import io.docfeed.query.pipeline.SortOrder;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.List;

/**
 * Total order of order-by rows across feed ranges.
 *
 * Rows are ordered by their order-by items, each in the direction of its column, then by resource id, then by the
 * feed range they came from. The first two make up the row's key, which is what continuations record. Resource ids
 * are compared in the direction of the first column, which is how the backend breaks ties within a range.
 */
@API(API.Status.INTERNAL)
public class OrderByQueryResultComparator implements Comparator<OrderByQueryResult> {
    @Nonnull
    private final List<SortOrder> sortOrders;

    public OrderByQueryResultComparator(@Nonnull List<SortOrder> sortOrders) {
        this.sortOrders = ImmutableList.copyOf(sortOrders);
    }

    @Override
    public int compare(@Nonnull OrderByQueryResult left, @Nonnull OrderByQueryResult right) {
        final int keyComparison = compareKeys(left.getOrderByItems(), left.getRid(), right.getOrderByItems(), right.getRid());
        if (keyComparison != 0) {
            return keyComparison;
        }
        return left.getFeedRange().getMin().compareTo(right.getFeedRange().getMin());
    }

    /**
     * Compare two row keys.
     * @param leftItems order-by items of the left row
     * @param leftRid resource id of the left row
     * @param rightItems order-by items of the right row
     * @param rightRid resource id of the right row
     * @return a negative number, zero or a positive number as the left key sorts before, with or after the right key
     */
    public int compareKeys(@Nonnull List<Value> leftItems, @Nonnull String leftRid,
                           @Nonnull List<Value> rightItems, @Nonnull String rightRid) {
        for (int i = 0; i < sortOrders.size(); i++) {
            final int comparison = sortOrders.get(i).apply(ItemComparator.INSTANCE.compare(leftItems.get(i), rightItems.get(i)));
            if (comparison != 0) {
                return comparison;
            }
        }
        final int ridComparison = leftRid.compareTo(rightRid);
        return sortOrders.isEmpty() ? ridComparison : sortOrders.get(0).apply(ridComparison);
    }

    public int compareKey(@Nonnull OrderByQueryResult row, @Nonnull OrderByResumeFilter filter) {
        return compareKeys(row.getOrderByItems(), row.getRid(), filter.getOrderByItems(), filter.getRid());
    }

    @Nonnull
    public List<SortOrder> getSortOrders() {
        return sortOrders;
    }

    public int getColumnCount() {
        return sortOrders.size();
    }
}
