/*
 * OrderByQueryResult.java
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
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.item.Items;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pagination.FeedRange;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A row returned by the backend for an order-by query.
 *
 * <p>
 * The rewritten query returns each document as {@code {"_rid": ..., "orderByItems": [{"item": ...}, ...], "payload": ...}}.
 * The order-by items are the values of the order-by expressions, and an {@code item} that is absent is undefined. Only
 * the payload is returned to the caller.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class OrderByQueryResult {
    public static final String RID_FIELD = "_rid";
    public static final String ORDER_BY_ITEMS_FIELD = "orderByItems";
    public static final String ITEM_FIELD = "item";
    public static final String PAYLOAD_FIELD = "payload";

    @Nonnull
    private final String rid;
    @Nonnull
    private final List<Value> orderByItems;
    @Nonnull
    private final Value payload;
    @Nonnull
    private final FeedRange feedRange;

    public OrderByQueryResult(@Nonnull String rid, @Nonnull List<Value> orderByItems, @Nonnull Value payload,
                              @Nonnull FeedRange feedRange) {
        this.rid = rid;
        this.orderByItems = ImmutableList.copyOf(orderByItems);
        this.payload = payload;
        this.feedRange = feedRange;
    }

    /**
     * Read a backend row.
     *
     * @param row the row
     * @param columnCount the number of order-by expressions of the query
     * @param feedRange the range the row was read from
     * @return the row
     * @throws QueryCoreException if the row does not have the expected shape
     */
    @Nonnull
    public static OrderByQueryResult parse(@Nonnull Value row, int columnCount, @Nonnull FeedRange feedRange) {
        final Value rid = Items.getField(row, RID_FIELD);
        final Value items = Items.getField(row, ORDER_BY_ITEMS_FIELD);
        if (rid.getKindCase() != Value.KindCase.STRING_VALUE || items.getKindCase() != Value.KindCase.LIST_VALUE
                || items.getListValue().getValuesCount() != columnCount) {
            throw new QueryCoreException("order by row does not have the expected shape",
                    LogMessageKeys.FEED_RANGE, feedRange,
                    LogMessageKeys.COLUMN_COUNT, columnCount);
        }
        final ImmutableList.Builder<Value> orderByItems = ImmutableList.builderWithExpectedSize(columnCount);
        for (Value wrapped : items.getListValue().getValuesList()) {
            orderByItems.add(Items.getField(wrapped, ITEM_FIELD));
        }
        return new OrderByQueryResult(rid.getStringValue(), orderByItems.build(), Items.getField(row, PAYLOAD_FIELD), feedRange);
    }

    @Nonnull
    public String getRid() {
        return rid;
    }

    @Nonnull
    public List<Value> getOrderByItems() {
        return orderByItems;
    }

    @Nonnull
    public Value getPayload() {
        return payload;
    }

    @Nonnull
    public FeedRange getFeedRange() {
        return feedRange;
    }

    @Override
    public String toString() {
        return "OrderByQueryResult{rid=" + rid + ", orderByItems=" + orderByItems + ", feedRange=" + feedRange + "}";
    }
}
