/*
 * OrderByFilters.java
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

import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.item.ItemComparator;
import io.docfeed.query.pipeline.SortOrder;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Builds the {@code WHERE} condition that lets the backend skip rows an order-by range has already returned.
 *
 * <p>
 * The rewritten order-by query contains {@link #FORMAT_PLACEHOLDER}, which is replaced by {@code true} or by a
 * condition on the first order-by expression. The condition is only a narrowing: rows equal to the resume key
 * are still returned and dropped on the client, and values of other types that sort after the key (before it, when
 * descending) are kept by type checks.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class OrderByFilters {
    public static final String FORMAT_PLACEHOLDER = "{documentdb-formattableorderbyquery-filter}";
    public static final String TRUE_FILTER = "true";

    private static final String[] TYPE_CHECKS = {null, "IS_NULL", "IS_BOOL", "IS_NUMBER", "IS_STRING", "IS_ARRAY", "IS_OBJECT"};

    /**
     * Build the condition for resuming at a key.
     * @param expressions the order-by expressions
     * @param sortOrders the order-by directions
     * @param orderByItems the order-by items of the resume key
     * @return the condition, or {@code null} if there is nothing useful to filter on
     */
    @Nullable
    public static String resumeFilter(@Nonnull List<String> expressions, @Nonnull List<SortOrder> sortOrders,
                                      @Nonnull List<Value> orderByItems) {
        if (expressions.isEmpty() || orderByItems.isEmpty()) {
            return null;
        }
        final Value item = orderByItems.get(0);
        final String literal = toQueryLiteral(item);
        if (literal == null) {
            return null;
        }
        final String expression = expressions.get(0);
        final boolean ascending = sortOrders.get(0) == SortOrder.ASCENDING;
        final StringBuilder filter = new StringBuilder("( ")
                .append(expression).append(ascending ? " >= " : " <= ").append(literal);
        final int typeOrder = ItemComparator.typeOrder(item);
        if (ascending) {
            for (int i = typeOrder + 1; i < TYPE_CHECKS.length; i++) {
                filter.append(" OR ").append(TYPE_CHECKS[i]).append('(').append(expression).append(')');
            }
        } else {
            filter.append(" OR NOT IS_DEFINED(").append(expression).append(')');
            for (int i = 1; i < typeOrder; i++) {
                filter.append(" OR ").append(TYPE_CHECKS[i]).append('(').append(expression).append(')');
            }
        }
        return filter.append(" )").toString();
    }

    /**
     * Substitute a condition into the rewritten query.
     * @param querySpec the rewritten query
     * @param filter the condition, or {@code null} for none
     * @return the query to send to the backend
     */
    @Nonnull
    public static SqlQuerySpec format(@Nonnull SqlQuerySpec querySpec, @Nullable String filter) {
        return querySpec.withQueryText(querySpec.getQueryText().replace(FORMAT_PLACEHOLDER, filter == null ? TRUE_FILTER : filter));
    }

    @Nullable
    static String toQueryLiteral(@Nonnull Value item) {
        switch (item.getKindCase()) {
            case BOOL_VALUE:
                return Boolean.toString(item.getBoolValue());
            case NUMBER_VALUE:
                final double number = item.getNumberValue();
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    return Long.toString((long)number);
                }
                return Double.toString(number);
            case STRING_VALUE:
                return quote(item.getStringValue());
            default:
                return null;
        }
    }

    @Nonnull
    private static String quote(@Nonnull String value) {
        final StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                quoted.append('\\').append(c);
            } else if (c < 0x20) {
                quoted.append(String.format("\\u%04x", (int)c));
            } else {
                quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    private OrderByFilters() {
    }
}
