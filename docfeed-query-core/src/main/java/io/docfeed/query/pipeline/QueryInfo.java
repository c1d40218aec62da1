/*
 * QueryInfo.java
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
import com.google.common.collect.ImmutableMap;
import io.docfeed.annotation.API;
import io.docfeed.query.QueryCoreArgumentException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * The compiled plan of a query, as far as the client-side pipeline needs it.
 *
 * <p>
 * The plan is produced elsewhere, together with a rewritten query that each feed range is sent. The rewritten query
 * returns rows in the shapes the stages expect: order-by rows carry {@code _rid}, {@code orderByItems} and
 * {@code payload}; aggregate rows carry partial aggregates wrapped as {@code {"item": partial}}; group-by rows carry
 * {@code groupByItems} and {@code payload}.
 * </p>
 *
 * <p>
 * Aggregates in a select list are described by {@link #getOrderedAliases()}, every projected alias in select order,
 * and {@link #getAliasToAggregateType()}, which maps the aliases that are aggregates to their operator. An alias that
 * is not in the map is a plain projection of the group key.
 * </p>
 */
@API(API.Status.STABLE)
public class QueryInfo {
    @Nonnull
    private final List<SortOrder> orderBy;
    @Nonnull
    private final List<String> orderByExpressions;
    @Nonnull
    private final List<AggregateOperator> aggregates;
    @Nonnull
    private final Map<String, AggregateOperator> aliasToAggregateType;
    @Nonnull
    private final List<String> orderedAliases;
    @Nonnull
    private final List<String> groupByExpressions;
    private final boolean hasSelectValue;
    @Nonnull
    private final DistinctQueryType distinctType;
    @Nullable
    private final Long offset;
    @Nullable
    private final Long limit;
    @Nullable
    private final Long top;
    private final boolean hasDCount;
    @Nullable
    private final String dCountAlias;
    @Nullable
    private final String rewrittenQuery;
    private final boolean nonStreamingOrderBy;

    private QueryInfo(@Nonnull Builder builder) {
        this.orderBy = ImmutableList.copyOf(builder.orderBy);
        this.orderByExpressions = ImmutableList.copyOf(builder.orderByExpressions);
        this.aggregates = ImmutableList.copyOf(builder.aggregates);
        this.aliasToAggregateType = ImmutableMap.copyOf(builder.aliasToAggregateType);
        this.orderedAliases = ImmutableList.copyOf(builder.orderedAliases);
        this.groupByExpressions = ImmutableList.copyOf(builder.groupByExpressions);
        this.hasSelectValue = builder.hasSelectValue;
        this.distinctType = builder.distinctType;
        this.offset = builder.offset;
        this.limit = builder.limit;
        this.top = builder.top;
        this.hasDCount = builder.hasDCount;
        this.dCountAlias = builder.dCountAlias;
        this.rewrittenQuery = builder.rewrittenQuery;
        this.nonStreamingOrderBy = builder.nonStreamingOrderBy;
    }

    @Nonnull
    public List<SortOrder> getOrderBy() {
        return orderBy;
    }

    @Nonnull
    public List<String> getOrderByExpressions() {
        return orderByExpressions;
    }

    public boolean hasOrderBy() {
        return !orderBy.isEmpty();
    }

    @Nonnull
    public List<AggregateOperator> getAggregates() {
        return aggregates;
    }

    public boolean hasAggregates() {
        return !aggregates.isEmpty();
    }

    @Nonnull
    public Map<String, AggregateOperator> getAliasToAggregateType() {
        return aliasToAggregateType;
    }

    @Nonnull
    public List<String> getOrderedAliases() {
        return orderedAliases;
    }

    @Nonnull
    public List<String> getGroupByExpressions() {
        return groupByExpressions;
    }

    public boolean hasGroupBy() {
        return !groupByExpressions.isEmpty();
    }

    public boolean hasSelectValue() {
        return hasSelectValue;
    }

    @Nonnull
    public DistinctQueryType getDistinctType() {
        return distinctType;
    }

    public boolean hasDistinct() {
        return distinctType != DistinctQueryType.NONE;
    }

    @Nullable
    public Long getOffset() {
        return offset;
    }

    public boolean hasOffset() {
        return offset != null;
    }

    @Nullable
    public Long getLimit() {
        return limit;
    }

    public boolean hasLimit() {
        return limit != null;
    }

    @Nullable
    public Long getTop() {
        return top;
    }

    public boolean hasTop() {
        return top != null;
    }

    public boolean hasDCount() {
        return hasDCount;
    }

    @Nullable
    public String getDCountAlias() {
        return dCountAlias;
    }

    @Nullable
    public String getRewrittenQuery() {
        return rewrittenQuery;
    }

    public boolean isNonStreamingOrderBy() {
        return nonStreamingOrderBy;
    }

    /**
     * Whether the rows of the source can be returned as they are, without any stage beyond the cross-partition one.
     * @return {@code true} if no operator needs client-side work
     */
    public boolean isPassthrough() {
        return !hasAggregates() && !hasDistinct() && !hasGroupBy() && !hasOrderBy()
               && !hasOffset() && !hasLimit() && !hasTop() && !hasDCount();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "QueryInfo{orderBy=" + orderBy + ", aggregates=" + aggregates + ", groupBy=" + groupByExpressions
               + ", distinct=" + distinctType + ", offset=" + offset + ", limit=" + limit + ", top=" + top
               + ", dCount=" + hasDCount + "}";
    }

    /**
     * A builder for {@link QueryInfo}.
     */
    public static class Builder {
        @Nonnull
        private List<SortOrder> orderBy = ImmutableList.of();
        @Nonnull
        private List<String> orderByExpressions = ImmutableList.of();
        @Nonnull
        private List<AggregateOperator> aggregates = ImmutableList.of();
        @Nonnull
        private Map<String, AggregateOperator> aliasToAggregateType = ImmutableMap.of();
        @Nonnull
        private List<String> orderedAliases = ImmutableList.of();
        @Nonnull
        private List<String> groupByExpressions = ImmutableList.of();
        private boolean hasSelectValue;
        @Nonnull
        private DistinctQueryType distinctType = DistinctQueryType.NONE;
        @Nullable
        private Long offset;
        @Nullable
        private Long limit;
        @Nullable
        private Long top;
        private boolean hasDCount;
        @Nullable
        private String dCountAlias;
        @Nullable
        private String rewrittenQuery;
        private boolean nonStreamingOrderBy;

        private Builder() {
        }

        @Nonnull
        public Builder setOrderBy(@Nonnull List<SortOrder> orderBy, @Nonnull List<String> orderByExpressions) {
            if (!orderByExpressions.isEmpty() && orderByExpressions.size() != orderBy.size()) {
                throw new QueryCoreArgumentException("order by expressions do not match sort orders");
            }
            this.orderBy = orderBy;
            this.orderByExpressions = orderByExpressions;
            return this;
        }

        @Nonnull
        public Builder setOrderBy(@Nonnull SortOrder... orderBy) {
            return setOrderBy(List.of(orderBy), ImmutableList.of());
        }

        @Nonnull
        public Builder setAggregates(@Nonnull AggregateOperator... aggregates) {
            this.aggregates = List.of(aggregates);
            return this;
        }

        /**
         * Describe a select list.
         * @param orderedAliases every alias in select order
         * @param aliasToAggregateType the operator of each alias that is an aggregate
         * @return this builder
         */
        @Nonnull
        public Builder setAliases(@Nonnull List<String> orderedAliases, @Nonnull Map<String, AggregateOperator> aliasToAggregateType) {
            if (!orderedAliases.containsAll(aliasToAggregateType.keySet())) {
                throw new QueryCoreArgumentException("aggregate alias missing from ordered aliases");
            }
            this.orderedAliases = orderedAliases;
            this.aliasToAggregateType = aliasToAggregateType;
            return this;
        }

        @Nonnull
        public Builder setGroupByExpressions(@Nonnull String... groupByExpressions) {
            this.groupByExpressions = List.of(groupByExpressions);
            return this;
        }

        @Nonnull
        public Builder setHasSelectValue(boolean hasSelectValue) {
            this.hasSelectValue = hasSelectValue;
            return this;
        }

        @Nonnull
        public Builder setDistinctType(@Nonnull DistinctQueryType distinctType) {
            this.distinctType = distinctType;
            return this;
        }

        @Nonnull
        public Builder setOffset(long offset) {
            this.offset = checkNotNegative(offset, "offset");
            return this;
        }

        @Nonnull
        public Builder setLimit(long limit) {
            this.limit = checkNotNegative(limit, "limit");
            return this;
        }

        @Nonnull
        public Builder setTop(long top) {
            this.top = checkNotNegative(top, "top");
            return this;
        }

        @Nonnull
        public Builder setDCount(@Nullable String alias) {
            this.hasDCount = true;
            this.dCountAlias = alias;
            return this;
        }

        @Nonnull
        public Builder setRewrittenQuery(@Nullable String rewrittenQuery) {
            this.rewrittenQuery = rewrittenQuery;
            return this;
        }

        @Nonnull
        public Builder setNonStreamingOrderBy(boolean nonStreamingOrderBy) {
            this.nonStreamingOrderBy = nonStreamingOrderBy;
            return this;
        }

        private static long checkNotNegative(long value, @Nonnull String name) {
            if (value < 0) {
                throw new QueryCoreArgumentException(name + " must not be negative", name, value);
            }
            return value;
        }

        @Nonnull
        public QueryInfo build() {
            return new QueryInfo(this);
        }
    }
}
