/*
 * SingleGroupAggregator.java
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

package io.docfeed.query.pipeline.aggregate;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.item.Items;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pipeline.AggregateOperator;
import io.docfeed.query.pipeline.QueryInfo;
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Combines the partial aggregates that the feed ranges return for one group into the group's result.
 *
 * <p>
 * For {@code SELECT VALUE}, a row is an array whose first element is {@code {"item": partial}}, or the plain value
 * when nothing is aggregated, and the result is that single value. For a select list, a row is an object with one
 * field per alias: aggregated aliases hold {@code {"item": partial}} and the others hold the plain value. The result
 * is an object with the aliases in select order, leaving out those whose value is undefined.
 * </p>
 */
@API(API.Status.INTERNAL)
public abstract class SingleGroupAggregator {
    public static final String ITEM_FIELD = "item";

    /**
     * Add the row of one range.
     * @param row the row
     * @throws QueryCoreException if the row does not have the expected shape
     */
    public abstract void addValues(@Nonnull Value row);

    /**
     * The result of the group so far.
     * @return the result, undefined if a {@code SELECT VALUE} aggregate has no value
     */
    @Nonnull
    public abstract Value getResult();

    @Nonnull
    public abstract ContinuationProto.SingleGroupAggregatorState toProto();

    /**
     * Create an aggregator for the projection of a query.
     *
     * @param queryInfo the query plan
     * @param proto the saved state, or {@code null} for an empty aggregator
     * @return the aggregator
     * @throws MalformedContinuationTokenException if the saved state does not match the projection
     */
    @Nonnull
    public static SingleGroupAggregator create(@Nonnull QueryInfo queryInfo,
                                               @Nullable ContinuationProto.SingleGroupAggregatorState proto) {
        if (queryInfo.hasSelectValue()) {
            final AggregateOperator operator = queryInfo.getAggregates().isEmpty() ? null : queryInfo.getAggregates().get(0);
            ContinuationProto.AccumulatorState state = null;
            if (proto != null) {
                if (proto.getAccumulatorsCount() != 1 || proto.getAccumulators(0).hasAlias()) {
                    throw mismatch(proto, 1);
                }
                state = proto.getAccumulators(0).getState();
            }
            return new SelectValueAggregator(operator, AccumulatorStates.create(operator, state));
        }
        final List<String> aliases = queryInfo.getOrderedAliases();
        if (proto != null && proto.getAccumulatorsCount() != aliases.size()) {
            throw mismatch(proto, aliases.size());
        }
        final Map<String, AccumulatorState> states = new LinkedHashMap<>();
        for (int i = 0; i < aliases.size(); i++) {
            final String alias = aliases.get(i);
            ContinuationProto.AccumulatorState state = null;
            if (proto != null) {
                final ContinuationProto.AliasAccumulator aliasAccumulator = proto.getAccumulators(i);
                if (!alias.equals(aliasAccumulator.getAlias())) {
                    throw mismatch(proto, aliases.size());
                }
                state = aliasAccumulator.getState();
            }
            states.put(alias, AccumulatorStates.create(queryInfo.getAliasToAggregateType().get(alias), state));
        }
        return new SelectListAggregator(ImmutableList.copyOf(aliases), queryInfo.getAliasToAggregateType().keySet(), states);
    }

    @Nonnull
    private static MalformedContinuationTokenException mismatch(@Nonnull ContinuationProto.SingleGroupAggregatorState proto,
                                                                int expected) {
        return new MalformedContinuationTokenException("aggregate continuation does not match the projection",
                LogMessageKeys.EXPECTED, expected,
                LogMessageKeys.ACTUAL, proto.getAccumulatorsCount());
    }

    @Nonnull
    static Value unwrapItem(@Nonnull Value wrapped) {
        if (Items.isUndefined(wrapped)) {
            return Items.UNDEFINED;
        }
        if (wrapped.getKindCase() != Value.KindCase.STRUCT_VALUE) {
            throw new QueryCoreException("partial aggregate is not wrapped as an item",
                    LogMessageKeys.ACTUAL, wrapped);
        }
        return Items.getField(wrapped, ITEM_FIELD);
    }

    private static final class SelectValueAggregator extends SingleGroupAggregator {
        @Nullable
        private final AggregateOperator operator;
        @Nonnull
        private final AccumulatorState state;

        private SelectValueAggregator(@Nullable AggregateOperator operator, @Nonnull AccumulatorState state) {
            this.operator = operator;
            this.state = state;
        }

        @Override
        public void addValues(@Nonnull Value row) {
            if (operator == null) {
                state.accumulate(row);
                return;
            }
            if (row.getKindCase() != Value.KindCase.LIST_VALUE || row.getListValue().getValuesCount() == 0) {
                throw new QueryCoreException("aggregate row is not an array of partial aggregates",
                        LogMessageKeys.ACTUAL, row);
            }
            state.accumulate(unwrapItem(row.getListValue().getValues(0)));
        }

        @Nonnull
        @Override
        public Value getResult() {
            return state.finish();
        }

        @Nonnull
        @Override
        public ContinuationProto.SingleGroupAggregatorState toProto() {
            return ContinuationProto.SingleGroupAggregatorState.newBuilder()
                    .addAccumulators(ContinuationProto.AliasAccumulator.newBuilder().setState(state.toProto()))
                    .build();
        }
    }

    private static final class SelectListAggregator extends SingleGroupAggregator {
        @Nonnull
        private final List<String> orderedAliases;
        @Nonnull
        private final Set<String> aggregatedAliases;
        @Nonnull
        private final Map<String, AccumulatorState> states;

        private SelectListAggregator(@Nonnull List<String> orderedAliases, @Nonnull Set<String> aggregatedAliases,
                                     @Nonnull Map<String, AccumulatorState> states) {
            this.orderedAliases = orderedAliases;
            this.aggregatedAliases = aggregatedAliases;
            this.states = states;
        }

        @Override
        public void addValues(@Nonnull Value row) {
            if (row.getKindCase() != Value.KindCase.STRUCT_VALUE) {
                throw new QueryCoreException("aggregate row is not an object",
                        LogMessageKeys.ACTUAL, row);
            }
            for (String alias : orderedAliases) {
                final Value value = Items.getField(row, alias);
                states.get(alias).accumulate(aggregatedAliases.contains(alias) ? unwrapItem(value) : value);
            }
        }

        @Nonnull
        @Override
        public Value getResult() {
            final Map<String, Value> fields = new LinkedHashMap<>();
            for (String alias : orderedAliases) {
                fields.put(alias, states.get(alias).finish());
            }
            return Items.struct(fields);
        }

        @Nonnull
        @Override
        public ContinuationProto.SingleGroupAggregatorState toProto() {
            final ContinuationProto.SingleGroupAggregatorState.Builder builder = ContinuationProto.SingleGroupAggregatorState.newBuilder();
            for (String alias : orderedAliases) {
                builder.addAccumulatorsBuilder()
                        .setAlias(alias)
                        .setState(states.get(alias).toProto());
            }
            return builder.build();
        }
    }
}
