/*
 * MinMaxAccumulatorState.java
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

import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.item.ItemComparator;
import io.docfeed.query.item.Items;
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Accumulator state for {@code MIN} and {@code MAX}, keeping the extreme partial under the cross-type item order.
 * Undefined partials are ignored; an array or object partial makes the result undefined for good.
 */
@API(API.Status.INTERNAL)
public class MinMaxAccumulatorState implements AccumulatorState {
    private final boolean max;
    @Nullable
    private Value extreme;
    private boolean undefined;

    public MinMaxAccumulatorState(boolean max, @Nullable Value extreme, boolean undefined) {
        this.max = max;
        this.extreme = extreme;
        this.undefined = undefined;
    }

    @Override
    public void accumulate(@Nonnull Value partial) {
        if (undefined || Items.isUndefined(partial)) {
            return;
        }
        if (!Items.isPrimitive(partial)) {
            undefined = true;
            return;
        }
        if (extreme == null) {
            extreme = partial;
            return;
        }
        final int comparison = ItemComparator.INSTANCE.compare(partial, extreme);
        if (max ? comparison > 0 : comparison < 0) {
            extreme = partial;
        }
    }

    @Nonnull
    @Override
    public Value finish() {
        if (undefined || extreme == null) {
            return Items.UNDEFINED;
        }
        return extreme;
    }

    @Nonnull
    @Override
    public ContinuationProto.AccumulatorState toProto() {
        final ContinuationProto.AccumulatorState.Builder builder = ContinuationProto.AccumulatorState.newBuilder()
                .setUndefined(undefined);
        if (extreme != null) {
            builder.setValue(extreme);
        }
        return builder.build();
    }
}
