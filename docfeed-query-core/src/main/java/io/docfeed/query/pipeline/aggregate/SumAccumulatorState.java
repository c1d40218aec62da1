/*
 * SumAccumulatorState.java
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
import io.docfeed.query.item.Items;
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;

/**
 * Accumulator state for {@code SUM}.
 * Undefined partials are ignored. Any other partial that is not a number makes the sum undefined for good, as does
 * having no partial at all.
 */
@API(API.Status.INTERNAL)
public class SumAccumulatorState implements AccumulatorState {
    private double sum;
    private long contributions;
    private boolean undefined;

    public SumAccumulatorState(double sum, long contributions, boolean undefined) {
        this.sum = sum;
        this.contributions = contributions;
        this.undefined = undefined;
    }

    @Override
    public void accumulate(@Nonnull Value partial) {
        if (undefined || Items.isUndefined(partial)) {
            return;
        }
        if (!Items.isNumber(partial)) {
            undefined = true;
            return;
        }
        sum += partial.getNumberValue();
        contributions++;
    }

    @Nonnull
    @Override
    public Value finish() {
        if (undefined || contributions == 0) {
            return Items.UNDEFINED;
        }
        return Items.number(sum);
    }

    @Nonnull
    @Override
    public ContinuationProto.AccumulatorState toProto() {
        return ContinuationProto.AccumulatorState.newBuilder()
                .setSum(sum)
                .setCount(contributions)
                .setUndefined(undefined)
                .build();
    }
}
