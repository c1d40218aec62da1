/*
 * AverageAccumulatorState.java
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
 * Accumulator state for {@code AVG}. Each range returns its partial as {@code {"sum": s, "count": c}}; the state adds
 * both up and divides at the end. With no count the average is undefined.
 */
@API(API.Status.INTERNAL)
public class AverageAccumulatorState implements AccumulatorState {
    public static final String SUM_FIELD = "sum";
    public static final String COUNT_FIELD = "count";

    private double sum;
    private long count;
    private boolean undefined;

    public AverageAccumulatorState(double sum, long count, boolean undefined) {
        this.sum = sum;
        this.count = count;
        this.undefined = undefined;
    }

    @Override
    public void accumulate(@Nonnull Value partial) {
        if (undefined || Items.isUndefined(partial)) {
            return;
        }
        final Value partialSum = Items.getField(partial, SUM_FIELD);
        final Value partialCount = Items.getField(partial, COUNT_FIELD);
        if (Items.isUndefined(partialSum) && Items.isNumber(partialCount) && partialCount.getNumberValue() == 0) {
            // a range with nothing to average
            return;
        }
        if (!Items.isNumber(partialSum) || !Items.isNumber(partialCount)) {
            undefined = true;
            return;
        }
        sum += partialSum.getNumberValue();
        count += (long)partialCount.getNumberValue();
    }

    @Nonnull
    @Override
    public Value finish() {
        if (undefined || count == 0) {
            return Items.UNDEFINED;
        }
        return Items.number(sum / count);
    }

    @Nonnull
    @Override
    public ContinuationProto.AccumulatorState toProto() {
        return ContinuationProto.AccumulatorState.newBuilder()
                .setSum(sum)
                .setCount(count)
                .setUndefined(undefined)
                .build();
    }
}
