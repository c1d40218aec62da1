/*
 * AccumulatorStates.java
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

import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pipeline.AggregateOperator;
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Creates {@link AccumulatorState}s, either empty or restored from a continuation.
 */
@API(API.Status.INTERNAL)
public final class AccumulatorStates {

    /**
     * Create the state of one projected value.
     *
     * @param operator the aggregate, or {@code null} for a value that is not aggregated
     * @param proto the saved state, or {@code null} for an empty one
     * @return the state
     * @throws MalformedContinuationTokenException if the saved state does not fit the aggregate
     */
    @Nonnull
    public static AccumulatorState create(@Nullable AggregateOperator operator,
                                          @Nullable ContinuationProto.AccumulatorState proto) {
        if (operator == null) {
            return new ScalarAccumulatorState(proto != null && proto.hasValue() ? proto.getValue() : null);
        }
        switch (operator) {
            case COUNT:
                if (proto == null) {
                    return new CountAccumulatorState(0L);
                }
                check(proto.hasCount() && proto.getCount() >= 0, operator, proto);
                return new CountAccumulatorState(proto.getCount());
            case SUM:
                if (proto == null) {
                    return new SumAccumulatorState(0.0, 0L, false);
                }
                check(proto.hasSum() && proto.hasCount() && proto.getCount() >= 0, operator, proto);
                return new SumAccumulatorState(proto.getSum(), proto.getCount(), proto.getUndefined());
            case AVERAGE:
                if (proto == null) {
                    return new AverageAccumulatorState(0.0, 0L, false);
                }
                check(proto.hasSum() && proto.hasCount() && proto.getCount() >= 0, operator, proto);
                return new AverageAccumulatorState(proto.getSum(), proto.getCount(), proto.getUndefined());
            case MIN:
            case MAX:
                if (proto == null) {
                    return new MinMaxAccumulatorState(operator == AggregateOperator.MAX, null, false);
                }
                check(proto.hasUndefined() && !proto.hasSum() && !proto.hasCount(), operator, proto);
                return new MinMaxAccumulatorState(operator == AggregateOperator.MAX,
                        proto.hasValue() ? proto.getValue() : null, proto.getUndefined());
            default:
                throw new MalformedContinuationTokenException("unknown aggregate operator",
                        LogMessageKeys.ACTUAL, operator);
        }
    }

    private static void check(boolean valid, @Nonnull AggregateOperator operator,
                              @Nonnull ContinuationProto.AccumulatorState proto) {
        if (!valid) {
            throw new MalformedContinuationTokenException("aggregate continuation does not match the aggregate",
                    LogMessageKeys.EXPECTED, operator,
                    LogMessageKeys.CONTINUATION, proto);
        }
    }

    private AccumulatorStates() {
    }
}
