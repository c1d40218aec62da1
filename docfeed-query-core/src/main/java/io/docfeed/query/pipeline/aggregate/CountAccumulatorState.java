/*
 * CountAccumulatorState.java
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
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.item.Items;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;

/**
 * Accumulator state for {@code COUNT}: the sum of the ranges' counts. Counting nothing gives zero.
 */
@API(API.Status.INTERNAL)
public class CountAccumulatorState implements AccumulatorState {
    private long count;

    public CountAccumulatorState(long count) {
        this.count = count;
    }

    @Override
    public void accumulate(@Nonnull Value partial) {
        if (Items.isUndefined(partial)) {
            return;
        }
        if (!Items.isNumber(partial)) {
            throw new QueryCoreException("count partial aggregate is not a number",
                    LogMessageKeys.ACTUAL, partial);
        }
        count += (long)partial.getNumberValue();
    }

    @Nonnull
    @Override
    public Value finish() {
        return Items.number(count);
    }

    @Nonnull
    @Override
    public ContinuationProto.AccumulatorState toProto() {
        return ContinuationProto.AccumulatorState.newBuilder().setCount(count).build();
    }
}
