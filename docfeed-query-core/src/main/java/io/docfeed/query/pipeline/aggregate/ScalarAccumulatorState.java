/*
 * ScalarAccumulatorState.java
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
import javax.annotation.Nullable;

/**
 * State of a projected value that is not an aggregate, such as a grouping key in the select list. Every row of a
 * group has the same value, so the first one is kept.
 */
@API(API.Status.INTERNAL)
public class ScalarAccumulatorState implements AccumulatorState {
    @Nullable
    private Value value;

    public ScalarAccumulatorState(@Nullable Value value) {
        this.value = value;
    }

    @Override
    public void accumulate(@Nonnull Value partial) {
        if (value == null) {
            value = partial;
        }
    }

    @Nonnull
    @Override
    public Value finish() {
        return value == null ? Items.UNDEFINED : value;
    }

    @Nonnull
    @Override
    public ContinuationProto.AccumulatorState toProto() {
        final ContinuationProto.AccumulatorState.Builder builder = ContinuationProto.AccumulatorState.newBuilder();
        if (value != null) {
            builder.setValue(value);
        }
        return builder.build();
    }
}
