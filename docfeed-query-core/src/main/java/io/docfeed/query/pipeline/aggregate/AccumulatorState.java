/*
 * AccumulatorState.java
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
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;

/**
 * The running state of one aggregate across feed ranges. Each range computes a partial aggregate, and the state
 * combines the partials with {@link #accumulate} until {@link #finish()} produces the final value.
 *
 * The state can be saved in a continuation with {@link #toProto()} and restored by {@link AccumulatorStates}.
 */
@API(API.Status.INTERNAL)
public interface AccumulatorState {
    /**
     * Combine one partial aggregate into the state.
     * @param partial the partial aggregate of a range, possibly undefined
     */
    void accumulate(@Nonnull Value partial);

    /**
     * The aggregate of everything accumulated so far.
     * @return the aggregate, which is undefined if the aggregate has no value
     */
    @Nonnull
    Value finish();

    @Nonnull
    ContinuationProto.AccumulatorState toProto();
}
