/*
 * StageContinuationsTest.java
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

import com.google.protobuf.ByteString;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryState;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.proto.ContinuationProto;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StageContinuations}.
 */
public class StageContinuationsTest {
    private static final ContinuationProto.TakeContinuation TAKE = ContinuationProto.TakeContinuation.newBuilder()
            .setRemaining(7)
            .setInner(ByteString.copyFromUtf8("inner"))
            .build();

    @Test
    public void unwrapsTheSameKind() {
        final QueryState state = StageContinuations.wrap(ContinuationProto.StageKind.TAKE, TAKE);
        final QueryState decoded = QueryState.fromBase64(state.toBase64());
        assertThat(StageContinuations.unwrap(decoded, ContinuationProto.StageKind.TAKE,
                ContinuationProto.TakeContinuation.parser())).isEqualTo(TAKE);
    }

    @Test
    public void rejectsAnotherKind() {
        final QueryState state = StageContinuations.wrap(ContinuationProto.StageKind.TAKE, TAKE);
        assertThatThrownBy(() -> StageContinuations.unwrap(state, ContinuationProto.StageKind.SKIP,
                ContinuationProto.SkipContinuation.parser()))
                .isInstanceOf(MalformedContinuationTokenException.class)
                .hasMessageContaining("different stage")
                .satisfies(ex -> assertThat(((MalformedContinuationTokenException)ex).getLogInfo())
                        .containsEntry(LogMessageKeys.EXPECTED.toString(), ContinuationProto.StageKind.SKIP)
                        .containsEntry(LogMessageKeys.ACTUAL.toString(), ContinuationProto.StageKind.TAKE)
                        .containsEntry(LogMessageKeys.RAW_BYTES.toString(), state));
    }

    @Test
    public void rejectsGarbage() {
        final QueryState garbage = QueryState.fromBytes(new byte[] {(byte)0xff, (byte)0xff, 0x01});
        assertThatThrownBy(() -> StageContinuations.unwrap(garbage, ContinuationProto.StageKind.TAKE,
                ContinuationProto.TakeContinuation.parser()))
                .isInstanceOf(MalformedContinuationTokenException.class);
    }

    @Test
    public void nested() {
        assertThat(StageContinuations.nested(false, ByteString.EMPTY)).isNull();
        assertThat(StageContinuations.nested(true, ByteString.copyFromUtf8("x")))
                .isEqualTo(QueryState.of(ByteString.copyFromUtf8("x")));
    }
}
