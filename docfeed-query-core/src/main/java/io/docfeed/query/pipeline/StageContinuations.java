/*
 * StageContinuations.java
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
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryState;
import io.docfeed.query.logging.KeyValueLogMessage;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.proto.ContinuationProto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Encoding of stage continuations.
 *
 * <p>
 * Every stage's continuation is a {@link ContinuationProto.ContinuationEnvelope} naming the stage kind, around a
 * stage specific message. Wrapping stages keep the inner stage's whole envelope as bytes inside their own message,
 * so a pipeline's continuation is a nest of envelopes, outermost stage first. Each stage only decodes its own level
 * and rejects any envelope not of its kind.
 * </p>
 */
@API(API.Status.INTERNAL)
public final class StageContinuations {
    private static final Logger LOGGER = LoggerFactory.getLogger(StageContinuations.class);

    @Nonnull
    public static QueryState wrap(@Nonnull ContinuationProto.StageKind kind, @Nonnull Message payload) {
        return QueryState.of(ContinuationProto.ContinuationEnvelope.newBuilder()
                .setKind(kind)
                .setPayload(payload.toByteString())
                .build()
                .toByteString());
    }

    /**
     * Decode a continuation of the given kind.
     *
     * @param continuation the continuation
     * @param expected the kind of stage being built
     * @param parser parser of the stage's message
     * @param <M> type of the stage's message
     * @return the stage's message
     * @throws MalformedContinuationTokenException if the bytes are not an envelope of the expected kind holding
     * a valid message
     */
    @Nonnull
    public static <M extends Message> M unwrap(@Nonnull QueryState continuation,
                                               @Nonnull ContinuationProto.StageKind expected,
                                               @Nonnull Parser<M> parser) {
        final ContinuationProto.ContinuationEnvelope envelope;
        try {
            envelope = ContinuationProto.ContinuationEnvelope.parseFrom(continuation.getBytes());
        } catch (InvalidProtocolBufferException ex) {
            throw malformed("continuation is not a stage continuation", ex, continuation, expected);
        }
        if (envelope.getKind() != expected) {
            throw new MalformedContinuationTokenException("continuation belongs to a different stage",
                    LogMessageKeys.EXPECTED, expected,
                    LogMessageKeys.ACTUAL, envelope.getKind(),
                    LogMessageKeys.RAW_BYTES, continuation);
        }
        try {
            final M message = parser.parseFrom(envelope.getPayload());
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("decoded continuation",
                        LogMessageKeys.STAGE_KIND, expected,
                        LogMessageKeys.CONTINUATION, message));
            }
            return message;
        } catch (InvalidProtocolBufferException ex) {
            throw malformed("error parsing stage continuation", ex, continuation, expected);
        }
    }

    @Nonnull
    private static MalformedContinuationTokenException malformed(@Nonnull String message,
                                                                 @Nonnull InvalidProtocolBufferException cause,
                                                                 @Nonnull QueryState continuation,
                                                                 @Nonnull ContinuationProto.StageKind expected) {
        return new MalformedContinuationTokenException(message, cause,
                LogMessageKeys.STAGE_KIND, expected,
                LogMessageKeys.RAW_BYTES, continuation);
    }

    /**
     * Read an optional nested continuation.
     * @param present whether the field is set
     * @param bytes the field's value
     * @return the nested continuation, or {@code null} if not set
     */
    @Nullable
    public static QueryState nested(boolean present, @Nonnull ByteString bytes) {
        return present ? QueryState.of(bytes) : null;
    }

    private StageContinuations() {
    }
}
