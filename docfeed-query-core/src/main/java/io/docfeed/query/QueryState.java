/*
 * QueryState.java
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

package io.docfeed.query;

import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.google.protobuf.ByteString;
import io.docfeed.annotation.API;
import io.docfeed.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Base64;

/**
 * Opaque resumption state. A backend range state says where the next page of one feed range starts; a stage state
 * is the encoded continuation of a whole pipeline stage. Callers must hand it back verbatim.
 *
 * <p>
 * States order by unsigned byte comparison. Backend states are expected to be order preserving, so that the
 * lower of two states for the same keyspace is the one with less progress. A {@code null} state, meaning "not
 * started", sorts below every other state; see {@link #compareNullable}.
 * </p>
 */
@API(API.Status.STABLE)
public final class QueryState implements Comparable<QueryState> {
    @Nonnull
    private final ByteString bytes;

    private QueryState(@Nonnull ByteString bytes) {
        this.bytes = bytes;
    }

    @Nonnull
    public static QueryState of(@Nonnull ByteString bytes) {
        return new QueryState(bytes);
    }

    @Nonnull
    public static QueryState fromBytes(@Nonnull byte[] bytes) {
        return new QueryState(ByteString.copyFrom(bytes));
    }

    /**
     * Decode the external string form of a continuation token.
     *
     * @param token base64 text produced by {@link #toBase64()}
     * @return the decoded state
     * @throws MalformedContinuationTokenException if {@code token} is not valid base64
     */
    @Nonnull
    public static QueryState fromBase64(@Nonnull String token) {
        try {
            return new QueryState(ByteString.copyFrom(Base64.getDecoder().decode(token)));
        } catch (IllegalArgumentException ex) {
            throw new MalformedContinuationTokenException("continuation token is not base64", ex,
                    LogMessageKeys.CONTINUATION, token);
        }
    }

    @Nonnull
    public ByteString getBytes() {
        return bytes;
    }

    @Nonnull
    public byte[] toByteArray() {
        return bytes.toByteArray();
    }

    @Nonnull
    public String toBase64() {
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    @Override
    public int compareTo(@Nonnull QueryState o) {
        return ByteArrayUtil.compareUnsigned(bytes.toByteArray(), o.bytes.toByteArray());
    }

    /**
     * Compare two states of which either may be {@code null}; {@code null} sorts first.
     * @param a the first state
     * @param b the second state
     * @return a negative number, zero or a positive number
     */
    public static int compareNullable(@Nullable QueryState a, @Nullable QueryState b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        return b == null ? 1 : a.compareTo(b);
    }

    @Nullable
    public static QueryState ofNullable(@Nullable ByteString bytes) {
        return bytes == null ? null : new QueryState(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof QueryState && bytes.equals(((QueryState)o).bytes);
    }

    @Override
    public int hashCode() {
        return bytes.hashCode();
    }

    @Override
    public String toString() {
        return ByteArrayUtil.printable(bytes.toByteArray());
    }
}
