/*
 * DistinctMap.java
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

package io.docfeed.query.pipeline.distinct;

import com.google.common.hash.HashCode;
import com.google.protobuf.ByteString;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreArgumentException;
import io.docfeed.query.item.DistinctHash;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pipeline.DistinctQueryType;
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashSet;
import java.util.Set;

/**
 * Remembers the values already returned by a {@code DISTINCT} query, by their {@link DistinctHash}.
 *
 * <p>
 * When the rows arrive sorted, equal values are adjacent and only the last hash needs to be kept. Otherwise every
 * hash seen so far is kept, and the continuation carries all of them.
 * </p>
 */
@API(API.Status.INTERNAL)
public abstract class DistinctMap {
    private static final int HASH_BYTES = 16;

    /**
     * Record a value.
     * @param value the value
     * @return {@code true} if the value has not been seen before and should be returned
     */
    public abstract boolean add(@Nonnull Value value);

    /**
     * Save the map into a continuation.
     * @param builder builder of the distinct stage's continuation
     */
    public abstract void save(@Nonnull ContinuationProto.DistinctContinuation.Builder builder);

    /**
     * Create a map.
     *
     * @param distinctType whether rows arrive sorted
     * @param proto the saved map, or {@code null} for an empty one
     * @return the map
     * @throws MalformedContinuationTokenException if the saved map is of the other kind or holds invalid hashes
     */
    @Nonnull
    public static DistinctMap create(@Nonnull DistinctQueryType distinctType,
                                     @Nullable ContinuationProto.DistinctContinuation proto) {
        switch (distinctType) {
            case ORDERED:
                if (proto == null) {
                    return new OrderedDistinctMap(null);
                }
                if (proto.getHashesCount() > 0) {
                    throw new MalformedContinuationTokenException("ordered distinct continuation has unordered hashes");
                }
                return new OrderedDistinctMap(proto.hasLastHash() ? toHashCode(proto.getLastHash()) : null);
            case UNORDERED:
                final Set<HashCode> hashes = new HashSet<>();
                if (proto != null) {
                    if (proto.hasLastHash()) {
                        throw new MalformedContinuationTokenException("unordered distinct continuation has an ordered hash");
                    }
                    for (ByteString hash : proto.getHashesList()) {
                        hashes.add(toHashCode(hash));
                    }
                }
                return new UnorderedDistinctMap(hashes);
            default:
                throw new QueryCoreArgumentException("query is not distinct",
                        LogMessageKeys.ACTUAL, distinctType);
        }
    }

    @Nonnull
    private static HashCode toHashCode(@Nonnull ByteString bytes) {
        if (bytes.size() != HASH_BYTES) {
            throw new MalformedContinuationTokenException("distinct continuation has an invalid hash",
                    LogMessageKeys.RAW_BYTES, bytes);
        }
        return HashCode.fromBytes(bytes.toByteArray());
    }

    /**
     * Keeps the hash of the last value, for rows that arrive sorted.
     */
    static final class OrderedDistinctMap extends DistinctMap {
        @Nullable
        private HashCode lastHash;

        OrderedDistinctMap(@Nullable HashCode lastHash) {
            this.lastHash = lastHash;
        }

        @Override
        public boolean add(@Nonnull Value value) {
            final HashCode hash = DistinctHash.of(value);
            if (hash.equals(lastHash)) {
                return false;
            }
            lastHash = hash;
            return true;
        }

        @Override
        public void save(@Nonnull ContinuationProto.DistinctContinuation.Builder builder) {
            if (lastHash != null) {
                builder.setLastHash(ByteString.copyFrom(lastHash.asBytes()));
            }
        }
    }

    /**
     * Keeps the hash of every value.
     */
    static final class UnorderedDistinctMap extends DistinctMap {
        @Nonnull
        private final Set<HashCode> hashes;

        UnorderedDistinctMap(@Nonnull Set<HashCode> hashes) {
            this.hashes = hashes;
        }

        @Override
        public boolean add(@Nonnull Value value) {
            return hashes.add(DistinctHash.of(value));
        }

        @Override
        public void save(@Nonnull ContinuationProto.DistinctContinuation.Builder builder) {
            for (HashCode hash : hashes) {
                builder.addHashes(ByteString.copyFrom(hash.asBytes()));
            }
        }
    }
}
