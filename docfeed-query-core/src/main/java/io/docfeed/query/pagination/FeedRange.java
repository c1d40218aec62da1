/*
 * FeedRange.java
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

package io.docfeed.query.pagination;

import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreArgumentException;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.proto.ContinuationProto;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Objects;

/**
 * A contiguous slice {@code [min, max)} of the effective partition key space.
 *
 * <p>
 * Keys are upper-case hexadecimal strings and compare as strings. The whole key space is {@link #FULL}, from the
 * empty string to {@code "FF"}. At any time the backend's physical ranges cover the key space exactly once; a split
 * replaces one range by several that cover the same span, and a merge does the opposite.
 * </p>
 */
@API(API.Status.STABLE)
public final class FeedRange implements Comparable<FeedRange> {
    public static final String MINIMUM_KEY = "";
    public static final String MAXIMUM_KEY = "FF";
    public static final FeedRange FULL = new FeedRange(MINIMUM_KEY, MAXIMUM_KEY);

    private static final Comparator<FeedRange> COMPARATOR =
            Comparator.comparing(FeedRange::getMin).thenComparing(FeedRange::getMax);

    @Nonnull
    private final String min;
    @Nonnull
    private final String max;

    public FeedRange(@Nonnull String min, @Nonnull String max) {
        if (min.compareTo(max) >= 0) {
            throw new QueryCoreArgumentException("feed range must not be empty",
                    LogMessageKeys.FEED_RANGE, "[" + min + "," + max + ")");
        }
        this.min = min;
        this.max = max;
    }

    @Nonnull
    public String getMin() {
        return min;
    }

    @Nonnull
    public String getMax() {
        return max;
    }

    public boolean contains(@Nonnull FeedRange other) {
        return min.compareTo(other.min) <= 0 && other.max.compareTo(max) <= 0;
    }

    public boolean contains(@Nonnull String key) {
        return min.compareTo(key) <= 0 && key.compareTo(max) < 0;
    }

    public boolean overlaps(@Nonnull FeedRange other) {
        return min.compareTo(other.max) < 0 && other.min.compareTo(max) < 0;
    }

    @Nonnull
    public ContinuationProto.FeedRange toProto() {
        return ContinuationProto.FeedRange.newBuilder().setMin(min).setMax(max).build();
    }

    /**
     * Read a range back from a continuation.
     * @param proto the serialized range
     * @return the range
     * @throws MalformedContinuationTokenException if the range is empty
     */
    @Nonnull
    public static FeedRange fromProto(@Nonnull ContinuationProto.FeedRange proto) {
        if (proto.getMin().compareTo(proto.getMax()) >= 0) {
            throw new MalformedContinuationTokenException("continuation contains an empty feed range",
                    LogMessageKeys.FEED_RANGE, "[" + proto.getMin() + "," + proto.getMax() + ")");
        }
        return new FeedRange(proto.getMin(), proto.getMax());
    }

    @Override
    public int compareTo(@Nonnull FeedRange o) {
        return COMPARATOR.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeedRange)) {
            return false;
        }
        FeedRange that = (FeedRange)o;
        return min.equals(that.min) && max.equals(that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "[" + min + "," + max + ")";
    }
}
