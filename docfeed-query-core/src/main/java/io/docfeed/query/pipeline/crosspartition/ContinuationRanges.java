/*
 * ContinuationRanges.java
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

package io.docfeed.query.pipeline.crosspartition;

import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryState;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pagination.FeedRange;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the feed ranges of a cross-partition continuation against the ranges the query targets.
 *
 * The ranges of a continuation may be finer or coarser than the current target ranges, since the topology may have
 * changed since it was produced, but they must not overlap one another and must lie within the targeted span.
 */
@API(API.Status.INTERNAL)
public final class ContinuationRanges {

    /**
     * Validate continuation ranges.
     *
     * @param continuationRanges ranges named by the continuation
     * @param targetRanges ranges the query is run against
     * @param continuation the raw continuation, for diagnostics
     * @throws MalformedContinuationTokenException if the continuation names no range, ranges that overlap, or
     * ranges outside the target span
     */
    public static void validate(@Nonnull List<FeedRange> continuationRanges,
                                @Nonnull List<FeedRange> targetRanges,
                                @Nonnull QueryState continuation) {
        if (continuationRanges.isEmpty()) {
            throw new MalformedContinuationTokenException("continuation has no feed ranges",
                    LogMessageKeys.RAW_BYTES, continuation);
        }
        final List<FeedRange> sorted = new ArrayList<>(continuationRanges);
        sorted.sort(null);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).overlaps(sorted.get(i))) {
                throw new MalformedContinuationTokenException("continuation has overlapping feed ranges",
                        LogMessageKeys.FEED_RANGE, sorted.get(i),
                        LogMessageKeys.RAW_BYTES, continuation);
            }
        }
        if (targetRanges.isEmpty()) {
            return;
        }
        final FeedRange span = span(targetRanges);
        for (FeedRange range : sorted) {
            if (!span.contains(range)) {
                throw new MalformedContinuationTokenException("continuation feed range is outside the target ranges",
                        LogMessageKeys.FEED_RANGE, range,
                        LogMessageKeys.EXPECTED, span,
                        LogMessageKeys.RAW_BYTES, continuation);
            }
        }
    }

    /**
     * The smallest range covering all of the given ranges.
     * @param ranges a non-empty list of ranges
     * @return the covering range
     */
    @Nonnull
    public static FeedRange span(@Nonnull List<FeedRange> ranges) {
        String min = null;
        String max = null;
        for (FeedRange range : ranges) {
            if (min == null || range.getMin().compareTo(min) < 0) {
                min = range.getMin();
            }
            if (max == null || range.getMax().compareTo(max) > 0) {
                max = range.getMax();
            }
        }
        return new FeedRange(min, max);
    }

    private ContinuationRanges() {
    }
}
