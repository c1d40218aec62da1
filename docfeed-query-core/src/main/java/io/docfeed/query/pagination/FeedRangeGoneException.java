/*
 * FeedRangeGoneException.java
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
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;

/**
 * The backend no longer serves a feed range as one partition, because it was split or merged. Reported by a
 * {@link MonadicQueryDataSource} and repaired by {@link CrossPartitionRangePageEnumerator}; callers of a pipeline
 * never see it.
 */
@API(API.Status.STABLE)
public class FeedRangeGoneException extends QueryCoreException {
    private static final long serialVersionUID = 1;

    @Nonnull
    private final transient FeedRange feedRange;

    public FeedRangeGoneException(@Nonnull FeedRange feedRange) {
        super("feed range is gone", LogMessageKeys.FEED_RANGE, feedRange);
        this.feedRange = feedRange;
    }

    @Nonnull
    public FeedRange getFeedRange() {
        return feedRange;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
