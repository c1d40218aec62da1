/*
 * FeedRangeProvider.java
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
import io.docfeed.query.CancellationToken;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves the physical feed ranges of a collection.
 */
@API(API.Status.STABLE)
public interface FeedRangeProvider {
    /**
     * Get the current physical ranges, ordered by their minimum key.
     * @param trace diagnostics handle
     * @param cancellation cancellation of the whole query
     * @return the ranges or the failure
     */
    @Nonnull
    CompletableFuture<Result<List<FeedRange>, QueryCoreException>> monadicGetFeedRanges(@Nonnull QueryTrace trace,
                                                                                       @Nonnull CancellationToken cancellation);

    /**
     * Get the current physical ranges that overlap {@code feedRange}. After a split these are the children of
     * {@code feedRange}; after a merge it is the single range that now contains it.
     *
     * @param feedRange a range that was reported gone
     * @param trace diagnostics handle
     * @param cancellation cancellation of the whole query
     * @return the overlapping ranges, ordered by their minimum key, or the failure
     */
    @Nonnull
    CompletableFuture<Result<List<FeedRange>, QueryCoreException>> monadicGetChildRanges(@Nonnull FeedRange feedRange,
                                                                                        @Nonnull QueryTrace trace,
                                                                                        @Nonnull CancellationToken cancellation);

    /**
     * Drop any cached topology so that the next lookup sees the backend's current ranges.
     * @param trace diagnostics handle
     * @param cancellation cancellation of the whole query
     * @return a future that completes when the refresh is done
     */
    @Nonnull
    CompletableFuture<Void> refreshFeedRanges(@Nonnull QueryTrace trace, @Nonnull CancellationToken cancellation);
}
