/*
 * MonadicQueryDataSource.java
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
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPaginationOptions;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import java.util.concurrent.CompletableFuture;

/**
 * Issues one query request against one feed range.
 *
 * <p>
 * Implementations return failures as values: a range that is no longer a single partition yields a
 * {@link FeedRangeGoneException}, a throttled or otherwise failed request a
 * {@link io.docfeed.query.BackendRequestException}. The pipeline may call this concurrently for different ranges.
 * </p>
 */
@API(API.Status.STABLE)
public interface MonadicQueryDataSource {
    /**
     * Fetch the page of {@code feedRangeState}'s range that starts at its state.
     *
     * @param querySpec the query to run
     * @param feedRangeState the range, and where in it to start ({@code null} state for the beginning)
     * @param paginationOptions page size and headers
     * @param trace diagnostics handle
     * @param cancellation cancellation of the whole query
     * @return the page, whose state is {@code null} if the range has no more pages, or the failure
     */
    @Nonnull
    CompletableFuture<Result<QueryPage, QueryCoreException>> monadicQuery(@Nonnull SqlQuerySpec querySpec,
                                                                          @Nonnull FeedRangeState feedRangeState,
                                                                          @Nonnull QueryPaginationOptions paginationOptions,
                                                                          @Nonnull QueryTrace trace,
                                                                          @Nonnull CancellationToken cancellation);
}
