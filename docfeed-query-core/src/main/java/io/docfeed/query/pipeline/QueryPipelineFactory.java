/*
 * QueryPipelineFactory.java
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

import io.docfeed.annotation.API;
import io.docfeed.query.CancellationToken;
import io.docfeed.query.QueryCoreArgumentException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPaginationOptions;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.SqlQuerySpec;
import io.docfeed.query.logging.KeyValueLogMessage;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pagination.DocumentContainer;
import io.docfeed.query.pagination.FeedRange;
import io.docfeed.query.pagination.PrefetchPolicy;
import io.docfeed.query.pipeline.aggregate.AggregateQueryPipelineStage;
import io.docfeed.query.pipeline.crosspartition.NonStreamingOrderByQueryPipelineStage;
import io.docfeed.query.pipeline.crosspartition.OrderByCrossPartitionQueryPipelineStage;
import io.docfeed.query.pipeline.crosspartition.ParallelCrossPartitionQueryPipelineStage;
import io.docfeed.query.pipeline.dcount.DCountQueryPipelineStage;
import io.docfeed.query.pipeline.distinct.DistinctQueryPipelineStage;
import io.docfeed.query.pipeline.groupby.GroupByQueryPipelineStage;
import io.docfeed.query.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds the chain of stages that evaluates a cross-partition query from its {@link QueryInfo}.
 *
 * <p>
 * From the inside out the chain is: the source (order-by or parallel), aggregate, distinct, group by, skip, limit,
 * top, distinct count, the stage that hides empty pages and the stage that catches failures. Stages the plan does
 * not need are left out. Each stage reads its own part of a continuation and hands the rest to the stage inside it,
 * so a continuation from another query fails with a {@link io.docfeed.query.MalformedContinuationTokenException}
 * before anything is fetched.
 * </p>
 *
 * <pre><code>
 * QueryPipelineFactory factory = QueryPipelineFactory.newBuilder()
 *         .setDocumentContainer(container)
 *         .setExecutor(executor)
 *         .build();
 * Result&lt;QueryPipelineStage, QueryCoreException&gt; pipeline =
 *         factory.create(querySpec, targetRanges, queryInfo, QueryPaginationOptions.DEFAULT, cancellation, continuation);
 * </code></pre>
 */
@API(API.Status.UNSTABLE)
public class QueryPipelineFactory {
    /**
     * With {@code TOP}, each range is asked for this many times the top count per page, since only the first rows
     * of the merged result survive.
     */
    public static final int PAGE_SIZE_FACTOR_FOR_TOP = 5;
    public static final int DEFAULT_MAX_CONCURRENCY = 10;

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryPipelineFactory.class);

    @Nonnull
    private final DocumentContainer documentContainer;
    private final int maxConcurrency;
    @Nonnull
    private final PrefetchPolicy prefetchPolicy;
    @Nonnull
    private final Executor executor;

    private QueryPipelineFactory(@Nonnull Builder builder) {
        this.documentContainer = builder.documentContainer;
        this.maxConcurrency = builder.maxConcurrency;
        this.prefetchPolicy = builder.prefetchPolicy;
        this.executor = builder.executor;
    }

    /**
     * Create the pipeline for a query, first looking up the feed ranges of the collection if none are given.
     *
     * @param querySpec the query
     * @param targetRanges the ranges to query, or an empty list for the whole collection
     * @param queryInfo the query plan
     * @param paginationOptions page size and headers
     * @param trace diagnostics handle for the range lookup
     * @param cancellation cancellation of the query
     * @param continuation the continuation of an earlier page, or {@code null} to start from the beginning
     * @return a future with the pipeline, or the reason it could not be built
     */
    @Nonnull
    public CompletableFuture<Result<QueryPipelineStage, QueryCoreException>> createAsync(@Nonnull SqlQuerySpec querySpec,
                                                                                     @Nonnull List<FeedRange> targetRanges,
                                                                                     @Nonnull QueryInfo queryInfo,
                                                                                     @Nonnull QueryPaginationOptions paginationOptions,
                                                                                     @Nonnull QueryTrace trace,
                                                                                     @Nonnull CancellationToken cancellation,
                                                                                     @Nullable QueryState continuation) {
        if (!targetRanges.isEmpty()) {
            return CompletableFuture.completedFuture(
                    create(querySpec, targetRanges, queryInfo, paginationOptions, cancellation, continuation));
        }
        return documentContainer.monadicGetFeedRanges(trace, cancellation).thenApply(ranges ->
                ranges.flatMap(resolved -> create(querySpec, resolved, queryInfo, paginationOptions, cancellation, continuation)));
    }

    /**
     * Create the pipeline for a query over the given ranges.
     *
     * @param querySpec the query
     * @param targetRanges the ranges to query
     * @param queryInfo the query plan
     * @param paginationOptions page size and headers
     * @param cancellation cancellation of the query
     * @param continuation the continuation of an earlier page, or {@code null} to start from the beginning
     * @return the pipeline, or the reason it could not be built
     */
    @Nonnull
    public Result<QueryPipelineStage, QueryCoreException> create(@Nonnull SqlQuerySpec querySpec,
                                                               @Nonnull List<FeedRange> targetRanges,
                                                               @Nonnull QueryInfo queryInfo,
                                                               @Nonnull QueryPaginationOptions paginationOptions,
                                                               @Nonnull CancellationToken cancellation,
                                                               @Nullable QueryState continuation) {
        if (targetRanges.isEmpty()) {
            return Result.failure(new QueryCoreArgumentException("query has no target ranges"));
        }
        final SqlQuerySpec sourceQuerySpec = queryInfo.getRewrittenQuery() == null
                                             ? querySpec
                                             : querySpec.withQueryText(queryInfo.getRewrittenQuery());
        final int pageSize = paginationOptions.getPageSizeLimit();
        final QueryPaginationOptions sourceOptions = queryInfo.hasTop()
                ? paginationOptions.withPageSizeLimit((int)Math.min(Integer.MAX_VALUE,
                        Math.max(pageSize, queryInfo.getTop() * PAGE_SIZE_FACTOR_FOR_TOP)))
                : paginationOptions;
        final List<String> stageNames = new ArrayList<>();

        StageFactory factory = sourceFactory(sourceQuerySpec, targetRanges, queryInfo, sourceOptions, cancellation, stageNames);
        if (queryInfo.hasAggregates() && !queryInfo.hasGroupBy()) {
            final StageFactory inner = factory;
            factory = state -> AggregateQueryPipelineStage.monadicCreate(queryInfo, state, inner);
            stageNames.add("aggregate");
        }
        if (queryInfo.hasDistinct()) {
            final StageFactory inner = factory;
            factory = state -> DistinctQueryPipelineStage.monadicCreate(queryInfo.getDistinctType(), state, inner);
            stageNames.add("distinct");
        }
        if (queryInfo.hasGroupBy()) {
            final StageFactory inner = factory;
            factory = state -> GroupByQueryPipelineStage.monadicCreate(queryInfo, pageSize, executor, state,
                    inner);
            stageNames.add("groupBy");
        }
        if (queryInfo.hasOffset()) {
            final StageFactory inner = factory;
            final long offset = queryInfo.getOffset();
            factory = state -> SkipQueryPipelineStage.monadicCreate(offset, state, inner);
            stageNames.add("skip");
        }
        if (queryInfo.hasLimit()) {
            final StageFactory inner = factory;
            final long limit = queryInfo.getLimit();
            factory = state -> TakeQueryPipelineStage.monadicCreateLimitStage(limit, state, inner);
            stageNames.add("limit");
        }
        if (queryInfo.hasTop()) {
            final StageFactory inner = factory;
            final long top = queryInfo.getTop();
            factory = state -> TakeQueryPipelineStage.monadicCreateTopStage(top, state, inner);
            stageNames.add("top");
        }
        if (queryInfo.hasDCount()) {
            final StageFactory inner = factory;
            factory = state -> DCountQueryPipelineStage.monadicCreate(queryInfo.getDCountAlias(), state, inner);
            stageNames.add("dcount");
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("creating query pipeline",
                    LogMessageKeys.STAGE_KIND, stageNames,
                    LogMessageKeys.RANGE_COUNT, targetRanges.size(),
                    LogMessageKeys.PAGE_SIZE, sourceOptions.getPageSizeLimit(),
                    LogMessageKeys.CONTINUATION, continuation));
        }

        final Result<QueryPipelineStage, QueryCoreException> pipeline;
        try {
            pipeline = factory.create(continuation);
        } catch (QueryCoreException ex) {
            return Result.failure(ex);
        }
        return pipeline.map(stage -> new CatchAllQueryPipelineStage(new SkipEmptyPageQueryPipelineStage(stage)));
    }

    @Nonnull
    private StageFactory sourceFactory(@Nonnull SqlQuerySpec querySpec, @Nonnull List<FeedRange> targetRanges,
                                       @Nonnull QueryInfo queryInfo, @Nonnull QueryPaginationOptions sourceOptions,
                                       @Nonnull CancellationToken cancellation, @Nonnull List<String> stageNames) {
        if (!queryInfo.hasOrderBy()) {
            stageNames.add("parallel");
            return state -> ParallelCrossPartitionQueryPipelineStage.monadicCreate(documentContainer, querySpec,
                    targetRanges, sourceOptions, maxConcurrency, prefetchPolicy, executor, cancellation, state);
        }
        if (queryInfo.isNonStreamingOrderBy()) {
            stageNames.add("nonStreamingOrderBy");
            final Long maxRetained = maxRetained(queryInfo);
            return state -> NonStreamingOrderByQueryPipelineStage.monadicCreate(documentContainer, querySpec,
                    targetRanges, queryInfo.getOrderBy(), maxRetained, sourceOptions, maxConcurrency, executor,
                    cancellation, state);
        }
        stageNames.add("orderBy");
        final OrderByCrossPartitionQueryPipelineStage.Builder builder = OrderByCrossPartitionQueryPipelineStage.newBuilder()
                .setDocumentContainer(documentContainer)
                .setQuerySpec(querySpec)
                .setTargetRanges(targetRanges)
                .setOrderBy(queryInfo.getOrderBy(), queryInfo.getOrderByExpressions())
                .setPaginationOptions(sourceOptions)
                .setMaxConcurrency(maxConcurrency)
                .setPrefetchPolicy(prefetchPolicy)
                .setExecutor(executor)
                .setCancellation(cancellation);
        return builder::monadicCreate;
    }

    // Only the rows that can still be returned after OFFSET and LIMIT, or TOP, need to be kept.
    @Nullable
    private static Long maxRetained(@Nonnull QueryInfo queryInfo) {
        if (queryInfo.hasTop()) {
            return queryInfo.getTop();
        }
        if (queryInfo.hasLimit()) {
            return queryInfo.getLimit() + (queryInfo.hasOffset() ? queryInfo.getOffset() : 0L);
        }
        return null;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * A builder for {@link QueryPipelineFactory}.
     */
    public static class Builder {
        @Nullable
        private DocumentContainer documentContainer;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        @Nonnull
        private PrefetchPolicy prefetchPolicy = PrefetchPolicy.PREFETCH_SINGLE_PAGE;
        @Nullable
        private Executor executor;

        private Builder() {
        }

        @Nonnull
        public Builder setDocumentContainer(@Nonnull DocumentContainer documentContainer) {
            this.documentContainer = documentContainer;
            return this;
        }

        /**
         * Set the maximum number of backend fetches in flight for one query. Zero means one at a time.
         * @param maxConcurrency the maximum
         * @return this builder
         */
        @Nonnull
        public Builder setMaxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 0) {
                throw new QueryCoreArgumentException("max concurrency must not be negative",
                        LogMessageKeys.MAX_CONCURRENCY, maxConcurrency);
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        @Nonnull
        public Builder setPrefetchPolicy(@Nonnull PrefetchPolicy prefetchPolicy) {
            this.prefetchPolicy = prefetchPolicy;
            return this;
        }

        @Nonnull
        public Builder setExecutor(@Nonnull Executor executor) {
            this.executor = executor;
            return this;
        }

        @Nonnull
        public QueryPipelineFactory build() {
            if (documentContainer == null || executor == null) {
                throw new QueryCoreArgumentException("document container and executor are required");
            }
            return new QueryPipelineFactory(this);
        }
    }
}
