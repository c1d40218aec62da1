/*
 * CrossPartitionRangePageEnumerator.java
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

import com.apple.foundationdb.async.AsyncUtil;
import io.docfeed.annotation.API;
import io.docfeed.query.CancellationToken;
import io.docfeed.query.QueryCancelledException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.logging.KeyValueLogMessage;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Reads pages from many feed ranges, one range at a time, in the order given by a comparator over the ranges'
 * enumerators.
 *
 * <p>
 * Each {@link #moveNext} takes the best ranked enumerator from the working set and reads one page from it. With
 * {@link PrefetchPolicy#PREFETCH_ALL}, the next page of every other enumerator in the working set is requested at the
 * same time. All fetches go through one {@link FetchLimiter}, so no more than the configured number are ever in
 * flight.
 * </p>
 *
 * <p>
 * A range that the backend reports {@linkplain FeedRangeGoneException gone} is repaired here and never surfaces to
 * the caller:
 * </p>
 * <ul>
 *     <li>After a split, the range is replaced by one enumerator per child range, each starting from the parent's
 *     state. Child states are positions within the parent's order, so nothing is read twice or skipped.</li>
 *     <li>After a merge, the range and every other enumerator inside the merged range, including those the owner holds
 *     outside the working set (see {@link MergeParticipants}), are replaced by one enumerator over the merged range.
 *     It starts from the lowest of their states, so rows after that point in the other ranges may be delivered
 *     again.</li>
 * </ul>
 *
 * @param <E> type of the range enumerators
 */
@API(API.Status.INTERNAL)
public class CrossPartitionRangePageEnumerator<E extends PartitionRangePageEnumerator> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrossPartitionRangePageEnumerator.class);

    /**
     * Builds the enumerators that replace a range which is gone.
     * @param <E> type of the range enumerators
     */
    public interface ChildEnumeratorFactory<E extends PartitionRangePageEnumerator> {
        @Nonnull
        E createForSplit(@Nonnull E parent, @Nonnull FeedRange childRange);

        @Nonnull
        E createForMerge(@Nonnull List<E> parents, @Nonnull FeedRange mergedRange);
    }

    /**
     * Gives up enumerators that the owner holds outside the working set when their range is merged away.
     * @param <E> type of the range enumerators
     */
    @FunctionalInterface
    public interface MergeParticipants<E extends PartitionRangePageEnumerator> {
        @Nonnull
        List<E> removeWithin(@Nonnull FeedRange mergedRange);
    }

    @Nonnull
    private final FeedRangeProvider feedRangeProvider;
    @Nonnull
    private final PriorityQueue<E> enumerators;
    @Nonnull
    private final Comparator<? super E> comparator;
    @Nonnull
    private final ChildEnumeratorFactory<E> childEnumeratorFactory;
    @Nullable
    private final MergeParticipants<E> mergeParticipants;
    @Nonnull
    private final FetchLimiter limiter;
    @Nonnull
    private final PrefetchPolicy prefetchPolicy;
    private final boolean reinsertAfterPage;
    @Nonnull
    private final CancellationToken cancellation;
    @Nonnull
    private final Executor executor;

    @Nullable
    private Result<CrossFeedRangePage<E>, QueryCoreException> current;
    private boolean closed;

    /**
     * Create an enumerator over a working set of range enumerators.
     *
     * @param feedRangeProvider resolves child ranges when a range is gone
     * @param initial the starting working set
     * @param comparator ranks the working set; the least enumerator is read next
     * @param childEnumeratorFactory creates enumerators for ranges after a split or merge
     * @param mergeParticipants enumerators held outside the working set, or {@code null} if there are none
     * @param limiter bound on fetches in flight, shared with the range enumerators
     * @param prefetchPolicy how eagerly to fetch other ranges
     * @param reinsertAfterPage whether an enumerator goes back into the working set after it returns a page;
     * if not, the owner hands it back with {@link #enqueue} when it needs another page
     * @param cancellation cancellation of the query
     * @param executor executor for asynchronous loops
     */
    public CrossPartitionRangePageEnumerator(@Nonnull FeedRangeProvider feedRangeProvider,
                                             @Nonnull Collection<E> initial,
                                             @Nonnull Comparator<? super E> comparator,
                                             @Nonnull ChildEnumeratorFactory<E> childEnumeratorFactory,
                                             @Nullable MergeParticipants<E> mergeParticipants,
                                             @Nonnull FetchLimiter limiter,
                                             @Nonnull PrefetchPolicy prefetchPolicy,
                                             boolean reinsertAfterPage,
                                             @Nonnull CancellationToken cancellation,
                                             @Nonnull Executor executor) {
        this.feedRangeProvider = feedRangeProvider;
        this.comparator = comparator;
        this.enumerators = new PriorityQueue<>(Math.max(1, initial.size()), comparator);
        this.enumerators.addAll(initial);
        this.childEnumeratorFactory = childEnumeratorFactory;
        this.mergeParticipants = mergeParticipants;
        this.limiter = limiter;
        this.prefetchPolicy = prefetchPolicy;
        this.reinsertAfterPage = reinsertAfterPage;
        this.cancellation = cancellation;
        this.executor = executor;
    }

    /**
     * Read the next page from the best ranked range.
     *
     * @param trace diagnostics handle
     * @return a future completing with {@code false} when the working set is empty, and otherwise with {@code true}
     * once {@link #getCurrent()} holds a page or a failure
     */
    @Nonnull
    public CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace) {
        current = null;
        return AsyncUtil.whileTrue(() -> step(trace), executor).thenApply(vignore -> current != null);
    }

    // Returns whether to go around again: a drained enumerator was dropped or a gone range was repaired.
    @Nonnull
    private CompletableFuture<Boolean> step(@Nonnull QueryTrace trace) {
        if (cancellation.isCancellationRequested()) {
            current = Result.failure(new QueryCancelledException("query was cancelled"));
            return AsyncUtil.READY_FALSE;
        }
        final E next = enumerators.poll();
        if (next == null) {
            return AsyncUtil.READY_FALSE;
        }
        if (prefetchPolicy == PrefetchPolicy.PREFETCH_ALL) {
            prefetchWorkingSet(trace);
        }
        return next.moveNext(trace).thenCompose(hasPage -> {
            if (!hasPage) {
                return AsyncUtil.READY_TRUE;
            }
            final Result<QueryPage, QueryCoreException> result = next.getCurrent();
            if (result.isSuccess()) {
                if (reinsertAfterPage && !next.isDrained()) {
                    enumerators.add(next);
                }
                current = Result.success(new CrossFeedRangePage<>(result.getValue(), next));
                return AsyncUtil.READY_FALSE;
            }
            if (result.getError() instanceof FeedRangeGoneException) {
                return repair(next, trace).thenApply(repairFailure -> {
                    if (repairFailure == null) {
                        return true;
                    }
                    enumerators.add(next);
                    current = Result.failure(repairFailure);
                    return false;
                });
            }
            // keep the range so that the next call retries it
            enumerators.add(next);
            current = Result.failure(result.getError());
            return AsyncUtil.READY_FALSE;
        });
    }

    private void prefetchWorkingSet(@Nonnull QueryTrace trace) {
        final List<E> ranked = new ArrayList<>(enumerators);
        ranked.sort(comparator);
        for (E enumerator : ranked) {
            enumerator.prefetch(trace);
        }
    }

    // Completes with null once the working set has been repaired, or with the reason it could not be.
    @Nonnull
    private CompletableFuture<QueryCoreException> repair(@Nonnull E gone, @Nonnull QueryTrace trace) {
        final FeedRange range = gone.getFeedRange();
        return resolveChildRanges(range, trace, true).thenApply(childRanges -> {
            if (!childRanges.isSuccess()) {
                return childRanges.getError();
            }
            final List<FeedRange> children = childRanges.getValue();
            if (children.size() > 1 && children.stream().allMatch(range::contains)) {
                split(gone, children);
                return null;
            }
            if (children.size() == 1 && children.get(0).contains(range)) {
                merge(gone, children.get(0));
                return null;
            }
            if (LOGGER.isInfoEnabled()) {
                LOGGER.info(KeyValueLogMessage.of("unsupported feed range topology change",
                        LogMessageKeys.FEED_RANGE, range,
                        LogMessageKeys.CHILD_RANGES, children));
            }
            return new QueryCoreException("unsupported feed range topology change",
                    LogMessageKeys.FEED_RANGE, range,
                    LogMessageKeys.CHILD_RANGES, children);
        });
    }

    @Nonnull
    private CompletableFuture<Result<List<FeedRange>, QueryCoreException>> resolveChildRanges(@Nonnull FeedRange range,
                                                                                              @Nonnull QueryTrace trace,
                                                                                              boolean mayRefresh) {
        return feedRangeProvider.monadicGetChildRanges(range, trace, cancellation).thenCompose(result -> {
            if (!result.isSuccess() || !isStale(range, result.getValue())) {
                return CompletableFuture.completedFuture(result);
            }
            if (mayRefresh) {
                if (LOGGER.isInfoEnabled()) {
                    LOGGER.info(KeyValueLogMessage.of("refreshing feed ranges after gone range resolved to itself",
                            LogMessageKeys.FEED_RANGE, range));
                }
                return feedRangeProvider.refreshFeedRanges(trace, cancellation)
                        .thenCompose(vignore -> resolveChildRanges(range, trace, false));
            }
            return CompletableFuture.completedFuture(Result.failure(
                    new QueryCoreException("feed range is gone but no replacement ranges were found",
                            LogMessageKeys.FEED_RANGE, range,
                            LogMessageKeys.CHILD_RANGES, result.getValue())));
        });
    }

    private static boolean isStale(@Nonnull FeedRange range, @Nonnull List<FeedRange> children) {
        return children.isEmpty() || (children.size() == 1 && children.get(0).equals(range));
    }

    private void split(@Nonnull E parent, @Nonnull List<FeedRange> children) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("repairing split feed range",
                    LogMessageKeys.FEED_RANGE, parent.getFeedRangeState(),
                    LogMessageKeys.CHILD_RANGES, children));
        }
        for (FeedRange child : children) {
            enumerators.add(childEnumeratorFactory.createForSplit(parent, child));
        }
    }

    private void merge(@Nonnull E gone, @Nonnull FeedRange mergedRange) {
        final List<E> parents = new ArrayList<>();
        parents.add(gone);
        enumerators.removeIf(enumerator -> {
            if (mergedRange.contains(enumerator.getFeedRange())) {
                parents.add(enumerator);
                return true;
            }
            return false;
        });
        if (mergeParticipants != null) {
            parents.addAll(mergeParticipants.removeWithin(mergedRange));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("repairing merged feed range",
                    LogMessageKeys.FEED_RANGE, mergedRange,
                    LogMessageKeys.MERGED_RANGES, parents.stream().map(PartitionRangePageEnumerator::getFeedRangeState).collect(Collectors.toList())));
        }
        enumerators.add(childEnumeratorFactory.createForMerge(parents, mergedRange));
    }

    /**
     * The least progressed state of a set of enumerators, {@code null} if any of them has not started.
     * @param enumerators enumerators over ranges being merged
     * @return the lowest state
     */
    @Nullable
    public static QueryState lowestState(@Nonnull Collection<? extends PartitionRangePageEnumerator> enumerators) {
        QueryState lowest = null;
        boolean first = true;
        for (PartitionRangePageEnumerator enumerator : enumerators) {
            final QueryState state = enumerator.getFeedRangeState().getState();
            if (first || QueryState.compareNullable(state, lowest) < 0) {
                lowest = state;
                first = false;
            }
        }
        return lowest;
    }

    /**
     * Put an enumerator (back) into the working set.
     * @param enumerator the enumerator
     */
    public void enqueue(@Nonnull E enumerator) {
        enumerators.add(enumerator);
    }

    public boolean isEmpty() {
        return enumerators.isEmpty();
    }

    /**
     * The enumerators in the working set, ordered by range.
     * @return a snapshot of the working set
     */
    @Nonnull
    public List<E> getEnumerators() {
        final List<E> snapshot = new ArrayList<>(enumerators);
        snapshot.sort(Comparator.comparing(PartitionRangePageEnumerator::getFeedRange));
        return snapshot;
    }

    @Nullable
    public Result<CrossFeedRangePage<E>, QueryCoreException> getCurrent() {
        return current;
    }

    @Nonnull
    public FetchLimiter getLimiter() {
        return limiter;
    }

    @Nonnull
    public Executor getExecutor() {
        return executor;
    }

    @Override
    public void close() {
        closed = true;
        enumerators.clear();
    }

    public boolean isClosed() {
        return closed;
    }
}
