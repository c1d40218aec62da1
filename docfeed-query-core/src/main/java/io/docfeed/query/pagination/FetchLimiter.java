/*
 * FetchLimiter.java
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
import io.docfeed.query.QueryCancelledException;
import io.docfeed.query.QueryCoreArgumentException;
import io.docfeed.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Bounds the number of backend fetches in flight at once across all ranges of a query.
 *
 * <p>
 * Fetches beyond the bound wait in arrival order and start as earlier ones complete, so every submitted fetch
 * eventually runs. When the query is cancelled, waiting fetches complete exceptionally with a
 * {@link QueryCancelledException} without running.
 * </p>
 */
@API(API.Status.INTERNAL)
public class FetchLimiter {
    private final int maxInFlight;
    @Nonnull
    private final CancellationToken cancellation;
    @Nonnull
    private final Deque<Runnable> waiting = new ArrayDeque<>();
    private int inFlight;
    private int highWaterMark;

    /**
     * Create a limiter.
     * @param maxConcurrency maximum number of fetches in flight; {@code 0} means one at a time
     * @param cancellation cancellation of the query the fetches belong to
     */
    public FetchLimiter(int maxConcurrency, @Nonnull CancellationToken cancellation) {
        if (maxConcurrency < 0) {
            throw new QueryCoreArgumentException("max concurrency must not be negative",
                    LogMessageKeys.MAX_CONCURRENCY, maxConcurrency);
        }
        this.maxInFlight = Math.max(1, maxConcurrency);
        this.cancellation = cancellation;
        cancellation.onCancel(this::cancelWaiting);
    }

    /**
     * Run {@code fetch} now if a slot is free, or once one frees up.
     * @param fetch starts the fetch
     * @param <T> result type of the fetch
     * @return a future completed with the fetch's outcome
     */
    @Nonnull
    public <T> CompletableFuture<T> submit(@Nonnull Supplier<CompletableFuture<T>> fetch) {
        final CompletableFuture<T> result = new CompletableFuture<>();
        final Runnable start = () -> start(fetch, result);
        final boolean runNow;
        synchronized (this) {
            runNow = inFlight < maxInFlight;
            if (runNow) {
                acquired();
            } else {
                waiting.addLast(start);
            }
        }
        if (runNow) {
            start.run();
        }
        return result;
    }

    private <T> void start(@Nonnull Supplier<CompletableFuture<T>> fetch, @Nonnull CompletableFuture<T> result) {
        if (cancellation.isCancellationRequested()) {
            release();
            result.completeExceptionally(new QueryCancelledException("fetch cancelled before it started"));
            return;
        }
        final CompletableFuture<T> started;
        try {
            started = fetch.get();
        } catch (RuntimeException ex) {
            release();
            result.completeExceptionally(ex);
            return;
        }
        started.whenComplete((value, err) -> {
            release();
            if (err != null) {
                result.completeExceptionally(err);
            } else {
                result.complete(value);
            }
        });
    }

    private void acquired() {
        inFlight++;
        highWaterMark = Math.max(highWaterMark, inFlight);
    }

    private void release() {
        final Runnable next;
        synchronized (this) {
            next = waiting.pollFirst();
            if (next == null) {
                inFlight--;
            }
            // otherwise the slot passes straight to next
        }
        if (next != null) {
            next.run();
        }
    }

    private void cancelWaiting() {
        final List<Runnable> toCancel;
        synchronized (this) {
            toCancel = new ArrayList<>(waiting);
            waiting.clear();
            inFlight += toCancel.size();
        }
        // each start sees the cancellation, fails its future and gives its slot back
        toCancel.forEach(Runnable::run);
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public synchronized int getInFlight() {
        return inFlight;
    }

    /**
     * The largest number of fetches that were ever in flight together.
     * @return the high water mark
     */
    public synchronized int getHighWaterMark() {
        return highWaterMark;
    }
}
