/*
 * FetchLimiterTest.java
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

import io.docfeed.query.CancellationToken;
import io.docfeed.query.QueryCancelledException;
import io.docfeed.query.QueryCoreArgumentException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FetchLimiter}.
 */
public class FetchLimiterTest {
    @Test
    public void boundsFetchesInFlight() {
        final FetchLimiter limiter = new FetchLimiter(3, CancellationToken.none());
        final List<CompletableFuture<Integer>> backend = new ArrayList<>();
        final List<CompletableFuture<Integer>> results = new ArrayList<>();
        final AtomicInteger started = new AtomicInteger();
        for (int i = 0; i < 10; i++) {
            final CompletableFuture<Integer> fetch = new CompletableFuture<>();
            backend.add(fetch);
            results.add(limiter.submit(() -> {
                started.incrementAndGet();
                return fetch;
            }));
        }
        assertThat(started).hasValue(3);
        assertThat(limiter.getInFlight()).isEqualTo(3);

        for (int i = 0; i < 10; i++) {
            backend.get(i).complete(i);
            assertThat(limiter.getInFlight()).isLessThanOrEqualTo(3);
        }
        assertThat(started).hasValue(10);
        assertThat(limiter.getHighWaterMark()).isEqualTo(3);
        assertThat(limiter.getInFlight()).isZero();
        for (int i = 0; i < 10; i++) {
            assertThat(results.get(i).join()).isEqualTo(i);
        }
    }

    @Test
    public void zeroMeansOneAtATime() {
        final FetchLimiter limiter = new FetchLimiter(0, CancellationToken.none());
        assertThat(limiter.getMaxInFlight()).isEqualTo(1);
    }

    @Test
    public void negativeConcurrencyIsRejected() {
        assertThatThrownBy(() -> new FetchLimiter(-1, CancellationToken.none()))
                .isInstanceOf(QueryCoreArgumentException.class);
    }

    @Test
    public void cancellationFailsWaitingFetches() {
        final CancellationToken cancellation = new CancellationToken();
        final FetchLimiter limiter = new FetchLimiter(1, cancellation);
        final CompletableFuture<String> running = new CompletableFuture<>();
        final AtomicInteger started = new AtomicInteger();
        final CompletableFuture<String> first = limiter.submit(() -> {
            started.incrementAndGet();
            return running;
        });
        final CompletableFuture<String> queued = limiter.submit(() -> {
            started.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        });

        cancellation.cancel();
        assertThatThrownBy(queued::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(QueryCancelledException.class);
        assertThat(started).hasValue(1);

        running.complete("done");
        assertThat(first.join()).isEqualTo("done");
        assertThat(limiter.getInFlight()).isZero();
    }

    @Test
    public void failedFetchReleasesItsSlot() {
        final FetchLimiter limiter = new FetchLimiter(1, CancellationToken.none());
        final CompletableFuture<String> failed = limiter.submit(() -> {
            throw new IllegalStateException("backend exploded");
        });
        assertThat(failed).isCompletedExceptionally();
        assertThat(limiter.submit(() -> CompletableFuture.completedFuture("ok")).join()).isEqualTo("ok");
    }
}
