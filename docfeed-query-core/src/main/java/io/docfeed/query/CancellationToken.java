/*
 * CancellationToken.java
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

package io.docfeed.query;

import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation handle, passed explicitly to every stage and every fetch of a pipeline.
 * Cancelling runs the registered callbacks once; callbacks registered afterwards run immediately.
 */
@API(API.Status.STABLE)
public class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * A fresh token that nobody else holds, and so is never cancelled.
     * @return a new token
     */
    @Nonnull
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Runnable callback : callbacks) {
                callback.run();
            }
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Throw if this token has been cancelled.
     * @throws QueryCancelledException if cancellation was requested
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new QueryCancelledException("query was cancelled");
        }
    }

    public void onCancel(@Nonnull Runnable callback) {
        callbacks.add(callback);
        // cancel() may have raced with the add
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }
}
