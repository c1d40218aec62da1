/*
 * SkipEmptyPageQueryPipelineStage.java
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

import com.apple.foundationdb.async.AsyncUtil;
import io.docfeed.annotation.API;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.StageAccessChecker;
import io.docfeed.query.logging.KeyValueLogMessage;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage that hides empty intermediate pages from the caller.
 *
 * <p>
 * Stages such as aggregate and order-by return empty pages while they work. This stage keeps pulling until it gets a
 * page with rows, the last page, or a failure, and charges the cost of the skipped pages to the page it returns. A
 * final empty page is only returned if nothing was returned before it or if it has to carry the cost of skipped
 * pages. Any number of consecutive empty pages is handled in constant stack depth.
 * </p>
 */
@API(API.Status.INTERNAL)
public class SkipEmptyPageQueryPipelineStage implements QueryPipelineStage {
    private static final Logger LOGGER = LoggerFactory.getLogger(SkipEmptyPageQueryPipelineStage.class);

    @Nonnull
    private final QueryPipelineStage inner;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private double pendingCharge;
    private long pendingSkipped;
    @Nonnull
    private String lastActivityId = "";
    private boolean returnedAnyPage;
    private boolean innerExhausted;
    private boolean exhausted;
    private boolean closed;

    public SkipEmptyPageQueryPipelineStage(@Nonnull QueryPipelineStage inner) {
        this.inner = inner;
    }

    @Nonnull
    @Override
    public Result<QueryPage, QueryCoreException> getCurrent() {
        return StageAccessChecker.checkCurrent(current, this);
    }

    @Nonnull
    @Override
    public CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace) {
        StageAccessChecker.checkMoveNext(exhausted, this);
        current = null;
        if (innerExhausted) {
            exhausted = true;
            return AsyncUtil.READY_FALSE;
        }
        return AsyncUtil.whileTrue(() -> inner.moveNext(trace).thenApply(this::onInnerPage), getExecutor())
                .thenApply(vignore -> {
                    if (current == null) {
                        exhausted = true;
                        return false;
                    }
                    return true;
                });
    }

    // Returns whether to keep pulling.
    private boolean onInnerPage(boolean hasNext) {
        if (!hasNext) {
            finish();
            return false;
        }
        final Result<QueryPage, QueryCoreException> result = inner.getCurrent();
        if (!result.isSuccess()) {
            current = result;
            return false;
        }
        final QueryPage page = result.getValue();
        lastActivityId = page.getActivityId();
        if (page.isEmpty()) {
            pendingCharge += page.getRequestCharge();
            if (page.getState() != null) {
                pendingSkipped++;
                return true;
            }
            finish();
            return false;
        }
        emit(page);
        return false;
    }

    // The inner stage has no more rows: return a last empty page only if nothing was returned or charge is pending.
    private void finish() {
        innerExhausted = true;
        if (!returnedAnyPage || pendingCharge > 0) {
            emit(QueryPage.empty(0.0, lastActivityId, null));
        }
    }

    private void emit(@Nonnull QueryPage page) {
        if (pendingSkipped > 0 && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("skipped empty pages",
                    LogMessageKeys.EMPTY_PAGES_SKIPPED, pendingSkipped,
                    LogMessageKeys.REQUEST_CHARGE, pendingCharge));
        }
        current = Result.success(page.withRequestCharge(page.getRequestCharge() + pendingCharge));
        pendingCharge = 0.0;
        pendingSkipped = 0;
        returnedAnyPage = true;
    }

    @Nonnull
    @Override
    public Executor getExecutor() {
        return inner.getExecutor();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            inner.close();
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }
}
