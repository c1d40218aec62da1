/*
 * BackendRequestException.java
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
import io.docfeed.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;

/**
 * A request to the backend for one feed range failed. The pipeline does not retry these itself; a throttled
 * request is {@linkplain #isRetryable() retryable} by the caller, which may call
 * {@link QueryPipelineStage#moveNext} again.
 */
@API(API.Status.STABLE)
public class BackendRequestException extends QueryCoreException {
    private static final long serialVersionUID = 1;

    public static final int TOO_MANY_REQUESTS = 429;
    public static final int SERVICE_UNAVAILABLE = 503;
    public static final int REQUEST_TIMEOUT = 408;

    private final int statusCode;
    private final int subStatusCode;
    @Nullable
    private final Duration retryAfter;

    public BackendRequestException(@Nonnull String msg, int statusCode, int subStatusCode, @Nullable Duration retryAfter) {
        super(msg, LogMessageKeys.STATUS_CODE, statusCode, LogMessageKeys.SUB_STATUS_CODE, subStatusCode);
        this.statusCode = statusCode;
        this.subStatusCode = subStatusCode;
        this.retryAfter = retryAfter;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public int getSubStatusCode() {
        return subStatusCode;
    }

    @Nullable
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isThrottled() {
        return statusCode == TOO_MANY_REQUESTS;
    }

    @Override
    public boolean isRetryable() {
        return isThrottled() || statusCode == SERVICE_UNAVAILABLE || statusCode == REQUEST_TIMEOUT;
    }
}
