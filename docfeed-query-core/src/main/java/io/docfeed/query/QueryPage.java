/*
 * QueryPage.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * One page of query results.
 *
 * <p>
 * A page carries its documents in order together with the cost of producing it. Its {@link #getState() state} is the
 * continuation for resuming after this page, and is {@code null} exactly when whatever produced the page has
 * nothing more to return.
 * </p>
 */
@API(API.Status.STABLE)
public final class QueryPage {
    @Nonnull
    private final List<Value> documents;
    private final double requestCharge;
    @Nonnull
    private final String activityId;
    @Nullable
    private final QueryExecutionInfo executionInfo;
    private final long responseLengthInBytes;
    @Nonnull
    private final Map<String, String> additionalHeaders;
    @Nullable
    private final QueryState state;

    public QueryPage(@Nonnull List<Value> documents, double requestCharge, @Nonnull String activityId,
                     @Nullable QueryExecutionInfo executionInfo, long responseLengthInBytes,
                     @Nonnull Map<String, String> additionalHeaders, @Nullable QueryState state) {
        this.documents = ImmutableList.copyOf(documents);
        this.requestCharge = requestCharge;
        this.activityId = activityId;
        this.executionInfo = executionInfo;
        this.responseLengthInBytes = responseLengthInBytes;
        this.additionalHeaders = ImmutableMap.copyOf(additionalHeaders);
        this.state = state;
    }

    public QueryPage(@Nonnull List<Value> documents, double requestCharge, @Nonnull String activityId, @Nullable QueryState state) {
        this(documents, requestCharge, activityId, null, 0L, ImmutableMap.of(), state);
    }

    /**
     * An empty page that only reports cost, used while a stage is still working towards its first rows.
     * @param requestCharge the charge incurred
     * @param activityId activity of the request that incurred it
     * @param state continuation after this page
     * @return a new page with no documents
     */
    @Nonnull
    public static QueryPage empty(double requestCharge, @Nonnull String activityId, @Nullable QueryState state) {
        return new QueryPage(ImmutableList.of(), requestCharge, activityId, state);
    }

    @Nonnull
    public List<Value> getDocuments() {
        return documents;
    }

    public double getRequestCharge() {
        return requestCharge;
    }

    @Nonnull
    public String getActivityId() {
        return activityId;
    }

    @Nullable
    public QueryExecutionInfo getExecutionInfo() {
        return executionInfo;
    }

    public long getResponseLengthInBytes() {
        return responseLengthInBytes;
    }

    @Nonnull
    public Map<String, String> getAdditionalHeaders() {
        return additionalHeaders;
    }

    @Nullable
    public QueryState getState() {
        return state;
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    @Nonnull
    public QueryPage withDocuments(@Nonnull List<Value> newDocuments) {
        return new QueryPage(newDocuments, requestCharge, activityId, executionInfo, responseLengthInBytes, additionalHeaders, state);
    }

    @Nonnull
    public QueryPage withState(@Nullable QueryState newState) {
        return new QueryPage(documents, requestCharge, activityId, executionInfo, responseLengthInBytes, additionalHeaders, newState);
    }

    @Nonnull
    public QueryPage withDocumentsAndState(@Nonnull List<Value> newDocuments, @Nullable QueryState newState) {
        return new QueryPage(newDocuments, requestCharge, activityId, executionInfo, responseLengthInBytes, additionalHeaders, newState);
    }

    @Nonnull
    public QueryPage withRequestCharge(double newRequestCharge) {
        return new QueryPage(documents, newRequestCharge, activityId, executionInfo, responseLengthInBytes, additionalHeaders, state);
    }

    @Override
    public String toString() {
        return "QueryPage{documents=" + documents.size() + ", requestCharge=" + requestCharge
               + ", activityId=" + activityId + ", state=" + state + "}";
    }
}
