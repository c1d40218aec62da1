/*
 * QueryExecutionInfo.java
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

import java.util.Objects;

/**
 * Execution details a backend may attach to a page.
 */
@API(API.Status.EXPERIMENTAL)
public final class QueryExecutionInfo {
    private final boolean reverseRidEnabled;
    private final boolean reverseIndexScan;

    public QueryExecutionInfo(boolean reverseRidEnabled, boolean reverseIndexScan) {
        this.reverseRidEnabled = reverseRidEnabled;
        this.reverseIndexScan = reverseIndexScan;
    }

    public boolean isReverseRidEnabled() {
        return reverseRidEnabled;
    }

    public boolean isReverseIndexScan() {
        return reverseIndexScan;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryExecutionInfo)) {
            return false;
        }
        QueryExecutionInfo that = (QueryExecutionInfo)o;
        return reverseRidEnabled == that.reverseRidEnabled && reverseIndexScan == that.reverseIndexScan;
    }

    @Override
    public int hashCode() {
        return Objects.hash(reverseRidEnabled, reverseIndexScan);
    }

    @Override
    public String toString() {
        return "QueryExecutionInfo{reverseRidEnabled=" + reverseRidEnabled + ", reverseIndexScan=" + reverseIndexScan + "}";
    }
}
