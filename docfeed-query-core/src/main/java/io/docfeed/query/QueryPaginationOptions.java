/*
 * QueryPaginationOptions.java
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

import com.google.common.collect.ImmutableMap;
import io.docfeed.annotation.API;
import io.docfeed.query.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Paging options passed down to the data source with every fetch.
 *
 * <p>
 * The page size limit is a maximum: the backend may return fewer documents, and stages that buffer rows (order-by,
 * group-by) use it to cut their own output into pages.
 * </p>
 */
@API(API.Status.STABLE)
public class QueryPaginationOptions {
    public static final int DEFAULT_PAGE_SIZE_LIMIT = 1000;

    public static final QueryPaginationOptions DEFAULT = newBuilder().build();

    private final int pageSizeLimit;
    @Nonnull
    private final Map<String, String> additionalHeaders;

    private QueryPaginationOptions(int pageSizeLimit, @Nonnull Map<String, String> additionalHeaders) {
        this.pageSizeLimit = pageSizeLimit;
        this.additionalHeaders = additionalHeaders;
    }

    public int getPageSizeLimit() {
        return pageSizeLimit;
    }

    @Nonnull
    public Map<String, String> getAdditionalHeaders() {
        return additionalHeaders;
    }

    @Nonnull
    public QueryPaginationOptions withPageSizeLimit(int newPageSizeLimit) {
        return toBuilder().setPageSizeLimit(newPageSizeLimit).build();
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public String toString() {
        return "QueryPaginationOptions{pageSizeLimit=" + pageSizeLimit + ", additionalHeaders=" + additionalHeaders + "}";
    }

    /**
     * A builder for {@link QueryPaginationOptions}.
     *
     * <pre><code>
     * QueryPaginationOptions.newBuilder().setPageSizeLimit(100).build()
     * </code></pre>
     */
    public static class Builder {
        private int pageSizeLimit = DEFAULT_PAGE_SIZE_LIMIT;
        @Nonnull
        private Map<String, String> additionalHeaders = ImmutableMap.of();

        private Builder() {
        }

        private Builder(@Nonnull QueryPaginationOptions options) {
            this.pageSizeLimit = options.pageSizeLimit;
            this.additionalHeaders = options.additionalHeaders;
        }

        @Nonnull
        public Builder setPageSizeLimit(int pageSizeLimit) {
            if (pageSizeLimit <= 0) {
                throw new QueryCoreArgumentException("page size limit must be positive",
                        LogMessageKeys.PAGE_SIZE, pageSizeLimit);
            }
            this.pageSizeLimit = pageSizeLimit;
            return this;
        }

        public int getPageSizeLimit() {
            return pageSizeLimit;
        }

        @Nonnull
        public Builder setAdditionalHeaders(@Nonnull Map<String, String> additionalHeaders) {
            this.additionalHeaders = ImmutableMap.copyOf(additionalHeaders);
            return this;
        }

        @Nonnull
        public QueryPaginationOptions build() {
            return new QueryPaginationOptions(pageSizeLimit, additionalHeaders);
        }
    }
}
