/*
 * SqlQuerySpec.java
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
import com.google.protobuf.Value;
import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;

/**
 * Query text plus named parameters, as sent to the backend for each feed range.
 */
@API(API.Status.STABLE)
public final class SqlQuerySpec {
    @Nonnull
    private final String queryText;
    @Nonnull
    private final Map<String, Value> parameters;

    public SqlQuerySpec(@Nonnull String queryText) {
        this(queryText, ImmutableMap.of());
    }

    public SqlQuerySpec(@Nonnull String queryText, @Nonnull Map<String, Value> parameters) {
        this.queryText = queryText;
        this.parameters = ImmutableMap.copyOf(parameters);
    }

    @Nonnull
    public String getQueryText() {
        return queryText;
    }

    @Nonnull
    public Map<String, Value> getParameters() {
        return parameters;
    }

    @Nonnull
    public SqlQuerySpec withQueryText(@Nonnull String newQueryText) {
        return new SqlQuerySpec(newQueryText, parameters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SqlQuerySpec)) {
            return false;
        }
        SqlQuerySpec that = (SqlQuerySpec)o;
        return queryText.equals(that.queryText) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queryText, parameters);
    }

    @Override
    public String toString() {
        return queryText;
    }
}
