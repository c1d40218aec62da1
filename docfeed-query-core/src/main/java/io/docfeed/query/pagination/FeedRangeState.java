/*
 * FeedRangeState.java
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
import io.docfeed.query.QueryState;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A feed range together with how far it has been read. A {@code null} state means the range has not been read yet.
 */
@API(API.Status.STABLE)
public final class FeedRangeState {
    @Nonnull
    private final FeedRange feedRange;
    @Nullable
    private final QueryState state;

    public FeedRangeState(@Nonnull FeedRange feedRange, @Nullable QueryState state) {
        this.feedRange = feedRange;
        this.state = state;
    }

    @Nonnull
    public FeedRange getFeedRange() {
        return feedRange;
    }

    @Nullable
    public QueryState getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeedRangeState)) {
            return false;
        }
        FeedRangeState that = (FeedRangeState)o;
        return feedRange.equals(that.feedRange) && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feedRange, state);
    }

    @Override
    public String toString() {
        return feedRange + "@" + state;
    }
}
