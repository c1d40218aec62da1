/*
 * CrossFeedRangePage.java
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
import io.docfeed.query.QueryPage;

import javax.annotation.Nonnull;

/**
 * A page read by a {@link CrossPartitionRangePageEnumerator}, together with the range enumerator that read it.
 * @param <E> type of the range enumerators
 */
@API(API.Status.INTERNAL)
public final class CrossFeedRangePage<E extends PartitionRangePageEnumerator> {
    @Nonnull
    private final QueryPage page;
    @Nonnull
    private final E source;

    public CrossFeedRangePage(@Nonnull QueryPage page, @Nonnull E source) {
        this.page = page;
        this.source = source;
    }

    @Nonnull
    public QueryPage getPage() {
        return page;
    }

    @Nonnull
    public E getSource() {
        return source;
    }
}
