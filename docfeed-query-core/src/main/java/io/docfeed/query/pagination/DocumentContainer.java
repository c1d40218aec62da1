/*
 * DocumentContainer.java
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

/**
 * A partitioned collection as the query pipeline sees it: something to query and something that knows its ranges.
 */
@API(API.Status.STABLE)
public interface DocumentContainer extends MonadicQueryDataSource, FeedRangeProvider {
}
