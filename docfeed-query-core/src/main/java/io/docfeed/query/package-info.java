/*
 * package-info.java
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

/**
 * Client-side evaluation of queries that span the feed ranges of a collection.
 *
 * <p>
 * A query is evaluated by a chain of {@link io.docfeed.query.QueryPipelineStage}s, built by
 * {@link io.docfeed.query.pipeline.QueryPipelineFactory}. Each call to {@code moveNext} produces one
 * {@link io.docfeed.query.QueryPage}, whose {@link io.docfeed.query.QueryState} resumes the query after that page,
 * possibly in another process. Failures are returned as values in a {@link io.docfeed.query.util.Result} rather than
 * thrown.
 * </p>
 */
package io.docfeed.query;
