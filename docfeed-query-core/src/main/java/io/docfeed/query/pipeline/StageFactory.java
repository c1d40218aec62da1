/*
 * StageFactory.java
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

import io.docfeed.annotation.API;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Creates a stage from its continuation, reporting a malformed continuation as a failure.
 * Wrapping stages are given the factory of the stage inside them and call it with the nested continuation.
 */
@API(API.Status.INTERNAL)
@FunctionalInterface
public interface StageFactory {
    /**
     * Create the stage.
     * @param continuation the stage's continuation, or {@code null} to start from the beginning
     * @return the stage, or the reason it could not be built
     */
    @Nonnull
    Result<QueryPipelineStage, QueryCoreException> create(@Nullable QueryState continuation);
}
