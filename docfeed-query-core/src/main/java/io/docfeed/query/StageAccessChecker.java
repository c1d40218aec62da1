/*
 * StageAccessChecker.java
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
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Checks that a {@link QueryPipelineStage} is driven the way its contract allows.
 *
 * {@code getCurrent} is only legal once {@code moveNext} has completed with {@code true}, and {@code moveNext} is
 * illegal once it has completed with {@code false}.
 */
@API(API.Status.INTERNAL)
public final class StageAccessChecker {

    public static void checkMoveNext(boolean exhausted, @Nonnull Object stage) {
        if (exhausted) {
            throw new QueryCoreException("moveNext called on exhausted stage",
                    LogMessageKeys.STAGE_KIND, stage.getClass().getSimpleName());
        }
    }

    @Nonnull
    public static <V, E extends Throwable> Result<V, E> checkCurrent(@Nullable Result<V, E> current, @Nonnull Object stage) {
        if (current == null) {
            throw new QueryCoreException("no current result",
                    LogMessageKeys.STAGE_KIND, stage.getClass().getSimpleName());
        }
        return current;
    }

    private StageAccessChecker() {
    }
}
