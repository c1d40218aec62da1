/*
 * QueryPipelineTestUtils.java
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

import com.google.protobuf.Value;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.item.Items;
import io.docfeed.query.util.Result;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Some utility functions for draining pipelines in tests, either in one go or one page per pipeline instance.
 */
public class QueryPipelineTestUtils {

    /**
     * What a drained pipeline returned.
     */
    public static final class Drained {
        @Nonnull
        private final List<QueryPage> pages = new ArrayList<>();
        @Nonnull
        private final List<Value> rows = new ArrayList<>();
        private double requestCharge;
        private int instances;

        private void add(@Nonnull QueryPage page) {
            pages.add(page);
            rows.addAll(page.getDocuments());
            requestCharge += page.getRequestCharge();
        }

        @Nonnull
        public List<QueryPage> getPages() {
            return pages;
        }

        @Nonnull
        public List<Value> getRows() {
            return rows;
        }

        public double getRequestCharge() {
            return requestCharge;
        }

        /**
         * The number of pipeline instances created while draining.
         * @return the count
         */
        public int getInstances() {
            return instances;
        }
    }

    /**
     * Read a stage to the end.
     * @param stage the stage
     * @return the pages
     * @throws QueryCoreException the first failure the stage returned
     */
    @Nonnull
    public static Drained drain(@Nonnull QueryPipelineStage stage) {
        final Drained drained = new Drained();
        drained.instances = 1;
        while (stage.moveNext(QueryTrace.NO_OP).join()) {
            drained.add(stage.getCurrent().get());
        }
        stage.close();
        return drained;
    }

    /**
     * Read a pipeline to the end, building a new instance from the continuation after every page.
     * @param factory creates the pipeline from a continuation
     * @return the pages
     * @throws QueryCoreException the first failure, whether from creating the pipeline or from a page
     */
    @Nonnull
    public static Drained drainWithResume(@Nonnull StageFactory factory) {
        return drainWithResume(factory, 1);
    }

    /**
     * Read a pipeline to the end, building a new instance from the latest continuation every few pages.
     * @param factory creates the pipeline from a continuation
     * @param pagesPerInstance how many pages to read from each instance
     * @return the pages
     * @throws QueryCoreException the first failure, whether from creating the pipeline or from a page
     */
    @Nonnull
    public static Drained drainWithResume(@Nonnull StageFactory factory, int pagesPerInstance) {
        final Drained drained = new Drained();
        QueryState continuation = null;
        do {
            final Result<QueryPipelineStage, QueryCoreException> created = factory.create(continuation);
            drained.instances++;
            try (QueryPipelineStage stage = created.get()) {
                continuation = readSome(stage, drained, pagesPerInstance);
            }
        } while (continuation != null);
        return drained;
    }

    // Returns the continuation to resume from, or null if the pipeline is done.
    @Nullable
    private static QueryState readSome(@Nonnull QueryPipelineStage stage, @Nonnull Drained drained, int pages) {
        QueryState continuation = null;
        for (int i = 0; i < pages; i++) {
            if (!stage.moveNext(QueryTrace.NO_OP).join()) {
                return null;
            }
            final QueryPage page = stage.getCurrent().get();
            drained.add(page);
            continuation = page.getState();
            if (continuation == null) {
                return null;
            }
        }
        return continuation;
    }

    /**
     * Pages of consecutive numbers.
     * @param count how many numbers, starting at 0
     * @param pageSize numbers per page
     * @return the pages
     */
    @Nonnull
    public static List<List<Value>> numberPages(int count, int pageSize) {
        final List<List<Value>> pages = new ArrayList<>();
        for (int start = 0; start < count; start += pageSize) {
            final List<Value> page = new ArrayList<>();
            for (int i = start; i < Math.min(count, start + pageSize); i++) {
                page.add(Items.number(i));
            }
            pages.add(page);
        }
        return pages;
    }

    @Nonnull
    public static List<Double> numbers(@Nonnull List<Value> rows) {
        final List<Double> numbers = new ArrayList<>(rows.size());
        for (Value row : rows) {
            numbers.add(row.getNumberValue());
        }
        return numbers;
    }

    private QueryPipelineTestUtils() {
    }
}
