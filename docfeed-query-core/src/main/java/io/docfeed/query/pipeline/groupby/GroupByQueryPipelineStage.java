/*
 * GroupByQueryPipelineStage.java
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

package io.docfeed.query.pipeline.groupby;

import com.apple.foundationdb.tuple.ByteArrayUtil;
import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.MalformedContinuationTokenException;
import io.docfeed.query.QueryCoreException;
import io.docfeed.query.QueryPage;
import io.docfeed.query.QueryPipelineStage;
import io.docfeed.query.QueryState;
import io.docfeed.query.QueryTrace;
import io.docfeed.query.StageAccessChecker;
import io.docfeed.query.item.DistinctHash;
import io.docfeed.query.item.Items;
import io.docfeed.query.logging.KeyValueLogMessage;
import io.docfeed.query.logging.LogMessageKeys;
import io.docfeed.query.pipeline.QueryInfo;
import io.docfeed.query.pipeline.StageContinuations;
import io.docfeed.query.pipeline.StageFactory;
import io.docfeed.query.pipeline.aggregate.SingleGroupAggregator;
import io.docfeed.query.proto.ContinuationProto;
import io.docfeed.query.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A stage that evaluates {@code GROUP BY} across feed ranges.
 *
 * <p>
 * Each backend row is {@code {"groupByItems": [...], "payload": ...}}, where the payload holds the partial aggregates
 * of the range for that group. The stage first drains its inner stage, folding every row into the aggregator of its
 * group and answering each inner page with an empty page whose continuation holds the whole group table. Then it
 * emits the groups in the order of their hashes, at most one page size at a time. While emitting, the continuation
 * holds the groups not yet returned, and the inner stage is not used again. A stage resumed from such a
 * continuation never builds its inner stage.
 * </p>
 */
@API(API.Status.INTERNAL)
public class GroupByQueryPipelineStage implements QueryPipelineStage {
    public static final String GROUP_BY_ITEMS_FIELD = "groupByItems";
    public static final String PAYLOAD_FIELD = "payload";

    private static final Logger LOGGER = LoggerFactory.getLogger(GroupByQueryPipelineStage.class);
    private static final int HASH_BYTES = 16;

    @Nullable
    private final QueryPipelineStage inner;
    @Nonnull
    private final Executor executor;
    @Nonnull
    private final QueryInfo queryInfo;
    private final int pageSize;
    @Nonnull
    private final NavigableMap<byte[], Group> groups;
    private boolean drainingDone;
    private int pagesEmitted;

    @Nullable
    private Result<QueryPage, QueryCoreException> current;
    private boolean exhausted;
    private boolean closed;

    private GroupByQueryPipelineStage(@Nullable QueryPipelineStage inner, @Nonnull Executor executor,
                                      @Nonnull QueryInfo queryInfo, int pageSize,
                                      @Nonnull NavigableMap<byte[], Group> groups, boolean drainingDone,
                                      int pagesEmitted) {
        this.inner = inner;
        this.executor = executor;
        this.queryInfo = queryInfo;
        this.pageSize = pageSize;
        this.groups = groups;
        this.drainingDone = drainingDone;
        this.pagesEmitted = pagesEmitted;
    }

    /**
     * Create the stage, resuming from a continuation if one is given.
     *
     * @param queryInfo the query plan, describing the projection of each group
     * @param pageSize the most groups returned in one page
     * @param executor executor of the query, used by this stage when it has no inner stage
     * @param continuation continuation of this stage, or {@code null} to start from the beginning
     * @param innerFactory creates the stage that returns the rows of all ranges
     * @return the stage, or the reason it could not be built
     */
    @Nonnull
    public static Result<QueryPipelineStage, QueryCoreException> monadicCreate(@Nonnull QueryInfo queryInfo,
                                                                             int pageSize,
                                                                             @Nonnull Executor executor,
                                                                             @Nullable QueryState continuation,
                                                                             @Nonnull StageFactory innerFactory) {
        final NavigableMap<byte[], Group> groups = new TreeMap<>(ByteArrayUtil::compareUnsigned);
        if (continuation == null) {
            return innerFactory.create(null)
                    .map(inner -> new GroupByQueryPipelineStage(inner, executor, queryInfo, pageSize, groups, false, 0));
        }
        final ContinuationProto.GroupByContinuation proto;
        try {
            proto = StageContinuations.unwrap(continuation, ContinuationProto.StageKind.GROUP_BY,
                    ContinuationProto.GroupByContinuation.parser());
            if (proto.getDrainingDone() == proto.hasInner() || proto.getPagesEmitted() < 0) {
                throw new MalformedContinuationTokenException("invalid group by continuation",
                        LogMessageKeys.RAW_BYTES, continuation);
            }
            for (ContinuationProto.GroupState groupState : proto.getGroupsList()) {
                final Group group = Group.fromProto(queryInfo, groupState);
                if (groups.put(group.key, group) != null) {
                    throw new MalformedContinuationTokenException("group by continuation repeats a group",
                            LogMessageKeys.RAW_BYTES, continuation);
                }
            }
        } catch (MalformedContinuationTokenException ex) {
            return Result.failure(ex);
        }
        if (proto.getDrainingDone()) {
            return Result.success(new GroupByQueryPipelineStage(null, executor, queryInfo, pageSize, groups,
                    true, proto.getPagesEmitted()));
        }
        return innerFactory.create(StageContinuations.nested(true, proto.getInner()))
                .map(inner -> new GroupByQueryPipelineStage(inner, executor, queryInfo, pageSize, groups,
                        false, proto.getPagesEmitted()));
    }

    @Nonnull
    @Override
    public Result<QueryPage, QueryCoreException> getCurrent() {
        return StageAccessChecker.checkCurrent(current, this);
    }

    @Nonnull
    @Override
    public CompletableFuture<Boolean> moveNext(@Nonnull QueryTrace trace) {
        StageAccessChecker.checkMoveNext(exhausted, this);
        if (drainingDone) {
            if (groups.isEmpty() && pagesEmitted > 0) {
                exhausted = true;
                current = null;
                return CompletableFuture.completedFuture(false);
            }
            current = Result.success(emitGroups(0.0, ""));
            return CompletableFuture.completedFuture(true);
        }
        final QueryPipelineStage source = Verify.verifyNotNull(inner, "group by source already drained");
        return source.moveNext(trace).thenApply(hasNext -> {
            if (!hasNext) {
                startEmitting();
                current = Result.success(emitGroups(0.0, ""));
                return true;
            }
            final Result<QueryPage, QueryCoreException> innerResult = source.getCurrent();
            if (!innerResult.isSuccess()) {
                current = innerResult;
                return true;
            }
            final QueryPage page = innerResult.getValue();
            try {
                for (Value row : page.getDocuments()) {
                    addRow(row);
                }
            } catch (QueryCoreException ex) {
                current = Result.failure(ex);
                return true;
            }
            if (page.getState() == null) {
                startEmitting();
                current = Result.success(emitGroups(page.getRequestCharge(), page.getActivityId()));
            } else {
                current = Result.success(QueryPage.empty(page.getRequestCharge(), page.getActivityId(),
                        saveState(page.getState())));
            }
            return true;
        });
    }

    private void addRow(@Nonnull Value row) {
        if (row.getKindCase() != Value.KindCase.STRUCT_VALUE) {
            throw new QueryCoreException("group by row is not an object",
                    LogMessageKeys.ACTUAL, row);
        }
        final Value groupByItems = Items.getField(row, GROUP_BY_ITEMS_FIELD);
        if (groupByItems.getKindCase() != Value.KindCase.LIST_VALUE) {
            throw new QueryCoreException("group by row has no group by items",
                    LogMessageKeys.ACTUAL, row);
        }
        final List<Value> items = groupByItems.getListValue().getValuesList();
        final byte[] key = DistinctHash.ofAll(items).asBytes();
        Group group = groups.get(key);
        if (group == null) {
            group = new Group(key, items, SingleGroupAggregator.create(queryInfo, null));
            groups.put(key, group);
        }
        group.aggregator.addValues(Items.getField(row, PAYLOAD_FIELD));
    }

    private void startEmitting() {
        drainingDone = true;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("group by source drained",
                    LogMessageKeys.GROUP_COUNT, groups.size()));
        }
    }

    @Nonnull
    private QueryPage emitGroups(double requestCharge, @Nonnull String activityId) {
        final List<Value> documents = new ArrayList<>();
        final Iterator<Group> iterator = groups.values().iterator();
        int taken = 0;
        while (iterator.hasNext() && taken < pageSize) {
            final Value result = iterator.next().aggregator.getResult();
            iterator.remove();
            taken++;
            if (!Items.isUndefined(result)) {
                documents.add(result);
            }
        }
        pagesEmitted++;
        // With nothing left the page has no continuation and the next call ends the stage.
        final QueryState state = groups.isEmpty() ? null : saveState(null);
        return new QueryPage(documents, requestCharge, activityId, state);
    }

    @Nonnull
    private QueryState saveState(@Nullable QueryState innerState) {
        final ContinuationProto.GroupByContinuation.Builder builder = ContinuationProto.GroupByContinuation.newBuilder();
        for (Group group : groups.values()) {
            builder.addGroups(group.toProto());
        }
        if (drainingDone) {
            builder.setDrainingDone(true).setPagesEmitted(pagesEmitted);
        } else {
            builder.setInner(innerState.getBytes());
        }
        return StageContinuations.wrap(ContinuationProto.StageKind.GROUP_BY, builder.build());
    }

    @Nonnull
    @Override
    public Executor getExecutor() {
        return inner == null ? executor : inner.getExecutor();
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            if (inner != null) {
                inner.close();
            }
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private static final class Group {
        @Nonnull
        private final byte[] key;
        @Nonnull
        private final List<Value> groupByItems;
        @Nonnull
        private final SingleGroupAggregator aggregator;

        private Group(@Nonnull byte[] key, @Nonnull List<Value> groupByItems, @Nonnull SingleGroupAggregator aggregator) {
            this.key = key;
            this.groupByItems = ImmutableList.copyOf(groupByItems);
            this.aggregator = aggregator;
        }

        @Nonnull
        private ContinuationProto.GroupState toProto() {
            return ContinuationProto.GroupState.newBuilder()
                    .setKey(ByteString.copyFrom(key))
                    .addAllGroupByItems(groupByItems)
                    .setAggregator(aggregator.toProto())
                    .build();
        }

        @Nonnull
        private static Group fromProto(@Nonnull QueryInfo queryInfo, @Nonnull ContinuationProto.GroupState proto) {
            final byte[] key = proto.getKey().toByteArray();
            if (key.length != HASH_BYTES
                    || ByteArrayUtil.compareUnsigned(key, DistinctHash.ofAll(proto.getGroupByItemsList()).asBytes()) != 0) {
                throw new MalformedContinuationTokenException("group key does not match its group by items",
                        LogMessageKeys.RAW_BYTES, proto.getKey());
            }
            return new Group(key, proto.getGroupByItemsList(), SingleGroupAggregator.create(queryInfo, proto.getAggregator()));
        }
    }
}
