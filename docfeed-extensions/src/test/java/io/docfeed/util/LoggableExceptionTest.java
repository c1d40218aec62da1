/*
 * LoggableExceptionTest.java
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

package io.docfeed.util;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {
    @Test
    public void emptyLogInfo() {
        LoggableException e = new LoggableException("this has no k/v pairs");
        assertEquals(Collections.emptyMap(), e.getLogInfo());
        assertEquals(0, e.exportLogInfo().length);
    }

    @Test
    public void logInfoKeepsInsertionOrder() {
        LoggableException e = new LoggableException("ordered", "k2", "v2", "k0", "v0")
                .addLogInfo("k1", "v1");
        assertThat(List.copyOf(e.getLogInfo().keySet()), contains("k2", "k0", "k1"));
        assertArrayEquals(new Object[] {"k2", "v2", "k0", "v0", "k1", "v1"}, e.exportLogInfo());
    }

    @Test
    public void causeWithLogInfo() {
        IllegalStateException cause = new IllegalStateException("inner");
        LoggableException e = new LoggableException("outer", cause, "key", 7);
        assertEquals(cause, e.getCause());
        assertEquals(Collections.singletonMap("key", 7), e.getLogInfo());
    }

    @Test
    public void collectAcrossCauseChain() {
        LoggableException inner = new LoggableException("inner", "shared", "inner", "only_inner", 1);
        RuntimeException middle = new RuntimeException(inner);
        LoggableException outer = new LoggableException("outer", middle, "shared", "outer");
        Map<String, Object> collected = LoggableException.collectLogInfo(outer);
        assertThat(collected, hasEntry("shared", "outer"));
        assertThat(collected, hasEntry("only_inner", 1));
        assertEquals(Collections.emptyMap(), LoggableException.collectLogInfo(null));
    }

    @Test
    public void oddLogInfoValues() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd number of log info!", "k1", "v1", "k2"));
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd in call!").addLogInfo("k1", "v1", "k2"));
    }
}
