/*
 * KeyValueLogMessage.java
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

package io.docfeed.query.logging;

import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A formatter for structured log messages.
 *
 * A {@code KeyValueLogMessage} is a static title followed by {@code key="value"} pairs, sorted by key, so that log
 * searches can match the title and extract the values.
 */
@API(API.Status.MAINTAINED)
public class KeyValueLogMessage {
    @Nonnull
    private final String staticMessage;
    @Nonnull
    private final Map<String, String> keyValueMap;

    private KeyValueLogMessage(@Nonnull String staticMessage) {
        this.staticMessage = staticMessage;
        this.keyValueMap = new TreeMap<>();
    }

    /**
     * Format a title and alternating keys and values into a single log line.
     * @param staticMessage the fixed part of the message
     * @param keysAndValues alternating keys and values
     * @return the formatted message
     */
    @Nonnull
    public static String of(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        return build(staticMessage, keysAndValues).toString();
    }

    @Nonnull
    public static KeyValueLogMessage build(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        final KeyValueLogMessage message = new KeyValueLogMessage(staticMessage);
        if (keysAndValues != null) {
            if (keysAndValues.length % 2 != 0) {
                throw new IllegalArgumentException("keys and values don't match");
            }
            for (int i = 0; i < keysAndValues.length; i += 2) {
                message.addKeyAndValue(keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return message;
    }

    @Nonnull
    public KeyValueLogMessage addKeyAndValue(@Nullable Object key, @Nullable Object value) {
        if (key == null) {
            throw new IllegalArgumentException("null key passed to KeyValueLogMessage");
        }
        keyValueMap.put(key.toString().replace("=", ""), Objects.toString(value).replace("\"", "'"));
        return this;
    }

    @Nonnull
    public KeyValueLogMessage addKeysAndValues(@Nonnull Map<?, ?> map) {
        map.forEach(this::addKeyAndValue);
        return this;
    }

    @Nonnull
    public String getStaticMessage() {
        return staticMessage;
    }

    @Nonnull
    public Map<String, String> getKeyValueMap() {
        return Collections.unmodifiableMap(keyValueMap);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(staticMessage.length() + keyValueMap.size() * 30);
        sb.append(staticMessage);
        for (Map.Entry<String, String> entry : keyValueMap.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return sb.toString();
    }
}
