/*
 * DistinctHash.java
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

package io.docfeed.query.item;

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content hash of document values, used to detect duplicates and to key groups.
 *
 * <p>
 * Two values hash the same when they are equal as documents: object fields are hashed in name order, so field
 * order does not matter, and {@code -0.0} hashes like {@code 0.0}. Each type is tagged, so that e.g. the string
 * {@code "1"} and the number {@code 1} differ.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class DistinctHash {
    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

    private static final byte UNDEFINED_TAG = 0;
    private static final byte NULL_TAG = 1;
    private static final byte FALSE_TAG = 2;
    private static final byte TRUE_TAG = 3;
    private static final byte NUMBER_TAG = 4;
    private static final byte STRING_TAG = 5;
    private static final byte ARRAY_TAG = 6;
    private static final byte OBJECT_TAG = 7;

    @Nonnull
    public static HashCode of(@Nonnull Value value) {
        final Hasher hasher = HASH_FUNCTION.newHasher();
        putValue(hasher, value);
        return hasher.hash();
    }

    /**
     * Hash a sequence of values as one key, e.g. the group-by items of a row.
     * @param values the values, in order
     * @return the combined hash
     */
    @Nonnull
    public static HashCode ofAll(@Nonnull List<Value> values) {
        final Hasher hasher = HASH_FUNCTION.newHasher();
        hasher.putInt(values.size());
        for (Value value : values) {
            putValue(hasher, value);
        }
        return hasher.hash();
    }

    private static void putValue(@Nonnull Hasher hasher, @Nonnull Value value) {
        switch (value.getKindCase()) {
            case NULL_VALUE:
                hasher.putByte(NULL_TAG);
                break;
            case BOOL_VALUE:
                hasher.putByte(value.getBoolValue() ? TRUE_TAG : FALSE_TAG);
                break;
            case NUMBER_VALUE:
                final double number = value.getNumberValue();
                hasher.putByte(NUMBER_TAG).putDouble(number == 0.0 ? 0.0 : number);
                break;
            case STRING_VALUE:
                putString(hasher.putByte(STRING_TAG), value.getStringValue());
                break;
            case LIST_VALUE:
                final List<Value> elements = value.getListValue().getValuesList();
                hasher.putByte(ARRAY_TAG).putInt(elements.size());
                for (Value element : elements) {
                    putValue(hasher, element);
                }
                break;
            case STRUCT_VALUE:
                final Map<String, Value> fields = new TreeMap<>(value.getStructValue().getFieldsMap());
                hasher.putByte(OBJECT_TAG).putInt(fields.size());
                for (Map.Entry<String, Value> field : fields.entrySet()) {
                    putString(hasher, field.getKey());
                    putValue(hasher, field.getValue());
                }
                break;
            case KIND_NOT_SET:
            default:
                hasher.putByte(UNDEFINED_TAG);
                break;
        }
    }

    private static void putString(@Nonnull Hasher hasher, @Nonnull String string) {
        // length prefix keeps ["ab", "c"] apart from ["a", "bc"]
        hasher.putInt(string.length()).putString(string, StandardCharsets.UTF_8);
    }

    private DistinctHash() {
    }
}
