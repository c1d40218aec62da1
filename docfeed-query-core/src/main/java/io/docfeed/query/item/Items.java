/*
 * Items.java
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

import com.google.protobuf.ListValue;
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import io.docfeed.annotation.API;
import io.docfeed.query.QueryCoreArgumentException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the document model. Documents and every value inside them are protobuf {@link Value}s.
 * The default instance, whose kind is not set, stands for "undefined": a field that is absent, which is
 * different from a field that is {@code null}.
 */
@API(API.Status.UNSTABLE)
public final class Items {
    /** The undefined value. */
    public static final Value UNDEFINED = Value.getDefaultInstance();

    /** The JSON {@code null} value. */
    public static final Value NULL = Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();

    public static boolean isUndefined(@Nullable Value value) {
        return value == null || value.getKindCase() == Value.KindCase.KIND_NOT_SET;
    }

    public static boolean isNumber(@Nonnull Value value) {
        return value.getKindCase() == Value.KindCase.NUMBER_VALUE;
    }

    /**
     * Whether the value is a scalar that MIN and MAX can order: null, boolean, number or string.
     * @param value the value to check
     * @return {@code true} for scalar values
     */
    public static boolean isPrimitive(@Nonnull Value value) {
        switch (value.getKindCase()) {
            case NULL_VALUE:
            case BOOL_VALUE:
            case NUMBER_VALUE:
            case STRING_VALUE:
                return true;
            default:
                return false;
        }
    }

    @Nonnull
    public static Value number(double value) {
        return Value.newBuilder().setNumberValue(value).build();
    }

    @Nonnull
    public static Value string(@Nonnull String value) {
        return Value.newBuilder().setStringValue(value).build();
    }

    @Nonnull
    public static Value bool(boolean value) {
        return Value.newBuilder().setBoolValue(value).build();
    }

    @Nonnull
    public static Value list(@Nonnull List<Value> values) {
        return Value.newBuilder().setListValue(ListValue.newBuilder().addAllValues(values)).build();
    }

    @Nonnull
    public static Value list(@Nonnull Value... values) {
        return list(List.of(values));
    }

    /**
     * Build an object. Undefined field values are left out, as they would be in a serialized document.
     * @param fields the fields in iteration order
     * @return the object value
     */
    @Nonnull
    public static Value struct(@Nonnull Map<String, Value> fields) {
        final Struct.Builder builder = Struct.newBuilder();
        fields.forEach((name, value) -> {
            if (!isUndefined(value)) {
                builder.putFields(name, value);
            }
        });
        return Value.newBuilder().setStructValue(builder).build();
    }

    /**
     * Convert a plain Java object into a value.
     *
     * @param object {@code null}, a {@link Boolean}, {@link Number}, {@link String}, {@link Value}, {@link List}
     * of such or {@link Map} from {@link String} to such
     * @return the equivalent value
     * @throws QueryCoreArgumentException if the object has no equivalent
     */
    @Nonnull
    public static Value of(@Nullable Object object) {
        if (object == null) {
            return NULL;
        }
        if (object instanceof Value) {
            return (Value)object;
        }
        if (object instanceof Boolean) {
            return bool((Boolean)object);
        }
        if (object instanceof Number) {
            return number(((Number)object).doubleValue());
        }
        if (object instanceof String) {
            return string((String)object);
        }
        if (object instanceof List<?>) {
            final ListValue.Builder builder = ListValue.newBuilder();
            for (Object element : (List<?>)object) {
                builder.addValues(of(element));
            }
            return Value.newBuilder().setListValue(builder).build();
        }
        if (object instanceof Map<?, ?>) {
            final Struct.Builder builder = Struct.newBuilder();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>)object).entrySet()) {
                builder.putFields(String.valueOf(entry.getKey()), of(entry.getValue()));
            }
            return Value.newBuilder().setStructValue(builder).build();
        }
        throw new QueryCoreArgumentException("unsupported document value", "class", object.getClass().getName());
    }

    /**
     * Read a field of an object value.
     * @param object the value to read from
     * @param name the field name
     * @return the field, or {@link #UNDEFINED} if {@code object} is not an object or has no such field
     */
    @Nonnull
    public static Value getField(@Nonnull Value object, @Nonnull String name) {
        if (object.getKindCase() != Value.KindCase.STRUCT_VALUE) {
            return UNDEFINED;
        }
        return object.getStructValue().getFieldsOrDefault(name, UNDEFINED);
    }

    /**
     * Read an element of an array value.
     * @param array the value to read from
     * @param index the element index
     * @return the element, or {@link #UNDEFINED} if {@code array} is not an array or is too short
     */
    @Nonnull
    public static Value getElement(@Nonnull Value array, int index) {
        if (array.getKindCase() != Value.KindCase.LIST_VALUE || index >= array.getListValue().getValuesCount()) {
            return UNDEFINED;
        }
        return array.getListValue().getValues(index);
    }

    private Items() {
    }
}
