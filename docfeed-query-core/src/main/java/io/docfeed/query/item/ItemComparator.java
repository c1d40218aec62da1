/*
 * ItemComparator.java
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

import com.google.protobuf.Value;
import io.docfeed.annotation.API;

import javax.annotation.Nonnull;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Total order over document values, matching the order the backend sorts by.
 *
 * <p>
 * Values of different types order by type: undefined, null, booleans, numbers, strings, arrays, objects. Within a
 * type, booleans order {@code false} first, numbers numerically (with {@code -0.0} equal to {@code 0.0}), strings
 * by UTF-16 code unit, arrays element by element, and objects by their fields sorted by name.
 * </p>
 */
@API(API.Status.UNSTABLE)
public final class ItemComparator implements Comparator<Value> {
    public static final ItemComparator INSTANCE = new ItemComparator();

    private ItemComparator() {
    }

    @Override
    public int compare(@Nonnull Value left, @Nonnull Value right) {
        final int typeComparison = Integer.compare(typeOrder(left), typeOrder(right));
        if (typeComparison != 0) {
            return typeComparison;
        }
        switch (left.getKindCase()) {
            case BOOL_VALUE:
                return Boolean.compare(left.getBoolValue(), right.getBoolValue());
            case NUMBER_VALUE:
                return compareNumbers(left.getNumberValue(), right.getNumberValue());
            case STRING_VALUE:
                return left.getStringValue().compareTo(right.getStringValue());
            case LIST_VALUE:
                return compareLists(left.getListValue().getValuesList(), right.getListValue().getValuesList());
            case STRUCT_VALUE:
                return compareStructs(left.getStructValue().getFieldsMap(), right.getStructValue().getFieldsMap());
            default:
                // undefined and null have a single value each
                return 0;
        }
    }

    /**
     * Rank of the value's type in the cross-type order.
     * @param value the value
     * @return the rank, lowest first
     */
    public static int typeOrder(@Nonnull Value value) {
        switch (value.getKindCase()) {
            case NULL_VALUE:
                return 1;
            case BOOL_VALUE:
                return 2;
            case NUMBER_VALUE:
                return 3;
            case STRING_VALUE:
                return 4;
            case LIST_VALUE:
                return 5;
            case STRUCT_VALUE:
                return 6;
            case KIND_NOT_SET:
            default:
                return 0;
        }
    }

    private static int compareNumbers(double left, double right) {
        return left == right ? 0 : Double.compare(left, right);
    }

    private int compareLists(@Nonnull List<Value> left, @Nonnull List<Value> right) {
        final int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            final int comparison = compare(left.get(i), right.get(i));
            if (comparison != 0) {
                return comparison;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private int compareStructs(@Nonnull Map<String, Value> left, @Nonnull Map<String, Value> right) {
        final Iterator<Map.Entry<String, Value>> leftEntries = new TreeMap<>(left).entrySet().iterator();
        final Iterator<Map.Entry<String, Value>> rightEntries = new TreeMap<>(right).entrySet().iterator();
        while (leftEntries.hasNext() && rightEntries.hasNext()) {
            final Map.Entry<String, Value> l = leftEntries.next();
            final Map.Entry<String, Value> r = rightEntries.next();
            int comparison = l.getKey().compareTo(r.getKey());
            if (comparison == 0) {
                comparison = compare(l.getValue(), r.getValue());
            }
            if (comparison != 0) {
                return comparison;
            }
        }
        return Boolean.compare(leftEntries.hasNext(), rightEntries.hasNext());
    }
}
