/*
 * Result.java
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

package io.docfeed.query.util;

import io.docfeed.annotation.API;
import io.docfeed.query.QueryCoreArgumentException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * The outcome of an operation: either a value or an error, never both.
 *
 * <p>
 * Pipeline stages and enumerators hand failures to their callers as values of this type rather than throwing, so
 * that every layer can apply the same recovery (split repair, failure isolation) uniformly. A success may carry a
 * {@code null} value, so check {@link #isSuccess()} rather than testing the value.
 * </p>
 *
 * @param <V> the type of a successful result
 * @param <E> the type of error from a failed result
 */
@API(API.Status.UNSTABLE)
public final class Result<V, E extends Throwable> {
    @Nullable
    private final V value;
    @Nullable
    private final E error;

    private Result(@Nullable V value, @Nullable E error) {
        this.value = value;
        this.error = error;
    }

    @Nullable
    public V getValue() {
        return value;
    }

    @Nullable
    public E getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Get the value of a successful result, or throw its error.
     *
     * @return the value
     * @throws E the error of a failed result
     */
    @Nullable
    public V get() throws E {
        if (error != null) {
            throw error;
        }
        return value;
    }

    /**
     * Transform the value of a successful result. A failure is passed through with its error unchanged.
     *
     * @param mapper function applied to the value
     * @param <U> the new value type
     * @return a result holding the mapped value or the original error
     */
    @Nonnull
    public <U> Result<U, E> map(@Nonnull Function<? super V, ? extends U> mapper) {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    /**
     * Chain another fallible step onto a successful result.
     *
     * @param mapper function producing the next result from the value
     * @param <U> the new value type
     * @return the result of {@code mapper}, or the original error
     */
    @Nonnull
    public <U> Result<U, E> flatMap(@Nonnull Function<? super V, Result<U, E>> mapper) {
        if (error != null) {
            return failure(error);
        }
        return mapper.apply(value);
    }

    @Nonnull
    public static <V, E extends Throwable> Result<V, E> success(@Nullable V value) {
        return new Result<>(value, null);
    }

    @Nonnull
    public static <V, E extends Throwable> Result<V, E> failure(@Nonnull E error) {
        return new Result<>(null, Objects.requireNonNull(error));
    }

    /**
     * Create a result from a value and an error, at most one of which may be non-{@code null}.
     *
     * @param value the value, or {@code null} if unsuccessful
     * @param error the error, or {@code null} if successful
     * @param <V> the type of value
     * @param <E> the type of error
     * @return a new result
     * @throws QueryCoreArgumentException if both are non-{@code null}
     */
    @Nonnull
    public static <V, E extends Throwable> Result<V, E> of(@Nullable V value, @Nullable E error) {
        if (value != null && error != null) {
            throw new QueryCoreArgumentException("Failure result can not have value");
        }
        return new Result<>(value, error);
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
