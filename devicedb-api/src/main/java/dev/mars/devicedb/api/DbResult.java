/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.devicedb.api;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Immutable outcome of a database operation.
 *
 * <p>A successful result carries its data (which may be {@code null} for operations
 * that produce nothing); a failed result carries a human-readable error message.
 *
 * @param success      whether the operation succeeded
 * @param errorMessage the failure reason, {@code null} on success
 * @param data         the produced value, {@code null} on failure
 * @param <T>          the type of the produced value
 */
public record DbResult<T>(
    boolean success,
    String errorMessage,
    T data
) {
    public DbResult {
        if (!success) {
            Objects.requireNonNull(errorMessage, "Failed result requires an error message");
        }
    }

    /**
     * Creates a successful result carrying the given data.
     */
    public static <T> DbResult<T> success(T data) {
        return new DbResult<>(true, null, data);
    }

    /**
     * Creates a failed result.
     */
    public static <T> DbResult<T> error(String errorMessage) {
        return new DbResult<>(false, errorMessage, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isError() {
        return !success;
    }

    public Optional<T> toOptional() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    public T orElse(T other) {
        return success && data != null ? data : other;
    }

    /**
     * Transforms the data of a successful result; failures pass through unchanged.
     */
    public <R> DbResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!success) {
            return error(errorMessage);
        }
        return success(mapper.apply(data));
    }
}
