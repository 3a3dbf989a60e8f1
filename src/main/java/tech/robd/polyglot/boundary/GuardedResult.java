/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/boundary/GuardedResult.java
 description: Outcome of a guarded call: a value on success, or a translated error with its type and message.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
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

package tech.robd.polyglot.boundary;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.error.PolyglotException;

/**
 * Result of {@link ExceptionBoundary#runGuarded(String, ThrowingSupplier)}.
 * Exactly one of {@code value}/{@code error} is meaningful, as told by {@code success}.
 *
 * @param <T> value type
 */
public record GuardedResult<T extends @Nullable Object>(boolean success, @Nullable T value, @Nullable PolyglotException error) {

    public GuardedResult {
        if (success && error != null) throw new IllegalArgumentException("successful result cannot carry an error");
        if (!success && error == null) throw new IllegalArgumentException("failed result needs an error");
    }

    public static <T extends @Nullable Object> GuardedResult<T> ok(@Nullable T value) {
        return new GuardedResult<>(true, value, null);
    }

    public static <T extends @Nullable Object> GuardedResult<T> failed(PolyglotException error) {
        return new GuardedResult<>(false, null, error);
    }

    /**
     * @return e.g. {@code "RuntimeError"}, or {@code null} on success
     */
    public @Nullable String errorType() {
        return error == null ? null : error.errorType();
    }

    public @Nullable String errorMessage() {
        return error == null ? null : error.getMessage();
    }

    /**
     * @return the value on success
     * @throws PolyglotException the stored error on failure
     */
    public @Nullable T getOrThrow() {
        if (error != null) throw error;
        return value;
    }
}
