/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/boundary/ExceptionBoundary.java
 description: Catches everything thrown across the language boundary and maps it onto the
              PolyglotException taxonomy; never lets an exception escape a guarded call.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.error.ResourceException;
import tech.robd.polyglot.error.TaskCancelledException;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * The single place where arbitrary throwables become typed {@link PolyglotException}s.
 *
 * <ul>
 *   <li>{@link PolyglotException} passes through unchanged.</li>
 *   <li>Interruption and {@link CancellationException} become {@link TaskCancelledException}.</li>
 *   <li>Wrapper exceptions from futures are unwrapped first.</li>
 *   <li>{@link StackOverflowError} and {@link OutOfMemoryError} become {@link ResourceException}.</li>
 *   <li>Anything else becomes a {@link ForeignRuntimeException} tagged with the language.</li>
 * </ul>
 */
public final class ExceptionBoundary {

    private static final Diagnostics DIAG = Diagnostics.of(ExceptionBoundary.class);

    private ExceptionBoundary() {
        // no instances
    }

    // 🧩 Section: guard

    /**
     * Run {@code fn} and capture its outcome. Never throws.
     */
    public static <T extends @Nullable Object> GuardedResult<T> runGuarded(String languageTag, ThrowingSupplier<T> fn) {
        if (fn == null) throw new IllegalArgumentException("fn cannot be null");
        try {
            return GuardedResult.ok(fn.get());
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            PolyglotException translated = translate(languageTag, t);
            DIAG.debug("guard[{}] caught {} -> {}", languageTag, t.getClass().getSimpleName(), translated.errorType());
            return GuardedResult.failed(translated);
        }
    }
    // [/🧩 Section: guard]

    // 🧩 Section: translate
    public static PolyglotException translate(@Nullable String languageTag, Throwable t) {
        if (t == null) throw new IllegalArgumentException("throwable cannot be null");
        Throwable cause = unwrap(t);
        if (cause instanceof PolyglotException pe) return pe;
        if (cause instanceof InterruptedException) {
            return new TaskCancelledException(languageTag, "interrupted", cause);
        }
        if (cause instanceof CancellationException) {
            return new TaskCancelledException(languageTag,
                    cause.getMessage() == null ? "cancelled" : cause.getMessage(), cause);
        }
        if (cause instanceof StackOverflowError) {
            return new ResourceException(languageTag, "stack overflow", cause);
        }
        if (cause instanceof OutOfMemoryError) {
            return new ResourceException(languageTag, "out of memory: " + cause.getMessage(), cause);
        }
        String message = cause.getMessage() == null ? "" : cause.getMessage();
        return new ForeignRuntimeException(languageTag == null ? "host" : languageTag,
                cause.getClass().getSimpleName(), message, List.of(), null, null, cause);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
    // [/🧩 Section: translate]
}
