/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/LanguageExecutor.java
 description: Contract every language back end implements: run one block with concrete arguments.
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

package tech.robd.polyglot.executor;

import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.value.Value;

/**
 * One language back end.
 *
 * <p>The scheduler calls {@link #run} on a worker thread with arguments that are concrete
 * and already validated. Implementations must:</p>
 * <ul>
 *   <li>pass their result through {@link tech.robd.polyglot.validate.FfiValidator#validateReturnValue}
 *       before returning it;</li>
 *   <li>register an interrupt hook with {@code token.onCancel} if they can be stopped, and
 *       report that via {@link #supportsInterrupt()};</li>
 *   <li>be safe to call from several workers at once unless registered with a bounded
 *       {@link ConcurrencyPolicy}.</li>
 * </ul>
 * Exceptions thrown from {@link #run} go through the exception boundary, so a plain
 * {@code IOException} still reaches the caller as a typed polyglot error.
 */
public interface LanguageExecutor extends AutoCloseable {

    /**
     * @return canonical tag this instance serves
     */
    String languageTag();

    Value run(ExecutionRequest request, CancellationToken token) throws Exception;

    /**
     * @return {@code true} if a cancel hook can stop a running block; {@code false} means a
     *         timed-out block is left to finish detached
     */
    default boolean supportsInterrupt() {
        return false;
    }

    @Override
    default void close() {
    }
}
