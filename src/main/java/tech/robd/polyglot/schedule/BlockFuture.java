/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/BlockFuture.java
 description: Handle to the deferred result of a spawned polyglot block.
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

package tech.robd.polyglot.schedule;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.value.Value;

import java.util.concurrent.CompletableFuture;

/**
 * Deferred result of a spawned block.
 *
 * <ul>
 *   <li>{@link #force()} blocks until the block settles, then returns its value or throws its
 *       error. Forcing again returns the same value or the same exception instance; the block
 *       never runs twice.</li>
 *   <li>Any number of threads may force concurrently.</li>
 *   <li>{@link #result()} and {@link #completion()} give non-blocking composition.</li>
 * </ul>
 */
public interface BlockFuture {

    String taskId();

    /**
     * @return canonical language tag the block was dispatched to
     */
    String languageTag();

    FutureState state();

    default boolean isDone() {
        return state() != FutureState.PENDING;
    }

    /**
     * Block the calling thread until the block settles.
     *
     * @return the block's value
     * @throws PolyglotException the stored error if the block was rejected, or a
     *                           {@link tech.robd.polyglot.error.TaskCancelledException} if the
     *                           forcing thread is interrupted (the block keeps running)
     */
    Value force();

    /**
     * Request cancellation: the future is rejected with a cancellation error if still pending
     * and the executor's interrupt hook fires.
     *
     * @return {@code true} if this call settled the future
     */
    boolean cancel();

    /**
     * @return the stored error once rejected, else {@code null}
     */
    @Nullable PolyglotException error();

    /**
     * @return a view completing with the value or the error; cancelling the view has no effect
     *         on the block
     */
    CompletableFuture<Value> result();

    /**
     * @return completes normally when the block settles, either way
     */
    CompletableFuture<Void> completion();
}
