/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/CancellationToken.java
 description: Cancellation signal shared by the scheduler and executors. Supports cascading
              child tokens and callback registration used as interrupt hooks.
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

package tech.robd.polyglot;

/**
 * Cooperative cancellation signal for one task (or, for the root token, the whole runtime).
 *
 * <p>Executors register their interrupt hook with {@link #onCancel(Runnable)}: a subprocess
 * executor destroys its process, the embedded engine cancels its context. Cancelling a
 * parent cancels its children; a child may be cancelled alone.</p>
 */
public interface CancellationToken {

    /**
     * @return {@code true} once {@link #cancel()} has been called on this token or an ancestor
     */
    boolean isCancelled();

    /**
     * Register a callback to run on cancellation. If already cancelled, it runs immediately on
     * the calling thread.
     *
     * @param callback fast, non-blocking action
     * @return handle that removes the callback when closed
     */
    AutoCloseable onCancel(Runnable callback);

    /**
     * @return a token cancelled whenever this one is
     */
    CancellationToken child();

    /**
     * Cancel this token and its children, running registered callbacks. Idempotent.
     *
     * @return {@code true} if this call performed the cancellation
     */
    boolean cancel();

    /**
     * @return a token that is never cancelled, for direct executor calls outside the scheduler
     */
    static CancellationToken none() {
        return NeverCancelledToken.INSTANCE;
    }
}
