/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/internal/BlockFutureImpl.java
 description: CompletableFuture-backed BlockFuture that settles exactly once and links
              cancellation to the task's token.
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

package tech.robd.polyglot.schedule.internal;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.schedule.BlockFuture;
import tech.robd.polyglot.schedule.FutureState;
import tech.robd.polyglot.value.Value;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link BlockFuture}.
 *
 * <p>Settlement goes through {@link #resolve(Value)} or {@link #reject(PolyglotException)};
 * an atomic flag makes the first caller win and every later call a no-op returning
 * {@code false}. The worker, the deadline timer and {@link #cancel()} all race through the
 * same flag.</p>
 *
 * <p>Token link: cancelling the token rejects the future with a cancellation error; the
 * reverse direction is the scheduler's job, since a timeout must reject first and cancel
 * second.</p>
 */
public final class BlockFutureImpl implements BlockFuture {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(BlockFutureImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final String taskId;
    private final String languageTag;
    private final CancellationToken token;
    private final CompletableFuture<Value> future = new CompletableFuture<>();
    private final AtomicBoolean settled = new AtomicBoolean(false);
    private volatile @Nullable PolyglotException error;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public BlockFutureImpl(String taskId, String languageTag, CancellationToken token) {
        if (taskId == null) throw new IllegalArgumentException("taskId cannot be null");
        if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
        if (token == null) throw new IllegalArgumentException("token cannot be null");
        this.taskId = taskId;
        this.languageTag = languageTag;
        this.token = token;

        // 🧩 Point: construction/token→future
        token.onCancel(() -> {
            if (reject(new TaskCancelledException(languageTag, "block " + taskId + " cancelled"))) {
                DIAG.debug("{} token->future cancelled", taskId);
            }
        });
    }
    // [/🧩 Section: construction]

    // 🧩 Section: settlement

    /**
     * @return {@code true} if this call settled the future
     */
    public boolean resolve(Value value) {
        if (value == null) throw new IllegalArgumentException("value cannot be null; use Value.Null");
        if (!settled.compareAndSet(false, true)) return false;
        future.complete(value);
        DIAG.debug("{} resolved ({})", taskId, value.typeName());
        return true;
    }

    /**
     * @return {@code true} if this call settled the future
     */
    public boolean reject(PolyglotException e) {
        if (e == null) throw new IllegalArgumentException("error cannot be null");
        if (!settled.compareAndSet(false, true)) return false;
        error = e;
        future.completeExceptionally(e);
        DIAG.debug("{} rejected ({})", taskId, e.errorType());
        return true;
    }

    public CancellationToken token() {
        return token;
    }
    // [/🧩 Section: settlement]

    // 🧩 Section: API
    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public String languageTag() {
        return languageTag;
    }

    @Override
    public FutureState state() {
        if (!future.isDone()) return FutureState.PENDING;
        return future.isCompletedExceptionally() ? FutureState.REJECTED : FutureState.RESOLVED;
    }

    @Override
    public Value force() {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PolyglotException pe) throw pe;
            // only PolyglotExceptions are ever stored
            throw new IllegalStateException("unexpected failure in " + taskId, cause);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException(languageTag, "interrupted while forcing block " + taskId, ie);
        }
    }

    @Override
    public boolean cancel() {
        boolean first = !isDone();
        DIAG.debug("{} cancel() requested (pending={})", taskId, first);
        try {
            token.cancel();
        } catch (Throwable t) {
            // never let cancel() throw out to callers
            DIAG.error("{} cancel() propagation failed: {}", taskId, t.toString());
        }
        if (first) {
            reject(new TaskCancelledException(languageTag, "block " + taskId + " cancelled"));
        }
        return first && error instanceof TaskCancelledException;
    }

    @Override
    public @Nullable PolyglotException error() {
        return error;
    }

    @Override
    public CompletableFuture<Value> result() {
        return future.copy();
    }

    @Override
    public CompletableFuture<Void> completion() {
        return future.handle((r, t) -> null);
    }
    // [/🧩 Section: API]

    @Override
    public String toString() {
        return "BlockFuture[" + taskId + " " + languageTag + " " + state() + "]";
    }
}
