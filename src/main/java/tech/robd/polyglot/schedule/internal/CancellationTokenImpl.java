/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/internal/CancellationTokenImpl.java
 description: Default CancellationToken with at-most-once callbacks, weakly linked children
              and cascading cancellation; released when its task finishes running.
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

import java.lang.ref.WeakReference;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event-driven {@link CancellationToken}.
 *
 * <p>The runtime holds one root token; each spawned task gets a child. A child is linked
 * to its parent only through a cancel hook holding a weak reference, and {@link #release()}
 * removes that hook once the task is finished, so settled tasks do not accumulate under
 * the root.</p>
 */
public final class CancellationTokenImpl implements CancellationToken {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(CancellationTokenImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final int tokId = System.identityHashCode(this);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);

    private final ConcurrentLinkedQueue<Hook> hooks = new ConcurrentLinkedQueue<>();

    private volatile @Nullable AutoCloseable parentRegistration;
    // [/🧩 Section: state]

    // 🧩 Section: hook
    private static final class Hook {
        private final AtomicReference<@Nullable Runnable> action;

        Hook(Runnable action) {
            this.action = new AtomicReference<>(action);
        }

        void fire() {
            Runnable r = action.getAndSet(null);
            if (r != null) r.run();
        }

        void clear() {
            action.set(null);
        }
    }
    // [/🧩 Section: hook]

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    // 🧩 Section: registration
    @Override
    public AutoCloseable onCancel(Runnable callback) {
        if (callback == null) throw new IllegalArgumentException("callback cannot be null");
        Hook hook = new Hook(callback);

        if (cancelled.get()) {
            DIAG.debug("tok#{} onCancel: already cancelled, running now", tokId);
            safeFire(hook, "immediate");
            return () -> {
            };
        }

        hooks.offer(hook);

        // cancel() may have drained the queue between the check and the offer
        if (cancelled.get() && hooks.remove(hook)) {
            DIAG.debug("tok#{} onCancel: lost race with cancel, running now", tokId);
            safeFire(hook, "race");
        }

        return () -> {
            if (hooks.remove(hook)) hook.clear();
        };
    }
    // [/🧩 Section: registration]

    // 🧩 Section: child
    @Override
    public CancellationToken child() {
        CancellationTokenImpl child = new CancellationTokenImpl();
        if (cancelled.get()) {
            child.cancel();
            return child;
        }
        WeakReference<CancellationTokenImpl> ref = new WeakReference<>(child);
        child.parentRegistration = onCancel(() -> {
            CancellationTokenImpl c = ref.get();
            if (c != null) c.cancel();
        });
        DIAG.debug("tok#{} child tok#{}", tokId, child.tokId);
        return child;
    }
    // [/🧩 Section: child]

    // 🧩 Section: cancel
    @Override
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) return false;
        DIAG.debug("tok#{} cancel: hooks={}", tokId, hooks.size());

        // child links are hooks too, so this cascades
        Hook hook;
        while ((hook = hooks.poll()) != null) {
            safeFire(hook, "cancel");
        }
        return true;
    }
    // [/🧩 Section: cancel]

    // 🧩 Section: release

    /**
     * Drop hooks and the link to the parent once the owning task has finished running.
     * A released token can still be cancelled; it just has nothing left to notify.
     */
    public void release() {
        if (!released.compareAndSet(false, true)) return;
        AutoCloseable reg = parentRegistration;
        parentRegistration = null;
        if (reg != null) {
            try {
                reg.close();
            } catch (Exception e) {
                DIAG.debug("tok#{} release: parent unlink failed: {}", tokId, e.toString());
            }
        }
        Hook hook;
        while ((hook = hooks.poll()) != null) hook.clear();
    }

    public int pendingHookCount() {
        return hooks.size();
    }
    // [/🧩 Section: release]

    private void safeFire(Hook hook, String where) {
        try {
            hook.fire();
        } catch (Throwable t) {
            DIAG.error("tok#{} cancel hook failed @{}: {}", tokId, where, t.toString());
        }
    }

    @Override
    public String toString() {
        return cancelled.get() ? "CancellationToken[CANCELLED]"
                : released.get() ? "CancellationToken[RELEASED]"
                : "CancellationToken[ACTIVE, hooks=" + hooks.size() + "]";
    }
}
