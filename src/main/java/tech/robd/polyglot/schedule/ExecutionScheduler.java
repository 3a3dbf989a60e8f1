/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/ExecutionScheduler.java
 description: Spawns polyglot blocks onto per-language worker lanes, races them against their deadline
              and settles each BlockFuture exactly once.
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

package tech.robd.polyglot.schedule;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.PolyglotBlock;
import tech.robd.polyglot.ValidationLimits;
import tech.robd.polyglot.boundary.ExceptionBoundary;
import tech.robd.polyglot.boundary.GuardedResult;
import tech.robd.polyglot.boundary.HostStackTracer;
import tech.robd.polyglot.diagnostics.AuditLog;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.error.TaskTimeoutException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorDescriptor;
import tech.robd.polyglot.executor.ExecutorRegistry;
import tech.robd.polyglot.executor.LanguageExecutor;
import tech.robd.polyglot.schedule.internal.BlockFutureImpl;
import tech.robd.polyglot.schedule.internal.CancellationTokenImpl;
import tech.robd.polyglot.schedule.internal.WorkerLanes;
import tech.robd.polyglot.validate.FfiValidator;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.Values;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns {@link PolyglotBlock}s into running tasks.
 *
 * <p>{@link #spawn} does the synchronous part on the caller's thread: language lookup,
 * argument count, fail-closed validation of the snapshot, then hands the task to its lane
 * and arms a deadline timer. It never waits for foreign code. The worker forces any deferred
 * arguments, runs the executor inside the exception boundary and settles the future; the
 * deadline timer may settle it first with a timeout. Whichever comes first wins, the other
 * outcome is discarded.</p>
 *
 * <p>Tasks of different languages never wait on each other. Tasks of one language wait only
 * if its executor was registered with a bounded {@link tech.robd.polyglot.executor.ConcurrencyPolicy}.</p>
 */
public final class ExecutionScheduler implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ExecutionScheduler.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final ExecutorRegistry registry;
    private final FfiValidator validator;
    private final ValidationLimits limits;

    private final CancellationTokenImpl rootToken = new CancellationTokenImpl();
    private final WorkerLanes lanes;
    private final ScheduledThreadPoolExecutor watchdog;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong taskSeq = new AtomicLong();

    private final AtomicLong spawned = new AtomicLong();
    private final AtomicLong resolved = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong detached = new AtomicLong();
    private final AtomicLong active = new AtomicLong();
    // [/🧩 Section: state]

    /**
     * Worker-side view of one task, shared with its deadline timer.
     */
    private static final class TaskSlot {
        volatile boolean started;
        volatile boolean finished;
        volatile boolean detached;
        volatile @Nullable LanguageExecutor executor;
    }

    // 🧩 Section: construction
    public ExecutionScheduler(ExecutorRegistry registry, FfiValidator validator, ValidationLimits limits) {
        if (registry == null) throw new IllegalArgumentException("registry cannot be null");
        if (validator == null) throw new IllegalArgumentException("validator cannot be null");
        if (limits == null) throw new IllegalArgumentException("limits cannot be null");
        this.registry = registry;
        this.validator = validator;
        this.limits = limits;
        this.lanes = new WorkerLanes("polyglot");
        this.watchdog = new ScheduledThreadPoolExecutor(1, WorkerLanes.daemonThreads("polyglot-deadline"));
        this.watchdog.setRemoveOnCancelPolicy(true);
    }
    // [/🧩 Section: construction]

    // 🧩 Section: spawn

    /**
     * Start {@code block} with {@code arguments} bound to its variable names, in order.
     * Arguments may include {@link Value.Deferred} results of other blocks; the new task
     * waits for them on its worker and fails with their error if they fail.
     *
     * @throws tech.robd.polyglot.error.UnknownLanguageException if no executor serves the tag
     * @throws ValidationException                               if the arguments cannot cross
     *                                                           the boundary; nothing is started
     */
    public BlockFuture spawn(PolyglotBlock block, List<? extends Value> arguments) {
        if (block == null) throw new IllegalArgumentException("block cannot be null");
        if (arguments == null) throw new IllegalArgumentException("arguments cannot be null");

        if (closed.get()) {
            DIAG.warn("spawn rejected for [{}]: scheduler is closed", block.languageTag());
            return cancelledFuture(block.languageTag(), "scheduler is closed");
        }

        // 🧩 Point: spawn/synchronous-checks
        ExecutorDescriptor descriptor = registry.descriptor(block.languageTag());
        String tag = descriptor.languageTag();
        List<Value> given = List.copyOf(arguments);
        List<String> names = block.boundVariableNames();
        if (given.size() != names.size()) {
            throw new ValidationException(tag, "args", "expected " + names.size()
                    + " arguments for bound variables " + names + ", got " + given.size());
        }
        validator.validateArguments(given, tag, true);
        List<Value> snapshot = Values.snapshot(given);

        // 🧩 Point: spawn/task
        Duration budget = block.timeout() != null ? block.timeout() : limits.defaultTaskTimeout();
        String taskId = "task-" + taskSeq.incrementAndGet();
        CancellationTokenImpl token = (CancellationTokenImpl) rootToken.child();
        BlockFutureImpl future = new BlockFutureImpl(taskId, tag, token);
        ExecutionTask task = new ExecutionTask(taskId, tag, block, snapshot, future, budget,
                System.nanoTime() + budget.toNanos(), HostStackTracer.snapshot());
        TaskSlot slot = new TaskSlot();

        spawned.incrementAndGet();
        active.incrementAndGet();
        DIAG.debug("{} spawn [{}] args={} budget={}ms", taskId, tag, snapshot.size(), budget.toMillis());

        try {
            lanes.laneFor(tag, descriptor.policy()).execute(() -> runTask(task, slot, token));
        } catch (RejectedExecutionException rex) {
            DIAG.warn("{} rejected by lane [{}]: {}", taskId, tag, rex.toString());
            future.reject(new TaskCancelledException(tag, "block " + taskId + " could not be scheduled", rex));
            finish(task, slot, token);
            countOutcome(future);
            return future;
        }

        // 🧩 Point: spawn/deadline
        ScheduledFuture<?> timer = watchdog.schedule(() -> onDeadline(task, slot, token),
                Math.max(0L, task.deadlineNanos() - System.nanoTime()), TimeUnit.NANOSECONDS);
        future.completion().whenComplete((r, t) -> {
            timer.cancel(false);
            countOutcome(future);
        });
        return future;
    }

    public BlockFuture spawn(PolyglotBlock block, Value... arguments) {
        return spawn(block, List.of(arguments));
    }

    /**
     * Spawn every call before waiting on any of them. If one spawn throws, the calls already
     * started are cancelled and the error is rethrown.
     */
    public List<BlockFuture> spawnAll(List<BlockCall> calls) {
        if (calls == null) throw new IllegalArgumentException("calls cannot be null");
        List<BlockFuture> futures = new ArrayList<>(calls.size());
        try {
            for (BlockCall call : calls) futures.add(spawn(call.block(), call.arguments()));
        } catch (RuntimeException e) {
            for (BlockFuture f : futures) f.cancel();
            throw e;
        }
        return futures;
    }

    /**
     * Spawn all, then force all in order.
     *
     * @return values in call order
     * @throws PolyglotException the first error in call order; the remaining tasks are cancelled
     */
    public List<Value> executeParallel(List<BlockCall> calls) {
        List<BlockFuture> futures = spawnAll(calls);
        List<Value> values = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                values.add(futures.get(i).force());
            } catch (PolyglotException e) {
                for (int j = i + 1; j < futures.size(); j++) futures.get(j).cancel();
                throw e;
            }
        }
        return values;
    }
    // [/🧩 Section: spawn]

    // 🧩 Section: force

    /**
     * Wait for {@code future}. Forcing again returns the same value or rethrows the same
     * error; the block never runs twice.
     */
    public Value force(BlockFuture future) {
        if (future == null) throw new IllegalArgumentException("future cannot be null");
        return future.force();
    }

    /**
     * Force {@code value} if it is a deferred block result, otherwise return it unchanged.
     */
    public Value force(Value value) {
        if (value == null) throw new IllegalArgumentException("value cannot be null");
        return Values.concrete(value);
    }
    // [/🧩 Section: force]

    // 🧩 Section: worker
    private void runTask(ExecutionTask task, TaskSlot slot, CancellationTokenImpl token) {
        BlockFutureImpl future = task.future();
        String taskId = task.taskId();
        try {
            if (future.isDone()) {
                DIAG.debug("{} settled before start ({}), skipping", taskId, future.state());
                return;
            }
            slot.started = true;
            Thread worker = Thread.currentThread();

            GuardedResult<Value> result;
            try (AutoCloseable interrupt = token.onCancel(() -> {
                DIAG.debug("{} token->interrupt {}", taskId, worker.getName());
                worker.interrupt();
            })) {
                result = ExceptionBoundary.runGuarded(task.languageTag(), () -> execute(task, slot, token));
            }
            slot.finished = true;

            if (result.success()) {
                Value v = result.value();
                if (!future.resolve(v == null ? Values.nil() : v)) lateOutcome(task, slot, "value");
            } else {
                PolyglotException e = result.error();
                if (e != null) e.attachHostContext(taskId, task.hostFrames());
                if (e == null || !future.reject(e)) lateOutcome(task, slot, e == null ? "error" : e.errorType());
            }
        } catch (Exception e) {
            // only the interrupt-hook close can land here
            DIAG.warn("{} worker bookkeeping failed: {}", taskId, e.toString());
        } finally {
            // pool threads must not carry a cancel interrupt into the next task
            Thread.interrupted();
            finish(task, slot, token);
        }
    }

    private Value execute(ExecutionTask task, TaskSlot slot, CancellationToken token) throws Exception {
        String tag = task.languageTag();
        LanguageExecutor executor = registry.resolve(tag);
        slot.executor = executor;

        // 🧩 Point: worker/deferred-arguments
        List<Value> args = Values.concreteAll(task.arguments());
        validator.validateArguments(args, tag);

        if (token.isCancelled()) {
            throw new TaskCancelledException(tag, "block " + task.taskId() + " cancelled before start");
        }
        AuditLog.blockExecute(task.taskId(), tag, task.block().sourceText().length(), args.size());
        DIAG.debug("{} run [{}] on {}", task.taskId(), tag, Thread.currentThread().getName());
        Value v = executor.run(new ExecutionRequest(task.taskId(), tag, task.block(), args), token);
        if (v == null) throw new IllegalStateException("executor '" + tag + "' returned null");
        return v;
    }

    private void lateOutcome(ExecutionTask task, TaskSlot slot, String what) {
        if (slot.detached) {
            DIAG.warn("{} [{}] detached worker finished late; {} discarded", task.taskId(), task.languageTag(), what);
        } else {
            DIAG.debug("{} late {} discarded (future already {})", task.taskId(), what, task.future().state());
        }
    }

    private void finish(ExecutionTask task, TaskSlot slot, CancellationTokenImpl token) {
        slot.finished = true;
        token.release();
        active.decrementAndGet();
        DIAG.debug("{} worker done", task.taskId());
    }
    // [/🧩 Section: worker]

    // 🧩 Section: deadline
    private void onDeadline(ExecutionTask task, TaskSlot slot, CancellationTokenImpl token) {
        TaskTimeoutException timeout = new TaskTimeoutException(task.languageTag(), task.taskId(), task.budget());
        timeout.attachHostContext(task.taskId(), task.hostFrames());
        if (!task.future().reject(timeout)) return;

        LanguageExecutor executor = slot.executor;
        boolean leftRunning = slot.started && !slot.finished && executor != null && !executor.supportsInterrupt();
        if (leftRunning) {
            slot.detached = true;
            detached.incrementAndGet();
            DIAG.warn("{} [{}] exceeded {} ms; executor cannot be interrupted, worker left to finish detached",
                    task.taskId(), task.languageTag(), task.budget().toMillis());
        } else {
            DIAG.debug("{} [{}] deadline hit, cancelling", task.taskId(), task.languageTag());
        }
        token.cancel();
        AuditLog.timeout(task.taskId(), task.languageTag(), task.budget().toMillis(), leftRunning);
    }
    // [/🧩 Section: deadline]

    // 🧩 Section: stats
    private void countOutcome(BlockFuture future) {
        PolyglotException e = future.error();
        if (e == null) {
            resolved.incrementAndGet();
            return;
        }
        rejected.incrementAndGet();
        if (e instanceof TaskTimeoutException) timedOut.incrementAndGet();
    }

    public SchedulerStats stats() {
        return new SchedulerStats(spawned.get(), resolved.get(), rejected.get(), timedOut.get(),
                detached.get(), active.get());
    }
    // [/🧩 Section: stats]

    // 🧩 Section: lifecycle
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Reject every pending task with a cancellation error, fire their interrupt hooks and stop
     * the lanes. Idempotent. Executors are owned by the registry and closed there.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        DIAG.info("scheduler closing: {}", stats());
        rootToken.cancel();
        lanes.close();
        watchdog.shutdownNow();
    }
    // [/🧩 Section: lifecycle]

    private static BlockFuture cancelledFuture(String languageTag, String reason) {
        CancellationTokenImpl token = new CancellationTokenImpl();
        BlockFutureImpl f = new BlockFutureImpl("task-rejected", languageTag, token);
        f.reject(new TaskCancelledException(languageTag, reason));
        token.release();
        return f;
    }
}
