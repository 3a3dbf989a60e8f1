/*
 [File Info]
 path: src/test/java/tech/robd/polyglot/schedule/ExecutionSchedulerTest.java
 description: Scheduler behaviour: non-blocking spawn, parallel execution, idempotent force, deadlines,
              fail-closed validation, per-tag serialisation, deferred chaining, cancellation and stats.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.polyglot.PolyglotBlock;
import tech.robd.polyglot.ValidationLimits;
import tech.robd.polyglot.boundary.HostStackTracer;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.error.StackFrame;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.error.TaskTimeoutException;
import tech.robd.polyglot.error.UnknownLanguageException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.executor.ConcurrencyPolicy;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.executor.ExecutorRegistry;
import tech.robd.polyglot.tools.ScriptedExecutor;
import tech.robd.polyglot.tools.TestAwaitUtils;
import tech.robd.polyglot.validate.FfiValidator;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.Values;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ExecutionSchedulerTest {

    private static final ValidationLimits LIMITS = ValidationLimits.defaults()
            .withDefaultTaskTimeout(Duration.ofSeconds(10));

    private static final PolyglotBlock ONE_ARG = new PolyglotBlock("slow", "x + 2", List.of("x"));

    // 🧩 Section: fixtures
    private static ExecutionScheduler scheduler(ScriptedExecutor... parallel) {
        return scheduler(LIMITS, parallel);
    }

    private static ExecutionScheduler scheduler(ValidationLimits limits, ScriptedExecutor... parallel) {
        ExecutorRegistry registry = new ExecutorRegistry(ExecutorEnvironment.of(limits));
        for (ScriptedExecutor e : parallel) {
            registry.register(e.languageTag(), e.factory(), ConcurrencyPolicy.parallel());
        }
        registry.freeze();
        return new ExecutionScheduler(registry, new FfiValidator(limits), limits);
    }

    private static ScriptedExecutor addTwoAfter(String tag, long millis) {
        return ScriptedExecutor.of(tag, (req, token) -> {
            Thread.sleep(millis);
            return Values.of(((Value.Int) req.arguments().get(0)).value() + 2);
        });
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
    // [/🧩 Section: fixtures]

    @Test
    @Timeout(5)
        // Spawn must not block on the foreign work; force waits for it.
        // Bounds are wide on purpose: CI machines are slow, but a blocking spawn would take ~1000ms.
    void spawnReturnsImmediatelyAndForceWaitsForTheResult() {
        ScriptedExecutor slow = addTwoAfter("slow", 1000);
        try (ExecutionScheduler s = scheduler(slow)) {
            long start = System.nanoTime();
            BlockFuture f = s.spawn(ONE_ARG, Values.of(40));
            long spawnMs = elapsedMs(start);
            assertTrue(spawnMs < 300, "spawn blocked for " + spawnMs + "ms");
            assertFalse(f.isDone());

            assertEquals(Values.of(42), s.force(f));
            long totalMs = elapsedMs(start);
            assertTrue(totalMs >= 900 && totalMs < 2000, "unexpected total " + totalMs + "ms");
            assertEquals(FutureState.RESOLVED, f.state());
        }
    }

    @Test
    @Timeout(5)
        // Three independent 1s blocks on a parallel tag finish in about one block's time, not three.
    void independentBlocksRunInParallel() {
        ScriptedExecutor slow = addTwoAfter("slow", 1000);
        try (ExecutionScheduler s = scheduler(slow)) {
            long start = System.nanoTime();
            List<BlockFuture> futures = List.of(
                    s.spawn(ONE_ARG, Values.of(1)),
                    s.spawn(ONE_ARG, Values.of(2)),
                    s.spawn(ONE_ARG, Values.of(3)));
            List<Value> values = new ArrayList<>();
            for (BlockFuture f : futures) values.add(s.force(f));

            long totalMs = elapsedMs(start);
            assertEquals(List.of(Values.of(3), Values.of(4), Values.of(5)), values);
            assertTrue(totalMs < 2000, "blocks did not overlap: " + totalMs + "ms");
            assertTrue(slow.maxConcurrency() >= 2, "max concurrency " + slow.maxConcurrency());
        }
    }

    @Test
    @Timeout(3)
    void forcingTwiceNeverRunsTheBlockAgain() {
        ScriptedExecutor fast = addTwoAfter("slow", 10);
        try (ExecutionScheduler s = scheduler(fast)) {
            BlockFuture f = s.spawn(ONE_ARG, Values.of(1));
            Value first = s.force(f);
            Value second = s.force(f);
            assertEquals(first, second);
            assertEquals(Values.of(3), s.force(new Value.Deferred(f)));
            assertEquals(1, fast.invocations());
        }
    }

    @Test
    @Timeout(5)
        // The deadline fires once; forcing again rethrows the stored error object, not a new one.
        // The executor sleeps 10s but is interruptible, so the worker is released promptly.
    void deadlineRejectsWithOneTimeoutErrorReusedOnEveryForce() {
        ScriptedExecutor sleepy = ScriptedExecutor.sleeping("slow", 10_000);
        try (ExecutionScheduler s = scheduler(sleepy)) {
            PolyglotBlock block = new PolyglotBlock("slow", "sleep(10)").withTimeout(Duration.ofMillis(150));
            long start = System.nanoTime();
            BlockFuture f = s.spawn(block);

            TaskTimeoutException first = assertThrows(TaskTimeoutException.class, () -> s.force(f));
            long ms = elapsedMs(start);
            assertTrue(ms >= 100 && ms < 1500, "timeout fired after " + ms + "ms");
            assertEquals("TimeoutError", first.errorType());
            assertEquals(f.taskId(), first.taskId());
            assertTrue(first.getMessage().contains("150 ms"), first.getMessage());

            TaskTimeoutException second = assertThrows(TaskTimeoutException.class, () -> s.force(f));
            assertSame(first, second);
            assertSame(first, f.error());

            TestAwaitUtils.awaitTrue(() -> s.stats().timedOut() == 1 && s.stats().active() == 0,
                    2000, "stats never settled: " + s.stats());
            assertEquals(0, s.stats().detached());
        }
    }

    @Test
    @Timeout(5)
        // An executor that cannot be interrupted keeps its worker; the future still times out on schedule
        // and the worker is counted as detached. The script spins without checking interrupts.
    void nonInterruptibleExecutorIsLeftDetachedAfterTimeout() {
        ScriptedExecutor stubborn = new ScriptedExecutor("stubborn", false, (req, token) -> {
            long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(600);
            long spins = 0;
            while (System.nanoTime() < until) spins++;
            return Values.of(spins > 0);
        });
        try (ExecutionScheduler s = scheduler(stubborn)) {
            PolyglotBlock block = new PolyglotBlock("stubborn", "spin()").withTimeout(Duration.ofMillis(100));
            BlockFuture f = s.spawn(block);

            TestAwaitUtils.awaitRejected(f, TaskTimeoutException.class, 1000);
            TestAwaitUtils.awaitTrue(() -> s.stats().detached() == 1, 1000, "worker not marked detached");
            // late result is discarded
            TestAwaitUtils.awaitTrue(() -> s.stats().active() == 0, 2000, "detached worker never finished");
            assertInstanceOf(TaskTimeoutException.class, f.error());
        }
    }

    @Test
    @Timeout(3)
        // Fail-closed: nothing reaches the executor when an argument breaks a boundary rule.
    void invalidArgumentsAreRejectedBeforeAnyInvocation() {
        ScriptedExecutor probe = addTwoAfter("slow", 0);
        try (ExecutionScheduler s = scheduler(probe)) {
            ValidationException nul = assertThrows(ValidationException.class,
                    () -> s.spawn(ONE_ARG, Values.of("bad\0string")));
            assertEquals("args[0]", nul.path());
            assertTrue(nul.getMessage().contains("null bytes"), nul.getMessage());

            Value nested = Values.list(Values.of(1), Values.of(Double.NaN));
            ValidationException nan = assertThrows(ValidationException.class, () -> s.spawn(ONE_ARG, nested));
            assertEquals("args[0][1]", nan.path());

            Value.Dict dict = new Value.Dict(Map.of("callback",
                    new Value.Closure("f", 0, args -> Values.nil())));
            ValidationException fn = assertThrows(ValidationException.class, () -> s.spawn(ONE_ARG, dict));
            assertEquals("args[0].callback", fn.path());
            assertTrue(fn.getMessage().contains("unsafe type for FFI crossing: function"), fn.getMessage());

            assertEquals(0, probe.invocations());
            assertEquals(0, s.stats().spawned());
        }
    }

    @Test
    @Timeout(3)
    void oversizedPayloadNeverReachesTheExecutor() {
        ValidationLimits small = LIMITS.withMaxFfiPayloadBytes(1024);
        ScriptedExecutor probe = addTwoAfter("slow", 0);
        try (ExecutionScheduler s = scheduler(small, probe)) {
            Value.Array big = new Value.Array();
            for (int i = 0; i < 100; i++) big.add(Values.of("item-" + i + "-" + "x".repeat(20)));

            ValidationException e = assertThrows(ValidationException.class, () -> s.spawn(ONE_ARG, big));
            assertTrue(e.reason().startsWith("total payload too large"), e.reason());
            assertEquals(0, probe.invocations());
        }
    }

    @Test
    @Timeout(3)
    void argumentCountMustMatchBoundVariables() {
        try (ExecutionScheduler s = scheduler(addTwoAfter("slow", 0))) {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> s.spawn(ONE_ARG, Values.of(1), Values.of(2)));
            assertEquals("args", e.path());
            assertTrue(e.getMessage().contains("expected 1 arguments"), e.getMessage());
        }
    }

    @Test
    @Timeout(3)
    void tooManyArgumentsIsAValidationError() {
        ValidationLimits tight = LIMITS.withMaxFfiArguments(2);
        PolyglotBlock three = new PolyglotBlock("slow", "a", List.of("a", "b", "c"));
        try (ExecutionScheduler s = scheduler(tight, addTwoAfter("slow", 0))) {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> s.spawn(three, Values.of(1), Values.of(2), Values.of(3)));
            assertTrue(e.getMessage().contains("too many arguments: 3 > 2"), e.getMessage());
        }
    }

    @Test
    @Timeout(3)
    void unknownLanguageIsReportedAtSpawn() {
        try (ExecutionScheduler s = scheduler(addTwoAfter("slow", 0))) {
            UnknownLanguageException e = assertThrows(UnknownLanguageException.class,
                    () -> s.spawn(new PolyglotBlock("cobol", "DISPLAY 'HI'")));
            assertTrue(e.supportedLanguages().contains("slow"));
            assertEquals("UnknownLanguageError", e.errorType());
        }
    }

    @Test
    @Timeout(10)
        // A serialised tag runs one block at a time while another tag keeps running.
        // Race-avoidance: 'gate' holds the serialised lane busy until the other tag has finished.
    void serializedTagDoesNotHoldUpOtherLanguages() {
        CountDownLatch gate = new CountDownLatch(1);
        ScriptedExecutor single = ScriptedExecutor.of("single", (req, token) -> {
            gate.await(5, TimeUnit.SECONDS);
            Thread.sleep(50);
            return Values.nil();
        });
        ScriptedExecutor other = addTwoAfter("other", 10);

        ExecutorRegistry registry = new ExecutorRegistry(ExecutorEnvironment.of(LIMITS));
        registry.register("single", single.factory(), ConcurrencyPolicy.serialized());
        registry.register("other", other.factory(), ConcurrencyPolicy.parallel());
        registry.freeze();

        try (ExecutionScheduler s = new ExecutionScheduler(registry, new FfiValidator(LIMITS), LIMITS)) {
            PolyglotBlock serialBlock = new PolyglotBlock("single", "work()");
            List<BlockFuture> serial = new ArrayList<>();
            for (int i = 0; i < 4; i++) serial.add(s.spawn(serialBlock));

            BlockFuture quick = s.spawn(new PolyglotBlock("other", "x", List.of("x")), Values.of(5));
            assertEquals(Values.of(7), TestAwaitUtils.awaitValue(quick, 2000));
            assertFalse(serial.get(0).isDone(), "serialised block should still be waiting on the gate");

            gate.countDown();
            for (BlockFuture f : serial) TestAwaitUtils.awaitValue(f, 3000);
            assertEquals(1, single.maxConcurrency());
            assertEquals(4, single.invocations());
        }
    }

    @Test
    @Timeout(10)
        // Race-avoidance: 'gate' keeps the serialised lane busy so the second task is still queued
        // when the host mutates the dict it passed in.
    void hostMutationAfterSpawnDoesNotReachAQueuedTask() {
        CountDownLatch gate = new CountDownLatch(1);
        ScriptedExecutor echo = ScriptedExecutor.of("single", (req, token) -> {
            if (req.arguments().isEmpty()) {
                gate.await(5, TimeUnit.SECONDS);
                return Values.nil();
            }
            return req.arguments().get(0);
        });
        ExecutorRegistry registry = new ExecutorRegistry(ExecutorEnvironment.of(LIMITS));
        registry.register("single", echo.factory(), ConcurrencyPolicy.serialized());
        registry.freeze();

        try (ExecutionScheduler s = new ExecutionScheduler(registry, new FfiValidator(LIMITS), LIMITS)) {
            BlockFuture blocker = s.spawn(new PolyglotBlock("single", "hold()"));
            Value.Dict d = new Value.Dict().put("a", Values.of(1));
            Value.Array nested = Values.list(Values.of(1));
            BlockFuture queued = s.spawn(new PolyglotBlock("single", "d", List.of("d", "xs")), d, nested);

            d.put("bad", Values.of("x\0y"));
            nested.add(Values.of(2));
            gate.countDown();

            TestAwaitUtils.awaitValue(blocker, 3000);
            assertEquals(new Value.Dict().put("a", Values.of(1)), TestAwaitUtils.awaitValue(queued, 3000));
        }
    }

    @Test
    @Timeout(5)
        // A deferred argument is forced on the worker: the dependent block waits for its upstream value.
    void deferredArgumentChainsBlocks() {
        ScriptedExecutor slow = addTwoAfter("slow", 200);
        try (ExecutionScheduler s = scheduler(slow)) {
            BlockFuture upstream = s.spawn(ONE_ARG, Values.of(40));
            BlockFuture downstream = s.spawn(ONE_ARG, new Value.Deferred(upstream));
            assertEquals(Values.of(44), s.force(downstream));
            assertTrue(upstream.isDone());
        }
    }

    @Test
    @Timeout(5)
    void upstreamFailurePropagatesToDependentBlock() {
        ScriptedExecutor failing = ScriptedExecutor.of("failing", (req, token) -> {
            throw new IllegalStateException("upstream broke");
        });
        ScriptedExecutor slow = addTwoAfter("slow", 0);
        try (ExecutionScheduler s = scheduler(failing, slow)) {
            BlockFuture upstream = s.spawn(new PolyglotBlock("failing", "boom()"));
            BlockFuture downstream = s.spawn(ONE_ARG, new Value.Deferred(upstream));

            PolyglotException down = assertThrows(PolyglotException.class, downstream::force);
            PolyglotException up = assertThrows(PolyglotException.class, upstream::force);
            assertSame(up, down);
            assertEquals(0, slow.invocations());
        }
    }

    @Test
    @Timeout(3)
    void executorExceptionBecomesTypedForeignError() {
        ScriptedExecutor failing = ScriptedExecutor.of("failing", (req, token) -> {
            throw new IllegalStateException("boom");
        });
        try (ExecutionScheduler s = scheduler(failing)) {
            BlockFuture f;
            try (HostStackTracer.Frame frame = HostStackTracer.enter("main", "app.naab", 12)) {
                f = s.spawn(new PolyglotBlock("failing", "boom()"));
            }
            ForeignRuntimeException e = TestAwaitUtils.awaitRejected(f, ForeignRuntimeException.class, 2000);
            assertEquals("IllegalStateException", e.foreignType());
            assertEquals("RuntimeError", e.errorType());
            assertEquals("failing", e.languageTag());
            assertEquals(f.taskId(), e.taskId());
            assertTrue(e.getMessage().startsWith("[failing]"), e.getMessage());

            List<StackFrame> trace = e.unifiedTrace();
            assertTrue(trace.stream().anyMatch(fr -> fr.function().equals("main") && fr.lineNumber() == 12),
                    "host frame missing: " + trace);
            assertTrue(e.formatUnifiedTrace().contains("<polyglot block " + f.taskId() + ">"));
        }
    }

    @Test
    @Timeout(3)
        // Race-avoidance: 'entered' ensures the block is running before cancel.
    void cancelRejectsPromptlyAndInterruptsTheWorker() {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        ScriptedExecutor waiting = ScriptedExecutor.of("slow", (req, token) -> {
            entered.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ie) {
                interrupted.countDown();
                throw ie;
            }
            return Values.nil();
        });
        try (ExecutionScheduler s = scheduler(waiting)) {
            BlockFuture f = s.spawn(new PolyglotBlock("slow", "wait()"));
            TestAwaitUtils.awaitLatch(entered, 1000, "block never started");

            assertTrue(f.cancel());
            assertFalse(f.cancel(), "second cancel must be a no-op");
            assertEquals(FutureState.REJECTED, f.state());
            assertThrows(TaskCancelledException.class, f::force);
            TestAwaitUtils.awaitLatch(interrupted, 1000, "worker was not interrupted");
        }
    }

    @Test
    @Timeout(3)
    void cancelAfterCompletionReturnsFalse() {
        try (ExecutionScheduler s = scheduler(addTwoAfter("slow", 0))) {
            BlockFuture f = s.spawn(ONE_ARG, Values.of(1));
            TestAwaitUtils.awaitValue(f, 1000);
            assertFalse(f.cancel());
            assertEquals(Values.of(3), f.force());
        }
    }

    @Test
    @Timeout(5)
    void executeParallelReturnsValuesInCallOrder() {
        try (ExecutionScheduler s = scheduler(addTwoAfter("slow", 100))) {
            List<Value> out = s.executeParallel(List.of(
                    BlockCall.of(ONE_ARG, Values.of(10)),
                    BlockCall.of(ONE_ARG, Values.of(20)),
                    BlockCall.of(ONE_ARG, Values.of(30))));
            assertEquals(List.of(Values.of(12), Values.of(22), Values.of(32)), out);
        }
    }

    @Test
    @Timeout(5)
        // The first failing call aborts the batch; the slow call behind it is cancelled rather than awaited.
    void executeParallelCancelsRemainingCallsOnFirstError() {
        ScriptedExecutor failing = ScriptedExecutor.of("failing", (req, token) -> {
            throw new IllegalArgumentException("bad input");
        });
        ScriptedExecutor sleepy = ScriptedExecutor.sleeping("sleepy", 10_000);
        try (ExecutionScheduler s = scheduler(failing, sleepy)) {
            long start = System.nanoTime();
            assertThrows(ForeignRuntimeException.class, () -> s.executeParallel(List.of(
                    BlockCall.of(new PolyglotBlock("failing", "x")),
                    BlockCall.of(new PolyglotBlock("sleepy", "y")))));
            assertTrue(elapsedMs(start) < 2000);
            TestAwaitUtils.awaitTrue(() -> s.stats().rejected() == 2, 2000, "stats: " + s.stats());
        }
    }

    @Test
    @Timeout(5)
    void spawnAllCancelsStartedCallsWhenALaterSpawnFails() {
        ScriptedExecutor sleepy = ScriptedExecutor.sleeping("sleepy", 10_000);
        try (ExecutionScheduler s = scheduler(sleepy)) {
            PolyglotBlock withArg = new PolyglotBlock("sleepy", "x", List.of("x"));
            assertThrows(ValidationException.class, () -> s.spawnAll(List.of(
                    BlockCall.of(withArg, Values.of(1)),
                    BlockCall.of(withArg, Values.of("nul\0")))));
            TestAwaitUtils.awaitTrue(() -> s.stats().spawned() == 1 && s.stats().rejected() == 1,
                    2000, "stats: " + s.stats());
        }
    }

    @Test
    @Timeout(5)
    void statsCountOutcomes() {
        ScriptedExecutor ok = addTwoAfter("slow", 0);
        ScriptedExecutor failing = ScriptedExecutor.of("failing", (req, token) -> {
            throw new IllegalStateException("no");
        });
        try (ExecutionScheduler s = scheduler(ok, failing)) {
            TestAwaitUtils.awaitValue(s.spawn(ONE_ARG, Values.of(1)), 1000);
            TestAwaitUtils.awaitValue(s.spawn(ONE_ARG, Values.of(2)), 1000);
            TestAwaitUtils.awaitRejected(s.spawn(new PolyglotBlock("failing", "x")),
                    ForeignRuntimeException.class, 1000);

            // outcome counters are updated from the completion callback
            TestAwaitUtils.awaitTrue(() -> {
                SchedulerStats st = s.stats();
                return st.resolved() == 2 && st.rejected() == 1 && st.active() == 0;
            }, 2000, "stats: " + s.stats());
            assertEquals(3, s.stats().spawned());
            assertEquals(0, s.stats().timedOut());
        }
    }

    @Test
    @Timeout(10)
        // Closing cancels pending work; spawning afterwards yields an already-cancelled future.
    void closeCancelsPendingWorkAndRefusesNewSpawns() {
        CountDownLatch entered = new CountDownLatch(1);
        ScriptedExecutor waiting = ScriptedExecutor.of("slow", (req, token) -> {
            entered.countDown();
            Thread.sleep(10_000);
            return Values.nil();
        });
        ExecutionScheduler s = scheduler(waiting);
        BlockFuture running = s.spawn(new PolyglotBlock("slow", "wait()"));
        TestAwaitUtils.awaitLatch(entered, 1000, "block never started");

        s.close();
        assertTrue(s.isClosed());
        assertThrows(TaskCancelledException.class, running::force);

        BlockFuture late = s.spawn(new PolyglotBlock("slow", "wait()"));
        assertTrue(late.isDone());
        assertThrows(TaskCancelledException.class, late::force);
        s.close(); // idempotent
    }
}
