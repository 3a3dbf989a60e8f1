/*
 [File Info]
 path: src/test/java/tech/robd/polyglot/PolyglotRuntimeTest.java
 description: Runtime facade: builder wiring, aliases, host callbacks, default executors
              and lifecycle through the public entry point.
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
package tech.robd.polyglot;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.polyglot.callback.CallbackSignature;
import tech.robd.polyglot.callback.Trampoline;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.executor.ConcurrencyPolicy;
import tech.robd.polyglot.schedule.BlockCall;
import tech.robd.polyglot.schedule.BlockFuture;
import tech.robd.polyglot.tools.ScriptedExecutor;
import tech.robd.polyglot.tools.TestAwaitUtils;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.ValueType;
import tech.robd.polyglot.value.Values;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

final class PolyglotRuntimeTest {

    private static final ValidationLimits LIMITS = ValidationLimits.defaults()
            .withDefaultTaskTimeout(Duration.ofSeconds(10));

    private static ScriptedExecutor doubler() {
        return ScriptedExecutor.of("calc", (req, token) ->
                Values.of(((Value.Int) req.arguments().get(0)).value() * 2));
    }

    @Test
    @Timeout(10)
    void builderWiresExecutorsAliasesAndLimits() {
        ScriptedExecutor calc = doubler();
        try (PolyglotRuntime rt = PolyglotRuntime.builder()
                .limits(LIMITS)
                .register("calc", calc.factory(), ConcurrencyPolicy.parallel())
                .alias("c", "calc")
                .build()) {

            assertSame(LIMITS, rt.limits());
            assertEquals(List.of("c", "calc"), rt.registry().supportedLanguages());
            assertTrue(rt.registry().isFrozen());

            PolyglotBlock block = new PolyglotBlock("c", "x * 2", List.of("x"));
            assertEquals(Values.of(42), rt.execute(block, Values.of(21)));

            BlockFuture f = rt.spawn(block, Values.of(5));
            assertEquals(Values.of(10), rt.force(f));
            assertEquals(Values.of(10), rt.force(new Value.Deferred(f)));
            assertEquals(Values.of("plain"), rt.force(Values.of("plain")));
            assertEquals(2, calc.invocations());

            TestAwaitUtils.awaitTrue(() -> rt.stats().resolved() == 2, 2000, "stats: " + rt.stats());
        }
        assertTrue(calc.isClosed(), "runtime close must close started executors");
    }

    @Test
    @Timeout(10)
    void executeParallelThroughTheRuntimeKeepsCallOrder() {
        ScriptedExecutor slow = ScriptedExecutor.sleeping("slow", 300);
        try (PolyglotRuntime rt = PolyglotRuntime.builder()
                .limits(LIMITS)
                .register("slow", slow.factory(), ConcurrencyPolicy.parallel())
                .build()) {
            PolyglotBlock echo = new PolyglotBlock("slow", "x", List.of("x"));
            List<Value> out = rt.executeParallel(List.of(
                    BlockCall.of(echo, Values.of("a")),
                    BlockCall.of(echo, Values.of("b")),
                    BlockCall.of(echo, Values.of("c"))));
            assertEquals(List.of(Values.of("a"), Values.of("b"), Values.of("c")), out);
            assertTrue(slow.maxConcurrency() > 1, "blocks did not overlap");
        }
    }

    @Test
    @Timeout(10)
    void hostFunctionsBecomeCallbacks() {
        try (PolyglotRuntime rt = PolyglotRuntime.builder()
                .limits(LIMITS)
                .hostFunction(CallbackSignature.of("count", ValueType.INT, ValueType.ANY),
                        args -> Values.of(args.size()))
                .hostFunction(CallbackSignature.of("unbound", ValueType.NULL), null)
                .build()) {

            assertEquals(2, rt.callbacks().names().size());
            Trampoline count = rt.callbacks().lookup("count");
            assertNotNull(count);
            assertEquals(1, count.signature().arity());

            Trampoline unbound = rt.callbacks().lookup("unbound");
            assertNotNull(unbound);
            assertFalse(unbound.invoke("test", List.of()).ok());
            assertNull(rt.callbacks().lookup("missing"));
        }
    }

    @Test
    @Timeout(10)
    void defaultExecutorsRegisterAllTagsWithoutStartingThem() {
        try (PolyglotRuntime rt = PolyglotRuntime.builder().limits(LIMITS).withDefaultExecutors().build()) {
            assertTrue(rt.registry().supportedLanguages().containsAll(
                    List.of("shell", "sh", "bash", "python", "py", "python3", "javascript", "js")));
            assertTrue(rt.registry().isSupported("JS"));
            assertFalse(rt.registry().isStarted("javascript"), "executors start on first use");
            assertTrue(rt.registry().descriptor("js").policy().isBounded());
            assertFalse(rt.registry().descriptor("python").policy().isBounded());
        }
    }

    @Test
    @Timeout(10)
    void shellBlockRunsThroughTheRuntime() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs a POSIX shell");
        try (PolyglotRuntime rt = PolyglotRuntime.builder().limits(LIMITS).withDefaultExecutors().build()) {
            Value v = rt.execute(new PolyglotBlock("sh", "echo $((a + b))", List.of("a", "b")),
                    Values.of(40), Values.of(2));
            Value.Struct r = assertInstanceOf(Value.Struct.class, v);
            assertEquals(Values.of("42"), r.field("stdout"));
            assertEquals(Values.of(0), r.field("exitCode"));
        }
    }

    @Test
    @Timeout(10)
    void commandTemplatesRegisterCustomToolchains() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs a POSIX shell");
        try (PolyglotRuntime rt = PolyglotRuntime.builder()
                .limits(LIMITS)
                .command("script", "sh {}", ".sh")
                .build()) {
            Value v = rt.execute(new PolyglotBlock("script", """
                    echo "log line"
                    echo '__NAAB_RETURN__:[1, 2, 3]'
                    """));
            assertEquals(Values.list(Values.of(1), Values.of(2), Values.of(3)), v);
        }
    }

    @Test
    @Timeout(10)
    void closedRuntimeRefusesWork() {
        ScriptedExecutor calc = doubler();
        PolyglotRuntime rt = PolyglotRuntime.builder()
                .limits(LIMITS)
                .register("calc", calc.factory(), ConcurrencyPolicy.parallel())
                .build();
        rt.close();

        BlockFuture late = rt.spawn(new PolyglotBlock("calc", "x", List.of("x")), Values.of(1));
        assertThrows(TaskCancelledException.class, late::force);
        assertEquals(0, calc.invocations());
    }

    @Test
    void builderRejectsNulls() {
        PolyglotRuntime.Builder b = PolyglotRuntime.builder();
        assertThrows(IllegalArgumentException.class, () -> b.limits(null));
        assertThrows(IllegalArgumentException.class, () -> b.alias(null, "x"));
        assertThrows(IllegalArgumentException.class, () -> b.register("x", null, ConcurrencyPolicy.parallel()));
        assertThrows(IllegalArgumentException.class, () -> b.hostFunction(null, null));
    }
}
