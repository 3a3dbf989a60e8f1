/*
 [File Info]
 path: src/test/java/tech/robd/polyglot/executor/embedded/GraalPolyglotExecutorTest.java
 description: JavaScript blocks on the embedded GraalVM engine: scoping, values, errors, sandbox,
              host callbacks and interrupt. Skipped when the JS language is not on the classpath.
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
package tech.robd.polyglot.executor.embedded;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.PolyglotBlock;
import tech.robd.polyglot.ValidationLimits;
import tech.robd.polyglot.callback.CallbackRegistry;
import tech.robd.polyglot.callback.CallbackSignature;
import tech.robd.polyglot.callback.CallbackValidator;
import tech.robd.polyglot.callback.HostFunction;
import tech.robd.polyglot.callback.Trampoline;
import tech.robd.polyglot.error.CompileException;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.marshal.ValueMarshaller;
import tech.robd.polyglot.schedule.internal.CancellationTokenImpl;
import tech.robd.polyglot.validate.FfiValidator;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.ValueType;
import tech.robd.polyglot.value.Values;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

final class GraalPolyglotExecutorTest {

    private static final ValidationLimits LIMITS = ValidationLimits.defaults();
    private static GraalPolyglotExecutor js;
    private static Trampoline add;

    @BeforeAll
    static void startEngine() {
        assumeTrue(GraalPolyglotExecutor.isAvailable(GraalPolyglotExecutor.JAVASCRIPT), "GraalJS not available");
        CallbackValidator wrapper = new CallbackValidator(new ValueMarshaller(LIMITS), new FfiValidator(LIMITS));
        HostFunction sum = args -> Values.of(((Value.Int) args.get(0)).value() + ((Value.Int) args.get(1)).value());
        add = wrapper.wrap(sum, CallbackSignature.of("hostAdd", ValueType.INT, ValueType.INT, ValueType.INT));
        ExecutorEnvironment env = ExecutorEnvironment.of(LIMITS, CallbackRegistry.of(List.of(add)));
        js = new GraalPolyglotExecutor("javascript", env, GraalPolyglotExecutor.JAVASCRIPT);
    }

    @AfterAll
    static void stopEngine() {
        if (js != null) js.close();
    }

    private static Value run(String source, List<String> names, Value... args) throws Exception {
        return run(source, names, CancellationToken.none(), args);
    }

    private static Value run(String source, List<String> names, CancellationToken token, Value... args) throws Exception {
        PolyglotBlock block = new PolyglotBlock("javascript", source, names);
        return js.run(new ExecutionRequest("task-js", "javascript", block, List.of(args)), token);
    }

    @Test
    @Timeout(30)
    void completionValueIsTheResult() throws Exception {
        assertEquals(Values.of(42), run("a + b", List.of("a", "b"), Values.of(40), Values.of(2)));
        assertEquals(Values.of(2.5), run("5 / 2", List.of()));
        assertEquals(Values.of("HI"), run("s.toUpperCase()", List.of("s"), Values.of("hi")));
    }

    @Test
    @Timeout(30)
    void objectsAndArraysComeBackAsDictsAndLists() throws Exception {
        Value v = run("const o = { total: xs.reduce((p, c) => p + c, 0), flags: [true, null] }; o",
                List.of("xs"), Values.list(Values.of(1), Values.of(2), Values.of(3)));
        Value.Dict d = assertInstanceOf(Value.Dict.class, v);
        assertEquals(Values.of(6), d.get("total"));
        assertEquals(Values.list(Values.of(true), Values.nil()), d.get("flags"));
    }

    @Test
    @Timeout(30)
        // Blocks share one context, but declarations are local to each block.
    void declarationsDoNotLeakBetweenBlocks() throws Exception {
        run("let leaked = 1; const alsoLeaked = 2; leaked", List.of());
        assertEquals(Values.of("undefined"), run("typeof leaked + ''", List.of()));
    }

    @Test
    @Timeout(30)
    void thrownErrorsKeepTheirType() {
        ForeignRuntimeException e = assertThrows(ForeignRuntimeException.class,
                () -> run("throw new TypeError('bad input')", List.of()));
        assertEquals("TypeError", e.foreignType());
        assertEquals("[javascript] TypeError: bad input", e.getMessage());
    }

    @Test
    @Timeout(30)
    void syntaxErrorIsACompileError() {
        CompileException e = assertThrows(CompileException.class, () -> run("let = ;", List.of()));
        assertEquals("CompileError", e.errorType());
    }

    @Test
    @Timeout(30)
    void functionsAndNonFiniteNumbersCannotCross() {
        ValidationException fn = assertThrows(ValidationException.class, () -> run("(x) => x", List.of()));
        assertEquals("unsafe type for FFI crossing: function", fn.reason());

        ValidationException nan = assertThrows(ValidationException.class, () -> run("0 / 0", List.of()));
        assertEquals("NaN not allowed in FFI", nan.reason());
    }

    @Test
    @Timeout(30)
    void hostClassesAreNotReachable() throws Exception {
        Value v = run("let r; try { Java.type('java.lang.System'); r = 'escaped'; } catch (e) { r = 'blocked'; } r",
                List.of());
        assertEquals(Values.of("blocked"), v);
    }

    @Test
    @Timeout(30)
    void hostCallbacksAreValidatedBothWays() throws Exception {
        long before = add.hostCallCount();
        assertEquals(Values.of(5), run("hostAdd(2, 3)", List.of()));
        assertEquals(before + 1, add.hostCallCount());

        Value rejected = run("let n; try { hostAdd('2', 3); n = 'called'; } catch (e) { n = e.name; } n", List.of());
        assertEquals(Values.of("ValidationError"), rejected);
        assertEquals(before + 1, add.hostCallCount());
    }

    @Test
    @Timeout(30)
        // Race-avoidance: the token fires after 300ms while the guest spins; the context must stay usable.
    void cancellationInterruptsTheGuestAndTheExecutorRecovers() throws Exception {
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread t = new Thread(() -> {
            try {
                run("while (true) {}", List.of(), token);
            } catch (Throwable e) {
                thrown.set(e);
            }
        });
        t.start();
        Thread.sleep(300);
        token.cancel();
        t.join(10_000);

        assertFalse(t.isAlive(), "guest loop was not interrupted");
        assertInstanceOf(TaskCancelledException.class, thrown.get());
        assertEquals(Values.of(3), run("1 + 2", List.of()));
    }

    @Test
    @Timeout(30)
    void limitSystemPropertiesDoNotUpsetTheEngine() throws Exception {
        String key = ValidationLimits.KEY_MAX_DEPTH;
        String before = System.getProperty(key);
        System.setProperty(key, "12");
        GraalPolyglotExecutor fresh = null;
        try {
            ValidationLimits loaded = ValidationLimits.load();
            assertEquals(12, loaded.maxFfiDepth());
            fresh = new GraalPolyglotExecutor("javascript", ExecutorEnvironment.of(loaded), GraalPolyglotExecutor.JAVASCRIPT);
            PolyglotBlock block = new PolyglotBlock("javascript", "1 + 2", List.of());
            assertEquals(Values.of(3),
                    fresh.run(new ExecutionRequest("task-props", "javascript", block, List.of()), CancellationToken.none()));
        } finally {
            if (fresh != null) fresh.close();
            if (before == null) System.clearProperty(key);
            else System.setProperty(key, before);
        }
    }
}
