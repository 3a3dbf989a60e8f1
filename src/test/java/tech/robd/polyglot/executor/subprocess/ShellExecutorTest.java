/*
 [File Info]
 path: src/test/java/tech/robd/polyglot/executor/subprocess/ShellExecutorTest.java
 description: Shell blocks through sh: environment bindings, ShellResult, exit status, output cap, cancel.
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
package tech.robd.polyglot.executor.subprocess;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.PolyglotBlock;
import tech.robd.polyglot.ValidationLimits;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.schedule.internal.CancellationTokenImpl;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.Values;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

final class ShellExecutorTest {

    private static final ExecutorEnvironment ENV = ExecutorEnvironment.of(ValidationLimits.defaults());

    @BeforeAll
    static void requireShell() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "needs a POSIX shell");
    }

    private static Value.Struct run(ShellExecutor shell, PolyglotBlock block, Value... args) throws Exception {
        Value v = shell.run(new ExecutionRequest("task-1", "shell", block, List.of(args)), CancellationToken.none());
        return assertInstanceOf(Value.Struct.class, v);
    }

    @Test
    @Timeout(10)
    void stdoutIsReturnedWithoutTrailingNewlines() throws Exception {
        Value.Struct r = run(new ShellExecutor("shell", ENV), new PolyglotBlock("shell", "echo hello; echo oops >&2"));
        assertEquals(ShellExecutor.RESULT_STRUCT, r.structName());
        assertEquals(Values.of("hello"), r.field("stdout"));
        assertEquals(Values.of("oops"), r.field("stderr"));
        assertEquals(Values.of(0), r.field("exitCode"));
    }

    @Test
    @Timeout(10)
    void boundVariablesArriveAsEnvironmentVariables() throws Exception {
        PolyglotBlock block = new PolyglotBlock("shell", """
                    printf '%s|%s|%s|%s' "$name" "$count" "$items" "$missing"
                """, List.of("name", "count", "items", "missing"));
        Value.Struct r = run(new ShellExecutor("shell", ENV), block,
                Values.of("world"), Values.of(42), Values.list(Values.of(1), Values.of("a")), Values.nil());
        assertEquals(Values.of("world|42|[1,\"a\"]|"), r.field("stdout"));
    }

    @Test
    @Timeout(10)
    void boundVariablesCannotReplaceReservedEnvironment() {
        ShellExecutor shell = new ShellExecutor("shell", ENV);
        ValidationException e = assertThrows(ValidationException.class, () -> run(shell,
                new PolyglotBlock("shell", "echo \"$PATH\"", List.of("greeting", "PATH")),
                Values.of("hi"), Values.of("/tmp/evil")));
        assertEquals("args[1]", e.path());
        assertTrue(e.getMessage().contains("PATH"), e.getMessage());

        assertThrows(ValidationException.class, () -> run(shell,
                new PolyglotBlock("shell", "true", List.of("LD_PRELOAD")), Values.of("/tmp/x.so")));
    }

    @Test
    @Timeout(10)
    void nonZeroExitFailsWithExitCodeAndStderr() {
        ShellExecutor shell = new ShellExecutor("shell", ENV);
        ForeignRuntimeException e = assertThrows(ForeignRuntimeException.class,
                () -> run(shell, new PolyglotBlock("shell", "echo first >&2; echo broken >&2; exit 3")));
        assertEquals(3, e.exitCode());
        assertEquals("first\nbroken", e.stderr());
        assertEquals("[shell] command exited with code 3: broken", e.getMessage());
    }

    @Test
    @Timeout(10)
    void exitCodeCanBeInspectedInsteadOfFailing() throws Exception {
        ShellExecutor lenient = new ShellExecutor("shell", ENV, "sh", false);
        Value.Struct r = run(lenient, new PolyglotBlock("shell", "exit 3"));
        assertEquals(Values.of(3), r.field("exitCode"));
    }

    @Test
    @Timeout(10)
        // Fail-closed on output: a NUL byte cannot come back as a host string.
    void nulInOutputIsRejected() {
        ShellExecutor shell = new ShellExecutor("shell", ENV);
        ValidationException e = assertThrows(ValidationException.class,
                () -> run(shell, new PolyglotBlock("shell", "printf 'a\\000b'")));
        assertEquals("return", e.path());
    }

    @Test
    @Timeout(10)
    void capturedOutputIsCapped() {
        ExecutorEnvironment small = ExecutorEnvironment.of(ValidationLimits.defaults().withMaxCapturedOutputBytes(1000));
        ShellExecutor shell = new ShellExecutor("shell", small);
        ValidationException e = assertThrows(ValidationException.class,
                () -> run(shell, new PolyglotBlock("shell", "yes | head -c 100000")));
        assertTrue(e.getMessage().contains("captured output too large"), e.getMessage());
    }

    @Test
    @Timeout(10)
        // Race-avoidance: the process is given 300ms to start before the token fires.
    void cancellingTheTokenKillsTheProcess() throws Exception {
        ShellExecutor shell = new ShellExecutor("shell", ENV);
        CancellationTokenImpl token = new CancellationTokenImpl();
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        Thread t = new Thread(() -> {
            try {
                shell.run(new ExecutionRequest("task-2", "shell", new PolyglotBlock("shell", "sleep 30"), List.of()), token);
            } catch (Throwable e) {
                thrown.set(e);
            }
        });
        long start = System.nanoTime();
        t.start();
        Thread.sleep(300);
        token.cancel();
        t.join(5000);

        assertFalse(t.isAlive(), "runner still waiting on a killed process");
        assertInstanceOf(TaskCancelledException.class, thrown.get());
        assertTrue(System.nanoTime() - start < 5_000_000_000L);
    }

    @Test
    void cancelledTokenNeverStartsAProcess() {
        CancellationTokenImpl token = new CancellationTokenImpl();
        token.cancel();
        ShellExecutor shell = new ShellExecutor("shell", ENV);
        assertThrows(TaskCancelledException.class, () -> shell.run(
                new ExecutionRequest("task-3", "shell", new PolyglotBlock("shell", "echo hi"), List.of()), token));
    }

    @Test
    void trailingNewlinesOnlyAreTrimmed() {
        assertEquals("  a\n b", ShellExecutor.trimTrailingNewlines("  a\n b\r\n\n"));
    }
}
