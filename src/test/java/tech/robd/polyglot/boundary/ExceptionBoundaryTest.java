/*
 [File Info]
 path: src/test/java/tech/robd/polyglot/boundary/ExceptionBoundaryTest.java
 description: Translation of arbitrary throwables into typed polyglot errors, and unified traces.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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
package tech.robd.polyglot.boundary;

import org.junit.jupiter.api.Test;
import tech.robd.polyglot.error.CompileException;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.error.ResourceException;
import tech.robd.polyglot.error.StackFrame;
import tech.robd.polyglot.error.TaskCancelledException;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class ExceptionBoundaryTest {

    @Test
    void successIsCapturedWithoutError() {
        GuardedResult<String> r = ExceptionBoundary.runGuarded("python", () -> "ok");
        assertTrue(r.success());
        assertEquals("ok", r.value());
        assertNull(r.error());
        assertNull(r.errorType());
    }

    @Test
    void polyglotExceptionsPassThroughUnchanged() {
        CompileException compile = new CompileException("python", "SyntaxError: invalid syntax");
        GuardedResult<Object> r = ExceptionBoundary.runGuarded("python", () -> {
            throw compile;
        });
        assertFalse(r.success());
        assertSame(compile, r.error());
        assertEquals("CompileError", r.errorType());
        assertSame(compile, assertThrows(CompileException.class, r::getOrThrow));
    }

    @Test
    void wrappersAreUnwrappedBeforeTranslation() {
        PolyglotException e = ExceptionBoundary.translate("ruby",
                new CompletionException(new IllegalArgumentException("bad arg")));
        ForeignRuntimeException fre = assertInstanceOf(ForeignRuntimeException.class, e);
        assertEquals("IllegalArgumentException", fre.foreignType());
        assertEquals("[ruby] IllegalArgumentException: bad arg", fre.getMessage());
    }

    @Test
    void interruptionAndCancellationBecomeCancelledErrors() {
        assertInstanceOf(TaskCancelledException.class,
                ExceptionBoundary.translate("js", new InterruptedException()));
        assertInstanceOf(TaskCancelledException.class,
                ExceptionBoundary.translate("js", new CancellationException("stop")));
    }

    @Test
    void interruptedGuardRestoresTheFlag() {
        GuardedResult<Object> r = ExceptionBoundary.runGuarded("js", () -> {
            throw new InterruptedException("wake");
        });
        try {
            assertTrue(Thread.currentThread().isInterrupted());
            assertEquals("CancelledError", r.errorType());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void vmErrorsBecomeResourceErrors() {
        assertInstanceOf(ResourceException.class, ExceptionBoundary.translate("js", new StackOverflowError()));
        assertInstanceOf(ResourceException.class, ExceptionBoundary.translate("js", new OutOfMemoryError("heap")));
    }

    @Test
    void unifiedTracePutsForeignFramesFirstThenBoundaryThenHost() {
        StackFrame inner = new StackFrame("python", "divide", "<block>", 3);
        StackFrame outer = new StackFrame("python", "<module>", "<block>", 5);
        ForeignRuntimeException e = new ForeignRuntimeException("python", "ZeroDivisionError", "division by zero",
                List.of(inner, outer), 1, "", null);
        StackFrame host = StackFrame.host("main", "app.naab", 12);
        e.attachHostContext("task-9", List.of(host));
        e.attachHostContext("task-10", List.of()); // ignored

        List<StackFrame> trace = e.unifiedTrace();
        assertEquals(4, trace.size());
        assertSame(inner, trace.get(0));
        assertSame(outer, trace.get(1));
        assertEquals("<polyglot block task-9>", trace.get(2).function());
        assertSame(host, trace.get(3));
        assertEquals("task-9", e.taskId());

        String text = e.formatUnifiedTrace();
        assertTrue(text.startsWith("RuntimeError: [python] ZeroDivisionError: division by zero"), text);
        assertTrue(text.contains("at divide (python:<block>:3)"), text);

        // the Java trace shows the foreign frames on top
        assertEquals("<python>", e.getStackTrace()[0].getClassName());
        assertEquals("divide", e.getStackTrace()[0].getMethodName());
    }
}
