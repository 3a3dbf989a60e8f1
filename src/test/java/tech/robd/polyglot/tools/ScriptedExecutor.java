/*
 [File Info]
 path: src/test/java/tech/robd/polyglot/tools/ScriptedExecutor.java
 description: Test LanguageExecutor driven by a lambda; counts invocations and observed concurrency.
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
package tech.robd.polyglot.tools;

import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorFactory;
import tech.robd.polyglot.executor.LanguageExecutor;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.Values;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for a foreign runtime. The instrumented counters let tests prove that
 * validation happened before any "foreign" invocation and that a block ran exactly once.
 */
public final class ScriptedExecutor implements LanguageExecutor {

    @FunctionalInterface
    public interface Script {
        Value run(ExecutionRequest request, CancellationToken token) throws Exception;
    }

    private final String languageTag;
    private final Script script;
    private final boolean interruptible;

    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public ScriptedExecutor(String languageTag, boolean interruptible, Script script) {
        this.languageTag = languageTag;
        this.interruptible = interruptible;
        this.script = script;
    }

    public static ScriptedExecutor of(String languageTag, Script script) {
        return new ScriptedExecutor(languageTag, true, script);
    }

    /**
     * Returns the first argument after sleeping {@code millis}.
     */
    public static ScriptedExecutor sleeping(String languageTag, long millis) {
        return of(languageTag, (req, token) -> {
            Thread.sleep(millis);
            return req.arguments().isEmpty() ? Values.nil() : req.arguments().get(0);
        });
    }

    /**
     * Factory handing out this very instance, so the test keeps access to the counters.
     */
    public ExecutorFactory factory() {
        return (tag, env) -> this;
    }

    @Override
    public String languageTag() {
        return languageTag;
    }

    @Override
    public Value run(ExecutionRequest request, CancellationToken token) throws Exception {
        invocations.incrementAndGet();
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
        try {
            return script.run(request, token);
        } finally {
            active.decrementAndGet();
        }
    }

    @Override
    public boolean supportsInterrupt() {
        return interruptible;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public int invocations() {
        return invocations.get();
    }

    public int maxConcurrency() {
        return maxActive.get();
    }

    public boolean isClosed() {
        return closed.get();
    }
}
