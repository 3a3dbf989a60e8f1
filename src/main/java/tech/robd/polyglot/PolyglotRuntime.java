/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/PolyglotRuntime.java
 description: Entry point: builds the registry, callbacks and scheduler, and exposes spawn/force/executeParallel.
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


package tech.robd.polyglot;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.callback.CallbackRegistry;
import tech.robd.polyglot.callback.CallbackSignature;
import tech.robd.polyglot.callback.CallbackValidator;
import tech.robd.polyglot.callback.HostFunction;
import tech.robd.polyglot.callback.Trampoline;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.executor.ConcurrencyPolicy;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.executor.ExecutorFactory;
import tech.robd.polyglot.executor.ExecutorRegistry;
import tech.robd.polyglot.executor.embedded.GraalPolyglotExecutor;
import tech.robd.polyglot.executor.subprocess.GenericSubprocessExecutor;
import tech.robd.polyglot.executor.subprocess.PythonSubprocessExecutor;
import tech.robd.polyglot.executor.subprocess.ShellExecutor;
import tech.robd.polyglot.marshal.ValueMarshaller;
import tech.robd.polyglot.schedule.BlockCall;
import tech.robd.polyglot.schedule.BlockFuture;
import tech.robd.polyglot.schedule.ExecutionScheduler;
import tech.robd.polyglot.schedule.SchedulerStats;
import tech.robd.polyglot.validate.FfiValidator;
import tech.robd.polyglot.value.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One polyglot execution runtime.
 *
 * <p>Provides:
 * <ul>
 *   <li>{@link #spawn} to start a block and get a {@link BlockFuture} right away.</li>
 *   <li>{@link #force} to wait for a result; a second force returns the same outcome.</li>
 *   <li>{@link #executeParallel} for a batch that runs concurrently and returns in order.</li>
 *   <li>{@link #close()} to cancel what is still running and release executors.</li>
 * </ul>
 *
 * <p>Build with {@link #builder()}; {@link #standard()} registers shell, Python and
 * JavaScript. After {@link Builder#build()} the set of languages is fixed.</p>
 */
public final class PolyglotRuntime implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(PolyglotRuntime.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final ValidationLimits limits;
    private final ExecutorRegistry registry;
    private final ExecutionScheduler scheduler;
    // [/🧩 Section: state]

    private PolyglotRuntime(ValidationLimits limits, ExecutorRegistry registry, ExecutionScheduler scheduler) {
        this.limits = limits;
        this.registry = registry;
        this.scheduler = scheduler;
    }

    // 🧩 Section: factories
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runtime with the default executors and limits from {@link ValidationLimits#load()}.
     */
    public static PolyglotRuntime standard() {
        return builder().withDefaultExecutors().build();
    }
    // [/🧩 Section: factories]

    // 🧩 Section: execution

    /**
     * @see ExecutionScheduler#spawn(PolyglotBlock, List)
     */
    public BlockFuture spawn(PolyglotBlock block, List<? extends Value> arguments) {
        return scheduler.spawn(block, arguments);
    }

    public BlockFuture spawn(PolyglotBlock block, Value... arguments) {
        return scheduler.spawn(block, arguments);
    }

    public Value force(BlockFuture future) {
        return scheduler.force(future);
    }

    /**
     * Force a deferred value; other values come back unchanged.
     */
    public Value force(Value value) {
        return scheduler.force(value);
    }

    /**
     * Spawn and wait.
     */
    public Value execute(PolyglotBlock block, Value... arguments) {
        return scheduler.spawn(block, arguments).force();
    }

    public List<BlockFuture> spawnAll(List<BlockCall> calls) {
        return scheduler.spawnAll(calls);
    }

    public List<Value> executeParallel(List<BlockCall> calls) {
        return scheduler.executeParallel(calls);
    }
    // [/🧩 Section: execution]

    // 🧩 Section: accessors
    public ExecutorRegistry registry() {
        return registry;
    }

    public ValidationLimits limits() {
        return limits;
    }

    public CallbackRegistry callbacks() {
        return registry.environment().callbacks();
    }

    public SchedulerStats stats() {
        return scheduler.stats();
    }
    // [/🧩 Section: accessors]

    /**
     * Cancel pending blocks, stop the workers, then close the executors.
     */
    @Override
    public void close() {
        scheduler.close();
        registry.close();
        DIAG.debug("runtime closed");
    }

    // 🧩 Section: builder

    /**
     * Collects limits, executors and host callbacks. Not thread-safe.
     */
    public static final class Builder {

        private record Registration(String tag, ExecutorFactory factory, ConcurrencyPolicy policy) {
        }

        private record Alias(String alias, String tag) {
        }

        private record Callback(CallbackSignature signature, @Nullable HostFunction function) {
        }

        private @Nullable ValidationLimits limits;
        private final List<Registration> registrations = new ArrayList<>();
        private final List<Alias> aliases = new ArrayList<>();
        private final List<Callback> callbacks = new ArrayList<>();

        private Builder() {
        }

        public Builder limits(ValidationLimits limits) {
            if (limits == null) throw new IllegalArgumentException("limits cannot be null");
            this.limits = limits;
            return this;
        }

        public Builder register(String languageTag, ExecutorFactory factory, ConcurrencyPolicy policy) {
            if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
            if (factory == null) throw new IllegalArgumentException("factory cannot be null");
            if (policy == null) throw new IllegalArgumentException("policy cannot be null");
            registrations.add(new Registration(languageTag, factory, policy));
            return this;
        }

        public Builder alias(String alias, String languageTag) {
            if (alias == null) throw new IllegalArgumentException("alias cannot be null");
            if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
            aliases.add(new Alias(alias, languageTag));
            return this;
        }

        /**
         * Register a command-line toolchain, e.g. {@code command("ruby", "ruby {}", ".rb")}.
         * Pass a {@code null} extension to substitute the source text itself.
         */
        public Builder command(String languageTag, String commandTemplate, @Nullable String fileExtension) {
            return register(languageTag, GenericSubprocessExecutor.factory(commandTemplate, fileExtension),
                    GenericSubprocessExecutor.defaultPolicy());
        }

        /**
         * Make a host function callable from foreign blocks under {@code signature.name()}.
         */
        public Builder hostFunction(CallbackSignature signature, @Nullable HostFunction function) {
            if (signature == null) throw new IllegalArgumentException("signature cannot be null");
            callbacks.add(new Callback(signature, function));
            return this;
        }

        /**
         * {@code shell} ({@code sh}, {@code bash}) and {@code python} ({@code py},
         * {@code python3}) as parallel subprocess executors; {@code javascript} ({@code js})
         * on the embedded engine, serialised.
         */
        public Builder withDefaultExecutors() {
            register("shell", ShellExecutor::new, ConcurrencyPolicy.parallel());
            alias("sh", "shell");
            alias("bash", "shell");
            register("python", PythonSubprocessExecutor.factory(), ConcurrencyPolicy.parallel());
            alias("py", "python");
            alias("python3", "python");
            register("javascript", GraalPolyglotExecutor.javascript(), ConcurrencyPolicy.serialized());
            alias("js", "javascript");
            return this;
        }

        public PolyglotRuntime build() {
            ValidationLimits l = limits != null ? limits : ValidationLimits.load();
            ValueMarshaller marshaller = new ValueMarshaller(l);
            FfiValidator validator = new FfiValidator(l);

            CallbackValidator wrapper = new CallbackValidator(marshaller, validator);
            List<Trampoline> trampolines = new ArrayList<>(callbacks.size());
            for (Callback c : callbacks) trampolines.add(wrapper.wrap(c.function(), c.signature()));

            ExecutorEnvironment env = new ExecutorEnvironment(l, marshaller, validator, CallbackRegistry.of(trampolines));
            ExecutorRegistry registry = new ExecutorRegistry(env);
            for (Registration r : registrations) registry.register(r.tag(), r.factory(), r.policy());
            for (Alias a : aliases) registry.alias(a.alias(), a.tag());
            registry.freeze();

            DIAG.info("runtime built: languages={} callbacks={}", registry.supportedLanguages(), trampolines.size());
            return new PolyglotRuntime(l, registry, new ExecutionScheduler(registry, validator, l));
        }
    }
    // [/🧩 Section: builder]
}
