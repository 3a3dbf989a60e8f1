/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/ExecutorRegistry.java
 description: Case-insensitive table of language executors: registration, aliases, freeze and lazy creation.
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

package tech.robd.polyglot.executor;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.ResourceException;
import tech.robd.polyglot.error.UnknownLanguageException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps language tags to executors.
 *
 * <p>Two phases. While open, {@link #register} and {@link #alias} fill the table under the
 * instance lock. {@link #freeze()} publishes an immutable copy; from then on lookups read the
 * frozen maps without locking and further registration is refused.</p>
 *
 * <p>Executors are created on first {@link #resolve(String)}, one instance per canonical
 * tag. A factory that throws leaves nothing cached, so a later task can try again.</p>
 */
public final class ExecutorRegistry implements AutoCloseable {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ExecutorRegistry.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final ExecutorEnvironment environment;

    private final Map<String, ExecutorDescriptor> building = new HashMap<>();
    private final Map<String, String> buildingAliases = new HashMap<>();

    private volatile @Nullable Map<String, ExecutorDescriptor> descriptors;
    private volatile @Nullable Map<String, String> aliases;

    private final ConcurrentMap<String, LanguageExecutor> instances = new ConcurrentHashMap<>();
    // [/🧩 Section: state]

    public ExecutorRegistry(ExecutorEnvironment environment) {
        if (environment == null) throw new IllegalArgumentException("environment cannot be null");
        this.environment = environment;
    }

    public ExecutorEnvironment environment() {
        return environment;
    }

    // 🧩 Section: registration

    /**
     * Register or replace the executor for {@code languageTag}.
     *
     * @throws IllegalStateException after {@link #freeze()}
     */
    public synchronized ExecutorRegistry register(String languageTag, ExecutorFactory factory, ConcurrencyPolicy policy) {
        requireOpen();
        String tag = canonical(languageTag);
        ExecutorDescriptor previous = building.put(tag, new ExecutorDescriptor(tag, factory, policy));
        if (previous != null) {
            DIAG.warn("executor for '{}' re-registered; previous registration replaced", tag);
        }
        // a real registration wins over an alias of the same name
        buildingAliases.remove(tag);
        DIAG.debug("registered '{}' policy={}", tag, policy);
        return this;
    }

    public ExecutorRegistry registerExecutor(String languageTag, ExecutorFactory factory, ConcurrencyPolicy policy) {
        return register(languageTag, factory, policy);
    }

    /**
     * Make {@code alias} resolve to {@code languageTag}. The target may be registered later,
     * as long as it exists by {@link #freeze()}.
     */
    public synchronized ExecutorRegistry alias(String alias, String languageTag) {
        requireOpen();
        String a = canonical(alias);
        String target = canonical(languageTag);
        if (a.equals(target)) throw new IllegalArgumentException("alias '" + a + "' points at itself");
        buildingAliases.put(a, target);
        return this;
    }

    /**
     * End registration. Idempotent.
     *
     * @throws IllegalStateException if an alias targets an unregistered tag
     */
    public synchronized void freeze() {
        if (descriptors != null) return;
        for (Map.Entry<String, String> e : buildingAliases.entrySet()) {
            if (!building.containsKey(e.getValue())) {
                throw new IllegalStateException("alias '" + e.getKey() + "' targets unregistered language '"
                        + e.getValue() + "'");
            }
        }
        aliases = Map.copyOf(buildingAliases);
        descriptors = Map.copyOf(building);
        DIAG.info("registry frozen: {}", supportedLanguages());
    }

    public boolean isFrozen() {
        return descriptors != null;
    }

    private void requireOpen() {
        if (descriptors != null) throw new IllegalStateException("registry is frozen; register executors before build()");
    }
    // [/🧩 Section: registration]

    // 🧩 Section: lookup

    /**
     * @throws UnknownLanguageException if neither a tag nor an alias matches
     * @throws IllegalStateException    before {@link #freeze()}
     */
    public ExecutorDescriptor descriptor(String languageTag) {
        Map<String, ExecutorDescriptor> table = frozen();
        String tag = canonicalOrAlias(languageTag);
        ExecutorDescriptor d = table.get(tag);
        if (d == null) throw new UnknownLanguageException(languageTag, supportedLanguages());
        return d;
    }

    /**
     * Executor for {@code languageTag}, created on first use.
     *
     * @throws UnknownLanguageException if the tag is not registered
     * @throws ResourceException        if the factory fails
     */
    public LanguageExecutor resolve(String languageTag) {
        ExecutorDescriptor d = descriptor(languageTag);
        LanguageExecutor existing = instances.get(d.languageTag());
        if (existing != null) return existing;
        try {
            return instances.computeIfAbsent(d.languageTag(), tag -> create(d));
        } catch (FactoryFailure f) {
            throw new ResourceException(d.languageTag(), "cannot start executor for '" + d.languageTag() + "': "
                    + f.getCause().getMessage(), f.getCause());
        }
    }

    public boolean isSupported(@Nullable String languageTag) {
        if (languageTag == null || languageTag.isBlank()) return false;
        Map<String, ExecutorDescriptor> table = descriptors;
        if (table == null) {
            synchronized (this) {
                String tag = canonical(languageTag);
                return building.containsKey(buildingAliases.getOrDefault(tag, tag));
            }
        }
        return table.containsKey(canonicalOrAlias(languageTag));
    }

    /**
     * @return canonical tags and aliases, sorted
     */
    public List<String> supportedLanguages() {
        TreeSet<String> all = new TreeSet<>();
        Map<String, ExecutorDescriptor> table = descriptors;
        Map<String, String> al = aliases;
        if (table != null && al != null) {
            all.addAll(table.keySet());
            all.addAll(al.keySet());
        } else {
            synchronized (this) {
                all.addAll(building.keySet());
                all.addAll(buildingAliases.keySet());
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(all));
    }

    /**
     * @return {@code true} once an executor instance exists for the tag
     */
    public boolean isStarted(String languageTag) {
        return instances.containsKey(canonicalOrAlias(languageTag));
    }

    private Map<String, ExecutorDescriptor> frozen() {
        Map<String, ExecutorDescriptor> table = descriptors;
        if (table == null) throw new IllegalStateException("registry is not frozen yet");
        return table;
    }

    private String canonicalOrAlias(String languageTag) {
        String tag = canonical(languageTag);
        Map<String, String> al = aliases;
        return al == null ? tag : al.getOrDefault(tag, tag);
    }

    private static String canonical(String languageTag) {
        if (languageTag == null || languageTag.isBlank()) {
            throw new IllegalArgumentException("languageTag cannot be null or blank");
        }
        return languageTag.trim().toLowerCase(Locale.ROOT);
    }
    // [/🧩 Section: lookup]

    // 🧩 Section: creation
    private LanguageExecutor create(ExecutorDescriptor d) {
        DIAG.debug("starting executor '{}'", d.languageTag());
        try {
            LanguageExecutor executor = d.factory().create(d.languageTag(), environment);
            if (executor == null) {
                throw new FactoryFailure(new IllegalStateException("factory returned null"));
            }
            DIAG.info("executor '{}' started ({})", d.languageTag(), executor.getClass().getSimpleName());
            return executor;
        } catch (FactoryFailure f) {
            throw f;
        } catch (Exception e) {
            DIAG.warn("executor '{}' failed to start: {}", d.languageTag(), e.toString());
            throw new FactoryFailure(e);
        }
    }

    /**
     * Carries a checked factory failure out of {@code computeIfAbsent}.
     */
    private static final class FactoryFailure extends RuntimeException {
        FactoryFailure(Exception cause) {
            super(cause);
        }
    }
    // [/🧩 Section: creation]

    // 🧩 Section: lifecycle

    /**
     * Close every started executor. Failures are logged and do not stop the others.
     */
    @Override
    public void close() {
        for (Map.Entry<String, LanguageExecutor> e : instances.entrySet()) {
            try {
                e.getValue().close();
            } catch (Exception ex) {
                DIAG.warn("executor '{}' failed to close: {}", e.getKey(), ex.toString());
            }
        }
        instances.clear();
    }
    // [/🧩 Section: lifecycle]
}
