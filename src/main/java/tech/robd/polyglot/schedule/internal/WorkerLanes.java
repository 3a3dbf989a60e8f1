/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/internal/WorkerLanes.java
 description: Worker pools for block execution: one shared cached pool for parallel languages
              and one bounded pool per serialised language tag.
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

import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.executor.ConcurrencyPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lanes a task can be dispatched to.
 *
 * <ul>
 *   <li>{@link ConcurrencyPolicy#parallel()} tags share one cached pool: every task gets a
 *       worker right away.</li>
 *   <li>Bounded tags get their own fixed pool of {@code maxActive} workers; extra tasks
 *       queue there without holding up other languages.</li>
 * </ul>
 * Workers are daemon threads, so a detached worker stuck in foreign code does not keep the
 * JVM alive.
 */
public final class WorkerLanes implements AutoCloseable {

    private static final Diagnostics DIAG = Diagnostics.of(WorkerLanes.class);

    private final String name;
    private final ExecutorService shared;
    private final ConcurrentMap<String, ExecutorService> bounded = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public WorkerLanes(String name) {
        if (name == null) throw new IllegalArgumentException("name cannot be null");
        this.name = name;
        this.shared = Executors.newCachedThreadPool(daemonThreads(name + "-worker"));
    }

    // 🧩 Section: dispatch

    /**
     * @return the executor service that runs tasks for {@code languageTag}
     */
    public ExecutorService laneFor(String languageTag, ConcurrencyPolicy policy) {
        if (!policy.isBounded()) return shared;
        return bounded.computeIfAbsent(languageTag, tag -> {
            DIAG.debug("lanes[{}] creating lane {} maxActive={}", name, tag, policy.maxActive());
            return Executors.newFixedThreadPool(policy.maxActive(), daemonThreads(name + "-" + tag));
        });
    }

    public boolean isClosed() {
        return closed;
    }
    // [/🧩 Section: dispatch]

    // 🧩 Section: lifecycle

    /**
     * Stop accepting work, wait up to 5 seconds per lane for running tasks, then interrupt
     * whatever is left.
     */
    @Override
    public void close() {
        closed = true;
        List<ExecutorService> all = new ArrayList<>(bounded.values());
        all.add(shared);
        for (ExecutorService es : all) es.shutdown();
        for (ExecutorService es : all) {
            try {
                if (!es.awaitTermination(5, TimeUnit.SECONDS)) {
                    DIAG.warn("lanes[{}] workers still busy after 5s, interrupting", name);
                    es.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                es.shutdownNow();
            }
        }
    }
    // [/🧩 Section: lifecycle]

    /**
     * Named daemon thread factory: {@code prefix-1}, {@code prefix-2}, ...
     */
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public String toString() {
        return "WorkerLanes(" + name + ", bounded=" + bounded.keySet() + ")";
    }
}
