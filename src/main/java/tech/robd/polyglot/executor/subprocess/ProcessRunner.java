/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/subprocess/ProcessRunner.java
 description: Starts a foreign process, feeds stdin, captures capped stdout/stderr and kills the
              process tree when the task is cancelled.
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

package tech.robd.polyglot.executor.subprocess;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.ResourceException;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.schedule.internal.WorkerLanes;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one command to completion.
 *
 * <p>stdout and stderr are drained on pump threads while the caller waits, so a chatty
 * process cannot block on a full pipe. Each stream is capped at
 * {@code maxCapturedBytes}; going over the cap kills the process and fails the block, the
 * same way an oversized return value would.</p>
 *
 * <p>The cancel hook destroys the process and its descendants, which also unblocks the
 * waiting worker.</p>
 */
public final class ProcessRunner {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ProcessRunner.class);
    // [/🧩 Section: diagnostics]

    private static final ExecutorService PUMPS = Executors.newCachedThreadPool(WorkerLanes.daemonThreads("polyglot-pipe"));

    /**
     * How long to keep draining after exit, for output held open by a background grandchild.
     */
    private static final long DRAIN_GRACE_MILLIS = 2_000;

    /**
     * Exit status and captured output, decoded as UTF-8.
     */
    public record Outcome(int exitCode, String stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    private final String languageTag;
    private final long maxCapturedBytes;

    public ProcessRunner(String languageTag, long maxCapturedBytes) {
        if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
        if (maxCapturedBytes <= 0) throw new IllegalArgumentException("maxCapturedBytes must be positive");
        this.languageTag = languageTag;
        this.maxCapturedBytes = maxCapturedBytes;
    }

    // 🧩 Section: run

    /**
     * @param command     argv, first element is the program
     * @param environment added to (and overriding) the inherited environment
     * @param stdin       written then closed; {@code null} closes stdin immediately
     * @param workDir     working directory, or {@code null} to inherit
     * @throws ResourceException      if the program cannot be started
     * @throws TaskCancelledException if the token fires or the caller is interrupted
     * @throws ValidationException    if captured output exceeds the cap
     */
    public Outcome run(List<String> command,
                       Map<String, String> environment,
                       @Nullable String stdin,
                       @Nullable Path workDir,
                       CancellationToken token) {
        if (command == null || command.isEmpty()) throw new IllegalArgumentException("command cannot be empty");
        if (environment == null) throw new IllegalArgumentException("environment cannot be null");
        if (token == null) throw new IllegalArgumentException("token cannot be null");

        if (token.isCancelled()) {
            throw new TaskCancelledException(languageTag, "cancelled before " + command.get(0) + " started");
        }

        ProcessBuilder builder = new ProcessBuilder(List.copyOf(command));
        builder.environment().putAll(environment);
        builder.redirectErrorStream(false);
        if (workDir != null) builder.directory(workDir.toFile());

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ResourceException(languageTag, "cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }
        DIAG.debug("[{}] started pid={} {}", languageTag, process.pid(), command.get(0));

        AtomicBoolean overflow = new AtomicBoolean(false);
        Pump out = new Pump(process.getInputStream(), process, overflow);
        Pump err = new Pump(process.getErrorStream(), process, overflow);
        Future<?> outF = PUMPS.submit(out);
        Future<?> errF = PUMPS.submit(err);

        // 🧩 Point: run/cancel-hook
        try (AutoCloseable reg = token.onCancel(() -> destroyTree(process))) {
            writeStdin(process, stdin);

            int exit;
            try {
                exit = process.waitFor();
            } catch (InterruptedException ie) {
                destroyTree(process);
                Thread.currentThread().interrupt();
                throw new TaskCancelledException(languageTag, "interrupted while waiting for " + command.get(0), ie);
            }
            drain(outF, process);
            drain(errF, process);

            if (token.isCancelled()) {
                throw new TaskCancelledException(languageTag, command.get(0) + " killed: block cancelled");
            }
            if (overflow.get()) {
                throw new ValidationException(languageTag, "return",
                        "captured output too large: > " + maxCapturedBytes + " bytes");
            }
            DIAG.debug("[{}] pid={} exit={}", languageTag, process.pid(), exit);
            return new Outcome(exit, out.text(), err.text());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // registration close; never thrown by the built-in tokens
            throw new ResourceException(languageTag, "process bookkeeping failed: " + e.getMessage(), e);
        } finally {
            if (process.isAlive()) destroyTree(process);
        }
    }
    // [/🧩 Section: run]

    // 🧩 Section: helpers
    private void writeStdin(Process process, @Nullable String stdin) {
        try (OutputStream os = process.getOutputStream()) {
            if (stdin != null && !stdin.isEmpty()) {
                os.write(stdin.getBytes(StandardCharsets.UTF_8));
                os.flush();
            }
        } catch (IOException e) {
            // the program may exit without reading its input
            DIAG.debug("[{}] stdin not fully written: {}", languageTag, e.toString());
        }
    }

    private void drain(Future<?> pump, Process process) {
        try {
            pump.get(DRAIN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            DIAG.warn("[{}] pid={} output still open {} ms after exit; keeping partial output",
                    languageTag, process.pid(), DRAIN_GRACE_MILLIS);
            pump.cancel(true);
        } catch (ExecutionException e) {
            DIAG.warn("[{}] pid={} output pump failed: {}", languageTag, process.pid(), e.getCause().toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException(languageTag, "interrupted while reading process output", e);
        }
    }

    static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Copies one stream into memory until EOF or the cap.
     */
    private final class Pump implements Runnable {
        private final InputStream in;
        private final Process process;
        private final AtomicBoolean overflow;
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();

        Pump(InputStream in, Process process, AtomicBoolean overflow) {
            this.in = in;
            this.process = process;
            this.overflow = overflow;
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream is = in) {
                int n;
                while ((n = is.read(chunk)) != -1) {
                    synchronized (buf) {
                        if (buf.size() + (long) n > maxCapturedBytes) {
                            overflow.set(true);
                            DIAG.warn("[{}] pid={} output over {} bytes, killing", languageTag, process.pid(), maxCapturedBytes);
                            destroyTree(process);
                            return;
                        }
                        buf.write(chunk, 0, n);
                    }
                }
            } catch (IOException e) {
                // stream closed under us by destroy
                DIAG.debug("[{}] pump stopped: {}", languageTag, e.toString());
            }
        }

        String text() {
            synchronized (buf) {
                return buf.toString(StandardCharsets.UTF_8);
            }
        }
    }
    // [/🧩 Section: helpers]
}
