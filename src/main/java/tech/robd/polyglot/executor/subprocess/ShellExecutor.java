/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/subprocess/ShellExecutor.java
 description: Runs shell blocks with sh -c; bound variables arrive as environment variables, the result is
              a ShellResult struct.
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

import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.executor.LanguageExecutor;
import tech.robd.polyglot.executor.SourceText;
import tech.robd.polyglot.marshal.BoundaryPath;
import tech.robd.polyglot.marshal.JsonWire;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.Values;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shell back end.
 *
 * <p>Each bound variable becomes an environment variable of the same name: strings as-is,
 * {@code null} as the empty string, anything else as JSON. The block's value is a
 * {@code ShellResult} struct with {@code exitCode}, {@code stdout} and {@code stderr}, output
 * stripped of trailing newlines. By default a non-zero exit fails the block with the exit code
 * and stderr attached; {@link #ShellExecutor(String, ExecutorEnvironment, String, boolean)}
 * can turn that off so callers inspect {@code exitCode} themselves.</p>
 *
 * <p>Bound variables are layered over the inherited environment, so a name that steers the
 * shell or the dynamic loader ({@code PATH}, {@code HOME}, {@code IFS}, {@code LD_*} and the
 * rest of {@link #RESERVED_NAMES}) is refused with a {@link ValidationException} before any
 * process starts.</p>
 */
public final class ShellExecutor implements LanguageExecutor {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(ShellExecutor.class);
    // [/🧩 Section: diagnostics]

    public static final String RESULT_STRUCT = "ShellResult";

    public static final Set<String> RESERVED_NAMES = Set.of(
            "PATH", "HOME", "IFS", "SHELL", "USER", "PWD", "ENV", "BASH_ENV", "CDPATH", "PS4");

    private final String languageTag;
    private final ExecutorEnvironment env;
    private final String shell;
    private final boolean failOnNonZeroExit;
    private final ProcessRunner runner;

    public ShellExecutor(String languageTag, ExecutorEnvironment env) {
        this(languageTag, env, "sh", true);
    }

    public ShellExecutor(String languageTag, ExecutorEnvironment env, String shell, boolean failOnNonZeroExit) {
        if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
        if (env == null) throw new IllegalArgumentException("env cannot be null");
        if (shell == null || shell.isBlank()) throw new IllegalArgumentException("shell cannot be blank");
        this.languageTag = languageTag;
        this.env = env;
        this.shell = shell;
        this.failOnNonZeroExit = failOnNonZeroExit;
        this.runner = new ProcessRunner(languageTag, env.limits().maxCapturedOutputBytes());
    }

    @Override
    public String languageTag() {
        return languageTag;
    }

    @Override
    public boolean supportsInterrupt() {
        return true;
    }

    // 🧩 Section: run
    @Override
    public Value run(ExecutionRequest request, CancellationToken token) throws Exception {
        Map<String, String> vars = environmentFor(request);
        String script = SourceText.dedent(request.source());

        ProcessRunner.Outcome outcome = runner.run(List.of(shell, "-c", script), vars, null, null, token);
        String stdout = trimTrailingNewlines(outcome.stdout());
        String stderr = trimTrailingNewlines(outcome.stderr());

        // 🧩 Point: run/exit-status
        if (outcome.exitCode() != 0) {
            DIAG.debug("{} [{}] exit={} stderr={}", request.taskId(), languageTag, outcome.exitCode(), stderr);
            if (failOnNonZeroExit) {
                String detail = stderr.isEmpty() ? "" : ": " + lastLine(stderr);
                throw new ForeignRuntimeException(languageTag, null,
                        "command exited with code " + outcome.exitCode() + detail,
                        List.of(), outcome.exitCode(), stderr, null);
            }
        }

        Value.Str out = Values.of(stdout);
        Value.Str err = Values.of(stderr);
        env.validator().validateReturnValue(out, languageTag);
        env.validator().validateReturnValue(err, languageTag);

        Map<String, Value> fields = new LinkedHashMap<>();
        fields.put("exitCode", Values.of((long) outcome.exitCode()));
        fields.put("stdout", out);
        fields.put("stderr", err);
        return new Value.Struct(RESULT_STRUCT, fields);
    }
    // [/🧩 Section: run]

    // 🧩 Section: helpers
    private Map<String, String> environmentFor(ExecutionRequest request) throws Exception {
        Map<String, String> vars = new LinkedHashMap<>();
        List<String> names = request.block().boundVariableNames();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (RESERVED_NAMES.contains(name) || name.startsWith("LD_") || name.startsWith("DYLD_")) {
                throw new ValidationException(languageTag, BoundaryPath.argument(i).toString(),
                        "bound variable '" + name + "' would override a reserved environment variable");
            }
            Object repr = env.marshaller().toForeign(request.arguments().get(i), languageTag, BoundaryPath.argument(i));
            String text;
            if (repr == null) text = "";
            else if (repr instanceof String s) text = s;
            else text = JsonWire.encode(repr);
            vars.put(name, text);
        }
        return vars;
    }

    static String trimTrailingNewlines(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) end--;
        return s.substring(0, end);
    }

    private static String lastLine(String text) {
        int nl = text.lastIndexOf('\n');
        return nl < 0 ? text : text.substring(nl + 1);
    }
    // [/🧩 Section: helpers]
}
