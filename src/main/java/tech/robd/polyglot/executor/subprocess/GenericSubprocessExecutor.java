/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/subprocess/GenericSubprocessExecutor.java
 description: Runs a block through any command-line toolchain described by a command template; arguments
              as JSON on stdin and in NAAB_ARGS, result parsed from stdout.
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
import tech.robd.polyglot.executor.ConcurrencyPolicy;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.executor.ExecutorFactory;
import tech.robd.polyglot.executor.LanguageExecutor;
import tech.robd.polyglot.executor.SourceText;
import tech.robd.polyglot.marshal.BoundaryPath;
import tech.robd.polyglot.marshal.JsonWire;
import tech.robd.polyglot.value.Value;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Subprocess back end driven by a command template such as {@code "node {}"} or
 * {@code "ruby -e {}"}.
 *
 * <p>With a file extension the source is written to a temporary file and {@code {}} is
 * replaced by its path; the file is deleted afterwards whatever happens. Without one,
 * {@code {}} is replaced by the source text itself. A template without {@code {}} gets the
 * target appended as the last argument.</p>
 *
 * <p>Bound variables are sent as one JSON object, on stdin and in the {@value #ARGS_ENV}
 * environment variable (skipped when too large for an environment entry). A non-zero exit
 * is parsed by {@link ForeignErrorParser}; otherwise stdout goes through
 * {@link OutputParser}, then the marshaller and the return-value check.</p>
 *
 * <p>Subclasses adapt a specific language by overriding {@link #prepareSource}.</p>
 */
public class GenericSubprocessExecutor implements LanguageExecutor {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(GenericSubprocessExecutor.class);
    // [/🧩 Section: diagnostics]

    public static final String ARGS_ENV = "NAAB_ARGS";
    public static final String PLACEHOLDER = "{}";

    /**
     * Linux refuses single environment strings over 128 KiB; stay well below.
     */
    static final int MAX_ENV_ARGS_CHARS = 64 * 1024;

    private final String languageTag;
    private final ExecutorEnvironment env;
    private final List<String> template;
    private final @Nullable String fileExtension;
    private final ProcessRunner runner;

    public GenericSubprocessExecutor(String languageTag, ExecutorEnvironment env,
                                     String commandTemplate, @Nullable String fileExtension) {
        if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
        if (env == null) throw new IllegalArgumentException("env cannot be null");
        if (commandTemplate == null || commandTemplate.isBlank()) {
            throw new IllegalArgumentException("commandTemplate cannot be blank");
        }
        this.languageTag = languageTag;
        this.env = env;
        this.template = List.of(commandTemplate.trim().split("\\s+"));
        this.fileExtension = fileExtension == null || fileExtension.isBlank() ? null
                : fileExtension.startsWith(".") ? fileExtension : "." + fileExtension;
        this.runner = new ProcessRunner(languageTag, env.limits().maxCapturedOutputBytes());
    }

    /**
     * Factory for registration, e.g. {@code register("ruby", factory("ruby {}", ".rb"), parallel())}.
     */
    public static ExecutorFactory factory(String commandTemplate, @Nullable String fileExtension) {
        return (tag, env) -> new GenericSubprocessExecutor(tag, env, commandTemplate, fileExtension);
    }

    /**
     * Subprocess toolchains are separate processes, so they run fully in parallel.
     */
    public static ConcurrencyPolicy defaultPolicy() {
        return ConcurrencyPolicy.parallel();
    }

    @Override
    public String languageTag() {
        return languageTag;
    }

    @Override
    public boolean supportsInterrupt() {
        return true;
    }

    protected ExecutorEnvironment environment() {
        return env;
    }

    // 🧩 Section: run
    @Override
    public Value run(ExecutionRequest request, CancellationToken token) throws Exception {
        Map<String, @Nullable Object> bindings = env.marshaller().bindingsToForeign(
                request.block().boundVariableNames(), request.arguments(), languageTag);
        String argsJson = JsonWire.encode(bindings);
        String source = prepareSource(request);

        Path file = null;
        try {
            String target = source;
            if (fileExtension != null) {
                file = Files.createTempFile("naab-" + request.taskId() + "-", fileExtension);
                Files.writeString(file, source, StandardCharsets.UTF_8);
                target = file.toString();
            }

            Map<String, String> vars = argsJson.length() <= MAX_ENV_ARGS_CHARS
                    ? Map.of(ARGS_ENV, argsJson)
                    : Map.of();
            if (vars.isEmpty()) {
                DIAG.debug("{} [{}] arguments too large for {}, stdin only", request.taskId(), languageTag, ARGS_ENV);
            }

            ProcessRunner.Outcome outcome = runner.run(command(target), vars, argsJson, null, token);

            // 🧩 Point: run/failure
            if (!outcome.succeeded()) {
                throw ForeignErrorParser.parse(languageTag, outcome.exitCode(), outcome.stdout(), outcome.stderr());
            }

            // 🧩 Point: run/result
            OutputParser.Parsed parsed = OutputParser.parse(outcome.stdout());
            if (!parsed.logOutput().isBlank()) {
                DIAG.debug("{} [{}] output: {}", request.taskId(), languageTag, parsed.logOutput());
            }
            Value result = env.marshaller().fromForeign(parsed.value(), languageTag, BoundaryPath.returnValue());
            env.validator().validateReturnValue(result, languageTag);
            return result;
        } finally {
            if (file != null) deleteTempFile(file);
        }
    }
    // [/🧩 Section: run]

    // 🧩 Section: extension-points

    /**
     * Source text as handed to the toolchain. Default: the block with common indentation removed.
     */
    protected String prepareSource(ExecutionRequest request) {
        return SourceText.dedent(request.source());
    }

    /**
     * @param target temp file path, or the source itself when no extension is configured
     */
    protected List<String> command(String target) {
        List<String> argv = new ArrayList<>(template.size() + 1);
        boolean substituted = false;
        for (String part : template) {
            if (part.contains(PLACEHOLDER)) {
                argv.add(part.replace(PLACEHOLDER, target));
                substituted = true;
            } else {
                argv.add(part);
            }
        }
        if (!substituted) argv.add(target);
        return argv;
    }
    // [/🧩 Section: extension-points]

    private void deleteTempFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            DIAG.warn("[{}] could not delete temp source {}: {}", languageTag, file, e.toString());
        }
    }
}
