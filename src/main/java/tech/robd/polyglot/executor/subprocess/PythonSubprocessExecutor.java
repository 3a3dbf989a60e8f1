/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/subprocess/PythonSubprocessExecutor.java
 description: Python back end: a python3 subprocess running a driver that binds variables, returns the last
              expression and reports failures as structured error lines.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
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

import com.fasterxml.jackson.core.JsonProcessingException;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.executor.ExecutorFactory;
import tech.robd.polyglot.executor.SourceText;
import tech.robd.polyglot.marshal.JsonWire;

import java.io.UncheckedIOException;

/**
 * Runs Python blocks in a fresh {@code python3} process each time, so blocks run in true
 * parallel and a hung block can be killed.
 *
 * <p>The block is embedded in a small driver. The driver reads the bound variables from stdin
 * into the block's globals, runs the block, evaluates a trailing expression statement as the
 * result (otherwise the result is {@code None}) and prints it after
 * {@value OutputParser#RETURN_SENTINEL}. Errors are printed after
 * {@value ForeignErrorParser#ERROR_SENTINEL} with the block's frames only, innermost first.</p>
 */
public final class PythonSubprocessExecutor extends GenericSubprocessExecutor {

    public static final String DEFAULT_INTERPRETER = "python3";

    /**
     * Source name the block's frames carry in tracebacks.
     */
    public static final String BLOCK_FILE = "<block>";

    // 🧩 Section: driver
    private static final String DRIVER = String.join("\n",
            "import ast, json, sys, traceback",
            "",
            "def __naab_fail(exc, frames):",
            "    message = exc.msg if isinstance(exc, SyntaxError) and exc.msg else str(exc)",
            "    record = {'type': type(exc).__name__, 'message': message, 'frames': frames}",
            "    sys.stdout.flush()",
            "    sys.stderr.write('" + ForeignErrorParser.ERROR_SENTINEL + "' + json.dumps(record) + '\\n')",
            "    sys.stderr.flush()",
            "    sys.exit(1)",
            "",
            "def __naab_unserializable(obj):",
            "    raise TypeError('result of type ' + type(obj).__name__ + ' cannot cross the language boundary')",
            "",
            "def __naab_main(src):",
            "    raw = sys.stdin.buffer.read().decode('utf-8')",
            "    scope = {'__name__': '__naab_block__'}",
            "    if raw.strip():",
            "        scope.update(json.loads(raw))",
            "    try:",
            "        tree = ast.parse(src, '" + BLOCK_FILE + "', 'exec')",
            "    except SyntaxError as e:",
            "        __naab_fail(e, [{'function': '<module>', 'file': '" + BLOCK_FILE + "', 'line': e.lineno or 0}])",
            "    tail = None",
            "    if tree.body and isinstance(tree.body[-1], ast.Expr):",
            "        tail = ast.Expression(tree.body.pop().value)",
            "    try:",
            "        exec(compile(tree, '" + BLOCK_FILE + "', 'exec'), scope)",
            "        result = eval(compile(tail, '" + BLOCK_FILE + "', 'eval'), scope) if tail is not None else None",
            "        encoded = json.dumps(result, default=__naab_unserializable)",
            "    except Exception as e:",
            "        frames = [{'function': f.name, 'file': f.filename, 'line': f.lineno}",
            "                  for f in traceback.extract_tb(e.__traceback__) if f.filename == '" + BLOCK_FILE + "']",
            "        frames.reverse()",
            "        __naab_fail(e, frames)",
            "    sys.stdout.flush()",
            "    sys.stdout.write('\\n" + OutputParser.RETURN_SENTINEL + "' + encoded + '\\n')",
            "    sys.stdout.flush()",
            "",
            "__naab_main(%s)",
            "");
    // [/🧩 Section: driver]

    public PythonSubprocessExecutor(String languageTag, ExecutorEnvironment env) {
        this(languageTag, env, DEFAULT_INTERPRETER);
    }

    public PythonSubprocessExecutor(String languageTag, ExecutorEnvironment env, String interpreter) {
        super(languageTag, env, interpreter + " " + PLACEHOLDER, ".py");
    }

    public static ExecutorFactory factory() {
        return PythonSubprocessExecutor::new;
    }

    /**
     * The driver with the dedented block embedded as a JSON string literal, which Python reads
     * as an ordinary string.
     */
    @Override
    protected String prepareSource(ExecutionRequest request) {
        String block = SourceText.dedent(request.source());
        try {
            return DRIVER.replace("%s", JsonWire.encode(block));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("cannot embed block source", e);
        }
    }
}
