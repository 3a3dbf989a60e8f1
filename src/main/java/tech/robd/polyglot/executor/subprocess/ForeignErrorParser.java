/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/subprocess/ForeignErrorParser.java
 description: Turns a failed subprocess run into a typed error: structured error line, Python traceback, or
              plain stderr.
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

import com.fasterxml.jackson.core.JsonProcessingException;
import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.error.CompileException;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.error.StackFrame;
import tech.robd.polyglot.marshal.JsonWire;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the failure a foreign program reported.
 *
 * <p>A driver that knows the protocol prints one {@value #ERROR_SENTINEL} line holding
 * {@code {"type", "message", "frames": [{"function", "file", "line"}]}} with frames innermost
 * first. Without it the parser falls back to a Python-style traceback, then to the last line
 * of stderr.</p>
 */
public final class ForeignErrorParser {

    public static final String ERROR_SENTINEL = "__NAAB_ERROR__:";

    /**
     * Foreign error types that mean the block never started running.
     */
    private static final Set<String> COMPILE_TYPES = Set.of("SyntaxError", "IndentationError", "TabError");

    private static final Pattern TRACEBACK_FRAME = Pattern.compile("^\\s*File \"([^\"]*)\", line (\\d+)(?:, in (.+))?$");
    private static final Pattern TYPED_MESSAGE = Pattern.compile("^([A-Za-z_][\\w.]*(?:Error|Exception|Exit|Interrupt)): ?(.*)$");

    private ForeignErrorParser() {
    }

    // 🧩 Section: parse

    /**
     * @param stdout captured stdout, searched for the sentinel as well as stderr
     */
    public static PolyglotException parse(String languageTag, int exitCode, String stdout, String stderr) {
        if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
        String out = stdout == null ? "" : stdout;
        String err = stderr == null ? "" : stderr;

        // 🧩 Point: parse/structured
        String structured = lastSentinelLine(err);
        if (structured == null) structured = lastSentinelLine(out);
        if (structured != null) {
            PolyglotException e = fromStructured(languageTag, exitCode, structured, err);
            if (e != null) return e;
        }

        // 🧩 Point: parse/traceback
        List<StackFrame> frames = tracebackFrames(languageTag, err);
        String last = lastNonBlankLine(err);
        if (last == null) {
            return new ForeignRuntimeException(languageTag, null, "process exited with code " + exitCode,
                    frames, exitCode, err, null);
        }
        Matcher m = TYPED_MESSAGE.matcher(last.strip());
        if (m.matches()) {
            return build(languageTag, m.group(1), m.group(2), frames, exitCode, err);
        }
        return new ForeignRuntimeException(languageTag, null, last.strip() + " (exit code " + exitCode + ")",
                frames, exitCode, err, null);
    }
    // [/🧩 Section: parse]

    // 🧩 Section: structured
    private static @Nullable PolyglotException fromStructured(String languageTag, int exitCode, String json, String stderr) {
        Object decoded;
        try {
            decoded = JsonWire.decode(json);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (!(decoded instanceof Map<?, ?> fields)) return null;

        String type = fields.get("type") instanceof String s ? s : "Error";
        String message = fields.get("message") instanceof String s ? s : "";
        List<StackFrame> frames = new ArrayList<>();
        if (fields.get("frames") instanceof List<?> list) {
            for (Object o : list) {
                if (!(o instanceof Map<?, ?> f)) continue;
                String fn = f.get("function") instanceof String s ? s : "<module>";
                String file = f.get("file") instanceof String s ? s : null;
                int line = f.get("line") instanceof Number n ? n.intValue() : 0;
                frames.add(new StackFrame(languageTag, fn, file, line));
            }
        }
        return build(languageTag, type, message, frames, exitCode, stderr);
    }
    // [/🧩 Section: structured]

    // 🧩 Section: helpers
    private static PolyglotException build(String languageTag, String type, String message,
                                           List<StackFrame> frames, int exitCode, String stderr) {
        String simpleType = type.substring(type.lastIndexOf('.') + 1);
        if (COMPILE_TYPES.contains(simpleType)) {
            return new CompileException(languageTag, simpleType + ": " + message, frames, null);
        }
        return new ForeignRuntimeException(languageTag, simpleType, message, frames, exitCode, stderr, null);
    }

    /**
     * Traceback frames are printed outermost first; returned innermost first.
     */
    static List<StackFrame> tracebackFrames(String languageTag, String stderr) {
        List<StackFrame> frames = new ArrayList<>();
        for (String line : stderr.lines().toList()) {
            Matcher m = TRACEBACK_FRAME.matcher(line);
            if (m.matches()) {
                String fn = m.group(3) != null ? m.group(3).strip() : "<module>";
                frames.add(new StackFrame(languageTag, fn, m.group(1), Integer.parseInt(m.group(2))));
            }
        }
        Collections.reverse(frames);
        return frames;
    }

    private static @Nullable String lastSentinelLine(String text) {
        List<String> lines = text.lines().toList();
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i);
            if (line.startsWith(ERROR_SENTINEL)) return line.substring(ERROR_SENTINEL.length());
        }
        return null;
    }

    private static @Nullable String lastNonBlankLine(String text) {
        List<String> lines = text.lines().toList();
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) return lines.get(i);
        }
        return null;
    }
    // [/🧩 Section: helpers]
}
