/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/subprocess/OutputParser.java
 description: Recovers a block result from subprocess stdout: sentinel line, JSON, simple scalars, text.
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
import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.marshal.JsonWire;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads a result out of what a foreign program printed.
 *
 * <p>Order of preference:</p>
 * <ol>
 *   <li>the last line starting with {@value #RETURN_SENTINEL}; the rest of that line is the
 *       value, everything else is log output;</li>
 *   <li>the whole trimmed output as JSON;</li>
 *   <li>simple scalars: integers, decimals, {@code true/false}, {@code null/None/nil};</li>
 *   <li>the trimmed output as a string. Empty output is null.</li>
 * </ol>
 * The result is a foreign representation tree; the caller marshals and validates it.
 */
public final class OutputParser {

    public static final String RETURN_SENTINEL = "__NAAB_RETURN__:";

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+([eE][-+]?\\d+)?");

    private OutputParser() {
    }

    /**
     * @param value     foreign representation of the result
     * @param logOutput stdout minus the sentinel line; empty when there was no sentinel
     */
    public record Parsed(@Nullable Object value, String logOutput) {
    }

    public static Parsed parse(String stdout) {
        if (stdout == null) throw new IllegalArgumentException("stdout cannot be null");
        List<String> lines = stdout.lines().toList();

        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i);
            if (line.startsWith(RETURN_SENTINEL)) {
                Object value = parseText(line.substring(RETURN_SENTINEL.length()));
                List<String> rest = new ArrayList<>(lines);
                rest.remove(i);
                return new Parsed(value, String.join("\n", rest));
            }
        }
        return new Parsed(parseText(stdout), "");
    }

    /**
     * JSON first, then simple scalars, then the text itself.
     */
    public static @Nullable Object parseText(String text) {
        String trimmed = text.strip();
        if (trimmed.isEmpty()) return null;
        try {
            return JsonWire.decode(trimmed);
        } catch (JsonProcessingException e) {
            return parseSimple(trimmed);
        }
    }

    static @Nullable Object parseSimple(String trimmed) {
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                return Long.parseLong(trimmed);
            } catch (NumberFormatException e) {
                // out of range for a long: keep the digits as text
                return trimmed;
            }
        }
        if (DECIMAL.matcher(trimmed).matches()) return Double.parseDouble(trimmed);
        switch (trimmed) {
            case "true", "True", "TRUE":
                return Boolean.TRUE;
            case "false", "False", "FALSE":
                return Boolean.FALSE;
            case "null", "None", "nil":
                return null;
            default:
                return trimmed;
        }
    }
}
