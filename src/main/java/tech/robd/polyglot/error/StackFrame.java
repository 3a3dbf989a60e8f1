/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/StackFrame.java
 description: One frame of a unified host/foreign stack trace.
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

package tech.robd.polyglot.error;

import org.jspecify.annotations.Nullable;

/**
 * A stack frame from either side of the language boundary.
 *
 * @param language   language the frame executes in ({@code "naab"} for host frames)
 * @param function   function or scope name
 * @param file       source name, or {@code null} for native/unknown
 * @param lineNumber 1-based line, or {@code 0} when unknown
 */
public record StackFrame(String language, String function, @Nullable String file, int lineNumber) {

    /**
     * Language name used for frames of the host program.
     */
    public static final String HOST_LANGUAGE = "naab";

    public StackFrame {
        if (language == null) throw new IllegalArgumentException("language cannot be null");
        if (function == null || function.isEmpty()) function = "<anonymous>";
        if (lineNumber < 0) lineNumber = 0;
    }

    public static StackFrame host(String function, @Nullable String file, int lineNumber) {
        return new StackFrame(HOST_LANGUAGE, function, file, lineNumber);
    }

    /**
     * Java stack element with the language as pseudo class, so that a printed Java trace
     * shows the foreign frames in place.
     */
    public StackTraceElement toStackTraceElement() {
        return new StackTraceElement("<" + language + ">", function, file, lineNumber > 0 ? lineNumber : -1);
    }

    @Override
    public String toString() {
        String where = file != null ? file : "<native>";
        return lineNumber > 0
                ? "  at " + function + " (" + language + ":" + where + ":" + lineNumber + ")"
                : "  at " + function + " (" + language + ":" + where + ")";
    }
}
