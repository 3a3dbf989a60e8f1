/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/ForeignRuntimeException.java
 description: Foreign code raised an error or a subprocess exited non-zero.
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

import java.util.List;

/**
 * Foreign code failed while running. Subprocess executors also record the exit code and
 * captured standard error.
 */
public final class ForeignRuntimeException extends PolyglotException {

    private final @Nullable String foreignType;
    private final @Nullable Integer exitCode;
    private final @Nullable String stderr;

    public ForeignRuntimeException(String languageTag,
                                   @Nullable String foreignType,
                                   String message,
                                   List<StackFrame> foreignFrames,
                                   @Nullable Integer exitCode,
                                   @Nullable String stderr,
                                   @Nullable Throwable cause) {
        super(ErrorKind.RUNTIME, languageTag,
                foreignType == null || foreignType.isEmpty() ? message : foreignType + ": " + message,
                foreignFrames, cause);
        this.foreignType = foreignType;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public ForeignRuntimeException(String languageTag, String message, @Nullable Throwable cause) {
        this(languageTag, null, message, List.of(), null, null, cause);
    }

    /**
     * @return the foreign exception class name, e.g. {@code ZeroDivisionError}, when known
     */
    public @Nullable String foreignType() {
        return foreignType;
    }

    public @Nullable Integer exitCode() {
        return exitCode;
    }

    public @Nullable String stderr() {
        return stderr;
    }
}
