/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/ErrorKind.java
 description: Failure categories of the polyglot execution core, with their host-visible type names.
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

/**
 * Category of a {@link PolyglotException}.
 */
public enum ErrorKind {
    VALIDATION("ValidationError"),
    COMPILE("CompileError"),
    RUNTIME("RuntimeError"),
    TIMEOUT("TimeoutError"),
    RESOURCE("ResourceError"),
    UNKNOWN_LANGUAGE("UnknownLanguageError"),
    CANCELLED("CancelledError");

    private final String typeName;

    ErrorKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * @return the error type name host programs see (e.g. {@code "TimeoutError"})
     */
    public String typeName() {
        return typeName;
    }
}
