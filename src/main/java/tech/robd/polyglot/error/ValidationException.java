/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/ValidationException.java
 description: A value, argument list or callback rejected at the language boundary.
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
 * Raised when a value may not cross the language boundary: unsupported type, NUL byte,
 * non-finite float, oversized string or payload, or a callback signature mismatch.
 * Validation happens before the foreign runtime is touched.
 */
public class ValidationException extends PolyglotException {

    private final String path;
    private final String reason;

    /**
     * @param languageTag target language, or {@code null} when not yet known
     * @param path        location of the offending value, e.g. {@code args[2].items[5]}
     * @param reason      what rule was broken
     */
    public ValidationException(@Nullable String languageTag, String path, String reason) {
        super(ErrorKind.VALIDATION, languageTag, reason + " at " + path);
        this.path = path;
        this.reason = reason;
    }

    public String path() {
        return path;
    }

    public String reason() {
        return reason;
    }
}
