/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/callback/CallbackResult.java
 description: Value or error record handed back to foreign code by a trampoline.
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

package tech.robd.polyglot.callback;

import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a callback as foreign code receives it. Failures are plain data; no host
 * exception object is ever part of it.
 *
 * @param ok           whether the host function ran and returned a valid value
 * @param value        marshalled return value (foreign representation) when {@code ok}
 * @param errorType    e.g. {@code ValidationError} when not {@code ok}
 * @param errorMessage human-readable reason when not {@code ok}
 */
public record CallbackResult(boolean ok,
                             @Nullable Object value,
                             @Nullable String errorType,
                             @Nullable String errorMessage) {

    public static CallbackResult success(@Nullable Object value) {
        return new CallbackResult(true, value, null, null);
    }

    public static CallbackResult failure(String errorType, String errorMessage) {
        return new CallbackResult(false, null, errorType, errorMessage);
    }

    /**
     * @return {@code {"ok": true, "value": ...}} or {@code {"ok": false, "error": {"type": ..., "message": ...}}}
     */
    public Map<String, @Nullable Object> toForeignRecord() {
        Map<String, @Nullable Object> out = new LinkedHashMap<>();
        out.put("ok", ok);
        if (ok) {
            out.put("value", value);
        } else {
            Map<String, @Nullable Object> err = new LinkedHashMap<>();
            err.put("type", errorType);
            err.put("message", errorMessage);
            out.put("error", err);
        }
        return out;
    }
}
