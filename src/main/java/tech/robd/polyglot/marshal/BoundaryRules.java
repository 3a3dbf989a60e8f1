/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/marshal/BoundaryRules.java
 description: Per-value rules shared by the marshaller and the FFI validator: type taxonomy,
              string, float and depth checks.
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

package tech.robd.polyglot.marshal;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.ValidationLimits;
import tech.robd.polyglot.error.DepthExceededException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.value.Value;

/**
 * Checks applied to each value at the boundary, in both directions. Every failure is a
 * {@link ValidationException} naming the path.
 */
public final class BoundaryRules {

    private BoundaryRules() {
        // no instances
    }

    public static void checkSerializable(Value v, BoundaryPath path, @Nullable String tag) {
        if (v.type().isSerializable()) return;
        String reason = v instanceof Value.Deferred
                ? "unforced future cannot cross FFI"
                : "unsafe type for FFI crossing: " + v.typeName();
        throw new ValidationException(tag, path.toString(), reason);
    }

    public static void checkString(String s, BoundaryPath path, @Nullable String tag, ValidationLimits limits) {
        if (s.indexOf('\0') >= 0) {
            throw new ValidationException(tag, path.toString(), "string contains null bytes");
        }
        long bytes = utf8Length(s);
        if (bytes > limits.maxFfiStringBytes()) {
            throw new ValidationException(tag, path.toString(),
                    "string too large: " + bytes + " > " + limits.maxFfiStringBytes() + " bytes");
        }
    }

    public static void checkFloat(double d, BoundaryPath path, @Nullable String tag) {
        if (Double.isNaN(d)) throw new ValidationException(tag, path.toString(), "NaN not allowed in FFI");
        if (Double.isInfinite(d)) throw new ValidationException(tag, path.toString(), "Infinity not allowed in FFI");
    }

    /**
     * @param depth nesting level of the container being entered, 1 for a top-level list or dict
     */
    public static void checkDepth(int depth, BoundaryPath path, @Nullable String tag, ValidationLimits limits) {
        if (depth > limits.maxFfiDepth()) {
            throw new DepthExceededException(tag, path.toString(), depth, limits.maxFfiDepth());
        }
    }

    /**
     * UTF-8 encoded length without allocating the encoded form.
     */
    public static long utf8Length(String s) {
        long n = 0;
        for (int i = 0, len = s.length(); i < len; i++) {
            char c = s.charAt(i);
            if (c < 0x80) {
                n += 1;
            } else if (c < 0x800) {
                n += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < len && Character.isLowSurrogate(s.charAt(i + 1))) {
                n += 4;
                i++;
            } else {
                n += 3;
            }
        }
        return n;
    }
}
