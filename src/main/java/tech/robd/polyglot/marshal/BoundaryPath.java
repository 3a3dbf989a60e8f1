/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/marshal/BoundaryPath.java
 description: Immutable location of a value inside an argument list or return value, rendered
              as args[2].items[5] in error messages.
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

import java.util.regex.Pattern;

/**
 * Path from a root ({@code args}, {@code return}, a callback name) to a nested value.
 * Segments are only rendered when an error is reported.
 */
public final class BoundaryPath {

    private static final Pattern SIMPLE_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final @Nullable BoundaryPath parent;
    private final String segment;

    private BoundaryPath(@Nullable BoundaryPath parent, String segment) {
        this.parent = parent;
        this.segment = segment;
    }

    public static BoundaryPath root(String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("root name cannot be empty");
        return new BoundaryPath(null, name);
    }

    /**
     * Path of argument {@code index}: {@code args[index]}.
     */
    public static BoundaryPath argument(int index) {
        return root("args").index(index);
    }

    public static BoundaryPath returnValue() {
        return root("return");
    }

    public BoundaryPath index(int i) {
        return new BoundaryPath(this, "[" + i + "]");
    }

    public BoundaryPath key(String key) {
        return SIMPLE_KEY.matcher(key).matches()
                ? new BoundaryPath(this, "." + key)
                : new BoundaryPath(this, "[\"" + key.replace("\"", "\\\"") + "\"]");
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        append(sb);
        return sb.toString();
    }

    private void append(StringBuilder sb) {
        if (parent != null) parent.append(sb);
        sb.append(segment);
    }
}
