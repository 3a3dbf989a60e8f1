/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/callback/CallbackRegistry.java
 description: Immutable name-to-trampoline table exposed to executors that support callbacks.
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public final class CallbackRegistry {

    private static final CallbackRegistry EMPTY = new CallbackRegistry(Map.of());

    private final Map<String, Trampoline> trampolines;

    private CallbackRegistry(Map<String, Trampoline> trampolines) {
        this.trampolines = trampolines;
    }

    public static CallbackRegistry empty() {
        return EMPTY;
    }

    /**
     * @param trampolines keyed by their signature name
     */
    public static CallbackRegistry of(Iterable<Trampoline> trampolines) {
        Map<String, Trampoline> map = new LinkedHashMap<>();
        for (Trampoline t : trampolines) {
            if (map.putIfAbsent(t.signature().name(), t) != null) {
                throw new IllegalArgumentException("duplicate callback name '" + t.signature().name() + "'");
            }
        }
        return new CallbackRegistry(Collections.unmodifiableMap(map));
    }

    public @Nullable Trampoline lookup(String name) {
        return trampolines.get(name);
    }

    public Set<String> names() {
        return trampolines.keySet();
    }

    public boolean isEmpty() {
        return trampolines.isEmpty();
    }
}
