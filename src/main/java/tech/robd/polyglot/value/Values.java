/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/value/Values.java
 description: Factories for Value trees and transparent forcing of deferred block results.
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

package tech.robd.polyglot.value;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static helpers around {@link Value}.
 */
public final class Values {

    private Values() {
        // no instances
    }

    public static Value.Null nil() {
        return Value.Null.INSTANCE;
    }

    public static Value.Bool of(boolean b) {
        return b ? Value.Bool.TRUE : Value.Bool.FALSE;
    }

    public static Value.Int of(long n) {
        return new Value.Int(n);
    }

    public static Value.Float of(double d) {
        return new Value.Float(d);
    }

    public static Value.Str of(String s) {
        return new Value.Str(s);
    }

    public static Value.Array list(Value... items) {
        return new Value.Array(List.of(items));
    }

    /**
     * Convert a plain Java object graph ({@code null}, booleans, integral and floating numbers,
     * strings, lists, string-keyed maps, or existing {@link Value}s) into a Value tree.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static Value from(@Nullable Object o) {
        if (o == null) return nil();
        if (o instanceof Value v) return v;
        if (o instanceof Boolean b) return of(b.booleanValue());
        if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return of(((Number) o).longValue());
        }
        if (o instanceof Double || o instanceof java.lang.Float) return of(((Number) o).doubleValue());
        if (o instanceof CharSequence cs) return of(cs.toString());
        if (o instanceof List<?> l) {
            Value.Array out = new Value.Array();
            for (Object item : l) out.add(from(item));
            return out;
        }
        if (o instanceof Map<?, ?> m) {
            Value.Dict out = new Value.Dict();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new IllegalArgumentException("dict keys must be strings, got " + e.getKey());
                }
                out.put(key, from(e.getValue()));
            }
            return out;
        }
        throw new IllegalArgumentException("no Value mapping for " + o.getClass().getName());
    }

    /**
     * Argument snapshot taken at spawn. The list and every list or dict reachable from it are
     * copied, so later host mutations stay on the host side. Deferred results, structs and
     * closures are kept by reference.
     * <p>
     * Callers validate first: the copy follows the containers without a depth bound.
     */
    public static List<Value> snapshot(List<? extends Value> args) {
        if (args == null) throw new IllegalArgumentException("arguments cannot be null");
        List<Value> out = new ArrayList<>(args.size());
        for (Value v : args) out.add(detach(v));
        return List.copyOf(out);
    }

    private static Value detach(Value v) {
        if (v instanceof Value.Array a) {
            Value.Array copy = new Value.Array();
            for (Value item : a.items()) copy.add(detach(item));
            return copy;
        }
        if (v instanceof Value.Dict d) {
            Value.Dict copy = new Value.Dict();
            for (Map.Entry<String, Value> e : d.entries().entrySet()) copy.put(e.getKey(), detach(e.getValue()));
            return copy;
        }
        return v;
    }

    /**
     * Force a deferred block result, or return a concrete value unchanged.
     * Blocks the calling thread while the block is running.
     *
     * @throws tech.robd.polyglot.error.PolyglotException the error stored in the future
     */
    public static Value concrete(Value v) {
        Value current = v;
        while (current instanceof Value.Deferred d) {
            current = d.future().force();
        }
        return current;
    }

    /**
     * Force every top-level deferred element of {@code args}.
     */
    public static List<Value> concreteAll(List<Value> args) {
        List<Value> out = new ArrayList<>(args.size());
        for (Value v : args) out.add(concrete(v));
        return out;
    }

    /**
     * Like {@link #concrete} but also forces deferred results nested in lists and dicts.
     * Containers holding a deferred element are copied; containers without one come back
     * as the same instance.
     */
    public static Value resolveDeep(Value v) {
        Value c = concrete(v);
        if (c instanceof Value.Array a) {
            List<Value> items = new ArrayList<>(a.size());
            boolean changed = false;
            for (Value item : a.items()) {
                Value r = resolveDeep(item);
                changed |= r != item;
                items.add(r);
            }
            return changed ? new Value.Array(items) : a;
        }
        if (c instanceof Value.Dict d) {
            Value.Dict out = new Value.Dict();
            boolean changed = false;
            for (Map.Entry<String, Value> e : d.entries().entrySet()) {
                Value r = resolveDeep(e.getValue());
                changed |= r != e.getValue();
                out.put(e.getKey(), r);
            }
            return changed ? out : d;
        }
        return c;
    }

    public static boolean containsDeferred(List<Value> args) {
        for (Value v : args) {
            if (v instanceof Value.Deferred) return true;
        }
        return false;
    }
}
