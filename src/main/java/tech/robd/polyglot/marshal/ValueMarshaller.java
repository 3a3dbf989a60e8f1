/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/marshal/ValueMarshaller.java
 description: Converts host Values to the neutral foreign representation (null, Boolean, Long,
              Double, String, List, Map) and back, enforcing depth, string and float rules.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
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
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional conversion between {@link Value} and the foreign representation every
 * executor family consumes.
 *
 * <p>Type map: int &lt;-&gt; {@link Long}, float &lt;-&gt; {@link Double}, string &lt;-&gt;
 * {@link String}, bool &lt;-&gt; {@link Boolean}, list &lt;-&gt; {@link List}, dict &lt;-&gt;
 * {@link Map} with string keys, null &lt;-&gt; {@code null}. Structs, closures and futures
 * have no foreign form.</p>
 *
 * <p>Containers are copied on the way out, so foreign code never holds a host container.</p>
 */
public final class ValueMarshaller {

    private final ValidationLimits limits;

    public ValueMarshaller(ValidationLimits limits) {
        if (limits == null) throw new IllegalArgumentException("limits cannot be null");
        this.limits = limits;
    }

    public ValidationLimits limits() {
        return limits;
    }

    // 🧩 Section: outbound

    public @Nullable Object toForeign(Value value, String languageTag) {
        return toForeign(value, languageTag, BoundaryPath.root("value"));
    }

    public @Nullable Object toForeign(Value value, String languageTag, BoundaryPath path) {
        if (value == null) throw new IllegalArgumentException("value cannot be null");
        return out(value, languageTag, path, 0);
    }

    /**
     * Marshal an argument list; element {@code i} is reported as {@code args[i]}.
     */
    public List<@Nullable Object> argumentsToForeign(List<Value> args, String languageTag) {
        List<@Nullable Object> out = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) {
            out.add(out(args.get(i), languageTag, BoundaryPath.argument(i), 0));
        }
        return out;
    }

    /**
     * Marshal arguments keyed by the block's bound variable names, preserving order.
     */
    public Map<String, @Nullable Object> bindingsToForeign(List<String> names, List<Value> args, String languageTag) {
        if (names.size() != args.size()) {
            throw new IllegalArgumentException("expected " + names.size() + " values for " + names + ", got " + args.size());
        }
        Map<String, @Nullable Object> out = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            out.put(names.get(i), out(args.get(i), languageTag, BoundaryPath.argument(i), 0));
        }
        return out;
    }

    private @Nullable Object out(Value v, String tag, BoundaryPath path, int depth) {
        BoundaryRules.checkSerializable(v, path, tag);
        // 🧩 Point: outbound/type-map
        if (v instanceof Value.Null) return null;
        if (v instanceof Value.Bool b) return b.value();
        if (v instanceof Value.Int i) return i.value();
        if (v instanceof Value.Float f) {
            BoundaryRules.checkFloat(f.value(), path, tag);
            return f.value();
        }
        if (v instanceof Value.Str s) {
            BoundaryRules.checkString(s.value(), path, tag, limits);
            return s.value();
        }
        if (v instanceof Value.Array a) {
            BoundaryRules.checkDepth(depth + 1, path, tag, limits);
            List<@Nullable Object> items = new ArrayList<>(a.size());
            for (int i = 0; i < a.size(); i++) {
                items.add(out(a.get(i), tag, path.index(i), depth + 1));
            }
            return items;
        }
        if (v instanceof Value.Dict d) {
            BoundaryRules.checkDepth(depth + 1, path, tag, limits);
            Map<String, @Nullable Object> entries = new LinkedHashMap<>();
            for (Map.Entry<String, Value> e : d.entries().entrySet()) {
                BoundaryPath child = path.key(e.getKey());
                BoundaryRules.checkString(e.getKey(), child, tag, limits);
                entries.put(e.getKey(), out(e.getValue(), tag, child, depth + 1));
            }
            return entries;
        }
        throw new ValidationException(tag, path.toString(), "unsafe type for FFI crossing: " + v.typeName());
    }
    // [/🧩 Section: outbound]

    // 🧩 Section: inbound

    /**
     * Convert a foreign result; errors are reported under the {@code return} path.
     */
    public Value fromForeign(@Nullable Object repr, String languageTag) {
        return fromForeign(repr, languageTag, BoundaryPath.returnValue());
    }

    public Value fromForeign(@Nullable Object repr, String languageTag, BoundaryPath path) {
        return in(repr, languageTag, path, 0);
    }

    private Value in(@Nullable Object o, String tag, BoundaryPath path, int depth) {
        if (o == null) return Values.nil();
        if (o instanceof Boolean b) return Values.of(b.booleanValue());
        if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
            return Values.of(((Number) o).longValue());
        }
        if (o instanceof BigInteger big) {
            if (big.bitLength() >= 64) {
                throw new ValidationException(tag, path.toString(), "integer out of 64-bit range: " + big);
            }
            return Values.of(big.longValue());
        }
        if (o instanceof Double || o instanceof Float || o instanceof BigDecimal) {
            double d = ((Number) o).doubleValue();
            BoundaryRules.checkFloat(d, path, tag);
            return Values.of(d);
        }
        if (o instanceof String || o instanceof Character) {
            String s = o.toString();
            BoundaryRules.checkString(s, path, tag, limits);
            return Values.of(s);
        }
        if (o instanceof List<?> list) {
            BoundaryRules.checkDepth(depth + 1, path, tag, limits);
            Value.Array out = new Value.Array();
            for (int i = 0; i < list.size(); i++) {
                out.add(in(list.get(i), tag, path.index(i), depth + 1));
            }
            return out;
        }
        if (o instanceof Map<?, ?> map) {
            BoundaryRules.checkDepth(depth + 1, path, tag, limits);
            Value.Dict out = new Value.Dict();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new ValidationException(tag, path.toString(), "dict keys must be strings, got " + e.getKey());
                }
                BoundaryPath child = path.key(key);
                BoundaryRules.checkString(key, child, tag, limits);
                out.put(key, in(e.getValue(), tag, child, depth + 1));
            }
            return out;
        }
        throw new ValidationException(tag, path.toString(), "unsafe type for FFI crossing: " + o.getClass().getName());
    }
    // [/🧩 Section: inbound]
}
