/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/value/Value.java
 description: Host dynamic value model: immutable scalars, shared mutable containers, structs,
              host closures and deferred block results.
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

package tech.robd.polyglot.value;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.callback.HostFunction;
import tech.robd.polyglot.schedule.BlockFuture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A host program value.
 *
 * <p>Scalars are immutable records. {@link Array}, {@link Dict} and {@link Struct} are heap
 * containers shared by reference: two variables may hold the same container, and a block
 * spawned with a container argument sees the container as it is when the block's executor
 * marshals it. Containers are not thread-safe; the host mutating a container that it has
 * loaned to a running block gets unspecified visibility on the foreign side.</p>
 */
public sealed interface Value
        permits Value.Null, Value.Bool, Value.Int, Value.Float, Value.Str,
        Value.Array, Value.Dict, Value.Struct, Value.Closure, Value.Deferred {

    ValueType type();

    default String typeName() {
        return type().displayName();
    }

    // 🧩 Section: scalars

    enum Null implements Value {
        INSTANCE;

        @Override
        public ValueType type() {
            return ValueType.NULL;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Bool(boolean value) implements Value {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        @Override
        public ValueType type() {
            return ValueType.BOOL;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record Int(long value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.INT;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record Float(double value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.FLOAT;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record Str(String value) implements Value {
        public Str {
            if (value == null) throw new IllegalArgumentException("string value cannot be null");
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }
    // [/🧩 Section: scalars]

    // 🧩 Section: containers

    /**
     * Mutable list. Equality is structural.
     */
    final class Array implements Value {
        private final List<Value> items;

        public Array() {
            this.items = new ArrayList<>();
        }

        public Array(List<? extends Value> initial) {
            if (initial == null) throw new IllegalArgumentException("initial items cannot be null");
            this.items = new ArrayList<>(initial);
            if (this.items.contains(null)) throw new IllegalArgumentException("list items cannot be null; use Value.Null");
        }

        @Override
        public ValueType type() {
            return ValueType.LIST;
        }

        public int size() {
            return items.size();
        }

        public Value get(int index) {
            return items.get(index);
        }

        public Array add(Value item) {
            items.add(Objects.requireNonNull(item, "item"));
            return this;
        }

        public Value set(int index, Value item) {
            return items.set(index, Objects.requireNonNull(item, "item"));
        }

        /**
         * @return read-only live view of the items
         */
        public List<Value> items() {
            return Collections.unmodifiableList(items);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Array that && items.equals(that.items));
        }

        @Override
        public int hashCode() {
            return items.hashCode();
        }

        @Override
        public String toString() {
            return items.toString();
        }
    }

    /**
     * Mutable insertion-ordered map with string keys. Equality is structural.
     */
    final class Dict implements Value {
        private final LinkedHashMap<String, Value> entries;

        public Dict() {
            this.entries = new LinkedHashMap<>();
        }

        public Dict(Map<String, ? extends Value> initial) {
            this();
            if (initial == null) throw new IllegalArgumentException("initial entries cannot be null");
            initial.forEach(this::put);
        }

        @Override
        public ValueType type() {
            return ValueType.DICT;
        }

        public int size() {
            return entries.size();
        }

        public @Nullable Value get(String key) {
            return entries.get(key);
        }

        public Dict put(String key, Value value) {
            entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public @Nullable Value remove(String key) {
            return entries.remove(key);
        }

        /**
         * @return read-only live view of the entries, in insertion order
         */
        public Map<String, Value> entries() {
            return Collections.unmodifiableMap(entries);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Dict that && entries.equals(that.entries));
        }

        @Override
        public int hashCode() {
            return entries.hashCode();
        }

        @Override
        public String toString() {
            return entries.toString();
        }
    }

    /**
     * Named record with ordered fields. Has no foreign representation.
     */
    final class Struct implements Value {
        private final String structName;
        private final LinkedHashMap<String, Value> fields;

        public Struct(String structName, Map<String, ? extends Value> fields) {
            if (structName == null || structName.isEmpty()) throw new IllegalArgumentException("struct name cannot be empty");
            if (fields == null) throw new IllegalArgumentException("fields cannot be null");
            this.structName = structName;
            this.fields = new LinkedHashMap<>();
            fields.forEach((k, v) -> this.fields.put(Objects.requireNonNull(k, "field"), Objects.requireNonNull(v, "value")));
        }

        @Override
        public ValueType type() {
            return ValueType.STRUCT;
        }

        public String structName() {
            return structName;
        }

        /**
         * Field access.
         *
         * @throws IllegalArgumentException if the struct has no such field
         */
        public Value field(String name) {
            Value v = fields.get(name);
            if (v == null) throw new IllegalArgumentException(structName + " has no field '" + name + "'");
            return v;
        }

        public void setField(String name, Value value) {
            if (!fields.containsKey(name)) throw new IllegalArgumentException(structName + " has no field '" + name + "'");
            fields.put(name, Objects.requireNonNull(value, "value"));
        }

        public Map<String, Value> fields() {
            return Collections.unmodifiableMap(fields);
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof Struct that
                    && structName.equals(that.structName) && fields.equals(that.fields));
        }

        @Override
        public int hashCode() {
            return structName.hashCode() * 31 + fields.hashCode();
        }

        @Override
        public String toString() {
            return structName + fields;
        }
    }
    // [/🧩 Section: containers]

    // 🧩 Section: callables-and-deferred

    /**
     * Host function value. {@code arity} of {@code -1} means variadic.
     */
    record Closure(String name, int arity, HostFunction function) implements Value {
        public Closure {
            if (name == null) throw new IllegalArgumentException("closure name cannot be null");
            if (function == null) throw new IllegalArgumentException("closure function cannot be null");
        }

        @Override
        public ValueType type() {
            return ValueType.CLOSURE;
        }

        @Override
        public String toString() {
            return "<function " + name + ">";
        }
    }

    /**
     * Result of a spawned block that may still be running. Consumers force it through
     * {@link Values#concrete(Value)}.
     */
    record Deferred(BlockFuture future) implements Value {
        public Deferred {
            if (future == null) throw new IllegalArgumentException("future cannot be null");
        }

        @Override
        public ValueType type() {
            return ValueType.FUTURE;
        }

        @Override
        public String toString() {
            return "<future " + future.taskId() + " " + future.state() + ">";
        }
    }
    // [/🧩 Section: callables-and-deferred]
}
