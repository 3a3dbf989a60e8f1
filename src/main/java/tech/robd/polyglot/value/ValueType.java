/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/value/ValueType.java
 description: Runtime type tags of host values, plus ANY for callback signatures.
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

/**
 * Type tag of a {@link Value}.
 */
public enum ValueType {
    NULL("null", true),
    BOOL("bool", true),
    INT("int", true),
    FLOAT("float", true),
    STRING("string", true),
    LIST("list", true),
    DICT("dict", true),
    STRUCT("struct", false),
    CLOSURE("function", false),
    FUTURE("future", false),
    /**
     * Wildcard used in signatures only; no value has this type.
     */
    ANY("any", false);

    private final String displayName;
    private final boolean serializable;

    ValueType(String displayName, boolean serializable) {
        this.displayName = displayName;
        this.serializable = serializable;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @return whether values of this type have a representation in every foreign runtime
     */
    public boolean isSerializable() {
        return serializable;
    }

    /**
     * Signature check: does a parameter declared as this type accept a value of {@code actual}?
     * {@code ANY} accepts everything and {@code FLOAT} also accepts {@code INT}.
     */
    public boolean accepts(ValueType actual) {
        if (this == ANY || this == actual) return true;
        return this == FLOAT && actual == INT;
    }
}
