/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/callback/CallbackSignature.java
 description: Declared name, parameter types and return type of a host callback.
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

import tech.robd.polyglot.value.ValueType;

import java.util.List;

/**
 * Expected shape of a callback invocation.
 *
 * @param name           name foreign code calls the callback by
 * @param parameterTypes one entry per positional parameter; {@link ValueType#ANY} matches everything
 * @param returnType     type the host function must return
 */
public record CallbackSignature(String name, List<ValueType> parameterTypes, ValueType returnType) {

    public CallbackSignature {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("callback name cannot be empty");
        if (parameterTypes == null) throw new IllegalArgumentException("parameterTypes cannot be null");
        if (returnType == null) throw new IllegalArgumentException("returnType cannot be null");
        parameterTypes = List.copyOf(parameterTypes);
    }

    public static CallbackSignature of(String name, ValueType returnType, ValueType... parameterTypes) {
        return new CallbackSignature(name, List.of(parameterTypes), returnType);
    }

    public int arity() {
        return parameterTypes.size();
    }
}
