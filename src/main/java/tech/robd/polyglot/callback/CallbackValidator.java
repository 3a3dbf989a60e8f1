/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/callback/CallbackValidator.java
 description: Builds trampolines that check handle, arity and argument types before a host
              function is called from foreign code.
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
import tech.robd.polyglot.marshal.ValueMarshaller;
import tech.robd.polyglot.validate.FfiValidator;

/**
 * Factory for {@link Trampoline}s sharing one marshaller and validator.
 */
public final class CallbackValidator {

    private final ValueMarshaller marshaller;
    private final FfiValidator validator;

    public CallbackValidator(ValueMarshaller marshaller, FfiValidator validator) {
        if (marshaller == null) throw new IllegalArgumentException("marshaller cannot be null");
        if (validator == null) throw new IllegalArgumentException("validator cannot be null");
        this.marshaller = marshaller;
        this.validator = validator;
    }

    /**
     * Wrap a host function. A {@code null} handle is accepted here and rejected on every call,
     * so a missing binding shows up as a foreign-side error rather than at registration.
     */
    public Trampoline wrap(@Nullable HostFunction handle, CallbackSignature expected) {
        if (expected == null) throw new IllegalArgumentException("expected signature cannot be null");
        return new Trampoline(handle, expected, marshaller, validator);
    }
}
