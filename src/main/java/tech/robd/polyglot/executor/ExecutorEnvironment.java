/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/ExecutorEnvironment.java
 description: Shared services handed to executor factories: limits, marshaller, validator, callbacks.
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

package tech.robd.polyglot.executor;

import tech.robd.polyglot.ValidationLimits;
import tech.robd.polyglot.callback.CallbackRegistry;
import tech.robd.polyglot.marshal.ValueMarshaller;
import tech.robd.polyglot.validate.FfiValidator;

public record ExecutorEnvironment(ValidationLimits limits,
                                  ValueMarshaller marshaller,
                                  FfiValidator validator,
                                  CallbackRegistry callbacks) {

    public ExecutorEnvironment {
        if (limits == null) throw new IllegalArgumentException("limits cannot be null");
        if (marshaller == null) throw new IllegalArgumentException("marshaller cannot be null");
        if (validator == null) throw new IllegalArgumentException("validator cannot be null");
        if (callbacks == null) throw new IllegalArgumentException("callbacks cannot be null");
    }

    public static ExecutorEnvironment of(ValidationLimits limits) {
        return of(limits, CallbackRegistry.empty());
    }

    public static ExecutorEnvironment of(ValidationLimits limits, CallbackRegistry callbacks) {
        return new ExecutorEnvironment(limits, new ValueMarshaller(limits), new FfiValidator(limits), callbacks);
    }
}
