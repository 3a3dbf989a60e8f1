/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/callback/Trampoline.java
 description: Validated entry point through which foreign code calls one host function.
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

package tech.robd.polyglot.callback;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.boundary.ExceptionBoundary;
import tech.robd.polyglot.boundary.GuardedResult;
import tech.robd.polyglot.diagnostics.AuditLog;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.ErrorKind;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.marshal.BoundaryPath;
import tech.robd.polyglot.marshal.ValueMarshaller;
import tech.robd.polyglot.validate.FfiValidator;
import tech.robd.polyglot.value.Value;
import tech.robd.polyglot.value.ValueType;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wraps a host function for foreign callers. Each call goes through, in order: handle
 * check, argument count, per-argument type, the host call inside the exception boundary,
 * then return type and return value validation. The first failing step produces a
 * {@link CallbackResult} error and nothing after it runs.
 *
 * <p>{@link #invoke(String, List)} never throws.</p>
 */
public final class Trampoline {

    private static final Diagnostics DIAG = Diagnostics.of(Trampoline.class);

    // 🧩 Section: state
    private final @Nullable HostFunction function;
    private final CallbackSignature signature;
    private final ValueMarshaller marshaller;
    private final FfiValidator validator;

    private final AtomicLong invocations = new AtomicLong();
    private final AtomicLong hostCalls = new AtomicLong();
    private final AtomicLong rejections = new AtomicLong();
    // [/🧩 Section: state]

    Trampoline(@Nullable HostFunction function, CallbackSignature signature,
               ValueMarshaller marshaller, FfiValidator validator) {
        this.function = function;
        this.signature = signature;
        this.marshaller = marshaller;
        this.validator = validator;
    }

    public CallbackSignature signature() {
        return signature;
    }

    // 🧩 Section: invoke

    /**
     * Call the host function on behalf of foreign code.
     *
     * @param callerTag   language of the calling block
     * @param foreignArgs arguments in foreign representation
     */
    public CallbackResult invoke(String callerTag, List<@Nullable Object> foreignArgs) {
        invocations.incrementAndGet();
        String name = signature.name();

        // 🧩 Point: invoke/null-handle
        HostFunction fn = function;
        if (fn == null) {
            return reject(callerTag, ErrorKind.VALIDATION, "callback '" + name + "' has no host function bound");
        }

        // 🧩 Point: invoke/arity
        List<@Nullable Object> raw = foreignArgs == null ? List.of() : foreignArgs;
        if (raw.size() != signature.arity()) {
            return reject(callerTag, ErrorKind.VALIDATION, "callback '" + name + "' argument count mismatch: expected "
                    + signature.arity() + ", got " + raw.size());
        }

        // 🧩 Point: invoke/argument-types
        List<Value> args = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            BoundaryPath path = BoundaryPath.root(name + ".args").index(i);
            Value v;
            try {
                v = marshaller.fromForeign(raw.get(i), callerTag, path);
            } catch (PolyglotException e) {
                return reject(callerTag, e.kind(), e.foreignMessage());
            }
            ValueType expected = signature.parameterTypes().get(i);
            if (!expected.accepts(v.type())) {
                return reject(callerTag, ErrorKind.VALIDATION, "callback '" + name + "' type mismatch at " + path
                        + ": expected " + expected.displayName() + ", got " + v.typeName());
            }
            args.add(v);
        }
        try {
            validator.validateArguments(args, callerTag);
        } catch (PolyglotException e) {
            return audited(e);
        }

        // 🧩 Point: invoke/host-call
        hostCalls.incrementAndGet();
        GuardedResult<Value> result = ExceptionBoundary.runGuarded(callerTag, () -> fn.call(args));
        if (!result.success()) {
            PolyglotException err = result.error();
            DIAG.debug("callback '{}' from {} failed: {}", name, callerTag, result.errorMessage());
            rejections.incrementAndGet();
            return CallbackResult.failure(err == null ? ErrorKind.RUNTIME.typeName() : err.errorType(),
                    err == null ? "callback failed" : err.foreignMessage());
        }

        // 🧩 Point: invoke/return
        Value out = result.value() == null ? Value.Null.INSTANCE : result.value();
        if (!signature.returnType().accepts(out.type())) {
            return reject(callerTag, ErrorKind.VALIDATION, "callback '" + name + "' returned "
                    + out.typeName() + ", declared " + signature.returnType().displayName());
        }
        try {
            validator.validateReturnValue(out, callerTag);
            return CallbackResult.success(marshaller.toForeign(out, callerTag, BoundaryPath.root(name).key("return")));
        } catch (PolyglotException e) {
            return audited(e);
        }
    }
    // [/🧩 Section: invoke]

    private CallbackResult reject(String callerTag, ErrorKind kind, String message) {
        rejections.incrementAndGet();
        AuditLog.securityViolation(callerTag, "callback", message);
        DIAG.debug("callback '{}' rejected for {}: {}", signature.name(), callerTag, message);
        return CallbackResult.failure(kind.typeName(), message);
    }

    // validator has already written the audit entry
    private CallbackResult audited(PolyglotException e) {
        rejections.incrementAndGet();
        return CallbackResult.failure(e.errorType(), e.foreignMessage());
    }

    // 🧩 Section: counters
    public long invocationCount() {
        return invocations.get();
    }

    /**
     * @return how many invocations actually reached the host function
     */
    public long hostCallCount() {
        return hostCalls.get();
    }

    public long rejectionCount() {
        return rejections.get();
    }
    // [/🧩 Section: counters]
}
