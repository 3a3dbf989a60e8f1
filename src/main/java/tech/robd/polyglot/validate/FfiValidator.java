/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/validate/FfiValidator.java
 description: Fail-closed checks on argument lists and return values crossing the language
              boundary: types, strings, floats, depth, argument count and estimated payload size.
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

package tech.robd.polyglot.validate;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.ValidationLimits;
import tech.robd.polyglot.diagnostics.AuditLog;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.marshal.BoundaryPath;
import tech.robd.polyglot.marshal.BoundaryRules;
import tech.robd.polyglot.value.Value;

import java.util.List;
import java.util.Map;

/**
 * Validates values in both directions with one rule set. Meant to run before any foreign
 * process or interpreter is touched; a failure means the block does not run.
 *
 * <p>Payload size is an estimate of the JSON-encoded size: enough to bound memory and
 * pipe traffic, not an exact byte count of any particular executor's wire format.</p>
 */
public final class FfiValidator {

    private static final Diagnostics DIAG = Diagnostics.of(FfiValidator.class);

    private final ValidationLimits limits;

    public FfiValidator(ValidationLimits limits) {
        if (limits == null) throw new IllegalArgumentException("limits cannot be null");
        this.limits = limits;
    }

    public ValidationLimits limits() {
        return limits;
    }

    // 🧩 Section: api

    /**
     * Validate every argument of a block or callback call.
     *
     * @throws ValidationException on the first violation, naming its path
     */
    public void validateArguments(List<Value> args, String languageTag) {
        validateArguments(args, languageTag, false);
    }

    /**
     * @param skipDeferred when {@code true}, top-level deferred results are left for the worker
     *                     to force and validate later
     */
    public void validateArguments(List<Value> args, String languageTag, boolean skipDeferred) {
        if (args == null) throw new IllegalArgumentException("args cannot be null");
        try {
            if (args.size() > limits.maxFfiArguments()) {
                throw new ValidationException(languageTag, "args",
                        "too many arguments: " + args.size() + " > " + limits.maxFfiArguments());
            }
            Walk walk = new Walk(languageTag, true, BoundaryPath.root("args").toString());
            walk.total = 2;
            for (int i = 0; i < args.size(); i++) {
                Value v = args.get(i);
                if (v == null) throw new IllegalArgumentException("argument " + i + " is null; use Value.Null");
                if (skipDeferred && v instanceof Value.Deferred) continue;
                walk.visit(v, BoundaryPath.argument(i), 0);
                walk.add(1);
            }
            DIAG.debug("validated {} args for {} (~{} bytes)", args.size(), languageTag, walk.total);
        } catch (ValidationException e) {
            AuditLog.securityViolation(languageTag, "argument", e.getMessage());
            throw e;
        }
    }

    /**
     * Validate a value produced by foreign code before it becomes a host value.
     * A foreign {@code null} is allowed.
     */
    public void validateReturnValue(Value value, String languageTag) {
        if (value == null) throw new IllegalArgumentException("value cannot be null; use Value.Null");
        try {
            Walk walk = new Walk(languageTag, true, "return");
            walk.visit(value, BoundaryPath.returnValue(), 0);
        } catch (ValidationException e) {
            AuditLog.securityViolation(languageTag, "return", e.getMessage());
            throw e;
        }
    }

    /**
     * Estimated serialised size of {@code value}. No rule is applied except the nesting bound,
     * which also stops a list or dict that contains itself.
     *
     * @throws tech.robd.polyglot.error.DepthExceededException nested deeper than {@code maxFfiDepth}
     */
    public long estimateSize(Value value) {
        Walk walk = new Walk(null, false, "value");
        walk.visit(value, BoundaryPath.root("value"), 0);
        return walk.total;
    }
    // [/🧩 Section: api]

    // 🧩 Section: walker
    private final class Walk {
        private final @Nullable String tag;
        private final boolean enforce;
        private final String payloadPath;
        long total;

        Walk(@Nullable String tag, boolean enforce, String payloadPath) {
            this.tag = tag;
            this.enforce = enforce;
            this.payloadPath = payloadPath;
        }

        void add(long bytes) {
            total += bytes;
            if (enforce && total > limits.maxFfiPayloadBytes()) {
                throw new ValidationException(tag, payloadPath,
                        "total payload too large: " + total + " > " + limits.maxFfiPayloadBytes() + " bytes");
            }
        }

        void visit(Value v, BoundaryPath path, int depth) {
            if (enforce) BoundaryRules.checkSerializable(v, path, tag);
            if (v instanceof Value.Null) {
                add(4);
            } else if (v instanceof Value.Bool b) {
                add(b.value() ? 4 : 5);
            } else if (v instanceof Value.Int i) {
                add(Long.toString(i.value()).length());
            } else if (v instanceof Value.Float f) {
                if (enforce) BoundaryRules.checkFloat(f.value(), path, tag);
                add(Double.toString(f.value()).length());
            } else if (v instanceof Value.Str s) {
                if (enforce) BoundaryRules.checkString(s.value(), path, tag, limits);
                add(BoundaryRules.utf8Length(s.value()) + 2);
            } else if (v instanceof Value.Array a) {
                BoundaryRules.checkDepth(depth + 1, path, tag, limits);
                add(2);
                for (int i = 0; i < a.size(); i++) {
                    visit(a.get(i), path.index(i), depth + 1);
                    if (i > 0) add(1);
                }
            } else if (v instanceof Value.Dict d) {
                BoundaryRules.checkDepth(depth + 1, path, tag, limits);
                add(2);
                boolean first = true;
                for (Map.Entry<String, Value> e : d.entries().entrySet()) {
                    BoundaryPath child = path.key(e.getKey());
                    if (enforce) BoundaryRules.checkString(e.getKey(), child, tag, limits);
                    add(BoundaryRules.utf8Length(e.getKey()) + 3 + (first ? 0 : 1));
                    first = false;
                    visit(e.getValue(), child, depth + 1);
                }
            } else {
                // not serialisable; only reachable when estimating
                add(v.toString().length());
            }
        }
    }
    // [/🧩 Section: walker]
}
