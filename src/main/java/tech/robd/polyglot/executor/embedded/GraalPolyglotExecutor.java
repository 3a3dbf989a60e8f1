/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/embedded/GraalPolyglotExecutor.java
 description: Embedded GraalVM back end: one long-lived polyglot context per language tag, host callbacks
              as guest functions, guest errors mapped to typed polyglot errors.
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


package tech.robd.polyglot.executor.embedded;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.SourceSection;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.graalvm.polyglot.proxy.ProxyObject;
import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.CancellationToken;
import tech.robd.polyglot.boundary.ExceptionBoundary;
import tech.robd.polyglot.callback.CallbackResult;
import tech.robd.polyglot.callback.Trampoline;
import tech.robd.polyglot.diagnostics.Diagnostics;
import tech.robd.polyglot.error.CompileException;
import tech.robd.polyglot.error.DepthExceededException;
import tech.robd.polyglot.error.ErrorKind;
import tech.robd.polyglot.error.ForeignRuntimeException;
import tech.robd.polyglot.error.PolyglotException;
import tech.robd.polyglot.error.ResourceException;
import tech.robd.polyglot.error.StackFrame;
import tech.robd.polyglot.error.TaskCancelledException;
import tech.robd.polyglot.error.ValidationException;
import tech.robd.polyglot.executor.ConcurrencyPolicy;
import tech.robd.polyglot.executor.ExecutionRequest;
import tech.robd.polyglot.executor.ExecutorEnvironment;
import tech.robd.polyglot.executor.ExecutorFactory;
import tech.robd.polyglot.executor.LanguageExecutor;
import tech.robd.polyglot.marshal.BoundaryPath;
import tech.robd.polyglot.marshal.JsonWire;
import tech.robd.polyglot.value.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs blocks inside a GraalVM polyglot {@link Context}.
 *
 * <p>One context lives as long as the executor and is shared by all of its blocks, so it
 * must be registered with {@link ConcurrencyPolicy#serialized()}; an internal lock keeps a
 * misconfigured registration from entering the context twice. The context is sandboxed: no
 * host class lookup, and host objects only through {@link HostAccess.Export}.</p>
 *
 * <p>JavaScript blocks run through a direct {@code eval} inside a wrapper function whose
 * parameters are the bound variables, so declarations stay local to the block and the
 * completion value of the last statement is the result. Arguments are rebuilt as native guest
 * values via {@code JSON.parse}. Host callbacks are installed as global functions that throw
 * a guest {@code Error} (with {@code name} set to the error type) when the call is rejected.
 * Other languages get their arguments as proxies in the top-level bindings.</p>
 *
 * <p>Cancellation interrupts the running guest code; if the guest does not stop within
 * {@value #INTERRUPT_GRACE_MILLIS} ms the context is closed and recreated on next use.</p>
 */
public final class GraalPolyglotExecutor implements LanguageExecutor {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(GraalPolyglotExecutor.class);
    // [/🧩 Section: diagnostics]

    public static final String JAVASCRIPT = "js";

    static final long INTERRUPT_GRACE_MILLIS = 1_000;

    /**
     * Source names of the glue code; their frames are hidden from error traces.
     */
    private static final String INTERNAL_PREFIX = "naab-internal-";

    private static final String CALLBACK_SHIM = String.join("\n",
            "(function (bridge, name) {",
            "  return function (...args) {",
            "    const reply = JSON.parse(bridge(name, args));",
            "    if (reply.ok) return reply.value;",
            "    const err = new Error(reply.error.message);",
            "    err.name = reply.error.type;",
            "    throw err;",
            "  };",
            "})");

    // 🧩 Section: state
    private final String languageTag;
    private final String languageId;
    private final ExecutorEnvironment env;
    private final Engine engine;
    private final ReentrantLock entered = new ReentrantLock();

    private final Object contextLock = new Object();
    private @Nullable Context context;
    private org.graalvm.polyglot.@Nullable Value jsonParse;
    private volatile boolean closed;
    // [/🧩 Section: state]

    // 🧩 Section: construction

    /**
     * @param languageId GraalVM language id, e.g. {@code "js"}
     * @throws IllegalStateException if that language is not on the classpath
     */
    public GraalPolyglotExecutor(String languageTag, ExecutorEnvironment env, String languageId) {
        if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
        if (env == null) throw new IllegalArgumentException("env cannot be null");
        if (languageId == null) throw new IllegalArgumentException("languageId cannot be null");
        this.languageTag = languageTag;
        this.languageId = languageId;
        this.env = env;
        this.engine = Engine.newBuilder()
                .option("engine.WarnInterpreterOnly", "false")
                .build();
        if (!engine.getLanguages().containsKey(languageId)) {
            engine.close();
            throw new IllegalStateException("GraalVM language '" + languageId + "' is not installed");
        }
        DIAG.debug("[{}] engine ready for '{}'", languageTag, languageId);
    }

    public static ExecutorFactory factory(String languageId) {
        return (tag, env) -> new GraalPolyglotExecutor(tag, env, languageId);
    }

    public static ExecutorFactory javascript() {
        return factory(JAVASCRIPT);
    }

    /**
     * @return whether a context for {@code languageId} can be created in this JVM
     */
    public static boolean isAvailable(String languageId) {
        try (Engine probe = Engine.newBuilder().option("engine.WarnInterpreterOnly", "false").build()) {
            return probe.getLanguages().containsKey(languageId);
        } catch (LinkageError e) {
            DIAG.debug("GraalVM '{}' not available: {}", languageId, e.toString());
            return false;
        } catch (RuntimeException e) {
            // engine present but refused to start, e.g. an unknown polyglot.* system property
            DIAG.warn("GraalVM engine failed to start: {}", e.toString());
            return false;
        }
    }
    // [/🧩 Section: construction]

    @Override
    public String languageTag() {
        return languageTag;
    }

    @Override
    public boolean supportsInterrupt() {
        return true;
    }

    // 🧩 Section: run
    @Override
    public Value run(ExecutionRequest request, CancellationToken token) throws Exception {
        Map<String, @Nullable Object> bindings = env.marshaller().bindingsToForeign(
                request.block().boundVariableNames(), request.arguments(), languageTag);

        entered.lockInterruptibly();
        try {
            Context ctx = context();
            try (AutoCloseable hook = token.onCancel(() -> interrupt(ctx, request.taskId()))) {
                org.graalvm.polyglot.Value result = JAVASCRIPT.equals(languageId)
                        ? evalJavaScript(ctx, request, bindings)
                        : evalGeneric(ctx, request, bindings);
                Object repr = toRepr(result, BoundaryPath.returnValue(), 0);
                Value value = env.marshaller().fromForeign(repr, languageTag, BoundaryPath.returnValue());
                env.validator().validateReturnValue(value, languageTag);
                return value;
            } catch (org.graalvm.polyglot.PolyglotException e) {
                throw translate(e, ctx, request.taskId());
            }
        } finally {
            entered.unlock();
        }
    }

    private org.graalvm.polyglot.Value evalJavaScript(Context ctx, ExecutionRequest request,
                                                      Map<String, @Nullable Object> bindings) throws JsonProcessingException {
        List<String> names = request.block().boundVariableNames();
        String wrapper = "(function (__naab_src" + (names.isEmpty() ? "" : ", " + String.join(", ", names))
                + ") { return eval(__naab_src); })";
        org.graalvm.polyglot.Value fn = ctx.eval(Source.newBuilder(JAVASCRIPT, wrapper,
                INTERNAL_PREFIX + "block-" + request.taskId() + ".js").buildLiteral());

        Object[] args = new Object[names.size() + 1];
        args[0] = request.source();
        org.graalvm.polyglot.Value parse = jsonParse(ctx);
        int i = 1;
        for (Object repr : bindings.values()) {
            args[i++] = parse.execute(JsonWire.encode(repr));
        }
        return fn.execute(args);
    }

    private org.graalvm.polyglot.Value evalGeneric(Context ctx, ExecutionRequest request,
                                                   Map<String, @Nullable Object> bindings) {
        org.graalvm.polyglot.Value top = ctx.getBindings(languageId);
        for (Map.Entry<String, @Nullable Object> e : bindings.entrySet()) {
            top.putMember(e.getKey(), toGuest(e.getValue()));
        }
        return ctx.eval(Source.newBuilder(languageId, request.source(), "block-" + request.taskId()).buildLiteral());
    }
    // [/🧩 Section: run]

    // 🧩 Section: context
    private Context context() {
        synchronized (contextLock) {
            if (closed) throw new ResourceException(languageTag, "executor is closed");
            Context ctx = context;
            if (ctx != null) return ctx;
            ctx = Context.newBuilder(languageId)
                    .engine(engine)
                    .allowHostAccess(HostAccess.newBuilder(HostAccess.NONE)
                            .allowAccessAnnotatedBy(HostAccess.Export.class)
                            .build())
                    .allowHostClassLookup(className -> false)
                    .allowAllAccess(false)
                    .build();
            installCallbacks(ctx);
            context = ctx;
            jsonParse = null;
            DIAG.debug("[{}] context created", languageTag);
            return ctx;
        }
    }

    private org.graalvm.polyglot.Value jsonParse(Context ctx) {
        synchronized (contextLock) {
            org.graalvm.polyglot.Value parse = jsonParse;
            if (parse == null) {
                parse = ctx.eval(Source.newBuilder(JAVASCRIPT, "JSON.parse", INTERNAL_PREFIX + "json.js").buildLiteral());
                jsonParse = parse;
            }
            return parse;
        }
    }

    private void installCallbacks(Context ctx) {
        if (env.callbacks().isEmpty()) return;
        if (!JAVASCRIPT.equals(languageId)) {
            DIAG.info("[{}] host callbacks are only installed for JavaScript; {} skipped",
                    languageTag, env.callbacks().names());
            return;
        }
        org.graalvm.polyglot.Value shim = ctx.eval(Source.newBuilder(JAVASCRIPT, CALLBACK_SHIM,
                INTERNAL_PREFIX + "callback.js").buildLiteral());
        ProxyExecutable bridge = args -> bridge(args[0].asString(), args[1]);
        org.graalvm.polyglot.Value global = ctx.getBindings(JAVASCRIPT);
        for (String name : env.callbacks().names()) {
            global.putMember(name, shim.execute(bridge, name));
        }
        DIAG.debug("[{}] callbacks installed: {}", languageTag, env.callbacks().names());
    }

    /**
     * Guest-to-host call: arguments converted and checked by the trampoline, reply returned as
     * a JSON record so that no host object reaches the guest.
     */
    private String bridge(String name, org.graalvm.polyglot.Value guestArgs) {
        Trampoline trampoline = env.callbacks().lookup(name);
        CallbackResult result;
        if (trampoline == null) {
            result = CallbackResult.failure(ErrorKind.VALIDATION.typeName(), "no host callback named '" + name + "'");
        } else {
            try {
                List<@Nullable Object> args = new ArrayList<>();
                for (long i = 0; i < guestArgs.getArraySize(); i++) {
                    args.add(toRepr(guestArgs.getArrayElement(i), BoundaryPath.root(name + ".args").index((int) i), 0));
                }
                result = trampoline.invoke(languageTag, args);
            } catch (PolyglotException e) {
                result = CallbackResult.failure(e.errorType(), e.foreignMessage());
            }
        }
        try {
            return JsonWire.encode(result.toForeignRecord());
        } catch (JsonProcessingException e) {
            // the record holds only marshalled values, so this is a bug
            throw new IllegalStateException("cannot encode callback reply for '" + name + "'", e);
        }
    }

    private void interrupt(Context ctx, String taskId) {
        DIAG.debug("{} [{}] interrupting guest", taskId, languageTag);
        try {
            ctx.interrupt(Duration.ofMillis(INTERRUPT_GRACE_MILLIS));
        } catch (TimeoutException e) {
            DIAG.warn("{} [{}] guest ignored interrupt for {} ms, closing context", taskId, languageTag, INTERRUPT_GRACE_MILLIS);
            discard(ctx, true);
        } catch (RuntimeException e) {
            DIAG.warn("{} [{}] interrupt failed ({}), closing context", taskId, languageTag, e.toString());
            discard(ctx, true);
        }
    }

    private void discard(Context ctx, boolean cancel) {
        synchronized (contextLock) {
            if (context == ctx) {
                context = null;
                jsonParse = null;
            }
        }
        try {
            ctx.close(cancel);
        } catch (RuntimeException e) {
            DIAG.warn("[{}] context close failed: {}", languageTag, e.toString());
        }
    }
    // [/🧩 Section: context]

    // 🧩 Section: values

    /**
     * Guest value to foreign representation. Depth is bounded here as well as in the
     * marshaller because guest object graphs can be cyclic.
     */
    private @Nullable Object toRepr(org.graalvm.polyglot.Value v, BoundaryPath path, int depth) {
        if (v == null || v.isNull()) return null;
        if (v.isBoolean()) return v.asBoolean();
        if (v.isNumber()) {
            if (v.fitsInLong()) return v.asLong();
            return v.asDouble();
        }
        if (v.isString()) return v.asString();
        if (v.canExecute()) {
            throw new ValidationException(languageTag, path.toString(), "unsafe type for FFI crossing: function");
        }
        int max = env.limits().maxFfiDepth();
        if (v.hasArrayElements()) {
            if (depth + 1 > max) throw new DepthExceededException(languageTag, path.toString(), depth + 1, max);
            List<@Nullable Object> out = new ArrayList<>();
            for (long i = 0; i < v.getArraySize(); i++) {
                out.add(toRepr(v.getArrayElement(i), path.index((int) i), depth + 1));
            }
            return out;
        }
        if (v.hasMembers()) {
            if (depth + 1 > max) throw new DepthExceededException(languageTag, path.toString(), depth + 1, max);
            Map<String, @Nullable Object> out = new LinkedHashMap<>();
            for (String key : v.getMemberKeys()) {
                out.put(key, toRepr(v.getMember(key), path.key(key), depth + 1));
            }
            return out;
        }
        return v.toString();
    }

    private static @Nullable Object toGuest(@Nullable Object repr) {
        if (repr instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object o : list) items.add(toGuest(o));
            return ProxyArray.fromList(items);
        }
        if (repr instanceof Map<?, ?> map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) fields.put(String.valueOf(e.getKey()), toGuest(e.getValue()));
            return ProxyObject.fromMap(fields);
        }
        return repr;
    }
    // [/🧩 Section: values]

    // 🧩 Section: errors
    private PolyglotException translate(org.graalvm.polyglot.PolyglotException e, Context ctx, String taskId) {
        if (e.isCancelled()) {
            discard(ctx, false);
            return new TaskCancelledException(languageTag, "block " + taskId + " cancelled", e);
        }
        if (e.isInterrupted()) {
            return new TaskCancelledException(languageTag, "block " + taskId + " interrupted", e);
        }
        if (e.isResourceExhausted()) {
            return new ResourceException(languageTag, "guest resources exhausted: " + e.getMessage(), e);
        }
        if (e.isHostException()) {
            return ExceptionBoundary.translate(languageTag, e.asHostException());
        }
        if (e.isInternalError()) {
            return new ForeignRuntimeException(languageTag, "InternalError", String.valueOf(e.getMessage()),
                    guestFrames(e), null, null, e);
        }
        if (e.isExit()) {
            return new ForeignRuntimeException(languageTag, null, "guest exited with code " + e.getExitStatus(),
                    guestFrames(e), e.getExitStatus(), null, e);
        }

        String type = guestErrorName(e);
        String message = stripTypePrefix(String.valueOf(e.getMessage()), type);
        List<StackFrame> frames = guestFrames(e);
        if (e.isSyntaxError() || "SyntaxError".equals(type)) {
            return new CompileException(languageTag, "SyntaxError: " + message, frames, e);
        }
        return new ForeignRuntimeException(languageTag, type, message, frames, null, null, e);
    }

    private static @Nullable String guestErrorName(org.graalvm.polyglot.PolyglotException e) {
        try {
            org.graalvm.polyglot.Value guest = e.getGuestObject();
            if (guest != null && guest.hasMember("name")) {
                org.graalvm.polyglot.Value name = guest.getMember("name");
                if (name != null && name.isString()) return name.asString();
            }
        } catch (RuntimeException ex) {
            // context already gone; fall back to the message
            DIAG.debug("guest error name unavailable: {}", ex.toString());
        }
        return null;
    }

    static String stripTypePrefix(String message, @Nullable String type) {
        if (type != null && message.startsWith(type + ": ")) return message.substring(type.length() + 2);
        return message;
    }

    private List<StackFrame> guestFrames(org.graalvm.polyglot.PolyglotException e) {
        List<StackFrame> frames = new ArrayList<>();
        for (org.graalvm.polyglot.PolyglotException.StackFrame f : e.getPolyglotStackTrace()) {
            if (!f.isGuestFrame()) continue;
            SourceSection loc = f.getSourceLocation();
            String file = loc != null ? loc.getSource().getName() : null;
            if (file != null && file.startsWith(INTERNAL_PREFIX)) continue;
            frames.add(new StackFrame(languageTag, f.getRootName(), file, loc != null ? loc.getStartLine() : 0));
        }
        return frames;
    }
    // [/🧩 Section: errors]

    // 🧩 Section: lifecycle
    @Override
    public void close() {
        Context ctx;
        synchronized (contextLock) {
            if (closed) return;
            closed = true;
            ctx = context;
            context = null;
            jsonParse = null;
        }
        if (ctx != null) {
            try {
                ctx.close(true);
            } catch (RuntimeException e) {
                DIAG.warn("[{}] context close failed: {}", languageTag, e.toString());
            }
        }
        engine.close(true);
        DIAG.debug("[{}] closed", languageTag);
    }
    // [/🧩 Section: lifecycle]
}
