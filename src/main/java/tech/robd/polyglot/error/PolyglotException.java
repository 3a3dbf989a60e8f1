/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/PolyglotException.java
 description: Root of the host exception taxonomy for polyglot block failures; carries the
              language tag, foreign frames and the host frames captured at spawn.
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

package tech.robd.polyglot.error;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class of every failure a polyglot block can produce.
 *
 * <p>The message always names the language tag, e.g.
 * {@code [python] ZeroDivisionError: division by zero}. Foreign frames, when the executor
 * could recover them, are placed in front of the Java stack trace so a plain
 * {@code printStackTrace()} reads as one trace across the boundary.</p>
 *
 * <p>Host context (task id and the host frames active at spawn) is attached once by the
 * scheduler; later attempts are ignored so a stored error stays stable across repeated forcing.</p>
 */
public abstract class PolyglotException extends RuntimeException {

    // 🧩 Section: state
    private final ErrorKind kind;
    private final @Nullable String languageTag;
    private final String foreignMessage;
    private final List<StackFrame> foreignFrames;

    private volatile @Nullable String taskId;
    private volatile List<StackFrame> hostFrames = List.of();
    // [/🧩 Section: state]

    // 🧩 Section: construction
    protected PolyglotException(ErrorKind kind,
                                @Nullable String languageTag,
                                String message,
                                List<StackFrame> foreignFrames,
                                @Nullable Throwable cause) {
        super(decorate(languageTag, message), cause);
        if (kind == null) throw new IllegalArgumentException("kind cannot be null");
        this.kind = kind;
        this.languageTag = languageTag;
        this.foreignMessage = message == null ? "" : message;
        this.foreignFrames = foreignFrames == null ? List.of() : List.copyOf(foreignFrames);

        // 🧩 Point: construction/foreign-frames-first
        if (!this.foreignFrames.isEmpty()) {
            List<StackTraceElement> merged = new ArrayList<>();
            for (StackFrame f : this.foreignFrames) merged.add(f.toStackTraceElement());
            merged.addAll(List.of(getStackTrace()));
            setStackTrace(merged.toArray(new StackTraceElement[0]));
        }
    }

    protected PolyglotException(ErrorKind kind, @Nullable String languageTag, String message) {
        this(kind, languageTag, message, List.of(), null);
    }

    private static String decorate(@Nullable String languageTag, String message) {
        String body = message == null ? "" : message;
        return languageTag == null ? body : "[" + languageTag + "] " + body;
    }
    // [/🧩 Section: construction]

    // 🧩 Section: accessors
    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the host-visible error type name, e.g. {@code "RuntimeError"}
     */
    public String errorType() {
        return kind.typeName();
    }

    public @Nullable String languageTag() {
        return languageTag;
    }

    /**
     * @return the message as reported by the foreign side, without the language prefix
     */
    public String foreignMessage() {
        return foreignMessage;
    }

    public List<StackFrame> foreignFrames() {
        return foreignFrames;
    }

    public List<StackFrame> hostFrames() {
        return hostFrames;
    }

    public @Nullable String taskId() {
        return taskId;
    }
    // [/🧩 Section: accessors]

    // 🧩 Section: host-context

    /**
     * Attach the spawning task and the host frames captured when it was spawned.
     * Only the first call has an effect.
     *
     * @return this exception
     */
    public synchronized PolyglotException attachHostContext(String taskId, List<StackFrame> frames) {
        if (this.taskId == null && taskId != null) {
            this.taskId = taskId;
            this.hostFrames = frames == null ? List.of() : List.copyOf(frames);
        }
        return this;
    }

    /**
     * Foreign frames, then one boundary frame naming the task, then the host frames.
     */
    public List<StackFrame> unifiedTrace() {
        List<StackFrame> out = new ArrayList<>(foreignFrames);
        String id = taskId;
        if (id != null) {
            out.add(StackFrame.host("<polyglot block " + id + ">", "<boundary>", 0));
        }
        out.addAll(hostFrames);
        return out;
    }

    /**
     * Render {@link #unifiedTrace()} under a header line carrying the error type and message.
     */
    public String formatUnifiedTrace() {
        StringBuilder sb = new StringBuilder(errorType()).append(": ").append(getMessage());
        for (StackFrame f : unifiedTrace()) {
            sb.append('\n').append(f);
        }
        return sb.toString();
    }
    // [/🧩 Section: host-context]
}
