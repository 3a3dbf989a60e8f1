/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/diagnostics/Diagnostics.java
 description: Lightweight diagnostics facade bound to an owner class. Debug/info are gated by
              the global switch, warn/error always reach SLF4J.
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

package tech.robd.polyglot.diagnostics;

/**
 * Minimal logging facade bound to an owning {@link Class}.
 * <p>
 * Instance methods forward to a static {@code DiagnosticsBackend}. {@link #of(Class)} hands
 * out a quiet instance (debug/info dropped) while tracing is globally disabled.
 * Warnings and errors are never gated: detached workers, discarded late results and
 * boundary violations must always be visible.
 */
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * @return the owner class associated with this diagnostics instance
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    /**
     * Emit a debug message (dropped unless diagnostics are enabled).
     *
     * @param msg  SLF4J-style message pattern
     * @param args arguments to format into {@code msg}
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    /**
     * Emit an info message (dropped unless diagnostics are enabled).
     */
    default void info(String msg, Object... args) {
        DiagnosticsBackend.info(owner(), msg, args);
    }

    /**
     * Emit a warning. Always forwarded.
     */
    default void warn(String msg, Object... args) {
        DiagnosticsBackend.warn(owner(), msg, args);
    }

    /**
     * Emit an error. Always forwarded.
     */
    default void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Create a diagnostics instance for {@code owner}. If tracing is globally disabled the
     * returned instance skips debug/info without touching the backend.
     *
     * @param owner the owning class (non-null)
     * @return active or quiet diagnostics depending on backend state
     */
    static Diagnostics of(Class<?> owner) {
        if (owner == null) throw new IllegalArgumentException("owner cannot be null");
        return DiagnosticsBackend.isEnabled() ? new ActiveD(owner) : new QuietD(owner);
    }

    /**
     * Turn debug/info tracing on for instances created by {@link #of(Class)} after this call.
     * Quiet instances created earlier stay quiet.
     */
    static void enable() {
        DiagnosticsBackend.enable();
    }

    /**
     * Turn debug/info tracing off.
     */
    static void disable() {
        DiagnosticsBackend.disable();
    }

    /**
     * @return whether debug/info tracing is on
     */
    static boolean isEnabled() {
        return DiagnosticsBackend.isEnabled();
    }
    // [/🧩 Section: factories]
}
