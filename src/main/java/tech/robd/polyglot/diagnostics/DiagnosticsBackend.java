/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/diagnostics/DiagnosticsBackend.java
 description: SLF4J sink behind Diagnostics; one emit path for all levels, debug/info behind the
              naab.diag switch.
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

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;
import org.slf4j.spi.LocationAwareLogger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Where {@link Diagnostics} output ends up. Each owner class gets its SLF4J logger once; every
 * level goes through {@link #emit}. A {@link Throwable} passed as the last argument with no
 * placeholder left for it is logged as the cause, stack trace included.
 * <p>
 * Runtime tracing (debug and info) starts from {@code -Dnaab.diag=true} and can be flipped
 * with {@link #enable()} / {@link #disable()}. Boundary warnings and errors are never gated.
 */
final class DiagnosticsBackend {

    // 🧩 Section: state
    static final String DIAGNOSTICS_PROPERTY_NAME = "naab.diag";

    // location-aware loggers report the caller of Diagnostics, not this class
    private static final String CALLER_BOUNDARY = DiagnosticsBackend.class.getName();

    private static final Map<Class<?>, Logger> BY_OWNER = new ConcurrentHashMap<>();

    private static volatile boolean tracing = Boolean.parseBoolean(
            System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: state]

    private DiagnosticsBackend() {
    }

    static void enable() {
        tracing = true;
    }

    static void disable() {
        tracing = false;
    }

    static boolean isEnabled() {
        return tracing;
    }

    // 🧩 Section: levels
    static void debug(Class<?> owner, String msg, Object... args) {
        if (tracing) emit(owner, Level.DEBUG, msg, args);
    }

    static void info(Class<?> owner, String msg, Object... args) {
        if (tracing) emit(owner, Level.INFO, msg, args);
    }

    static void warn(Class<?> owner, String msg, Object... args) {
        emit(owner, Level.WARN, msg, args);
    }

    static void error(Class<?> owner, String msg, Object... args) {
        emit(owner, Level.ERROR, msg, args);
    }
    // [/🧩 Section: levels]

    // 🧩 Section: emit
    private static void emit(Class<?> owner, Level level, String msg, Object @Nullable [] args) {
        Logger target = BY_OWNER.computeIfAbsent(owner, LoggerFactory::getLogger);
        if (!target.isEnabledForLevel(level)) return;

        Throwable cause = MessageFormatter.getThrowableCandidate(args);
        Object[] params = cause == null ? args : MessageFormatter.trimmedCopy(args);

        if (target instanceof LocationAwareLogger located) {
            located.log(null, CALLER_BOUNDARY, level.toInt(), msg, params, cause);
        } else {
            target.atLevel(level).setCause(cause).log(msg, params);
        }
    }
    // [/🧩 Section: emit]
}
