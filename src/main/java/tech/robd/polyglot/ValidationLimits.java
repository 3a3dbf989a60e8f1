/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/ValidationLimits.java
 description: Immutable process-wide limits for the language boundary and task deadlines, loaded
              from defaults, an optional classpath properties file and system properties.
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

package tech.robd.polyglot;

import tech.robd.polyglot.diagnostics.Diagnostics;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Limits enforced on every value crossing the language boundary, and the default task deadline.
 *
 * <p>Built once at startup and then only read. {@link #load()} layers, lowest precedence first:
 * built-in defaults, classpath resource {@value #RESOURCE_NAME}, system properties.</p>
 *
 * @param maxFfiStringBytes      largest single string, in UTF-8 bytes
 * @param maxFfiDepth            deepest list/dict nesting
 * @param maxFfiPayloadBytes     largest estimated serialised size of one argument list or return value
 * @param maxFfiArguments        most arguments one block or callback may receive
 * @param defaultTaskTimeout     deadline for blocks without their own timeout annotation
 * @param maxCapturedOutputBytes cap on captured subprocess stdout/stderr, each
 */
public record ValidationLimits(long maxFfiStringBytes,
                               int maxFfiDepth,
                               long maxFfiPayloadBytes,
                               int maxFfiArguments,
                               Duration defaultTaskTimeout,
                               long maxCapturedOutputBytes) {

    // 🧩 Section: constants
    public static final String RESOURCE_NAME = "naab.properties";

    public static final String PREFIX = "naab.";
    public static final String KEY_MAX_STRING_BYTES = PREFIX + "maxFfiStringBytes";
    public static final String KEY_MAX_DEPTH = PREFIX + "maxFfiDepth";
    public static final String KEY_MAX_PAYLOAD_BYTES = PREFIX + "maxFfiPayloadBytes";
    public static final String KEY_MAX_ARGUMENTS = PREFIX + "maxFfiArguments";
    public static final String KEY_DEFAULT_TIMEOUT = PREFIX + "defaultTaskTimeout";
    public static final String KEY_MAX_CAPTURED_OUTPUT = PREFIX + "maxCapturedOutputBytes";

    public static final long DEFAULT_MAX_PAYLOAD_BYTES = 10L * 1024 * 1024;
    public static final long DEFAULT_MAX_STRING_BYTES = DEFAULT_MAX_PAYLOAD_BYTES;
    public static final int DEFAULT_MAX_DEPTH = 100;
    public static final int DEFAULT_MAX_ARGUMENTS = 1000;
    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(30);
    // [/🧩 Section: constants]

    private static final Diagnostics DIAG = Diagnostics.of(ValidationLimits.class);

    public ValidationLimits {
        if (maxFfiStringBytes <= 0) throw new IllegalArgumentException("maxFfiStringBytes must be positive");
        if (maxFfiDepth <= 0) throw new IllegalArgumentException("maxFfiDepth must be positive");
        if (maxFfiPayloadBytes <= 0) throw new IllegalArgumentException("maxFfiPayloadBytes must be positive");
        if (maxFfiArguments <= 0) throw new IllegalArgumentException("maxFfiArguments must be positive");
        if (defaultTaskTimeout == null || defaultTaskTimeout.isNegative() || defaultTaskTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTaskTimeout must be positive");
        }
        if (maxCapturedOutputBytes <= 0) throw new IllegalArgumentException("maxCapturedOutputBytes must be positive");
    }

    // 🧩 Section: factories
    public static ValidationLimits defaults() {
        return new ValidationLimits(DEFAULT_MAX_STRING_BYTES, DEFAULT_MAX_DEPTH, DEFAULT_MAX_PAYLOAD_BYTES,
                DEFAULT_MAX_ARGUMENTS, DEFAULT_TASK_TIMEOUT, DEFAULT_MAX_PAYLOAD_BYTES);
    }

    /**
     * Defaults, then {@value #RESOURCE_NAME} from the classpath if present, then system properties.
     */
    public static ValidationLimits load() {
        Properties merged = new Properties();
        ClassLoader cl = ValidationLimits.class.getClassLoader();
        try (InputStream in = cl == null ? null : cl.getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                merged.load(in);
                DIAG.debug("limits: loaded {} from classpath", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE_NAME, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) merged.setProperty(key, System.getProperty(key));
        }
        return fromProperties(merged, defaults());
    }

    /**
     * Overlay the recognised keys of {@code props} on {@code base}. Unknown keys are ignored.
     *
     * @throws IllegalArgumentException naming the key when a value does not parse
     */
    public static ValidationLimits fromProperties(Properties props, ValidationLimits base) {
        if (props == null) throw new IllegalArgumentException("props cannot be null");
        if (base == null) throw new IllegalArgumentException("base cannot be null");
        return new ValidationLimits(
                longProp(props, KEY_MAX_STRING_BYTES, base.maxFfiStringBytes),
                intProp(props, KEY_MAX_DEPTH, base.maxFfiDepth),
                longProp(props, KEY_MAX_PAYLOAD_BYTES, base.maxFfiPayloadBytes),
                intProp(props, KEY_MAX_ARGUMENTS, base.maxFfiArguments),
                durationProp(props, KEY_DEFAULT_TIMEOUT, base.defaultTaskTimeout),
                longProp(props, KEY_MAX_CAPTURED_OUTPUT, base.maxCapturedOutputBytes));
    }
    // [/🧩 Section: factories]

    // 🧩 Section: withers
    public ValidationLimits withMaxFfiPayloadBytes(long bytes) {
        return new ValidationLimits(maxFfiStringBytes, maxFfiDepth, bytes, maxFfiArguments, defaultTaskTimeout, maxCapturedOutputBytes);
    }

    public ValidationLimits withMaxFfiStringBytes(long bytes) {
        return new ValidationLimits(bytes, maxFfiDepth, maxFfiPayloadBytes, maxFfiArguments, defaultTaskTimeout, maxCapturedOutputBytes);
    }

    public ValidationLimits withMaxFfiDepth(int depth) {
        return new ValidationLimits(maxFfiStringBytes, depth, maxFfiPayloadBytes, maxFfiArguments, defaultTaskTimeout, maxCapturedOutputBytes);
    }

    public ValidationLimits withMaxFfiArguments(int count) {
        return new ValidationLimits(maxFfiStringBytes, maxFfiDepth, maxFfiPayloadBytes, count, defaultTaskTimeout, maxCapturedOutputBytes);
    }

    public ValidationLimits withDefaultTaskTimeout(Duration timeout) {
        return new ValidationLimits(maxFfiStringBytes, maxFfiDepth, maxFfiPayloadBytes, maxFfiArguments, timeout, maxCapturedOutputBytes);
    }

    public ValidationLimits withMaxCapturedOutputBytes(long bytes) {
        return new ValidationLimits(maxFfiStringBytes, maxFfiDepth, maxFfiPayloadBytes, maxFfiArguments, defaultTaskTimeout, bytes);
    }
    // [/🧩 Section: withers]

    // 🧩 Section: parsing
    private static long longProp(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Long.parseLong(raw.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }

    private static int intProp(Properties props, String key, int fallback) {
        long n = longProp(props, key, fallback);
        if (n < Integer.MIN_VALUE || n > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Value for " + key + " out of int range: " + n);
        }
        return (int) n;
    }

    /**
     * Accepts ISO-8601 ({@code PT5S}) or plain milliseconds ({@code 5000}).
     */
    private static Duration durationProp(Properties props, String key, Duration fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        String s = raw.trim();
        try {
            if (s.startsWith("P") || s.startsWith("p")) return Duration.parse(s);
            return Duration.ofMillis(Long.parseLong(s));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": '" + raw + "'", e);
        }
    }
    // [/🧩 Section: parsing]
}
