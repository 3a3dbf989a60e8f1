/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/PolyglotBlock.java
 description: Immutable parsed polyglot block: language tag, source text, bound variable names
              and optional timeout annotation.
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

package tech.robd.polyglot;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A block of foreign source as handed over by the parser.
 *
 * @param languageTag        registry key, e.g. {@code python}, {@code js}, {@code shell}
 * @param sourceText         the foreign source, verbatim
 * @param boundVariableNames host variables the block reads, in argument order
 * @param timeout            per-block deadline, or {@code null} for the runtime default
 */
public record PolyglotBlock(String languageTag,
                           String sourceText,
                           List<String> boundVariableNames,
                           @Nullable Duration timeout) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public PolyglotBlock {
        if (languageTag == null || languageTag.isBlank()) throw new IllegalArgumentException("languageTag cannot be empty");
        if (sourceText == null) throw new IllegalArgumentException("sourceText cannot be null");
        if (boundVariableNames == null) throw new IllegalArgumentException("boundVariableNames cannot be null");
        boundVariableNames = List.copyOf(boundVariableNames);
        for (String name : boundVariableNames) {
            if (!IDENTIFIER.matcher(name).matches()) {
                throw new IllegalArgumentException("invalid bound variable name '" + name + "'");
            }
        }
        if (boundVariableNames.stream().distinct().count() != boundVariableNames.size()) {
            throw new IllegalArgumentException("duplicate bound variable names: " + boundVariableNames);
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public PolyglotBlock(String languageTag, String sourceText, List<String> boundVariableNames) {
        this(languageTag, sourceText, boundVariableNames, null);
    }

    public PolyglotBlock(String languageTag, String sourceText) {
        this(languageTag, sourceText, List.of(), null);
    }

    public PolyglotBlock withTimeout(Duration newTimeout) {
        return new PolyglotBlock(languageTag, sourceText, boundVariableNames, newTimeout);
    }
}
