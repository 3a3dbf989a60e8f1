/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/DepthExceededException.java
 description: Nesting of a marshalled value exceeded the configured maximum depth.
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

package tech.robd.polyglot.error;

import org.jspecify.annotations.Nullable;

/**
 * Raised when list/dict nesting goes deeper than {@code maxFfiDepth}. The path names the
 * first container beyond the limit.
 */
public final class DepthExceededException extends ValidationException {

    private final int depth;
    private final int maxDepth;

    public DepthExceededException(@Nullable String languageTag, String path, int depth, int maxDepth) {
        super(languageTag, path, "collection nesting too deep: " + depth + " > " + maxDepth);
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
