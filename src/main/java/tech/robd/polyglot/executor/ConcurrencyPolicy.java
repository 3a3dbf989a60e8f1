/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/ConcurrencyPolicy.java
 description: How many blocks of one language may run at the same time.
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

/**
 * {@code maxActive == 0} means unbounded.
 */
public record ConcurrencyPolicy(int maxActive) {

    private static final ConcurrencyPolicy PARALLEL = new ConcurrencyPolicy(0);
    private static final ConcurrencyPolicy SERIALIZED = new ConcurrencyPolicy(1);

    public ConcurrencyPolicy {
        if (maxActive < 0) throw new IllegalArgumentException("maxActive cannot be negative: " + maxActive);
    }

    public static ConcurrencyPolicy parallel() {
        return PARALLEL;
    }

    /**
     * One block at a time, for engines with a global interpreter lock or a single context.
     */
    public static ConcurrencyPolicy serialized() {
        return SERIALIZED;
    }

    public static ConcurrencyPolicy bounded(int maxActive) {
        if (maxActive < 1) throw new IllegalArgumentException("maxActive must be at least 1");
        return new ConcurrencyPolicy(maxActive);
    }

    public boolean isBounded() {
        return maxActive > 0;
    }
}
