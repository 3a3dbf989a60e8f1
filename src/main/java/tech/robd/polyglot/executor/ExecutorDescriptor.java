/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/ExecutorDescriptor.java
 description: Registration entry: canonical tag, factory and concurrency policy.
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

public record ExecutorDescriptor(String languageTag, ExecutorFactory factory, ConcurrencyPolicy policy) {

    public ExecutorDescriptor {
        if (languageTag == null || languageTag.isBlank()) {
            throw new IllegalArgumentException("languageTag cannot be null or blank");
        }
        if (factory == null) throw new IllegalArgumentException("factory cannot be null");
        if (policy == null) throw new IllegalArgumentException("policy cannot be null");
    }
}
