/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/ExecutionRequest.java
 description: One block run as seen by an executor: task id, tag, block and concrete arguments.
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

import tech.robd.polyglot.PolyglotBlock;
import tech.robd.polyglot.value.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ExecutionRequest(String taskId, String languageTag, PolyglotBlock block, List<Value> arguments) {

    public ExecutionRequest {
        if (taskId == null) throw new IllegalArgumentException("taskId cannot be null");
        if (languageTag == null) throw new IllegalArgumentException("languageTag cannot be null");
        if (block == null) throw new IllegalArgumentException("block cannot be null");
        arguments = List.copyOf(arguments);
        if (arguments.size() != block.boundVariableNames().size()) {
            throw new IllegalArgumentException("expected " + block.boundVariableNames().size()
                    + " arguments, got " + arguments.size());
        }
    }

    /**
     * @return bound variable name to argument, in declaration order
     */
    public Map<String, Value> bindings() {
        Map<String, Value> out = new LinkedHashMap<>();
        List<String> names = block.boundVariableNames();
        for (int i = 0; i < names.size(); i++) out.put(names.get(i), arguments.get(i));
        return out;
    }

    public String source() {
        return block.sourceText();
    }
}
