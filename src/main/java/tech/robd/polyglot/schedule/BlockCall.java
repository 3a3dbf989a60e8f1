/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/BlockCall.java
 description: A block paired with its argument values, for batch spawning.
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

package tech.robd.polyglot.schedule;

import tech.robd.polyglot.PolyglotBlock;
import tech.robd.polyglot.value.Value;

import java.util.List;

public record BlockCall(PolyglotBlock block, List<Value> arguments) {

    public BlockCall {
        if (block == null) throw new IllegalArgumentException("block cannot be null");
        if (arguments == null) throw new IllegalArgumentException("arguments cannot be null");
    }

    public static BlockCall of(PolyglotBlock block, Value... arguments) {
        return new BlockCall(block, List.of(arguments));
    }
}
