/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/ExecutionTask.java
 description: Unit of scheduled work: block, argument snapshot, future, deadline and spawn-site host frames.
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
import tech.robd.polyglot.error.StackFrame;
import tech.robd.polyglot.schedule.internal.BlockFutureImpl;
import tech.robd.polyglot.value.Value;

import java.time.Duration;
import java.util.List;

/**
 * Created by {@link ExecutionScheduler#spawn}; immutable. {@code arguments} is the spawn-time
 * snapshot: the list and the lists and dicts inside it are copies detached from the host.
 *
 * @param deadlineNanos {@link System#nanoTime()} value after which the task is timed out
 */
public record ExecutionTask(String taskId,
                            String languageTag,
                            PolyglotBlock block,
                            List<Value> arguments,
                            BlockFutureImpl future,
                            Duration budget,
                            long deadlineNanos,
                            List<StackFrame> hostFrames) {

    public ExecutionTask {
        arguments = List.copyOf(arguments);
        hostFrames = List.copyOf(hostFrames);
    }
}
