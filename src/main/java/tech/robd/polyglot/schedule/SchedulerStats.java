/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/schedule/SchedulerStats.java
 description: Point-in-time counters of the execution scheduler.
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

/**
 * @param spawned  tasks accepted by spawn
 * @param resolved tasks that produced a value
 * @param rejected tasks that produced an error, timeouts included
 * @param timedOut tasks rejected by their deadline
 * @param detached timed-out tasks whose worker could not be interrupted
 * @param active   tasks spawned but not yet finished on a worker
 */
public record SchedulerStats(long spawned, long resolved, long rejected, long timedOut, long detached, long active) {
}
