/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/diagnostics/AuditLog.java
 description: Always-on audit trail for block executions and boundary security violations.
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

package tech.robd.polyglot.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit events, written to the SLF4J logger {@value #LOGGER_NAME} independently of the
 * {@link Diagnostics} tracing switch. Route that logger to a dedicated appender to keep
 * an execution trail.
 */
public final class AuditLog {

    public static final String LOGGER_NAME = "tech.robd.polyglot.audit";

    private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

    private AuditLog() {
        // no instances
    }

    /**
     * Record that a block is about to be handed to a foreign runtime.
     */
    public static void blockExecute(String taskId, String languageTag, int sourceLength, int argumentCount) {
        if (AUDIT.isInfoEnabled()) {
            AUDIT.info("BLOCK_EXECUTE task={} lang={} sourceChars={} args={}",
                    taskId, languageTag, sourceLength, argumentCount);
        }
    }

    /**
     * Record a value or callback rejected at the language boundary.
     */
    public static void securityViolation(String languageTag, String category, String detail) {
        AUDIT.warn("SECURITY_VIOLATION lang={} category={} detail={}", languageTag, category, detail);
    }

    /**
     * Record a task that outlived its deadline.
     */
    public static void timeout(String taskId, String languageTag, long budgetMillis, boolean detached) {
        AUDIT.warn("TIMEOUT task={} lang={} budgetMs={} detached={}", taskId, languageTag, budgetMillis, detached);
    }
}
