/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/boundary/HostStackTracer.java
 description: Thread-local stack of host call frames, snapshotted at spawn for unified traces.
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

package tech.robd.polyglot.boundary;

import org.jspecify.annotations.Nullable;
import tech.robd.polyglot.error.StackFrame;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Host call stack as the evaluator sees it. The evaluator enters a frame per host function
 * call; the scheduler takes a {@link #snapshot()} when a block is spawned so that a foreign
 * failure surfacing later on another thread can still show where the block came from.
 *
 * <pre>{@code
 * try (var frame = HostStackTracer.enter("main", "app.naab", 12)) {
 *     runtime.spawn(block, args);
 * }
 * }</pre>
 */
public final class HostStackTracer {

    private static final int MAX_FRAMES = 256;

    private static final ThreadLocal<Deque<StackFrame>> STACK = ThreadLocal.withInitial(ArrayDeque::new);

    private HostStackTracer() {
        // no instances
    }

    /**
     * Scoped frame; closing pops it.
     */
    public static final class Frame implements AutoCloseable {
        private final StackFrame frame;
        private boolean closed;

        private Frame(StackFrame frame) {
            this.frame = frame;
        }

        public StackFrame frame() {
            return frame;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            Deque<StackFrame> stack = STACK.get();
            // pop up to and including our frame; tolerates frames left open by inner code
            while (!stack.isEmpty()) {
                if (stack.pop() == frame) break;
            }
            if (stack.isEmpty()) STACK.remove();
        }
    }

    public static Frame enter(String function, @Nullable String file, int line) {
        StackFrame f = StackFrame.host(function, file, line);
        Deque<StackFrame> stack = STACK.get();
        if (stack.size() >= MAX_FRAMES) stack.removeLast();
        stack.push(f);
        return new Frame(f);
    }

    /**
     * @return current frames, innermost first
     */
    public static List<StackFrame> snapshot() {
        Deque<StackFrame> stack = STACK.get();
        if (stack.isEmpty()) {
            STACK.remove();
            return List.of();
        }
        List<StackFrame> out = new ArrayList<>(stack.size());
        for (Iterator<StackFrame> it = stack.iterator(); it.hasNext(); ) out.add(it.next());
        return List.copyOf(out);
    }

    public static int depth() {
        return STACK.get().size();
    }
}
