/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/NeverCancelledToken.java
 description: Singleton CancellationToken that is permanently not cancelled.
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

/**
 * Token for code paths that need one but can never be interrupted, such as running an
 * executor directly in a test. Callbacks are dropped, {@link #child()} returns itself and
 * {@link #cancel()} is refused.
 */
final class NeverCancelledToken implements CancellationToken {

    static final NeverCancelledToken INSTANCE = new NeverCancelledToken();

    private NeverCancelledToken() {
    }

    @Override
    public boolean isCancelled() {
        return false;
    }

    @Override
    public AutoCloseable onCancel(Runnable callback) {
        return () -> {
        };
    }

    @Override
    public CancellationToken child() {
        return this;
    }

    @Override
    public boolean cancel() {
        return false;
    }

    @Override
    public String toString() {
        return "CancellationToken[NEVER]";
    }
}
