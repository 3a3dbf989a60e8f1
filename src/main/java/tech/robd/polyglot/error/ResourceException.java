/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/ResourceException.java
 description: An executor or foreign process could not be created or ran out of resources.
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

public final class ResourceException extends PolyglotException {

    public ResourceException(@Nullable String languageTag, String message, @Nullable Throwable cause) {
        super(ErrorKind.RESOURCE, languageTag, message, java.util.List.of(), cause);
    }

    public ResourceException(@Nullable String languageTag, String message) {
        this(languageTag, message, null);
    }
}
