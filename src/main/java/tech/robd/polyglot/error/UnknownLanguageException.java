/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/error/UnknownLanguageException.java
 description: No executor is registered for a block's language tag.
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

import java.util.Collection;
import java.util.List;

public final class UnknownLanguageException extends PolyglotException {

    private final List<String> supported;

    public UnknownLanguageException(String languageTag, Collection<String> supported) {
        super(ErrorKind.UNKNOWN_LANGUAGE, languageTag,
                "no executor registered for language '" + languageTag + "' (supported: " + supported + ")");
        this.supported = List.copyOf(supported);
    }

    public List<String> supportedLanguages() {
        return supported;
    }
}
