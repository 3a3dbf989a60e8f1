/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/executor/SourceText.java
 description: Source text helpers shared by executors (common-indent stripping).
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

/**
 * Blocks are usually written indented inside host code; indentation-sensitive languages need
 * it removed.
 */
public final class SourceText {

    private SourceText() {
    }

    /**
     * Remove the indentation common to all non-blank lines, and leading/trailing blank lines.
     * Tabs count as one column.
     */
    public static String dedent(String source) {
        if (source == null) throw new IllegalArgumentException("source cannot be null");
        String[] lines = source.replace("\r\n", "\n").split("\n", -1);
        int first = 0;
        int last = lines.length - 1;
        while (first <= last && lines[first].isBlank()) first++;
        while (last >= first && lines[last].isBlank()) last--;
        if (first > last) return "";

        int common = Integer.MAX_VALUE;
        for (int i = first; i <= last; i++) {
            String line = lines[i];
            if (line.isBlank()) continue;
            int n = 0;
            while (n < line.length() && (line.charAt(n) == ' ' || line.charAt(n) == '\t')) n++;
            common = Math.min(common, n);
        }

        StringBuilder sb = new StringBuilder();
        for (int i = first; i <= last; i++) {
            String line = lines[i];
            sb.append(line.length() >= common ? line.substring(common) : line.strip());
            if (i < last) sb.append('\n');
        }
        return sb.toString();
    }
}
