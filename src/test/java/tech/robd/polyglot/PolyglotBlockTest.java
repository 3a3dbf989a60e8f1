/*
 [File Info]
 path: src/test/java/tech/robd/polyglot/PolyglotBlockTest.java
 description: Block construction rules: bound variable names and timeouts.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PolyglotBlockTest {

    @Test
    void boundNamesAreCopiedAndChecked() {
        List<String> names = new ArrayList<>(List.of("a", "b_2"));
        PolyglotBlock b = new PolyglotBlock("python", "a + b_2", names);
        names.add("c");
        assertEquals(List.of("a", "b_2"), b.boundVariableNames());

        assertThrows(IllegalArgumentException.class, () -> new PolyglotBlock("python", "x", List.of("not valid")));
        assertThrows(IllegalArgumentException.class, () -> new PolyglotBlock("python", "x", List.of("a", "a")));
        assertThrows(IllegalArgumentException.class, () -> new PolyglotBlock(" ", "x"));
    }

    @Test
    void timeoutIsOptionalButPositive() {
        PolyglotBlock b = new PolyglotBlock("python", "1");
        assertNull(b.timeout());
        assertEquals(Duration.ofSeconds(2), b.withTimeout(Duration.ofSeconds(2)).timeout());
        assertThrows(IllegalArgumentException.class, () -> b.withTimeout(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> b.withTimeout(Duration.ZERO));
    }
}
