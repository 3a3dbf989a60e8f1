/*
 [File Info]
 path: src/main/java/tech/robd/polyglot/marshal/JsonWire.java
 description: Jackson-based JSON codec for the foreign representation, used by subprocess executors.
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

package tech.robd.polyglot.marshal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON text &lt;-&gt; foreign representation tree.
 *
 * <p>Decoding accepts {@code NaN} and {@code Infinity} tokens (Python's {@code json.dumps}
 * emits them) so that {@link ValueMarshaller} can reject them with a proper path instead of
 * a parse error.</p>
 */
public final class JsonWire {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private JsonWire() {
        // no instances
    }

    public static String encode(@Nullable Object repr) throws JsonProcessingException {
        return MAPPER.writeValueAsString(repr);
    }

    public static @Nullable Object decode(String json) throws JsonProcessingException {
        return toRepr(MAPPER.readTree(json));
    }

    /**
     * @return the JSON tree as plain objects; integral numbers that fit become {@link Long}
     */
    static @Nullable Object toRepr(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) return node.textValue();
        if (node.isArray()) {
            List<@Nullable Object> out = new ArrayList<>(node.size());
            for (JsonNode item : node) out.add(toRepr(item));
            return out;
        }
        if (node.isObject()) {
            Map<String, @Nullable Object> out = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.put(e.getKey(), toRepr(e.getValue()));
            }
            return out;
        }
        return node.asText();
    }
}
