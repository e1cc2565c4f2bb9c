package me.golemcore.memory.adapter.outbound.storage;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.memory.domain.service.TopicNormalizer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code topics} whether it was stored as a JSON array, a comma
 * separated string or a stringified array.
 */
public class TopicListDeserializer extends JsonDeserializer<List<String>> {

    @Override
    public List<String> deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node == null || node.isNull()) {
            return TopicNormalizer.normalize(null);
        }
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(item -> {
                if (!item.isNull()) {
                    values.add(item.asText());
                }
            });
            return TopicNormalizer.normalize(values);
        }
        return TopicNormalizer.normalize(node.asText());
    }

    @Override
    public List<String> getNullValue(DeserializationContext context) {
        return TopicNormalizer.normalize(null);
    }
}
