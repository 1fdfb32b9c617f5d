/*
 * Copyright (c) 2025 DevSquad Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.devsquad.core.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Mapper creation and small helpers to read loosely shaped JSON frames
 */
@UtilityClass
public class JsonUtils {

    public static JsonMapper createMapper() {
        final var mapper = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
        mapper.findAndRegisterModules()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Returns the first non-null, non-json-null child of the node among the given field names.
     *
     * @param node   Node to look into. Can be null.
     * @param fields Candidate field names, in order of preference
     * @return The child node if found
     */
    public static Optional<JsonNode> field(final JsonNode node, final String... fields) {
        if (null == node || !node.isObject()) {
            return Optional.empty();
        }
        for (final var field : fields) {
            final var child = node.get(field);
            if (null != child && !child.isNull() && !child.isMissingNode()) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> text(final JsonNode node, final String... fields) {
        return field(node, fields)
                .filter(JsonNode::isValueNode)
                .map(JsonNode::asText);
    }

    /**
     * An empty object node, used where a frame carries no params at all.
     */
    public static ObjectNode emptyObject(final ObjectMapper mapper) {
        return Objects.requireNonNull(mapper).createObjectNode();
    }
}
