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

package io.devsquad.core.capabilities;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds the JSON schema of a capability input. Only flat objects are needed by the agents.
 */
public class InputSchemas {
    private final ObjectNode properties = JsonNodeFactory.instance.objectNode();
    private final Set<String> required = new LinkedHashSet<>();

    private InputSchemas() {
    }

    public static InputSchemas object() {
        return new InputSchemas();
    }

    public InputSchemas string(final String name, final String description) {
        return property(name, "string", description);
    }

    public InputSchemas array(final String name, final String description) {
        properties.putObject(name)
                .put("type", "array")
                .put("description", description)
                .putObject("items")
                .put("type", "string");
        return this;
    }

    public InputSchemas property(final String name, final String type, final String description) {
        properties.putObject(name)
                .put("type", type)
                .put("description", description);
        return this;
    }

    public InputSchemas required(final String... names) {
        required.addAll(Arrays.asList(names));
        return this;
    }

    public ObjectNode build() {
        final var schema = JsonNodeFactory.instance.objectNode()
                .put("type", "object");
        schema.set("properties", properties.deepCopy());
        if (!required.isEmpty()) {
            final var requiredNode = schema.putArray("required");
            required.forEach(requiredNode::add);
        }
        return schema;
    }
}
