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
import io.devsquad.core.errors.ErrorType;
import io.devsquad.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link CapabilityRegistry} and the shape of {@link CapabilityResult}
 */
class CapabilityRegistryTest {

    private static Capability capability(String name) {
        return Capability.builder()
                .name(name)
                .description("Test capability " + name)
                .inputSchema(InputSchemas.object()
                                     .string("target", "What to act on")
                                     .required("target")
                                     .build())
                .build();
    }

    @Test
    void testRegistrationOrderIsKept() {
        final var registry = CapabilityRegistry.builder()
                .register(capability("b"), (name, args, suggestion) -> CapabilityResult.success("b"))
                .register(capability("a"), (name, args, suggestion) -> CapabilityResult.success("a"))
                .register(capability("c"), (name, args, suggestion) -> CapabilityResult.success("c"))
                .build();
        assertEquals(3, registry.size());
        assertEquals(List.of("b", "a", "c"),
                     registry.capabilities().stream().map(Capability::getName).toList());
        assertTrue(registry.contains("a"));
        assertFalse(registry.contains("d"));
        assertTrue(registry.find(null).isEmpty());
    }

    @Test
    void testDuplicateNameIsRejected() {
        final var builder = CapabilityRegistry.builder()
                .register(capability("a"), (name, args, suggestion) -> CapabilityResult.success("a"));
        final var duplicate = capability("a");
        final CapabilityExecutor executor = (name, args, suggestion) -> CapabilityResult.success("again");
        assertThrows(IllegalArgumentException.class, () -> builder.register(duplicate, executor));
    }

    @Test
    void testExecutePassesSuggestion() {
        final var registry = CapabilityRegistry.builder()
                .register(capability("echo"), (name, args, suggestion) -> CapabilityResult.success(
                        name + ":" + suggestion))
                .build();
        final var result = registry.execute("echo", JsonNodeFactory.instance.objectNode(), "hello");
        assertTrue(result.isSuccess());
        assertEquals("echo:hello", result.getResult());
        final var arguments = JsonNodeFactory.instance.objectNode();
        assertThrows(IllegalArgumentException.class, () -> registry.execute("missing", arguments, ""));
    }

    @Test
    @SneakyThrows
    void testResultSerializesFlat() {
        final var mapper = JsonUtils.createMapper();
        final var success = mapper.readTree(mapper.writeValueAsString(
                CapabilityResult.success("Created GET endpoint at /x", "code", "app.get('/x')")));
        assertTrue(success.get("success").asBoolean());
        assertEquals("Created GET endpoint at /x", success.get("result").asText());
        assertEquals("app.get('/x')", success.get("code").asText());
        assertFalse(success.has("error"));
        assertFalse(success.has("details"));

        final var failure = mapper.readTree(mapper.writeValueAsString(CapabilityResult.error(ErrorType.UNKNOWN_TOOL)));
        assertFalse(failure.get("success").asBoolean());
        assertEquals("Unknown tool", failure.get("error").asText());
        assertFalse(failure.has("result"));
    }

    @Test
    void testInputSchemaShape() {
        final var schema = InputSchemas.object()
                .string("path", "Endpoint path")
                .array("entities", "Entities")
                .required("path", "entities")
                .build();
        assertEquals("object", schema.get("type").asText());
        assertEquals("string", schema.at("/properties/path/type").asText());
        assertEquals("array", schema.at("/properties/entities/type").asText());
        assertEquals("path", schema.at("/required/0").asText());
        assertEquals("entities", schema.at("/required/1").asText());
    }
}
