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

package io.devsquad.agents;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.devsquad.core.capabilities.Capability;
import io.devsquad.core.model.AgentRole;
import io.devsquad.core.response.ResponseTopic;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the built-in profiles
 */
class AgentProfilesTest {
    private static final Map<AgentRole, List<String>> EXPECTED_TOOLS = Map.of(
            AgentRole.FRONTEND, List.of("create_react_component", "implement_ui", "optimize_performance"),
            AgentRole.BACKEND, List.of("create_api_endpoint", "design_database", "implement_auth"),
            AgentRole.SECURITY, List.of("security_audit", "vulnerability_scan", "security_recommendations"),
            AgentRole.DEVOPS, List.of("create_ci_pipeline", "containerize_app", "setup_infrastructure"),
            AgentRole.DATASCIENCE, List.of("analyze_data", "create_ml_model", "data_visualization"));

    private static final Set<String> ARTIFACT_FIELDS = Set.of(
            "code", "implementation", "schema", "findings", "vulnerabilities", "recommendations", "config",
            "analysis");

    @ParameterizedTest
    @EnumSource(AgentRole.class)
    void testRegistryIsComplete(AgentRole role) {
        final var profile = AgentProfiles.forRole(role);
        final var identity = profile.identity();
        assertEquals(role, identity.getRole());
        assertEquals("ai_" + role.getValue() + "_001", identity.getId());
        assertFalse(profile.roleDescription().isBlank());

        final var capabilities = profile.capabilities().capabilities();
        assertEquals(EXPECTED_TOOLS.get(role), capabilities.stream().map(Capability::getName).toList());
        capabilities.forEach(capability -> {
            assertFalse(capability.getDescription().isBlank());
            assertEquals("object", capability.getInputSchema().get("type").asText());
        });
    }

    @ParameterizedTest
    @EnumSource(AgentRole.class)
    void testEveryToolReturnsItsArtifact(AgentRole role) {
        final var registry = AgentProfiles.forRole(role).capabilities();
        for (final var capability : registry.capabilities()) {
            final var name = capability.getName();
            final var arguments = JsonNodeFactory.instance.objectNode().put("code", "eval(input)");
            final var registered = registry.find(name).orElseThrow();
            final var prompt = registered.getPrompter().prompt(name, arguments);
            assertFalse(prompt.getText().isBlank(), name);
            assertFalse(prompt.getContext().isBlank(), name);

            final var result = registered.getExecutor().execute(name, arguments, "suggested text");
            assertTrue(result.isSuccess(), name);
            assertFalse(result.getResult().isBlank(), name);
            final var artifacts = result.getDetails()
                    .entrySet()
                    .stream()
                    .filter(entry -> ARTIFACT_FIELDS.contains(entry.getKey()))
                    .toList();
            assertEquals(1, artifacts.size(), name);
            assertEquals("suggested text", artifacts.get(0).getValue(), name);
        }
    }

    @ParameterizedTest
    @EnumSource(AgentRole.class)
    void testFallbackCoversEveryTopic(AgentRole role) {
        final var profile = AgentProfiles.forRole(role);
        final var answers = profile.fallbackAnswers();
        for (final var topic : ResponseTopic.values()) {
            assertFalse(answers.getOrDefault(topic, "").isBlank(), role + "/" + topic);
        }
        assertEquals(answers.get(ResponseTopic.AUTH), profile.fallbackProvider().getResponse("login page", ""));
    }

    @Test
    void testBackendDefaults() {
        final var registry = AgentProfiles.forRole(AgentRole.BACKEND).capabilities();
        final var endpoint = registry.find("create_api_endpoint").orElseThrow();
        final var empty = JsonNodeFactory.instance.objectNode();
        assertEquals("Create a GET API endpoint at /api/endpoint that ",
                     endpoint.getPrompter().prompt("create_api_endpoint", empty).getText());
        final var result = endpoint.getExecutor().execute("create_api_endpoint", empty, "code");
        assertEquals("Created GET endpoint at /api/endpoint", result.getResult());
        assertEquals(Boolean.TRUE, result.getDetails().get("ai_generated"));

        final var schema = registry.find("design_database").orElseThrow();
        final var entities = JsonNodeFactory.instance.objectNode();
        entities.putArray("entities").add("user").add("order");
        assertTrue(schema.getPrompter()
                           .prompt("design_database", entities)
                           .getText()
                           .startsWith("Design a database schema for these entities: user, order"));
    }

    @Test
    void testVulnerabilityScanNeedsCode() {
        final var scan = AgentProfiles.forRole(AgentRole.SECURITY)
                .capabilities()
                .find("vulnerability_scan")
                .orElseThrow();
        final var empty = JsonNodeFactory.instance.objectNode();
        assertThrows(IllegalArgumentException.class, () -> scan.getPrompter().prompt("vulnerability_scan", empty));
        final var longCode = JsonNodeFactory.instance.objectNode().put("code", "x".repeat(2000));
        final var prompt = scan.getPrompter().prompt("vulnerability_scan", longCode).getText();
        assertEquals("Analyze this code for security vulnerabilities: ".length() + 500, prompt.length());
    }

    @Test
    void testRoleNames() {
        assertEquals(AgentRole.DATASCIENCE, AgentProfiles.forRole("datascience").identity().getRole());
        assertThrows(IllegalArgumentException.class, () -> AgentProfiles.forRole("designer"));
        assertEquals("frontend, backend, security, devops, datascience", AgentProfiles.knownRoles());
    }
}
