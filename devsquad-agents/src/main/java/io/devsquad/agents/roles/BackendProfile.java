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

package io.devsquad.agents.roles;

import io.devsquad.agents.AgentProfile;
import io.devsquad.core.capabilities.Capability;
import io.devsquad.core.capabilities.CapabilityRegistry;
import io.devsquad.core.capabilities.CapabilityResult;
import io.devsquad.core.capabilities.InputSchemas;
import io.devsquad.core.capabilities.SuggestionPrompter.Prompt;
import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.model.AgentRole;
import io.devsquad.core.response.ResponseTopic;

import java.util.Map;

import static io.devsquad.agents.tools.ToolArguments.joined;
import static io.devsquad.agents.tools.ToolArguments.text;

/**
 * REST APIs, database schemas and authentication
 */
public class BackendProfile implements AgentProfile {
    private static final String DEFAULT_PATH = "/api/endpoint";
    private static final String DEFAULT_METHOD = "GET";
    private static final String DEFAULT_AUTH_TYPE = "JWT";

    @Override
    public AgentIdentity identity() {
        return AgentIdentity.builder()
                .id(AgentRole.BACKEND.defaultAgentId())
                .role(AgentRole.BACKEND)
                .displayName("AI Backend Developer")
                .build();
    }

    @Override
    public String roleDescription() {
        return "an expert backend developer specializing in REST APIs, databases, and scalable architecture";
    }

    @Override
    public Map<ResponseTopic, String> fallbackAnswers() {
        return Map.of(
                ResponseTopic.AUTH,
                "I'll create REST API endpoints for user registration, login, and JWT token management.",
                ResponseTopic.CATALOG,
                "I'll design the database schema and API endpoints for product management.",
                ResponseTopic.CART,
                "I'll implement cart persistence API with session management and order processing.",
                ResponseTopic.DEFAULT,
                "I'll help you build scalable REST APIs with proper authentication and database design.");
    }

    @Override
    public CapabilityRegistry capabilities() {
        return CapabilityRegistry.builder()
                .register(Capability.builder()
                                  .name("create_api_endpoint")
                                  .description("Create a REST API endpoint with AI-generated code")
                                  .inputSchema(InputSchemas.object()
                                                       .string("path", "Path of the endpoint")
                                                       .string("method", "HTTP method")
                                                       .string("functionality", "What the endpoint does")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Create a %s API endpoint at %s that %s",
                                                text(args, "method", DEFAULT_METHOD),
                                                text(args, "path", DEFAULT_PATH),
                                                text(args, "functionality")),
                                  "API endpoint generation"),
                          (name, args, suggestion) -> CapabilityResult.builder()
                                  .success(true)
                                  .result(String.format("Created %s endpoint at %s",
                                                        text(args, "method", DEFAULT_METHOD),
                                                        text(args, "path", DEFAULT_PATH)))
                                  .detail("code", suggestion)
                                  .detail("ai_generated", true)
                                  .build())
                .register(Capability.builder()
                                  .name("design_database")
                                  .description("Design database schema with AI")
                                  .inputSchema(InputSchemas.object()
                                                       .array("entities", "Entities to model")
                                                       .string("relationships", "How the entities relate")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Design a database schema for these entities: %s. Relationships: %s",
                                                joined(args, "entities"),
                                                text(args, "relationships", "infer from the entities")),
                                  "Database design"),
                          (name, args, suggestion) -> CapabilityResult.success("Database schema designed",
                                                                              "schema",
                                                                              suggestion))
                .register(Capability.builder()
                                  .name("implement_auth")
                                  .description("Implement authentication system")
                                  .inputSchema(InputSchemas.object()
                                                       .string("auth_type", "Authentication scheme, e.g. JWT")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Implement %s based authentication with registration, login "
                                                        + "and token refresh endpoints",
                                                text(args, "auth_type", DEFAULT_AUTH_TYPE)),
                                  "Authentication implementation"),
                          (name, args, suggestion) -> CapabilityResult.builder()
                                  .success(true)
                                  .result(String.format("Implemented %s authentication",
                                                        text(args, "auth_type", DEFAULT_AUTH_TYPE)))
                                  .detail("code", suggestion)
                                  .detail("ai_generated", true)
                                  .build())
                .build();
    }
}
