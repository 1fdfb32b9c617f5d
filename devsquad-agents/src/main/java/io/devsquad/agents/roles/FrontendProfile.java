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
 * React components, UI implementation and frontend performance
 */
public class FrontendProfile implements AgentProfile {
    private static final String DEFAULT_COMPONENT = "Component";

    @Override
    public AgentIdentity identity() {
        return AgentIdentity.builder()
                .id(AgentRole.FRONTEND.defaultAgentId())
                .role(AgentRole.FRONTEND)
                .displayName("AI Frontend Developer")
                .build();
    }

    @Override
    public String roleDescription() {
        return "an expert frontend developer specializing in React, TypeScript, and modern UI/UX design";
    }

    @Override
    public Map<ResponseTopic, String> fallbackAnswers() {
        return Map.of(
                ResponseTopic.AUTH,
                "I'll create a React authentication component with JWT token handling and form validation.",
                ResponseTopic.CATALOG,
                "I'll build a responsive product catalog using React with filtering and search functionality.",
                ResponseTopic.CART,
                "I'll implement a shopping cart with local storage persistence and real-time updates.",
                ResponseTopic.DEFAULT,
                "I'll help you build the frontend components using React and modern UI patterns.");
    }

    @Override
    public CapabilityRegistry capabilities() {
        return CapabilityRegistry.builder()
                .register(Capability.builder()
                                  .name("create_react_component")
                                  .description("Create a React component with AI-generated code")
                                  .inputSchema(InputSchemas.object()
                                                       .string("component_name", "Name of the component")
                                                       .string("requirements", "What the component must do")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Generate a React component named %s with these requirements: %s",
                                                text(args, "component_name", DEFAULT_COMPONENT),
                                                text(args, "requirements")),
                                  "Component generation"),
                          (name, args, suggestion) -> CapabilityResult.builder()
                                  .success(true)
                                  .result("Created React component: "
                                                  + text(args, "component_name", DEFAULT_COMPONENT))
                                  .detail("code", suggestion)
                                  .detail("ai_generated", true)
                                  .build())
                .register(Capability.builder()
                                  .name("implement_ui")
                                  .description("Implement user interface with AI assistance")
                                  .inputSchema(InputSchemas.object()
                                                       .string("design", "Description of the design")
                                                       .array("features", "Features the UI must have")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Implement a UI based on this design: %s. Features: %s",
                                                text(args, "design"),
                                                joined(args, "features")),
                                  "UI implementation"),
                          (name, args, suggestion) -> CapabilityResult.success("UI implemented with AI assistance",
                                                                              "implementation",
                                                                              suggestion))
                .register(Capability.builder()
                                  .name("optimize_performance")
                                  .description("Optimize frontend performance")
                                  .inputSchema(InputSchemas.object()
                                                       .string("target", "Page or component to optimize")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Suggest concrete performance optimizations for %s: bundle size, "
                                                        + "rendering and network usage",
                                                text(args, "target", "the application")),
                                  "Performance optimization"),
                          (name, args, suggestion) -> CapabilityResult.success(
                                  "Performance optimized for " + text(args, "target", "the application"),
                                  "implementation",
                                  suggestion))
                .build();
    }
}
