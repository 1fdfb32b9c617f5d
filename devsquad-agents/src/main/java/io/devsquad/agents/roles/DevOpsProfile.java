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
 * CI/CD pipelines, containers and infrastructure as code
 */
public class DevOpsProfile implements AgentProfile {
    private static final String DEFAULT_PLATFORM = "GitHub Actions";
    private static final String DEFAULT_PROVIDER = "AWS";

    @Override
    public AgentIdentity identity() {
        return AgentIdentity.builder()
                .id(AgentRole.DEVOPS.defaultAgentId())
                .role(AgentRole.DEVOPS)
                .displayName("AI DevOps Engineer")
                .build();
    }

    @Override
    public String roleDescription() {
        return "a DevOps expert specializing in CI/CD pipelines, containerization, infrastructure as code, and "
                + "cloud deployments";
    }

    @Override
    public Map<ResponseTopic, String> fallbackAnswers() {
        return Map.of(
                ResponseTopic.AUTH,
                "I'll set up secret management for the JWT signing keys and wire it into the deployment pipeline.",
                ResponseTopic.CATALOG,
                "I'll containerize the catalog service and add a search index to the infrastructure.",
                ResponseTopic.CART,
                "I'll provision a session store and configure autoscaling for checkout traffic.",
                ResponseTopic.DEFAULT,
                "I'll help you automate builds, containerize services and deploy them to the cloud.");
    }

    @Override
    public CapabilityRegistry capabilities() {
        return CapabilityRegistry.builder()
                .register(Capability.builder()
                                  .name("create_ci_pipeline")
                                  .description("Create CI/CD pipeline configuration")
                                  .inputSchema(InputSchemas.object()
                                                       .string("platform", "CI platform")
                                                       .string("language", "Language of the application")
                                                       .string("requirements", "Extra pipeline requirements")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Create a %s CI/CD pipeline for %s application. %s",
                                                text(args, "platform", DEFAULT_PLATFORM),
                                                text(args, "language"),
                                                text(args, "requirements")).trim(),
                                  "DevOps pipeline creation"),
                          (name, args, suggestion) -> CapabilityResult.builder()
                                  .success(true)
                                  .result("Created CI/CD pipeline for " + text(args, "platform", DEFAULT_PLATFORM))
                                  .detail("config", suggestion)
                                  .detail("ai_generated", true)
                                  .build())
                .register(Capability.builder()
                                  .name("containerize_app")
                                  .description("Create Docker/Kubernetes configurations")
                                  .inputSchema(InputSchemas.object()
                                                       .string("app_type", "Kind of application")
                                                       .array("dependencies", "Runtime dependencies")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Create Dockerfile and Kubernetes manifests for %s application. "
                                                        + "Dependencies: %s",
                                                text(args, "app_type"),
                                                joined(args, "dependencies")),
                                  "Containerization"),
                          (name, args, suggestion) -> CapabilityResult.success("Application containerized",
                                                                              "config",
                                                                              suggestion))
                .register(Capability.builder()
                                  .name("setup_infrastructure")
                                  .description("Create infrastructure as code")
                                  .inputSchema(InputSchemas.object()
                                                       .string("provider", "Cloud provider")
                                                       .array("resources", "Resources to provision")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Create infrastructure as code for %s. Resources: %s",
                                                text(args, "provider", DEFAULT_PROVIDER),
                                                joined(args, "resources")),
                                  "Infrastructure setup"),
                          (name, args, suggestion) -> CapabilityResult.success(
                                  "Infrastructure configured for " + text(args, "provider", DEFAULT_PROVIDER),
                                  "config",
                                  suggestion))
                .build();
    }
}
