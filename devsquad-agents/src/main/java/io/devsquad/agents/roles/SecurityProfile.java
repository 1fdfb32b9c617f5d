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
import io.devsquad.agents.tools.ToolArguments;
import io.devsquad.core.capabilities.Capability;
import io.devsquad.core.capabilities.CapabilityRegistry;
import io.devsquad.core.capabilities.CapabilityResult;
import io.devsquad.core.capabilities.InputSchemas;
import io.devsquad.core.capabilities.SuggestionPrompter.Prompt;
import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.model.AgentRole;
import io.devsquad.core.response.ResponseTopic;

import java.util.Map;

import static io.devsquad.agents.tools.ToolArguments.text;

/**
 * Security audits, vulnerability scans and hardening advice
 */
public class SecurityProfile implements AgentProfile {
    private static final String DEFAULT_SCOPE = "comprehensive";
    private static final int MAX_SCANNED_CODE_LENGTH = 500;

    @Override
    public AgentIdentity identity() {
        return AgentIdentity.builder()
                .id(AgentRole.SECURITY.defaultAgentId())
                .role(AgentRole.SECURITY)
                .displayName("AI Security Auditor")
                .build();
    }

    @Override
    public String roleDescription() {
        return "a cybersecurity expert specializing in vulnerability assessment, penetration testing, and secure "
                + "coding practices";
    }

    @Override
    public Map<ResponseTopic, String> fallbackAnswers() {
        return Map.of(
                ResponseTopic.AUTH,
                "I'll audit the authentication flow for SQL injection, XSS, and JWT vulnerabilities.",
                ResponseTopic.CATALOG,
                "I'll check for input validation, rate limiting, and data exposure risks.",
                ResponseTopic.CART,
                "I'll review payment processing security and PCI compliance requirements.",
                ResponseTopic.DEFAULT,
                "I'll perform a comprehensive security audit and provide recommendations.");
    }

    @Override
    public CapabilityRegistry capabilities() {
        return CapabilityRegistry.builder()
                .register(Capability.builder()
                                  .name("security_audit")
                                  .description("Perform AI-powered security audit")
                                  .inputSchema(InputSchemas.object()
                                                       .string("target", "System or component to audit")
                                                       .string("scope", "Depth of the audit")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("Perform a %s security audit on %s. List potential vulnerabilities.",
                                                text(args, "scope", DEFAULT_SCOPE),
                                                text(args, "target")),
                                  "Security audit"),
                          (name, args, suggestion) -> CapabilityResult.builder()
                                  .success(true)
                                  .result("Security audit completed")
                                  .detail("findings", suggestion)
                                  .detail("ai_analysis", true)
                                  .build())
                .register(Capability.builder()
                                  .name("vulnerability_scan")
                                  .description("AI-assisted vulnerability scanning")
                                  .inputSchema(InputSchemas.object()
                                                       .string("code", "Source code to scan")
                                                       .required("code")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  "Analyze this code for security vulnerabilities: "
                                          + ToolArguments.truncated(ToolArguments.required(args, "code"),
                                                                    MAX_SCANNED_CODE_LENGTH),
                                  "Vulnerability scan"),
                          (name, args, suggestion) -> CapabilityResult.success("Vulnerability scan completed",
                                                                              "vulnerabilities",
                                                                              suggestion))
                .register(Capability.builder()
                                  .name("security_recommendations")
                                  .description("Generate security recommendations")
                                  .inputSchema(InputSchemas.object()
                                                       .string("system", "System to harden")
                                                       .build())
                                  .build(),
                          (name, args) -> Prompt.of(
                                  String.format("List prioritized security recommendations for %s",
                                                text(args, "system", "the application")),
                                  "Security recommendations"),
                          (name, args, suggestion) -> CapabilityResult.success("Security recommendations generated",
                                                                              "recommendations",
                                                                              suggestion))
                .build();
    }
}
