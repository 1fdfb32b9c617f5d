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

package io.devsquad.core.engine;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import io.devsquad.core.capabilities.Capability;
import io.devsquad.core.capabilities.CapabilityExecutor;
import io.devsquad.core.capabilities.CapabilityRegistry;
import io.devsquad.core.capabilities.CapabilityResult;
import io.devsquad.core.capabilities.SuggestionPrompter;
import io.devsquad.core.events.inbound.ThreadCreated;
import io.devsquad.core.events.inbound.ToolCall;
import io.devsquad.core.events.outbound.ToolResult;
import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.model.AgentRole;
import io.devsquad.core.response.ResponseProvider;
import io.devsquad.core.threads.ThreadStateTracker;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests {@link EventDispatcher}
 */
class EventDispatcherTest {
    private static final AgentIdentity IDENTITY = AgentIdentity.builder()
            .id("ai_security_001")
            .role(AgentRole.SECURITY)
            .displayName("AI Security Auditor")
            .build();

    private final ResponseProvider provider = mock(ResponseProvider.class);
    private final CapabilityExecutor executor = mock(CapabilityExecutor.class);
    private final ThreadStateTracker tracker = new ThreadStateTracker();
    private final EventDispatcher dispatcher = new EventDispatcher(
            IDENTITY,
            CapabilityRegistry.builder()
                    .register(Capability.builder()
                                      .name("security_audit")
                                      .description("Audit")
                                      .build(),
                              (name, arguments) -> SuggestionPrompter.Prompt.of("Audit " + arguments.get("target"),
                                                                               "Security audit request"),
                              executor)
                    .build(),
            provider,
            tracker);

    @Test
    void testUnknownToolNeverCallsProviderOrExecutor() {
        final var reply = dispatcher.visit(ToolCall.builder()
                                                   .requestId(TextNode.valueOf("x1"))
                                                   .toolName("rm_rf")
                                                   .arguments(JsonNodeFactory.instance.objectNode())
                                                   .build())
                .orElseThrow();
        final var result = assertInstanceOf(ToolResult.class, reply);
        assertEquals("x1", result.getRequestId().asText());
        assertFalse(result.getResult().isSuccess());
        assertEquals("Unknown tool", result.getResult().getError());
        verifyNoInteractions(provider, executor);
    }

    @Test
    void testCapabilityPromptAndSuggestionAreWired() {
        when(provider.getResponse("Audit \"login\"", "Security audit request")).thenReturn("use bcrypt");
        when(executor.execute(eq("security_audit"), any(), eq("use bcrypt")))
                .thenReturn(CapabilityResult.success("Audit done", "findings", "use bcrypt"));
        final var arguments = JsonNodeFactory.instance.objectNode().put("target", "login");
        final var reply = dispatcher.visit(ToolCall.builder()
                                                   .requestId(TextNode.valueOf("x2"))
                                                   .toolName("security_audit")
                                                   .arguments(arguments)
                                                   .build())
                .orElseThrow();
        final var result = assertInstanceOf(ToolResult.class, reply).getResult();
        assertTrue(result.isSuccess());
        assertEquals("use bcrypt", result.getDetails().get("findings"));
    }

    @Test
    void testInvalidArgumentsAreReported() {
        when(provider.getResponse(anyString(), anyString())).thenReturn("");
        when(executor.execute(anyString(), any(), anyString()))
                .thenThrow(new IllegalArgumentException("target is required"));
        final var reply = dispatcher.visit(ToolCall.builder()
                                                   .requestId(TextNode.valueOf("x3"))
                                                   .toolName("security_audit")
                                                   .arguments(JsonNodeFactory.instance.objectNode())
                                                   .build())
                .orElseThrow();
        final var result = assertInstanceOf(ToolResult.class, reply).getResult();
        assertFalse(result.isSuccess());
        assertEquals("Invalid arguments for security_audit: target is required", result.getError());
    }

    @Test
    void testThreadCreateOnlyUpdatesTracker() {
        final var reply = dispatcher.visit(ThreadCreated.builder()
                                                   .threadId("t7")
                                                   .participants(Set.of("ai_frontend_001", "ai_security_001"))
                                                   .build());
        assertTrue(reply.isEmpty());
        assertEquals(Set.of("ai_frontend_001", "ai_security_001"),
                     tracker.get("t7").orElseThrow().getParticipants());
        verifyNoInteractions(provider, executor);
    }
}
