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

package io.devsquad.core.events;

import io.devsquad.core.events.inbound.AgentMention;
import io.devsquad.core.events.inbound.InboundEventParser;
import io.devsquad.core.events.inbound.InboundEventType;
import io.devsquad.core.events.inbound.ThreadCreated;
import io.devsquad.core.events.inbound.ThreadMessage;
import io.devsquad.core.events.inbound.ToolCall;
import io.devsquad.core.events.inbound.ToolsRequest;
import io.devsquad.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link InboundEventParser}
 */
class InboundEventParserTest {
    private final InboundEventParser parser = new InboundEventParser(JsonUtils.createMapper());

    @Test
    void testToolsRequest() {
        final var event = parser.parse("data: {\"type\":\"tools\",\"id\":42}").orElseThrow();
        final var request = assertInstanceOf(ToolsRequest.class, event);
        assertEquals(InboundEventType.TOOLS, request.getType());
        assertEquals(42, request.getRequestId().asInt());
    }

    @Test
    void testToolCallWithArgumentsObject() {
        final var event = parser.parse("""
                data: {"type":"tool_call","id":"7","params":{"name":"design_database","arguments":{"entities":["user"]}}}
                """).orElseThrow();
        final var call = assertInstanceOf(ToolCall.class, event);
        assertEquals("7", call.getRequestId().asText());
        assertEquals("design_database", call.getToolName());
        assertEquals("user", call.getArguments().at("/entities/0").asText());
    }

    @Test
    void testToolCallWithInlineArguments() {
        final var event = parser.parse(
                "{\"type\":\"tool_call\",\"id\":\"7\",\"params\":{\"name\":\"create_api_endpoint\",\"method\":\"GET\",\"path\":\"/x\"}}")
                .orElseThrow();
        final var call = assertInstanceOf(ToolCall.class, event);
        assertEquals("create_api_endpoint", call.getToolName());
        assertEquals("GET", call.getArguments().get("method").asText());
        assertEquals("/x", call.getArguments().get("path").asText());
        assertFalse(call.getArguments().has("name"));
    }

    @Test
    void testToolCallWithoutParams() {
        final var call = assertInstanceOf(ToolCall.class,
                                          parser.parse("data: {\"type\":\"tool_call\",\"id\":null}").orElseThrow());
        assertNull(call.getRequestId());
        assertNull(call.getToolName());
        assertTrue(call.getArguments().isEmpty());
    }

    @Test
    void testThreadMessageNestedShape() {
        final var event = parser.parse("""
                data: {"type":"thread.message","thread_id":"t1","message":{"sender":"ai_backend_001","content":"API is ready"}}
                """).orElseThrow();
        final var message = assertInstanceOf(ThreadMessage.class, event);
        assertEquals("t1", message.getThreadId());
        assertEquals("ai_backend_001", message.getSender());
        assertEquals("API is ready", message.getContent());
        assertTrue(message.getParticipants().isEmpty());
    }

    @Test
    void testThreadMessageParamsShape() {
        final var event = parser.parse("""
                data: {"type":"thread.message","params":{"thread_id":"t2","sender":"orchestrator","content":"Build it","participants":["ai_frontend_001","ai_backend_001"]}}
                """).orElseThrow();
        final var message = assertInstanceOf(ThreadMessage.class, event);
        assertEquals("t2", message.getThreadId());
        assertEquals("orchestrator", message.getSender());
        assertEquals("Build it", message.getContent());
        assertEquals(Set.of("ai_frontend_001", "ai_backend_001"), message.getParticipants());
    }

    @Test
    void testMention() {
        final var event = parser.parse("""
                data: {"type":"agent.mention","thread_id":"t1","mentioner":"ai_security_001","context":"review auth"}
                """).orElseThrow();
        final var mention = assertInstanceOf(AgentMention.class, event);
        assertEquals("t1", mention.getThreadId());
        assertEquals("ai_security_001", mention.getMentioner());
        assertEquals("review auth", mention.getContext());
    }

    @Test
    void testMentionWithoutThread() {
        final var mention = assertInstanceOf(
                AgentMention.class,
                parser.parse("{\"type\":\"agent.mention\",\"mentioner\":\"x\"}").orElseThrow());
        assertNull(mention.getThreadId());
        assertEquals("", mention.getContext());
    }

    @Test
    void testThreadCreate() {
        final var event = parser.parse("""
                data: {"type":"thread.create","thread_id":"t9","participants":["a","b"]}
                """).orElseThrow();
        final var created = assertInstanceOf(ThreadCreated.class, event);
        assertEquals("t9", created.getThreadId());
        assertEquals(Set.of("a", "b"), created.getParticipants());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            ": keep-alive",
            "event: message",
            "retry: 1000",
            "id: 5",
            "data: not json",
            "data: [1,2,3]",
            "data: \"text\"",
            "data: {\"id\":1}",
            "data: {\"type\":\"\"}",
            "data: {\"type\":\"unknown.event\",\"params\":{}}",
            "{\"type\":42}",
            "data: {\"type\":\"tools\"",
    })
    void testUnusableLinesAreSkipped(String line) {
        assertTrue(parser.parse(line).isEmpty());
    }

    @Test
    void testNullLine() {
        assertTrue(parser.parse(null).isEmpty());
    }
}
