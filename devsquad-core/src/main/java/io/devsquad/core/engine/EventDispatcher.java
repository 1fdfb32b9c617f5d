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

import com.google.common.base.Strings;
import io.devsquad.core.capabilities.CapabilityRegistry;
import io.devsquad.core.capabilities.CapabilityResult;
import io.devsquad.core.capabilities.RegisteredCapability;
import io.devsquad.core.errors.ErrorType;
import io.devsquad.core.events.inbound.AgentMention;
import io.devsquad.core.events.inbound.InboundEventVisitor;
import io.devsquad.core.events.inbound.ThreadCreated;
import io.devsquad.core.events.inbound.ThreadMessage;
import io.devsquad.core.events.inbound.ToolCall;
import io.devsquad.core.events.inbound.ToolsRequest;
import io.devsquad.core.events.outbound.OutboundEvent;
import io.devsquad.core.events.outbound.ThreadSend;
import io.devsquad.core.events.outbound.ToolResult;
import io.devsquad.core.events.outbound.ToolsResponse;
import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.response.ResponseProvider;
import io.devsquad.core.threads.ThreadStateTracker;
import io.devsquad.core.utils.AgentUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;

/**
 * Handles one inbound event and decides what, if anything, to send back. Never throws for protocol or
 * capability level problems.
 */
@Slf4j
public class EventDispatcher implements InboundEventVisitor<Optional<OutboundEvent>> {
    private final AgentIdentity identity;
    private final CapabilityRegistry registry;
    private final ResponseProvider responseProvider;
    private final ThreadStateTracker threadStateTracker;

    /**
     * @param responseProvider Must not throw. Wrap fallible providers in a
     *                         {@link io.devsquad.core.response.SafeResponseProvider}.
     */
    public EventDispatcher(
            @NonNull AgentIdentity identity,
            @NonNull CapabilityRegistry registry,
            @NonNull ResponseProvider responseProvider,
            @NonNull ThreadStateTracker threadStateTracker) {
        this.identity = identity;
        this.registry = registry;
        this.responseProvider = responseProvider;
        this.threadStateTracker = threadStateTracker;
    }

    @Override
    public Optional<OutboundEvent> visit(ToolsRequest toolsRequest) {
        log.debug("Tools requested. Sending {} capabilities", registry.size());
        return Optional.of(ToolsResponse.builder()
                                   .requestId(toolsRequest.getRequestId())
                                   .tools(registry.capabilities())
                                   .build());
    }

    @Override
    public Optional<OutboundEvent> visit(ToolCall toolCall) {
        final var toolName = toolCall.getToolName();
        final var result = registry.find(toolName)
                .map(registered -> execute(registered, toolCall))
                .orElseGet(() -> {
                    log.warn("Call received for unknown tool: {}", toolName);
                    return CapabilityResult.error(ErrorType.UNKNOWN_TOOL);
                });
        return Optional.of(ToolResult.builder()
                                   .requestId(toolCall.getRequestId())
                                   .result(result)
                                   .build());
    }

    @Override
    public Optional<OutboundEvent> visit(ThreadMessage threadMessage) {
        final var threadId = threadMessage.getThreadId();
        final var sender = threadMessage.getSender();
        threadStateTracker.observe(threadId, threadMessage.getParticipants(), sender);
        if (identity.getId().equals(sender)) {
            log.debug("Ignoring own message in thread {}", threadId);
            return Optional.empty();
        }
        if (Strings.isNullOrEmpty(threadId) || Strings.isNullOrEmpty(threadMessage.getContent())) {
            log.debug("Ignoring thread message without thread id or content from {}", sender);
            return Optional.empty();
        }
        log.info("Message from {} in thread {}", sender, threadId);
        final var context = String.format("Message from %s in thread %s", sender, threadId);
        return reply(threadId, responseProvider.getResponse(threadMessage.getContent(), context));
    }

    @Override
    public Optional<OutboundEvent> visit(AgentMention agentMention) {
        final var threadId = agentMention.getThreadId();
        final var mentioner = agentMention.getMentioner();
        log.info("Mentioned by {} in thread {}", mentioner, threadId);
        if (Strings.isNullOrEmpty(threadId)) {
            return Optional.empty();
        }
        threadStateTracker.observe(threadId, Set.of(), mentioner);
        final var prompt = String.format("You were mentioned by %s. Context: %s",
                                         mentioner, Strings.nullToEmpty(agentMention.getContext()));
        return reply(threadId, responseProvider.getResponse(prompt, "Agent mention"));
    }

    @Override
    public Optional<OutboundEvent> visit(ThreadCreated threadCreated) {
        threadStateTracker.observe(threadCreated.getThreadId(), threadCreated.getParticipants(), null);
        return Optional.empty();
    }

    private CapabilityResult execute(RegisteredCapability registered, ToolCall toolCall) {
        final var toolName = toolCall.getToolName();
        log.info("Executing tool {}", toolName);
        try {
            final var prompt = registered.getPrompter().prompt(toolName, toolCall.getArguments());
            final var suggestion = Strings.nullToEmpty(
                    responseProvider.getResponse(prompt.getText(), prompt.getContext()));
            final var result = registered.getExecutor().execute(toolName, toolCall.getArguments(), suggestion);
            if (null == result) {
                return CapabilityResult.error(ErrorType.TOOL_EXECUTION_FAILURE, toolName, "no result returned");
            }
            return result;
        }
        catch (IllegalArgumentException e) {
            log.warn("Invalid arguments for tool {}: {}", toolName, e.getMessage());
            return CapabilityResult.error(ErrorType.INVALID_ARGUMENTS, toolName, e.getMessage());
        }
        catch (Exception e) {
            log.error("Error executing tool {}: {}", toolName, AgentUtils.rootCauseMessage(e));
            return CapabilityResult.error(ErrorType.TOOL_EXECUTION_FAILURE, toolName, AgentUtils.rootCauseMessage(e));
        }
    }

    private Optional<OutboundEvent> reply(String threadId, String response) {
        if (Strings.isNullOrEmpty(response) || response.isBlank()) {
            log.debug("No reply for thread {}", threadId);
            return Optional.empty();
        }
        return Optional.of(ThreadSend.builder()
                                   .threadId(threadId)
                                   .sender(identity.getId())
                                   .content(response)
                                   .build());
    }
}
