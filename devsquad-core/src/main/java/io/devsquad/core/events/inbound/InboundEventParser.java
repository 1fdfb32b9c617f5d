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

package io.devsquad.core.events.inbound;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import com.google.common.collect.ObjectArrays;
import io.devsquad.core.utils.AgentUtils;
import io.devsquad.core.utils.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Converts raw stream lines into {@link InboundEvent}s. Accepts SSE {@code data:} lines as well as bare JSON
 * lines. Lines that are not a recognisable event envelope yield an empty result and never an exception.
 */
@Slf4j
public class InboundEventParser {
    private static final String DATA_PREFIX = "data:";
    private static final String PARAMS = "params";
    private static final String MESSAGE = "message";
    private static final String[] THREAD_ID_FIELDS = {"thread_id", "threadId"};

    private final ObjectMapper mapper;

    public InboundEventParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public Optional<InboundEvent> parse(final String line) {
        final var payload = payload(line);
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        final JsonNode frame;
        try {
            frame = mapper.readTree(payload.get());
        }
        catch (JsonProcessingException e) {
            log.debug("Skipping non-JSON frame: {}", AgentUtils.abbreviate(payload.get(), 200));
            return Optional.empty();
        }
        if (null == frame || !frame.isObject()) {
            log.debug("Skipping frame that is not a JSON object: {}", AgentUtils.abbreviate(payload.get(), 200));
            return Optional.empty();
        }
        final var typeName = JsonUtils.text(frame, "type").orElse(null);
        if (Strings.isNullOrEmpty(typeName)) {
            log.warn("Skipping frame without a type: {}", AgentUtils.abbreviate(payload.get(), 200));
            return Optional.empty();
        }
        final var type = InboundEventType.fromValue(typeName).orElse(null);
        if (null == type) {
            log.warn("Unknown event type: {}. Frame dropped.", typeName);
            return Optional.empty();
        }
        return Optional.of(toEvent(type, frame));
    }

    private InboundEvent toEvent(InboundEventType type, JsonNode frame) {
        final var params = JsonUtils.field(frame, PARAMS).filter(JsonNode::isObject).orElse(null);
        final var message = JsonUtils.field(params, MESSAGE)
                .or(() -> JsonUtils.field(frame, MESSAGE))
                .filter(JsonNode::isObject)
                .orElse(null);
        return switch (type) {
            case TOOLS -> ToolsRequest.builder()
                    .requestId(requestId(frame))
                    .build();
            case TOOL_CALL -> ToolCall.builder()
                    .requestId(requestId(frame))
                    .toolName(text(params, frame, null, "name").orElse(null))
                    .arguments(arguments(params))
                    .build();
            case THREAD_MESSAGE -> ThreadMessage.builder()
                    .threadId(text(params, frame, message, THREAD_ID_FIELDS).orElse(null))
                    .sender(text(params, frame, message, "sender").orElse(null))
                    .content(text(params, frame, message, "content").orElse(null))
                    .participants(participants(params, frame))
                    .build();
            case AGENT_MENTION -> AgentMention.builder()
                    .threadId(text(params, frame, message, THREAD_ID_FIELDS).orElse(null))
                    .mentioner(text(params, frame, message, "mentioner", "sender").orElse(null))
                    .context(text(params, frame, message, "context", "content").orElse(""))
                    .build();
            case THREAD_CREATE -> ThreadCreated.builder()
                    .threadId(text(params, frame, null, ObjectArrays.concat(THREAD_ID_FIELDS, "id")).orElse(null))
                    .participants(participants(params, frame))
                    .build();
        };
    }

    private static Optional<String> payload(final String line) {
        if (null == line) {
            return Optional.empty();
        }
        var trimmed = line.trim();
        if (trimmed.startsWith(DATA_PREFIX)) {
            trimmed = trimmed.substring(DATA_PREFIX.length()).trim();
        }
        else if (trimmed.startsWith(":")
                || trimmed.startsWith("event:")
                || trimmed.startsWith("id:")
                || trimmed.startsWith("retry:")) {
            //SSE comments and field lines carry no event data
            return Optional.empty();
        }
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    private static JsonNode requestId(JsonNode frame) {
        return JsonUtils.field(frame, "id").orElse(null);
    }

    private JsonNode arguments(JsonNode params) {
        if (null == params) {
            return JsonUtils.emptyObject(mapper);
        }
        final var explicit = JsonUtils.field(params, "arguments");
        if (explicit.isPresent() && explicit.get().isObject()) {
            return explicit.get();
        }
        final var inline = (ObjectNode) params.deepCopy();
        inline.remove("name");
        inline.remove("arguments");
        return inline;
    }

    private static Optional<String> text(JsonNode params, JsonNode frame, JsonNode message, String... fields) {
        return JsonUtils.text(params, fields)
                .or(() -> JsonUtils.text(frame, fields))
                .or(() -> JsonUtils.text(message, fields));
    }

    private static Set<String> participants(JsonNode params, JsonNode frame) {
        final var participants = new LinkedHashSet<String>();
        JsonUtils.field(params, "participants")
                .or(() -> JsonUtils.field(frame, "participants"))
                .filter(JsonNode::isArray)
                .ifPresent(array -> array.forEach(node -> {
                    if (node.isTextual() && !node.asText().isBlank()) {
                        participants.add(node.asText());
                    }
                }));
        return participants;
    }
}
