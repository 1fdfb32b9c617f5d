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

package io.devsquad.core.events.outbound;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts outbound events into the JSON-RPC body posted to the coordination server
 */
@Slf4j
public class OutboundEventSerializer {
    public static final String THREAD_SEND_METHOD = "thread.send";

    private final ObjectMapper mapper;

    public OutboundEventSerializer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper);
    }

    public RpcEnvelope toEnvelope(final OutboundEvent event) {
        return event.accept(new OutboundEventVisitor<>() {
            @Override
            public RpcEnvelope visit(ToolsResponse toolsResponse) {
                return RpcEnvelope.builder()
                        .id(toolsResponse.getRequestId())
                        .result(Map.of("tools", toolsResponse.getTools()))
                        .build();
            }

            @Override
            public RpcEnvelope visit(ToolResult toolResult) {
                return RpcEnvelope.builder()
                        .id(toolResult.getRequestId())
                        .result(toolResult.getResult())
                        .build();
            }

            @Override
            public RpcEnvelope visit(ThreadSend threadSend) {
                final var params = new LinkedHashMap<String, Object>();
                params.put("thread_id", threadSend.getThreadId());
                params.put("content", threadSend.getContent());
                params.put("sender", threadSend.getSender());
                return RpcEnvelope.builder()
                        .method(THREAD_SEND_METHOD)
                        .params(params)
                        .build();
            }
        });
    }

    /**
     * Serialized request body for the event
     *
     * @throws IllegalStateException if the event cannot be written as JSON
     */
    public String serialize(final OutboundEvent event) {
        try {
            return mapper.writeValueAsString(toEnvelope(event));
        }
        catch (JsonProcessingException e) {
            log.error("Error serializing {} event: {}", event.getType(), e.getMessage());
            throw new IllegalStateException("Could not serialize outbound event of type " + event.getType(), e);
        }
    }
}
