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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Server asks the agent to run one of its capabilities
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ToolCall extends InboundEvent {
    JsonNode requestId;
    String toolName;
    JsonNode arguments;

    @Builder
    public ToolCall(JsonNode requestId, String toolName, JsonNode arguments) {
        super(InboundEventType.TOOL_CALL);
        this.requestId = requestId;
        this.toolName = toolName;
        this.arguments = arguments;
    }

    @Override
    public <T> T accept(InboundEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
