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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * Another participant mentioned this agent. The thread id may be absent.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AgentMention extends InboundEvent {
    String threadId;
    String mentioner;
    String context;

    @Builder
    public AgentMention(String threadId, String mentioner, String context) {
        super(InboundEventType.AGENT_MENTION);
        this.threadId = threadId;
        this.mentioner = mentioner;
        this.context = context;
    }

    @Override
    public <T> T accept(InboundEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
