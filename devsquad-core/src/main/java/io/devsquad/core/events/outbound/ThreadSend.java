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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

/**
 * A message the agent posts into a thread. Never correlated to a request.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ThreadSend extends OutboundEvent {
    String threadId;
    String sender;
    String content;

    @Builder
    public ThreadSend(String threadId, String sender, String content) {
        super(OutboundEventType.THREAD_SEND);
        this.threadId = threadId;
        this.sender = sender;
        this.content = content;
    }

    @Override
    public <T> T accept(OutboundEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
