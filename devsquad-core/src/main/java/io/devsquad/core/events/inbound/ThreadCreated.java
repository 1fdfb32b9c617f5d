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
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Set;

@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ThreadCreated extends InboundEvent {
    String threadId;
    Set<String> participants;

    @Builder
    public ThreadCreated(String threadId, @Singular Set<String> participants) {
        super(InboundEventType.THREAD_CREATE);
        this.threadId = threadId;
        this.participants = participants;
    }

    @Override
    public <T> T accept(InboundEventVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
