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

import lombok.Getter;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.Optional;

/**
 * Values of the {@code type} field of frames pushed by the coordination server
 */
@Getter
public enum InboundEventType {
    TOOLS(Values.TOOLS),
    TOOL_CALL(Values.TOOL_CALL),
    THREAD_MESSAGE(Values.THREAD_MESSAGE),
    AGENT_MENTION(Values.AGENT_MENTION),
    THREAD_CREATE(Values.THREAD_CREATE),
    ;

    private final String value;

    InboundEventType(String value) {
        this.value = value;
    }

    public static Optional<InboundEventType> fromValue(final String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }

    @UtilityClass
    public static final class Values {
        public static final String TOOLS = "tools";
        public static final String TOOL_CALL = "tool_call";
        public static final String THREAD_MESSAGE = "thread.message";
        public static final String AGENT_MENTION = "agent.mention";
        public static final String THREAD_CREATE = "thread.create";
    }
}
