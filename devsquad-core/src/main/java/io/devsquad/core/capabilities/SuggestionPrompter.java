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

package io.devsquad.core.capabilities;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.Value;

/**
 * Builds the prompt sent to the response provider before a capability is executed
 */
@FunctionalInterface
public interface SuggestionPrompter {

    @Value
    class Prompt {
        @NonNull
        String text;
        @NonNull
        String context;

        public static Prompt of(final String text, final String context) {
            return new Prompt(text, context);
        }
    }

    Prompt prompt(final String name, final JsonNode arguments);

    static SuggestionPrompter generic() {
        return (name, arguments) -> Prompt.of(
                String.format("Execute the '%s' tool with arguments: %s", name, arguments),
                "Tool execution request");
    }
}
