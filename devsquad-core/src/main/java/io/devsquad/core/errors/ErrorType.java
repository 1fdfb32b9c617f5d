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

package io.devsquad.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Structured failures reported back to the coordination server inside tool results
 */
@AllArgsConstructor
@Getter
public enum ErrorType {
    UNKNOWN_TOOL("Unknown tool"),
    TOOL_EXECUTION_FAILURE("Tool execution failed for %s: %s"),
    INVALID_ARGUMENTS("Invalid arguments for %s: %s"),
    ;

    private final String message;

    public String format(Object... args) {
        return String.format(message, args);
    }
}
