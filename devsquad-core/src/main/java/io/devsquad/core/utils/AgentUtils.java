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

package io.devsquad.core.utils;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Various small utilities used across agents and the supervisor.
 */
@UtilityClass
public class AgentUtils {

    public static Throwable rootCause(final Throwable leaf) {
        Throwable cause = leaf;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Message of the root cause, or the class name of the root cause if it carries no message.
     */
    public static String rootCauseMessage(final Throwable leaf) {
        final var cause = rootCause(leaf);
        return Objects.requireNonNullElseGet(cause.getMessage(), () -> cause.getClass().getSimpleName());
    }

    /**
     * Shortens text for log lines. Payloads from the coordination server can be arbitrarily long.
     */
    public static String abbreviate(final String text, final int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
