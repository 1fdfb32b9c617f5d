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

package io.devsquad.agents.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Lenient readers for tool call arguments. Missing or null values fall back to defaults.
 */
@UtilityClass
public class ToolArguments {

    public static String text(final JsonNode arguments, final String name, final String defaultValue) {
        if (null == arguments || !arguments.hasNonNull(name)) {
            return defaultValue;
        }
        final var value = arguments.get(name);
        if (value.isValueNode()) {
            final var text = value.asText();
            return Strings.isNullOrEmpty(text) ? defaultValue : text;
        }
        return value.toString();
    }

    public static String text(final JsonNode arguments, final String name) {
        return text(arguments, name, "");
    }

    /**
     * Reads a mandatory text argument
     *
     * @throws IllegalArgumentException if the argument is missing or blank
     */
    public static String required(final JsonNode arguments, final String name) {
        final var value = text(arguments, name, null);
        if (null == value || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    /**
     * Reads a list argument. A plain string is accepted as a single element list.
     */
    public static List<String> list(final JsonNode arguments, final String name) {
        if (null == arguments || !arguments.hasNonNull(name)) {
            return List.of();
        }
        final var value = arguments.get(name);
        if (!value.isArray()) {
            final var single = text(arguments, name);
            return single.isEmpty() ? List.of() : List.of(single);
        }
        final var items = new ArrayList<String>();
        value.forEach(item -> items.add(item.isValueNode() ? item.asText() : item.toString()));
        return items;
    }

    public static String joined(final JsonNode arguments, final String name) {
        return String.join(", ", list(arguments, name));
    }

    public static String truncated(final String value, final int maxLength) {
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
