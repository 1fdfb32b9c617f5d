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

package io.devsquad.core.response;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Coarse topics used to pick a canned answer when no model is available
 */
@Getter
public enum ResponseTopic {
    AUTH(List.of("auth", "login")),
    CATALOG(List.of("catalog", "product")),
    CART(List.of("cart", "shopping")),
    DEFAULT(List.of()),
    ;

    private final List<String> keywords;

    ResponseTopic(List<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * First topic (in declaration order) whose keyword appears in the prompt. {@link #DEFAULT} otherwise.
     */
    public static ResponseTopic classify(final String prompt) {
        if (null == prompt) {
            return DEFAULT;
        }
        final var lower = prompt.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(topic -> topic.keywords.stream().anyMatch(lower::contains))
                .findFirst()
                .orElse(DEFAULT);
    }
}
