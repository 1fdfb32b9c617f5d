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

package io.devsquad.models;

import io.devsquad.core.utils.EnvLoader;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Settings for the chat completion endpoint. Groq's OpenAI compatible API is used by default.
 */
@Value
@Builder
@Jacksonized
public class ChatModelConfig {
    public static final String API_KEY_ENV = "GROQ_API_KEY";
    public static final String BASE_URL_ENV = "GROQ_BASE_URL";
    public static final String MODEL_ENV = "GROQ_MODEL";

    public static final String DEFAULT_BASE_URL = "https://api.groq.com/openai";
    public static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    /**
     * No key means no model calls. Agents answer from their canned responses only.
     */
    String apiKey;
    @NonNull
    @Builder.Default
    String baseUrl = DEFAULT_BASE_URL;
    @NonNull
    @Builder.Default
    String model = DEFAULT_MODEL;
    @Builder.Default
    double temperature = 0.7;
    @Builder.Default
    int maxTokens = 500;
    @NonNull
    @Builder.Default
    Duration timeout = Duration.ofSeconds(30);

    public static ChatModelConfig fromEnv() {
        return ChatModelConfig.builder()
                .apiKey(EnvLoader.readEnv(API_KEY_ENV).orElse(null))
                .baseUrl(EnvLoader.readEnv(BASE_URL_ENV, DEFAULT_BASE_URL))
                .model(EnvLoader.readEnv(MODEL_ENV, DEFAULT_MODEL))
                .build();
    }

    public boolean hasApiKey() {
        return null != apiKey && !apiKey.isBlank();
    }
}
