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

import com.google.common.base.Strings;
import com.google.common.base.Stopwatch;
import io.devsquad.core.response.ResponseProvider;
import io.devsquad.core.response.SafeResponseProvider;
import io.devsquad.core.utils.JsonUtils;
import io.github.sashirestela.cleverclient.client.OkHttpClientAdapter;
import io.github.sashirestela.openai.SimpleOpenAI;
import io.github.sashirestela.openai.domain.chat.ChatMessage;
import io.github.sashirestela.openai.domain.chat.ChatRequest;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Answers prompts through an OpenAI compatible chat completion API, speaking as the agent's persona.
 * <p>
 * Failures are thrown to the caller. Wrap this in a {@link SafeResponseProvider} to get the fallback behaviour
 * agents need; {@link #create(ChatModelConfig, String, String, ResponseProvider)} does that.
 */
@Slf4j
public class SimpleOpenAIResponseProvider implements ResponseProvider {
    private final SimpleOpenAI openAI;
    private final ChatModelConfig config;
    private final String agentName;
    private final String roleDescription;

    @Builder
    public SimpleOpenAIResponseProvider(
            @NonNull SimpleOpenAI openAI,
            @NonNull ChatModelConfig config,
            @NonNull String agentName,
            @NonNull String roleDescription) {
        this.openAI = openAI;
        this.config = config;
        this.agentName = agentName;
        this.roleDescription = roleDescription;
    }

    /**
     * Provider for an agent. Uses the model if an api key is configured, the fallback otherwise. Model failures
     * also end up at the fallback.
     */
    public static ResponseProvider create(
            final ChatModelConfig config,
            final String agentName,
            final String roleDescription,
            final ResponseProvider fallback) {
        if (!config.hasApiKey()) {
            log.info("No API key configured for {}. Using canned responses", agentName);
            return new SafeResponseProvider(fallback, fallback);
        }
        final var httpClient = new OkHttpClient.Builder()
                .callTimeout(config.getTimeout())
                .build();
        final var openAI = SimpleOpenAI.builder()
                .apiKey(config.getApiKey())
                .baseUrl(config.getBaseUrl())
                .objectMapper(JsonUtils.createMapper())
                .clientAdapter(new OkHttpClientAdapter(httpClient))
                .build();
        log.info("Using model {} at {} for {}", config.getModel(), config.getBaseUrl(), agentName);
        return new SafeResponseProvider(new SimpleOpenAIResponseProvider(openAI, config, agentName, roleDescription),
                                        fallback);
    }

    @Override
    public String getResponse(String prompt, String context) {
        final var request = ChatRequest.builder()
                .model(config.getModel())
                .messages(List.of(ChatMessage.SystemMessage.of(systemPrompt()),
                                  ChatMessage.UserMessage.of(userPrompt(prompt, context))))
                .temperature(config.getTemperature())
                .maxCompletionTokens(config.getMaxTokens())
                .n(1)
                .build();
        final var stopwatch = Stopwatch.createStarted();
        final var response = openAI.chatCompletions()
                .create(request)
                .join();
        log.debug("Model call for {} took {} ms", agentName, stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return Strings.nullToEmpty(response.firstContent());
    }

    private String systemPrompt() {
        return String.format("You are %s, %s", agentName, roleDescription);
    }

    private String userPrompt(String prompt, String context) {
        return String.format("""
                                     You are %s, a %s.

                                     Context: %s

                                     User Request: %s

                                     Respond as %s would, focusing on your expertise. Be specific and helpful.""",
                             agentName,
                             roleDescription,
                             Strings.isNullOrEmpty(context) ? "Starting new conversation" : context,
                             prompt,
                             agentName);
    }
}
