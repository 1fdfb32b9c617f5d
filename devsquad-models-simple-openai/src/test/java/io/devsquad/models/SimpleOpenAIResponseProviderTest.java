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

import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.devsquad.core.response.ResponseTopic;
import io.devsquad.core.response.TopicFallbackResponseProvider;
import io.devsquad.core.utils.JsonUtils;
import io.github.sashirestela.cleverclient.client.OkHttpClientAdapter;
import io.github.sashirestela.openai.SimpleOpenAI;
import lombok.SneakyThrows;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link SimpleOpenAIResponseProvider}
 */
@WireMockTest
class SimpleOpenAIResponseProviderTest {
    private static final String AGENT_NAME = "AI Security Auditor";
    private static final String ROLE = "security expert who audits code and suggests fixes";

    private final TopicFallbackResponseProvider fallback = new TopicFallbackResponseProvider(Map.of(
            ResponseTopic.AUTH, "Canned auth review",
            ResponseTopic.DEFAULT, "Canned review"));

    private static ChatModelConfig config(WireMockRuntimeInfo wiremock) {
        return ChatModelConfig.builder()
                .apiKey("test-key")
                .baseUrl(wiremock.getHttpBaseUrl())
                .build();
    }

    private static SimpleOpenAIResponseProvider provider(WireMockRuntimeInfo wiremock) {
        return SimpleOpenAIResponseProvider.builder()
                .openAI(SimpleOpenAI.builder()
                                .apiKey("test-key")
                                .baseUrl(wiremock.getHttpBaseUrl())
                                .objectMapper(JsonUtils.createMapper())
                                .clientAdapter(new OkHttpClientAdapter(new OkHttpClient()))
                                .build())
                .config(config(wiremock))
                .agentName(AGENT_NAME)
                .roleDescription(ROLE)
                .build();
    }

    @SneakyThrows
    private static String stub(String name) {
        return Files.readString(Path.of(Objects.requireNonNull(
                SimpleOpenAIResponseProviderTest.class.getResource("/wiremock/" + name)).toURI()));
    }

    @Test
    void testModelAnswer(WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(okForContentType("application/json", stub("chat.1.json"))));
        final var answer = provider(wiremock).getResponse("Review the login flow", "Message from orchestrator");
        assertTrue(answer.contains("JWT"));

        verify(postRequestedFor(urlEqualTo("/v1/chat/completions"))
                       .withHeader("Authorization", equalTo("Bearer test-key"))
                       .withRequestBody(matchingJsonPath("$.model", equalTo("llama-3.3-70b-versatile")))
                       .withRequestBody(matchingJsonPath("$.temperature", equalTo("0.7")))
                       .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
                       .withRequestBody(matchingJsonPath("$.messages[0].content",
                                                         equalTo("You are " + AGENT_NAME + ", " + ROLE)))
                       .withRequestBody(matchingJsonPath("$.messages[1].content",
                                                         containing("User Request: Review the login flow"))));
    }

    @Test
    void testFailureIsThrownWithoutWrapper(WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));
        final var provider = provider(wiremock);
        assertThrows(RuntimeException.class, () -> provider.getResponse("Review the login flow", ""));
    }

    @Test
    void testFailureFallsBackThroughFactory(WireMockRuntimeInfo wiremock) {
        stubFor(post(urlEqualTo("/v1/chat/completions"))
                        .willReturn(aResponse().withStatus(500).withBody("{\"error\":\"overloaded\"}")));
        final var provider = SimpleOpenAIResponseProvider.create(config(wiremock), AGENT_NAME, ROLE, fallback);
        assertEquals("Canned auth review", provider.getResponse("Review the login flow", ""));
        assertEquals("Canned review", provider.getResponse("Review the deployment", ""));
    }

    @Test
    void testNoApiKeyNeverCallsModel(WireMockRuntimeInfo wiremock) {
        final var config = ChatModelConfig.builder()
                .baseUrl(wiremock.getHttpBaseUrl())
                .build();
        assertFalse(config.hasApiKey());
        final var provider = SimpleOpenAIResponseProvider.create(config, AGENT_NAME, ROLE, fallback);
        assertEquals("Canned auth review", provider.getResponse("auth module", ""));
        verify(0, postRequestedFor(anyUrl()));
    }
}
