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

package io.devsquad.supervisor.client;

import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.devsquad.core.transport.CoordinationServerConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link CoordinationServerClient} against a stubbed thread API
 */
@WireMockTest
class CoordinationServerClientTest {

    static CoordinationServerClient client(WireMockRuntimeInfo wiremock) {
        return new CoordinationServerClient(CoordinationServerConfig.builder()
                                                    .baseUrl(wiremock.getHttpBaseUrl())
                                                    .connectTimeout(Duration.ofSeconds(2))
                                                    .requestTimeout(Duration.ofSeconds(2))
                                                    .build());
    }

    @Test
    void testCreateThread(WireMockRuntimeInfo wiremock) {
        stubFor(post("/api/v1/threads")
                        .willReturn(aResponse()
                                            .withStatus(201)
                                            .withHeader("Content-Type", "application/json")
                                            .withBody("{\"id\":\"thread-42\",\"name\":\"Project: Shop\"}")));
        final var threadId = client(wiremock).createThread("Project: Shop",
                                                           List.of("frontend", "backend"),
                                                           Map.of("project", "Shop"));
        assertEquals("thread-42", threadId.orElseThrow());
        verify(postRequestedFor(urlEqualTo("/api/v1/threads"))
                       .withHeader("Content-Type", containing("application/json"))
                       .withRequestBody(matchingJsonPath("$.name", equalTo("Project: Shop")))
                       .withRequestBody(matchingJsonPath("$.participants[0]", equalTo("frontend")))
                       .withRequestBody(matchingJsonPath("$.participants[1]", equalTo("backend")))
                       .withRequestBody(matchingJsonPath("$.metadata.project", equalTo("Shop"))));
    }

    @Test
    void testCreateThreadFailures(WireMockRuntimeInfo wiremock) {
        final var client = client(wiremock);
        stubFor(post("/api/v1/threads").willReturn(aResponse().withStatus(500)));
        assertTrue(client.createThread("Project: Shop", List.of(), Map.of()).isEmpty());

        stubFor(post("/api/v1/threads").willReturn(aResponse().withStatus(200).withBody("{}")));
        assertTrue(client.createThread("Project: Shop", List.of(), null).isEmpty());
    }

    @Test
    void testPostMessage(WireMockRuntimeInfo wiremock) {
        stubFor(post("/api/v1/threads/thread-42/messages").willReturn(aResponse().withStatus(200)));
        assertTrue(client(wiremock).postMessage("thread-42", "Build product catalog", "orchestrator",
                                                List.of("frontend", "security")));
        verify(postRequestedFor(urlEqualTo("/api/v1/threads/thread-42/messages"))
                       .withRequestBody(matchingJsonPath("$.thread_id", equalTo("thread-42")))
                       .withRequestBody(matchingJsonPath("$.content", equalTo("Build product catalog")))
                       .withRequestBody(matchingJsonPath("$.sender", equalTo("orchestrator")))
                       .withRequestBody(matchingJsonPath("$.mentions[1]", equalTo("security"))));
    }

    @Test
    void testPostMessageRejected(WireMockRuntimeInfo wiremock) {
        stubFor(post("/api/v1/threads/missing/messages").willReturn(aResponse().withStatus(404)));
        assertFalse(client(wiremock).postMessage("missing", "hello", "orchestrator", List.of()));
    }

    @Test
    void testListAgents(WireMockRuntimeInfo wiremock) {
        stubFor(get("/api/v1/agents")
                        .willReturn(okJson("[{\"id\":\"ai_frontend_001\"},\"ai_backend_001\",{\"name\":\"x\"}]")));
        final var client = client(wiremock);
        assertEquals(List.of("ai_frontend_001", "ai_backend_001", "x"), client.listAgents().orElseThrow());
        assertTrue(client.isReachable());

        stubFor(get("/api/v1/agents").willReturn(okJson("{\"agents\":[{\"agentId\":\"ai_security_001\"}]}")));
        assertEquals(List.of("ai_security_001"), client.listAgents().orElseThrow());

        stubFor(get("/api/v1/agents").willReturn(aResponse().withStatus(503)));
        assertFalse(client.isReachable());
    }

    @Test
    void testUnreachableServer() {
        final var client = new CoordinationServerClient(CoordinationServerConfig.builder()
                                                                .baseUrl("http://localhost:1")
                                                                .connectTimeout(Duration.ofMillis(500))
                                                                .build());
        assertFalse(client.isReachable());
        assertTrue(client.createThread("Project: Shop", List.of(), Map.of()).isEmpty());
        assertFalse(client.postMessage("t", "c", "orchestrator", List.of()));
    }
}
