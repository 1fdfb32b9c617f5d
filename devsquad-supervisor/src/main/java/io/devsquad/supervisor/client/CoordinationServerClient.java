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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.devsquad.core.transport.CoordinationServerConfig;
import io.devsquad.core.utils.AgentUtils;
import io.devsquad.core.utils.JsonUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Talks to the thread and agent listing API of the coordination server. Failures are logged and reported through
 * the return value.
 */
@Slf4j
public class CoordinationServerClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final CoordinationServerConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;

    public CoordinationServerClient(@NonNull CoordinationServerConfig config) {
        this(config, new OkHttpClient(), JsonUtils.createMapper());
    }

    public CoordinationServerClient(
            @NonNull CoordinationServerConfig config,
            @NonNull OkHttpClient httpClient,
            @NonNull ObjectMapper mapper) {
        this.config = config;
        this.httpClient = httpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .callTimeout(config.getRequestTimeout())
                .build();
        this.mapper = mapper;
    }

    /**
     * Creates a thread
     *
     * @return Id of the new thread, empty if the server refused or could not be reached
     */
    public Optional<String> createThread(
            @NonNull String name,
            @NonNull Collection<String> participants,
            Map<String, Object> metadata) {
        final var body = NewThreadRequest.builder()
                .name(name)
                .participants(participants)
                .metadata(metadata)
                .build();
        try (final var response = post(threadsUrl(), body)) {
            if (!isCreated(response)) {
                log.error("Failed to create thread. Status: {}", response.code());
                return Optional.empty();
            }
            final var threadId = JsonUtils.text(readBody(response), "id");
            if (threadId.isEmpty()) {
                log.error("Thread created but the server did not return an id");
            }
            else {
                log.info("Created thread {} ({})", name, threadId.get());
            }
            return threadId;
        }
        catch (IOException e) {
            log.error("Error creating thread: {}", AgentUtils.rootCauseMessage(e));
            return Optional.empty();
        }
    }

    /**
     * Posts a message into a thread
     *
     * @return true if the server accepted the message
     */
    public boolean postMessage(
            @NonNull String threadId,
            @NonNull String content,
            @NonNull String sender,
            @NonNull Collection<String> mentions) {
        final var body = ThreadMessageRequest.builder()
                .threadId(threadId)
                .content(content)
                .sender(sender)
                .mentions(mentions)
                .build();
        final var url = threadsUrl().newBuilder()
                .addPathSegment(threadId)
                .addPathSegment("messages")
                .build();
        try (final var response = post(url, body)) {
            if (!isCreated(response)) {
                log.error("Failed to send message to thread {}. Status: {}", threadId, response.code());
                return false;
            }
            log.info("Message sent to thread {}: {}", threadId, AgentUtils.abbreviate(content, 80));
            return true;
        }
        catch (IOException e) {
            log.error("Error sending message to thread {}: {}", threadId, AgentUtils.rootCauseMessage(e));
            return false;
        }
    }

    /**
     * Agents currently known to the server
     *
     * @return Agent ids, empty if the server could not be reached
     */
    public Optional<List<String>> listAgents() {
        final var request = new Request.Builder()
                .url(config.baseHttpUrl().newBuilder().addPathSegments("api/v1/agents").build())
                .get()
                .build();
        try (final var response = httpClient.newCall(request).execute()) {
            if (response.code() != 200) {
                log.warn("Agent listing failed. Status: {}", response.code());
                return Optional.empty();
            }
            return Optional.of(agentIds(readBody(response)));
        }
        catch (IOException e) {
            log.warn("Coordination server at {} is not reachable: {}",
                     config.getBaseUrl(), AgentUtils.rootCauseMessage(e));
            return Optional.empty();
        }
    }

    public boolean isReachable() {
        return listAgents().isPresent();
    }

    private Response post(HttpUrl url, Object body) throws IOException {
        final var request = new Request.Builder()
                .url(url)
                .post(RequestBody.create(mapper.writeValueAsBytes(body), JSON))
                .build();
        return httpClient.newCall(request).execute();
    }

    private HttpUrl threadsUrl() {
        return config.baseHttpUrl().newBuilder()
                .addPathSegments("api/v1/threads")
                .build();
    }

    private JsonNode readBody(Response response) throws IOException {
        final var body = response.body();
        if (null == body) {
            return mapper.createObjectNode();
        }
        final var content = body.string();
        return content.isBlank() ? mapper.createObjectNode() : mapper.readTree(content);
    }

    private static boolean isCreated(Response response) {
        return response.code() == 200 || response.code() == 201;
    }

    private static List<String> agentIds(JsonNode node) {
        final var agents = node.isArray()
                           ? node
                           : JsonUtils.field(node, "agents").filter(JsonNode::isArray).orElse(null);
        final var ids = new ArrayList<String>();
        if (null == agents) {
            return ids;
        }
        agents.forEach(agent -> {
            if (agent.isTextual()) {
                ids.add(agent.asText());
            }
            else {
                JsonUtils.text(agent, "id", "agentId", "name").ifPresent(ids::add);
            }
        });
        return ids;
    }
}
