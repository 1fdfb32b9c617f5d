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

package io.devsquad.core.transport;

import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.utils.AgentUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.BufferedSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link CoordinationTransport} over OkHttp. The event stream is a long lived GET with no read timeout; outbound
 * events are POSTed as JSON to the message endpoint.
 */
@Slf4j
public class OkHttpCoordinationTransport implements CoordinationTransport {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final CoordinationServerConfig config;
    private final OkHttpClient streamClient;
    private final OkHttpClient requestClient;

    public OkHttpCoordinationTransport(@NonNull CoordinationServerConfig config) {
        this(config, new OkHttpClient());
    }

    public OkHttpCoordinationTransport(@NonNull CoordinationServerConfig config, @NonNull OkHttpClient httpClient) {
        this.config = config;
        this.streamClient = httpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .readTimeout(Duration.ZERO)
                .callTimeout(Duration.ZERO)
                .build();
        this.requestClient = httpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .callTimeout(config.getRequestTimeout())
                .build();
    }

    @Override
    public Optional<Stream<String>> openStream(AgentIdentity identity) {
        final var url = config.streamUrl(identity.getId());
        final var request = new Request.Builder()
                .url(url)
                .header("Accept", "text/event-stream")
                .header("Cache-Control", "no-cache")
                .get()
                .build();
        log.info("Connecting agent {} to {}", identity.getId(), url);
        final var call = streamClient.newCall(request);
        final Response response;
        try {
            response = call.execute();
        }
        catch (IOException e) {
            log.error("Could not connect to coordination server at {}: {}", url, AgentUtils.rootCauseMessage(e));
            return Optional.empty();
        }
        final var body = response.body();
        if (!response.isSuccessful() || null == body) {
            log.error("Coordination server refused stream for agent {}. Status: {}", identity.getId(), response.code());
            response.close();
            return Optional.empty();
        }
        log.info("Stream open for agent {}", identity.getId());
        return Optional.of(StreamSupport.stream(new LineSpliterator(identity.getId(), body.source()), false)
                                   .onClose(() -> closeQuietly(call, response)));
    }

    @Override
    public boolean deliver(String payload) {
        final var request = new Request.Builder()
                .url(config.messageUrl())
                .post(RequestBody.create(payload.getBytes(StandardCharsets.UTF_8), JSON))
                .build();
        try (final var response = requestClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.error("Failed to send message. Status: {}", response.code());
                return false;
            }
            return true;
        }
        catch (IOException e) {
            log.error("Failed to send message: {}", AgentUtils.rootCauseMessage(e));
            return false;
        }
    }

    @Override
    public void close() {
        streamClient.dispatcher().cancelAll();
        streamClient.connectionPool().evictAll();
        requestClient.connectionPool().evictAll();
    }

    private static void closeQuietly(Call call, Response response) {
        call.cancel();
        try {
            response.close();
        }
        catch (RuntimeException e) {
            log.debug("Error closing stream response: {}", AgentUtils.rootCauseMessage(e));
        }
    }

    /**
     * Reads one line per advance. The stream ends on end of input or on a read error.
     */
    private static final class LineSpliterator extends Spliterators.AbstractSpliterator<String> {
        private final String agentId;
        private final BufferedSource source;

        private LineSpliterator(String agentId, BufferedSource source) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.agentId = agentId;
            this.source = source;
        }

        @Override
        public boolean tryAdvance(Consumer<? super String> action) {
            final String line;
            try {
                line = source.readUtf8Line();
            }
            catch (IOException | IllegalStateException e) {
                log.warn("Stream for agent {} ended with error: {}", agentId, AgentUtils.rootCauseMessage(e));
                return false;
            }
            if (null == line) {
                log.info("Stream for agent {} closed by server", agentId);
                return false;
            }
            action.accept(line);
            return true;
        }
    }
}
