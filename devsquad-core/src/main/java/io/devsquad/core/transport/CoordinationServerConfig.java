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

import io.devsquad.core.utils.EnvLoader;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import okhttp3.HttpUrl;

import java.time.Duration;

/**
 * Where the coordination server lives and how long to wait for it
 */
@Value
@Builder
@Jacksonized
public class CoordinationServerConfig {
    public static final String SERVER_URL_ENV = "CORAL_SERVER_URL";
    public static final String APPLICATION_ID_ENV = "CORAL_APPLICATION_ID";
    public static final String PRIVACY_KEY_ENV = "CORAL_PRIVACY_KEY";
    public static final String SESSION_ID_ENV = "CORAL_SESSION_ID";

    public static final String DEFAULT_SERVER_URL = "http://localhost:5555";
    public static final String DEFAULT_APPLICATION_ID = "aiDevSquad";
    public static final String DEFAULT_PRIVACY_KEY = "privkey";
    public static final String DEFAULT_SESSION_ID = "session1";

    @NonNull
    @Builder.Default
    String baseUrl = DEFAULT_SERVER_URL;
    @NonNull
    @Builder.Default
    String applicationId = DEFAULT_APPLICATION_ID;
    @NonNull
    @Builder.Default
    String privacyKey = DEFAULT_PRIVACY_KEY;
    @NonNull
    @Builder.Default
    String sessionId = DEFAULT_SESSION_ID;
    /**
     * Bounds establishing the TCP connection of the stream and of every request
     */
    @NonNull
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(5);
    /**
     * Bounds a single outbound request end to end
     */
    @NonNull
    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(10);

    public static CoordinationServerConfig fromEnv() {
        return CoordinationServerConfig.builder()
                .baseUrl(EnvLoader.readEnv(SERVER_URL_ENV, DEFAULT_SERVER_URL))
                .applicationId(EnvLoader.readEnv(APPLICATION_ID_ENV, DEFAULT_APPLICATION_ID))
                .privacyKey(EnvLoader.readEnv(PRIVACY_KEY_ENV, DEFAULT_PRIVACY_KEY))
                .sessionId(EnvLoader.readEnv(SESSION_ID_ENV, DEFAULT_SESSION_ID))
                .build();
    }

    /**
     * Parsed base url
     *
     * @throws IllegalArgumentException if the base url is not a valid http(s) url
     */
    public HttpUrl baseHttpUrl() {
        return HttpUrl.get(baseUrl);
    }

    public HttpUrl streamUrl(final String agentId) {
        return baseHttpUrl().newBuilder()
                .addPathSegments("sse/v1/devmode")
                .addPathSegment(applicationId)
                .addPathSegment(privacyKey)
                .addPathSegment(sessionId)
                .addPathSegment("sse")
                .addQueryParameter("agentId", agentId)
                .build();
    }

    public HttpUrl messageUrl() {
        return baseHttpUrl().newBuilder()
                .addPathSegment("mcp")
                .build();
    }
}
