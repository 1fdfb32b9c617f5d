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

package io.devsquad.agents;

import io.devsquad.core.engine.ProtocolEngine;
import io.devsquad.core.transport.CoordinationServerConfig;
import io.devsquad.core.transport.CoordinationTransport;
import io.devsquad.core.transport.OkHttpCoordinationTransport;
import io.devsquad.models.ChatModelConfig;
import io.devsquad.models.SimpleOpenAIResponseProvider;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs a single agent role against the coordination server until its stream ends or it is stopped.
 */
@Slf4j
public class AgentProcess {
    public static final int EXIT_OK = 0;
    public static final int EXIT_BAD_ARGUMENTS = 1;
    public static final int EXIT_STREAM_UNAVAILABLE = 2;

    private final CoordinationServerConfig serverConfig;
    private final ChatModelConfig modelConfig;
    private final Function<CoordinationServerConfig, CoordinationTransport> transportFactory;

    private final AtomicReference<ProtocolEngine> engine = new AtomicReference<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    @Builder
    public AgentProcess(
            CoordinationServerConfig serverConfig,
            ChatModelConfig modelConfig,
            Function<CoordinationServerConfig, CoordinationTransport> transportFactory) {
        this.serverConfig = Objects.requireNonNullElseGet(serverConfig, CoordinationServerConfig::fromEnv);
        this.modelConfig = Objects.requireNonNullElseGet(modelConfig, ChatModelConfig::fromEnv);
        this.transportFactory = null != transportFactory
                                ? transportFactory
                                : OkHttpCoordinationTransport::new;
    }

    /**
     * @param args The role name as the only argument
     * @return Process exit code
     */
    public int run(final String... args) {
        if (null == args || args.length != 1) {
            log.error("Usage: AgentMain <role>. Known roles: {}", AgentProfiles.knownRoles());
            return EXIT_BAD_ARGUMENTS;
        }
        final AgentProfile profile;
        try {
            profile = AgentProfiles.forRole(args[0]);
        }
        catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return EXIT_BAD_ARGUMENTS;
        }
        return run(profile);
    }

    public int run(final AgentProfile profile) {
        final var identity = profile.identity();
        if (!modelConfig.hasApiKey()) {
            log.warn("{} not set. {} will use canned responses", ChatModelConfig.API_KEY_ENV, identity.getDisplayName());
        }
        try (final var transport = transportFactory.apply(serverConfig)) {
            final var protocolEngine = ProtocolEngine.builder()
                    .identity(identity)
                    .transport(transport)
                    .registry(profile.capabilities())
                    .responseProvider(SimpleOpenAIResponseProvider.create(modelConfig,
                                                                          identity.getDisplayName(),
                                                                          profile.roleDescription(),
                                                                          profile.fallbackProvider()))
                    .build();
            engine.set(protocolEngine);
            if (stopped.get()) {
                protocolEngine.close();
                return EXIT_OK;
            }
            log.info("Starting {} ({}) with {} capabilities",
                     identity.getDisplayName(), identity.getId(), protocolEngine.getRegistry().size());
            if (!protocolEngine.run()) {
                log.error("Could not open stream to coordination server at {}", serverConfig.getBaseUrl());
                return EXIT_STREAM_UNAVAILABLE;
            }
            log.info("Stopping {}", identity.getDisplayName());
            return EXIT_OK;
        }
    }

    /**
     * Closes the running engine, if any. Safe to call from a shutdown hook.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            final var current = engine.get();
            if (null != current) {
                current.close();
            }
        }
    }
}
