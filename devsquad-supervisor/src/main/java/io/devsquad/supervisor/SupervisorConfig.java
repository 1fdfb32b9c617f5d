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

package io.devsquad.supervisor;

import com.google.common.base.Splitter;
import io.devsquad.core.model.AgentRole;
import io.devsquad.core.transport.CoordinationServerConfig;
import io.devsquad.core.utils.EnvLoader;
import io.devsquad.models.ChatModelConfig;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What the supervisor runs and how it watches it
 */
@Value
@Builder
@Jacksonized
public class SupervisorConfig {
    public static final String ROLES_ENV = "DEVSQUAD_ROLES";
    public static final String AGENT_COMMAND_ENV = "DEVSQUAD_AGENT_COMMAND";

    public static final List<String> DEFAULT_ROLES = List.of(AgentRole.Values.FRONTEND,
                                                             AgentRole.Values.BACKEND,
                                                             AgentRole.Values.SECURITY);

    @NonNull
    @Builder.Default
    List<String> roles = DEFAULT_ROLES;

    @NonNull
    @Builder.Default
    Duration monitorInterval = Duration.ofSeconds(1);

    /**
     * How long a process gets to exit after the termination signal before it is killed
     */
    @NonNull
    @Builder.Default
    Duration stopGracePeriod = Duration.ofSeconds(1);

    @NonNull
    @Builder.Default
    RestartPolicy restartPolicy = RestartPolicy.unconditional();

    /**
     * Extra environment variables for every agent process
     */
    @Singular("environmentVariable")
    Map<String, String> environment;

    /**
     * Command template for agents. Empty means agents run in a child JVM on the current class path.
     */
    String agentCommand;

    public static SupervisorConfig fromEnv() {
        final var serverConfig = CoordinationServerConfig.fromEnv();
        final var builder = SupervisorConfig.builder()
                .roles(EnvLoader.readEnv(ROLES_ENV)
                               .map(SupervisorConfig::parseRoles)
                               .filter(roles -> !roles.isEmpty())
                               .orElse(DEFAULT_ROLES))
                .agentCommand(EnvLoader.readEnv(AGENT_COMMAND_ENV).orElse(null))
                .environmentVariable(CoordinationServerConfig.SERVER_URL_ENV, serverConfig.getBaseUrl())
                .environmentVariable(CoordinationServerConfig.APPLICATION_ID_ENV, serverConfig.getApplicationId())
                .environmentVariable(CoordinationServerConfig.PRIVACY_KEY_ENV, serverConfig.getPrivacyKey())
                .environmentVariable(CoordinationServerConfig.SESSION_ID_ENV, serverConfig.getSessionId());
        EnvLoader.readEnv(ChatModelConfig.API_KEY_ENV)
                .ifPresent(key -> builder.environmentVariable(ChatModelConfig.API_KEY_ENV, key));
        return builder.build();
    }

    public Optional<String> agentCommand() {
        return Optional.ofNullable(agentCommand).filter(command -> !command.isBlank());
    }

    static List<String> parseRoles(String value) {
        return Splitter.on(',')
                .trimResults()
                .omitEmptyStrings()
                .splitToList(value);
    }
}
