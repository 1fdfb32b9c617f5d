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

package io.devsquad.supervisor.orchestrator;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;

/**
 * A collaboration scenario: one thread per project and an ordered list of tasks posted into it
 */
@Value
@Builder
@Jacksonized
public class ScenarioConfig {
    public static final String DEFAULT_PROJECT_NAME = "E-Commerce Platform";
    public static final List<String> DEFAULT_TASKS = List.of(
            "Create user authentication system with JWT",
            "Build product catalog with search functionality",
            "Implement shopping cart and checkout",
            "Perform security audit on authentication");

    @NonNull
    @Builder.Default
    String projectName = DEFAULT_PROJECT_NAME;

    @NonNull
    @Builder.Default
    List<String> tasks = DEFAULT_TASKS;

    @NonNull
    @Builder.Default
    Duration delayBetweenPosts = Duration.ofSeconds(3);

    /**
     * Pause after each agent is started, giving it time to connect
     */
    @NonNull
    @Builder.Default
    Duration startupDelay = Duration.ofSeconds(2);

    /**
     * How long agents are watched after the last task is posted
     */
    @NonNull
    @Builder.Default
    Duration monitorWindow = Duration.ofSeconds(30);

    @NonNull
    @Builder.Default
    Duration monitorInterval = Duration.ofSeconds(1);

    public static ScenarioConfig defaultScenario() {
        return ScenarioConfig.builder().build();
    }
}
