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

/**
 * Process entry point. Takes the role name as its only argument.
 */
public class AgentMain {
    public static void main(String[] args) {
        final var process = AgentProcess.builder().build();
        Runtime.getRuntime().addShutdownHook(new Thread(process::stop, "agent-shutdown"));
        System.exit(process.run(args));
    }
}
