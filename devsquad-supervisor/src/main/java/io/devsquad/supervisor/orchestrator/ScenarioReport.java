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
import lombok.Value;

import java.util.Optional;

@Value
@Builder
public class ScenarioReport {
    String projectName;
    /**
     * Null if the thread could not be created
     */
    String threadId;
    int tasksPosted;
    int tasksFailed;
    boolean interrupted;

    public Optional<String> threadId() {
        return Optional.ofNullable(threadId);
    }

    public boolean isThreadCreated() {
        return null != threadId;
    }
}
