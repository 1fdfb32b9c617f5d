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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Lifecycle change of a supervised role
 */
@Value
@Builder
public class SupervisorEvent {
    @NonNull
    SupervisorEventType type;
    @NonNull
    String role;
    int restartCount;
    /**
     * Exit code for {@link SupervisorEventType#EXITED}, null otherwise
     */
    Integer exitCode;
    /**
     * Failure reason or other human readable detail. Can be null.
     */
    String detail;
    @NonNull
    Instant timestamp;
}
