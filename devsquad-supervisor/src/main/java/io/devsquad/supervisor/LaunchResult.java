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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of starting an agent process. Either carries the process or the reason it could not be started.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LaunchResult {
    SupervisedProcess process;
    String failureReason;

    public static LaunchResult launched(SupervisedProcess process) {
        return new LaunchResult(process, null);
    }

    public static LaunchResult failed(String failureReason) {
        return new LaunchResult(null, failureReason);
    }

    public boolean isLaunched() {
        return null != process;
    }

    public Optional<SupervisedProcess> process() {
        return Optional.ofNullable(process);
    }
}
