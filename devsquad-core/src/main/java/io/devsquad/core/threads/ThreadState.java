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

package io.devsquad.core.threads;

import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Set;

/**
 * Last known state of a collaboration thread as seen by one agent
 */
@Value
@With
public class ThreadState {
    @NonNull
    String threadId;
    @NonNull
    Set<String> participants;
    @NonNull
    Instant lastSeenAt;
}
