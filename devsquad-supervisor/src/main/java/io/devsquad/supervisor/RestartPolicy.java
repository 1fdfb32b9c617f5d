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
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Decides whether a crashed agent process is started again and how long to wait before doing so. The default
 * restarts immediately and without limit.
 */
@Value
@Builder
@Jacksonized
public class RestartPolicy {
    public static final int UNBOUNDED = -1;

    /**
     * Maximum restarts per role for the life of the supervisor. Negative means no limit.
     */
    @Builder.Default
    int maxRestarts = UNBOUNDED;

    @NonNull
    @Builder.Default
    Duration initialBackoff = Duration.ZERO;

    @Builder.Default
    double multiplier = 2.0;

    @NonNull
    @Builder.Default
    Duration maxBackoff = Duration.ofMinutes(1);

    public static RestartPolicy unconditional() {
        return RestartPolicy.builder().build();
    }

    /**
     * @param restartsSoFar Number of restarts already performed for the role
     * @return true if another restart is allowed
     */
    public boolean allowsRestart(int restartsSoFar) {
        return maxRestarts < 0 || restartsSoFar < maxRestarts;
    }

    /**
     * Delay before the given restart attempt.
     *
     * @param attempt 1 based attempt number
     */
    public Duration backoff(int attempt) {
        if (initialBackoff.isZero() || initialBackoff.isNegative()) {
            return Duration.ZERO;
        }
        final var factor = Math.pow(Math.max(1.0, multiplier), Math.max(0, attempt - 1));
        final var millis = initialBackoff.toMillis() * factor;
        if (millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
