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

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RestartPolicyTest {

    @Test
    void testUnconditional() {
        final var policy = RestartPolicy.unconditional();
        assertTrue(policy.allowsRestart(0));
        assertTrue(policy.allowsRestart(1_000_000));
        assertEquals(Duration.ZERO, policy.backoff(1));
        assertEquals(Duration.ZERO, policy.backoff(50));
    }

    @Test
    void testCap() {
        final var policy = RestartPolicy.builder().maxRestarts(3).build();
        assertTrue(policy.allowsRestart(2));
        assertFalse(policy.allowsRestart(3));
        assertFalse(RestartPolicy.builder().maxRestarts(0).build().allowsRestart(0));
    }

    @Test
    void testExponentialBackoff() {
        final var policy = RestartPolicy.builder()
                .initialBackoff(Duration.ofMillis(100))
                .multiplier(2.0)
                .maxBackoff(Duration.ofSeconds(1))
                .build();
        assertEquals(Duration.ofMillis(100), policy.backoff(1));
        assertEquals(Duration.ofMillis(200), policy.backoff(2));
        assertEquals(Duration.ofMillis(400), policy.backoff(3));
        assertEquals(Duration.ofMillis(800), policy.backoff(4));
        assertEquals(Duration.ofSeconds(1), policy.backoff(5));
        assertEquals(Duration.ofSeconds(1), policy.backoff(500));
    }

    @Test
    void testFixedBackoff() {
        final var policy = RestartPolicy.builder()
                .initialBackoff(Duration.ofMillis(250))
                .multiplier(1.0)
                .build();
        assertEquals(Duration.ofMillis(250), policy.backoff(1));
        assertEquals(Duration.ofMillis(250), policy.backoff(10));
    }
}
