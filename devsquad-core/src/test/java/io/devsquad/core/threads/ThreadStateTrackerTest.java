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

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link ThreadStateTracker}
 */
class ThreadStateTrackerTest {

    @Test
    void testParticipantsAreMerged() {
        final var clock = Clock.fixed(Instant.parse("2025-01-01T10:00:00Z"), ZoneOffset.UTC);
        final var tracker = new ThreadStateTracker(clock);
        tracker.observe("t1", List.of("ai_frontend_001", "ai_backend_001"), "orchestrator");
        final var state = tracker.observe("t1", List.of("ai_security_001"), "ai_backend_001").orElseThrow();
        assertEquals(Set.of("ai_frontend_001", "ai_backend_001", "ai_security_001", "orchestrator"),
                     state.getParticipants());
        assertEquals(clock.instant(), state.getLastSeenAt());
        assertEquals(state, tracker.get("t1").orElseThrow());
        assertEquals("t1", tracker.currentThread().orElseThrow());
    }

    @Test
    void testLastSeenMovesForward() {
        final var tracker = new ThreadStateTracker(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
        tracker.observe("t1", null, null);
        final var later = tracker.get("t1").orElseThrow().withLastSeenAt(Instant.EPOCH.plusSeconds(5));
        assertEquals(Instant.EPOCH.plusSeconds(5), later.getLastSeenAt());
        assertTrue(tracker.get("t1").orElseThrow().getParticipants().isEmpty());
    }

    @Test
    void testBlankThreadIsIgnored() {
        final var tracker = new ThreadStateTracker();
        assertTrue(tracker.observe(null, List.of("a"), "b").isEmpty());
        assertTrue(tracker.observe("", List.of("a"), "b").isEmpty());
        assertTrue(tracker.snapshot().isEmpty());
        assertTrue(tracker.currentThread().isEmpty());
    }

    @Test
    void testCurrentThreadFollowsActivity() {
        final var tracker = new ThreadStateTracker();
        tracker.observe("t1", List.of(), "a");
        tracker.observe("t2", List.of(), "b");
        assertEquals("t2", tracker.currentThread().orElseThrow());
        assertEquals(2, tracker.snapshot().size());
    }
}
