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

import com.google.common.base.Strings;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory record of the threads an agent has seen. Entries are never removed.
 */
@Slf4j
public class ThreadStateTracker {
    private final Map<String, ThreadState> threads = new ConcurrentHashMap<>();
    private final AtomicReference<String> currentThread = new AtomicReference<>();
    private final Clock clock;

    public ThreadStateTracker() {
        this(Clock.systemUTC());
    }

    public ThreadStateTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Records activity on a thread. Known participants are merged with the given ones and the sender.
     *
     * @param threadId     Thread id. Activity without a thread id is ignored.
     * @param participants Participants reported by the server. May be null or empty.
     * @param sender       Sender of the message, if any
     * @return Updated state, empty if the thread id was blank
     */
    public Optional<ThreadState> observe(
            final String threadId,
            final Collection<String> participants,
            final String sender) {
        if (Strings.isNullOrEmpty(threadId)) {
            return Optional.empty();
        }
        final var now = clock.instant();
        final var updated = threads.compute(threadId, (id, existing) -> {
            final var merged = new LinkedHashSet<String>();
            if (null != existing) {
                merged.addAll(existing.getParticipants());
            }
            if (null != participants) {
                participants.stream()
                        .filter(participant -> !Strings.isNullOrEmpty(participant))
                        .forEach(merged::add);
            }
            if (!Strings.isNullOrEmpty(sender)) {
                merged.add(sender);
            }
            return new ThreadState(id, Set.copyOf(merged), now);
        });
        if (!threadId.equals(currentThread.getAndSet(threadId))) {
            log.info("Now active in thread {} with participants: {}", threadId, updated.getParticipants());
        }
        return Optional.of(updated);
    }

    public Optional<ThreadState> get(final String threadId) {
        return Optional.ofNullable(null == threadId ? null : threads.get(threadId));
    }

    /**
     * The thread the agent saw activity on most recently
     */
    public Optional<String> currentThread() {
        return Optional.ofNullable(currentThread.get());
    }

    public Map<String, ThreadState> snapshot() {
        return Map.copyOf(threads);
    }
}
