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

import io.devsquad.supervisor.ProcessSupervisor;
import io.devsquad.supervisor.client.CoordinationServerClient;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Seeds a multi agent collaboration: creates a thread for a project on the coordination server and posts tasks
 * into it for the supervised agents to pick up.
 */
@Slf4j
public class CollaborationOrchestrator {
    public static final String SENDER = "orchestrator";

    private final ProcessSupervisor supervisor;
    private final CoordinationServerClient client;
    private final Clock clock;

    @Builder
    public CollaborationOrchestrator(
            @NonNull ProcessSupervisor supervisor,
            @NonNull CoordinationServerClient client,
            Clock clock) {
        this.supervisor = supervisor;
        this.client = client;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    /**
     * Creates the project thread with the live roles as participants and posts every task into it, mentioning all
     * live roles. A task that cannot be posted is logged and the next one is tried. Nothing is posted if the thread
     * cannot be created.
     */
    public ScenarioReport runScenario(@NonNull ScenarioConfig scenario) {
        final var projectName = scenario.getProjectName();
        final var participants = List.copyOf(supervisor.liveRoles());
        final var metadata = new LinkedHashMap<String, Object>();
        metadata.put("created_at", clock.instant().toString());
        metadata.put("project", projectName);
        final var threadId = client.createThread("Project: " + projectName, participants, metadata)
                .orElse(null);
        final var report = ScenarioReport.builder().projectName(projectName);
        if (null == threadId) {
            log.error("Could not create thread for project {}. No tasks will be posted", projectName);
            return report.build();
        }
        report.threadId(threadId);
        var posted = 0;
        var failed = 0;
        final var tasks = scenario.getTasks();
        for (var i = 0; i < tasks.size(); i++) {
            if (i > 0 && !pause(scenario.getDelayBetweenPosts())) {
                log.warn("Interrupted after posting {} of {} tasks", posted, tasks.size());
                return report.tasksPosted(posted).tasksFailed(failed).interrupted(true).build();
            }
            final var task = tasks.get(i);
            log.info("Posting task: {}", task);
            if (client.postMessage(threadId, task, SENDER, participants)) {
                posted++;
            }
            else {
                failed++;
            }
        }
        return report.tasksPosted(posted).tasksFailed(failed).build();
    }

    /**
     * Starts the given roles, runs the scenario, watches the agents for the monitoring window and stops them all.
     */
    public ScenarioReport runDemo(@NonNull Collection<String> roles, @NonNull ScenarioConfig scenario) {
        try {
            for (final var role : roles) {
                final var launched = supervisor.start(role);
                if (!launched.isLaunched()) {
                    log.error("Agent {} could not be started: {}", role, launched.getFailureReason());
                    continue;
                }
                if (!pause(scenario.getStartupDelay())) {
                    return ScenarioReport.builder()
                            .projectName(scenario.getProjectName())
                            .interrupted(true)
                            .build();
                }
            }
            log.info("{} agents running: {}", supervisor.liveRoles().size(), supervisor.liveRoles());
            final var report = runScenario(scenario);
            if (!report.isInterrupted()) {
                watch(scenario.getMonitorWindow(), scenario.getMonitorInterval());
            }
            return report;
        }
        finally {
            supervisor.stopAll();
        }
    }

    private void watch(Duration window, Duration interval) {
        final var deadline = clock.instant().plus(window);
        while (clock.instant().isBefore(deadline)) {
            supervisor.monitor();
            if (!pause(interval)) {
                return;
            }
        }
        supervisor.monitor();
    }

    private static boolean pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            TimeUnit.MILLISECONDS.sleep(duration.toMillis());
            return true;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
