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

import com.google.common.annotations.VisibleForTesting;
import io.devsquad.core.transport.CoordinationServerConfig;
import io.devsquad.supervisor.client.CoordinationServerClient;
import io.devsquad.supervisor.launchers.AgentProcessLauncher;
import io.devsquad.supervisor.launchers.CommandProcessLauncher;
import io.devsquad.supervisor.launchers.JavaAgentProcessLauncher;
import io.devsquad.supervisor.orchestrator.CollaborationOrchestrator;
import io.devsquad.supervisor.orchestrator.ScenarioConfig;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Supervisor entry point.
 * <ul>
 *     <li>{@code monitor} (default): runs the configured roles and keeps them alive until the JVM is stopped</li>
 *     <li>{@code demo}: runs the roles, seeds the default collaboration scenario, watches for a while and exits</li>
 * </ul>
 */
@Slf4j
public class SupervisorMain {
    public static final int EXIT_OK = 0;
    public static final int EXIT_BAD_ARGUMENTS = 1;
    public static final int EXIT_SERVER_UNREACHABLE = 2;

    private static final String MODE_MONITOR = "monitor";
    private static final String MODE_DEMO = "demo";

    private final SupervisorConfig config;
    private final CoordinationServerClient client;
    private final AgentProcessLauncher launcher;
    private final ScenarioConfig scenario;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicReference<ProcessSupervisor> running = new AtomicReference<>();

    public SupervisorMain(
            @NonNull SupervisorConfig config,
            @NonNull CoordinationServerClient client,
            @NonNull AgentProcessLauncher launcher,
            @NonNull ScenarioConfig scenario) {
        this.config = config;
        this.client = client;
        this.launcher = launcher;
        this.scenario = scenario;
    }

    public static void main(String[] args) {
        final var config = SupervisorConfig.fromEnv();
        final var launcher = config.agentCommand()
                .<AgentProcessLauncher>map(CommandProcessLauncher::parse)
                .orElseGet(JavaAgentProcessLauncher::new);
        final var main = new SupervisorMain(config,
                                            new CoordinationServerClient(CoordinationServerConfig.fromEnv()),
                                            launcher,
                                            ScenarioConfig.defaultScenario());
        Runtime.getRuntime().addShutdownHook(new Thread(main::stop, "supervisor-shutdown"));
        System.exit(main.run(args));
    }

    @VisibleForTesting
    int run(String... args) {
        if (args.length > 1 || (args.length == 1 && !MODE_MONITOR.equals(args[0]) && !MODE_DEMO.equals(args[0]))) {
            log.error("Usage: SupervisorMain [{}|{}]", MODE_MONITOR, MODE_DEMO);
            return EXIT_BAD_ARGUMENTS;
        }
        if (!client.isReachable()) {
            log.error("Coordination server is not running. Start it and try again");
            return EXIT_SERVER_UNREACHABLE;
        }
        try (final var supervisor = ProcessSupervisor.create(config, launcher)) {
            running.set(supervisor);
            supervisor.addListener(new LoggingListener());
            if (args.length == 1 && MODE_DEMO.equals(args[0])) {
                final var report = CollaborationOrchestrator.builder()
                        .supervisor(supervisor)
                        .client(client)
                        .build()
                        .runDemo(config.getRoles(), scenario);
                log.info("Demo complete. Thread: {}, tasks posted: {}, failed: {}",
                         report.threadId().orElse("<none>"), report.getTasksPosted(), report.getTasksFailed());
                return EXIT_OK;
            }
            config.getRoles().forEach(supervisor::start);
            log.info("{} agents running: {}", supervisor.liveRoles().size(), supervisor.liveRoles());
            supervisor.startMonitoring(config.getMonitorInterval());
            awaitStop();
            log.info("Shutting down agents");
        }
        finally {
            running.set(null);
        }
        return EXIT_OK;
    }

    /**
     * Stops all agents and releases {@link #run(String...)}. Safe to call more than once.
     */
    public void stop() {
        stopped.countDown();
        final var supervisor = running.get();
        if (null != supervisor) {
            supervisor.close();
        }
    }

    private void awaitStop() {
        try {
            stopped.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class LoggingListener implements SupervisorListener {
        @Override
        public void onOutput(ProcessOutput output) {
            log.info("[{}] {}", output.getRole(), output.getLine());
        }

        @Override
        public void onEvent(SupervisorEvent event) {
            switch (event.getType()) {
                case RESTARTED:
                    log.warn("Agent {} crashed and was restarted (restart #{})",
                             event.getRole(), event.getRestartCount());
                    break;
                case START_FAILED:
                case GAVE_UP:
                    log.error("Agent {}: {} ({})", event.getRole(), event.getType(), event.getDetail());
                    break;
                default:
                    log.debug("Agent {}: {}", event.getRole(), event.getType());
                    break;
            }
        }
    }
}
