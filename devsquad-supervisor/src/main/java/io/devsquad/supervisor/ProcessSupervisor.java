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

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.devsquad.core.utils.AgentUtils;
import io.devsquad.supervisor.launchers.AgentProcessLauncher;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Keeps one live OS process per started role until shutdown is requested.
 * <p>
 * All lifecycle changes ({@link #start(String)}, {@link #monitor()}, {@link #stopAll()}) are serialized on this
 * object. Output of every process is read on a dedicated daemon thread into a queue that each monitoring pass drains
 * to the registered {@link SupervisorListener}s, so a pass never blocks on a process.
 */
@Slf4j
public class ProcessSupervisor implements AutoCloseable {
    private final AgentProcessLauncher launcher;
    private final RestartPolicy restartPolicy;
    private final Duration stopGracePeriod;
    private final Map<String, String> environment;
    private final Clock clock;

    private final List<SupervisorListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, SupervisedProcess> live = new ConcurrentHashMap<>();
    private final Map<String, Instant> pendingRestarts = new ConcurrentHashMap<>();
    private final Map<String, Integer> restartCounts = new ConcurrentHashMap<>();
    private final Queue<ProcessOutput> output = new ConcurrentLinkedQueue<>();
    private final ExecutorService outputReaders;
    private final AtomicReference<ScheduledExecutorService> monitorExecutor = new AtomicReference<>();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Builder
    public ProcessSupervisor(
            @NonNull AgentProcessLauncher launcher,
            RestartPolicy restartPolicy,
            Duration stopGracePeriod,
            Map<String, String> environment,
            Clock clock) {
        this.launcher = launcher;
        this.restartPolicy = Objects.requireNonNullElseGet(restartPolicy, RestartPolicy::unconditional);
        this.stopGracePeriod = Objects.requireNonNullElse(stopGracePeriod, Duration.ofSeconds(1));
        this.environment = Map.copyOf(Objects.requireNonNullElseGet(environment, Map::<String, String>of));
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.outputReaders = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                                   .setDaemon(true)
                                                                   .setNameFormat("agent-output-%d")
                                                                   .build());
    }

    public static ProcessSupervisor create(@NonNull SupervisorConfig config, @NonNull AgentProcessLauncher launcher) {
        return ProcessSupervisor.builder()
                .launcher(launcher)
                .restartPolicy(config.getRestartPolicy())
                .stopGracePeriod(config.getStopGracePeriod())
                .environment(config.getEnvironment())
                .build();
    }

    public ProcessSupervisor addListener(@NonNull SupervisorListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Starts the agent for a role. Starting a role that already has a live process returns that process.
     * Clears a previous shutdown request.
     *
     * @return The started process or the reason it could not be started
     */
    public synchronized LaunchResult start(@NonNull String role) {
        Preconditions.checkState(!closed.get(), "Supervisor is closed");
        shutdownRequested.set(false);
        final var existing = live.get(role);
        if (null != existing && existing.isAlive()) {
            log.warn("Agent {} is already running (pid {})", role, existing.pid());
            return LaunchResult.launched(existing);
        }
        pendingRestarts.remove(role);
        final var restartCount = restartCount(role);
        final var result = launch(role, restartCount);
        if (result.isLaunched()) {
            publish(event(SupervisorEventType.STARTED, role, restartCount, null, null));
        }
        else {
            publish(event(SupervisorEventType.START_FAILED, role, restartCount, null, result.getFailureReason()));
        }
        return result;
    }

    /**
     * One monitoring pass. Reaps exited processes, restarts them as the policy allows and relays captured output.
     */
    public synchronized void monitor() {
        final var now = clock.instant();
        live.values()
                .stream()
                .filter(process -> !process.isAlive())
                .collect(Collectors.toList())
                .forEach(process -> handleExit(process, now));
        restartDue(now);
        drainOutput();
    }

    /**
     * Terminates every live process. Processes that do not exit within the grace period are killed.
     * Safe to call repeatedly.
     */
    public synchronized void stopAll() {
        shutdownRequested.set(true);
        pendingRestarts.clear();
        final var processes = List.copyOf(live.values());
        live.clear();
        if (processes.isEmpty()) {
            return;
        }
        log.info("Stopping {} agent processes", processes.size());
        processes.forEach(process -> process.getProcess().destroy());
        final var deadline = System.nanoTime() + stopGracePeriod.toNanos();
        for (final var process : processes) {
            try {
                final var remaining = Math.max(0L, deadline - System.nanoTime());
                if (!process.getProcess().waitFor(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Agent {} did not exit in {}. Killing it", process.getRole(), stopGracePeriod);
                    process.getProcess().destroyForcibly();
                }
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.getProcess().destroyForcibly();
            }
            log.info("Stopped {} agent", process.getRole());
        }
        drainOutput();
    }

    /**
     * Runs {@link #monitor()} on a background thread at a fixed interval
     */
    public void startMonitoring(@NonNull Duration interval) {
        Preconditions.checkArgument(!interval.isNegative() && !interval.isZero(), "Interval must be positive");
        final var executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                                .setDaemon(true)
                                                                                .setNameFormat("supervisor-monitor")
                                                                                .build());
        if (!monitorExecutor.compareAndSet(null, executor)) {
            executor.shutdownNow();
            throw new IllegalStateException("Monitoring is already running");
        }
        final var millis = interval.toMillis();
        executor.scheduleWithFixedDelay(this::monitorSafely, millis, millis, TimeUnit.MILLISECONDS);
    }

    public Set<String> liveRoles() {
        return Collections.unmodifiableSet(new TreeSet<>(live.keySet()));
    }

    public Optional<SupervisedProcess> process(String role) {
        return Optional.ofNullable(live.get(role));
    }

    public int restartCount(String role) {
        return restartCounts.getOrDefault(role, 0);
    }

    public boolean isShutdownRequested() {
        return shutdownRequested.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        final var executor = monitorExecutor.getAndSet(null);
        if (null != executor) {
            executor.shutdownNow();
        }
        stopAll();
        outputReaders.shutdownNow();
    }

    private LaunchResult launch(String role, int restartCount) {
        final List<String> command;
        try {
            command = List.copyOf(launcher.command(role));
        }
        catch (RuntimeException e) {
            log.error("Could not build command for agent {}: {}", role, AgentUtils.rootCauseMessage(e));
            return LaunchResult.failed(AgentUtils.rootCauseMessage(e));
        }
        if (command.isEmpty()) {
            return LaunchResult.failed("No command for role " + role);
        }
        final var missing = missingExecutable(command.get(0));
        if (missing.isPresent()) {
            log.error("Cannot start agent {}: {}", role, missing.get());
            return LaunchResult.failed(missing.get());
        }
        final var builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(environment);
        try {
            final var process = builder.start();
            final var supervised = new SupervisedProcess(role, process, clock.instant(), restartCount);
            live.put(role, supervised);
            outputReaders.execute(() -> relayOutput(role, process));
            log.info("Started {} agent (pid {})", role, process.pid());
            return LaunchResult.launched(supervised);
        }
        catch (IOException e) {
            log.error("Failed to start agent {}: {}", role, AgentUtils.rootCauseMessage(e));
            return LaunchResult.failed(AgentUtils.rootCauseMessage(e));
        }
    }

    private static Optional<String> missingExecutable(String executable) {
        try {
            final var path = Path.of(executable);
            if (path.isAbsolute() && !Files.isExecutable(path)) {
                return Optional.of("Executable not found: " + executable);
            }
            return Optional.empty();
        }
        catch (InvalidPathException e) {
            return Optional.of("Invalid executable: " + executable);
        }
    }

    private void handleExit(SupervisedProcess process, Instant now) {
        final var role = process.getRole();
        live.remove(role, process);
        final var exitCode = process.getProcess().exitValue();
        log.warn("Agent {} (pid {}) exited with code {}", role, process.pid(), exitCode);
        publish(event(SupervisorEventType.EXITED, role, process.getRestartCount(), exitCode, null));
        if (shutdownRequested.get()) {
            return;
        }
        final var restarts = restartCount(role);
        if (!restartPolicy.allowsRestart(restarts)) {
            log.error("Agent {} exited after {} restarts. Not restarting it again", role, restarts);
            publish(event(SupervisorEventType.GAVE_UP, role, restarts, exitCode, "Restart limit reached"));
            return;
        }
        pendingRestarts.put(role, now.plus(restartPolicy.backoff(restarts + 1)));
    }

    private void restartDue(Instant now) {
        if (shutdownRequested.get()) {
            return;
        }
        final var due = pendingRestarts.entrySet()
                .stream()
                .filter(entry -> !entry.getValue().isAfter(now))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        for (final var role : due) {
            pendingRestarts.remove(role);
            final var restartCount = restartCounts.merge(role, 1, Integer::sum);
            log.warn("Agent {} crashed. Restarting (restart #{})", role, restartCount);
            final var result = launch(role, restartCount);
            if (result.isLaunched()) {
                publish(event(SupervisorEventType.RESTARTED, role, restartCount, null, null));
            }
            else {
                publish(event(SupervisorEventType.START_FAILED, role, restartCount, null,
                              result.getFailureReason()));
                retryLater(role, restartCount, now);
            }
        }
    }

    private void retryLater(String role, int restartCount, Instant now) {
        if (!restartPolicy.allowsRestart(restartCount)) {
            log.error("Agent {} could not be restarted after {} attempts. Giving up", role, restartCount);
            publish(event(SupervisorEventType.GAVE_UP, role, restartCount, null, "Restart limit reached"));
            return;
        }
        pendingRestarts.put(role, now.plus(restartPolicy.backoff(restartCount + 1)));
    }

    private void relayOutput(String role, Process process) {
        try (final var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.add(new ProcessOutput(role, line));
            }
        }
        catch (IOException e) {
            log.debug("Output of agent {} closed: {}", role, AgentUtils.rootCauseMessage(e));
        }
    }

    private void drainOutput() {
        final var drained = new ArrayList<ProcessOutput>();
        ProcessOutput line;
        while ((line = output.poll()) != null) {
            drained.add(line);
        }
        drained.forEach(item -> notifyListeners(listener -> listener.onOutput(item)));
    }

    private void monitorSafely() {
        try {
            monitor();
        }
        catch (RuntimeException e) {
            log.error("Monitoring pass failed: {}", AgentUtils.rootCauseMessage(e), e);
        }
    }

    private SupervisorEvent event(
            SupervisorEventType type,
            String role,
            int restartCount,
            Integer exitCode,
            String detail) {
        return SupervisorEvent.builder()
                .type(type)
                .role(role)
                .restartCount(restartCount)
                .exitCode(exitCode)
                .detail(detail)
                .timestamp(clock.instant())
                .build();
    }

    private void publish(SupervisorEvent event) {
        notifyListeners(listener -> listener.onEvent(event));
    }

    private void notifyListeners(Consumer<SupervisorListener> notification) {
        for (final var listener : listeners) {
            try {
                notification.accept(listener);
            }
            catch (RuntimeException e) {
                log.warn("Supervisor listener failed: {}", AgentUtils.rootCauseMessage(e));
            }
        }
    }
}
