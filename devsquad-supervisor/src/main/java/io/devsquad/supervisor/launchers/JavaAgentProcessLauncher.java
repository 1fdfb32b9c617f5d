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

package io.devsquad.supervisor.launchers;

import io.devsquad.agents.AgentMain;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the agent entry point in a fresh JVM that shares the class path of the current one
 */
public class JavaAgentProcessLauncher implements AgentProcessLauncher {
    private final String javaBinary;
    private final String classPath;
    private final String mainClass;
    private final List<String> jvmOptions;

    public JavaAgentProcessLauncher() {
        this(null, null, null, List.of());
    }

    @Builder
    public JavaAgentProcessLauncher(
            String javaBinary,
            String classPath,
            String mainClass,
            @Singular List<String> jvmOptions) {
        this.javaBinary = Objects.requireNonNullElseGet(javaBinary, JavaAgentProcessLauncher::currentJavaBinary);
        this.classPath = Objects.requireNonNullElseGet(classPath, () -> System.getProperty("java.class.path"));
        this.mainClass = Objects.requireNonNullElse(mainClass, AgentMain.class.getName());
        this.jvmOptions = Objects.requireNonNullElseGet(jvmOptions, List::of);
    }

    @Override
    public List<String> command(@NonNull String role) {
        final var command = new ArrayList<String>();
        command.add(javaBinary);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classPath);
        command.add(mainClass);
        command.add(role);
        return List.copyOf(command);
    }

    private static String currentJavaBinary() {
        return ProcessHandle.current()
                .info()
                .command()
                .orElseGet(() -> Path.of(System.getProperty("java.home"), "bin", "java").toString());
    }
}
