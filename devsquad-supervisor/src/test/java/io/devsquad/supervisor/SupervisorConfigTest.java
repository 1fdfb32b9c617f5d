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

import io.devsquad.supervisor.launchers.CommandProcessLauncher;
import io.devsquad.supervisor.launchers.JavaAgentProcessLauncher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SupervisorConfigTest {

    @Test
    void testDefaults() {
        final var config = SupervisorConfig.builder().build();
        assertEquals(List.of("frontend", "backend", "security"), config.getRoles());
        assertEquals(Duration.ofSeconds(1), config.getMonitorInterval());
        assertEquals(Duration.ofSeconds(1), config.getStopGracePeriod());
        assertEquals(RestartPolicy.unconditional(), config.getRestartPolicy());
        assertTrue(config.getEnvironment().isEmpty());
        assertTrue(config.agentCommand().isEmpty());
    }

    @Test
    void testParseRoles() {
        assertEquals(List.of("backend", "devops"), SupervisorConfig.parseRoles(" backend, ,devops "));
        assertTrue(SupervisorConfig.parseRoles(" , ").isEmpty());
    }

    @Test
    void testCommandLauncher() {
        final var launcher = CommandProcessLauncher.parse("  /opt/agents/run.sh   --role {role}  ");
        assertEquals(List.of("/opt/agents/run.sh", "--role", "security"), launcher.command("security"));
        assertThrows(IllegalArgumentException.class, () -> CommandProcessLauncher.parse("   "));
    }

    @Test
    void testJavaLauncher() {
        final var launcher = JavaAgentProcessLauncher.builder()
                .javaBinary("/usr/bin/java")
                .classPath("a.jar:b.jar")
                .jvmOption("-Xmx128m")
                .build();
        assertEquals(List.of("/usr/bin/java", "-Xmx128m", "-cp", "a.jar:b.jar", "io.devsquad.agents.AgentMain",
                             "frontend"),
                     launcher.command("frontend"));
        final var defaults = new JavaAgentProcessLauncher().command("backend");
        assertEquals("backend", defaults.get(defaults.size() - 1));
        assertEquals("io.devsquad.agents.AgentMain", defaults.get(defaults.size() - 2));
    }
}
