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

package io.devsquad.agents;

import io.devsquad.agents.roles.BackendProfile;
import io.devsquad.agents.roles.DataScienceProfile;
import io.devsquad.agents.roles.DevOpsProfile;
import io.devsquad.agents.roles.FrontendProfile;
import io.devsquad.agents.roles.SecurityProfile;
import io.devsquad.core.model.AgentRole;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Lookup of the built-in profile for a role
 */
@UtilityClass
public class AgentProfiles {

    public static AgentProfile forRole(final AgentRole role) {
        return switch (role) {
            case FRONTEND -> new FrontendProfile();
            case BACKEND -> new BackendProfile();
            case SECURITY -> new SecurityProfile();
            case DEVOPS -> new DevOpsProfile();
            case DATASCIENCE -> new DataScienceProfile();
        };
    }

    /**
     * Profile for a role name as given on the command line
     *
     * @throws IllegalArgumentException if the name does not match any role
     */
    public static AgentProfile forRole(final String roleName) {
        return AgentRole.fromValue(roleName)
                .map(AgentProfiles::forRole)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown agent role: " + roleName + ". Known roles: " + knownRoles()));
    }

    public static String knownRoles() {
        return Arrays.stream(AgentRole.values())
                .map(AgentRole::getValue)
                .collect(Collectors.joining(", "));
    }
}
