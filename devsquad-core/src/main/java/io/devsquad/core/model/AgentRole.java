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

package io.devsquad.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.experimental.UtilityClass;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Roles an agent process can be started as
 */
@Getter
public enum AgentRole {
    FRONTEND(Values.FRONTEND),
    BACKEND(Values.BACKEND),
    SECURITY(Values.SECURITY),
    DEVOPS(Values.DEVOPS),
    DATASCIENCE(Values.DATASCIENCE),
    ;

    @UtilityClass
    public static final class Values {
        public static final String FRONTEND = "frontend";
        public static final String BACKEND = "backend";
        public static final String SECURITY = "security";
        public static final String DEVOPS = "devops";
        public static final String DATASCIENCE = "datascience";
    }

    @JsonValue
    private final String value;

    AgentRole(String value) {
        this.value = value;
    }

    /**
     * Resolves a role from its command line name. Matching is case-insensitive.
     */
    public static Optional<AgentRole> fromValue(final String value) {
        if (null == value) {
            return Optional.empty();
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(role -> role.value.equals(normalized))
                .findFirst();
    }

    /**
     * Identity used on the coordination server for the first agent of this role
     */
    public String defaultAgentId() {
        return "ai_" + value + "_001";
    }
}
