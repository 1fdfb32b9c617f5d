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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import lombok.NonNull;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs an arbitrary command per role. Every occurrence of {@value #ROLE_PLACEHOLDER} in the template is replaced by
 * the role name.
 */
public class CommandProcessLauncher implements AgentProcessLauncher {
    public static final String ROLE_PLACEHOLDER = "{role}";

    private final List<String> template;

    public CommandProcessLauncher(@NonNull List<String> template) {
        Preconditions.checkArgument(!template.isEmpty(), "Command template cannot be empty");
        this.template = List.copyOf(template);
    }

    /**
     * Template from a whitespace separated command line. No quoting is supported.
     */
    public static CommandProcessLauncher parse(@NonNull String commandLine) {
        return new CommandProcessLauncher(Splitter.on(CharMatcher.whitespace())
                                                  .omitEmptyStrings()
                                                  .splitToList(commandLine));
    }

    @Override
    public List<String> command(@NonNull String role) {
        return template.stream()
                .map(part -> part.replace(ROLE_PLACEHOLDER, role))
                .collect(Collectors.toUnmodifiableList());
    }
}
