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

package io.devsquad.core.capabilities;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed table of capabilities for one agent. Built once at startup, read-only afterwards. Iteration order is
 * registration order.
 */
public class CapabilityRegistry {
    private final Map<String, RegisteredCapability> capabilities;

    private CapabilityRegistry(Map<String, RegisteredCapability> capabilities) {
        this.capabilities = Collections.unmodifiableMap(capabilities);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CapabilityRegistry empty() {
        return builder().build();
    }

    /**
     * All capability descriptors, in registration order
     */
    public List<Capability> capabilities() {
        return capabilities.values()
                .stream()
                .map(RegisteredCapability::getCapability)
                .toList();
    }

    public Optional<RegisteredCapability> find(final String name) {
        return Optional.ofNullable(null == name ? null : capabilities.get(name));
    }

    public boolean contains(final String name) {
        return find(name).isPresent();
    }

    public int size() {
        return capabilities.size();
    }

    /**
     * Runs the executor registered for the name.
     *
     * @throws IllegalArgumentException if nothing is registered under the name. Callers are expected to check
     *                                  with {@link #find(String)} first.
     */
    public CapabilityResult execute(final String name, final JsonNode arguments, final String suggestion) {
        final var registered = find(name)
                .orElseThrow(() -> new IllegalArgumentException("No capability registered with name " + name));
        return registered.getExecutor().execute(name, arguments, suggestion);
    }

    public static class Builder {
        private final Map<String, RegisteredCapability> capabilities = new LinkedHashMap<>();

        public Builder register(final Capability capability, final CapabilityExecutor executor) {
            return register(capability, SuggestionPrompter.generic(), executor);
        }

        public Builder register(
                final Capability capability,
                final SuggestionPrompter prompter,
                final CapabilityExecutor executor) {
            Preconditions.checkArgument(!capabilities.containsKey(capability.getName()),
                                        "Capability %s is already registered", capability.getName());
            capabilities.put(capability.getName(), new RegisteredCapability(capability, prompter, executor));
            return this;
        }

        public CapabilityRegistry build() {
            return new CapabilityRegistry(new LinkedHashMap<>(capabilities));
        }
    }
}
