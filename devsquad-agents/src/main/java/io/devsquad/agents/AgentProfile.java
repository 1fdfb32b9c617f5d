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

import io.devsquad.core.capabilities.CapabilityRegistry;
import io.devsquad.core.model.AgentIdentity;
import io.devsquad.core.response.ResponseProvider;
import io.devsquad.core.response.ResponseTopic;
import io.devsquad.core.response.TopicFallbackResponseProvider;

import java.util.Map;

/**
 * Everything that makes one agent role different from another: who it is, what it can do and what it says when
 * no model is available.
 */
public interface AgentProfile {
    AgentIdentity identity();

    /**
     * Persona used when prompting the model, e.g. "an expert frontend developer specializing in React"
     */
    String roleDescription();

    Map<ResponseTopic, String> fallbackAnswers();

    CapabilityRegistry capabilities();

    default ResponseProvider fallbackProvider() {
        return new TopicFallbackResponseProvider(fallbackAnswers());
    }
}
