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

package io.devsquad.core.response;

import com.google.common.base.Preconditions;

import java.util.EnumMap;
import java.util.Map;

/**
 * Deterministic provider that answers with a fixed text per {@link ResponseTopic}
 */
public class TopicFallbackResponseProvider implements ResponseProvider {
    private final Map<ResponseTopic, String> answers;

    public TopicFallbackResponseProvider(Map<ResponseTopic, String> answers) {
        Preconditions.checkArgument(answers.containsKey(ResponseTopic.DEFAULT),
                                    "A default answer is required");
        this.answers = new EnumMap<>(answers);
    }

    @Override
    public String getResponse(String prompt, String context) {
        return answers.getOrDefault(ResponseTopic.classify(prompt), answers.get(ResponseTopic.DEFAULT));
    }
}
