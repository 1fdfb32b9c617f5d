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

/**
 * Produces a natural language answer for a prompt. Implementations may block on a network call.
 */
@FunctionalInterface
public interface ResponseProvider {
    /**
     * Get an answer for the prompt
     *
     * @param prompt  What is being asked
     * @param context Short description of where the prompt comes from (thread, sender, tool call etc.)
     * @return A best effort answer. An empty string means there is nothing to say.
     */
    String getResponse(final String prompt, final String context);
}
