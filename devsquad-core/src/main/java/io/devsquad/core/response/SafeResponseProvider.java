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

import io.devsquad.core.utils.AgentUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Wraps a provider so that callers never see a failure. Any exception from the delegate is logged and the
 * fallback answer is returned instead. A null answer is treated as empty.
 */
@Slf4j
public class SafeResponseProvider implements ResponseProvider {
    private final ResponseProvider delegate;
    private final ResponseProvider fallback;

    public SafeResponseProvider(@NonNull ResponseProvider delegate, @NonNull ResponseProvider fallback) {
        this.delegate = delegate;
        this.fallback = fallback;
    }

    @Override
    public String getResponse(String prompt, String context) {
        try {
            return Objects.requireNonNullElse(delegate.getResponse(prompt, context), "");
        }
        catch (Exception e) {
            log.warn("Response provider failed, using fallback answer. Error: {}", AgentUtils.rootCauseMessage(e));
            return fallbackResponse(prompt, context);
        }
    }

    private String fallbackResponse(String prompt, String context) {
        try {
            return Objects.requireNonNullElse(fallback.getResponse(prompt, context), "");
        }
        catch (Exception e) {
            log.error("Fallback response provider failed as well: {}", AgentUtils.rootCauseMessage(e));
            return "";
        }
    }
}
