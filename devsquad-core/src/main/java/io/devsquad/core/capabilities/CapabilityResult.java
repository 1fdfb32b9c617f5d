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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.devsquad.core.errors.ErrorType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Result of a tool call. Serialized as a flat object: {@code success}, an optional {@code result} line, an
 * optional {@code error} and any role specific fields (code, schema, findings etc.) at the same level.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "result", "error"})
public class CapabilityResult {
    boolean success;
    String result;
    String error;
    @Singular
    Map<String, Object> details;

    @JsonAnyGetter
    public Map<String, Object> getDetails() {
        return details;
    }

    public static CapabilityResult success(final String result) {
        return CapabilityResult.builder()
                .success(true)
                .result(result)
                .build();
    }

    public static CapabilityResult success(final String result, final String detailName, final Object detail) {
        return CapabilityResult.builder()
                .success(true)
                .result(result)
                .detail(detailName, detail)
                .build();
    }

    public static CapabilityResult error(final ErrorType errorType, Object... args) {
        return CapabilityResult.builder()
                .success(false)
                .error(errorType.format(args))
                .build();
    }
}
