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

package io.devsquad.core.utils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import io.github.cdimascio.dotenv.Dotenv;
import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Loads variables from a .env file (if present) or from the process environment
 */
@UtilityClass
public class EnvLoader {
    private static final Dotenv DOTENV = Dotenv.configure()
            .filename(System.getProperty("dotenv.file", ".env"))
            .ignoreIfMissing()
            .ignoreIfMalformed()
            .load();

    /**
     * Reads an environment variable
     * @param variable the name of the variable
     * @return the value of the variable if set and non-empty
     */
    public static Optional<String> readEnv(final String variable) {
        return Optional.ofNullable(readEnv(variable, null));
    }

    /**
     * Reads an environment variable, falling back to the default
     * @param variable the name of the variable
     * @param defaultValue value to return if the variable is not set
     * @return the value of the variable or the default
     */
    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(DOTENV, variable, defaultValue);
    }

    @VisibleForTesting
    static String readEnv(final Dotenv dotenv, final String variable, final String defaultValue) {
        final var fromFile = dotenv.get(variable);
        if (!Strings.isNullOrEmpty(fromFile)) {
            return fromFile;
        }
        final var fromSystem = System.getenv(variable);
        return Strings.isNullOrEmpty(fromSystem) ? defaultValue : fromSystem;
    }
}
