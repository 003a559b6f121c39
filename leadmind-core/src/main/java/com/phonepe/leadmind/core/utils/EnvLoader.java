/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.leadmind.core.utils;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import io.github.cdimascio.dotenv.Dotenv;
import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.util.Optional;

/**
 * Loads variables from the process environment, falling back to a {@code .env} file in the working directory
 */
@UtilityClass
public class EnvLoader {
    private static final Dotenv DOTENV = Dotenv.configure()
            .ignoreIfMissing()
            .ignoreIfMalformed()
            .load();

    public static Optional<String> readEnv(final String variable) {
        return readEnv(variable, DOTENV);
    }

    public static String readEnv(final String variable, final String defaultValue) {
        return readEnv(variable).orElse(defaultValue);
    }

    public static int readInt(final String variable, final int defaultValue) {
        return readEnv(variable).map(Integer::parseInt).orElse(defaultValue);
    }

    public static double readDouble(final String variable, final double defaultValue) {
        return readEnv(variable).map(Double::parseDouble).orElse(defaultValue);
    }

    /**
     * Reads a duration expressed in seconds
     */
    public static Duration readSeconds(final String variable, final Duration defaultValue) {
        return readEnv(variable).map(Long::parseLong).map(Duration::ofSeconds).orElse(defaultValue);
    }

    @VisibleForTesting
    static Optional<String> readEnv(final String variable, final Dotenv dotenv) {
        final var value = System.getenv(variable);
        if (!Strings.isNullOrEmpty(value)) {
            return Optional.of(value);
        }
        return Optional.ofNullable(Strings.emptyToNull(dotenv.get(variable, null)));
    }
}
